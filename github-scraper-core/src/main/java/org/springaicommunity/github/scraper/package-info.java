/**
 * GitHub Scraper core package.
 *
 * <p>
 * Contains the credential-pool request dispatcher and the unified-diff parser, plus the
 * cache-backed scraper service built on top of them.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.scraper;

import org.jspecify.annotations.NullMarked;
