package org.springaicommunity.github.scraper;

import java.util.Optional;

/**
 * Key/value store used as a local cache of API responses. Keys are slash-separated
 * relative paths such as {@code pr_data/owner/repo/12/api.json}.
 */
public interface BlobStore {

	/**
	 * Read a cached entry.
	 * @param key the entry key
	 * @return the bytes, or empty if the entry does not exist or cannot be read
	 */
	Optional<byte[]> read(String key);

	/**
	 * Write an entry, replacing any existing value.
	 * @param key the entry key
	 * @param data the bytes to store
	 */
	void write(String key, byte[] data);

}
