package org.springaicommunity.github.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Separates source code from documentation, configuration and binary files by file
 * suffix.
 *
 * <p>
 * The suffix list is read from {@code language/non-code-suffixes.txt} on the classpath,
 * one suffix per line including the leading dot. Files without an extension and
 * {@code .gitignore} files also count as non-code.
 */
public class CodeFileFilter {

	private static final Logger logger = LoggerFactory.getLogger(CodeFileFilter.class);

	public static final String SUFFIX_RESOURCE = "language/non-code-suffixes.txt";

	/**
	 * Default number of code files above which a change set is considered too big.
	 */
	public static final int DEFAULT_MAX_CODE_FILES = 500;

	private final Set<String> nonCodeSuffixes;

	private final int maxCodeFiles;

	public CodeFileFilter() {
		this(loadSuffixes(SUFFIX_RESOURCE), DEFAULT_MAX_CODE_FILES);
	}

	public CodeFileFilter(Set<String> nonCodeSuffixes, int maxCodeFiles) {
		this.nonCodeSuffixes = Set.copyOf(nonCodeSuffixes);
		this.maxCodeFiles = maxCodeFiles;
	}

	public boolean isCode(String path) {
		return !isNonCode(path);
	}

	public boolean isNonCode(String path) {
		String fileName = path.substring(path.lastIndexOf('/') + 1);
		if (fileName.contains(".gitignore")) {
			return true;
		}
		int dot = fileName.lastIndexOf('.');
		if (dot < 0) {
			return true;
		}
		String suffix = fileName.substring(dot).trim();
		if (nonCodeSuffixes.contains(suffix)) {
			return true;
		}
		// compound suffixes such as .min.js
		int previousDot = fileName.lastIndexOf('.', dot - 1);
		return previousDot >= 0 && nonCodeSuffixes.contains(fileName.substring(previousDot).trim());
	}

	/**
	 * Keep the statistics of code files only. The change set is dropped when any file
	 * follows once more than the configured maximum of code files has been kept, so a
	 * list ending with its {@code maxCodeFiles + 1}th code file is still returned.
	 * @param files per-file statistics
	 * @return the code files, or an empty list for an oversized change set
	 */
	public List<FileDiffStats> codeFilesOnly(Collection<FileDiffStats> files) {
		List<FileDiffStats> code = new ArrayList<>();
		for (FileDiffStats file : files) {
			if (code.size() > maxCodeFiles) {
				logger.warn("More than {} code files changed, ignoring the change set", maxCodeFiles);
				return new ArrayList<>();
			}
			if (isCode(file.fileName())) {
				code.add(file);
			}
		}
		return code;
	}

	public int getMaxCodeFiles() {
		return maxCodeFiles;
	}

	static Set<String> loadSuffixes(String resource) {
		InputStream in = CodeFileFilter.class.getClassLoader().getResourceAsStream(resource);
		if (in == null) {
			throw new ConfigurationException("Suffix list not found on classpath: " + resource);
		}
		Set<String> suffixes = new LinkedHashSet<>();
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				String suffix = line.strip();
				if (!suffix.isEmpty() && !suffix.startsWith("#")) {
					suffixes.add(suffix);
				}
			}
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to read suffix list: " + resource, e);
		}
		logger.debug("Loaded {} non-code suffixes from {}", suffixes.size(), resource);
		return suffixes;
	}

}
