package org.springaicommunity.github.scraper;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort parser for unified diff text as returned by GitHub for pull request files,
 * commits and {@code .diff} media types.
 *
 * <p>
 * The text is read line by line. A line starting with {@code @@} opens a hunk; the lines
 * up to the next header form its body. A hunk is kept only if
 * <ul>
 * <li>its header parses: two ranges {@code -start[,length]} and {@code +start[,length]}
 * in either order, a missing length meaning 1</li>
 * <li>its body is not longer than the configured ceiling</li>
 * <li>its body agrees with the header: context plus added lines equals the added length
 * and context plus removed lines equals the deleted length</li>
 * </ul>
 * Anything else is logged and skipped. Parsing never fails for the file as a whole.
 */
public class DiffParser {

	private static final Logger logger = LoggerFactory.getLogger(DiffParser.class);

	/**
	 * Default ceiling for the text of one hunk body (100 KiB).
	 */
	public static final int DEFAULT_MAX_HUNK_LENGTH = 100 * 1024;

	private static final String FILE_BOUNDARY = "diff --git ";

	private static final Pattern BOUNDARY_PATTERN = Pattern.compile("^diff --git a/(.*?) b/(.*)$");

	private static final Pattern RANGE_PATTERN = Pattern.compile("([+-])(\\d{1,9})(?:,(\\d{1,9}))?");

	private final int maxHunkLength;

	public DiffParser() {
		this(DEFAULT_MAX_HUNK_LENGTH);
	}

	public DiffParser(int maxHunkLength) {
		if (maxHunkLength < 1) {
			throw new IllegalArgumentException("maxHunkLength must be positive");
		}
		this.maxHunkLength = maxHunkLength;
	}

	public int getMaxHunkLength() {
		return maxHunkLength;
	}

	/**
	 * Parse the diff of one file into statistics.
	 * @param fileName display name of the file
	 * @param diffText the patch text, may be null
	 * @return statistics over every well-formed hunk
	 */
	public FileDiffStats parse(String fileName, @Nullable String diffText) {
		return FileDiffStats.of(fileName, parseHunks(diffText));
	}

	/**
	 * Parse the well-formed hunks of one file's diff, in order.
	 * @param diffText the patch text, may be null
	 * @return the hunks, empty if there are none
	 */
	public List<DiffHunk> parseHunks(@Nullable String diffText) {
		List<DiffHunk> hunks = new ArrayList<>();
		if (diffText == null || diffText.isEmpty()) {
			return hunks;
		}

		HunkBuilder current = null;
		for (String line : diffText.split("\n", -1)) {
			if (line.startsWith("@@")) {
				complete(current, hunks);
				current = openHunk(line);
			}
			else if (current != null) {
				current.append(line);
			}
		}
		complete(current, hunks);
		return hunks;
	}

	/**
	 * Parse a multi-file diff ({@code git diff} output) into per-file statistics. Files
	 * whose {@code diff --git} line cannot be read are skipped.
	 * @param rawDiff the complete diff text, may be null
	 * @return statistics per file, in order
	 */
	public List<FileDiffStats> parseFiles(@Nullable String rawDiff) {
		List<FileDiffStats> files = new ArrayList<>();
		if (rawDiff == null || rawDiff.isEmpty()) {
			return files;
		}

		String fileName = null;
		boolean inFile = false;
		StringBuilder section = new StringBuilder();
		for (String line : rawDiff.split("\n", -1)) {
			if (line.startsWith(FILE_BOUNDARY)) {
				if (inFile && fileName != null) {
					files.add(parse(fileName, section.toString()));
				}
				section.setLength(0);
				inFile = true;
				fileName = fileName(line);
				if (fileName == null) {
					logger.warn("Skipping file with unreadable boundary line: {}", line);
				}
			}
			else if (inFile) {
				section.append(line).append('\n');
			}
		}
		if (inFile && fileName != null) {
			files.add(parse(fileName, section.toString()));
		}
		return files;
	}

	@Nullable
	private static String fileName(String boundaryLine) {
		Matcher matcher = BOUNDARY_PATTERN.matcher(boundaryLine);
		if (!matcher.matches() || matcher.group(2).isEmpty()) {
			return null;
		}
		return matcher.group(2);
	}

	@Nullable
	private HunkBuilder openHunk(String headerLine) {
		try {
			return new HunkBuilder(parseHeader(headerLine), maxHunkLength);
		}
		catch (DiffParseException e) {
			logger.warn("Skipping hunk: {}", e.getMessage());
			return null;
		}
	}

	private void complete(@Nullable HunkBuilder builder, List<DiffHunk> hunks) {
		if (builder == null) {
			return;
		}
		if (builder.length > maxHunkLength) {
			logger.warn("Skipping hunk {}: body of {} characters exceeds limit of {}", builder.header.text(),
					builder.length, maxHunkLength);
			return;
		}
		try {
			hunks.add(builder.build());
		}
		catch (DiffParseException e) {
			logger.warn("Skipping hunk {}: {}", builder.header.text(), e.getMessage());
		}
	}

	/**
	 * Parse {@code @@ <range> <range> @@[ heading]}.
	 */
	static HunkHeader parseHeader(String line) {
		if (!line.startsWith("@@ ")) {
			throw new DiffParseException("Malformed hunk header: " + line);
		}
		int close = line.indexOf(" @@", 2);
		if (close < 0) {
			throw new DiffParseException("Unterminated hunk header: " + line);
		}
		String[] ranges = line.substring(3, close).trim().split("\\s+");
		if (ranges.length != 2) {
			throw new DiffParseException("Expected two ranges in hunk header: " + line);
		}
		Matcher first = RANGE_PATTERN.matcher(ranges[0]);
		Matcher second = RANGE_PATTERN.matcher(ranges[1]);
		if (!first.matches() || !second.matches()) {
			throw new DiffParseException("Malformed range in hunk header: " + line);
		}
		if (first.group(1).equals(second.group(1))) {
			throw new DiffParseException("Both ranges of hunk header have sign " + first.group(1) + ": " + line);
		}

		Matcher added = "+".equals(first.group(1)) ? first : second;
		Matcher deleted = added == first ? second : first;
		String header = line.substring(0, close + 3);
		return new HunkHeader(header, start(added), length(added), start(deleted), length(deleted));
	}

	private static int start(Matcher range) {
		return Integer.parseInt(range.group(2));
	}

	private static int length(Matcher range) {
		return range.group(3) != null ? Integer.parseInt(range.group(3)) : 1;
	}

	record HunkHeader(String text, int addStart, int addLen, int delStart, int delLen) {
	}

	/**
	 * Collects the body lines of one hunk.
	 */
	private static final class HunkBuilder {

		private final HunkHeader header;

		private final List<String> lines = new ArrayList<>();

		private final int maxLength;

		private int length;

		HunkBuilder(HunkHeader header, int maxLength) {
			this.header = header;
			this.maxLength = maxLength;
		}

		void append(String line) {
			length += line.length() + 1;
			if (length <= maxLength) {
				lines.add(line);
			}
		}

		DiffHunk build() {
			int end = lines.size();
			while (end > 0 && lines.get(end - 1).isEmpty()) {
				end--;
			}
			int trailingBlank = lines.size() - end;

			List<String> added = new ArrayList<>();
			List<String> removed = new ArrayList<>();
			int context = 0;
			for (String line : lines.subList(0, end)) {
				if (line.isEmpty()) {
					context++;
					continue;
				}
				switch (line.charAt(0)) {
					case '+':
						added.add(line.substring(1));
						break;
					case '-':
						removed.add(line.substring(1));
						break;
					case '\\':
						// "\ No newline at end of file"
						break;
					default:
						context++;
				}
			}

			// Blank context lines at the end of a hunk may have lost their leading space.
			int missingAdded = header.addLen() - added.size() - context;
			int missingDeleted = header.delLen() - removed.size() - context;
			if (missingAdded != missingDeleted || missingAdded < 0 || missingAdded > trailingBlank) {
				throw new DiffParseException("body has " + added.size() + " added, " + removed.size() + " removed and "
						+ context + " context lines");
			}
			return new DiffHunk(header.addStart(), header.addLen(), header.delStart(), header.delLen(), added,
					removed);
		}

	}

}
