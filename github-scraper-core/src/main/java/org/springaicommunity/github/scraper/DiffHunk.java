package org.springaicommunity.github.scraper;

import java.util.List;

/**
 * One well-formed hunk of a unified diff. Marker characters are stripped from
 * {@code addedLines} and {@code removedLines}; context lines are not kept.
 */
public record DiffHunk(int addStart, int addLen, int delStart, int delLen, List<String> addedLines,
		List<String> removedLines) {

	public DiffHunk {
		addedLines = List.copyOf(addedLines);
		removedLines = List.copyOf(removedLines);
	}

	public LineRange addedRange() {
		return new LineRange(addStart, addLen);
	}

	public LineRange deletedRange() {
		return new LineRange(delStart, delLen);
	}

}
