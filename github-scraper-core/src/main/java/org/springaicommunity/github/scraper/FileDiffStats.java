package org.springaicommunity.github.scraper;

import java.util.ArrayList;
import java.util.List;

/**
 * Line statistics of one changed file, accumulated over its hunks in order.
 *
 * @param fileName display name of the file
 * @param addedLoc number of added lines
 * @param deletedLoc number of removed lines
 * @param addedLocations added-side range of every hunk
 * @param deletedLocations deleted-side range of every hunk
 * @param addedCode added lines, each followed by a newline
 * @param deletedCode removed lines, each followed by a newline
 */
public record FileDiffStats(String fileName, int addedLoc, int deletedLoc, List<LineRange> addedLocations,
		List<LineRange> deletedLocations, String addedCode, String deletedCode) {

	public FileDiffStats {
		addedLocations = List.copyOf(addedLocations);
		deletedLocations = List.copyOf(deletedLocations);
	}

	public static FileDiffStats of(String fileName, List<DiffHunk> hunks) {
		int added = 0;
		int deleted = 0;
		List<LineRange> addedLocations = new ArrayList<>();
		List<LineRange> deletedLocations = new ArrayList<>();
		StringBuilder addedCode = new StringBuilder();
		StringBuilder deletedCode = new StringBuilder();
		for (DiffHunk hunk : hunks) {
			added += hunk.addedLines().size();
			deleted += hunk.removedLines().size();
			addedLocations.add(hunk.addedRange());
			deletedLocations.add(hunk.deletedRange());
			hunk.addedLines().forEach(line -> addedCode.append(line).append('\n'));
			hunk.removedLines().forEach(line -> deletedCode.append(line).append('\n'));
		}
		return new FileDiffStats(fileName, added, deleted, addedLocations, deletedLocations, addedCode.toString(),
				deletedCode.toString());
	}

	public static FileDiffStats empty(String fileName) {
		return of(fileName, List.of());
	}

	public boolean hasChanges() {
		return addedLoc > 0 || deletedLoc > 0;
	}

}
