package org.springaicommunity.github.scraper;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A {@code (start, length)} line range of one side of a hunk. Serialised as a
 * two-element JSON array, e.g. {@code [12, 3]}.
 */
public record LineRange(int start, int length) {

	public LineRange {
		if (start < 0 || length < 0) {
			throw new IllegalArgumentException("Line range must not be negative: " + start + "," + length);
		}
	}

	@JsonCreator(mode = JsonCreator.Mode.DELEGATING)
	public static LineRange fromArray(int[] pair) {
		if (pair.length != 2) {
			throw new IllegalArgumentException("Line range needs two elements, got " + pair.length);
		}
		return new LineRange(pair[0], pair[1]);
	}

	@JsonValue
	public int[] toArray() {
		return new int[] { start, length };
	}

}
