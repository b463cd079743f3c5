package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;

/**
 * Result of searching the text for a section's expected lines.
 *
 * @param position index of the first matched line, or {@link #NOT_FOUND}
 * @param fuzz     tolerance the match needed; 0 is exact, {@link #NOT_FOUND_FUZZ} means no match
 */
public record ContextMatch(
	int position,
	int fuzz
) {

	public static final int NOT_FOUND = -1;
	public static final int NOT_FOUND_FUZZ = 10_000;

	public ContextMatch {
		if (position < NOT_FOUND) {
			throw new IllegalArgumentException("position must be -1 or non-negative: " + position);
		}
		if (fuzz < 0) {
			throw new IllegalArgumentException("fuzz must be non-negative: " + fuzz);
		}
	}

	/**
	 * Returns the result signalling that no acceptable match exists.
	 *
	 * @return not-found match
	 */
	@Nonnull
	public static ContextMatch notFound() {
		return new ContextMatch(NOT_FOUND, NOT_FOUND_FUZZ);
	}

	public boolean isFound() {
		return this.position != NOT_FOUND;
	}
}
