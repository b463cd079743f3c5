package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.function.UnaryOperator;

/**
 * Normalizations tried when comparing expected context with the actual text, ordered by
 * increasing tolerance. Each tier carries the fuzz a match on it costs.
 */
public enum MatchTier {

	/**
	 * Lines are equal as they are.
	 */
	EXACT(0, UnaryOperator.identity()),

	/**
	 * Lines are equal once trailing whitespace is stripped.
	 */
	TRAILING_WHITESPACE(1, String::stripTrailing),

	/**
	 * Lines are equal once leading and trailing whitespace is stripped.
	 */
	SURROUNDING_WHITESPACE(100, String::strip),

	/**
	 * Lines are equal once stripped and every inner whitespace run collapsed to one space.
	 * Catches text that was re-indented or re-aligned after the patch was written.
	 */
	INTERNAL_WHITESPACE(1000, MatchTier::collapseWhitespace);

	private final int fuzz;
	@Nonnull
	private final UnaryOperator<String> normalizer;

	MatchTier(int fuzz, @Nonnull UnaryOperator<String> normalizer) {
		this.fuzz = fuzz;
		this.normalizer = normalizer;
	}

	public int fuzz() {
		return this.fuzz;
	}

	/**
	 * Compares an actual line of the text with an expected line under this tier.
	 *
	 * @param actual   line from the text being patched
	 * @param expected line from the patch
	 * @return true if both lines normalize to the same value
	 */
	public boolean matches(@Nonnull String actual, @Nonnull String expected) {
		return this.normalizer.apply(actual).equals(this.normalizer.apply(expected));
	}

	@Nonnull
	private static String collapseWhitespace(@Nonnull String value) {
		return value.strip().replaceAll("\\s+", " ");
	}
}
