package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Locates expected lines inside the text, tolerating whitespace drift.
 *
 * The scan moves forward from the start index and stops at the first position where any
 * {@link MatchTier} accepts the whole window; the cheapest tier accepting that position
 * determines the fuzz. A cheaper match further down is never preferred over an earlier,
 * looser one, which keeps the placement of ambiguous hunks predictable.
 */
public final class ContextMatcher {

	/**
	 * Finds the expected lines, falling back to the tail of the text for end-of-file sections.
	 *
	 * @param lines    the text being patched
	 * @param expected the lines to find
	 * @param start    index to start scanning from
	 * @param eof      true if the lines are expected at the end of the text
	 * @return the match, or {@link ContextMatch#notFound()}
	 */
	@Nonnull
	public ContextMatch find(
		@Nonnull List<String> lines,
		@Nonnull List<String> expected,
		int start,
		boolean eof
	) {
		Objects.requireNonNull(lines, "lines must not be null");
		Objects.requireNonNull(expected, "expected must not be null");

		if (eof && expected.isEmpty()) {
			return new ContextMatch(lines.size(), 0);
		}
		final ContextMatch forward = findForward(lines, expected, start);
		if (forward.isFound() || !eof) {
			return forward;
		}
		return findAtTail(lines, expected);
	}

	/**
	 * Scans forward from the start index only.
	 *
	 * @param lines    the text being patched
	 * @param expected the lines to find
	 * @param start    index to start scanning from
	 * @return the first acceptable match, or {@link ContextMatch#notFound()}
	 */
	@Nonnull
	public ContextMatch findForward(
		@Nonnull List<String> lines,
		@Nonnull List<String> expected,
		int start
	) {
		Objects.requireNonNull(lines, "lines must not be null");
		Objects.requireNonNull(expected, "expected must not be null");

		if (expected.isEmpty()) {
			return new ContextMatch(Math.min(Math.max(start, 0), lines.size()), 0);
		}
		final int lastPosition = lines.size() - expected.size();
		for (int position = Math.max(start, 0); position <= lastPosition; position++) {
			final MatchTier tier = matchAt(lines, expected, position);
			if (tier != null) {
				return new ContextMatch(position, tier.fuzz());
			}
		}
		return ContextMatch.notFound();
	}

	@Nonnull
	private static ContextMatch findAtTail(@Nonnull List<String> lines, @Nonnull List<String> expected) {
		final int position = lines.size() - expected.size();
		if (position < 0) {
			return ContextMatch.notFound();
		}
		final MatchTier tier = matchAt(lines, expected, position);
		return tier == null ? ContextMatch.notFound() : new ContextMatch(position, tier.fuzz());
	}

	/**
	 * Returns the cheapest tier under which the window at the position matches.
	 */
	@Nullable
	private static MatchTier matchAt(@Nonnull List<String> lines, @Nonnull List<String> expected, int position) {
		for (final MatchTier tier : MatchTier.values()) {
			if (windowMatches(lines, expected, position, tier)) {
				return tier;
			}
		}
		return null;
	}

	private static boolean windowMatches(
		@Nonnull List<String> lines,
		@Nonnull List<String> expected,
		int position,
		@Nonnull MatchTier tier
	) {
		for (int i = 0; i < expected.size(); i++) {
			if (!tier.matches(lines.get(position + i), expected.get(i))) {
				return false;
			}
		}
		return true;
	}
}
