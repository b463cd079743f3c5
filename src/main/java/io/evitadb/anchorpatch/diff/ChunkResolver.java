package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turns parsed sections into positioned chunks.
 *
 * Sections are located in patch order. The search for each section starts where the previous
 * chunk's deletions end, so hunks always apply top to bottom and never consume the same
 * line twice.
 */
public final class ChunkResolver {

	@Nonnull
	private final ContextMatcher matcher;

	public ChunkResolver() {
		this(new ContextMatcher());
	}

	public ChunkResolver(@Nonnull ContextMatcher matcher) {
		this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
	}

	/**
	 * Resolves every section against the original lines.
	 *
	 * @param original the lines being patched
	 * @param sections the parsed sections in patch order
	 * @return the chunks and the accumulated fuzz
	 * @throws PatchResolutionException if a section cannot be located or lands before the
	 *                                  previous one
	 */
	@Nonnull
	public Resolution resolve(
		@Nonnull List<String> original,
		@Nonnull List<Section> sections
	) throws PatchResolutionException {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(sections, "sections must not be null");

		final List<Chunk> chunks = new ArrayList<>(sections.size());
		int cursor = 0;
		int fuzz = 0;

		for (int sectionIndex = 0; sectionIndex < sections.size(); sectionIndex++) {
			final Section section = sections.get(sectionIndex);
			final Placement placement = place(original, section, cursor);

			if (placement == null) {
				throw new PatchResolutionException(
					section.eof() ? "Could not find end-of-file context" : "Could not find context",
					sectionIndex,
					String.join("\n", section.expectedLines())
				);
			}
			if (placement.originIndex() < cursor) {
				throw new PatchResolutionException(
					"Section resolves to line " + (placement.originIndex() + 1) +
						", which overlaps the previous section ending at line " + cursor,
					sectionIndex,
					String.join("\n", section.expectedLines())
				);
			}

			final Chunk chunk = new Chunk(placement.originIndex(), section.deleteLines(), section.insertLines());
			chunks.add(chunk);
			cursor = chunk.endIndex();
			fuzz += placement.fuzz();
		}

		return new Resolution(chunks, fuzz);
	}

	/**
	 * Locates one section. A header hint is tried first as an extra leading context line,
	 * then as a scope line the section must follow, and finally ignored.
	 *
	 * The hint takes part in the forward scan like any other context line, also for an
	 * end-of-file section. A pure insertion such as {@code @@ foo / +x / *** End of File}
	 * therefore lands right after the first {@code foo}, while the same section without a hint
	 * appends at the end of the text.
	 */
	@Nullable
	private Placement place(@Nonnull List<String> original, @Nonnull Section section, int cursor) {
		final List<String> expected = section.expectedLines();
		final int leading = section.leadingContext().size();
		final String hint = section.hint();

		if (hint != null) {
			final List<String> hinted = new ArrayList<>(expected.size() + 1);
			hinted.add(hint);
			hinted.addAll(expected);
			final ContextMatch withHint = this.matcher.find(original, hinted, cursor, section.eof());
			if (withHint.isFound()) {
				return new Placement(withHint.position() + 1 + leading, withHint.fuzz());
			}

			final ContextMatch scope = this.matcher.findForward(original, Collections.singletonList(hint), cursor);
			if (scope.isFound()) {
				final ContextMatch inScope = this.matcher.find(original, expected, scope.position() + 1, section.eof());
				if (inScope.isFound()) {
					return new Placement(inScope.position() + leading, inScope.fuzz() + scope.fuzz());
				}
			}
		}

		final ContextMatch match = this.matcher.find(original, expected, cursor, section.eof());
		return match.isFound() ? new Placement(match.position() + leading, match.fuzz()) : null;
	}

	/**
	 * Resolved chunks of a patch.
	 *
	 * @param chunks chunks in application order
	 * @param fuzz   sum of the fuzz of all section matches
	 */
	public record Resolution(
		@Nonnull List<Chunk> chunks,
		int fuzz
	) {

		public Resolution {
			Objects.requireNonNull(chunks, "chunks must not be null");
			chunks = Collections.unmodifiableList(chunks);
		}
	}

	private record Placement(int originIndex, int fuzz) {
	}
}
