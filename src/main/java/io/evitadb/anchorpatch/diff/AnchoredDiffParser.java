package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses context-anchored patches.
 *
 * Patch format:
 * ```
 * @@ optional hint, e.g. the enclosing function
 *  context line
 * -removed line
 * +added line
 *  context line
 * *** End of File
 * ```
 * Hunk headers carry no line numbers. Whatever follows `@@` is kept as an opaque hint for
 * locating the hunk; unified-diff ranges like `-1,3 +1,4 @@` are accepted but never parsed.
 * The first hunk may omit its header.
 */
public final class AnchoredDiffParser {

	private static final List<String> TERMINATORS = List.of(SectionReader.END_PATCH_MARKER);
	private static final int MAX_QUOTED_LENGTH = 40;

	@Nonnull
	private final SectionReader sectionReader;

	public AnchoredDiffParser() {
		this(new SectionReader());
	}

	public AnchoredDiffParser(@Nonnull SectionReader sectionReader) {
		this.sectionReader = Objects.requireNonNull(sectionReader, "sectionReader must not be null");
	}

	/**
	 * Parses a patch string into its sections.
	 *
	 * @param diffText the raw patch text
	 * @return parsed patch; empty when the text holds no sections
	 * @throws PatchFormatException if the patch is malformed
	 */
	@Nonnull
	public ParsedDiff parse(@Nonnull String diffText) throws PatchFormatException {
		Objects.requireNonNull(diffText, "diffText must not be null");

		final ParserState state = new ParserState(Lines.normalize(diffText));
		final List<Section> sections = new ArrayList<>();
		boolean continued = false;

		while (!state.isDone(TERMINATORS)) {
			final Optional<String> header = state.readPrefixed(SectionReader.HUNK_MARKER);
			String hint = null;
			if (header.isPresent()) {
				final String text = header.get().strip();
				hint = text.isEmpty() ? null : text;
			} else if (!sections.isEmpty() && !continued) {
				final String current = Objects.requireNonNull(state.current());
				throw new PatchFormatException(
					"Expected hunk marker (@@) but found: '" + truncate(current) + "'",
					current,
					state.getLineNumber()
				);
			}

			final Section section = this.sectionReader.read(state.getLines(), state.getIndex());
			sections.add(hint == null ? section : section.withHint(hint));
			state.setIndex(section.endIndex());
			continued = section.continued();
		}

		return new ParsedDiff(sections);
	}

	@Nonnull
	private static String truncate(@Nonnull String s) {
		if (s.length() <= MAX_QUOTED_LENGTH) {
			return s;
		}
		return s.substring(0, MAX_QUOTED_LENGTH - 3) + "...";
	}
}
