package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads one section of an update patch.
 *
 * A section is a run of directive lines:
 * ```
 *  leading context
 * -deleted line
 * +inserted line
 *  trailing context
 * ```
 * It ends at the next hunk marker, the end-of-file marker, the patch terminator or the end
 * of input. When a further change follows the trailing context, the section stops before
 * that context so the next section can use it as its own anchor.
 */
public final class SectionReader {

	public static final String HUNK_MARKER = "@@";
	public static final String END_OF_FILE_MARKER = "*** End of File";
	public static final String END_PATCH_MARKER = "*** End Patch";

	/**
	 * Prefix of every marker line in the patch vocabulary.
	 */
	private static final String MARKER_PREFIX = "***";

	/**
	 * Reads the section starting at the given index.
	 *
	 * @param lines      the normalized patch lines
	 * @param startIndex index of the first line of the section
	 * @return the parsed section, with {@link Section#endIndex()} pointing past it
	 * @throws PatchFormatException if a line is not a directive or marker, or the section is empty
	 */
	@Nonnull
	public Section read(@Nonnull List<String> lines, int startIndex) throws PatchFormatException {
		Objects.requireNonNull(lines, "lines must not be null");

		final List<String> leading = new ArrayList<>();
		final List<String> deletions = new ArrayList<>();
		final List<String> insertions = new ArrayList<>();
		final List<String> trailing = new ArrayList<>();
		boolean changeSeen = false;
		int trailingStart = -1;
		int index = startIndex;

		while (index < lines.size()) {
			final String line = lines.get(index);
			if (isBoundary(line)) {
				break;
			}
			if (line.startsWith(MARKER_PREFIX)) {
				throw new PatchFormatException("Unrecognized marker '" + line + "'", line, index + 1);
			}

			final Directive directive = toDirective(line, index);
			switch (directive.type()) {
				case CONTEXT -> {
					if (!changeSeen) {
						leading.add(directive.content());
					} else {
						if (trailing.isEmpty()) {
							trailingStart = index;
						}
						trailing.add(directive.content());
					}
				}
				case DELETION, INSERTION -> {
					if (!trailing.isEmpty()) {
						return new Section(
							null, leading, deletions, insertions, trailing, false, true, trailingStart
						);
					}
					changeSeen = true;
					if (directive.type() == DirectiveType.DELETION) {
						deletions.add(directive.content());
					} else {
						insertions.add(directive.content());
					}
				}
			}
			index++;
		}

		if (index < lines.size() && END_OF_FILE_MARKER.equals(lines.get(index))) {
			return new Section(null, leading, deletions, insertions, trailing, true, false, index + 1);
		}
		if (index == startIndex) {
			final String next = index < lines.size() ? lines.get(index) : "";
			throw new PatchFormatException(
				"A section must contain at least one directive line", next, index + 1
			);
		}
		return new Section(null, leading, deletions, insertions, trailing, false, false, index);
	}

	/**
	 * Returns true for lines that end a section without belonging to it.
	 */
	private static boolean isBoundary(@Nonnull String line) {
		return line.startsWith(HUNK_MARKER) ||
			END_OF_FILE_MARKER.equals(line) ||
			END_PATCH_MARKER.equals(line);
	}

	@Nonnull
	private static Directive toDirective(@Nonnull String line, int index) throws PatchFormatException {
		// A blank line is an empty context line whose space prefix was trimmed away
		if (line.isEmpty()) {
			return Directive.context("");
		}
		final char prefix = line.charAt(0);
		final DirectiveType type = DirectiveType.fromPrefix(prefix);
		if (type == null) {
			throw new PatchFormatException(
				"Invalid line prefix '" + prefix + "' - expected ' ', '-', or '+'",
				line,
				index + 1
			);
		}
		return new Directive(type, line.substring(1));
	}
}
