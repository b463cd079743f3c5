package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the content of a new file from a patch made only of insertion lines.
 * Nothing is matched, the original text is never consulted.
 */
public final class CreateModeBuilder {

	/**
	 * Extracts the content lines from a create-mode patch.
	 *
	 * Blank lines and hunk markers are skipped. The end-of-file marker or the patch
	 * terminator ends the content.
	 *
	 * @param diffLines the normalized patch lines
	 * @return the lines of the new content
	 * @throws PatchFormatException if a content line is not an insertion, or content follows
	 *                              the end marker
	 */
	@Nonnull
	public List<String> build(@Nonnull List<String> diffLines) throws PatchFormatException {
		Objects.requireNonNull(diffLines, "diffLines must not be null");

		final List<String> output = new ArrayList<>(diffLines.size());
		boolean ended = false;

		for (int index = 0; index < diffLines.size(); index++) {
			final String line = diffLines.get(index);
			if (line.isBlank()) {
				continue;
			}
			if (ended) {
				throw new PatchFormatException("Unexpected content after end marker", line, index + 1);
			}
			if (line.startsWith(SectionReader.HUNK_MARKER)) {
				continue;
			}
			if (SectionReader.END_OF_FILE_MARKER.equals(line) || SectionReader.END_PATCH_MARKER.equals(line)) {
				ended = true;
				continue;
			}
			if (line.charAt(0) != DirectiveType.INSERTION.prefix()) {
				throw new PatchFormatException(
					"Create mode requires every content line to be an addition", line, index + 1
				);
			}
			output.add(line.substring(1));
		}

		return output;
	}
}
