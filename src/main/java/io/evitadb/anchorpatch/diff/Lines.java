package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts between raw text and the line sequences the patch engine works on.
 *
 * Only '\n' separates lines. A single trailing newline is not stored as an empty last
 * line; it is implied, and {@link #join(List)} always restores it.
 */
public final class Lines {

	private static final char NEWLINE = '\n';

	private Lines() {
	}

	/**
	 * Splits text into lines, dropping the empty element a trailing newline would produce.
	 *
	 * @param text the text to split
	 * @return mutable list of lines (without line terminators), empty for empty input
	 */
	@Nonnull
	public static List<String> normalize(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");

		final List<String> result = new ArrayList<>();
		if (text.isEmpty()) {
			return result;
		}

		int start = 0;
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == NEWLINE) {
				result.add(text.substring(start, i));
				start = i + 1;
			}
		}

		// Last line without newline
		if (start < text.length()) {
			result.add(text.substring(start));
		}

		return result;
	}

	/**
	 * Joins lines back into text that ends with exactly one newline. An explicit empty last
	 * line already supplies that newline, so it produces the same text as its absence.
	 *
	 * @param lines the lines to join
	 * @return joined text, or the empty string when there are no lines
	 */
	@Nonnull
	public static String join(@Nonnull List<String> lines) {
		Objects.requireNonNull(lines, "lines must not be null");

		if (lines.isEmpty()) {
			return "";
		}

		final StringBuilder sb = new StringBuilder();
		for (int i = 0; i < lines.size(); i++) {
			if (i > 0) {
				sb.append(NEWLINE);
			}
			sb.append(lines.get(i));
		}
		if (sb.length() == 0 || sb.charAt(sb.length() - 1) != NEWLINE) {
			sb.append(NEWLINE);
		}
		return sb.toString();
	}
}
