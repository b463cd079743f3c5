package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cursor over the normalized lines of one patch.
 *
 * A state is owned by a single parse call and never shared, so it is deliberately mutable.
 * Tests may build states by hand to drive the readers from an arbitrary position.
 */
public final class ParserState {

	@Nonnull
	private final List<String> lines;
	private int index;

	/**
	 * Creates a state positioned at the first line.
	 *
	 * @param lines the patch lines
	 */
	public ParserState(@Nonnull List<String> lines) {
		this(lines, 0);
	}

	/**
	 * Creates a state positioned at the given line.
	 *
	 * @param lines the patch lines
	 * @param index the cursor position, within [0, lines.size()]
	 */
	public ParserState(@Nonnull List<String> lines, int index) {
		Objects.requireNonNull(lines, "lines must not be null");
		this.lines = Collections.unmodifiableList(lines);
		setIndex(index);
	}

	/**
	 * Returns true when there is no more input for the current section: the cursor is at or
	 * past the end, or the current line equals one of the terminators.
	 *
	 * @param terminators line values that end the input
	 * @return true if the input is exhausted
	 */
	public boolean isDone(@Nonnull Collection<String> terminators) {
		Objects.requireNonNull(terminators, "terminators must not be null");
		if (this.index >= this.lines.size()) {
			return true;
		}
		return terminators.contains(this.lines.get(this.index));
	}

	/**
	 * Reads the remainder of the current line when it starts with the prefix and advances
	 * past it. Otherwise the cursor stays where it is.
	 *
	 * @param prefix the expected prefix
	 * @return the text following the prefix, or empty when the line does not match
	 */
	@Nonnull
	public Optional<String> readPrefixed(@Nonnull String prefix) {
		Objects.requireNonNull(prefix, "prefix must not be null");
		final String current = current();
		if (current == null || !current.startsWith(prefix)) {
			return Optional.empty();
		}
		this.index++;
		return Optional.of(current.substring(prefix.length()));
	}

	/**
	 * Returns the line under the cursor.
	 *
	 * @return the current line, or null when the input is exhausted
	 */
	@Nullable
	public String current() {
		return this.index < this.lines.size() ? this.lines.get(this.index) : null;
	}

	@Nonnull
	public List<String> getLines() {
		return this.lines;
	}

	public int getIndex() {
		return this.index;
	}

	/**
	 * Returns the 1-based number of the line under the cursor, for error reporting.
	 *
	 * @return line number
	 */
	public int getLineNumber() {
		return this.index + 1;
	}

	public void setIndex(int index) {
		if (index < 0 || index > this.lines.size()) {
			throw new IllegalArgumentException(
				"index must be within [0, " + this.lines.size() + "]: " + index
			);
		}
		this.index = index;
	}
}
