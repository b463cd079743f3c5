package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One editable region of a patch: the lines that anchor it, the lines it removes and the
 * lines it adds. Each section resolves to exactly one {@link Chunk}.
 *
 * @param hint            author-supplied text from the hunk header, or null
 * @param leadingContext  context lines before the first change
 * @param deleteLines     deleted lines in encounter order
 * @param insertLines     inserted lines in encounter order
 * @param trailingContext context lines after the last change
 * @param eof             true when the section is anchored to the end of the text
 * @param continued       true when the section was cut short by a further change run,
 *                        whose section starts at {@code endIndex} with this section's trailing
 *                        context as its leading context
 * @param endIndex        index of the first patch line not consumed by this section
 */
public record Section(
	@Nullable String hint,
	@Nonnull List<String> leadingContext,
	@Nonnull List<String> deleteLines,
	@Nonnull List<String> insertLines,
	@Nonnull List<String> trailingContext,
	boolean eof,
	boolean continued,
	int endIndex
) {

	public Section {
		Objects.requireNonNull(leadingContext, "leadingContext must not be null");
		Objects.requireNonNull(deleteLines, "deleteLines must not be null");
		Objects.requireNonNull(insertLines, "insertLines must not be null");
		Objects.requireNonNull(trailingContext, "trailingContext must not be null");
		if (endIndex < 0) {
			throw new IllegalArgumentException("endIndex must be non-negative: " + endIndex);
		}
		leadingContext = List.copyOf(leadingContext);
		deleteLines = List.copyOf(deleteLines);
		insertLines = List.copyOf(insertLines);
		trailingContext = List.copyOf(trailingContext);
	}

	/**
	 * Returns a copy of this section carrying the given header hint.
	 *
	 * @param hint the hint text
	 * @return section with the hint attached
	 */
	@Nonnull
	public Section withHint(@Nullable String hint) {
		return new Section(
			hint, this.leadingContext, this.deleteLines, this.insertLines,
			this.trailingContext, this.eof, this.continued, this.endIndex
		);
	}

	/**
	 * Returns the lines this section expects to find in the text, in order: leading
	 * context, deletions and trailing context.
	 *
	 * @return the expected old-side window
	 */
	@Nonnull
	public List<String> expectedLines() {
		final List<String> expected = new ArrayList<>(
			this.leadingContext.size() + this.deleteLines.size() + this.trailingContext.size()
		);
		expected.addAll(this.leadingContext);
		expected.addAll(this.deleteLines);
		expected.addAll(this.trailingContext);
		return expected;
	}
}
