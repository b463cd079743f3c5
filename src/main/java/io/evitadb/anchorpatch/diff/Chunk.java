package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * A resolved, positioned edit ready to be spliced into the original lines.
 *
 * @param originIndex index in the original lines where the edit begins (0-based)
 * @param deleteLines lines removed at that position
 * @param insertLines lines inserted in their place
 */
public record Chunk(
	int originIndex,
	@Nonnull List<String> deleteLines,
	@Nonnull List<String> insertLines
) {

	public Chunk {
		if (originIndex < 0) {
			throw new IllegalArgumentException("originIndex must be non-negative: " + originIndex);
		}
		Objects.requireNonNull(deleteLines, "deleteLines must not be null");
		Objects.requireNonNull(insertLines, "insertLines must not be null");
		deleteLines = List.copyOf(deleteLines);
		insertLines = List.copyOf(insertLines);
	}

	/**
	 * Returns the index just past the last original line this chunk consumes.
	 *
	 * @return exclusive end index in the original lines
	 */
	public int endIndex() {
		return this.originIndex + this.deleteLines.size();
	}
}
