package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successfully applied patch.
 *
 * @param content      the patched text
 * @param mode         the mode the patch was applied in
 * @param chunks       the chunks that were applied, in order
 * @param fuzz         total tolerance needed to place the sections; 0 means every context matched exactly
 * @param linesAdded   number of inserted lines
 * @param linesRemoved number of deleted lines
 */
public record PatchResult(
	@Nonnull String content,
	@Nonnull PatchMode mode,
	@Nonnull List<Chunk> chunks,
	int fuzz,
	int linesAdded,
	int linesRemoved
) {

	public PatchResult {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(mode, "mode must not be null");
		Objects.requireNonNull(chunks, "chunks must not be null");
		chunks = List.copyOf(chunks);
	}

	public boolean isExact() {
		return this.fuzz == 0;
	}
}
