package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splices resolved chunks into the original lines.
 * Chunks must be ordered and must not overlap, no matter how they were produced.
 */
public final class ChunkApplier {

	/**
	 * Applies the chunks to the original lines.
	 *
	 * @param original the lines being patched
	 * @param chunks   chunks in application order
	 * @return new list with every chunk applied
	 * @throws PatchResolutionException if a chunk lies outside the original or overlaps its predecessor
	 */
	@Nonnull
	public List<String> apply(
		@Nonnull List<String> original,
		@Nonnull List<Chunk> chunks
	) throws PatchResolutionException {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(chunks, "chunks must not be null");

		final List<String> result = new ArrayList<>(original.size());
		int cursor = 0;

		for (int chunkIndex = 0; chunkIndex < chunks.size(); chunkIndex++) {
			final Chunk chunk = chunks.get(chunkIndex);

			if (chunk.originIndex() > original.size()) {
				throw new PatchResolutionException(
					"Chunk starts at line " + (chunk.originIndex() + 1) +
						" but the text has only " + original.size() + " lines",
					chunkIndex,
					null
				);
			}
			if (chunk.originIndex() < cursor) {
				throw new PatchResolutionException(
					"Chunk starting at line " + (chunk.originIndex() + 1) +
						" overlaps the previous chunk ending at line " + cursor,
					chunkIndex,
					null
				);
			}
			if (chunk.endIndex() > original.size()) {
				throw new PatchResolutionException(
					"Chunk deletes past the end of the text",
					chunkIndex,
					String.join("\n", chunk.deleteLines())
				);
			}

			result.addAll(original.subList(cursor, chunk.originIndex()));
			result.addAll(chunk.insertLines());
			cursor = chunk.endIndex();
		}

		result.addAll(original.subList(cursor, original.size()));
		return result;
	}
}
