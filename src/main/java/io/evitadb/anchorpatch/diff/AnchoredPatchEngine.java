package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Applies context-anchored patches to text.
 *
 * In {@link PatchMode#UPDATE} the patch is parsed into sections, each section is located in
 * the original by its context lines, and the resulting chunks are spliced in. In
 * {@link PatchMode#CREATE} the content is taken straight from the insertion lines. Either
 * way the result ends with a single newline, and a failure never yields partial output.
 *
 * The engine keeps no state between calls; one instance can serve concurrent callers.
 */
public final class AnchoredPatchEngine {

	@Nonnull
	private final AnchoredDiffParser parser;
	@Nonnull
	private final ChunkResolver resolver;
	@Nonnull
	private final ChunkApplier applier;
	@Nonnull
	private final CreateModeBuilder createModeBuilder;

	public AnchoredPatchEngine() {
		this.parser = new AnchoredDiffParser();
		this.resolver = new ChunkResolver();
		this.applier = new ChunkApplier();
		this.createModeBuilder = new CreateModeBuilder();
	}

	/**
	 * Applies an update patch.
	 *
	 * @param original the current text
	 * @param diff     the patch text
	 * @return the patched text
	 * @throws PatchException if the patch is malformed or does not apply
	 */
	@Nonnull
	public String apply(@Nonnull String original, @Nonnull String diff) throws PatchException {
		return apply(original, diff, PatchMode.UPDATE);
	}

	/**
	 * Applies a patch in the given mode.
	 *
	 * @param original the current text, ignored in create mode
	 * @param diff     the patch text
	 * @param mode     how to apply the patch
	 * @return the patched text
	 * @throws PatchException if the patch is malformed or does not apply
	 */
	@Nonnull
	public String apply(
		@Nonnull String original,
		@Nonnull String diff,
		@Nonnull PatchMode mode
	) throws PatchException {
		return applyDetailed(original, diff, mode).content();
	}

	/**
	 * Applies a patch and reports how it was placed.
	 *
	 * @param original the current text, ignored in create mode
	 * @param diff     the patch text
	 * @param mode     how to apply the patch
	 * @return the patched text with the applied chunks and the fuzz needed
	 * @throws PatchFormatException     if the patch is malformed
	 * @throws PatchResolutionException if the patch does not apply to the text
	 */
	@Nonnull
	public PatchResult applyDetailed(
		@Nonnull String original,
		@Nonnull String diff,
		@Nonnull PatchMode mode
	) throws PatchFormatException, PatchResolutionException {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(diff, "diff must not be null");
		Objects.requireNonNull(mode, "mode must not be null");

		return switch (mode) {
			case CREATE -> {
				final List<String> content = this.createModeBuilder.build(Lines.normalize(diff));
				yield new PatchResult(Lines.join(content), mode, List.of(new Chunk(0, List.of(), content)), 0, content.size(), 0);
			}
			case UPDATE -> {
				final List<String> originalLines = Lines.normalize(original);
				final ParsedDiff parsed = this.parser.parse(diff);
				final ChunkResolver.Resolution resolution = this.resolver.resolve(originalLines, parsed.sections());
				final List<String> patched = this.applier.apply(originalLines, resolution.chunks());
				yield new PatchResult(
					Lines.join(patched), mode, resolution.chunks(), resolution.fuzz(),
					parsed.linesAdded(), parsed.linesRemoved()
				);
			}
		};
	}
}
