package io.evitadb.anchorpatch.tool;

import io.evitadb.anchorpatch.Writer;
import io.evitadb.anchorpatch.diff.AnchoredPatchEngine;
import io.evitadb.anchorpatch.diff.PatchException;
import io.evitadb.anchorpatch.diff.PatchMode;
import io.evitadb.anchorpatch.diff.PatchResult;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Editor that applies operations to files below one workspace directory.
 * Paths escaping the workspace, including through symbolic links, are rejected. In dry-run mode
 * every patch is still applied in memory, so a rejected patch fails exactly as it would for real,
 * but nothing is written. Dry-run results are remembered, so later operations of the same run
 * see the files created, updated or deleted before them.
 *
 * Instances are meant for a single run and are not thread-safe.
 */
public final class WorkspaceEditor implements Editor {

	private static final String DRY_RUN_SUFFIX = " (dry run)";

	@Nonnull
	private final Path root;
	@Nonnull
	private final AnchoredPatchEngine engine;
	@Nonnull
	private final Writer writer;
	@Nonnull
	private final Log log;
	private final boolean dryRun;
	/** Contents produced by dry-run creates and updates, keyed by real path. */
	@Nonnull
	private final Map<Path, String> pending = new HashMap<>();
	/** Paths removed by dry-run deletes. */
	@Nonnull
	private final Set<Path> deleted = new HashSet<>();

	/**
	 * Creates an editor for the given workspace.
	 *
	 * @param root   workspace directory every path is resolved against
	 * @param dryRun when true, nothing is written or deleted
	 * @param log    log for per-file details
	 * @throws IOException if the workspace directory does not exist
	 */
	public WorkspaceEditor(@Nonnull Path root, boolean dryRun, @Nonnull Log log) throws IOException {
		this(root, new AnchoredPatchEngine(), new Writer(), dryRun, log);
	}

	public WorkspaceEditor(
		@Nonnull Path root,
		@Nonnull AnchoredPatchEngine engine,
		@Nonnull Writer writer,
		boolean dryRun,
		@Nonnull Log log
	) throws IOException {
		this.root = Objects.requireNonNull(root, "root must not be null").toRealPath();
		this.engine = Objects.requireNonNull(engine, "engine must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.dryRun = dryRun;
	}

	@Nonnull
	@Override
	public ApplyPatchResult createFile(@Nonnull ApplyPatchOperation operation) throws IOException, PatchException {
		final Path target = resolve(operation.path());
		final String content = this.engine.apply("", operation.diffOrEmpty(), PatchMode.CREATE);
		store(target, content);
		return ApplyPatchResult.completed("Created " + relative(target) + suffix());
	}

	@Nonnull
	@Override
	public ApplyPatchResult updateFile(@Nonnull ApplyPatchOperation operation) throws IOException, PatchException {
		final Path target = resolve(operation.path());
		final String original = read(target);
		final PatchResult result = this.engine.applyDetailed(original, operation.diffOrEmpty(), PatchMode.UPDATE);

		if (!result.isExact()) {
			this.log.warn("Patch for " + relative(target) + " needed fuzzy matching (fuzz " + result.fuzz() + ")");
		}
		this.log.debug(
			"Patch for " + relative(target) + ": " + result.chunks().size() + " chunk(s), +" +
				result.linesAdded() + " -" + result.linesRemoved()
		);

		store(target, result.content());
		return ApplyPatchResult.completed("Updated " + relative(target) + suffix());
	}

	@Nonnull
	@Override
	public ApplyPatchResult deleteFile(@Nonnull ApplyPatchOperation operation) throws IOException {
		final Path target = resolve(operation.path());
		if (this.dryRun) {
			this.pending.remove(target);
			this.deleted.add(target);
		} else {
			Files.deleteIfExists(target);
		}
		return ApplyPatchResult.completed("Deleted " + relative(target) + suffix());
	}

	/**
	 * Resolves a path against the workspace root and makes sure it stays inside. Symbolic links
	 * are followed up to the deepest part of the path that exists, so a link pointing out of the
	 * workspace cannot be used to reach files outside it.
	 *
	 * @param path relative or absolute path
	 * @return real absolute path inside the workspace
	 * @throws IOException              if an existing part of the path cannot be resolved
	 * @throws IllegalArgumentException if the path points outside the workspace
	 */
	@Nonnull
	Path resolve(@Nonnull String path) throws IOException {
		final Path candidate = Path.of(path);
		final Path lexical = (candidate.isAbsolute() ? candidate : this.root.resolve(candidate))
			.toAbsolutePath()
			.normalize();

		Path existing = lexical;
		while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
			existing = existing.getParent();
		}
		final Path target = existing == null ?
			lexical :
			existing.toRealPath().resolve(existing.relativize(lexical)).normalize();

		if (!target.startsWith(this.root) || target.equals(this.root)) {
			throw new IllegalArgumentException("Operation outside workspace: " + path);
		}
		return target;
	}

	/**
	 * Reads the current content of a file, preferring what an earlier dry-run operation left.
	 */
	@Nonnull
	private String read(@Nonnull Path target) throws IOException {
		if (this.dryRun) {
			final String content = this.pending.get(target);
			if (content != null) {
				return content;
			}
			if (this.deleted.contains(target)) {
				throw new NoSuchFileException(relative(target), null, "file to update was deleted");
			}
		}
		if (!Files.isRegularFile(target)) {
			throw new NoSuchFileException(relative(target), null, "file to update does not exist");
		}
		return Files.readString(target, StandardCharsets.UTF_8);
	}

	private void store(@Nonnull Path target, @Nonnull String content) throws IOException {
		if (this.dryRun) {
			this.pending.put(target, content);
			this.deleted.remove(target);
		} else {
			this.writer.write(content, target);
		}
	}

	@Nonnull
	private String relative(@Nonnull Path target) {
		return this.root.relativize(target).toString().replace('\\', '/');
	}

	@Nonnull
	private String suffix() {
		return this.dryRun ? DRY_RUN_SUFFIX : "";
	}
}
