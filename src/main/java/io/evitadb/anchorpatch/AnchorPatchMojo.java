package io.evitadb.anchorpatch;

import io.evitadb.anchorpatch.tool.ApplyPatchOperation;
import io.evitadb.anchorpatch.tool.ApplyPatchResult;
import io.evitadb.anchorpatch.tool.ApplyPatchTool;
import io.evitadb.anchorpatch.tool.OperationType;
import io.evitadb.anchorpatch.tool.WorkspaceEditor;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main Mojo for AnchorPatch plugin providing actions:
 * - show-config: prints current configuration
 * - apply: applies the configured patches to the workspace
 * - check: verifies the configured patches apply cleanly without writing anything
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class AnchorPatchMojo extends AbstractMojo {

	/** Which action to perform: "show-config", "apply" or "check". */
	@Parameter(property = "anchorpatch.action", defaultValue = "show-config")
	private String action;

	/** Workspace directory all patch targets are resolved against (no default). */
	@Parameter(property = "anchorpatch.workspaceDir")
	private String workspaceDir;

	/** Patches to apply, in order. */
	@Parameter(property = "anchorpatch.patches")
	private List<PatchSpec> patches;

	/** When true, a failed patch fails the build of the apply action. */
	@Parameter(property = "anchorpatch.failOnError", defaultValue = "true")
	private boolean failOnError = true;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "apply":
				apply(getLog(), false);
				break;
			case "check":
				apply(getLog(), true);
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, apply, check");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("AnchorPatch Plugin Configuration:");
		log.info(" - workspaceDir: " + (this.workspaceDir == null || this.workspaceDir.isBlank() ? "<not set>" : this.workspaceDir));
		if (this.workspaceDir == null || this.workspaceDir.isBlank()) {
			log.warn("Workspace directory is not set");
		}
		if (this.patches == null || this.patches.isEmpty()) {
			log.info(" - patches: <none>");
			log.warn("No patches configured");
		} else {
			log.info(" - patches:");
			for (final PatchSpec p : this.patches) {
				final String type = p == null ? null : p.getType();
				final String path = p == null ? null : p.getPath();
				final String patchFile = p == null ? null : p.getPatchFile();
				log.info("   - type: " + orNotSet(type) + ", path: " + orNotSet(path) + ", patchFile: " + orNotSet(patchFile));
				if (path == null || path.isBlank()) {
					log.warn("Patch target path is not set");
				}
			}
		}
		log.info(" - failOnError: " + this.failOnError);
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return value == null || value.isBlank() ? "<not set>" : value;
	}

	/**
	 * Runs every configured patch through the patch tool.
	 *
	 * @param log    the Maven log
	 * @param dryRun when true (check action), patches are verified but nothing is written
	 * @throws MojoExecutionException if the configuration is invalid, or patches failed and
	 *                                the action must fail the build
	 */
	private void apply(@Nonnull final Log log, final boolean dryRun) throws MojoExecutionException {
		final String actionName = dryRun ? "check" : "apply";
		if (this.workspaceDir == null || this.workspaceDir.isBlank()) {
			log.error("Workspace directory must be specified for " + actionName + " action");
			throw new MojoExecutionException("Workspace directory not specified");
		}

		final Path root = Path.of(this.workspaceDir).toAbsolutePath().normalize();
		if (!Files.isDirectory(root)) {
			log.error("Workspace directory does not exist or is not a directory: " + root);
			throw new MojoExecutionException("Invalid workspace directory: " + root);
		}
		if (this.patches == null || this.patches.isEmpty()) {
			log.warn("No patches configured, nothing to " + actionName);
			return;
		}

		log.info("=== " + (dryRun ? "Checking" : "Applying") + " " + this.patches.size() + " patch(es) in: " + root + " ===");

		final ApplyPatchTool tool;
		try {
			tool = new ApplyPatchTool(new WorkspaceEditor(root, dryRun, log), log);
		} catch (final IOException ex) {
			throw new MojoExecutionException("Cannot open workspace directory: " + root, ex);
		}
		int applied = 0;
		int failed = 0;
		int skipped = 0;

		for (final PatchSpec spec : this.patches) {
			if (spec == null || spec.getPath() == null || spec.getPath().isBlank()) {
				log.warn("Skipping incomplete patch configuration");
				skipped++;
				continue;
			}

			final ApplyPatchResult result;
			try {
				result = tool.execute(toOperation(spec, root));
			} catch (final IOException | IllegalArgumentException ex) {
				log.error("Cannot prepare patch for " + spec.getPath() + ": " + ex.getMessage());
				failed++;
				continue;
			}

			if (result.isSuccess()) {
				log.info("[OK] " + result.output());
				applied++;
			} else {
				log.error("[FAILED] " + spec.getPath() + ": " + result.output());
				failed++;
			}
		}

		log.info("--- " + (dryRun ? "Check" : "Patch") + " Summary ---");
		log.info((dryRun ? "Applicable: " : "Applied: ") + applied);
		log.info("Failed: " + failed);
		if (skipped > 0) {
			log.info("Skipped: " + skipped);
		}

		if (failed > 0 && (dryRun || this.failOnError)) {
			throw new MojoExecutionException(
				(dryRun ? "Check" : "Apply") + " failed with " + failed + " error(s)"
			);
		}
	}

	/**
	 * Builds the tool operation for one configured patch, reading its patch file.
	 *
	 * @param spec the patch configuration
	 * @param root the workspace root, used to resolve relative patch files
	 * @return the operation
	 * @throws IOException              if the patch file cannot be read
	 * @throws IllegalArgumentException if the operation type is unknown or a patch file is missing
	 */
	@Nonnull
	private static ApplyPatchOperation toOperation(@Nonnull final PatchSpec spec, @Nonnull final Path root) throws IOException {
		final OperationType type = spec.getType() == null || spec.getType().isBlank() ?
			OperationType.UPDATE_FILE : OperationType.fromWireName(spec.getType());

		if (type == OperationType.DELETE_FILE) {
			return new ApplyPatchOperation(type, spec.getPath(), null);
		}
		if (spec.getPatchFile() == null || spec.getPatchFile().isBlank()) {
			throw new IllegalArgumentException("patchFile must be set for " + type.wireName());
		}
		final Path patchFile = root.resolve(spec.getPatchFile()).toAbsolutePath().normalize();
		final String diff = Files.readString(patchFile, StandardCharsets.UTF_8);
		return new ApplyPatchOperation(type, spec.getPath(), diff);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setWorkspaceDir(@Nullable final String workspaceDir) { this.workspaceDir = workspaceDir; }
	void setPatches(@Nullable final List<PatchSpec> patches) { this.patches = patches; }
	void setFailOnError(final boolean failOnError) { this.failOnError = failOnError; }

	/** Single patch configuration. */
	public static class PatchSpec {
		/** Operation type: create_file, update_file (default) or delete_file. */
		@Parameter
		private String type;
		/** Target file, relative to the workspace. */
		@Parameter
		private String path;
		/** File holding the patch text; relative paths resolve against the workspace. */
		@Parameter
		private String patchFile;

		public PatchSpec() {}

		public PatchSpec(@Nullable final String type, @Nullable final String path, @Nullable final String patchFile) {
			this.type = type;
			this.path = path;
			this.patchFile = patchFile;
		}

		@Nullable
		public String getType() { return this.type; }

		@Nullable
		public String getPath() { return this.path; }

		@Nullable
		public String getPatchFile() { return this.patchFile; }

		public void setType(@Nullable final String type) { this.type = type; }

		public void setPath(@Nullable final String path) { this.path = path; }

		public void setPatchFile(@Nullable final String patchFile) { this.patchFile = patchFile; }
	}
}
