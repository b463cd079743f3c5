package io.evitadb.anchorpatch.tool;

import io.evitadb.anchorpatch.diff.PatchException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Entry point for patch requests coming from a tool call.
 *
 * Dispatches each operation to the {@link Editor} and reports the outcome as an
 * {@link ApplyPatchResult}. A rejected patch is never hidden: it is logged and returned as a
 * failed result carrying the reason, so the caller can refresh its view of the file and retry.
 */
public final class ApplyPatchTool {

	@Nonnull
	private final Editor editor;
	@Nonnull
	private final Log log;

	public ApplyPatchTool(@Nonnull Editor editor) {
		this(editor, new SystemStreamLog());
	}

	public ApplyPatchTool(@Nonnull Editor editor, @Nonnull Log log) {
		this.editor = Objects.requireNonNull(editor, "editor must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Executes one operation.
	 *
	 * @param operation the requested operation
	 * @return completed result from the editor, or a failed result describing the error
	 */
	@Nonnull
	public ApplyPatchResult execute(@Nonnull ApplyPatchOperation operation) {
		Objects.requireNonNull(operation, "operation must not be null");

		try {
			final ApplyPatchResult result = switch (operation.type()) {
				case CREATE_FILE -> this.editor.createFile(operation);
				case UPDATE_FILE -> this.editor.updateFile(operation);
				case DELETE_FILE -> this.editor.deleteFile(operation);
			};
			this.log.debug(operation.type().wireName() + " " + operation.path() + ": " + result.output());
			return result;
		} catch (final PatchException ex) {
			this.log.error(
				"Patch rejected for " + operation.path() + " (" + ex.getKind().name().toLowerCase(Locale.ROOT) + " error): " +
					ex.getMessage()
			);
			return ApplyPatchResult.failed(ex.getMessage());
		} catch (final IOException | RuntimeException ex) {
			this.log.error("Failed to " + operation.type().wireName() + " " + operation.path() + ": " + ex.getMessage(), ex);
			return ApplyPatchResult.failed(describe(ex));
		}
	}

	@Nonnull
	private static String describe(@Nonnull Exception ex) {
		final String message = ex.getMessage();
		return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
	}
}
