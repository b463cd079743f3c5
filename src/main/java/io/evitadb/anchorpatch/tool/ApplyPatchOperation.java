package io.evitadb.anchorpatch.tool;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A single file operation requested from the patch tool.
 *
 * @param type the operation to perform
 * @param path path of the file, relative to the editor's workspace
 * @param diff the patch text; required for create and update, ignored for delete
 */
public record ApplyPatchOperation(
	@Nonnull OperationType type,
	@Nonnull String path,
	@Nullable String diff
) {

	public ApplyPatchOperation {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(path, "path must not be null");
		if (path.isBlank()) {
			throw new IllegalArgumentException("path must not be blank");
		}
	}

	/**
	 * Returns the patch text, treating a missing patch as empty.
	 *
	 * @return the diff or an empty string
	 */
	@Nonnull
	public String diffOrEmpty() {
		return this.diff == null ? "" : this.diff;
	}
}
