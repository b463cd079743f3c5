package io.evitadb.anchorpatch.tool;

import io.evitadb.anchorpatch.diff.PatchException;

import javax.annotation.Nonnull;
import java.io.IOException;

/**
 * File-editing collaborator of the patch tool.
 *
 * Implementations own path resolution and I/O. They report success through the returned
 * result and failure by throwing; the tool turns exceptions into failed results.
 */
public interface Editor {

	/**
	 * Creates a file whose content is built from the operation's insertion lines.
	 *
	 * @param operation the create operation
	 * @return the completed result
	 * @throws IOException    if the file cannot be written
	 * @throws PatchException if the patch is rejected
	 */
	@Nonnull
	ApplyPatchResult createFile(@Nonnull ApplyPatchOperation operation) throws IOException, PatchException;

	/**
	 * Applies the operation's patch to an existing file.
	 *
	 * @param operation the update operation
	 * @return the completed result
	 * @throws IOException    if the file cannot be read or written
	 * @throws PatchException if the patch is rejected
	 */
	@Nonnull
	ApplyPatchResult updateFile(@Nonnull ApplyPatchOperation operation) throws IOException, PatchException;

	/**
	 * Deletes a file.
	 *
	 * @param operation the delete operation
	 * @return the completed result
	 * @throws IOException if the file cannot be deleted
	 */
	@Nonnull
	ApplyPatchResult deleteFile(@Nonnull ApplyPatchOperation operation) throws IOException;
}
