package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;

/**
 * Common parent of all failures raised while applying a patch.
 * Callers that only report the rejection can catch this type and use {@link #getKind()}
 * to tell malformed patches from patches that do not fit the text.
 */
public abstract class PatchException extends Exception {

	protected PatchException(@Nonnull String message) {
		super(message);
	}

	/**
	 * Returns the kind of failure.
	 *
	 * @return the error kind
	 */
	@Nonnull
	public abstract PatchErrorKind getKind();
}
