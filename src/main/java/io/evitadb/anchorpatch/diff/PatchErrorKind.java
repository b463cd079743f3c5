package io.evitadb.anchorpatch.diff;

/**
 * Distinguishes why a patch was rejected.
 */
public enum PatchErrorKind {

	/**
	 * The patch text itself is malformed. Retrying with the same patch cannot succeed.
	 */
	FORMAT,

	/**
	 * The patch is well-formed but does not apply to the given text, usually because the
	 * text is stale or belongs to a different file.
	 */
	RESOLUTION
}
