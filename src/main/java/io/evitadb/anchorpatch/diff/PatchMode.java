package io.evitadb.anchorpatch.diff;

/**
 * Mode in which a patch is applied.
 */
public enum PatchMode {

	/**
	 * Patch is anchored into the existing text by its context lines.
	 */
	UPDATE,

	/**
	 * Patch synthesizes brand-new content purely from insertion lines.
	 */
	CREATE
}
