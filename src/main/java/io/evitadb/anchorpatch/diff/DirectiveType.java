package io.evitadb.anchorpatch.diff;

import javax.annotation.Nullable;

/**
 * Enumeration of directive kinds a patch line can carry.
 * Each directive line in a section is prefixed with a character indicating its kind.
 */
public enum DirectiveType {

	/**
	 * Context line - existing line used to anchor the section, kept unchanged.
	 * Prefixed with a space character.
	 */
	CONTEXT(' '),

	/**
	 * Deletion line - existing line that is expected at the anchor and removed.
	 * Prefixed with '-' character.
	 */
	DELETION('-'),

	/**
	 * Insertion line - new line added in place of the deletions.
	 * Prefixed with '+' character.
	 */
	INSERTION('+');

	private final char prefix;

	DirectiveType(char prefix) {
		this.prefix = prefix;
	}

	/**
	 * Returns the prefix character that introduces this directive in patch text.
	 *
	 * @return the prefix character
	 */
	public char prefix() {
		return this.prefix;
	}

	/**
	 * Classifies a prefix character.
	 *
	 * @param prefix the first character of a patch line
	 * @return the matching directive type, or null if the character is not a directive prefix
	 */
	@Nullable
	public static DirectiveType fromPrefix(char prefix) {
		for (final DirectiveType type : values()) {
			if (type.prefix == prefix) {
				return type;
			}
		}
		return null;
	}
}
