package io.evitadb.anchorpatch.tool;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * File operations a patch request can ask for.
 */
public enum OperationType {

	CREATE_FILE("create_file"),
	UPDATE_FILE("update_file"),
	DELETE_FILE("delete_file");

	@Nonnull
	private final String wireName;

	OperationType(@Nonnull String wireName) {
		this.wireName = wireName;
	}

	/**
	 * Returns the name used for this operation in tool requests.
	 *
	 * @return wire name, e.g. {@code update_file}
	 */
	@Nonnull
	public String wireName() {
		return this.wireName;
	}

	/**
	 * Resolves an operation from its wire name, ignoring case and accepting the constant name.
	 *
	 * @param value the wire name, e.g. {@code create_file} or {@code CREATE_FILE}
	 * @return the operation type
	 * @throws IllegalArgumentException if the value names no operation
	 */
	@Nonnull
	public static OperationType fromWireName(@Nonnull String value) {
		Objects.requireNonNull(value, "value must not be null");
		final String normalized = value.strip().toLowerCase(Locale.ROOT).replace('-', '_');
		for (final OperationType type : values()) {
			if (type.wireName.equals(normalized)) {
				return type;
			}
		}
		throw new IllegalArgumentException(
			"Unknown operation type: " + value + ". Supported types: create_file, update_file, delete_file"
		);
	}
}
