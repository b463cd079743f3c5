package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when the patch text is malformed.
 * Contains the offending line and its position within the patch.
 */
public final class PatchFormatException extends PatchException {

	@Nonnull
	private final String offendingLine;
	private final int lineNumber;

	/**
	 * Creates a new PatchFormatException.
	 *
	 * @param message       the error message describing the format violation
	 * @param offendingLine the patch line that violates the format, empty when there is none
	 * @param lineNumber    the line number where the error occurred (1-based), or 0 if unknown
	 */
	public PatchFormatException(
		@Nonnull String message,
		@Nonnull String offendingLine,
		int lineNumber
	) {
		super(formatMessage(message, lineNumber));
		this.offendingLine = Objects.requireNonNull(offendingLine, "offendingLine must not be null");
		this.lineNumber = lineNumber;
	}

	/**
	 * Formats the exception message with line number context.
	 *
	 * @param message    the base error message
	 * @param lineNumber the line number
	 * @return formatted message
	 */
	@Nonnull
	private static String formatMessage(@Nonnull String message, int lineNumber) {
		if (lineNumber > 0) {
			return message + " at line " + lineNumber;
		}
		return message;
	}

	@Nonnull
	@Override
	public PatchErrorKind getKind() {
		return PatchErrorKind.FORMAT;
	}

	/**
	 * Returns the patch line that violates the format.
	 *
	 * @return the offending line, empty if the patch ended prematurely
	 */
	@Nonnull
	public String getOffendingLine() {
		return this.offendingLine;
	}

	/**
	 * Returns the line number where the format error occurred.
	 *
	 * @return line number (1-based), or 0 if unknown
	 */
	public int getLineNumber() {
		return this.lineNumber;
	}
}
