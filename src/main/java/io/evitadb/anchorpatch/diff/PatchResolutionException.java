package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown when a well-formed patch does not apply to the given text.
 * Typically occurs when the context of a section cannot be found, or when resolved
 * edits overlap or fall outside the text.
 */
public final class PatchResolutionException extends PatchException {

	private static final int MAX_CONTEXT_LENGTH = 200;

	private final int sectionIndex;
	@Nullable
	private final String expectedContext;

	/**
	 * Creates a new PatchResolutionException.
	 *
	 * @param message         the error message describing the failure
	 * @param sectionIndex    the index of the failed section or chunk (0-based)
	 * @param expectedContext the context the section expected to find, may be null
	 */
	public PatchResolutionException(
		@Nonnull String message,
		int sectionIndex,
		@Nullable String expectedContext
	) {
		super(formatMessage(message, sectionIndex, expectedContext));
		this.sectionIndex = sectionIndex;
		this.expectedContext = expectedContext;
	}

	@Nonnull
	private static String formatMessage(
		@Nonnull String message,
		int sectionIndex,
		@Nullable String expectedContext
	) {
		final StringBuilder sb = new StringBuilder(message);
		sb.append(" (section ").append(sectionIndex + 1).append(")");

		if (expectedContext != null && !expectedContext.isEmpty()) {
			sb.append("\nExpected:\n").append(truncate(expectedContext));
		}

		return sb.toString();
	}

	@Nonnull
	private static String truncate(@Nonnull String s) {
		if (s.length() <= MAX_CONTEXT_LENGTH) {
			return s;
		}
		return s.substring(0, MAX_CONTEXT_LENGTH - 3) + "...";
	}

	@Nonnull
	@Override
	public PatchErrorKind getKind() {
		return PatchErrorKind.RESOLUTION;
	}

	/**
	 * Returns the index of the section (or chunk) that failed to apply.
	 *
	 * @return section index (0-based)
	 */
	public int getSectionIndex() {
		return this.sectionIndex;
	}

	/**
	 * Returns the context lines the section expected, joined with newlines.
	 *
	 * @return expected context, or null when the failure is not a context mismatch
	 */
	@Nullable
	public String getExpectedContext() {
		return this.expectedContext;
	}
}
