package io.evitadb.anchorpatch.tool;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Structured outcome of one patch tool invocation, reported back to the caller.
 *
 * @param status whether the operation completed
 * @param output human-readable summary or failure reason
 */
public record ApplyPatchResult(
	@Nonnull Status status,
	@Nonnull String output
) {

	public ApplyPatchResult {
		Objects.requireNonNull(status, "status must not be null");
		Objects.requireNonNull(output, "output must not be null");
	}

	@Nonnull
	public static ApplyPatchResult completed(@Nonnull String output) {
		return new ApplyPatchResult(Status.COMPLETED, output);
	}

	@Nonnull
	public static ApplyPatchResult failed(@Nonnull String output) {
		return new ApplyPatchResult(Status.FAILED, output);
	}

	public boolean isSuccess() {
		return this.status == Status.COMPLETED;
	}

	/**
	 * Status of a tool invocation.
	 */
	public enum Status {
		COMPLETED,
		FAILED
	}
}
