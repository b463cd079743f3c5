package io.evitadb.anchorpatch.diff;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Represents a single classified line of a patch section.
 * Each directive has a type (context, deletion, or insertion) and its content.
 *
 * @param type    the directive kind
 * @param content the line content without the prefix character
 */
public record Directive(
	@Nonnull DirectiveType type,
	@Nonnull String content
) {

	public Directive {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * Creates a context directive.
	 *
	 * @param content the line content
	 * @return a new context Directive
	 */
	@Nonnull
	public static Directive context(@Nonnull String content) {
		return new Directive(DirectiveType.CONTEXT, content);
	}
}
