package io.evitadb.anchorpatch;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writer outputs patched text to a target file as UTF-8.
 */
public final class Writer {

	/**
	 * Writes the content to the target file, ensuring that the file's parent directory
	 * structure exists. An existing file is overwritten.
	 *
	 * @param content    the text to be written; must not be null
	 * @param targetFile the path to the target file; must not be null
	 * @throws IOException          if an I/O error occurs while creating directories or writing the file
	 * @throws NullPointerException if the content or targetFile parameter is null
	 */
	public void write(
		@Nonnull final String content,
		@Nonnull final Path targetFile
	) throws IOException {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		Files.write(absolute, content.getBytes(StandardCharsets.UTF_8));
	}
}
