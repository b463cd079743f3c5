package io.evitadb.anchorpatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Writer should write patched text as UTF-8")
public class WriterTest {

	@Test
	@DisplayName("shouldWriteToFileAndCreateParents")
	public void shouldWriteToFileAndCreateParents() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-out-");
		final Path target = tempDir.resolve("a/b/c.md");

		new Writer().write("# Header\nŽluťoučký kůň\n", target);

		assertEquals("# Header\nŽluťoučký kůň\n", Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("shouldOverwriteExistingFileWhenPresent")
	public void shouldOverwriteExistingFileWhenPresent() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-over-");
		final Path target = tempDir.resolve("x/y.md");
		Files.createDirectories(target.getParent());
		Files.writeString(target, "OLD", StandardCharsets.UTF_8);

		new Writer().write("NEW\n", target);

		assertEquals("NEW\n", Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("shouldRejectNullContent")
	public void shouldRejectNullContent() throws IOException {
		final Path target = Files.createTempDirectory("writer-null-").resolve("z.md");

		assertThrows(NullPointerException.class, () -> new Writer().write(null, target));
	}
}
