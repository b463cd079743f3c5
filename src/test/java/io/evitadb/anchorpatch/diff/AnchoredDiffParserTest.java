package io.evitadb.anchorpatch.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnchoredDiffParser should split patches into sections")
public class AnchoredDiffParserTest {

	private AnchoredDiffParser parser;

	@BeforeEach
	void setUp() {
		this.parser = new AnchoredDiffParser();
	}

	@Test
	@DisplayName("parses a single hunk with a hint")
	void shouldParseHunkWithHint() throws Exception {
		final String diff = """
			@@ def greet():
			-    print("hi")
			+    print("hello")
			""";

		final ParsedDiff result = this.parser.parse(diff);

		assertEquals(1, result.sectionCount());
		final Section section = result.sections().get(0);
		assertEquals("def greet():", section.hint());
		assertEquals(List.of("    print(\"hi\")"), section.deleteLines());
		assertEquals(List.of("    print(\"hello\")"), section.insertLines());
	}

	@Test
	@DisplayName("parses a bare marker without a hint")
	void shouldParseBareMarker() throws Exception {
		final ParsedDiff result = this.parser.parse("@@\n+hello\n+world");

		assertEquals(1, result.sectionCount());
		assertNull(result.sections().get(0).hint());
		assertEquals(2, result.linesAdded());
	}

	@Test
	@DisplayName("allows the first hunk to omit its marker")
	void shouldAllowFirstHunkWithoutMarker() throws Exception {
		final ParsedDiff result = this.parser.parse("-a\n+b\n");

		assertEquals(1, result.sectionCount());
		assertEquals(1, result.linesAdded());
		assertEquals(1, result.linesRemoved());
	}

	@Test
	@DisplayName("keeps numeric unified-diff ranges as an opaque hint")
	void shouldKeepNumericRangesAsHint() throws Exception {
		final ParsedDiff result = this.parser.parse("@@ -1,2 +1,2 @@\n x\n-two\n+2");

		assertEquals("-1,2 +1,2 @@", result.sections().get(0).hint());
		assertEquals(List.of("x"), result.sections().get(0).leadingContext());
	}

	@Test
	@DisplayName("parses multiple hunks")
	void shouldParseMultipleHunks() throws Exception {
		final String diff = """
			@@ first
			-a
			+A
			@@ second
			-b
			+B
			 c
			""";

		final ParsedDiff result = this.parser.parse(diff);

		assertEquals(2, result.sectionCount());
		assertEquals("first", result.sections().get(0).hint());
		assertEquals("second", result.sections().get(1).hint());
		assertEquals(List.of("c"), result.sections().get(1).trailingContext());
	}

	@Test
	@DisplayName("continues a hunk into a further section without a marker")
	void shouldContinueHunkIntoFurtherSection() throws Exception {
		final ParsedDiff result = this.parser.parse(" a\n-b\n c\n-d\n e\n");

		assertEquals(2, result.sectionCount());
		assertEquals(List.of("c"), result.sections().get(1).leadingContext());
		assertNull(result.sections().get(1).hint());
	}

	@Test
	@DisplayName("requires a marker after an end-of-file section")
	void shouldRequireMarkerAfterEofSection() {
		final PatchFormatException exception = assertThrows(
			PatchFormatException.class,
			() -> this.parser.parse("-a\n+A\n*** End of File\n-b\n")
		);

		assertTrue(exception.getMessage().contains("Expected hunk marker"));
		assertEquals(4, exception.getLineNumber());
	}

	@Test
	@DisplayName("stops at the patch terminator")
	void shouldStopAtEndPatch() throws Exception {
		final ParsedDiff result = this.parser.parse("@@\n+a\n*** End Patch\ngarbage\n");

		assertEquals(1, result.sectionCount());
	}

	@Test
	@DisplayName("rejects a marker with no section after it")
	void shouldRejectEmptyHunk() {
		final PatchFormatException exception = assertThrows(
			PatchFormatException.class,
			() -> this.parser.parse("@@\n")
		);

		assertEquals(2, exception.getLineNumber());
	}

	@Test
	@DisplayName("handles empty patch gracefully")
	void shouldHandleEmptyDiff() throws Exception {
		assertEquals(0, this.parser.parse("").sectionCount());
	}
}
