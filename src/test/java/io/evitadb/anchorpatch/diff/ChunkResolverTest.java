package io.evitadb.anchorpatch.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChunkResolver should position sections in the original")
public class ChunkResolverTest {

	private ChunkResolver resolver;
	private AnchoredDiffParser parser;

	@BeforeEach
	void setUp() {
		this.resolver = new ChunkResolver();
		this.parser = new AnchoredDiffParser();
	}

	@Test
	@DisplayName("resolves sections to increasing, non-overlapping chunks")
	void shouldResolveMonotonically() throws Exception {
		final List<String> original = List.of("x", "y", "x", "y");
		final ParsedDiff diff = this.parser.parse("@@\n x\n-y\n+Y1\n@@\n x\n-y\n+Y2\n");

		final ChunkResolver.Resolution resolution = this.resolver.resolve(original, diff.sections());

		assertEquals(2, resolution.chunks().size());
		assertEquals(1, resolution.chunks().get(0).originIndex());
		assertEquals(3, resolution.chunks().get(1).originIndex());
		assertTrue(resolution.chunks().get(0).endIndex() <= resolution.chunks().get(1).originIndex());
		assertEquals(0, resolution.fuzz());
	}

	@Test
	@DisplayName("never re-matches text consumed by an earlier section")
	void shouldNotRematchConsumedText() throws Exception {
		final List<String> original = List.of("a", "b");
		final ParsedDiff diff = this.parser.parse("@@\n-a\n+A\n@@\n-a\n+A2\n");

		final PatchResolutionException exception = assertThrows(
			PatchResolutionException.class,
			() -> this.resolver.resolve(original, diff.sections())
		);

		assertEquals(1, exception.getSectionIndex());
		assertEquals("a", exception.getExpectedContext());
	}

	@Test
	@DisplayName("accumulates fuzz of all sections")
	void shouldAccumulateFuzz() throws Exception {
		final List<String> original = List.of("  a", "  b");
		final ParsedDiff diff = this.parser.parse("@@\n-a\n+A\n@@\n-b\n+B\n");

		final ChunkResolver.Resolution resolution = this.resolver.resolve(original, diff.sections());

		assertEquals(200, resolution.fuzz());
	}

	@Test
	@DisplayName("uses the hint as an extra leading context line")
	void shouldUseHintAsLeadingContext() throws Exception {
		final List<String> original = List.of("def a():", "    pass", "def b():", "    pass");
		final ParsedDiff diff = this.parser.parse("@@ def b():\n-    pass\n+    return 1\n");

		final ChunkResolver.Resolution resolution = this.resolver.resolve(original, diff.sections());

		assertEquals(3, resolution.chunks().get(0).originIndex());
	}

	@Test
	@DisplayName("uses a non-adjacent hint as the scope the section must follow")
	void shouldUseHintAsScope() throws Exception {
		final List<String> original = List.of(
			"class A {", "  y = 2;", "}", "class B {", "  x = 1;", "  y = 2;", "}"
		);
		final ParsedDiff diff = this.parser.parse("@@ class B {\n-  y = 2;\n+  y = 3;\n");

		final ChunkResolver.Resolution resolution = this.resolver.resolve(original, diff.sections());

		assertEquals(5, resolution.chunks().get(0).originIndex());
	}

	@Test
	@DisplayName("ignores a hint that matches nothing")
	void shouldIgnoreUnmatchedHint() throws Exception {
		final List<String> original = List.of("one", "two");
		final ParsedDiff diff = this.parser.parse("@@ -1,2 +1,2 @@\n one\n-two\n+2\n");

		final ChunkResolver.Resolution resolution = this.resolver.resolve(original, diff.sections());

		assertEquals(1, resolution.chunks().get(0).originIndex());
		assertEquals(List.of("two"), resolution.chunks().get(0).deleteLines());
	}

	@Test
	@DisplayName("fails with a resolution error identifying the unmatched section")
	void shouldFailOnMissingContext() throws Exception {
		final List<String> original = List.of("one", "two");
		final ParsedDiff diff = this.parser.parse("@@ -1,2 +1,2 @@\n x\n-two\n+2\n");

		final PatchResolutionException exception = assertThrows(
			PatchResolutionException.class,
			() -> this.resolver.resolve(original, diff.sections())
		);

		assertEquals(PatchErrorKind.RESOLUTION, exception.getKind());
		assertEquals(0, exception.getSectionIndex());
		assertEquals("x\ntwo", exception.getExpectedContext());
		assertTrue(exception.getMessage().contains("Could not find context (section 1)"));
	}

	@Test
	@DisplayName("reports end-of-file sections distinctly")
	void shouldReportEofContext() throws Exception {
		final List<String> original = List.of("one", "two");
		final ParsedDiff diff = this.parser.parse("-three\n*** End of File\n");

		final PatchResolutionException exception = assertThrows(
			PatchResolutionException.class,
			() -> this.resolver.resolve(original, diff.sections())
		);

		assertTrue(exception.getMessage().startsWith("Could not find end-of-file context"));
	}

	@Test
	@DisplayName("anchors a hinted end-of-file insertion after its hint")
	void shouldAnchorHintedEofInsertionAfterHint() throws Exception {
		final List<String> original = List.of("foo", "bar", "baz");
		final ParsedDiff hinted = this.parser.parse("@@ foo\n+x\n*** End of File\n");
		final ParsedDiff plain = this.parser.parse("@@\n+x\n*** End of File\n");

		assertEquals(1, this.resolver.resolve(original, hinted.sections()).chunks().get(0).originIndex());
		assertEquals(3, this.resolver.resolve(original, plain.sections()).chunks().get(0).originIndex());
	}
}
