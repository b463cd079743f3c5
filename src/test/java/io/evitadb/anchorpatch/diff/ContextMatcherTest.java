package io.evitadb.anchorpatch.diff;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ContextMatcher should locate expected lines with tolerance")
public class ContextMatcherTest {

	private ContextMatcher matcher;

	@BeforeEach
	void setUp() {
		this.matcher = new ContextMatcher();
	}

	@Test
	@DisplayName("matches identical lines with zero fuzz")
	void shouldMatchExactly() {
		final ContextMatch match = this.matcher.findForward(List.of("a", "b", "c"), List.of("b", "c"), 0);

		assertEquals(new ContextMatch(1, 0), match);
	}

	@Test
	@DisplayName("matches lines differing in trailing whitespace")
	void shouldMatchTrailingWhitespace() {
		final ContextMatch match = this.matcher.findForward(List.of("line   "), List.of("line"), 0);

		assertEquals(0, match.position());
		assertEquals(MatchTier.TRAILING_WHITESPACE.fuzz(), match.fuzz());
	}

	@Test
	@DisplayName("matches lines differing in surrounding whitespace with fuzz 100")
	void shouldMatchStrippedLines() {
		final ContextMatch match = this.matcher.findForward(List.of(" line "), List.of("line"), 0);

		assertEquals(0, match.position());
		assertEquals(100, match.fuzz());
		assertTrue(match.isFound());
		assertTrue(match.fuzz() > 0 && match.fuzz() < ContextMatch.NOT_FOUND_FUZZ);
	}

	@Test
	@DisplayName("matches re-aligned lines on the internal whitespace tier")
	void shouldMatchCollapsedWhitespace() {
		final ContextMatch match = this.matcher.findForward(
			List.of("int   x  =  1;"), List.of("int x = 1;"), 0
		);

		assertEquals(0, match.position());
		assertEquals(MatchTier.INTERNAL_WHITESPACE.fuzz(), match.fuzz());
	}

	@Test
	@DisplayName("takes the first position that matches on any tier, not the cheapest one")
	void shouldPreferFirstAcceptableMatch() {
		final ContextMatch match = this.matcher.findForward(List.of("  foo", "foo"), List.of("foo"), 0);

		assertEquals(new ContextMatch(0, 100), match);
	}

	@Test
	@DisplayName("does not look before the start index")
	void shouldScanForwardOnly() {
		final ContextMatch match = this.matcher.findForward(List.of("x", "y", "x"), List.of("x"), 1);

		assertEquals(2, match.position());
	}

	@Test
	@DisplayName("reports not found with the sentinel fuzz")
	void shouldReportNotFound() {
		final ContextMatch match = this.matcher.find(List.of("one"), List.of("missing"), 0, false);

		assertFalse(match.isFound());
		assertEquals(ContextMatch.NOT_FOUND, match.position());
		assertTrue(match.fuzz() >= 10000);
	}

	@Test
	@DisplayName("reports not found after the end-of-file fallback fails")
	void shouldReportNotFoundAfterEofFallback() {
		final ContextMatch match = this.matcher.find(List.of("one"), List.of("missing"), 0, true);

		assertEquals(-1, match.position());
		assertTrue(match.fuzz() >= 10000);
	}

	@Test
	@DisplayName("anchors end-of-file context at the tail only when eof is honored")
	void shouldUseTailFallbackOnlyForEof() {
		final List<String> lines = List.of("a", "b", "c");
		final List<String> expected = List.of("b", "c");

		final ContextMatch withEof = this.matcher.find(lines, expected, 2, true);
		final ContextMatch withoutEof = this.matcher.find(lines, expected, 2, false);

		assertEquals(new ContextMatch(1, 0), withEof);
		assertFalse(withoutEof.isFound());
	}

	@Test
	@DisplayName("applies whitespace tiers to the tail fallback as well")
	void shouldApplyTiersToTail() {
		final ContextMatch match = this.matcher.find(List.of("a", "  end  "), List.of("end"), 2, true);

		assertEquals(new ContextMatch(1, 100), match);
	}

	@Test
	@DisplayName("matches empty expected lines at the start, or at the end for eof")
	void shouldPlaceEmptyExpectation() {
		final List<String> lines = List.of("a", "b");

		assertEquals(new ContextMatch(1, 0), this.matcher.find(lines, List.of(), 1, false));
		assertEquals(new ContextMatch(2, 0), this.matcher.find(lines, List.of(), 0, true));
	}

	@Test
	@DisplayName("never matches a window longer than the text")
	void shouldNotMatchLongerWindow() {
		assertFalse(this.matcher.find(List.of("a"), List.of("a", "b"), 0, true).isFound());
	}
}
