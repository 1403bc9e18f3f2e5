package org.fuzzdex.core.text;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SubsequenceFuzzyMatcherTest {

	private final SubsequenceFuzzyMatcher matcher = new SubsequenceFuzzyMatcher();

	@Test
	public void testContiguousWordMatch() {
		Optional<FuzzyMatch> match = matcher.bestMatch("fox", "red fox ");

		assertTrue(match.isPresent());
		// word start + two consecutive chars + coverage 64 * 3 / 8
		assertEquals(72 + 8 + 8 + 24, match.get().score());
		assertEquals(3, match.get().matchedChars());
	}

	@Test
	public void testNoMatchWhenCharactersMissing() {
		assertTrue(matcher.bestMatch("xyz", "red fox").isEmpty());
	}

	@Test
	public void testCharactersMustAppearInOrder() {
		assertTrue(matcher.bestMatch("fox red", "red fox").isEmpty());
	}

	@Test
	public void testCaseInsensitiveAndWhitespaceIgnored() {
		assertTrue(matcher.bestMatch("FOX", "red fox").isPresent());
		assertTrue(matcher.bestMatch("red fox", "redfox").isPresent());
	}

	@Test
	public void testWordStartBeatsMidWordMatch() {
		int wordStart = matcher.bestMatch("fox", "the fox").orElseThrow().score();
		int midWord = matcher.bestMatch("fox", "firefox").orElseThrow().score();

		assertTrue(wordStart > midWord, wordStart + " should exceed " + midWord);
	}

	@Test
	public void testDegenerateInputs() {
		assertTrue(matcher.bestMatch("   ", "red fox").isEmpty());
		assertTrue(matcher.bestMatch("fox", "").isEmpty());
		assertTrue(matcher.bestMatch("foxes", "fox").isEmpty());
		assertTrue(matcher.bestMatch(null, "fox").isEmpty());
	}
}
