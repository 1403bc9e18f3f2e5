package org.fuzzdex.core.text;

import java.util.Arrays;
import java.util.Optional;

/**
 * Case-insensitive subsequence matcher in the style of editor "go to anything" pickers.
 *
 * <p>Every non-whitespace character of the query must occur in the haystack, in order. Among all
 * such alignments the best one is chosen by dynamic programming over (query char, haystack position):
 * <ul>
 *   <li>{@value #BONUS_WORD_START} for a character that starts a word,</li>
 *   <li>{@value #BONUS_CONSECUTIVE} for a character right after the previously matched one,</li>
 *   <li>minus {@value #PENALTY_DISTANCE} per haystack character skipped between two matched ones.</li>
 * </ul>
 * A coverage bonus of {@value #BONUS_COVERAGE} scaled by matched/haystack length is added last.</p>
 */
public final class SubsequenceFuzzyMatcher implements FuzzyMatcher {

	static final int BONUS_WORD_START = 72;
	static final int BONUS_CONSECUTIVE = 8;
	static final int BONUS_COVERAGE = 64;
	static final int PENALTY_DISTANCE = 4;

	private static final int NONE = Integer.MIN_VALUE / 2;

	@Override
	public Optional<FuzzyMatch> bestMatch(String query, String haystack) {
		if (query == null || haystack == null) {
			return Optional.empty();
		}

		char[] pattern = lowerWithoutWhitespace(query);
		char[] original = haystack.toCharArray();
		char[] target = new char[original.length];
		for (int i = 0; i < original.length; i++) {
			target[i] = Character.toLowerCase(original[i]);
		}

		int m = pattern.length;
		int n = target.length;
		if (m == 0 || n == 0 || m > n) {
			return Optional.empty();
		}

		int[] prev = new int[n];
		Arrays.fill(prev, NONE);
		for (int j = 0; j < n; j++) {
			if (target[j] == pattern[0]) {
				prev[j] = positionBonus(original, j);
			}
		}

		for (int i = 1; i < m; i++) {
			int[] cur = new int[n];
			Arrays.fill(cur, NONE);
			// best of prev[k] + PENALTY * k over k <= j - 2, so the gap penalty stays linear
			int bestGapped = NONE;
			for (int j = i; j < n; j++) {
				int k = j - 2;
				if (k >= 0 && prev[k] != NONE) {
					bestGapped = Math.max(bestGapped, prev[k] + PENALTY_DISTANCE * k);
				}
				if (target[j] != pattern[i]) {
					continue;
				}
				int score = NONE;
				if (prev[j - 1] != NONE) {
					score = prev[j - 1] + BONUS_CONSECUTIVE;
				}
				if (bestGapped != NONE) {
					score = Math.max(score, bestGapped - PENALTY_DISTANCE * (j - 1));
				}
				if (score != NONE) {
					cur[j] = score + positionBonus(original, j);
				}
			}
			prev = cur;
		}

		int best = NONE;
		for (int score : prev) {
			best = Math.max(best, score);
		}
		if (best == NONE) {
			return Optional.empty();
		}

		return Optional.of(new FuzzyMatch(best + BONUS_COVERAGE * m / n, m));
	}

	private static int positionBonus(char[] text, int pos) {
		if (pos == 0) {
			return BONUS_WORD_START;
		}
		char before = text[pos - 1];
		char at = text[pos];
		if (!Character.isLetterOrDigit(before) && Character.isLetterOrDigit(at)) {
			return BONUS_WORD_START;
		}
		if (Character.isLowerCase(before) && Character.isUpperCase(at)) {
			return BONUS_WORD_START;
		}
		return 0;
	}

	private static char[] lowerWithoutWhitespace(String query) {
		StringBuilder sb = new StringBuilder(query.length());
		for (int i = 0; i < query.length(); i++) {
			char c = query.charAt(i);
			if (!Character.isWhitespace(c)) {
				sb.append(Character.toLowerCase(c));
			}
		}
		return sb.toString().toCharArray();
	}
}
