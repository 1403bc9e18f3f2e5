package org.fuzzdex.core.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowercasing tokenizer producing words as runs of letters and digits, and grams as the fixed-size
 * character windows of each word. A word no longer than the window is its own single gram.
 */
public final class NGramTokenizer implements Tokenizer {

	public static final int DEFAULT_GRAM_SIZE = 3;

	private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");

	private final int gramSize;

	public NGramTokenizer() {
		this(DEFAULT_GRAM_SIZE);
	}

	public NGramTokenizer(int gramSize) {
		if (gramSize < 1) {
			throw new IllegalArgumentException("gram size must be positive: " + gramSize);
		}
		this.gramSize = gramSize;
	}

	public int getGramSize() {
		return gramSize;
	}

	@Override
	public List<String> words(String text) {
		if (text == null || text.isBlank()) return List.of();

		String lower = text.toLowerCase(Locale.ROOT);

		List<String> out = new ArrayList<>();
		Matcher m = WORD.matcher(lower);
		while (m.find()) {
			out.add(m.group());
		}
		return out;
	}

	@Override
	public List<String> grams(String text) {
		List<String> out = new ArrayList<>();
		for (String word : words(text)) {
			if (word.length() <= gramSize) {
				out.add(word);
				continue;
			}
			for (int i = 0; i + gramSize <= word.length(); i++) {
				out.add(word.substring(i, i + gramSize));
			}
		}
		return out;
	}
}
