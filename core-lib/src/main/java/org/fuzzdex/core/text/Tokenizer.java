package org.fuzzdex.core.text;

import java.util.List;

/**
 * Splits a text blob into the two token kinds the index works with.
 */
public interface Tokenizer {
	/**
	 * Substring-derived tokens used for partial matching. Duplicates are kept.
	 */
	List<String> grams(String text);

	/**
	 * Normalized whole-word tokens used for exact term matching. Duplicates are kept.
	 */
	List<String> words(String text);
}
