/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.tokenize;

import java.util.List;


/**
 * A language-specific function that splits a sentence into tokens.
 *
 * <p>Implementations return tokens interleaved with the whitespace that
 * separates them, in sentence order, such that concatenating the returned
 * pieces reproduces the input exactly.  Empty whitespace pieces are left out
 * rather than returned as empty strings.
 */
public interface TokenizerAdapter {

    /**
     * Splits the sentence into token and whitespace pieces.
     */
    List<String> tokenize(String sentence);
}
