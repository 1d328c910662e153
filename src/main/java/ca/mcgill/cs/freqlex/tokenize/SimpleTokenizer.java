/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.tokenize;

import java.util.ArrayList;
import java.util.List;

import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * A rule-based {@link TokenizerAdapter} for languages without a dedicated
 * tokenizer.  A run of letters and digits is one token, and may contain an
 * apostrophe, hyphen or period that is followed by another letter or digit
 * (e.g., {@code don't}, {@code well-known}, {@code U.S}).  Every other
 * non-space character is a token of its own.
 */
public class SimpleTokenizer implements TokenizerAdapter {

    private static final Pattern TOKEN = Pattern.compile(
        "[\\p{L}\\p{M}\\p{N}]+(?:['’\\-.][\\p{L}\\p{M}\\p{N}]+)*|\\S",
        Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * {@inheritDoc}
     */
    @Override public List<String> tokenize(String sentence) {
        List<String> pieces = new ArrayList<String>();
        Matcher m = TOKEN.matcher(sentence);
        int end = 0;
        while (m.find()) {
            if (m.start() > end)
                pieces.add(sentence.substring(end, m.start()));
            pieces.add(m.group());
            end = m.end();
        }
        if (end < sentence.length())
            pieces.add(sentence.substring(end));
        return pieces;
    }

    @Override public String toString() {
        return "simple tokenizer";
    }
}
