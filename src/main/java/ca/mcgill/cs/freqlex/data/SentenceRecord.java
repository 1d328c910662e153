/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.data;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import org.json.JSONArray;


/**
 * One sentence of a corpus together with its tokenization.  The token list
 * alternates tokens and the whitespace that followed them, so joining the
 * list gives back the sentence text.  Two records are equal when their text
 * is equal, regardless of identifier or tokens.
 */
public final class SentenceRecord {

    private final Long id;

    private final String text;

    private final List<String> tokens;

    /**
     * Creates a record.
     *
     * @param id the identifier of the sentence in its sentence bank, or
     *        {@code null} if the corpus has none
     * @param text the cleaned sentence
     * @param tokens the token and whitespace pieces of {@code text}
     */
    public SentenceRecord(Long id, String text, List<String> tokens) {
        if (text == null)
            throw new NullPointerException("text");
        this.id = id;
        this.text = text;
        this.tokens = ImmutableList.copyOf(tokens);
    }

    /**
     * Returns {@code true} if the piece is inter-token whitespace (or empty)
     * rather than a token.
     */
    public static boolean isWhitespace(String piece) {
        return CharMatcher.whitespace().matchesAllOf(piece);
    }

    public boolean hasId() {
        return id != null;
    }

    /**
     * Returns the identifier, or {@code null} if the sentence has none.
     */
    public Long getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    /**
     * Returns every piece produced by the tokenizer, whitespace included.
     */
    public List<String> getTokens() {
        return tokens;
    }

    /**
     * Returns the pieces that are tokens, in sentence order.
     */
    public List<String> words() {
        List<String> words = new ArrayList<String>(tokens.size());
        for (String piece : tokens) {
            if (!isWhitespace(piece))
                words.add(piece);
        }
        return words;
    }

    /**
     * Returns the token list as a JSON array of strings.
     */
    public String tokensAsJson() {
        return new JSONArray(tokens).toString();
    }

    /**
     * Returns the fields of this sentence's row in the sentence table: the
     * identifier (when present), the text and the JSON-encoded tokens.
     */
    public List<Object> row() {
        return (id == null)
            ? ImmutableList.<Object>of(text, tokensAsJson())
            : ImmutableList.<Object>of(id, text, tokensAsJson());
    }

    @Override public boolean equals(Object o) {
        if (o instanceof SentenceRecord) {
            SentenceRecord r = (SentenceRecord)o;
            return text.equals(r.text);
        }
        return false;
    }

    @Override public int hashCode() {
        return text.hashCode();
    }

    @Override public String toString() {
        return (id == null) ? text : id + ": " + text;
    }
}
