/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;


/**
 * The character inventory of a language and the heuristic rule that decides
 * whether a token is one of its words.  A token is a word if it is non-empty,
 * starts with a letter of the {@link #isAlphabetic(int) alphabet}, and
 * consists only of alphabet letters and the language's {@link
 * #isSymbol(int) symbols}.  Characters are compared as Unicode code points
 * and case-sensitively.
 */
public class LanguageProfile {

    /**
     * The CoreNLP tokenizer language used when a profile does not name one.
     */
    public static final String DEFAULT_TOKENIZER_LANGUAGE = "en";

    private final String code;

    private final String name;

    private final String bcp47;

    private final TIntSet alphabet;

    private final TIntSet symbols;

    private final String tokenizerLanguage;

    public LanguageProfile(String code, String name, String bcp47,
                           String alphabet) {
        this(code, name, bcp47, alphabet, "", DEFAULT_TOKENIZER_LANGUAGE);
    }

    public LanguageProfile(String code, String name, String bcp47,
                           String alphabet, String symbols) {
        this(code, name, bcp47, alphabet, symbols,
             DEFAULT_TOKENIZER_LANGUAGE);
    }

    /**
     * Creates a profile.
     *
     * @param code the ISO 639-3 code
     * @param name the display name
     * @param bcp47 the BCP-47 tag, e.g. for an HTML {@code lang} attribute
     * @param alphabet every character that may start a word
     * @param symbols the characters allowed inside, but not at the start of,
     *        a word
     * @param tokenizerLanguage the CoreNLP {@code tokenize.language} used for
     *        this language
     */
    public LanguageProfile(String code, String name, String bcp47,
                           String alphabet, String symbols,
                           String tokenizerLanguage) {
        if (alphabet.isEmpty())
            throw new IllegalArgumentException(
                "empty alphabet for language " + code);
        this.code = code;
        this.name = name;
        this.bcp47 = bcp47;
        this.alphabet = toCodePoints(alphabet);
        this.symbols = toCodePoints(symbols);
        this.tokenizerLanguage = tokenizerLanguage;
    }

    private static TIntSet toCodePoints(String chars) {
        TIntSet set = new TIntHashSet(chars.length());
        chars.codePoints().forEach(set::add);
        return set;
    }

    /**
     * Returns {@code true} if the token is a word of this language.
     */
    public boolean isWord(String token) {
        if (token == null || token.isEmpty())
            return false;
        if (!alphabet.contains(token.codePointAt(0)))
            return false;
        return token.codePoints()
            .allMatch(c -> alphabet.contains(c) || symbols.contains(c));
    }

    public boolean isAlphabetic(int codePoint) {
        return alphabet.contains(codePoint);
    }

    public boolean isSymbol(int codePoint) {
        return symbols.contains(codePoint);
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getBcp47() {
        return bcp47;
    }

    public String getTokenizerLanguage() {
        return tokenizerLanguage;
    }

    public int alphabetSize() {
        return alphabet.size();
    }

    @Override public boolean equals(Object o) {
        if (o instanceof LanguageProfile) {
            LanguageProfile p = (LanguageProfile)o;
            return code.equals(p.code);
        }
        return false;
    }

    @Override public int hashCode() {
        return code.hashCode();
    }

    @Override public String toString() {
        return name + " (" + code + ")";
    }
}
