/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.tokenize;

import java.util.Locale;

import ca.mcgill.cs.freqlex.LanguageProfile;


/**
 * Chooses the {@link TokenizerAdapter} for a language.
 */
public final class Tokenizers {

    /**
     * The kinds of tokenizer that can be requested.
     */
    public enum Kind {

        /**
         * CoreNLP's tokenizer for the profile's tokenizer language.
         */
        CORENLP,

        /**
         * The language-independent {@link SimpleTokenizer}.
         */
        SIMPLE;

        /**
         * Returns the kind with the given case-insensitive name.
         *
         * @throws IllegalArgumentException if no kind has that name
         */
        public static Kind forName(String name) {
            try {
                return valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException iae) {
                throw new IllegalArgumentException(
                    "unknown tokenizer: " + name, iae);
            }
        }
    }

    private Tokenizers() { }

    /**
     * Returns the default (CoreNLP) tokenizer for the language.
     */
    public static TokenizerAdapter forLanguage(LanguageProfile language) {
        return forLanguage(language, Kind.CORENLP);
    }

    public static TokenizerAdapter forLanguage(LanguageProfile language,
                                               Kind kind) {
        switch (kind) {
        case CORENLP:
            return new CoreNlpTokenizer(language.getTokenizerLanguage());
        case SIMPLE:
            return new SimpleTokenizer();
        default:
            throw new IllegalArgumentException("unknown tokenizer: " + kind);
        }
    }
}
