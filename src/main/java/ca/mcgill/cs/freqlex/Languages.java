/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.util.Arrays;
import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;


/**
 * The registry of supported languages, keyed by ISO 639-3 code.  The table is
 * built once when the class is loaded and never changes afterwards.
 *
 * <p>BCP-47 tags follow the IANA language subtag registry.
 */
public final class Languages {

    /**
     * Every supported language, in code order.
     */
    private static final LanguageProfile[] PROFILES_ = new LanguageProfile[] {
        new LanguageProfile("cat", "Catalan", "ca", "abcdefghijlmnopqrstuvxyzàéèíïóòúüçkw", "-'0123456789"),
        new LanguageProfile("dan", "Danish", "da", "abcdefghijklmnopqrstuvwxyzæøå"),
        new LanguageProfile("deu", "German", "de", "abcdefghijklmnopqrstuvwxyzäéöüß", "-.'0123456789", "de"),
        new LanguageProfile("ell", "Greek", "el", "αβγδεζηθικλμνξοπρσςτυφχψω", ","),
        new LanguageProfile("eng", "English", "en", "abcdefghijklmnopqrstuvwxyz", "-.'0123456789"),
        new LanguageProfile("epo", "Esperanto", "eo", "abcĉdefgĝhĥijĵklmnoprsŝtuŭvz", "-0123456789"),
        new LanguageProfile("fin", "Finnish", "fi", "abcdefghijklmnopqrstuvwxyzåäöšž"),
        new LanguageProfile("fra", "French", "fr", "abcdefghijklmnopqrstuvwxyzàâæçéèêëîïôœùûüÿ", "", "fr"),
        new LanguageProfile("hrv", "Croatian", "hr", "abcčćdđefghijklmnoprsštuvzž"),
        new LanguageProfile("ita", "Italian", "it", "abcdefghilmnopqrstuvzàèéìíîòóùú"),
        new LanguageProfile("lit", "Lithuanian", "lt", "aąbcčdeęėfghiįyjklmnoprsštuųūvzž"),
        new LanguageProfile("mkd", "Macedonian", "mk", "абвгдѓежзѕијклљмнњопрстќуфхцчџшѐѝč", "'"),
        new LanguageProfile("nld", "Dutch", "nl", "abcdefghijklmnopqrstuvwxyzĳäëïöüáéíóú"),
        new LanguageProfile("nob", "Norwegian Bokmål", "nb", "abcdefghijklmnopqrstuvwxyzæøå"),
        new LanguageProfile("pol", "Polish", "pl", "aąbcćdeęfghijklłmnńoópqrsśtuvwxyzźż"),
        new LanguageProfile("por", "Portuguese", "pt", "abcdefghijklmnopqrstuvwxyzáâãàçéêíóôõú"),
        new LanguageProfile("ron", "Romanian", "ro", "aăâbcdefghiîjklmnopqrsştţuvwxyz"),
        new LanguageProfile("rus", "Russian", "ru", "бвгджзклмнпрстфхцчшщаеёиоуыэюяйьъ"),
        // Space included because abbreviations like "EE. UU." are a single
        // token
        new LanguageProfile("spa", "Spanish", "es", "abcdefghijklmnñopqrstuvwxyzáéíóúü", "-.'0123456789 "),
        new LanguageProfile("swe", "Swedish", "sv", "abcdefghijklmnopqrstuvwxyzåäöáüè"),
        new LanguageProfile("tgl", "Tagalog", "tl", "abcdefghijklmnñopqrstuvwxyzáàâéèêëíìîóòôúùû'", "-.0123456789"),
        new LanguageProfile("tok", "toki pona", "tok", "aeijklmnopstuw"),
        new LanguageProfile("ukr", "Ukrainian", "uk", "абвгґдеєжзиіїйклмнопрстуфхцчшщьюя'"),
    };

    private static final ImmutableMap<String,LanguageProfile> LANGUAGES =
        Maps.uniqueIndex(Arrays.asList(PROFILES_), LanguageProfile::getCode);

    private Languages() { }

    /**
     * Returns the profile for the ISO 639-3 code.
     *
     * @throws UnknownLanguageException if no language has that code
     */
    public static LanguageProfile forCode(String code) {
        LanguageProfile profile = LANGUAGES.get(code);
        if (profile == null)
            throw new UnknownLanguageException(code);
        return profile;
    }

    public static boolean isSupported(String code) {
        return LANGUAGES.containsKey(code);
    }

    /**
     * Returns the supported codes in registration (alphabetical) order.
     */
    public static Set<String> codes() {
        return LANGUAGES.keySet();
    }

    public static Collection<LanguageProfile> all() {
        return LANGUAGES.values();
    }
}
