/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;


public class LanguageProfileTest {

    private final LanguageProfile abc =
        new LanguageProfile("xxx", "Test", "xx", "abc", "-");

    @Test
    public void wordsStartWithAlphabetCharacter() {
        assertTrue(abc.isWord("abc"));
        assertTrue(abc.isWord("a-b"));
        assertTrue(abc.isWord("c"));
        assertFalse(abc.isWord("-ab"));
        assertFalse(abc.isWord("abd"));
    }

    @Test
    public void emptyAndNullAreNotWords() {
        assertFalse(abc.isWord(""));
        assertFalse(abc.isWord(null));
    }

    @Test
    public void symbolsAloneAreNotWords() {
        assertFalse(abc.isWord("-"));
        assertFalse(abc.isWord("--"));
    }

    @Test
    public void supplementaryCodePointsAreSingleCharacters() {
        // U+1D400 is outside the basic multilingual plane
        LanguageProfile math = new LanguageProfile(
            "mth", "Math", "x-math", "𝐀b", "");
        assertTrue(math.isWord("𝐀b"));
        assertTrue(math.isAlphabetic(0x1D400));
        assertFalse(math.isWord("\uD835b"));
        assertEquals(2, math.alphabetSize());
    }

    @Test
    public void spanishAbbreviationsKeepTheirSpace() {
        LanguageProfile spanish = Languages.forCode("spa");
        assertTrue(spanish.isWord("EE. UU.".toLowerCase()));
        assertFalse(spanish.isWord(" ee."));
    }

    @Test
    public void validityIsCaseSensitive() {
        LanguageProfile english = Languages.forCode("eng");
        assertTrue(english.isWord("hello"));
        assertFalse(english.isWord("Hello"));
    }

    @Test
    public void emptyAlphabetIsRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new LanguageProfile("nil", "Nothing", "x", ""));
    }

    @Test
    public void profilesAreEqualByCode() {
        LanguageProfile other =
            new LanguageProfile("xxx", "Other", "yy", "xyz");
        assertEquals(abc, other);
        assertEquals(abc.hashCode(), other.hashCode());
        assertEquals("Test (xxx)", abc.toString());
        assertEquals(LanguageProfile.DEFAULT_TOKENIZER_LANGUAGE,
                     abc.getTokenizerLanguage());
    }
}
