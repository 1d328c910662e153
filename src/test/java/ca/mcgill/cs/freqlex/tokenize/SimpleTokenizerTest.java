/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.tokenize;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;


public class SimpleTokenizerTest {

    private final SimpleTokenizer tokenizer = new SimpleTokenizer();

    @Test
    public void splitsWordsPunctuationAndWhitespace() {
        assertEquals(Arrays.asList("Hello", " ", "world", "."),
                     tokenizer.tokenize("Hello world."));
    }

    @Test
    public void keepsInternalApostrophesAndHyphens() {
        assertEquals(Arrays.asList("l'homme", " ", "au", " ", "porte-monnaie"),
                     tokenizer.tokenize("l'homme au porte-monnaie"));
    }

    @Test
    public void piecesReconstructTheSentence() {
        String[] sentences = { "  padded  ", "Tom's 3.5 kg!", "a\tb",
                               "Как дела?", "" };
        for (String s : sentences)
            assertEquals(s, String.join("", tokenizer.tokenize(s)));
    }

    @Test
    public void emptySentenceHasNoPieces() {
        List<String> pieces = tokenizer.tokenize("");
        assertTrue(pieces.isEmpty());
    }
}
