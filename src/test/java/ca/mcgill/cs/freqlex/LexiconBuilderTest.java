/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.IOException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ca.mcgill.cs.freqlex.data.LexiconEntry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;


public class LexiconBuilderTest {

    private final LanguageProfile abc =
        new LanguageProfile("xxx", "Test", "xx", "abc", "-");

    @TempDir
    Path dir;

    @Test
    public void frequencyClassHalvesPerStep() {
        assertEquals(0, LexiconBuilder.frequencyClass(10, 10));
        assertEquals(1, LexiconBuilder.frequencyClass(5, 10));
        assertEquals(2, LexiconBuilder.frequencyClass(1, 4));
        assertEquals(0, LexiconBuilder.frequencyClass(3, 4));
        assertEquals(3, LexiconBuilder.frequencyClass(1, 10));
        assertEquals(13, LexiconBuilder.frequencyClass(1, 10000));
    }

    @Test
    public void wordsAreRankedWithClasses() {
        FrequencyCounter counter = new FrequencyCounter();
        counter.count("a", 10);
        counter.count("b", 5);
        counter.count("c", 10);

        Lexicon lexicon = new LexiconBuilder(abc).build(counter);
        assertEquals(Arrays.asList(new LexiconEntry("a", 10, 0),
                                   new LexiconEntry("c", 10, 0),
                                   new LexiconEntry("b", 5, 1)),
                     lexicon.getEntries());
        assertEquals(10, lexicon.getMaxCount());
        assertTrue(lexicon.getRejected().isEmpty());
    }

    @Test
    public void singleWordHasClassZero() {
        FrequencyCounter counter = new FrequencyCounter();
        counter.count("abc", 7);
        Lexicon lexicon = new LexiconBuilder(abc).build(counter);
        assertEquals(1, lexicon.size());
        assertEquals(0, lexicon.getEntries().get(0).getFrequencyClass());
    }

    @Test
    public void nonWordsAreRemovedMostFrequentFirst() {
        FrequencyCounter counter = new FrequencyCounter();
        counter.count("x", 3);
        counter.count("a", 2);
        counter.count("-", 5);
        counter.count("b", 1);

        Lexicon lexicon = new LexiconBuilder(abc).build(counter);
        assertEquals(Arrays.asList("-", "x"), lexicon.getRejected());
        assertFalse(counter.contains("x"));
        // The maximum is taken over words only
        assertEquals(2, lexicon.getMaxCount());
        assertEquals(1, lexicon.getEntries().get(1).getFrequencyClass());
    }

    @Test
    public void noWordsLeftIsAnError() throws IOException {
        FrequencyCounter counter = new FrequencyCounter();
        counter.count("xyz", 2);
        counter.count("!", 1);
        Path words = dir.resolve("words.csv");
        Path nonWords = dir.resolve("nonwords.txt");

        assertThrows(EmptyLexiconException.class,
                     () -> new LexiconBuilder(abc).build(counter, words,
                                                          nonWords));
        // Rejected tokens are still written
        assertEquals("xyz\n!\n", new String(Files.readAllBytes(nonWords),
                                            StandardCharsets.UTF_8));
        assertFalse(Files.exists(words));
    }

    @Test
    public void emptyCounterIsAnError() {
        assertThrows(EmptyLexiconException.class,
                     () -> new LexiconBuilder(abc)
                         .build(new FrequencyCounter()));
    }

    @Test
    public void outputFilesAreWritten() throws IOException {
        FrequencyCounter counter = new FrequencyCounter();
        counter.countAll(Arrays.asList("a", " ", "b", " ", "a", " ", "d", "."));
        Path words = dir.resolve("words.csv");
        Path nonWords = dir.resolve("nonwords.txt");

        new LexiconBuilder(abc).build(counter, words, nonWords);

        List<String> rows = Files.readAllLines(words, StandardCharsets.UTF_8);
        assertEquals(Arrays.asList("word,frequency,frequency_class",
                                   "a,2,0", "b,1,1"), rows);
        assertEquals(Arrays.asList("d", "."),
                     Files.readAllLines(nonWords, StandardCharsets.UTF_8));
    }
}
