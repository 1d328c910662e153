/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.IOException;
import java.io.PrintWriter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ca.mcgill.cs.freqlex.data.LexiconEntry;

import ca.mcgill.cs.freqlex.util.CsvWriter;
import ca.mcgill.cs.freqlex.util.FreqLexLogger;


/**
 * Turns the token counts of a fully-ingested corpus into a lexicon.  Tokens
 * that the {@link LanguageProfile} does not recognize as words are removed
 * from the counter, and every remaining word is assigned the frequency class
 * {@code floor(0.5 - log2(count / maxCount))}, where {@code maxCount} is the
 * count of the most frequent remaining word.
 *
 * <p>Building modifies the counter it is given, so it must only be called
 * once ingestion of the whole corpus has finished.
 */
public class LexiconBuilder {

    static final String[] WORDS_HEADER =
        { "word", "frequency", "frequency_class" };

    private static final double LN_2 = Math.log(2);

    private final LanguageProfile language;

    public LexiconBuilder(LanguageProfile language) {
        this.language = language;
    }

    /**
     * Returns the frequency class of a word occurring {@code count} times
     * when the most frequent word occurs {@code maxCount} times.  Halves are
     * rounded up.
     */
    public static int frequencyClass(int count, int maxCount) {
        double ratio = (double)count / maxCount;
        return (int)Math.floor(0.5 - Math.log(ratio) / LN_2);
    }

    /**
     * Filters and ranks the counted tokens without writing anything.
     *
     * @throws EmptyLexiconException if none of the tokens is a word
     */
    public Lexicon build(FrequencyCounter counter) {
        List<String> rejected = removeNonWords(counter);
        return rank(counter, rejected);
    }

    /**
     * Filters and ranks the counted tokens, writing the rejected tokens to
     * {@code nonWordsFile} (one per line) and the ranked words to the {@code
     * wordsFile} table.  The rejected tokens are written before ranking, so
     * they are available even when no word remains.
     *
     * @throws EmptyLexiconException if none of the tokens is a word
     */
    public Lexicon build(FrequencyCounter counter, Path wordsFile,
                         Path nonWordsFile) throws IOException {
        List<String> rejected = removeNonWords(counter);
        try (PrintWriter pw = new PrintWriter(
                 Files.newBufferedWriter(nonWordsFile, StandardCharsets.UTF_8))) {
            for (String token : rejected)
                pw.print(token + "\n");
            if (pw.checkError())
                throw new IOException("could not write " + nonWordsFile);
        }

        Lexicon lexicon = rank(counter, rejected);
        try (CsvWriter words = CsvWriter.open(wordsFile)) {
            words.writeRow((Object[])WORDS_HEADER);
            for (LexiconEntry e : lexicon.getEntries())
                words.writeRow(e.row());
        }
        return lexicon;
    }

    /**
     * Removes every token that is not a word from the counter and returns the
     * removed tokens, most frequent first.
     */
    List<String> removeNonWords(FrequencyCounter counter) {
        List<String> rejected = new ArrayList<String>();
        for (Map.Entry<String,Integer> e : counter.mostCommon()) {
            String token = e.getKey();
            if (!language.isWord(token)) {
                counter.delete(token);
                rejected.add(token);
                FreqLexLogger.veryVerbose("Rejected \"%s\" (%d occurrences)",
                                          token, e.getValue());
            }
        }
        FreqLexLogger.verbose("Rejected %d non-word tokens for %s",
                              rejected.size(), language);
        return rejected;
    }

    private Lexicon rank(FrequencyCounter counter, List<String> rejected) {
        List<Map.Entry<String,Integer>> ranked = counter.mostCommon();
        if (ranked.isEmpty()) {
            throw new EmptyLexiconException(
                "none of the " + rejected.size() + " counted tokens is a " +
                language.getName() + " word");
        }
        int maxCount = ranked.get(0).getValue();

        List<LexiconEntry> entries = new ArrayList<LexiconEntry>(ranked.size());
        for (Map.Entry<String,Integer> e : ranked) {
            int count = e.getValue();
            entries.add(new LexiconEntry(e.getKey(), count,
                                         frequencyClass(count, maxCount)));
        }
        FreqLexLogger.info("Built %s lexicon of %d words (max count %d)",
                           language.getName(), entries.size(), maxCount);
        return new Lexicon(entries, rejected, maxCount);
    }

    public LanguageProfile getLanguage() {
        return language;
    }
}
