/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.BufferedReader;
import java.io.IOException;

import java.nio.file.Path;

import com.google.common.base.CharMatcher;

import ca.mcgill.cs.freqlex.data.SentenceRecord;

import ca.mcgill.cs.freqlex.tokenize.TokenizerAdapter;

import ca.mcgill.cs.freqlex.util.CsvWriter;
import ca.mcgill.cs.freqlex.util.FreqLexLogger;


/**
 * Reads a corpus of {@code <identifier><TAB><sentence>} lines, tokenizes
 * each sentence, and writes the tokenized sentences to the sentence table.
 * Every sentence's tokens are counted, but sentences longer than the maximum
 * length are written to the skip log instead of the sentence table.
 *
 * <p>Lines are processed strictly in input order.  A malformed line stops
 * ingestion with a {@link MalformedLineException}; rows written before it
 * remain in the output files.
 */
public class IngestionPipeline {

    /**
     * The longest sentence, in characters, that is kept in the sentence
     * table.
     */
    public static final int DEFAULT_MAX_SENTENCE_LENGTH = 100;

    public static final String TOO_LONG = "too long";

    static final String LEFT_TO_RIGHT_MARK = "\u200E";

    static final String RIGHT_TO_LEFT_MARK = "\u200F";

    static final String[] SENTENCE_HEADER =
        { "tatoeba_id", "text", "tokens" };

    static final String[] SENTENCE_HEADER_WITHOUT_IDS = { "text", "tokens" };

    static final String[] SKIPPED_HEADER =
        { "tatoeba_id", "text", "reason_for_exclusion" };

    private static final int PROGRESS_INTERVAL = 10_000;

    private final TokenizerAdapter tokenizer;

    private final int maxSentenceLength;

    private final boolean withIds;

    public IngestionPipeline(TokenizerAdapter tokenizer) {
        this(tokenizer, DEFAULT_MAX_SENTENCE_LENGTH, true);
    }

    /**
     * Creates a pipeline.
     *
     * @param tokenizer the tokenizer for the corpus language
     * @param maxSentenceLength the longest sentence, in characters, written
     *        to the sentence table
     * @param withIds {@code true} if the identifier column holds numeric
     *        sentence ids that should be kept; if {@code false} the column is
     *        not validated and the sentence table has no id column
     */
    public IngestionPipeline(TokenizerAdapter tokenizer,
                             int maxSentenceLength, boolean withIds) {
        if (maxSentenceLength < 0)
            throw new IllegalArgumentException(
                "negative maximum sentence length: " + maxSentenceLength);
        this.tokenizer = tokenizer;
        this.maxSentenceLength = maxSentenceLength;
        this.withIds = withIds;
    }

    /**
     * Ingests the corpus, writing the sentence table and skip log to the
     * provided files.  Both files are closed before this method returns,
     * whether or not ingestion succeeds.
     */
    public IngestionResult ingest(BufferedReader corpus, Path sentencesFile,
                                  Path skippedFile) throws IOException {
        try (CsvWriter sentences = CsvWriter.open(sentencesFile);
             CsvWriter skipped = CsvWriter.open(skippedFile)) {
            return ingest(corpus, sentences, skipped);
        }
    }

    /**
     * Ingests the corpus, writing to already-open tables.  The caller remains
     * responsible for closing them.
     *
     * @return the counts of every token in the corpus, along with a summary
     *         of what was written
     */
    public IngestionResult ingest(BufferedReader corpus, CsvWriter sentences,
                                  CsvWriter skipped) throws IOException {
        FrequencyCounter counter = new FrequencyCounter();
        sentences.writeRow((Object[])
            (withIds ? SENTENCE_HEADER : SENTENCE_HEADER_WITHOUT_IDS));
        skipped.writeRow((Object[])SKIPPED_HEADER);

        long lineNumber = 0;
        long accepted = 0;
        long tooLong = 0;
        for (String line = null; (line = corpus.readLine()) != null; ) {
            ++lineNumber;
            int tab = line.indexOf('\t');
            if (tab < 0)
                throw new MalformedLineException(lineNumber, "missing tab");
            String identifier = line.substring(0, tab);
            Long id = (withIds) ? parseId(lineNumber, identifier) : null;
            String text = clean(line.substring(tab + 1));

            SentenceRecord sentence =
                new SentenceRecord(id, text, tokenizer.tokenize(text));
            // Count every sentence, even those left out of the table
            counter.countAll(sentence.getTokens());

            if (text.codePointCount(0, text.length()) <= maxSentenceLength) {
                sentences.writeRow(sentence.row());
                accepted++;
            }
            else {
                FreqLexLogger.veryVerbose("Skipping sentence %s: %s",
                                          identifier, TOO_LONG);
                skipped.writeRow(identifier, text, TOO_LONG);
                tooLong++;
            }

            if (lineNumber % PROGRESS_INTERVAL == 0)
                FreqLexLogger.info("Processed %d sentences", lineNumber);
        }

        FreqLexLogger.info("Ingested %d sentences (%d kept, %d too long); " +
                           "%d distinct tokens", lineNumber, accepted,
                           tooLong, counter.size());
        return new IngestionResult(counter, lineNumber, accepted, tooLong);
    }

    private static Long parseId(long lineNumber, String identifier)
            throws MalformedLineException {
        try {
            return Long.valueOf(CharMatcher.whitespace().trimFrom(identifier));
        } catch (NumberFormatException nfe) {
            throw new MalformedLineException(
                lineNumber, "identifier is not a number: " + identifier);
        }
    }

    /**
     * Removes a single directional mark of each kind from both ends of the
     * sentence, along with the surrounding whitespace.
     */
    static String clean(String text) {
        CharMatcher whitespace = CharMatcher.whitespace();
        String s = whitespace.trimFrom(text);
        s = strip(s, LEFT_TO_RIGHT_MARK);
        s = strip(s, RIGHT_TO_LEFT_MARK);
        return whitespace.trimFrom(s);
    }

    private static String strip(String s, String mark) {
        if (s.startsWith(mark))
            s = s.substring(mark.length());
        if (s.endsWith(mark))
            s = s.substring(0, s.length() - mark.length());
        return s;
    }

    public int getMaxSentenceLength() {
        return maxSentenceLength;
    }

    public boolean isWithIds() {
        return withIds;
    }
}
