/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;


/**
 * What an {@link IngestionPipeline} run produced: the token counts for the
 * whole corpus and how many sentences went to each output.  The counter is
 * handed over to the caller, typically to pass on to a {@link
 * LexiconBuilder}.
 */
public class IngestionResult {

    private final FrequencyCounter counter;

    private final long sentencesRead;

    private final long sentencesKept;

    private final long sentencesSkipped;

    public IngestionResult(FrequencyCounter counter, long sentencesRead,
                           long sentencesKept, long sentencesSkipped) {
        this.counter = counter;
        this.sentencesRead = sentencesRead;
        this.sentencesKept = sentencesKept;
        this.sentencesSkipped = sentencesSkipped;
    }

    public FrequencyCounter getCounter() {
        return counter;
    }

    public long getSentencesRead() {
        return sentencesRead;
    }

    /**
     * Returns the number of sentences written to the sentence table.
     */
    public long getSentencesKept() {
        return sentencesKept;
    }

    /**
     * Returns the number of sentences written to the skip log.
     */
    public long getSentencesSkipped() {
        return sentencesSkipped;
    }

    @Override public String toString() {
        return String.format("%d sentences read, %d kept, %d skipped, " +
                             "%d distinct tokens", sentencesRead,
                             sentencesKept, sentencesSkipped, counter.size());
    }
}
