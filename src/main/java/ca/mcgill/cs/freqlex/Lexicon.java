/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.util.List;

import com.google.common.collect.ImmutableList;

import ca.mcgill.cs.freqlex.data.LexiconEntry;


/**
 * The ranked word list of one language, together with the tokens that were
 * rejected as non-words while building it.
 */
public class Lexicon {

    private final List<LexiconEntry> entries;

    private final List<String> rejected;

    private final int maxCount;

    public Lexicon(List<LexiconEntry> entries, List<String> rejected,
                   int maxCount) {
        this.entries = ImmutableList.copyOf(entries);
        this.rejected = ImmutableList.copyOf(rejected);
        this.maxCount = maxCount;
    }

    /**
     * Returns the entries, most frequent first.
     */
    public List<LexiconEntry> getEntries() {
        return entries;
    }

    /**
     * Returns the rejected tokens in the order they were rejected.
     */
    public List<String> getRejected() {
        return rejected;
    }

    /**
     * Returns the count of the most frequent word, against which frequency
     * classes are computed.
     */
    public int getMaxCount() {
        return maxCount;
    }

    public int size() {
        return entries.size();
    }

    @Override public String toString() {
        return String.format("Lexicon of %d words (%d rejected, max count %d)",
                             entries.size(), rejected.size(), maxCount);
    }
}
