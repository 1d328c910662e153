/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.data;

import java.util.List;

import com.google.common.collect.ImmutableList;


/**
 * A row of the lexicon: a validated word, how often it occurred in the
 * corpus, and its frequency class.
 */
public final class LexiconEntry {

    private final String word;

    private final int frequency;

    private final int frequencyClass;

    public LexiconEntry(String word, int frequency, int frequencyClass) {
        this.word = word;
        this.frequency = frequency;
        this.frequencyClass = frequencyClass;
    }

    public String getWord() {
        return word;
    }

    public int getFrequency() {
        return frequency;
    }

    /**
     * Returns the frequency class, where 0 marks the most frequent words and
     * each further class is roughly half as frequent as the one before.
     */
    public int getFrequencyClass() {
        return frequencyClass;
    }

    public List<Object> row() {
        return ImmutableList.<Object>of(word, frequency, frequencyClass);
    }

    @Override public boolean equals(Object o) {
        if (o instanceof LexiconEntry) {
            LexiconEntry e = (LexiconEntry)o;
            return word.equals(e.word)
                && frequency == e.frequency
                && frequencyClass == e.frequencyClass;
        }
        return false;
    }

    @Override public int hashCode() {
        return word.hashCode();
    }

    @Override public String toString() {
        return String.format("%s (%d, class %d)", word, frequency,
                             frequencyClass);
    }
}
