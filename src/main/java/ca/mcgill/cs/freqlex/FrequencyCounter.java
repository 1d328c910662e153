/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import ca.mcgill.cs.freqlex.data.SentenceRecord;


/**
 * Counts how often each token occurs.  Entries are enumerated from the most
 * to the least frequent; tokens with the same count come out in the order in
 * which they were first counted, so repeated enumerations without an
 * intervening change return the same order.  A token that is {@link
 * #delete(String) deleted} and later counted again is treated as newly seen.
 *
 * <p>This class is not thread-safe.
 */
public class FrequencyCounter {

    private final TObjectIntMap<String> counts;

    /**
     * The order in which each present token was first counted.
     */
    private final TObjectIntMap<String> firstSeen;

    private int nextRank;

    private long total;

    public FrequencyCounter() {
        counts = new TObjectIntHashMap<String>();
        firstSeen = new TObjectIntHashMap<String>();
        nextRank = 0;
        total = 0;
    }

    /**
     * Counts every token of the sequence once, ignoring whitespace and empty
     * pieces.
     */
    public void countAll(Iterable<String> tokens) {
        for (String token : tokens) {
            if (!SentenceRecord.isWhitespace(token))
                count(token);
        }
    }

    /**
     * Increments the count of the token and returns the new count.
     */
    public int count(String token) {
        return count(token, 1);
    }

    /**
     * Adds {@code n} to the count of the token and returns the new count.
     */
    public int count(String token, int n) {
        if (n < 1)
            throw new IllegalArgumentException("count must be positive: " + n);
        if (!counts.containsKey(token))
            firstSeen.put(token, nextRank++);
        total += n;
        return counts.adjustOrPutValue(token, n, n);
    }

    /**
     * Returns the count of the token, or 0 if it has not been counted.
     */
    public int getCount(String token) {
        return counts.get(token);
    }

    public boolean contains(String token) {
        return counts.containsKey(token);
    }

    /**
     * Removes the token and its count entirely.
     *
     * @return {@code true} if the token was present
     */
    public boolean delete(String token) {
        if (!counts.containsKey(token))
            return false;
        total -= counts.remove(token);
        firstSeen.remove(token);
        return true;
    }

    /**
     * Returns the number of distinct tokens.
     */
    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * Returns the sum of all counts.
     */
    public long sum() {
        return total;
    }

    /**
     * Returns all tokens with their counts, most frequent first.
     */
    public List<Map.Entry<String,Integer>> mostCommon() {
        return mostCommon(counts.size());
    }

    /**
     * Returns the {@code n} most frequent tokens with their counts, most
     * frequent first.
     */
    public List<Map.Entry<String,Integer>> mostCommon(int n) {
        List<String> tokens = new ArrayList<String>(counts.keySet());
        tokens.sort(Comparator.<String>comparingInt(t -> -counts.get(t))
                    .thenComparingInt(firstSeen::get));
        int limit = Math.min(Math.max(n, 0), tokens.size());
        List<Map.Entry<String,Integer>> entries =
            new ArrayList<Map.Entry<String,Integer>>(limit);
        for (String token : tokens.subList(0, limit)) {
            entries.add(new AbstractMap.SimpleImmutableEntry<String,Integer>(
                            token, counts.get(token)));
        }
        return entries;
    }

    @Override public String toString() {
        return "FrequencyCounter" + mostCommon();
    }
}
