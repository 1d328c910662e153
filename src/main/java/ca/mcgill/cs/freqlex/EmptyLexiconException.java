/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;


/**
 * Thrown when no counted token survives word filtering, which leaves the
 * lexicon without a maximum count to rank against.
 */
public class EmptyLexiconException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyLexiconException(String message) {
        super(message);
    }
}
