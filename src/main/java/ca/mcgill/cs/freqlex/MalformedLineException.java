/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.IOException;


/**
 * Thrown when a corpus line is not of the form {@code
 * <identifier><TAB><sentence>}.  A corpus with such a line is considered
 * corrupt, so the whole build stops.
 */
public class MalformedLineException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long lineNumber;

    public MalformedLineException(long lineNumber, String reason) {
        super(String.format("line %d: %s", lineNumber, reason));
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based number of the offending line.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
