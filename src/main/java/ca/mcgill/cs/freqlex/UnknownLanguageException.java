/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;


/**
 * Thrown when a language code is not in the {@link Languages} registry.
 */
public class UnknownLanguageException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String code;

    public UnknownLanguageException(String code) {
        super("unsupported language: " + code);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
