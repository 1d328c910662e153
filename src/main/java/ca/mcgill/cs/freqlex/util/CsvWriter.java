/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.util;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.Writer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import java.util.Arrays;
import java.util.List;


/**
 * Writes comma-separated rows.  A field is quoted only when it contains the
 * delimiter, a quote or a line break, and embedded quotes are doubled.  Rows
 * end in {@code \r\n}.  Each row is formatted in full before any of it is
 * handed to the underlying writer, so a failure between rows never leaves a
 * partial row behind.
 */
public class CsvWriter implements Closeable, Flushable {

    private static final char DELIMITER = ',';

    private static final char QUOTE = '"';

    private static final String ROW_END = "\r\n";

    private final Writer writer;

    private long rowsWritten;

    public CsvWriter(Writer writer) {
        this.writer = writer;
        this.rowsWritten = 0;
    }

    /**
     * Opens a UTF-8 CSV file, replacing any existing content.
     */
    public static CsvWriter open(Path file) throws IOException {
        BufferedWriter bw = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        return new CsvWriter(bw);
    }

    public void writeRow(Object... fields) throws IOException {
        writeRow(Arrays.asList(fields));
    }

    public void writeRow(List<?> fields) throws IOException {
        writer.write(formatRow(fields));
        rowsWritten++;
    }

    /**
     * Returns the number of rows (header included) written so far.
     */
    public long rowsWritten() {
        return rowsWritten;
    }

    static String formatRow(List<?> fields) {
        StringBuilder sb = new StringBuilder();
        // A lone empty field would otherwise be indistinguishable from an
        // empty line
        if (fields.size() == 1 && String.valueOf(fields.get(0)).isEmpty()) {
            sb.append(QUOTE).append(QUOTE);
        }
        else {
            for (int i = 0; i < fields.size(); ++i) {
                if (i > 0)
                    sb.append(DELIMITER);
                appendField(sb, String.valueOf(fields.get(i)));
            }
        }
        return sb.append(ROW_END).toString();
    }

    private static void appendField(StringBuilder sb, String field) {
        if (!needsQuoting(field)) {
            sb.append(field);
            return;
        }
        sb.append(QUOTE);
        for (int i = 0; i < field.length(); ++i) {
            char c = field.charAt(i);
            if (c == QUOTE)
                sb.append(QUOTE);
            sb.append(c);
        }
        sb.append(QUOTE);
    }

    private static boolean needsQuoting(String field) {
        for (int i = 0; i < field.length(); ++i) {
            char c = field.charAt(i);
            if (c == DELIMITER || c == QUOTE || c == '\r' || c == '\n')
                return true;
        }
        return false;
    }

    @Override public void flush() throws IOException {
        writer.flush();
    }

    @Override public void close() throws IOException {
        writer.close();
    }
}
