/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import ca.mcgill.cs.freqlex.tokenize.SimpleTokenizer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;


public class FreqLexCreatorTest {

    private static final String CORPUS =
        "1\tthe cat sat.\n" +
        "2\tThe cat!\n";

    @TempDir
    Path dir;

    private List<String> lines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    @Test
    public void processWritesAllOutputs() throws IOException {
        Path out = dir.resolve("eng");
        FreqLexCreator creator = new FreqLexCreator(
            Languages.forCode("eng"), new SimpleTokenizer());
        Lexicon lexicon = creator.process(
            new BufferedReader(new StringReader(CORPUS)), out);

        assertEquals(3, lexicon.size());
        assertEquals(Arrays.asList("word,frequency,frequency_class",
                                   "cat,2,0", "the,1,1", "sat,1,1"),
                     lines(out.resolve(FreqLexCreator.WORDS_FILE)));
        assertEquals(Arrays.asList(".", "The", "!"),
                     lines(out.resolve(FreqLexCreator.NON_WORDS_FILE)));
        assertEquals(3, lines(out.resolve(FreqLexCreator.SENTENCES_FILE)).size());
        assertEquals(1, lines(out.resolve(FreqLexCreator.SKIPPED_FILE)).size());
    }

    @Test
    public void commandLineBuildsLexicon() throws IOException {
        Path corpus = dir.resolve("corpus.tsv");
        Files.write(corpus, CORPUS.getBytes(StandardCharsets.UTF_8));
        Path out = dir.resolve("out");

        int status = FreqLexCreator.run(new String[] {
                "-t", "simple", "-m", "8", "-f", corpus.toString(),
                "eng", out.toString() });

        assertEquals(0, status);
        assertEquals(Arrays.asList("tatoeba_id,text,tokens",
                                   "2,The cat!,\"[\"\"The\"\",\"\" \"\",\"\"cat\"\",\"\"!\"\"]\""),
                     lines(out.resolve(FreqLexCreator.SENTENCES_FILE)));
        assertEquals(Arrays.asList("tatoeba_id,text,reason_for_exclusion",
                                   "1,the cat sat.,too long"),
                     lines(out.resolve(FreqLexCreator.SKIPPED_FILE)));
        // Skipped sentences still contribute to the counts
        assertTrue(lines(out.resolve(FreqLexCreator.WORDS_FILE))
                   .contains("sat,1,1"));
    }

    @Test
    public void unsupportedLanguageFailsBeforeWriting() {
        Path out = dir.resolve("never");
        assertEquals(1, FreqLexCreator.run(new String[] {
                    "-t", "simple", "xyz", out.toString() }));
        assertFalse(Files.exists(out));
    }

    @Test
    public void outputFileIsRejected() throws IOException {
        Path file = Files.createFile(dir.resolve("taken"));
        assertEquals(1, FreqLexCreator.run(new String[] {
                    "-t", "simple", "eng", file.toString() }));
    }

    @Test
    public void unknownTokenizerIsRejected() {
        assertEquals(1, FreqLexCreator.run(new String[] {
                    "-t", "whitespace", "eng", dir.toString() }));
    }

    @Test
    public void missingArgumentsPrintUsage() {
        assertEquals(1, FreqLexCreator.run(new String[] { "eng" }));
    }

    @Test
    public void malformedCorpusFails() throws IOException {
        Path corpus = dir.resolve("bad.tsv");
        Files.write(corpus, "no tab\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, FreqLexCreator.run(new String[] {
                    "-t", "simple", "-f", corpus.toString(), "eng",
                    dir.resolve("out").toString() }));
    }
}
