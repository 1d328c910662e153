/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import java.util.logging.Level;

import edu.ucla.sspace.common.ArgOptions;

import ca.mcgill.cs.freqlex.tokenize.TokenizerAdapter;
import ca.mcgill.cs.freqlex.tokenize.Tokenizers;

import ca.mcgill.cs.freqlex.util.FreqLexLogger;


/**
 * The main class for building the lexicon of one language.  This class is
 * intended to be run as a command-line executable program, reading a
 * tab-separated sentence corpus and writing four files into an output
 * directory:
 *
 * <ul>
 * <li>{@value #SENTENCES_FILE}: the tokenized sentences</li>
 * <li>{@value #SKIPPED_FILE}: the sentences left out and why</li>
 * <li>{@value #WORDS_FILE}: the ranked words with their frequency classes</li>
 * <li>{@value #NON_WORDS_FILE}: the tokens rejected as non-words</li>
 * </ul>
 */
public class FreqLexCreator {

    public static final String SENTENCES_FILE = "sentences.csv";

    public static final String SKIPPED_FILE = "skipped.csv";

    public static final String WORDS_FILE = "words.csv";

    public static final String NON_WORDS_FILE = "nonwords.txt";

    private final LanguageProfile language;

    private final TokenizerAdapter tokenizer;

    private final int maxSentenceLength;

    private final boolean withIds;

    public FreqLexCreator(LanguageProfile language,
                          TokenizerAdapter tokenizer) {
        this(language, tokenizer,
             IngestionPipeline.DEFAULT_MAX_SENTENCE_LENGTH, true);
    }

    public FreqLexCreator(LanguageProfile language, TokenizerAdapter tokenizer,
                          int maxSentenceLength, boolean withIds) {
        this.language = language;
        this.tokenizer = tokenizer;
        this.maxSentenceLength = maxSentenceLength;
        this.withIds = withIds;
    }

    /**
     * Reads the corpus file (or standard input if {@code inputFile} is {@code
     * null}) and writes all outputs into {@code outputDir}, creating it if
     * needed.
     */
    public Lexicon process(Path inputFile, Path outputDir) throws IOException {
        if (inputFile == null) {
            BufferedReader stdin = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return process(stdin, outputDir);
        }
        try (BufferedReader br =
                 Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
            return process(br, outputDir);
        }
    }

    /**
     * Ingests the whole corpus, and only then builds the lexicon from the
     * resulting counts.
     */
    public Lexicon process(BufferedReader corpus, Path outputDir)
            throws IOException {
        Files.createDirectories(outputDir);
        FreqLexLogger.info("Building %s lexicon in %s using the %s",
                           language.getName(), outputDir, tokenizer);

        IngestionPipeline pipeline =
            new IngestionPipeline(tokenizer, maxSentenceLength, withIds);
        IngestionResult ingested = pipeline.ingest(
            corpus, outputDir.resolve(SENTENCES_FILE),
            outputDir.resolve(SKIPPED_FILE));
        FreqLexLogger.verbose("Ingestion finished: %s", ingested);

        LexiconBuilder builder = new LexiconBuilder(language);
        return builder.build(ingested.getCounter(),
                             outputDir.resolve(WORDS_FILE),
                             outputDir.resolve(NON_WORDS_FILE));
    }

    public LanguageProfile getLanguage() {
        return language;
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0)
            System.exit(status);
    }

    /**
     * Runs the program with the command-line arguments and returns its exit
     * status.
     */
    static int run(String[] args) {
        ArgOptions opts = createOptions();
        try {
            opts.parseOptions(args);
        } catch (IllegalArgumentException iae) {
            System.err.println(iae.getMessage());
            usage(opts);
            return 1;
        }

        if (opts.hasOption('v'))
            FreqLexLogger.setLevel(Level.FINE);
        if (opts.hasOption('V'))
            FreqLexLogger.setLevel(Level.FINER);

        if (opts.numPositionalArgs() != 2) {
            usage(opts);
            return 1;
        }

        try {
            // Check the language before touching any file
            LanguageProfile language =
                Languages.forCode(opts.getPositionalArg(0));
            Path outputDir = Paths.get(opts.getPositionalArg(1));
            if (Files.isRegularFile(outputDir)) {
                System.err.println(outputDir + " is a file");
                return 1;
            }

            Tokenizers.Kind kind = (opts.hasOption('t'))
                ? Tokenizers.Kind.forName(opts.getStringOption('t'))
                : Tokenizers.Kind.CORENLP;
            int maxLength = (opts.hasOption('m'))
                ? opts.getIntOption('m')
                : IngestionPipeline.DEFAULT_MAX_SENTENCE_LENGTH;
            Path inputFile = (opts.hasOption('f'))
                ? Paths.get(opts.getStringOption('f')) : null;

            FreqLexCreator creator = new FreqLexCreator(
                language, Tokenizers.forLanguage(language, kind),
                maxLength, !opts.hasOption('n'));
            Lexicon lexicon = creator.process(inputFile, outputDir);
            FreqLexLogger.info("Wrote %d words to %s", lexicon.size(),
                               outputDir.resolve(WORDS_FILE));
            return 0;
        }
        catch (IllegalArgumentException iae) {
            // Unknown language or tokenizer, or a malformed number
            System.err.println(iae.getMessage());
            return 1;
        }
        catch (IOException | EmptyLexiconException e) {
            FreqLexLogger.severe("Lexicon build failed: %s", e.getMessage());
            System.err.println(e.getMessage());
            return 1;
        }
    }

    private static ArgOptions createOptions() {
        ArgOptions options = new ArgOptions();

        options.addOption('f', "input",
                          "the file of tab-separated sentences to read " +
                          "(default: standard input)",
                          true, "FILE", "Input Options");
        options.addOption('n', "no-ids",
                          "the corpus identifiers are not sentence ids; " +
                          "leave them out of " + SENTENCES_FILE,
                          false, null, "Input Options");

        options.addOption('m', "max-length",
                          "the longest sentence, in characters, kept in " +
                          SENTENCES_FILE + " (default: " +
                          IngestionPipeline.DEFAULT_MAX_SENTENCE_LENGTH + ")",
                          true, "INT", "Lexicon Options");
        options.addOption('t', "tokenizer",
                          "the tokenizer to use, corenlp or simple " +
                          "(default: corenlp)",
                          true, "KIND", "Lexicon Options");

        options.addOption('v', "verbose", "prints verbose output",
                          false, null, "Program Options");
        options.addOption('V', "veryVerbose", "prints very verbose output, " +
                          "which lists every rejected token",
                          false, null, "Program Options");
        return options;
    }

    /**
     * Prints out information on how to run the program to {@code stdout}.
     */
    private static void usage(ArgOptions argOptions) {
        System.out.println(
            "usage: java " + FreqLexCreator.class.getName()
            + " [options] <language-code> <output-dir>\n"
            + "supported languages: " + String.join(" ", Languages.codes())
            + "\n" + argOptions.prettyPrint());
    }
}
