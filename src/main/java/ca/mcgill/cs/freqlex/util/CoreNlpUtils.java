/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.util;

import java.util.Map;
import java.util.Properties;

import java.util.concurrent.ConcurrentHashMap;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;


/**
 * A collection of utility functions around CoreNLP.  Building a {@link
 * StanfordCoreNLP} pipeline is expensive, so tokenizing pipelines are built
 * once per tokenizer language and shared afterwards.
 */
public class CoreNlpUtils {

    /**
     * The tokenizer options applied for every language.  Offsets must refer
     * to the original text and no character may be dropped.
     */
    static final String TOKENIZE_OPTIONS =
        "invertible=true,untokenizable=noneKeep";

    private static final Map<String,StanfordCoreNLP> pipelines =
        new ConcurrentHashMap<String,StanfordCoreNLP>();

    private CoreNlpUtils() { }

    /**
     * Returns the shared tokenize-only pipeline for the CoreNLP tokenizer
     * language (e.g., {@code "en"}, {@code "fr"} or {@code "de"}).
     *
     * @param tokenizerLanguage the value passed as {@code tokenize.language}
     *
     * @return the pipeline for that language
     */
    public static StanfordCoreNLP tokenizer(String tokenizerLanguage) {
        return pipelines.computeIfAbsent(tokenizerLanguage, lang -> {
            FreqLexLogger.verbose("Creating CoreNLP tokenizer for \"%s\"",
                                  lang);
            Properties props = new Properties();
            props.put("annotators", "tokenize");
            props.put("tokenize.language", lang);
            props.put("tokenize.options", TOKENIZE_OPTIONS);
            return new StanfordCoreNLP(props);
        });
    }
}
