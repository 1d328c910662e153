/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.freqlex.tokenize;

import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.ling.CoreAnnotations.TokensAnnotation;
import edu.stanford.nlp.ling.CoreLabel;

import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;

import ca.mcgill.cs.freqlex.util.CoreNlpUtils;


/**
 * A {@link TokenizerAdapter} backed by the CoreNLP {@code tokenize}
 * annotator.  Token pieces are cut from the sentence by their character
 * offsets, and whatever lies between two tokens becomes a whitespace piece,
 * so the output always joins back to the input even where CoreNLP normalizes
 * a token's text.  A token whose span overlaps one already emitted (as when a
 * contraction is split into two words sharing one span) is dropped.
 */
public class CoreNlpTokenizer implements TokenizerAdapter {

    private final StanfordCoreNLP pipeline;

    private final String tokenizerLanguage;

    /**
     * Creates a tokenizer for the CoreNLP tokenizer language, e.g. {@code
     * "en"}.
     */
    public CoreNlpTokenizer(String tokenizerLanguage) {
        this.tokenizerLanguage = tokenizerLanguage;
        this.pipeline = CoreNlpUtils.tokenizer(tokenizerLanguage);
    }

    /**
     * {@inheritDoc}
     */
    @Override public List<String> tokenize(String sentence) {
        Annotation document = new Annotation(sentence);
        pipeline.annotate(document);
        List<CoreLabel> labels = document.get(TokensAnnotation.class);

        List<String> pieces = new ArrayList<String>();
        int end = 0;
        if (labels != null) {
            for (CoreLabel label : labels) {
                int b = label.beginPosition();
                int e = label.endPosition();
                if (b < end || e <= b || e > sentence.length())
                    continue;
                if (b > end)
                    pieces.add(sentence.substring(end, b));
                pieces.add(sentence.substring(b, e));
                end = e;
            }
        }
        if (end < sentence.length())
            pieces.add(sentence.substring(end));
        return pieces;
    }

    @Override public String toString() {
        return "CoreNLP tokenizer (" + tokenizerLanguage + ")";
    }
}
