package com.text_classifier_app.trainer;

import weka.core.stemmers.LovinsStemmer;
import weka.core.stemmers.Stemmer;
import weka.core.stopwords.Rainbow;
import weka.core.stopwords.StopwordsHandler;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic text cleanup applied before vectorization, both at training and at prediction
 * time: lower-case, drop everything that is not a letter, tokenize on whitespace, remove stop
 * words and stem. Word n-grams are then emitted as single terms joined by {@link #NGRAM_JOINER}.
 * Holds no learned state and travels inside the model artifact.
 */
public class TextPreprocessor implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String NGRAM_JOINER = "_";

    private static final Pattern NON_ALPHABETIC = Pattern.compile("[^a-z]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final StopwordsHandler stopwords;
    private final Stemmer stemmer;
    private final int ngramMin;
    private final int ngramMax;

    public TextPreprocessor(int ngramMin, int ngramMax) {
        this(new Rainbow(), new LovinsStemmer(), ngramMin, ngramMax);
    }

    public TextPreprocessor(StopwordsHandler stopwords, Stemmer stemmer, int ngramMin, int ngramMax) {
        if (ngramMin < 1 || ngramMax < ngramMin) {
            throw new IllegalArgumentException("Invalid n-gram range [" + ngramMin + ", " + ngramMax + "]");
        }
        this.stopwords = stopwords;
        this.stemmer = stemmer;
        this.ngramMin = ngramMin;
        this.ngramMax = ngramMax;
    }

    /**
     * @return the cleaned, stemmed tokens of {@code text} in their original order
     */
    public List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String letters = NON_ALPHABETIC.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (letters.isEmpty()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(letters)) {
            if (token.length() < 2 || stopwords.isStopword(token)) {
                continue;
            }
            String stem = stemmer.stem(token);
            if (!stem.isEmpty()) {
                tokens.add(stem);
            }
        }
        return tokens;
    }

    /**
     * @return the space separated terms (n-grams of the cleaned tokens) fed to the vectorizer
     */
    public String prepare(String text) {
        List<String> tokens = tokens(text);
        List<String> terms = new ArrayList<>();
        for (int n = ngramMin; n <= ngramMax; n++) {
            for (int start = 0; start + n <= tokens.size(); start++) {
                terms.add(String.join(NGRAM_JOINER, tokens.subList(start, start + n)));
            }
        }
        return String.join(" ", terms);
    }
}
