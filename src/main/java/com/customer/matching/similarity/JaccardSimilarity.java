package com.customer.matching.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity over word sets.
 * Computes |intersection| / |union| of the lower-cased words of each text.
 * Words shorter than the minimum length are ignored.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    private static final int DEFAULT_MIN_TOKEN_LENGTH = 3;

    private final Pattern separator;
    private final int minTokenLength;

    public JaccardSimilarity() {
        this("\\W+", DEFAULT_MIN_TOKEN_LENGTH);
    }

    public JaccardSimilarity(String separatorPattern, int minTokenLength) {
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("minTokenLength must be >= 1");
        }
        this.separator = Pattern.compile(separatorPattern);
        this.minTokenLength = minTokenLength;
    }

    @Override
    public double compute(String text1, String text2) {
        Set<String> tokens1 = tokenize(text1);
        Set<String> tokens2 = tokenize(text2);

        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }

        // |union| = |A| + |B| - |intersection|
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;

        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return "Jaccard";
    }

    /**
     * Splits a text into its distinct lower-cased words.
     */
    Set<String> tokenize(String text) {
        Set<String> tokenSet = new HashSet<>();
        if (text == null || text.isEmpty()) {
            return tokenSet;
        }
        for (String token : separator.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= minTokenLength) {
                tokenSet.add(token);
            }
        }
        return tokenSet;
    }
}
