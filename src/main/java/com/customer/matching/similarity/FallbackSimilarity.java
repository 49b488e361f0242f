package com.customer.matching.similarity;

import com.customer.matching.core.model.Confidence;

import java.util.Objects;

/**
 * Local, deterministic stand-in for the remote semantic matcher.
 *
 * <p>Scores two texts by word-set Jaccard similarity and assigns a confidence band:
 * {@code >= 0.6} high, {@code >= 0.4} medium, {@code >= 0.2} low, otherwise very low.
 * If either text has no usable words the score is 0.0 with very low confidence.</p>
 */
public class FallbackSimilarity {

    private final SimilarityAlgorithm algorithm;

    public FallbackSimilarity() {
        this(new JaccardSimilarity());
    }

    public FallbackSimilarity(SimilarityAlgorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
    }

    public SimilarityScore similarity(String text1, String text2) {
        double similarity = algorithm.compute(text1, text2);
        if (Double.isNaN(similarity) || similarity <= 0.0) {
            return SimilarityScore.none();
        }
        double bounded = Math.min(1.0, similarity);
        return new SimilarityScore(bounded, Confidence.forSimilarity(bounded));
    }

    public String getAlgorithmName() {
        return algorithm.getName();
    }
}
