package com.customer.matching.similarity;

import com.customer.matching.core.model.Confidence;

import java.util.Objects;

/**
 * Similarity of two texts with its confidence band.
 */
public record SimilarityScore(double similarity, Confidence confidence) {

    public SimilarityScore {
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("Similarity must be between 0.0 and 1.0");
        }
        Objects.requireNonNull(confidence, "confidence is required");
    }

    public static SimilarityScore none() {
        return new SimilarityScore(0.0, Confidence.VERY_LOW);
    }
}
