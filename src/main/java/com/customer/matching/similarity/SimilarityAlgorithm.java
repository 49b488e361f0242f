package com.customer.matching.similarity;

/**
 * Interface for local text similarity algorithms.
 * All implementations return a score between 0.0 (nothing in common) and 1.0 (identical).
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two texts.
     *
     * @param text1 first text
     * @param text2 second text
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String text1, String text2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
