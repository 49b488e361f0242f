package com.customer.matching.remote;

import com.customer.matching.core.model.Confidence;
import com.customer.matching.core.model.Employee;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of the {@code matches} array returned by {@code POST /customer-employee-match}.
 * Only {@code employee} is guaranteed; every score field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteMatch(
        Employee employee,
        @JsonProperty("semantic_score") Double semanticScore,
        @JsonProperty("total_score") Double totalScore,
        @JsonProperty("score") Double plainScore,
        String confidence,
        @JsonProperty("overall_confidence") String overallConfidence,
        @JsonProperty("industry_similarity") Double industrySimilarity,
        @JsonProperty("skills_similarity") Double skillsSimilarity,
        @JsonProperty("rule_based_reasons") List<String> ruleBasedReasons
) {
    public RemoteMatch {
        ruleBasedReasons = ruleBasedReasons != null ? List.copyOf(ruleBasedReasons) : List.of();
    }

    public static RemoteMatch of(Employee employee, double semanticScore, String confidence) {
        return new RemoteMatch(employee, semanticScore, null, null, confidence, null, null, null, null);
    }

    /**
     * Returns the semantic score if present, else the total score, else the plain
     * {@code score} field, else NaN.
     */
    public double score() {
        if (semanticScore != null) {
            return semanticScore;
        }
        if (totalScore != null) {
            return totalScore;
        }
        if (plainScore != null) {
            return plainScore;
        }
        return Double.NaN;
    }

    /**
     * Returns the reported confidence band, or null if none or unrecognized.
     */
    public Confidence confidenceBand() {
        return Confidence.fromWireName(confidence != null ? confidence : overallConfidence);
    }
}
