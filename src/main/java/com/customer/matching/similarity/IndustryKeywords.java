package com.customer.matching.similarity;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in domain vocabulary per industry, used to widen the text an industry
 * label contributes to local similarity. Unknown industries contribute only
 * their own lower-cased words.
 */
public final class IndustryKeywords {

    private static final Map<String, List<String>> KEYWORDS = Map.of(
            "technology", List.of("technology", "software", "tech", "engineering", "cloud", "digital", "data"),
            "finance", List.of("finance", "financial", "banking", "bank", "investment", "accounting", "insurance", "fintech"),
            "healthcare", List.of("healthcare", "health", "medical", "clinical", "hospital", "pharma", "patient"),
            "energy", List.of("energy", "utilities", "oil", "gas", "renewable", "power"),
            "manufacturing", List.of("manufacturing", "industrial", "production", "factory", "supply", "chain"),
            "automotive", List.of("automotive", "vehicle", "cars", "dealership", "mobility"),
            "construction", List.of("construction", "building", "contractor", "property", "infrastructure"),
            "retail", List.of("retail", "ecommerce", "consumer", "store", "merchandise", "sales"),
            "education", List.of("education", "school", "university", "learning", "training")
    );

    private IndustryKeywords() {
    }

    /**
     * Returns the keywords for an industry label such as {@code "Finance"} or
     * {@code "Healthcare / Pharma"}. Never null.
     */
    public static Set<String> forIndustry(String industry) {
        Set<String> keywords = new LinkedHashSet<>();
        if (industry == null || industry.isBlank()) {
            return keywords;
        }
        String normalized = industry.trim().toLowerCase(Locale.ROOT);
        List<String> exact = KEYWORDS.get(normalized);
        if (exact != null) {
            keywords.addAll(exact);
            return keywords;
        }
        for (String word : normalized.split("\\W+")) {
            if (word.isEmpty()) {
                continue;
            }
            keywords.add(word);
            keywords.addAll(KEYWORDS.getOrDefault(word, List.of()));
        }
        return keywords;
    }

    public static Set<String> knownIndustries() {
        return KEYWORDS.keySet();
    }
}
