package com.customer.matching.similarity;

import com.customer.matching.core.model.BusinessRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Textual projection of a customer or employee record for local similarity:
 * the role, industry and description fields joined by spaces, with the
 * industry widened by {@link IndustryKeywords}.
 */
public final class ProfileText {

    private ProfileText() {
    }

    public static String of(BusinessRecord record) {
        if (record == null) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, record.getRole());
        String industry = record.getIndustry();
        addIfPresent(parts, industry);
        parts.addAll(IndustryKeywords.forIndustry(industry));
        addIfPresent(parts, record.getDescription());
        return String.join(" ", parts);
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
