package com.claimflow.classification;

import java.util.List;
import java.util.Locale;

/**
 * Keyword-based claim priority. Independent of the classifier's confidence.
 */
public final class PriorityResolver {

    static final List<String> HIGH_PRIORITY_KEYWORDS =
        List.of("major", "fire", "totaled", "emergency", "collision");

    private PriorityResolver() {
    }

    /** Case-insensitive substring match: "Firewall" counts as "fire". */
    public static Priority resolve(String claimText) {
        if (claimText == null) {
            return Priority.MEDIUM;
        }
        String lower = claimText.toLowerCase(Locale.ROOT);
        for (String keyword : HIGH_PRIORITY_KEYWORDS) {
            if (lower.contains(keyword)) {
                return Priority.HIGH;
            }
        }
        return Priority.MEDIUM;
    }
}
