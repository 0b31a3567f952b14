package com.lead.discovery.matching;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Related-term tables used by need matching.
 */
public final class NeedTaxonomy {

    static final Map<String, List<String>> NEED_RELATIONS = Map.of(
            "loan", List.of("financing", "capital", "funding", "credit"),
            "consulting", List.of("advice", "strategy", "improvement", "optimization"),
            "financial_service", List.of("accounting", "tax", "planning", "advisory"));

    static final Map<String, List<String>> CATEGORY_RELATIONS = Map.of(
            "loan", List.of("financing", "lending", "credit"),
            "consulting", List.of("advisory", "strategy", "coaching"));

    private NeedTaxonomy() {
    }

    /**
     * True when one side names a key of the relation table and the other one of its terms,
     * e.g. need {@code growth_capital} and service type {@code business_loan}.
     */
    public static boolean needsRelated(String need, String serviceType) {
        return relatedEitherWay(NEED_RELATIONS, need, serviceType);
    }

    public static boolean categoriesRelated(String category1, String category2) {
        return relatedEitherWay(CATEGORY_RELATIONS, category1, category2);
    }

    private static boolean relatedEitherWay(Map<String, List<String>> table, String first, String second) {
        if (first == null || second == null) {
            return false;
        }
        String a = first.toLowerCase(Locale.ROOT);
        String b = second.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : table.entrySet()) {
            String key = entry.getKey();
            List<String> terms = entry.getValue();
            if ((b.contains(key) && terms.stream().anyMatch(a::contains))
                    || (a.contains(key) && terms.stream().anyMatch(b::contains))) {
                return true;
            }
        }
        return false;
    }
}
