package com.lead.discovery.matching;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Curated families of related industries. Terms match as whole words so that short terms
 * such as "it" do not fire inside unrelated words.
 */
public final class IndustryTaxonomy {

    static final Set<String> WILDCARDS = Set.of("all", "any", "various");

    static final List<Set<String>> RELATED_GROUPS = List.of(
            Set.of("retail", "e-commerce", "store", "shop"),
            Set.of("technology", "software", "it", "tech", "saas"),
            Set.of("healthcare", "medical", "hospital", "clinic"),
            Set.of("finance", "banking", "financial services"),
            Set.of("manufacturing", "production", "factory"),
            Set.of("food", "restaurant", "hospitality", "dining"));

    private IndustryTaxonomy() {
    }

    public static boolean isWildcard(String industry) {
        return industry != null && WILDCARDS.contains(industry.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * True when both industries mention a term of the same family.
     */
    public static boolean related(String industry1, String industry2) {
        if (industry1 == null || industry2 == null) {
            return false;
        }
        String a = industry1.toLowerCase(Locale.ROOT);
        String b = industry2.toLowerCase(Locale.ROOT);
        for (Set<String> group : RELATED_GROUPS) {
            if (group.stream().anyMatch(t -> containsTerm(a, t)) && group.stream().anyMatch(t -> containsTerm(b, t))) {
                return true;
            }
        }
        return false;
    }

    static boolean containsTerm(String text, String term) {
        return Pattern.compile("\\b" + Pattern.quote(term) + "\\b").matcher(text).find();
    }
}
