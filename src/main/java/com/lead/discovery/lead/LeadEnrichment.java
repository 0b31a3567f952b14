package com.lead.discovery.lead;

import com.lead.discovery.core.model.Lead;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Enrichment data for an existing lead. Only whitelisted fields are applied; anything
 * else supplied is reported by {@link #ignoredFields()} and dropped.
 */
public final class LeadEnrichment {

    public static final Set<String> ENRICHABLE_FIELDS = Set.of(
            "email", "phone", "company", "website", "industry",
            "company_size", "revenue_range", "employee_count");

    private final Map<String, Object> applicable;
    private final Set<String> ignored;

    private LeadEnrichment(Map<String, Object> applicable, Set<String> ignored) {
        this.applicable = applicable;
        this.ignored = ignored;
    }

    public static LeadEnrichment of(Map<String, ?> data) {
        Map<String, Object> applicable = new LinkedHashMap<>();
        Set<String> ignored = new LinkedHashSet<>();
        if (data != null) {
            data.forEach((key, value) -> {
                if (ENRICHABLE_FIELDS.contains(key) && value != null) {
                    applicable.put(key, value);
                } else {
                    ignored.add(key);
                }
            });
        }
        return new LeadEnrichment(Map.copyOf(applicable), Set.copyOf(ignored));
    }

    public boolean isEmpty() {
        return applicable.isEmpty();
    }

    public Map<String, Object> applicableFields() {
        return applicable;
    }

    public Set<String> ignoredFields() {
        return ignored;
    }

    /**
     * @throws IllegalArgumentException if {@code employee_count} is not an integer
     */
    void applyTo(Lead lead) {
        applicable.forEach((field, value) -> {
            String text = String.valueOf(value);
            switch (field) {
                case "email" -> lead.setEmail(text);
                case "phone" -> lead.setPhone(text);
                case "company" -> lead.setCompany(text);
                case "website" -> lead.setWebsite(text);
                case "industry" -> lead.setIndustry(text);
                case "company_size" -> lead.setCompanySize(text);
                case "revenue_range" -> lead.setRevenueRange(text);
                case "employee_count" -> lead.setEmployeeCount(value instanceof Number n
                        ? Integer.valueOf(n.intValue()) : Integer.valueOf(text.trim()));
                default -> throw new IllegalStateException("Unexpected enrichment field: " + field);
            }
        });
    }
}
