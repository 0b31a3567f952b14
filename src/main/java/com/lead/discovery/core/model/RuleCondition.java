package com.lead.discovery.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single alert-rule condition over an alert's data.
 * Keys prefixed {@code min_} or {@code max_} become numeric bounds on the remaining field
 * name; any other key is an equality check.
 *
 * @param field    data key the condition reads
 * @param operator comparison to apply
 * @param value    threshold or expected value
 */
public record RuleCondition(String field, ConditionOperator operator, Object value) {

    private static final String MIN_PREFIX = "min_";
    private static final String MAX_PREFIX = "max_";

    public RuleCondition {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(operator, "operator is required");
        if (field.isBlank()) {
            throw new IllegalArgumentException("field must not be blank");
        }
        if (operator != ConditionOperator.EQUALS && !(value instanceof Number)) {
            throw new IllegalArgumentException("bound for " + field + " must be numeric: " + value);
        }
    }

    public static RuleCondition min(String field, double bound) {
        return new RuleCondition(field, ConditionOperator.MIN, bound);
    }

    public static RuleCondition max(String field, double bound) {
        return new RuleCondition(field, ConditionOperator.MAX, bound);
    }

    public static RuleCondition equalTo(String field, Object expected) {
        return new RuleCondition(field, ConditionOperator.EQUALS, expected);
    }

    /**
     * Parses one {@code key -> value} entry using the prefix convention.
     */
    public static RuleCondition parse(String key, Object value) {
        if (key.startsWith(MIN_PREFIX)) {
            return new RuleCondition(key.substring(MIN_PREFIX.length()), ConditionOperator.MIN, toNumber(key, value));
        }
        if (key.startsWith(MAX_PREFIX)) {
            return new RuleCondition(key.substring(MAX_PREFIX.length()), ConditionOperator.MAX, toNumber(key, value));
        }
        return new RuleCondition(key, ConditionOperator.EQUALS, value);
    }

    public static List<RuleCondition> parseAll(Map<String, ?> conditions) {
        List<RuleCondition> parsed = new ArrayList<>();
        if (conditions != null) {
            conditions.forEach((key, value) -> parsed.add(parse(key, value)));
        }
        return parsed;
    }

    /**
     * Evaluates the condition. Numeric bounds read a missing field as 0.
     */
    public boolean test(Map<String, Object> data) {
        Object actual = data != null ? data.get(field) : null;
        return switch (operator) {
            case MIN -> numeric(actual) >= ((Number) value).doubleValue();
            case MAX -> numeric(actual) <= ((Number) value).doubleValue();
            case EQUALS -> matchesExactly(actual);
        };
    }

    /**
     * Key form of this condition, the inverse of {@link #parse(String, Object)}.
     */
    public String key() {
        return switch (operator) {
            case MIN -> MIN_PREFIX + field;
            case MAX -> MAX_PREFIX + field;
            case EQUALS -> field;
        };
    }

    private boolean matchesExactly(Object actual) {
        if (actual == null || value == null) {
            return actual == value;
        }
        if (actual instanceof Number a && value instanceof Number v) {
            return Double.compare(a.doubleValue(), v.doubleValue()) == 0;
        }
        return String.valueOf(actual).equals(String.valueOf(value));
    }

    private static double numeric(Object actual) {
        if (actual instanceof Number n) {
            return n.doubleValue();
        }
        if (actual instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static Number toNumber(String key, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Condition " + key + " needs a numeric value: " + value, e);
            }
        }
        throw new IllegalArgumentException("Condition " + key + " needs a numeric value: " + value);
    }
}
