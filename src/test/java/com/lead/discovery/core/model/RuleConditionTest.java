package com.lead.discovery.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleConditionTest {

    @Test
    void prefixConvention() {
        assertEquals(RuleCondition.min("match_score", 90.0), RuleCondition.parse("min_match_score", 90.0));
        assertEquals(ConditionOperator.MAX, RuleCondition.parse("max_distance_km", "25").operator());
        assertEquals(RuleCondition.equalTo("industry", "retail"), RuleCondition.parse("industry", "retail"));
    }

    @Test
    void nonNumericBound_rejected() {
        assertThrows(IllegalArgumentException.class, () -> RuleCondition.parse("min_match_score", "high"));
        assertThrows(IllegalArgumentException.class,
                () -> new RuleCondition("match_score", ConditionOperator.MIN, "high"));
    }

    @Test
    void numericBounds() {
        RuleCondition min = RuleCondition.min("match_score", 90);
        assertTrue(min.test(Map.of("match_score", 96.7)));
        assertTrue(min.test(Map.of("match_score", 90)));
        assertFalse(min.test(Map.of("match_score", 85.0)));
        assertFalse(min.test(Map.of()), "missing field reads as 0");
        assertTrue(RuleCondition.max("match_score", 10).test(Map.of()));
        assertTrue(min.test(Map.of("match_score", "91.5")));
    }

    @Test
    void equality() {
        assertTrue(RuleCondition.equalTo("count", 3).test(Map.of("count", 3.0)));
        assertTrue(RuleCondition.equalTo("industry", "retail").test(Map.of("industry", "retail")));
        assertFalse(RuleCondition.equalTo("industry", "retail").test(Map.of("industry", "Retail")));
        assertFalse(RuleCondition.equalTo("industry", "retail").test(Map.of()));
    }

    @Test
    void keyRoundTripsThroughParse() {
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put("min_match_score", 80);
        conditions.put("service_id", "svc-1");
        List<RuleCondition> parsed = RuleCondition.parseAll(conditions);

        assertEquals(List.of("min_match_score", "service_id"), parsed.stream().map(RuleCondition::key).toList());
    }

    @Test
    void ruleMatchesWhenEveryConditionHolds() {
        AlertRule rule = AlertRule.builder()
                .ruleName("big retail matches")
                .ruleType(AlertType.HIGH_SCORE_MATCH)
                .conditions(Map.of("min_match_score", 80, "industry", "retail"))
                .build();

        assertTrue(rule.matches(Map.of("match_score", 88.0, "industry", "retail")));
        assertFalse(rule.matches(Map.of("match_score", 88.0, "industry", "mining")));
        assertEquals(java.util.Set.of(AlertChannel.DASHBOARD), rule.getChannels());
    }

    @Test
    void alertStatusMachine() {
        assertTrue(AlertStatus.NEW.canTransitionTo(AlertStatus.READ));
        assertTrue(AlertStatus.NEW.canTransitionTo(AlertStatus.DISMISSED));
        assertTrue(AlertStatus.READ.canTransitionTo(AlertStatus.ACTIONED));
        assertFalse(AlertStatus.NEW.canTransitionTo(AlertStatus.ACTIONED));
        assertFalse(AlertStatus.DISMISSED.canTransitionTo(AlertStatus.READ));
        assertFalse(AlertStatus.ACTIONED.canTransitionTo(AlertStatus.NEW));
    }
}
