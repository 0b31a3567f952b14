package com.lead.discovery.matching;

import com.lead.discovery.core.model.ConfidenceLevel;
import com.lead.discovery.core.model.Match;
import com.lead.discovery.core.model.Priority;

import java.time.Instant;
import java.util.List;

/**
 * Scores of one lead against one service, rounded to two decimals, with the reasons
 * that explain them.
 */
public record MatchBreakdown(
        double matchScore,
        double geographicScore,
        double industryScore,
        double needScore,
        double profileScore,
        double behavioralScore,
        ConfidenceLevel confidenceLevel,
        Priority priority,
        List<String> reasons
) {
    public MatchBreakdown {
        reasons = List.copyOf(reasons);
    }

    public Match toMatch(String leadId, String serviceId, Instant computedAt) {
        return Match.builder()
                .leadId(leadId)
                .serviceId(serviceId)
                .matchScore(matchScore)
                .geographicScore(geographicScore)
                .industryScore(industryScore)
                .needScore(needScore)
                .profileScore(profileScore)
                .behavioralScore(behavioralScore)
                .confidenceLevel(confidenceLevel)
                .priority(priority)
                .reasons(reasons)
                .createdAt(computedAt)
                .updatedAt(computedAt)
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "MatchBreakdown{score=%.2f, geographic=%.2f, industry=%.2f, need=%.2f, profile=%.2f, behavioral=%.2f, confidence=%s, priority=%s}",
                matchScore, geographicScore, industryScore, needScore, profileScore, behavioralScore,
                confidenceLevel, priority);
    }
}
