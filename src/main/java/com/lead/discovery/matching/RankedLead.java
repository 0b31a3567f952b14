package com.lead.discovery.matching;

import com.lead.discovery.core.model.Lead;
import com.lead.discovery.core.model.MatchStatus;

import java.util.List;

/**
 * A lead ranked for one service, with its stored or freshly computed score.
 *
 * @param freshlyScored true when the score was computed during this ranking
 */
public record RankedLead(
        Lead lead,
        double matchScore,
        MatchStatus matchStatus,
        List<String> reasons,
        boolean freshlyScored
) {
    public RankedLead {
        reasons = List.copyOf(reasons);
    }
}
