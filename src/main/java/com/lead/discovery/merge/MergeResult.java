package com.lead.discovery.merge;

import com.lead.discovery.core.model.Profile;

import java.util.List;

/**
 * Outcome of a committed profile merge.
 *
 * @param survivor          the target profile after absorbing the source
 * @param mergedProfileId   id of the deleted source profile
 * @param movedIdentifiers  identifiers reassigned from source to target
 * @param repointedLeads    leads whose profile reference moved to the target
 */
public record MergeResult(
        Profile survivor,
        String mergedProfileId,
        List<String> movedIdentifiers,
        List<String> repointedLeads
) {
    public MergeResult {
        movedIdentifiers = movedIdentifiers != null ? List.copyOf(movedIdentifiers) : List.of();
        repointedLeads = repointedLeads != null ? List.copyOf(repointedLeads) : List.of();
    }

    public String survivorId() {
        return survivor.getId();
    }
}
