package com.lead.discovery.identity;

/**
 * Two profiles whose identifiers share digest values. {@code firstProfileId} sorts before
 * {@code secondProfileId}.
 */
public record DuplicateProfilePair(String firstProfileId, String secondProfileId, int sharedIdentifiers) {

    public DuplicateProfilePair {
        if (firstProfileId.compareTo(secondProfileId) > 0) {
            String swap = firstProfileId;
            firstProfileId = secondProfileId;
            secondProfileId = swap;
        }
    }
}
