package com.lead.discovery.merge;

/**
 * Notified after a profile merge has been committed, e.g. to drop cached lookups.
 */
public interface MergeListener {

    /**
     * @param sourceProfileId the profile that was merged away and no longer exists
     * @param targetProfileId the surviving profile
     */
    void onMerge(String sourceProfileId, String targetProfileId);
}
