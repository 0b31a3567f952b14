package com.lead.discovery.privacy;

/**
 * Categories of stored data with their own retention period.
 */
public enum DataCategory {
    COOKIES,
    PROFILES,
    LEADS,
    TRACKING,
    ANALYTICS,
    OTHER
}
