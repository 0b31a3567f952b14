package com.lead.discovery.privacy;

public enum TrackingKind {
    COOKIES,
    FINGERPRINTING,
    CROSS_SITE_TRACKING,
    BEHAVIORAL_TRACKING
}
