package com.lead.discovery.privacy;

public enum SensitiveField {
    EMAIL,
    PHONE,
    IP_ADDRESS,
    IDENTIFIER
}
