package com.lead.discovery.core.model;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH
}
