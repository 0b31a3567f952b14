package com.lead.discovery.core.model;

public enum LeadType {
    CONSUMER,
    BUSINESS
}
