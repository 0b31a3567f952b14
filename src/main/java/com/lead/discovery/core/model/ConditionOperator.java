package com.lead.discovery.core.model;

public enum ConditionOperator {
    MIN,
    MAX,
    EQUALS
}
