package com.lead.discovery.core.model;

/**
 * How a signal was detected.
 */
public enum SignalCategory {
    KEYWORD,
    BEHAVIOR,
    PROBLEM_INDICATOR
}
