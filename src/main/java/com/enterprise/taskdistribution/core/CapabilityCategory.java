package com.enterprise.taskdistribution.core;

/**
 * Coarse grouping of capabilities, used for category-based agent lookups
 */
public enum CapabilityCategory {
    LANGUAGE,
    CODE,
    REASONING,
    DATA,
    DOMAIN,
    TASK,
    MODEL
}
