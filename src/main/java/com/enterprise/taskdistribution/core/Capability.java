package com.enterprise.taskdistribution.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Skill tag an agent may possess. The set is closed; every capability belongs
 * to exactly one {@link CapabilityCategory}.
 */
public enum Capability {
    // Language processing
    CREATIVE_WRITING("creative_writing", CapabilityCategory.LANGUAGE),
    TECHNICAL_WRITING("technical_writing", CapabilityCategory.LANGUAGE),
    TRANSLATION("translation", CapabilityCategory.LANGUAGE),
    SUMMARIZATION("summarization", CapabilityCategory.LANGUAGE),

    // Code related
    CODE_GENERATION("code_generation", CapabilityCategory.CODE),
    CODE_REVIEW("code_review", CapabilityCategory.CODE),
    CODE_OPTIMIZATION("code_optimization", CapabilityCategory.CODE),
    CODE_DOCUMENTATION("code_documentation", CapabilityCategory.CODE),

    // Reasoning
    MATH_REASONING("math_reasoning", CapabilityCategory.REASONING),
    LOGICAL_REASONING("logical_reasoning", CapabilityCategory.REASONING),
    CRITICAL_ANALYSIS("critical_analysis", CapabilityCategory.REASONING),

    // Data & research
    DATA_ANALYSIS("data_analysis", CapabilityCategory.DATA),
    DATA_VISUALIZATION("data_visualization", CapabilityCategory.DATA),
    RESEARCH("research", CapabilityCategory.DATA),
    FACT_CHECKING("fact_checking", CapabilityCategory.DATA),

    // Domain specific
    SCIENTIFIC_REASONING("scientific_reasoning", CapabilityCategory.DOMAIN),
    LEGAL_ANALYSIS("legal_analysis", CapabilityCategory.DOMAIN),
    MEDICAL_KNOWLEDGE("medical_knowledge", CapabilityCategory.DOMAIN),
    FINANCIAL_ANALYSIS("financial_analysis", CapabilityCategory.DOMAIN),

    // Task management
    TASK_PLANNING("task_planning", CapabilityCategory.TASK),
    TASK_PRIORITIZATION("task_prioritization", CapabilityCategory.TASK),
    RESOURCE_MANAGEMENT("resource_management", CapabilityCategory.TASK),

    // Model specific
    COMPUTER_USE("computer_use", CapabilityCategory.MODEL);

    private static final Map<String, Capability> BY_VALUE = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Capability::getValue, Function.identity()));

    private final String value;
    private final CapabilityCategory category;

    Capability(String value, CapabilityCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public CapabilityCategory getCategory() {
        return category;
    }

    /**
     * Resolve a capability from its wire value, e.g. {@code code_generation}
     */
    public static Optional<Capability> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_VALUE.get(value.trim().toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    public static Capability parse(String value) {
        return fromValue(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown capability: " + value));
    }
}
