package com.enterprise.taskdistribution.planning;

import com.enterprise.taskdistribution.core.Capability;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One step of a decomposition template: the id suffix, what the step does,
 * how its capabilities derive from the parent's, and when it applies.
 */
public class StepTemplate {

    private final String suffix;
    private final String description;
    private final Function<List<Capability>, List<Capability>> capabilitySelector;
    private final Predicate<List<Capability>> condition;

    public StepTemplate(String suffix, String description,
                        Function<List<Capability>, List<Capability>> capabilitySelector,
                        Predicate<List<Capability>> condition) {
        this.suffix = suffix;
        this.description = description;
        this.capabilitySelector = capabilitySelector;
        this.condition = condition;
    }

    public StepTemplate(String suffix, String description,
                        Function<List<Capability>, List<Capability>> capabilitySelector) {
        this(suffix, description, capabilitySelector, parent -> true);
    }

    public String getSuffix() {
        return suffix;
    }

    public String getDescription() {
        return description;
    }

    public boolean appliesTo(List<Capability> parentCapabilities) {
        return condition.test(parentCapabilities);
    }

    /**
     * Capabilities this step requires. Falls back to the parent's full list
     * when the selector leaves nothing.
     */
    public List<Capability> selectCapabilities(List<Capability> parentCapabilities) {
        List<Capability> selected = capabilitySelector.apply(parentCapabilities);
        return selected.isEmpty() ? parentCapabilities : selected;
    }
}
