package com.enterprise.taskdistribution.planning;

import com.enterprise.taskdistribution.core.Capability;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Broad kind of work a composite task represents. Decides which step
 * template the task is decomposed with.
 * <p>
 * Constants are declared in classification order: the first archetype whose
 * trigger capabilities intersect the task's required capabilities wins.
 */
public enum TaskArchetype {
    CODE(EnumSet.of(Capability.CODE_GENERATION, Capability.CODE_REVIEW, Capability.CODE_OPTIMIZATION)),
    WRITING(EnumSet.of(Capability.TECHNICAL_WRITING, Capability.CREATIVE_WRITING)),
    ANALYSIS(EnumSet.of(Capability.DATA_ANALYSIS, Capability.CRITICAL_ANALYSIS, Capability.RESEARCH)),
    GENERAL(EnumSet.noneOf(Capability.class));

    private final Set<Capability> triggers;

    TaskArchetype(Set<Capability> triggers) {
        this.triggers = triggers;
    }

    public boolean matches(Collection<Capability> capabilities) {
        for (Capability capability : capabilities) {
            if (triggers.contains(capability)) {
                return true;
            }
        }
        return false;
    }

    public static TaskArchetype classify(Collection<Capability> capabilities) {
        for (TaskArchetype archetype : values()) {
            if (archetype.matches(capabilities)) {
                return archetype;
            }
        }
        return GENERAL;
    }
}
