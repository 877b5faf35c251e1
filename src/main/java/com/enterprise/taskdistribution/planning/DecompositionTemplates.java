package com.enterprise.taskdistribution.planning;

import com.enterprise.taskdistribution.core.Capability;
import com.enterprise.taskdistribution.core.CapabilityCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Fixed step templates per archetype. Each step depends on the one before it.
 */
public final class DecompositionTemplates {

    private static final Map<TaskArchetype, List<StepTemplate>> TEMPLATES = new EnumMap<>(TaskArchetype.class);

    static {
        TEMPLATES.put(TaskArchetype.CODE, List.of(
            new StepTemplate("analysis", "Analyze requirements and plan implementation approach",
                only(Capability.CRITICAL_ANALYSIS)),
            new StepTemplate("implement", "Implement the planned solution",
                filter(c -> c.getCategory() == CapabilityCategory.CODE)),
            new StepTemplate("test", "Test implementation and review code quality",
                only(Capability.CODE_REVIEW)),
            new StepTemplate("optimize", "Optimize code for better performance",
                only(Capability.CODE_OPTIMIZATION),
                parent -> parent.contains(Capability.CODE_OPTIMIZATION))
        ));

        TEMPLATES.put(TaskArchetype.WRITING, List.of(
            new StepTemplate("research", "Research and gather information",
                only(Capability.RESEARCH)),
            new StepTemplate("outline", "Create detailed outline",
                filter(c -> c.name().endsWith("_WRITING"))),
            new StepTemplate("write", "Write initial content",
                Function.identity()),
            new StepTemplate("review", "Review and refine content",
                only(Capability.CRITICAL_ANALYSIS))
        ));

        TEMPLATES.put(TaskArchetype.ANALYSIS, List.of(
            new StepTemplate("gather", "Gather relevant data and information",
                only(Capability.RESEARCH)),
            new StepTemplate("analyze", "Analyze gathered information",
                filter(c -> c.name().endsWith("_ANALYSIS"))),
            new StepTemplate("synthesize", "Synthesize findings and draw conclusions",
                only(Capability.CRITICAL_ANALYSIS)),
            new StepTemplate("report", "Create detailed report of findings",
                only(Capability.TECHNICAL_WRITING))
        ));

        TEMPLATES.put(TaskArchetype.GENERAL, List.of(
            new StepTemplate("plan", "Plan approach and identify requirements",
                only(Capability.CRITICAL_ANALYSIS)),
            new StepTemplate("execute", "Execute planned approach",
                Function.identity()),
            new StepTemplate("review", "Review results and ensure quality",
                only(Capability.CRITICAL_ANALYSIS))
        ));
    }

    private DecompositionTemplates() {
    }

    /**
     * Steps of an archetype that apply to a parent with the given capabilities
     */
    public static List<StepTemplate> stepsFor(TaskArchetype archetype, List<Capability> parentCapabilities) {
        return TEMPLATES.getOrDefault(archetype, Collections.emptyList()).stream()
            .filter(step -> step.appliesTo(parentCapabilities))
            .collect(Collectors.toUnmodifiableList());
    }

    private static Function<List<Capability>, List<Capability>> only(Capability capability) {
        return parent -> List.of(capability);
    }

    private static Function<List<Capability>, List<Capability>> filter(Predicate<Capability> predicate) {
        return parent -> parent.stream().filter(predicate).collect(Collectors.toList());
    }
}
