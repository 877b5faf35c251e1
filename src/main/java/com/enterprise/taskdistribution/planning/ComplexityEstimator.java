package com.enterprise.taskdistribution.planning;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Estimates the relative effort of a subtask from the number of capabilities
 * it needs and the verbs in its description. 1.0 is baseline.
 */
public final class ComplexityEstimator {

    public static final double BASELINE = 1.0;
    public static final double MAX_COMPLEXITY = 5.0;

    private static final double PER_CAPABILITY = 0.2;
    private static final Map<String, Double> KEYWORD_MULTIPLIERS = new LinkedHashMap<>();

    static {
        KEYWORD_MULTIPLIERS.put("optimize", 1.5);
        KEYWORD_MULTIPLIERS.put("improve", 1.3);
        KEYWORD_MULTIPLIERS.put("refactor", 1.4);
        KEYWORD_MULTIPLIERS.put("design", 1.3);
        KEYWORD_MULTIPLIERS.put("implement", 1.2);
        KEYWORD_MULTIPLIERS.put("test", 1.1);
        KEYWORD_MULTIPLIERS.put("debug", 1.3);
        KEYWORD_MULTIPLIERS.put("analyze", 1.2);
        KEYWORD_MULTIPLIERS.put("research", 1.3);
    }

    private ComplexityEstimator() {
    }

    /**
     * @param description Step description; keywords match as case-insensitive substrings
     * @param capabilityCount Number of capabilities the step requires
     * @return Estimated complexity, capped at {@link #MAX_COMPLEXITY}
     */
    public static double estimate(String description, int capabilityCount) {
        double complexity = BASELINE * (1 + capabilityCount * PER_CAPABILITY);
        String text = description != null ? description.toLowerCase(Locale.ROOT) : "";
        for (Map.Entry<String, Double> keyword : KEYWORD_MULTIPLIERS.entrySet()) {
            if (text.contains(keyword.getKey())) {
                complexity *= keyword.getValue();
            }
        }
        return Math.min(complexity, MAX_COMPLEXITY);
    }
}
