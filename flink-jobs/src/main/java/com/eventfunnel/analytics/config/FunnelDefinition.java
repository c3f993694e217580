package com.eventfunnel.analytics.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, distinct event types forming the funnel. Step indexes are one-based.
 */
public final class FunnelDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final List<String> steps;
    private final Map<String, Integer> stepIndexByEventType;

    private FunnelDefinition(String name, List<String> steps, Map<String, Integer> stepIndexByEventType) {
        this.name = name;
        this.steps = steps;
        this.stepIndexByEventType = stepIndexByEventType;
    }

    public static FunnelDefinition of(String... steps) {
        return of("funnel", List.of(steps));
    }

    /**
     * @throws ConfigurationException if fewer than two steps are given, or a step is blank or repeated
     */
    public static FunnelDefinition of(String name, List<String> steps) {
        if (steps == null || steps.size() < 2) {
            throw new ConfigurationException("Funnel definition requires at least 2 steps, got "
                    + (steps == null ? 0 : steps.size()));
        }
        List<String> normalized = new ArrayList<>(steps.size());
        Map<String, Integer> byType = new HashMap<>();
        for (String step : steps) {
            if (step == null || step.isBlank()) {
                throw new ConfigurationException("Funnel step " + (normalized.size() + 1) + " is blank");
            }
            String eventType = step.trim();
            if (byType.putIfAbsent(eventType, normalized.size() + 1) != null) {
                throw new ConfigurationException("Duplicate funnel step: " + eventType);
            }
            normalized.add(eventType);
        }
        String resolvedName = name == null || name.isBlank() ? "funnel" : name;
        return new FunnelDefinition(resolvedName, Collections.unmodifiableList(normalized), Collections.unmodifiableMap(byType));
    }

    public String name() {
        return name;
    }

    public List<String> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    public String eventTypeAt(int stepIndex) {
        return steps.get(stepIndex - 1);
    }

    /** @return the one-based step index of the event type, or -1 when it is not part of the funnel */
    public int stepIndexOf(String eventType) {
        Integer index = stepIndexByEventType.get(eventType);
        return index == null ? -1 : index;
    }

    public boolean contains(String eventType) {
        return stepIndexByEventType.containsKey(eventType);
    }

    @Override
    public String toString() {
        return name + steps;
    }
}
