package com.jreinhal.norma.rag.fusion;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Effective authority weights: configured overrides on top of {@link SourceType#defaultWeight()}.
 * Values outside [0.0, 1.3] or unknown keys are ignored with a warning.
 */
@Component
public class SourceHierarchy {
    private static final Logger log = LoggerFactory.getLogger(SourceHierarchy.class);
    static final double MAX_WEIGHT = 1.3;

    private final SourceHierarchyProperties properties;
    private final Map<SourceType, Double> weights = new EnumMap<>(SourceType.class);

    public SourceHierarchy(SourceHierarchyProperties properties) {
        this.properties = properties;
        this.resetDefaults();
    }

    public static SourceHierarchy defaults() {
        return new SourceHierarchy(new SourceHierarchyProperties());
    }

    @PostConstruct
    public void init() {
        this.resetDefaults();
        Map<String, Double> configured = this.properties.getWeights();
        if (configured != null) {
            configured.forEach(this::applyOverride);
        }
        log.info("Source hierarchy weights: {}", this.weights);
    }

    private void applyOverride(String key, Double value) {
        SourceType type = null;
        for (SourceType candidate : SourceType.values()) {
            if (candidate.name().equalsIgnoreCase(key) || candidate.label().equalsIgnoreCase(key)) {
                type = candidate;
            }
        }
        if (type == null) {
            log.warn("Unknown source type '{}' in norma.hierarchy.weights, ignored", key);
            return;
        }
        if (value == null || value.isNaN() || value < 0.0 || value > MAX_WEIGHT) {
            log.warn("Invalid hierarchy weight {} for {}, keeping default {}", value, type, type.defaultWeight());
            return;
        }
        this.weights.put(type, value);
    }

    private void resetDefaults() {
        for (SourceType type : SourceType.values()) {
            this.weights.put(type, type.defaultWeight());
        }
    }

    public double weight(SourceType type) {
        return this.weights.getOrDefault(type == null ? SourceType.UNKNOWN : type, 1.0);
    }

    public int rank(SourceType type) {
        return (type == null ? SourceType.UNKNOWN : type).rank();
    }
}
