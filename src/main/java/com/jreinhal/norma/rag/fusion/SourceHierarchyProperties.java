package com.jreinhal.norma.rag.fusion;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Authority multipliers by source type, e.g. {@code norma.hierarchy.weights.circolare=1.15}.
 * Keys may be the Italian label or the enum name.
 */
@Component
@ConfigurationProperties(prefix = "norma.hierarchy")
public class SourceHierarchyProperties {
    private Map<String, Double> weights = new LinkedHashMap<>();

    public Map<String, Double> getWeights() {
        return this.weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }
}
