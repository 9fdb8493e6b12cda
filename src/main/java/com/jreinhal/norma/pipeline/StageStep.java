package com.jreinhal.norma.pipeline;

import java.util.Map;

/**
 * One timed pipeline stage. {@code degraded} marks a stage that answered through its
 * fallback path.
 */
public record StageStep(StageType type, String label, String detail, long durationMs, boolean degraded,
                        Map<String, Object> data) {

    public StageStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static StageStep of(StageType type, String label, String detail, long durationMs, boolean degraded) {
        return new StageStep(type, label, detail, durationMs, degraded, Map.of());
    }

    public enum StageType {
        ROUTING,
        EXPANSION,
        RETRIEVAL,
        CLASSIFICATION,
        REASONING,
        SYNTHESIS,
        GOLDEN_LOOP,
        CASUAL_REPLY,
        ERROR
    }
}
