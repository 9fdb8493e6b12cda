package com.jreinhal.norma.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request record of stage durations and outcomes. Owned by the request thread.
 */
public class PipelineTrace {

    private final String traceId;
    private final String sessionId;
    private final Instant timestamp;
    private final List<StageStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private boolean completed;

    public PipelineTrace(String traceId, String sessionId) {
        this.traceId = traceId;
        this.sessionId = sessionId;
        this.timestamp = Instant.now();
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    public void addStep(StageStep step) {
        this.steps.add(step);
        this.totalDurationMs += step.durationMs();
    }

    public void addMetric(String key, Object value) {
        this.metrics.put(key, value);
    }

    public void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public String getSessionId() {
        return this.sessionId;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    public List<StageStep> getSteps() {
        return Collections.unmodifiableList(this.steps);
    }

    public Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(this.metrics);
    }

    public long getTotalDurationMs() {
        return this.totalDurationMs;
    }

    public boolean isCompleted() {
        return this.completed;
    }

    public boolean hasDegradedStage() {
        return this.steps.stream().anyMatch(StageStep::degraded);
    }

    /**
     * Steps as maps for the response payload.
     */
    public List<Map<String, Object>> getStepsAsMaps() {
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (StageStep step : this.steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("stage", step.type().name().toLowerCase());
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            stepMap.put("degraded", step.degraded());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        return stepMaps;
    }

    public String getSummary() {
        return String.format("Trace[%s]: %d stages, %dms total, %s%s", this.traceId, this.steps.size(),
                this.totalDurationMs, this.completed ? "COMPLETED" : "IN_PROGRESS",
                this.hasDegradedStage() ? " (degraded)" : "");
    }
}
