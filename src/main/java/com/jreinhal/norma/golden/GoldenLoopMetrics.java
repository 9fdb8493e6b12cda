package com.jreinhal.norma.golden;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Micrometer instruments for the Golden Loop. Recording never throws into the request path.
 */
@Component
public class GoldenLoopMetrics {
    private static final Logger log = LoggerFactory.getLogger(GoldenLoopMetrics.class);

    private final Counter runs;
    private final Counter regenerations;
    private final Counter fallbacks;
    private final Counter attempts;
    private final DistributionSummary iterations;
    private final DistributionSummary finalValidActions;
    private final DistributionSummary qualityScore;
    private final Timer duration;

    public GoldenLoopMetrics(MeterRegistry registry) {
        this.runs = Counter.builder("norma.golden_loop.runs").register(registry);
        this.regenerations = Counter.builder("norma.golden_loop.regenerations")
                .description("Runs that needed at least one regeneration attempt").register(registry);
        this.fallbacks = Counter.builder("norma.golden_loop.fallbacks").register(registry);
        this.attempts = Counter.builder("norma.golden_loop.regeneration_attempts").register(registry);
        this.iterations = DistributionSummary.builder("norma.golden_loop.iterations").register(registry);
        this.finalValidActions = DistributionSummary.builder("norma.golden_loop.final_valid_actions").register(registry);
        this.qualityScore = DistributionSummary.builder("norma.golden_loop.initial_quality_score").register(registry);
        this.duration = Timer.builder("norma.golden_loop.duration").register(registry);
    }

    public void recordIteration(int iteration, int validCount) {
        this.attempts.increment();
        log.debug("Golden loop iteration {}: {} valid actions", iteration, validCount);
    }

    public void record(GoldenLoopResult result) {
        try {
            this.runs.increment();
            if (result.regenerationTriggered()) {
                this.regenerations.increment();
            }
            if (result.usedFallback()) {
                this.fallbacks.increment();
            }
            this.iterations.record(result.iterationsUsed());
            this.finalValidActions.record(result.finalValidCount());
            this.qualityScore.record(result.initialQualityScore());
            this.duration.record(result.totalLatencyMs(), TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("Golden loop metrics not recorded: {}", e.getMessage());
        }
        log.info("Golden loop: iterations={} regenerated={} fallback={} finalValid={} duration={}ms",
                result.iterationsUsed(), result.regenerationTriggered(), result.usedFallback(), result.finalValidCount(),
                result.totalLatencyMs());
    }
}
