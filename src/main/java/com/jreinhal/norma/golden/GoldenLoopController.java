package com.jreinhal.norma.golden;

import com.jreinhal.norma.pipeline.RequestDeadline;
import com.jreinhal.norma.synthesis.CandidateAction;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validate, then regenerate up to {@code maxIterations} times with exponential backoff,
 * then fall back to safe actions. The loop is bounded by its counter alone, and the
 * result always carries at least one action.
 */
@Service
public class GoldenLoopController {
    private static final Logger log = LoggerFactory.getLogger(GoldenLoopController.class);

    private final ActionValidator actionValidator;
    private final ActionRegenerator actionRegenerator;
    private final GoldenLoopProperties properties;
    private final GoldenLoopMetrics metrics;
    private Sleeper sleeper = Thread::sleep;

    public GoldenLoopController(ActionValidator actionValidator, ActionRegenerator actionRegenerator,
                                GoldenLoopProperties properties, GoldenLoopMetrics metrics) {
        this.actionValidator = actionValidator;
        this.actionRegenerator = actionRegenerator;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PostConstruct
    public void init() {
        this.properties.validate();
        log.info("Golden loop initialized (maxIterations={}, backoff={}ms x{} max {}ms, minValid={})",
                this.properties.getMaxIterations(), this.properties.getInitialBackoffMs(),
                this.properties.getBackoffMultiplier(), this.properties.getMaxBackoffMs(),
                this.properties.getMinValidActions());
    }

    public GoldenLoopResult run(List<CandidateAction> actions, ResponseContext context, RequestDeadline deadline) {
        BatchValidationResult validation = this.actionValidator.validateBatch(actions, context, this.properties.isDedupe());
        return this.regenerateIfNeeded(actions, validation, context, deadline);
    }

    public GoldenLoopResult regenerateIfNeeded(List<CandidateAction> actions, BatchValidationResult validation,
                                               ResponseContext context, RequestDeadline deadline) {
        long start = System.currentTimeMillis();
        int minValid = this.properties.getMinValidActions();
        List<CandidateAction> accepted = new ArrayList<>(validation.validatedActions());
        if (accepted.size() >= minValid) {
            return this.finish(accepted, 0, false, false, start, validation.qualityScore());
        }

        log.info("Golden loop: {}/{} actions valid, regenerating (rejections={})", accepted.size(),
                actions == null ? 0 : actions.size(), validation.rejectionLog());
        List<String> rejectionLog = new ArrayList<>(validation.rejectionLog());
        long backoff = this.properties.getInitialBackoffMs();
        int iterations = 0;
        for (int attempt = 1; attempt <= this.properties.getMaxIterations(); attempt++) {
            long delay = attempt == 1 ? 0L : backoff;
            if (deadline != null && !deadline.canAfford(delay + this.properties.getRegenerationTimeoutMs())) {
                log.warn("Golden loop: {}ms left on the request deadline, skipping regeneration attempt {}",
                        deadline.remainingMs(), attempt);
                break;
            }
            if (delay > 0L && !this.pause(delay)) {
                break;
            }
            if (attempt > 1) {
                backoff = Math.min((long) (backoff * this.properties.getBackoffMultiplier()), this.properties.getMaxBackoffMs());
            }
            iterations = attempt;
            List<CandidateAction> regenerated = this.actionRegenerator.attemptRegeneration(context, rejectionLog, attempt);
            List<CandidateAction> combined = new ArrayList<>(accepted);
            combined.addAll(regenerated);
            BatchValidationResult batch = this.actionValidator.validateBatch(combined, context, this.properties.isDedupe());
            accepted = new ArrayList<>(batch.validatedActions());
            rejectionLog = new ArrayList<>(batch.rejectionLog());
            this.metrics.recordIteration(attempt, accepted.size());
            if (accepted.size() >= minValid) {
                return this.finish(accepted, iterations, true, false, start, validation.qualityScore());
            }
        }

        log.warn("Golden loop: regeneration exhausted after {} attempts with {} valid actions, using safe fallback",
                iterations, accepted.size());
        List<CandidateAction> combined = new ArrayList<>(accepted);
        combined.addAll(this.actionRegenerator.generateSafeFallback(context));
        List<CandidateAction> finalActions = new ArrayList<>(
                this.actionValidator.validateBatch(combined, null, this.properties.isDedupe()).validatedActions());
        if (finalActions.isEmpty()) {
            finalActions.add(ActionRegenerator.LAST_RESORT);
        }
        return this.finish(finalActions, iterations, true, true, start, validation.qualityScore());
    }

    private GoldenLoopResult finish(List<CandidateAction> actions, int iterations, boolean regenerated, boolean fallback,
                                    long start, double initialQuality) {
        List<CandidateAction> capped = actions.size() > this.properties.getMaxActions()
                ? actions.subList(0, this.properties.getMaxActions())
                : actions;
        GoldenLoopResult result = new GoldenLoopResult(capped, iterations, regenerated,
                System.currentTimeMillis() - start, capped.size(), fallback, initialQuality);
        this.metrics.record(result);
        return result;
    }

    private boolean pause(long delayMs) {
        try {
            this.sleeper.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Golden loop: interrupted during backoff, stopping regeneration");
            return false;
        }
    }

    void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
