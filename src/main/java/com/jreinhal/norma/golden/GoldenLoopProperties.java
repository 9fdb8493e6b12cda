package com.jreinhal.norma.golden;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "norma.golden-loop")
public class GoldenLoopProperties {
    private static final Logger log = LoggerFactory.getLogger(GoldenLoopProperties.class);

    private int maxIterations = 2;
    private long initialBackoffMs = 100L;
    private double backoffMultiplier = 2.0;
    private long maxBackoffMs = 1000L;
    private int minValidActions = 2;
    private int maxActions = 4;
    private long regenerationTimeoutMs = 5000L;
    private boolean dedupe = true;

    /**
     * Resets out-of-range values to their defaults.
     */
    public void validate() {
        if (this.maxIterations < 0 || this.maxIterations > 5) {
            log.warn("Invalid norma.golden-loop.max-iterations {}, using 2", this.maxIterations);
            this.maxIterations = 2;
        }
        if (this.initialBackoffMs < 0L) {
            log.warn("Invalid norma.golden-loop.initial-backoff-ms {}, using 100", this.initialBackoffMs);
            this.initialBackoffMs = 100L;
        }
        if (this.backoffMultiplier < 1.0) {
            log.warn("Invalid norma.golden-loop.backoff-multiplier {}, using 2.0", this.backoffMultiplier);
            this.backoffMultiplier = 2.0;
        }
        if (this.maxBackoffMs < this.initialBackoffMs) {
            log.warn("norma.golden-loop.max-backoff-ms {} below initial backoff, using {}", this.maxBackoffMs,
                    Math.max(1000L, this.initialBackoffMs));
            this.maxBackoffMs = Math.max(1000L, this.initialBackoffMs);
        }
        if (this.minValidActions < 1) {
            log.warn("Invalid norma.golden-loop.min-valid-actions {}, using 2", this.minValidActions);
            this.minValidActions = 2;
        }
        if (this.maxActions < this.minValidActions) {
            log.warn("norma.golden-loop.max-actions {} below min-valid-actions, using 4", this.maxActions);
            this.maxActions = Math.max(4, this.minValidActions);
        }
        if (this.regenerationTimeoutMs <= 0L) {
            log.warn("Invalid norma.golden-loop.regeneration-timeout-ms {}, using 5000", this.regenerationTimeoutMs);
            this.regenerationTimeoutMs = 5000L;
        }
    }

    public int getMaxIterations() {
        return this.maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public long getInitialBackoffMs() {
        return this.initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public double getBackoffMultiplier() {
        return this.backoffMultiplier;
    }

    public void setBackoffMultiplier(double backoffMultiplier) {
        this.backoffMultiplier = backoffMultiplier;
    }

    public long getMaxBackoffMs() {
        return this.maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public int getMinValidActions() {
        return this.minValidActions;
    }

    public void setMinValidActions(int minValidActions) {
        this.minValidActions = minValidActions;
    }

    public int getMaxActions() {
        return this.maxActions;
    }

    public void setMaxActions(int maxActions) {
        this.maxActions = maxActions;
    }

    public long getRegenerationTimeoutMs() {
        return this.regenerationTimeoutMs;
    }

    public void setRegenerationTimeoutMs(long regenerationTimeoutMs) {
        this.regenerationTimeoutMs = regenerationTimeoutMs;
    }

    public boolean isDedupe() {
        return this.dedupe;
    }

    public void setDedupe(boolean dedupe) {
        this.dedupe = dedupe;
    }
}
