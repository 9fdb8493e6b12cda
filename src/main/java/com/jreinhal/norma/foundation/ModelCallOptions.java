package com.jreinhal.norma.foundation;

/**
 * Per-call overrides on top of the tier defaults. Null fields keep the tier value.
 */
public record ModelCallOptions(Double temperature, Integer maxTokens, Long timeoutMs) {

    public static ModelCallOptions defaults() {
        return new ModelCallOptions(null, null, null);
    }

    public static ModelCallOptions of(double temperature, int maxTokens, long timeoutMs) {
        return new ModelCallOptions(temperature, maxTokens, timeoutMs);
    }

    public ModelCallOptions withTimeoutMs(long timeout) {
        return new ModelCallOptions(this.temperature, this.maxTokens, timeout);
    }
}
