package com.jreinhal.norma.foundation;

public record ModelReply(String text, String provider, String model, ModelTier tier, int tokensIn, int tokensOut,
                         double costUsd, long latencyMs, boolean degraded) {

    public ModelReply {
        text = text == null ? "" : text;
    }
}
