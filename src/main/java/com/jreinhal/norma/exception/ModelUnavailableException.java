package com.jreinhal.norma.exception;

import com.jreinhal.norma.foundation.ModelTier;

/**
 * Thrown when neither the primary nor the fallback provider of a tier produced a reply.
 */
public class ModelUnavailableException extends RuntimeException {
    private final ModelTier tier;

    public ModelUnavailableException(ModelTier tier, String message, Throwable cause) {
        super(message, cause);
        this.tier = tier;
    }

    public ModelTier getTier() {
        return this.tier;
    }
}
