package com.jreinhal.norma.foundation;

public enum ModelTier {
    /** Cheap, fast model: routing, expansion, classification, simple answers. */
    BASIC,
    /** Stronger model for multi-hypothesis reasoning and complex synthesis. */
    ADVANCED
}
