package com.jreinhal.norma.foundation;

public enum ReasoningStrategy {
    CHAIN_OF_THOUGHT,
    TREE_OF_THOUGHTS,
    TREE_OF_THOUGHTS_MULTI_DOMAIN;

    public boolean isMultiHypothesis() {
        return this != CHAIN_OF_THOUGHT;
    }
}
