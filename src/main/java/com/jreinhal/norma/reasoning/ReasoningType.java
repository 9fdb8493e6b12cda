package com.jreinhal.norma.reasoning;

public enum ReasoningType {
    CHAIN_OF_THOUGHT,
    TREE_OF_THOUGHTS
}
