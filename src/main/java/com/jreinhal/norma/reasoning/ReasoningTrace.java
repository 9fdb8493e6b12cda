package com.jreinhal.norma.reasoning;

import java.util.List;

/**
 * Tagged union over the two reasoning shapes. Exactly one of {@code chainOfThought} and
 * {@code treeOfThoughts} is set, as indicated by {@code type}.
 */
public record ReasoningTrace(ReasoningType type, ChainOfThought chainOfThought, TreeOfThoughts treeOfThoughts,
                             boolean degraded, String degradedReason) {

    public ReasoningTrace {
        if (type == ReasoningType.CHAIN_OF_THOUGHT && (chainOfThought == null || treeOfThoughts != null)) {
            throw new IllegalArgumentException("CHAIN_OF_THOUGHT trace requires only chainOfThought");
        }
        if (type == ReasoningType.TREE_OF_THOUGHTS && (treeOfThoughts == null || chainOfThought != null)) {
            throw new IllegalArgumentException("TREE_OF_THOUGHTS trace requires only treeOfThoughts");
        }
    }

    public static ReasoningTrace of(ChainOfThought chainOfThought) {
        return new ReasoningTrace(ReasoningType.CHAIN_OF_THOUGHT, chainOfThought, null, false, null);
    }

    public static ReasoningTrace of(TreeOfThoughts treeOfThoughts) {
        return new ReasoningTrace(ReasoningType.TREE_OF_THOUGHTS, null, treeOfThoughts, false, null);
    }

    public static ReasoningTrace degraded(ChainOfThought chainOfThought, String reason) {
        return new ReasoningTrace(ReasoningType.CHAIN_OF_THOUGHT, chainOfThought, null, true, reason);
    }

    public String conclusion() {
        return switch (this.type) {
            case CHAIN_OF_THOUGHT -> this.chainOfThought.conclusion();
            case TREE_OF_THOUGHTS -> this.treeOfThoughts.selected().map(Hypothesis::conclusion).orElse("");
        };
    }

    public List<String> sources() {
        return switch (this.type) {
            case CHAIN_OF_THOUGHT -> this.chainOfThought.sourcesUsed();
            case TREE_OF_THOUGHTS -> this.treeOfThoughts.selected().map(Hypothesis::sourcesCited).orElse(List.of());
        };
    }
}
