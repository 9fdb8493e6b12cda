package com.jreinhal.norma.foundation;

/**
 * What the reasoning and synthesis stages run with for one request.
 */
public record ExecutionPlan(QueryComplexity complexity, ModelTier tier, ReasoningStrategy strategy,
                            String promptTemplate, ModelCallOptions callOptions, int maxHypotheses) {

    public long timeoutMs() {
        return this.callOptions.timeoutMs() == null ? 0L : this.callOptions.timeoutMs();
    }

    /**
     * Same tier and budget, single-path reasoning. Used when the deadline cannot
     * absorb a multi-hypothesis pass.
     */
    public ExecutionPlan downgradedToChain() {
        return new ExecutionPlan(this.complexity, this.tier, ReasoningStrategy.CHAIN_OF_THOUGHT,
                ModelSelector.TEMPLATE_COT, this.callOptions, 1);
    }
}
