package com.jreinhal.norma.foundation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a {@link ComplexityClassification} to an {@link ExecutionPlan}.
 *
 * <ul>
 *   <li>simple: basic tier, single-path reasoning, 0.3 / 1500 tokens / 30s</li>
 *   <li>complex: advanced tier, multi-hypothesis reasoning, 0.4 / 2500 tokens / 45s</li>
 *   <li>multi-domain: advanced tier, domain-partitioned hypotheses, 0.5 / 3500 tokens / 60s</li>
 * </ul>
 */
public final class ModelSelector {
    private static final Logger log = LoggerFactory.getLogger(ModelSelector.class);

    public static final String TEMPLATE_COT = "cot_fiscal";
    public static final String TEMPLATE_TOT = "tot_fiscal";
    public static final String TEMPLATE_TOT_MULTI_DOMAIN = "tot_multi_domain";
    public static final int DEFAULT_MAX_HYPOTHESES = 4;

    private ModelSelector() {
    }

    public static ExecutionPlan select(ComplexityClassification classification) {
        QueryComplexity complexity = classification == null ? QueryComplexity.SIMPLE : classification.complexity();
        ExecutionPlan plan = switch (complexity) {
            case SIMPLE -> new ExecutionPlan(complexity, ModelTier.BASIC, ReasoningStrategy.CHAIN_OF_THOUGHT,
                    TEMPLATE_COT, ModelCallOptions.of(0.3, 1500, 30_000L), 1);
            case COMPLEX -> new ExecutionPlan(complexity, ModelTier.ADVANCED, ReasoningStrategy.TREE_OF_THOUGHTS,
                    TEMPLATE_TOT, ModelCallOptions.of(0.4, 2500, 45_000L), DEFAULT_MAX_HYPOTHESES);
            case MULTI_DOMAIN -> new ExecutionPlan(complexity, ModelTier.ADVANCED, ReasoningStrategy.TREE_OF_THOUGHTS_MULTI_DOMAIN,
                    TEMPLATE_TOT_MULTI_DOMAIN, ModelCallOptions.of(0.5, 3500, 60_000L), DEFAULT_MAX_HYPOTHESES);
        };
        log.info("Execution plan: complexity={} tier={} strategy={} timeout={}ms", complexity, plan.tier(),
                plan.strategy(), plan.timeoutMs());
        return plan;
    }
}
