package com.jreinhal.norma.reasoning;

import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.RetrievalResult;
import com.jreinhal.norma.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs the reasoning strategy chosen by the execution plan and degrades along
 * ToT → CoT → evidence-only trace. The returned trace is never null.
 */
@Service
public class ReasoningEngine {
    private static final Logger log = LoggerFactory.getLogger(ReasoningEngine.class);

    private final ChainOfThoughtReasoner chainOfThoughtReasoner;
    private final TreeOfThoughtsReasoner treeOfThoughtsReasoner;

    @Value("${norma.reasoning.min-tot-budget-ms:15000}")
    private long minTreeBudgetMs;

    public ReasoningEngine(ChainOfThoughtReasoner chainOfThoughtReasoner, TreeOfThoughtsReasoner treeOfThoughtsReasoner) {
        this.chainOfThoughtReasoner = chainOfThoughtReasoner;
        this.treeOfThoughtsReasoner = treeOfThoughtsReasoner;
    }

    @PostConstruct
    public void init() {
        if (this.minTreeBudgetMs < 0L) {
            log.warn("Invalid norma.reasoning.min-tot-budget-ms {}, using 15000", this.minTreeBudgetMs);
            this.minTreeBudgetMs = 15_000L;
        }
        log.info("Reasoning engine initialized (minTotBudget={}ms)", this.minTreeBudgetMs);
    }

    /**
     * @param remainingBudgetMs time left on the request deadline, or 0 for no limit
     */
    public ReasoningTrace execute(String query, RetrievalResult retrieval, ExecutionPlan plan, List<String> domains,
                                  long remainingBudgetMs) {
        List<RankedDocument> documents = retrieval == null ? List.of() : retrieval.documents();
        ExecutionPlan effective = plan;
        if (plan.strategy().isMultiHypothesis() && remainingBudgetMs > 0L && remainingBudgetMs < this.minTreeBudgetMs) {
            log.warn("Reasoning: {}ms left, downgrading {} to chain-of-thought", remainingBudgetMs, plan.strategy());
            effective = plan.downgradedToChain();
        }

        if (effective.strategy().isMultiHypothesis()) {
            Optional<TreeOfThoughts> tree = this.treeOfThoughtsReasoner.reason(query, documents, effective, domains,
                    remainingBudgetMs);
            if (tree.isPresent()) {
                TreeOfThoughts result = tree.get();
                log.info("Reasoning: ToT selected {} of {} hypotheses (flagged={}, conflicts={}, needsReview={})",
                        result.selectedHypothesisId(), result.hypotheses().size(), result.flaggedAlternativeIds().size(),
                        result.domainConflicts().size(), result.needsReview());
                return ReasoningTrace.of(result);
            }
            log.warn("Reasoning: ToT failed for {}, falling back to chain-of-thought", LogSanitizer.querySummary(query));
        }

        Optional<ChainOfThought> chain = this.chainOfThoughtReasoner.reason(query, documents, effective);
        if (chain.isPresent()) {
            if (effective.strategy().isMultiHypothesis()) {
                return ReasoningTrace.degraded(chain.get(), "tree-of-thoughts non disponibile");
            }
            return ReasoningTrace.of(chain.get());
        }
        log.warn("Reasoning: all model calls failed, building trace from {} retrieved documents", documents.size());
        return ReasoningTrace.degraded(ChainOfThoughtReasoner.fromContext(query, documents), "ragionamento non disponibile");
    }
}
