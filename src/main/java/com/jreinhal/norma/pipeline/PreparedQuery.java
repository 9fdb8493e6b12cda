package com.jreinhal.norma.pipeline;

import com.jreinhal.norma.foundation.ComplexityClassification;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.model.PipelineRequest;
import com.jreinhal.norma.rag.expansion.QueryExpansion;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.RetrievalResult;
import com.jreinhal.norma.rag.router.RoutingDecision;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import java.util.List;

/**
 * State of a request after every stage that precedes synthesis. Casual chat stops after
 * routing, so expansion onwards are null.
 */
public record PreparedQuery(PipelineRequest request, RequestDeadline deadline, PipelineTrace trace,
                            RoutingDecision routing, QueryExpansion expansion, RetrievalResult retrieval,
                            ComplexityClassification classification, ExecutionPlan plan, ReasoningTrace reasoning) {

    public boolean isCasualChat() {
        return !this.routing.category().needsRetrieval();
    }

    public List<RankedDocument> documents() {
        return this.retrieval == null ? List.of() : this.retrieval.documents();
    }
}
