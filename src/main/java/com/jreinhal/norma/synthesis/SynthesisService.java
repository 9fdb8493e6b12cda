package com.jreinhal.norma.synthesis;

import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.util.EvidenceFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One model call producing answer, reasoning summary, cited sources and candidate actions.
 * When the model is unreachable but evidence exists, answers with a disclaimer-labelled
 * summary of the reasoning conclusion and the top sources.
 */
@Service
public class SynthesisService {
    private static final Logger log = LoggerFactory.getLogger(SynthesisService.class);
    public static final String DEGRADED_DISCLAIMER =
            "Risposta generata in modalità ridotta: la sintesi completa non è disponibile, verificare le fonti indicate.";

    private final ModelOrchestrator modelOrchestrator;
    private final SynthesisResponseParser responseParser;
    private final SourceConflictDetector conflictDetector;

    public SynthesisService(ModelOrchestrator modelOrchestrator, SynthesisResponseParser responseParser,
                            SourceConflictDetector conflictDetector) {
        this.modelOrchestrator = modelOrchestrator;
        this.responseParser = responseParser;
        this.conflictDetector = conflictDetector;
    }

    /**
     * @throws ModelUnavailableException when no provider answered and there is no evidence
     *                                   or reasoning to fall back on
     */
    public SynthesisResult synthesize(String query, List<RankedDocument> documents, ReasoningTrace trace,
                                      ExecutionPlan plan, List<ConversationTurn> history, String attachedDocument,
                                      long remainingBudgetMs) {
        List<RankedDocument> context = documents == null ? List.of() : documents;
        String prompt = SynthesisPrompts.userPrompt(query, context, trace, history, attachedDocument);
        ModelCallOptions options = plan.callOptions();
        if (remainingBudgetMs > 0L && (options.timeoutMs() == null || remainingBudgetMs < options.timeoutMs())) {
            options = options.withTimeoutMs(remainingBudgetMs);
        }
        ModelReply reply;
        try {
            reply = this.modelOrchestrator.invoke(plan.tier(), SynthesisPrompts.JSON_SYSTEM, prompt, options);
        } catch (ModelUnavailableException e) {
            if (context.isEmpty() && (trace == null || trace.conclusion().isBlank())) {
                throw e;
            }
            log.warn("Synthesis: model unavailable ({}), building degraded answer from {} documents", e.getMessage(),
                    context.size());
            return this.degraded(trace, context);
        }
        return this.assemble(this.responseParser.parse(reply.text(), context), trace, context, reply.degraded());
    }

    /**
     * Builds the result from an already-produced model output, as the streaming path does.
     */
    public SynthesisResult assemble(SynthesisPayload payload, ReasoningTrace trace, List<RankedDocument> documents,
                                    boolean providerDegraded) {
        ConflictAnalysis conflicts = this.conflictDetector.analyze(payload.sourcesCited(), documents);
        boolean needsRegeneration = !payload.structured() || payload.candidateActions().isEmpty();
        if (!payload.structured()) {
            log.warn("Synthesis: unstructured payload, actions will be regenerated");
        }
        String reasoning = payload.reasoningSummary() != null ? payload.reasoningSummary()
                : trace != null ? trace.conclusion() : null;
        return new SynthesisResult(payload.answerText(), reasoning, trace, payload.sourcesCited(),
                payload.candidateActions(), payload.structuredQuestion(), conflicts, needsRegeneration,
                providerDegraded, providerDegraded ? "Risposta generata dal modello di riserva." : null);
    }

    /**
     * Result for an answer cut short by a provider failure: the partial text is kept,
     * actions go through regeneration and the reduced-mode disclaimer is attached.
     */
    public SynthesisResult interrupted(SynthesisPayload payload, ReasoningTrace trace, List<RankedDocument> documents) {
        SynthesisResult partial = this.assemble(payload, trace, documents, true);
        return new SynthesisResult(partial.answerText(), partial.reasoningSummary(), trace, partial.sourcesCited(),
                partial.candidateActions(), partial.structuredQuestion(), partial.conflicts(), true, true, DEGRADED_DISCLAIMER);
    }

    SynthesisResult degraded(ReasoningTrace trace, List<RankedDocument> documents) {
        StringBuilder answer = new StringBuilder();
        if (trace != null && !trace.conclusion().isBlank()) {
            answer.append(trace.conclusion().trim()).append("\n\n");
        }
        List<RankedDocument> top = documents.subList(0, Math.min(3, documents.size()));
        List<CitedSource> sources = new ArrayList<>();
        if (!top.isEmpty()) {
            answer.append("Fonti principali:\n");
            for (int i = 0; i < top.size(); i++) {
                RankedDocument doc = top.get(i);
                answer.append('[').append(i + 1).append("] ").append(doc.reference()).append(": ")
                        .append(EvidenceFormatter.truncate(doc.content(), 200)).append('\n');
            }
            SynthesisPayload payload = this.responseParser.parse("<answer>" + answer + "</answer>", documents);
            sources.addAll(payload.sourcesCited());
        }
        ConflictAnalysis conflicts = this.conflictDetector.analyze(sources, documents);
        return new SynthesisResult(answer.toString().trim(), trace != null ? trace.conclusion() : null, trace, sources,
                List.of(), null, conflicts, true, true, DEGRADED_DISCLAIMER);
    }
}
