package com.jreinhal.norma.pipeline;

import com.jreinhal.norma.dto.QueryAnswerResponse;
import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.exception.PipelineUnavailableException;
import com.jreinhal.norma.foundation.ComplexityClassification;
import com.jreinhal.norma.foundation.ComplexityClassifier;
import com.jreinhal.norma.foundation.CostSnapshot;
import com.jreinhal.norma.foundation.CostTracker;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelSelector;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.golden.GoldenLoopController;
import com.jreinhal.norma.golden.GoldenLoopResult;
import com.jreinhal.norma.golden.ResponseContext;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.model.PipelineRequest;
import com.jreinhal.norma.rag.expansion.QueryExpansion;
import com.jreinhal.norma.rag.expansion.QueryExpansionService;
import com.jreinhal.norma.rag.fusion.RetrievalFusionService;
import com.jreinhal.norma.rag.fusion.RetrievalResult;
import com.jreinhal.norma.rag.router.QueryRouter;
import com.jreinhal.norma.rag.router.RoutingDecision;
import com.jreinhal.norma.reasoning.PublicReasoning;
import com.jreinhal.norma.reasoning.ReasoningEngine;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.reasoning.ReasoningTransformer;
import com.jreinhal.norma.synthesis.SynthesisResult;
import com.jreinhal.norma.synthesis.SynthesisService;
import com.jreinhal.norma.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one question through routing, expansion, retrieval, complexity classification,
 * reasoning, synthesis and the Golden Loop under a single request deadline. Each stage
 * degrades on its own; only a synthesis failure with no evidence to fall back on
 * propagates, as {@link PipelineUnavailableException}.
 */
@Service
public class QueryPipelineService {
    private static final Logger log = LoggerFactory.getLogger(QueryPipelineService.class);

    private static final String CASUAL_SYSTEM_PROMPT = """
            Sei l'assistente di uno studio professionale italiano. Rispondi in modo cordiale e breve,
            in italiano, e ricorda che puoi aiutare su questioni fiscali, del lavoro e legali.
            """;
    static final String CASUAL_FALLBACK_ANSWER =
            "Ciao! Sono qui per aiutarti con domande fiscali, del lavoro e legali. Come posso esserti utile?";

    private final QueryRouter queryRouter;
    private final QueryExpansionService queryExpansionService;
    private final RetrievalFusionService retrievalFusionService;
    private final ComplexityClassifier complexityClassifier;
    private final ReasoningEngine reasoningEngine;
    private final SynthesisService synthesisService;
    private final GoldenLoopController goldenLoopController;
    private final ReasoningTransformer reasoningTransformer;
    private final ModelOrchestrator modelOrchestrator;
    private final CostTracker costTracker;
    private final Clock clock;

    @Value("${norma.pipeline.deadline-ms:25000}")
    private long deadlineMs;
    @Value("${norma.pipeline.retrieval-budget-ms:2000}")
    private long retrievalBudgetMs;
    @Value("${norma.pipeline.include-technical-trace:true}")
    private boolean includeTechnicalTrace;

    public QueryPipelineService(QueryRouter queryRouter, QueryExpansionService queryExpansionService,
                                RetrievalFusionService retrievalFusionService, ComplexityClassifier complexityClassifier,
                                ReasoningEngine reasoningEngine, SynthesisService synthesisService,
                                GoldenLoopController goldenLoopController, ReasoningTransformer reasoningTransformer,
                                ModelOrchestrator modelOrchestrator, CostTracker costTracker, Clock clock) {
        this.queryRouter = queryRouter;
        this.queryExpansionService = queryExpansionService;
        this.retrievalFusionService = retrievalFusionService;
        this.complexityClassifier = complexityClassifier;
        this.reasoningEngine = reasoningEngine;
        this.synthesisService = synthesisService;
        this.goldenLoopController = goldenLoopController;
        this.reasoningTransformer = reasoningTransformer;
        this.modelOrchestrator = modelOrchestrator;
        this.costTracker = costTracker;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (this.deadlineMs <= 0L) {
            log.warn("Invalid norma.pipeline.deadline-ms {}, using 25000", this.deadlineMs);
            this.deadlineMs = 25_000L;
        }
        if (this.retrievalBudgetMs <= 0L) {
            log.warn("Invalid norma.pipeline.retrieval-budget-ms {}, using 2000", this.retrievalBudgetMs);
            this.retrievalBudgetMs = 2000L;
        }
        log.info("Query pipeline initialized (deadline={}ms, retrievalBudget={}ms, technicalTrace={})",
                this.deadlineMs, this.retrievalBudgetMs, this.includeTechnicalTrace);
    }

    /**
     * @throws PipelineUnavailableException when no model could synthesize an answer and no
     *                                      evidence was retrieved
     */
    public QueryAnswerResponse process(PipelineRequest request) {
        return withRequestContext(request, () -> {
            log.info("Pipeline: start {} (history={}, attachment={})", LogSanitizer.querySummary(request.query()),
                    request.history().size(), request.hasAttachedDocument());
            PreparedQuery prepared = this.prepare(request);
            if (prepared.isCasualChat()) {
                return this.casualReply(prepared);
            }
            return this.complete(prepared);
        });
    }

    /**
     * Runs {@code work} with the request and session ids in the MDC, restoring it afterwards.
     */
    public static <T> T withRequestContext(PipelineRequest request, Supplier<T> work) {
        MDC.put(CostTracker.MDC_REQUEST_ID, request.requestId());
        MDC.put(CostTracker.MDC_SESSION_ID, request.sessionId());
        try {
            return work.get();
        } finally {
            MDC.remove(CostTracker.MDC_REQUEST_ID);
            MDC.remove(CostTracker.MDC_SESSION_ID);
        }
    }

    /**
     * Every stage up to and including reasoning. Callers are expected to have set the MDC.
     */
    public PreparedQuery prepare(PipelineRequest request) {
        RequestDeadline deadline = RequestDeadline.start(this.clock, this.deadlineMs);
        PipelineTrace trace = new PipelineTrace(request.requestId(), request.sessionId());
        List<ConversationTurn> history = request.history();

        RoutingDecision routing = this.timed(trace, StageStep.StageType.ROUTING, "Routing",
                () -> this.queryRouter.route(request.query(), history),
                decision -> decision.category().wireName() + " (" + String.format("%.2f", decision.confidence()) + ")",
                decision -> decision.fallback());
        if (!routing.category().needsRetrieval()) {
            return new PreparedQuery(request, deadline, trace, routing, null, null, null, null, null);
        }

        QueryExpansion expansion = this.timed(trace, StageStep.StageType.EXPANSION, "Query expansion",
                () -> this.queryExpansionService.expand(request.query(), routing.category(), routing.extractedEntities(), history),
                e -> e.variants().distinctVariants().size() + " variants, hyde "
                        + (e.hypotheticalDocument().skipped() ? "skipped" : e.hypotheticalDocument().searchTexts().size() + " text(s)"),
                e -> e.variants().degraded());

        long retrievalBudget = Math.min(this.retrievalBudgetMs, deadline.remainingMs());
        RetrievalResult retrieval = this.timed(trace, StageStep.StageType.RETRIEVAL, "Retrieval fusion",
                () -> this.retrievalFusionService.retrieve(expansion.variants(), expansion.hypotheticalDocument(), retrievalBudget),
                r -> r.documents().size() + " documents, failed channels " + r.failedChannels(),
                r -> !r.failedChannels().isEmpty());

        ComplexityClassification classification = this.timed(trace, StageStep.StageType.CLASSIFICATION, "Complexity",
                () -> this.complexityClassifier.classify(request.query(), ComplexityClassifier.detectDomains(request.query()),
                        request.hasHistory(), request.hasAttachedDocument()),
                c -> c.complexity() + " " + c.domains(),
                c -> c.fallback());
        ExecutionPlan plan = ModelSelector.select(classification);

        ReasoningTrace reasoning = this.timed(trace, StageStep.StageType.REASONING, "Reasoning",
                () -> this.reasoningEngine.execute(request.query(), retrieval, plan, classification.domains(),
                        deadline.remainingMs()),
                r -> r.type().name().toLowerCase(),
                r -> r.degraded());
        return new PreparedQuery(request, deadline, trace, routing, expansion, retrieval, classification, plan, reasoning);
    }

    /**
     * Synthesis, Golden Loop and response assembly for a prepared question.
     */
    public QueryAnswerResponse complete(PreparedQuery prepared) {
        PipelineRequest request = prepared.request();
        PipelineTrace trace = prepared.trace();
        SynthesisResult synthesis;
        try {
            synthesis = this.timed(trace, StageStep.StageType.SYNTHESIS, "Synthesis",
                    () -> this.synthesisService.synthesize(request.query(), prepared.documents(), prepared.reasoning(),
                            prepared.plan(), request.history(), request.attachedDocument(), prepared.deadline().remainingMs()),
                    s -> s.sourcesCited().size() + " sources, " + s.candidateActions().size() + " actions",
                    s -> s.degraded());
        } catch (ModelUnavailableException e) {
            trace.addStep(StageStep.of(StageStep.StageType.ERROR, "Synthesis", e.getMessage(), 0L, true));
            log.error("Pipeline: request {} failed, no model available and no evidence: {}", request.requestId(), e.getMessage());
            throw new PipelineUnavailableException(request.requestId(), "Synthesis unavailable for request " + request.requestId(), e);
        }
        return this.finish(prepared, synthesis);
    }

    /**
     * Golden Loop and response assembly for an already synthesized answer.
     */
    public QueryAnswerResponse finish(PreparedQuery prepared, SynthesisResult synthesis) {
        PipelineRequest request = prepared.request();
        PipelineTrace trace = prepared.trace();
        ResponseContext context = ResponseContext.from(request.query(), synthesis, prepared.documents());
        GoldenLoopResult golden = this.timed(trace, StageStep.StageType.GOLDEN_LOOP, "Golden loop",
                () -> this.goldenLoopController.run(synthesis.candidateActions(), context, prepared.deadline()),
                g -> g.finalValidCount() + " actions, " + g.iterationsUsed() + " regeneration(s)",
                GoldenLoopResult::usedFallback);
        trace.addMetric("goldenLoopQuality", golden.initialQualityScore());

        PublicReasoning publicReasoning = this.reasoningTransformer.transform(prepared.reasoning(), prepared.documents());
        CostSnapshot cost = this.costTracker.forRequest(request.requestId());
        this.costTracker.attribute(prepared.plan().complexity(), cost);
        trace.addMetric("costUsd", cost.costUsd());
        trace.complete();
        log.info("Pipeline: {} answered in {}ms, cost=${}", trace.getSummary(), prepared.deadline().elapsedMs(),
                String.format("%.5f", cost.costUsd()));

        boolean degraded = synthesis.degraded() || prepared.reasoning().degraded();
        String disclaimer = synthesis.disclaimer();
        if (disclaimer == null && prepared.reasoning().degraded()) {
            disclaimer = "Il ragionamento strutturato non è stato completato: la risposta si basa direttamente sulle fonti.";
        }
        return new QueryAnswerResponse(synthesis.answerText(), synthesis.sourcesCited(), golden.actions(),
                synthesis.structuredQuestion(), this.includeTechnicalTrace ? prepared.reasoning() : null, publicReasoning,
                synthesis.conflicts().conflicts(), synthesis.conflicts().summary(), prepared.routing().category().wireName(),
                prepared.classification().complexity().name().toLowerCase(), degraded, disclaimer, cost,
                trace.getStepsAsMaps(), trace.getTraceId(), trace.getSessionId());
    }

    /**
     * Short conversational answer for casual chat: no retrieval, reasoning or Golden Loop.
     */
    public QueryAnswerResponse casualReply(PreparedQuery prepared) {
        PipelineRequest request = prepared.request();
        PipelineTrace trace = prepared.trace();
        long start = System.currentTimeMillis();
        String prompt = ConversationTurn.format(ConversationTurn.lastTurns(request.history(), 3));
        prompt = prompt.isEmpty() ? request.query() : prompt + "\nUtente: " + request.query();
        String answer;
        boolean degraded = false;
        try {
            ModelReply reply = this.modelOrchestrator.invoke(ModelTier.BASIC, CASUAL_SYSTEM_PROMPT, prompt,
                    ModelCallOptions.of(0.7, 200, Math.min(5000L, Math.max(1L, prepared.deadline().remainingMs()))));
            answer = reply.text().isBlank() ? CASUAL_FALLBACK_ANSWER : reply.text().trim();
            degraded = reply.degraded();
        } catch (ModelUnavailableException e) {
            log.warn("Pipeline: casual reply model unavailable ({}), using canned reply", e.getMessage());
            answer = CASUAL_FALLBACK_ANSWER;
            degraded = true;
        }
        trace.addStep(StageStep.of(StageStep.StageType.CASUAL_REPLY, "Casual reply", "no retrieval",
                System.currentTimeMillis() - start, degraded));
        trace.complete();
        CostSnapshot cost = this.costTracker.forRequest(request.requestId());
        return new QueryAnswerResponse(answer, List.of(), List.of(), null, null, null, List.of(), null,
                prepared.routing().category().wireName(), null, degraded, null, cost, trace.getStepsAsMaps(),
                trace.getTraceId(), trace.getSessionId());
    }

    private <T> T timed(PipelineTrace trace, StageStep.StageType type, String label, Supplier<T> stage,
                        Function<T, String> detail, Predicate<T> degraded) {
        long start = System.currentTimeMillis();
        T result;
        try {
            result = stage.get();
        } catch (RuntimeException e) {
            trace.addStep(StageStep.of(StageStep.StageType.ERROR, label + " (failed)", e.getMessage(),
                    System.currentTimeMillis() - start, true));
            throw e;
        }
        long duration = System.currentTimeMillis() - start;
        boolean isDegraded = degraded.test(result);
        trace.addStep(StageStep.of(type, label, detail.apply(result), duration, isDegraded));
        if (isDegraded) {
            log.warn("Pipeline: stage {} degraded for request {}: {}", type, trace.getTraceId(), detail.apply(result));
        }
        return result;
    }
}
