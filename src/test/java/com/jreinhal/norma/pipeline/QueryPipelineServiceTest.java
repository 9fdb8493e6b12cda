package com.jreinhal.norma.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.norma.dto.QueryAnswerResponse;
import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.exception.PipelineUnavailableException;
import com.jreinhal.norma.foundation.ComplexityClassification;
import com.jreinhal.norma.foundation.ComplexityClassifier;
import com.jreinhal.norma.foundation.CostTracker;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.foundation.QueryComplexity;
import com.jreinhal.norma.golden.GoldenLoopController;
import com.jreinhal.norma.golden.GoldenLoopResult;
import com.jreinhal.norma.model.PipelineRequest;
import com.jreinhal.norma.rag.expansion.QueryExpansion;
import com.jreinhal.norma.rag.expansion.QueryExpansionService;
import com.jreinhal.norma.rag.expansion.QueryVariantSet;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.RetrievalFusionService;
import com.jreinhal.norma.rag.fusion.RetrievalResult;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.rag.hyde.HypotheticalDocument;
import com.jreinhal.norma.rag.router.QueryRouter;
import com.jreinhal.norma.rag.router.RoutingCategory;
import com.jreinhal.norma.rag.router.RoutingDecision;
import com.jreinhal.norma.reasoning.ChainOfThought;
import com.jreinhal.norma.reasoning.ReasoningEngine;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.reasoning.ReasoningTransformer;
import com.jreinhal.norma.support.TestDocuments;
import com.jreinhal.norma.synthesis.CandidateAction;
import com.jreinhal.norma.synthesis.CitedSource;
import com.jreinhal.norma.synthesis.ConflictAnalysis;
import com.jreinhal.norma.synthesis.SynthesisResult;
import com.jreinhal.norma.synthesis.SynthesisService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.test.util.ReflectionTestUtils;

class QueryPipelineServiceTest {

    private static final String QUERY = "Qual è l'aliquota IVA ordinaria?";
    private static final ChainOfThought CHAIN = new ChainOfThought("Aliquota IVA ordinaria", List.of("[1]"),
            List.of("art. 16 DPR 633/1972", "22%"), "L'aliquota ordinaria è del 22%", 0.92);
    private static final CandidateAction ACTION = new CandidateAction("a1", "Applica il 22% a una fattura", "calculator",
            "Come applico l'aliquota del 22% a una fattura da 1.000 euro?", "[1]");

    private QueryRouter router;
    private QueryExpansionService expansionService;
    private RetrievalFusionService fusionService;
    private ComplexityClassifier classifier;
    private ReasoningEngine reasoningEngine;
    private SynthesisService synthesisService;
    private GoldenLoopController goldenLoop;
    private ModelOrchestrator orchestrator;
    private QueryPipelineService service;
    private List<RankedDocument> documents;

    @BeforeEach
    void setUp() {
        router = mock(QueryRouter.class);
        expansionService = mock(QueryExpansionService.class);
        fusionService = mock(RetrievalFusionService.class);
        classifier = mock(ComplexityClassifier.class);
        reasoningEngine = mock(ReasoningEngine.class);
        synthesisService = mock(SynthesisService.class);
        goldenLoop = mock(GoldenLoopController.class);
        orchestrator = mock(ModelOrchestrator.class);
        service = new QueryPipelineService(router, expansionService, fusionService, classifier, reasoningEngine,
                synthesisService, goldenLoop, new ReasoningTransformer(), orchestrator,
                new CostTracker(new SimpleMeterRegistry()),
                Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC));
        ReflectionTestUtils.setField(service, "deadlineMs", 25_000L);
        ReflectionTestUtils.setField(service, "retrievalBudgetMs", 2_000L);
        ReflectionTestUtils.setField(service, "includeTechnicalTrace", true);
        service.init();
        documents = List.of(TestDocuments.ranked("law", "Art. 16: l'aliquota IVA ordinaria è del 22%.", "DPR 633/1972",
                SourceType.LAW, LocalDate.of(1972, 10, 26)));
    }

    private void routeAs(RoutingCategory category) {
        when(router.route(eq(QUERY), anyList())).thenReturn(new RoutingDecision(category, 0.92, "", List.of(), false, false));
    }

    private void stubResearchStages(ReasoningTrace reasoning) {
        routeAs(RoutingCategory.TECHNICAL_RESEARCH);
        when(expansionService.expand(eq(QUERY), eq(RoutingCategory.TECHNICAL_RESEARCH), anyList(), anyList()))
                .thenReturn(new QueryExpansion(new QueryVariantSet(QUERY, "aliquota IVA ordinaria", QUERY,
                        "IVA aliquota ordinaria DPR 633/1972", false), HypotheticalDocument.skipped("disabled"), null));
        when(fusionService.retrieve(any(QueryVariantSet.class), any(HypotheticalDocument.class), anyLong()))
                .thenReturn(new RetrievalResult(documents, Map.of(), List.of(), 12L));
        when(classifier.classify(anyString(), anyList(), anyBoolean(), anyBoolean()))
                .thenReturn(new ComplexityClassification(QueryComplexity.SIMPLE, List.of("fiscale"), 0.9, "", false));
        when(reasoningEngine.execute(anyString(), any(RetrievalResult.class), any(), anyList(), anyLong())).thenReturn(reasoning);
        when(goldenLoop.run(anyList(), any(), any(RequestDeadline.class)))
                .thenReturn(new GoldenLoopResult(List.of(ACTION), 0, false, 3L, 1, false, 1.0));
    }

    private static SynthesisResult synthesis(String disclaimer, boolean degraded) {
        return new SynthesisResult("L'aliquota IVA ordinaria è del 22% [1].", null, null,
                List.of(new CitedSource("DPR 633/1972", "law", SourceType.LAW, 1, 1.0, LocalDate.of(1972, 10, 26))),
                List.of(ACTION), null, ConflictAnalysis.none(), false, degraded, disclaimer);
    }

    private void synthesisReturns(SynthesisResult result) {
        when(synthesisService.synthesize(anyString(), anyList(), any(), any(), anyList(), any(), anyLong())).thenReturn(result);
    }

    @Nested
    class Research {

        @Test
        void answersSimpleVatQuestion() {
            stubResearchStages(ReasoningTrace.of(CHAIN));
            synthesisReturns(synthesis(null, false));
            PipelineRequest request = new PipelineRequest(QUERY, List.of(), null, "session-1", "req-1");

            QueryAnswerResponse response = service.process(request);

            assertThat(response.answer()).isEqualTo("L'aliquota IVA ordinaria è del 22% [1].");
            assertThat(response.category()).isEqualTo("technical_research");
            assertThat(response.complexity()).isEqualTo("simple");
            assertThat(response.degraded()).isFalse();
            assertThat(response.disclaimer()).isNull();
            assertThat(response.suggestedActions()).containsExactly(ACTION);
            assertThat(response.sourcesCited()).extracting(CitedSource::reference).containsExactly("DPR 633/1972");
            assertThat(response.publicReasoning().confidenceLabel()).isEqualTo("alta");
            assertThat(response.reasoningTrace()).isNotNull();
            assertThat(response.traceId()).isEqualTo("req-1");
            assertThat(response.sessionId()).isEqualTo("session-1");
            assertThat(response.stages()).extracting(stage -> stage.get("stage")).containsExactly("routing", "expansion",
                    "retrieval", "classification", "reasoning", "synthesis", "golden_loop");
            verify(fusionService).retrieve(any(QueryVariantSet.class), any(HypotheticalDocument.class), eq(2_000L));
            assertThat(MDC.get(CostTracker.MDC_REQUEST_ID)).isNull();
        }

        @Test
        void degradedReasoningAddsDisclaimer() {
            stubResearchStages(ReasoningTrace.degraded(CHAIN, "tree-of-thoughts non disponibile"));
            synthesisReturns(synthesis(null, false));

            QueryAnswerResponse response = service.process(PipelineRequest.of(QUERY));

            assertThat(response.degraded()).isTrue();
            assertThat(response.disclaimer()).startsWith("Il ragionamento strutturato non è stato completato");
            assertThat(response.publicReasoning().confidenceLabel()).isEqualTo("non disponibile");
        }

        @Test
        void synthesisDisclaimerTakesPrecedence() {
            stubResearchStages(ReasoningTrace.of(CHAIN));
            synthesisReturns(synthesis(SynthesisService.DEGRADED_DISCLAIMER, true));

            QueryAnswerResponse response = service.process(PipelineRequest.of(QUERY));

            assertThat(response.degraded()).isTrue();
            assertThat(response.disclaimer()).isEqualTo(SynthesisService.DEGRADED_DISCLAIMER);
        }

        @Test
        void technicalTraceCanBeOmitted() {
            ReflectionTestUtils.setField(service, "includeTechnicalTrace", false);
            stubResearchStages(ReasoningTrace.of(CHAIN));
            synthesisReturns(synthesis(null, false));

            QueryAnswerResponse response = service.process(PipelineRequest.of(QUERY));

            assertThat(response.reasoningTrace()).isNull();
            assertThat(response.publicReasoning()).isNotNull();
        }

        @Test
        void synthesisWithoutModelOrEvidenceFails() {
            stubResearchStages(ReasoningTrace.of(CHAIN));
            when(synthesisService.synthesize(anyString(), anyList(), any(), any(), anyList(), any(), anyLong()))
                    .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "all providers failed", null));
            PipelineRequest request = new PipelineRequest(QUERY, List.of(), null, "session-1", "req-9");

            assertThatThrownBy(() -> service.process(request))
                    .isInstanceOf(PipelineUnavailableException.class)
                    .satisfies(e -> assertThat(((PipelineUnavailableException) e).getRequestId()).isEqualTo("req-9"));
            assertThat(MDC.get(CostTracker.MDC_REQUEST_ID)).isNull();
        }
    }

    @Nested
    class CasualChat {

        @Test
        void answersWithoutRetrievalOrReasoning() {
            routeAs(RoutingCategory.CASUAL_CHAT);
            when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                    .thenReturn(TestDocuments.reply("Ciao! Come posso aiutarti oggi?"));

            QueryAnswerResponse response = service.process(PipelineRequest.of(QUERY));

            assertThat(response.answer()).isEqualTo("Ciao! Come posso aiutarti oggi?");
            assertThat(response.category()).isEqualTo("casual_chat");
            assertThat(response.complexity()).isNull();
            assertThat(response.suggestedActions()).isEmpty();
            assertThat(response.stages()).extracting(stage -> stage.get("stage")).containsExactly("routing", "casual_reply");
            verifyNoInteractions(expansionService, fusionService, classifier, reasoningEngine, synthesisService, goldenLoop);
        }

        @Test
        void unavailableModelUsesCannedReply() {
            routeAs(RoutingCategory.CASUAL_CHAT);
            when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                    .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "down", null));

            QueryAnswerResponse response = service.process(PipelineRequest.of(QUERY));

            assertThat(response.answer()).isEqualTo(QueryPipelineService.CASUAL_FALLBACK_ANSWER);
            assertThat(response.degraded()).isTrue();
        }
    }
}
