package com.jreinhal.norma.synthesis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.foundation.ComplexityClassification;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelSelector;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.foundation.QueryComplexity;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.SourceHierarchy;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.reasoning.ChainOfThought;
import com.jreinhal.norma.reasoning.ReasoningTrace;
import com.jreinhal.norma.support.TestDocuments;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SynthesisServiceTest {

    private static final ExecutionPlan PLAN = ModelSelector.select(
            new ComplexityClassification(QueryComplexity.SIMPLE, List.of("fiscale"), 0.9, "", false));
    private static final ReasoningTrace TRACE = ReasoningTrace.of(new ChainOfThought("IVA", List.of("[1]"),
            List.of("22%"), "L'aliquota ordinaria è del 22%", 0.9));

    private ModelOrchestrator orchestrator;
    private SynthesisService service;
    private List<RankedDocument> documents;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ModelOrchestrator.class);
        service = new SynthesisService(orchestrator, new SynthesisResponseParser(SourceHierarchy.defaults()),
                new SourceConflictDetector());
        documents = List.of(TestDocuments.ranked("law", "Art. 16: l'aliquota IVA ordinaria è del 22%.", "DPR 633/1972",
                SourceType.LAW, LocalDate.of(1972, 10, 26)));
    }

    @Test
    void structuredReplyNeedsNoRegeneration() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenReturn(TestDocuments.reply("{\"answer\": \"L'aliquota è del 22% [1].\", \"suggested_actions\": "
                        + "[{\"label\": \"Calcola l'IVA al 22%\", \"prompt\": \"Quanto è l'IVA al 22% su 1.000 euro?\"}]}"));

        SynthesisResult result = service.synthesize("Aliquota IVA?", documents, TRACE, PLAN, List.of(), null, 0L);

        assertEquals("L'aliquota è del 22% [1].", result.answerText());
        assertFalse(result.needsRegeneration());
        assertFalse(result.degraded());
        assertEquals(1, result.sourcesCited().size());
        assertEquals("L'aliquota ordinaria è del 22%", result.reasoningSummary());
    }

    @Test
    void unstructuredReplyAsksForRegeneration() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenReturn(TestDocuments.reply("L'aliquota ordinaria è del 22%."));

        SynthesisResult result = service.synthesize("Aliquota IVA?", documents, TRACE, PLAN, List.of(), null, 0L);

        assertEquals("L'aliquota ordinaria è del 22%.", result.answerText());
        assertTrue(result.needsRegeneration());
    }

    @Test
    void capsTimeoutToRemainingBudget() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenReturn(TestDocuments.reply("{\"answer\": \"ok\"}"));

        service.synthesize("Aliquota IVA?", documents, TRACE, PLAN, List.of(), null, 4_000L);

        ArgumentCaptor<ModelCallOptions> options = ArgumentCaptor.forClass(ModelCallOptions.class);
        verify(orchestrator).invoke(eq(ModelTier.BASIC), anyString(), anyString(), options.capture());
        assertEquals(4_000L, options.getValue().timeoutMs());
    }

    @Test
    void unavailableModelYieldsDegradedAnswerFromEvidence() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "all providers failed", null));

        SynthesisResult result = service.synthesize("Aliquota IVA?", documents, TRACE, PLAN, List.of(), null, 0L);

        assertTrue(result.degraded());
        assertTrue(result.needsRegeneration());
        assertEquals(SynthesisService.DEGRADED_DISCLAIMER, result.disclaimer());
        assertTrue(result.answerText().startsWith("L'aliquota ordinaria è del 22%"));
        assertTrue(result.answerText().contains("[1] DPR 633/1972"));
        assertEquals("DPR 633/1972", result.sourcesCited().get(0).reference());
        assertTrue(result.candidateActions().isEmpty());
    }

    @Test
    void unavailableModelWithoutContextPropagates() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "all providers failed", null));

        assertThrows(ModelUnavailableException.class,
                () -> service.synthesize("Ciao", List.of(), null, PLAN, List.of(), null, 0L));
    }

    @Test
    void fallbackProviderMarksResultDegraded() {
        SynthesisPayload payload = new SynthesisPayload("Risposta", null, List.of(), List.of(), null, true);

        SynthesisResult result = service.assemble(payload, null, documents, true);

        assertTrue(result.degraded());
        assertTrue(result.needsRegeneration());
        assertNull(result.reasoningSummary());
        assertEquals("Risposta generata dal modello di riserva.", result.disclaimer());
    }

    @Test
    void interruptedAnswerKeepsPartialTextAndForcesRegeneration() {
        CandidateAction partialAction = new CandidateAction("a1", "Calcola l'IVA al 22%", "calculator",
                "Quanto è l'IVA al 22% su 1.000 euro?", null);
        SynthesisPayload partial = new SynthesisPayload("L'aliquota è del", null, List.of(), List.of(partialAction), null, true);

        SynthesisResult result = service.interrupted(partial, TRACE, documents);

        assertEquals("L'aliquota è del", result.answerText());
        assertTrue(result.degraded());
        assertTrue(result.needsRegeneration());
        assertEquals(SynthesisService.DEGRADED_DISCLAIMER, result.disclaimer());
        assertEquals("L'aliquota ordinaria è del 22%", result.reasoningSummary());
    }
}
