package com.jreinhal.norma.reasoning;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.norma.foundation.ComplexityClassification;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelSelector;
import com.jreinhal.norma.foundation.QueryComplexity;
import com.jreinhal.norma.foundation.ReasoningStrategy;
import com.jreinhal.norma.rag.fusion.RetrievalResult;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.support.TestDocuments;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

class ReasoningEngineTest {

    private static final RetrievalResult RETRIEVAL = new RetrievalResult(List.of(
            TestDocuments.ranked("law", "L'aliquota IVA ordinaria è del 22%.", "DPR 633/1972", SourceType.LAW,
                    LocalDate.of(1972, 10, 26))), Map.of(), List.of(), 10L);

    private ChainOfThoughtReasoner chainReasoner;
    private TreeOfThoughtsReasoner treeReasoner;
    private ReasoningEngine engine;

    @BeforeEach
    void setUp() {
        chainReasoner = mock(ChainOfThoughtReasoner.class);
        treeReasoner = mock(TreeOfThoughtsReasoner.class);
        engine = new ReasoningEngine(chainReasoner, treeReasoner);
        ReflectionTestUtils.setField(engine, "minTreeBudgetMs", 15_000L);
        engine.init();
    }

    private static ExecutionPlan plan(QueryComplexity complexity) {
        return ModelSelector.select(new ComplexityClassification(complexity, List.of(), 0.9, "", false));
    }

    private static ChainOfThought chain() {
        return new ChainOfThought("Aliquota IVA", List.of("[1]"), List.of("22%"), "L'aliquota ordinaria è del 22%", 0.9);
    }

    @Test
    void simpleQuestionUsesChainOfThought() {
        when(chainReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class))).thenReturn(Optional.of(chain()));

        ReasoningTrace trace = engine.execute("Aliquota IVA?", RETRIEVAL, plan(QueryComplexity.SIMPLE), List.of(), 20_000L);

        assertEquals(ReasoningType.CHAIN_OF_THOUGHT, trace.type());
        assertFalse(trace.degraded());
        verify(treeReasoner, never()).reason(anyString(), anyList(), any(), anyList(), anyLong());
    }

    @Test
    void complexQuestionUsesTreeOfThoughts() {
        Hypothesis h = new Hypothesis("H1", "p", "c", 0.8, List.of(), 0.5, 0.4, RiskLevel.LOW, List.of(), null);
        TreeOfThoughts tree = new TreeOfThoughts(List.of(h), "H1", "H1", List.of(), List.of(), false, false);
        when(treeReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class), anyList(), anyLong())).thenReturn(Optional.of(tree));

        ReasoningTrace trace = engine.execute("Domanda complessa", RETRIEVAL, plan(QueryComplexity.COMPLEX), List.of("fiscale"), 0L);

        assertEquals(ReasoningType.TREE_OF_THOUGHTS, trace.type());
        assertEquals("c", trace.conclusion());
    }

    @Test
    void failedTreeFallsBackToDegradedChain() {
        when(treeReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class), anyList(), anyLong())).thenReturn(Optional.empty());
        when(chainReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class))).thenReturn(Optional.of(chain()));

        ReasoningTrace trace = engine.execute("Domanda complessa", RETRIEVAL, plan(QueryComplexity.COMPLEX), List.of(), 40_000L);

        assertEquals(ReasoningType.CHAIN_OF_THOUGHT, trace.type());
        assertTrue(trace.degraded());
        assertEquals("tree-of-thoughts non disponibile", trace.degradedReason());
    }

    @Test
    void everythingFailingStillReturnsTraceFromEvidence() {
        when(treeReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class), anyList(), anyLong())).thenReturn(Optional.empty());
        when(chainReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class))).thenReturn(Optional.empty());

        ReasoningTrace trace = engine.execute("Domanda complessa", RETRIEVAL, plan(QueryComplexity.COMPLEX), List.of(), 0L);

        assertNotNull(trace);
        assertTrue(trace.degraded());
        assertEquals(List.of("DPR 633/1972"), trace.sources());
        assertNotNull(trace.chainOfThought().keyPoints());
    }

    @Test
    void shortBudgetDowngradesTreeToChain() {
        when(chainReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class))).thenReturn(Optional.of(chain()));

        ReasoningTrace trace = engine.execute("Domanda complessa", RETRIEVAL, plan(QueryComplexity.COMPLEX), List.of(), 5_000L);

        assertEquals(ReasoningType.CHAIN_OF_THOUGHT, trace.type());
        verify(treeReasoner, never()).reason(anyString(), anyList(), any(), anyList(), anyLong());
        ArgumentCaptor<ExecutionPlan> used = ArgumentCaptor.forClass(ExecutionPlan.class);
        verify(chainReasoner).reason(anyString(), anyList(), used.capture());
        assertEquals(ReasoningStrategy.CHAIN_OF_THOUGHT, used.getValue().strategy());
    }

    @Test
    void nullRetrievalIsTreatedAsNoEvidence() {
        when(chainReasoner.reason(anyString(), anyList(), any(ExecutionPlan.class))).thenReturn(Optional.empty());

        ReasoningTrace trace = engine.execute("Domanda", null, plan(QueryComplexity.SIMPLE), List.of(), 0L);

        assertTrue(trace.degraded());
        assertTrue(trace.sources().isEmpty());
    }
}
