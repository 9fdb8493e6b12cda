package com.jreinhal.norma.rag.expansion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.norma.exception.ModelUnavailableException;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.rag.hyde.HypotheticalDocument;
import com.jreinhal.norma.rag.hyde.HypotheticalDocumentService;
import com.jreinhal.norma.rag.router.ExtractedEntity;
import com.jreinhal.norma.rag.router.RoutingCategory;
import com.jreinhal.norma.support.TestDocuments;
import java.util.List;
import java.util.concurrent.Executor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class QueryExpansionServiceTest {

    private ModelOrchestrator orchestrator;
    private HypotheticalDocumentService hydeService;
    private QueryExpansionService service;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ModelOrchestrator.class);
        hydeService = mock(HypotheticalDocumentService.class);
        Executor direct = Runnable::run;
        service = new QueryExpansionService(orchestrator, hydeService, new AmbiguityDetector(), direct);
        ReflectionTestUtils.setField(service, "timeoutMs", 3000L);
        ReflectionTestUtils.setField(service, "cacheSize", 100);
        ReflectionTestUtils.setField(service, "cacheTtlSeconds", 60L);
        service.init();
    }

    private void modelReplies(String text) {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenReturn(TestDocuments.reply(text));
    }

    @Test
    void producesThreeVariantsWithExpandedAbbreviations() {
        modelReplies("{\"keyword\": \"aliquota iva prestazioni sanitarie\", \"semantic\": \"Quale aliquota dell'imposta sul valore aggiunto si applica alle prestazioni sanitarie?\", \"entity\": \"IVA art. 10 DPR 633/1972\"}");

        QueryVariantSet variants = service.expandVariants("Aliquota IVA prestazioni sanitarie?", List.of(), List.of());

        assertEquals("aliquota iva prestazioni sanitarie imposta sul valore aggiunto", variants.keywordVariant());
        assertTrue(variants.semanticVariant().contains("prestazioni sanitarie"));
        assertEquals("IVA art. 10 DPR 633/1972", variants.entityVariant());
        assertFalse(variants.degraded());
    }

    @Test
    void failedExpansionPassesOriginalQueryThrough() {
        when(orchestrator.invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class)))
                .thenThrow(new ModelUnavailableException(ModelTier.BASIC, "timeout", null));

        QueryVariantSet variants = service.expandVariants("Scadenza saldo IMU", List.of(), List.of());

        assertTrue(variants.degraded());
        assertEquals("Scadenza saldo IMU", variants.keywordVariant());
        assertEquals("Scadenza saldo IMU", variants.semanticVariant());
        assertEquals("Scadenza saldo IMU", variants.entityVariant());
        assertEquals(1, variants.distinctVariants().size());
    }

    @Test
    void unparseableExpansionPassesOriginalQueryThrough() {
        modelReplies("keyword: IMU, semantic: ...");

        assertTrue(service.expandVariants("Scadenza saldo IMU", List.of(), List.of()).degraded());
    }

    @Test
    void repeatedQueriesWithoutHistoryHitTheCache() {
        modelReplies("{\"keyword\": \"tfr\", \"semantic\": \"trattamento di fine rapporto\", \"entity\": \"TFR art. 2120 c.c.\"}");
        List<ExtractedEntity> entities = List.of(new ExtractedEntity("TFR", "concept", 0.9));

        QueryVariantSet first = service.expandVariants("Come si calcola il TFR?", entities, List.of());
        QueryVariantSet second = service.expandVariants("come si calcola il tfr?", entities, List.of());

        assertSame(first, second);
        verify(orchestrator, times(1)).invoke(eq(ModelTier.BASIC), anyString(), anyString(), any(ModelCallOptions.class));
    }

    @Test
    void expandCombinesVariantsHypotheticalDocumentAndAmbiguity() {
        modelReplies("{\"keyword\": \"iva forfettario\", \"semantic\": \"IVA nel regime forfettario\", \"entity\": \"IVA forfettario\"}");
        HypotheticalDocument hyde = HypotheticalDocument.multi(List.of(
                new HypotheticalDocument.Variant("IVA nel forfettario", "I contribuenti forfettari non addebitano l'IVA...", 7),
                new HypotheticalDocument.Variant("IVA in generale", "L'aliquota ordinaria è del 22%...", 6)));
        when(hydeService.generate(anyString(), eq(RoutingCategory.TECHNICAL_RESEARCH), anyList(), any(AmbiguityAssessment.class)))
                .thenReturn(hyde);
        List<ConversationTurn> history = List.of(new ConversationTurn("user", "Regime forfettario: requisiti?"));

        QueryExpansion expansion = service.expand("E per l'IVA?", RoutingCategory.TECHNICAL_RESEARCH, List.of(), history);

        assertTrue(expansion.ambiguity().isAmbiguous());
        assertSame(hyde, expansion.hypotheticalDocument());
        assertEquals(2, expansion.hypotheticalDocument().searchTexts().size());
        assertFalse(expansion.variants().degraded());
    }

    @Test
    void hypotheticalDocumentFailureIsSkippedNotPropagated() {
        modelReplies("{\"keyword\": \"imu\", \"semantic\": \"imposta municipale\", \"entity\": \"IMU\"}");
        when(hydeService.generate(anyString(), any(), anyList(), any(AmbiguityAssessment.class)))
                .thenThrow(new IllegalStateException("boom"));

        QueryExpansion expansion = service.expand("Scadenza saldo IMU seconda casa", RoutingCategory.TECHNICAL_RESEARCH,
                List.of(), List.of());

        assertTrue(expansion.hypotheticalDocument().skipped());
        assertFalse(expansion.variants().degraded());
    }
}
