package com.jreinhal.norma.reasoning;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.support.TestDocuments;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReasoningTransformerTest {

    private final ReasoningTransformer transformer = new ReasoningTransformer();

    @Test
    void labelsConfidence() {
        assertThat(ReasoningTransformer.confidenceLabel(0.85)).isEqualTo("alta");
        assertThat(ReasoningTransformer.confidenceLabel(0.8)).isEqualTo("alta");
        assertThat(ReasoningTransformer.confidenceLabel(0.6)).isEqualTo("media");
        assertThat(ReasoningTransformer.confidenceLabel(0.2)).isEqualTo("bassa");
        assertThat(ReasoningTransformer.confidenceLabel(null)).isEqualTo("non disponibile");
    }

    @Test
    void chainKeepsThemeAndSources() {
        ChainOfThought chain = new ChainOfThought("Aliquota IVA", List.of("[1] DPR 633/1972", "doc-42: Circolare 12/E"),
                List.of("art. 16", "22%"), "L'aliquota ordinaria è del 22%", 0.9);

        PublicReasoning reasoning = transformer.transform(ReasoningTrace.of(chain));

        assertThat(reasoning.mainTheme()).isEqualTo("Aliquota IVA");
        assertThat(reasoning.confidenceLabel()).isEqualTo("alta");
        assertThat(reasoning.primarySources()).containsExactly("DPR 633/1972", "Circolare 12/E");
        assertThat(reasoning.whySelected()).contains("art. 16");
        assertThat(reasoning.riskWarning()).isNull();
    }

    @Test
    void degradedChainHasNoConfidence() {
        ChainOfThought chain = new ChainOfThought("IVA", List.of(), List.of(), "Sintesi", 0.9);

        assertThat(transformer.transform(ReasoningTrace.degraded(chain, "ragionamento non disponibile")).confidenceLabel())
                .isEqualTo("non disponibile");
    }

    @Test
    void capsSourcesAndSummarizesTheRest() {
        List<String> sources = ReasoningTransformer.sources(
                List.of("Legge 190/2014", "Circolare 9/E/2019", "Risoluzione 5/E/2023", "FAQ IVA", "Guida forfettario"), List.of());

        assertThat(sources).containsExactly("Legge 190/2014", "Circolare 9/E/2019", "Risoluzione 5/E/2023", "e altre 2 fonti");
    }

    @Test
    void resolvesIndexCitationsToReferences() {
        List<RankedDocument> documents = List.of(
                TestDocuments.ranked("law", "Testo", "Legge 190/2014", SourceType.LAW, null));

        assertThat(ReasoningTransformer.sources(List.of("[1]", "Legge 190/2014"), documents)).containsExactly("Legge 190/2014");
    }

    @Test
    void treeHidesIdsAndWarnsAboutCriminalRisk() {
        Hypothesis selected = new Hypothesis("H1", "Secondo H1 la norma si applica", "Il regime spetta", 0.7,
                List.of("Legge 190/2014"), 1.3, 0.91, RiskLevel.LOW, List.of(), null);
        Hypothesis risky = new Hypothesis("H2", "Scenario", "Reato di frode", 0.2, List.of(), 0.5, 0.1,
                RiskLevel.CRITICAL, List.of("reato"), null);
        Hypothesis other = new Hypothesis("H3", "Prassi", "Spetta con limiti", 0.5, List.of(), 0.5, 0.25,
                RiskLevel.MEDIUM, List.of(), null);
        TreeOfThoughts tree = new TreeOfThoughts(List.of(selected, risky, other), "H1", "H1 selezionata", List.of("H2"),
                List.of(), false, false);

        PublicReasoning reasoning = transformer.transform(ReasoningTrace.of(tree));

        assertThat(reasoning.mainTheme()).isEqualTo("Secondo la norma si applica");
        assertThat(reasoning.selectedScenario()).isEqualTo("Il regime spetta");
        assertThat(reasoning.confidenceLabel()).isEqualTo("media");
        assertThat(reasoning.alternativesNote()).isEqualTo("Sono state valutate anche 2 interpretazioni alternative.");
        assertThat(reasoning.riskWarning()).contains("responsabilità penale");
        assertThat(reasoning.toString()).doesNotContain("H1", "H2", "0.91");
    }

    @Test
    void treeMentionsDomainConflicts() {
        Hypothesis fiscal = new Hypothesis("H1", "p", "20%", 0.8, List.of(), 1, 0.8, RiskLevel.HIGH, List.of(), "fiscale");
        Hypothesis labour = new Hypothesis("H2", "p", "33%", 0.7, List.of(), 1, 0.7, RiskLevel.LOW, List.of(), "lavoro");
        TreeOfThoughts tree = new TreeOfThoughts(List.of(fiscal, labour), "H1", "", List.of(),
                List.of(new DomainConflict("fiscale", "H1", "lavoro", "H2", "Valori diversi")), false, true);

        PublicReasoning reasoning = transformer.transform(ReasoningTrace.of(tree));

        assertThat(reasoning.alternativesNote()).startsWith("È stata valutata anche un'interpretazione alternativa.")
                .contains("non del tutto coerenti");
        assertThat(reasoning.riskWarning()).contains("sanzioni rilevanti");
    }
}
