package com.jreinhal.norma.reasoning;

import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.util.EvidenceFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a technical {@link ReasoningTrace} into {@link PublicReasoning}. Hypothesis ids,
 * document ids and scores never reach the output.
 */
@Component
public class ReasoningTransformer {
    static final int MAX_SOURCES = 3;
    static final String CONFIDENCE_HIGH = "alta";
    static final String CONFIDENCE_MEDIUM = "media";
    static final String CONFIDENCE_LOW = "bassa";
    static final String CONFIDENCE_UNAVAILABLE = "non disponibile";

    private static final Pattern TECHNICAL_ID = Pattern.compile("^(?:\\[\\d{1,2}]\\s*|(?:doc|chunk|id)[-_:][\\w-]+\\s*[:-]?\\s*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern HYPOTHESIS_ID = Pattern.compile("\\bH\\d+\\b");

    public PublicReasoning transform(ReasoningTrace trace) {
        return this.transform(trace, List.of());
    }

    /**
     * Citations that resolve against {@code documents} are shown by their reference code.
     */
    public PublicReasoning transform(ReasoningTrace trace, List<RankedDocument> documents) {
        if (trace == null) {
            return new PublicReasoning("", "", "", CONFIDENCE_UNAVAILABLE, List.of(), null, null);
        }
        return switch (trace.type()) {
            case CHAIN_OF_THOUGHT -> this.fromChain(trace.chainOfThought(), trace.degraded(), documents);
            case TREE_OF_THOUGHTS -> this.fromTree(trace.treeOfThoughts(), documents);
        };
    }

    private PublicReasoning fromChain(ChainOfThought chain, boolean degraded, List<RankedDocument> documents) {
        String why = chain.keyPoints().isEmpty()
                ? "Conclusione tratta direttamente dalle fonti citate."
                : "Punti chiave: " + String.join("; ", chain.keyPoints().subList(0, Math.min(3, chain.keyPoints().size()))) + ".";
        String label = degraded ? CONFIDENCE_UNAVAILABLE : confidenceLabel(chain.confidence());
        return new PublicReasoning(chain.theme(), chain.conclusion(), why, label, sources(chain.sourcesUsed(), documents), null, null);
    }

    private PublicReasoning fromTree(TreeOfThoughts tree, List<RankedDocument> documents) {
        Hypothesis selected = tree.selected().orElse(null);
        if (selected == null) {
            return new PublicReasoning("", "", "", CONFIDENCE_UNAVAILABLE, List.of(), null, null);
        }
        String why = "È lo scenario meglio supportato dalle fonti più autorevoli tra " + tree.hypotheses().size()
                + " interpretazioni valutate.";
        int alternatives = tree.hypotheses().size() - 1;
        String alternativesNote = null;
        if (alternatives > 0) {
            alternativesNote = alternatives == 1
                    ? "È stata valutata anche un'interpretazione alternativa."
                    : "Sono state valutate anche " + alternatives + " interpretazioni alternative.";
            if (!tree.domainConflicts().isEmpty()) {
                alternativesNote += " Gli ambiti coinvolti portano a conclusioni non del tutto coerenti.";
            }
        }
        return new PublicReasoning(stripIds(selected.path()), stripIds(selected.conclusion()), why,
                confidenceLabel(selected.confidence()), sources(selected.sourcesCited(), documents), alternativesNote,
                riskWarning(tree));
    }

    static String confidenceLabel(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return CONFIDENCE_UNAVAILABLE;
        }
        if (confidence >= 0.8) {
            return CONFIDENCE_HIGH;
        }
        return confidence >= 0.5 ? CONFIDENCE_MEDIUM : CONFIDENCE_LOW;
    }

    static List<String> sources(List<String> cited, List<RankedDocument> documents) {
        List<String> cleaned = new ArrayList<>();
        for (String source : cited) {
            String value = EvidenceFormatter.resolve(source, documents)
                    .map(RankedDocument::reference)
                    .orElseGet(() -> TECHNICAL_ID.matcher(source.trim()).replaceFirst("").trim());
            if (!value.isEmpty() && !cleaned.contains(value)) {
                cleaned.add(value);
            }
        }
        if (cleaned.size() <= MAX_SOURCES) {
            return cleaned;
        }
        List<String> shown = new ArrayList<>(cleaned.subList(0, MAX_SOURCES));
        shown.add("e altre " + (cleaned.size() - MAX_SOURCES) + " fonti");
        return shown;
    }

    private static String riskWarning(TreeOfThoughts tree) {
        RiskLevel worst = RiskLevel.LOW;
        for (Hypothesis hypothesis : tree.hypotheses()) {
            worst = RiskLevel.max(worst, hypothesis.riskLevel());
        }
        return switch (worst) {
            case CRITICAL -> "Attenzione: almeno uno scenario valutato comporta possibili profili di responsabilità penale.";
            case HIGH -> "Attenzione: almeno uno scenario valutato espone a sanzioni rilevanti.";
            case MEDIUM, LOW -> null;
        };
    }

    private static String stripIds(String text) {
        return text == null ? "" : HYPOTHESIS_ID.matcher(text).replaceAll("").replaceAll("\\s{2,}", " ").trim();
    }
}
