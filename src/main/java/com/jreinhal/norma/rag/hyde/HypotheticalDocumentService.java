package com.jreinhal.norma.rag.hyde;

import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.rag.expansion.AmbiguityAssessment;
import com.jreinhal.norma.rag.expansion.AmbiguityStrategy;
import com.jreinhal.norma.rag.router.RoutingCategory;
import com.jreinhal.norma.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * HyDE (Hypothetical Document Embeddings) for Italian fiscal and labour questions.
 *
 * <p>Writes the passage an authoritative source would contain, in the register of
 * circolari and testi normativi, so that vector search lands on real documents that
 * read like the answer rather than like the question.</p>
 *
 * <p>Skipped for casual chat and calculations. Ambiguous questions get one passage per
 * plausible reading; a failed reading is dropped and the others are kept.</p>
 */
@Service
public class HypotheticalDocumentService {
    private static final Logger log = LoggerFactory.getLogger(HypotheticalDocumentService.class);

    static final int MIN_WORDS = 150;
    static final int MAX_WORDS = 250;
    private static final int HISTORY_TURNS = 3;

    private static final String SYSTEM_PROMPT = """
            Sei un esperto di normativa fiscale e del lavoro italiana.
            Data una domanda, scrivi il brano che un documento autorevole (legge, circolare
            dell'Agenzia delle Entrate, messaggio INPS) conterrebbe come risposta.
            Regole:
            1. Scrivi come se fossi il documento cercato, non come un assistente.
            2. Usa la terminologia tecnica e i riferimenti normativi tipici delle fonti ufficiali.
            3. Tono formale e fattuale, anche se i dettagli sono plausibili e non verificati.
            4. Lunghezza tra 150 e 250 parole.
            5. Non dire mai che non conosci la risposta.
            """;

    private static final String STANDARD_TEMPLATE = "Domanda: %s\n\nBrano del documento:";

    private static final String CONVERSATIONAL_TEMPLATE = """
            Conversazione precedente:
            %s

            Domanda attuale (da interpretare alla luce della conversazione): %s

            Brano del documento:""";

    private static final String VARIANT_TEMPLATE = """
            Conversazione precedente:
            %s

            La domanda "%s" è ambigua. Considera l'interpretazione n. %d su %d, diversa dalle altre
            (ad esempio: %s).
            Scrivi il brano del documento che risponde a QUESTA interpretazione.
            Prima riga: "Interpretazione: <una frase>". Poi il brano.""";

    private static final List<String> INTERPRETATION_HINTS = List.of(
            "la stessa domanda applicata all'argomento della conversazione precedente",
            "la regola generale, indipendente dalla conversazione",
            "il caso particolare o l'eccezione più frequente");

    private final ModelOrchestrator modelOrchestrator;

    @Value("${norma.hyde.enabled:true}")
    private boolean enabled;

    @Value("${norma.hyde.timeout-ms:4000}")
    private long timeoutMs;

    public HypotheticalDocumentService(ModelOrchestrator modelOrchestrator) {
        this.modelOrchestrator = modelOrchestrator;
    }

    @PostConstruct
    public void init() {
        if (this.timeoutMs <= 0L) {
            log.warn("Invalid norma.hyde.timeout-ms {}, using 4000", this.timeoutMs);
            this.timeoutMs = 4000L;
        }
        log.info("HyDE service initialized (enabled={}, timeout={}ms)", this.enabled, this.timeoutMs);
    }

    public boolean shouldGenerate(RoutingCategory category) {
        return this.enabled && category != RoutingCategory.CASUAL_CHAT && category != RoutingCategory.CALCULATION;
    }

    public HypotheticalDocument generate(String query, RoutingCategory category, List<ConversationTurn> history,
                                         AmbiguityAssessment ambiguity) {
        if (!this.shouldGenerate(category)) {
            return HypotheticalDocument.skipped(this.enabled ? "category " + category.wireName() : "disabled");
        }
        if (query == null || query.isBlank()) {
            return HypotheticalDocument.skipped("empty query");
        }
        List<ConversationTurn> recent = ConversationTurn.lastTurns(history, HISTORY_TURNS);
        String historyText = recent.isEmpty() ? "(nessuna)" : ConversationTurn.format(recent);
        AmbiguityStrategy strategy = ambiguity == null ? AmbiguityStrategy.STANDARD : ambiguity.strategy();
        if (strategy == AmbiguityStrategy.MULTI_VARIANT) {
            return this.generateVariants(query, historyText, Math.max(2, Math.min(3, ambiguity.variantCount())));
        }
        String prompt = strategy == AmbiguityStrategy.CONVERSATIONAL
                ? String.format(CONVERSATIONAL_TEMPLATE, historyText, query)
                : String.format(STANDARD_TEMPLATE, query);
        String text = this.callModel(prompt);
        if (text == null) {
            return HypotheticalDocument.skipped("generation failed");
        }
        HypotheticalDocument document = HypotheticalDocument.single(text, strategy);
        log.info("HyDE: {} generated {} words ({})", LogSanitizer.querySummary(query), document.wordCount(), strategy);
        return document;
    }

    private HypotheticalDocument generateVariants(String query, String historyText, int count) {
        List<HypotheticalDocument.Variant> variants = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            String prompt = String.format(VARIANT_TEMPLATE, historyText, query, i, count, INTERPRETATION_HINTS.get(i - 1));
            String text = this.callModel(prompt);
            if (text == null) {
                log.warn("HyDE: variant {}/{} failed for {}, continuing with the others", i, count, LogSanitizer.querySummary(query));
                continue;
            }
            String interpretation = "interpretazione " + i;
            String body = text;
            if (text.regionMatches(true, 0, "Interpretazione:", 0, 16)) {
                int newline = text.indexOf('\n');
                interpretation = (newline > 0 ? text.substring(16, newline) : text.substring(16)).trim();
                body = newline > 0 ? text.substring(newline + 1).trim() : body;
            }
            if (body.isBlank()) {
                continue;
            }
            variants.add(new HypotheticalDocument.Variant(interpretation, body, HypotheticalDocument.countWords(body)));
        }
        if (variants.isEmpty()) {
            return HypotheticalDocument.skipped("all variants failed");
        }
        log.info("HyDE: {} multi-variant expansion produced {}/{} variants", LogSanitizer.querySummary(query), variants.size(), count);
        return HypotheticalDocument.multi(variants);
    }

    private String callModel(String userPrompt) {
        try {
            ModelReply reply = this.modelOrchestrator.invoke(ModelTier.BASIC, SYSTEM_PROMPT, userPrompt,
                    ModelCallOptions.of(0.7, 450, this.timeoutMs));
            String text = reply.text().trim();
            if (text.isEmpty()) {
                return null;
            }
            return clampWords(text);
        } catch (Exception e) {
            log.warn("HyDE: generation failed: {}", e.getMessage());
            return null;
        }
    }

    static String clampWords(String text) {
        String[] words = text.trim().split("\\s+");
        if (words.length < MIN_WORDS) {
            log.debug("HyDE: passage shorter than {} words ({}), kept as is", MIN_WORDS, words.length);
        }
        if (words.length <= MAX_WORDS) {
            return text.trim();
        }
        return String.join(" ", Arrays.copyOfRange(words, 0, MAX_WORDS));
    }
}
