package com.jreinhal.norma.foundation;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.util.LogSanitizer;
import com.jreinhal.norma.util.ModelJsonParser;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides how much reasoning a question deserves. Any failure resolves to
 * {@link QueryComplexity#SIMPLE}, the cheapest path.
 */
@Service
public class ComplexityClassifier {
    private static final Logger log = LoggerFactory.getLogger(ComplexityClassifier.class);

    private static final Map<String, List<String>> DOMAIN_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put("fiscale", List.of("iva", "irpef", "ires", "irap", "imposta", "tasse", "detrazion",
                "deduzion", "forfettario", "fattur", "f24", "dichiarazione dei redditi", "730", "redditi", "cedolare"));
        DOMAIN_KEYWORDS.put("lavoro", List.of("contratto di lavoro", "dipendent", "assunzion", "licenziament",
                "tfr", "inps", "inail", "contribut", "busta paga", "ccnl", "ferie", "malattia", "naspi"));
        DOMAIN_KEYWORDS.put("legale", List.of("societ", "srl", "spa", "codice civile", "contratto", "responsabilit",
                "successione", "eredit", "donazion", "penale", "sanzion", "ricorso", "contenzioso"));
    }

    private static final String SYSTEM_PROMPT = """
            Sei un classificatore di complessità per domande di professionisti (commercialisti, consulenti del lavoro).
            Rispondi SOLO con JSON valido.
            """;

    private static final String USER_TEMPLATE = """
            Classifica la complessità della domanda.

            - simple: una sola norma o un solo dato (aliquota, scadenza, definizione).
            - complex: più norme, casi con eccezioni, interpretazioni alternative o calcoli condizionati.
            - multi_domain: coinvolge almeno due ambiti tra fiscale, lavoro e legale.

            Domande con storico conversazione: %s
            Documenti allegati: %s
            Ambiti rilevati automaticamente: %s

            Domanda: %s

            JSON: {"complexity": "simple|complex|multi_domain", "domains": ["fiscale"], "confidence": 0.0-1.0, "reasoning": "breve motivazione"}
            """;

    private final ModelOrchestrator modelOrchestrator;

    @Value("${norma.complexity.timeout-ms:3000}")
    private long timeoutMs;

    public ComplexityClassifier(ModelOrchestrator modelOrchestrator) {
        this.modelOrchestrator = modelOrchestrator;
    }

    @PostConstruct
    public void init() {
        if (this.timeoutMs <= 0L) {
            log.warn("Invalid norma.complexity.timeout-ms {}, using 3000", this.timeoutMs);
            this.timeoutMs = 3000L;
        }
        log.info("Complexity classifier initialized (timeout={}ms)", this.timeoutMs);
    }

    public ComplexityClassification classify(String query, List<String> domainsHint, boolean hasHistory, boolean hasDocuments) {
        List<String> hint = domainsHint == null || domainsHint.isEmpty() ? detectDomains(query) : domainsHint;
        if (query == null || query.isBlank()) {
            return ComplexityClassification.fallback(hint, "domanda vuota");
        }
        String prompt = String.format(USER_TEMPLATE, hasHistory ? "sì" : "no", hasDocuments ? "sì" : "no",
                hint.isEmpty() ? "nessuno" : String.join(", ", hint), query);
        try {
            ModelReply reply = this.modelOrchestrator.invoke(ModelTier.BASIC, SYSTEM_PROMPT, prompt,
                    ModelCallOptions.of(0.1, 200, this.timeoutMs));
            Optional<JsonNode> json = ModelJsonParser.parseObject(reply.text());
            if (json.isEmpty()) {
                log.warn("Complexity: unparseable classifier output {}, defaulting to SIMPLE", LogSanitizer.excerpt(reply.text(), 120));
                return ComplexityClassification.fallback(hint, "risposta non interpretabile");
            }
            QueryComplexity complexity = QueryComplexity.fromLabel(ModelJsonParser.text(json.get(), "complexity", null));
            if (complexity == null) {
                log.warn("Complexity: unknown label, defaulting to SIMPLE");
                return ComplexityClassification.fallback(hint, "etichetta sconosciuta");
            }
            List<String> domains = ModelJsonParser.stringList(json.get(), "domains");
            if (domains.isEmpty()) {
                domains = hint;
            }
            ComplexityClassification result = new ComplexityClassification(complexity, domains,
                    ModelJsonParser.number(json.get(), "confidence", 0.7),
                    ModelJsonParser.text(json.get(), "reasoning", ""), false);
            log.info("Complexity: {} {} domains={} confidence={}", LogSanitizer.querySummary(query), result.complexity(),
                    result.domains(), String.format("%.2f", result.confidence()));
            return result;
        } catch (Exception e) {
            log.warn("Complexity: classifier call failed ({}), defaulting to SIMPLE", e.getMessage());
            return ComplexityClassification.fallback(hint, "errore del modello");
        }
    }

    public static List<String> detectDomains(String query) {
        List<String> domains = new ArrayList<>();
        if (query == null) {
            return domains;
        }
        String lower = query.toLowerCase(Locale.ITALIAN);
        for (Map.Entry<String, List<String>> entry : DOMAIN_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    domains.add(entry.getKey());
                    break;
                }
            }
        }
        return domains;
    }
}
