package com.jreinhal.norma.rag.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.util.LogSanitizer;
import com.jreinhal.norma.util.ModelJsonParser;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Semantic router: assigns each question one {@link RoutingCategory} with the cheap model tier.
 *
 * <p>The model is asked to reason step by step and then emit JSON. Any failure (timeout,
 * provider error, malformed or unknown output) yields {@link RoutingDecision#fallback},
 * i.e. technical research with confidence 0.5, so a question is never under-triaged.</p>
 *
 * <p>Pure greetings and thanks can be answered from heuristics alone when
 * {@code norma.router.greeting-fast-path} is on.</p>
 */
@Service
public class QueryRouter {

    private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);
    private static final int HISTORY_TURNS = 3;

    private static final List<Pattern> GREETING_PATTERNS = List.of(
            Pattern.compile("^(ciao|salve|buongiorno|buonasera|buon\\s+pomeriggio|hey|hi|hello)[\\s!.,]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(grazie(\\s+mille)?|ti\\s+ringrazio|thanks|thank\\s+you)[\\s!.,]*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(ok|okay|perfetto|va\\s+bene|d'accordo|arrivederci|a\\s+presto)[\\s!.,]*$", Pattern.CASE_INSENSITIVE));

    // Signals that data may have changed recently (rates, deadlines, new rules).
    private static final Pattern FRESHNESS_PATTERN = Pattern.compile(
            "\\b(20\\d{2}|quest'anno|nuov[aoie]|ultim[aoie]|aggiornat[aoie]|legge\\s+di\\s+bilancio|proroga|scadenz[ae])\\b",
            Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
            Sei il router di un assistente per commercialisti e consulenti del lavoro italiani.
            Ragiona passo per passo, poi termina con un unico oggetto JSON.
            """;

    private static final String USER_TEMPLATE = """
            Classifica la domanda in UNA categoria:
            - casual_chat: saluti, ringraziamenti, conversazione senza contenuto tecnico
            - definitional: richiesta di definizione di un concetto o istituto
            - technical_research: ricerca normativa, adempimenti, casi pratici
            - calculation: calcolo di importi, imposte, contributi, scadenze
            - fixed_answer_set: domanda frequente con risposta standard consolidata

            Passi:
            1. Individua l'intento principale della domanda, tenendo conto della conversazione.
            2. Estrai le entità (norme, imposte, modelli, scadenze, importi).
            3. Valuta se servono dati aggiornati.
            4. Scegli la categoria. In caso di dubbio scegli technical_research.

            Conversazione precedente:
            %s

            Domanda: %s

            JSON finale:
            {"category": "...", "confidence": 0.0-1.0, "reasoning": "...",
             "entities": [{"text": "...", "type": "...", "confidence": 0.0-1.0}],
             "requires_freshness": true|false}
            """;

    private final ModelOrchestrator modelOrchestrator;

    @Value("${norma.router.timeout-ms:2000}")
    private long timeoutMs;

    @Value("${norma.router.greeting-fast-path:true}")
    private boolean greetingFastPath;

    public QueryRouter(ModelOrchestrator modelOrchestrator) {
        this.modelOrchestrator = modelOrchestrator;
    }

    @PostConstruct
    public void init() {
        if (this.timeoutMs <= 0L) {
            log.warn("Invalid norma.router.timeout-ms {}, using 2000", this.timeoutMs);
            this.timeoutMs = 2000L;
        }
        log.info("Query router initialized (timeout={}ms, greetingFastPath={})", this.timeoutMs, this.greetingFastPath);
    }

    public RoutingDecision route(String query, List<ConversationTurn> history) {
        if (query == null || query.isBlank()) {
            return RoutingDecision.fallback("empty query");
        }
        String trimmed = query.trim();
        if (this.greetingFastPath && isGreeting(trimmed)) {
            log.debug("Router: greeting fast path {}", LogSanitizer.querySummary(trimmed));
            return new RoutingDecision(RoutingCategory.CASUAL_CHAT, 0.95, "greeting pattern", List.of(), false, false);
        }
        String historyText = ConversationTurn.format(ConversationTurn.lastTurns(history, HISTORY_TURNS));
        String prompt = String.format(USER_TEMPLATE, historyText.isEmpty() ? "(nessuna)" : historyText, trimmed);
        ModelReply reply;
        try {
            reply = this.modelOrchestrator.invoke(ModelTier.BASIC, SYSTEM_PROMPT, prompt,
                    ModelCallOptions.of(0.1, 400, this.timeoutMs));
        } catch (Exception e) {
            log.warn("Router: model call failed for {} ({}), using fallback", LogSanitizer.querySummary(trimmed), e.getMessage());
            return RoutingDecision.fallback("model unavailable");
        }
        RoutingDecision decision = this.parse(reply.text(), trimmed);
        log.info("Router: {} -> {} (confidence={}, fallback={})", LogSanitizer.querySummary(trimmed),
                decision.category(), String.format("%.2f", decision.confidence()), decision.fallback());
        return decision;
    }

    RoutingDecision parse(String raw, String query) {
        Optional<JsonNode> json = ModelJsonParser.parseObject(raw);
        if (json.isEmpty()) {
            log.warn("Router: no JSON in model output {}, using fallback", LogSanitizer.excerpt(raw, 120));
            return RoutingDecision.fallback("unparseable output");
        }
        JsonNode node = json.get();
        Optional<RoutingCategory> category = RoutingCategory.fromWireName(ModelJsonParser.text(node, "category", null));
        if (category.isEmpty()) {
            log.warn("Router: unknown category '{}', using fallback",
                    LogSanitizer.sanitize(ModelJsonParser.text(node, "category", "")));
            return RoutingDecision.fallback("unknown category");
        }
        double confidence = Math.max(0.0, Math.min(1.0, ModelJsonParser.number(node, "confidence", 0.7)));
        List<ExtractedEntity> entities = new ArrayList<>();
        JsonNode entityNodes = node.get("entities");
        if (entityNodes != null && entityNodes.isArray()) {
            for (JsonNode entity : entityNodes) {
                String text = entity.isTextual() ? entity.asText() : ModelJsonParser.text(entity, "text", "");
                if (text == null || text.isBlank()) {
                    continue;
                }
                entities.add(new ExtractedEntity(text.trim(), ModelJsonParser.text(entity, "type", "generic"),
                        Math.max(0.0, Math.min(1.0, ModelJsonParser.number(entity, "confidence", 0.8)))));
            }
        }
        boolean freshness = ModelJsonParser.bool(node, "requires_freshness", FRESHNESS_PATTERN.matcher(query).find());
        return new RoutingDecision(category.get(), confidence, ModelJsonParser.text(node, "reasoning", ""),
                entities, freshness, false);
    }

    static boolean isGreeting(String query) {
        for (Pattern pattern : GREETING_PATTERNS) {
            if (pattern.matcher(query).matches()) {
                return true;
            }
        }
        return false;
    }
}
