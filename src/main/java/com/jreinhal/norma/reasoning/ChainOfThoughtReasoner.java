package com.jreinhal.norma.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.util.EvidenceFormatter;
import com.jreinhal.norma.util.LogSanitizer;
import com.jreinhal.norma.util.ModelJsonParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single-path reasoning: theme, sources used, key points, conclusion, in one call.
 */
@Service
public class ChainOfThoughtReasoner {
    private static final Logger log = LoggerFactory.getLogger(ChainOfThoughtReasoner.class);
    static final int MAX_CONTEXT_DOCUMENTS = 5;
    static final int MAX_CONTEXT_CHARS = 500;

    private static final String SYSTEM_PROMPT = """
            Sei un esperto di diritto tributario e del lavoro italiano che ragiona per un collega professionista.
            Usa solo le fonti fornite, citandole con il loro numero tra parentesi quadre.
            Rispondi SOLO con JSON valido.
            """;

    private static final String USER_TEMPLATE = """
            Fonti:
            %s

            Domanda: %s

            Ragiona passo per passo:
            1. Identifica il tema giuridico.
            2. Elenca le fonti pertinenti, dalla più autorevole.
            3. Estrai i punti chiave (norme, soglie, aliquote, scadenze).
            4. Formula la conclusione.

            JSON: {"theme": "...", "sources_used": ["[1]"], "key_points": ["..."], "conclusion": "...", "confidence": 0.0-1.0}
            """;

    private final ModelOrchestrator modelOrchestrator;

    public ChainOfThoughtReasoner(ModelOrchestrator modelOrchestrator) {
        this.modelOrchestrator = modelOrchestrator;
    }

    public Optional<ChainOfThought> reason(String query, List<RankedDocument> documents, ExecutionPlan plan) {
        String prompt = String.format(USER_TEMPLATE,
                EvidenceFormatter.format(documents, MAX_CONTEXT_DOCUMENTS, MAX_CONTEXT_CHARS), query);
        try {
            ModelReply reply = this.modelOrchestrator.invoke(plan.tier(), SYSTEM_PROMPT, prompt, plan.callOptions());
            Optional<JsonNode> json = ModelJsonParser.parseObject(reply.text());
            if (json.isEmpty()) {
                log.warn("CoT: unparseable output {}", LogSanitizer.excerpt(reply.text(), 120));
                return Optional.empty();
            }
            JsonNode node = json.get();
            String conclusion = ModelJsonParser.text(node, "conclusion", "");
            if (conclusion.isBlank()) {
                log.warn("CoT: output without conclusion");
                return Optional.empty();
            }
            Double confidence = node.has("confidence") ? Math.max(0.0, Math.min(1.0, ModelJsonParser.number(node, "confidence", 0.7))) : null;
            return Optional.of(new ChainOfThought(ModelJsonParser.text(node, "theme", query),
                    ModelJsonParser.stringList(node, "sources_used"), ModelJsonParser.stringList(node, "key_points"),
                    conclusion, confidence));
        } catch (Exception e) {
            log.warn("CoT: model call failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Trace assembled from the evidence alone, for when no reasoning call succeeded.
     */
    public static ChainOfThought fromContext(String query, List<RankedDocument> documents) {
        List<String> sources = new ArrayList<>();
        List<String> keyPoints = new ArrayList<>();
        int limit = documents == null ? 0 : Math.min(3, documents.size());
        for (int i = 0; i < limit; i++) {
            RankedDocument doc = documents.get(i);
            sources.add(doc.reference());
            keyPoints.add(EvidenceFormatter.truncate(doc.content(), 160));
        }
        String conclusion = limit == 0 ? "" : "Sintesi basata sulle fonti recuperate, a partire da " + sources.get(0) + ".";
        return new ChainOfThought(query, sources, keyPoints, conclusion, null);
    }
}
