package com.jreinhal.norma.rag.expansion;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.norma.foundation.ModelCallOptions;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ModelTier;
import com.jreinhal.norma.model.ConversationTurn;
import com.jreinhal.norma.rag.hyde.HypotheticalDocument;
import com.jreinhal.norma.rag.hyde.HypotheticalDocumentService;
import com.jreinhal.norma.rag.router.ExtractedEntity;
import com.jreinhal.norma.rag.router.RoutingCategory;
import com.jreinhal.norma.util.LogSanitizer;
import com.jreinhal.norma.util.ModelJsonParser;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Multi-query expansion: one model call yields a keyword-oriented, a semantically
 * expanded and an entity-focused variant of the question.
 *
 * <p>The hypothetical document is generated concurrently by {@link HypotheticalDocumentService}.
 * Both sides fail safe: variants degrade to three copies of the original question and the
 * hypothetical document to "skipped", so retrieval never waits on a broken expansion.</p>
 */
@Component
public class QueryExpansionService {
    private static final Logger log = LoggerFactory.getLogger(QueryExpansionService.class);
    private static final int HISTORY_TURNS = 3;

    // Common abbreviations in professional questions; expanded in the keyword variant.
    private static final Map<String, String> ABBREVIATIONS = new TreeMap<>(Map.ofEntries(
            Map.entry("iva", "imposta sul valore aggiunto"),
            Map.entry("irpef", "imposta sul reddito delle persone fisiche"),
            Map.entry("ires", "imposta sul reddito delle società"),
            Map.entry("irap", "imposta regionale sulle attività produttive"),
            Map.entry("imu", "imposta municipale propria"),
            Map.entry("tfr", "trattamento di fine rapporto"),
            Map.entry("ccnl", "contratto collettivo nazionale di lavoro"),
            Map.entry("tuir", "testo unico delle imposte sui redditi"),
            Map.entry("naspi", "nuova assicurazione sociale per l'impiego"),
            Map.entry("durc", "documento unico di regolarità contributiva")));

    private static final String SYSTEM_PROMPT = """
            Riformuli domande di professionisti per la ricerca in una base documentale normativa.
            Rispondi SOLO con JSON valido.
            """;

    private static final String USER_TEMPLATE = """
            Genera tre varianti della domanda:
            - keyword: solo parole chiave e riferimenti normativi, senza articoli né verbi
            - semantic: riformulazione completa con sinonimi tecnici e concetti correlati
            - entity: focalizzata sulle entità (norme, imposte, modelli, enti, scadenze)

            Entità già individuate: %s
            Conversazione precedente:
            %s

            Domanda: %s

            JSON: {"keyword": "...", "semantic": "...", "entity": "..."}
            """;

    private final ModelOrchestrator modelOrchestrator;
    private final HypotheticalDocumentService hypotheticalDocumentService;
    private final AmbiguityDetector ambiguityDetector;
    private final Executor executor;
    private Cache<String, QueryVariantSet> expansionCache;

    @Value("${norma.expansion.timeout-ms:3000}")
    private long timeoutMs;

    @Value("${norma.expansion.cache-size:500}")
    private int cacheSize;

    @Value("${norma.expansion.cache-ttl-seconds:900}")
    private long cacheTtlSeconds;

    public QueryExpansionService(ModelOrchestrator modelOrchestrator, HypotheticalDocumentService hypotheticalDocumentService,
                                 AmbiguityDetector ambiguityDetector, @Qualifier("ragExecutor") Executor executor) {
        this.modelOrchestrator = modelOrchestrator;
        this.hypotheticalDocumentService = hypotheticalDocumentService;
        this.ambiguityDetector = ambiguityDetector;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        if (this.timeoutMs <= 0L) {
            log.warn("Invalid norma.expansion.timeout-ms {}, using 3000", this.timeoutMs);
            this.timeoutMs = 3000L;
        }
        this.expansionCache = Caffeine.newBuilder()
                .maximumSize(Math.max(1, this.cacheSize))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1L, this.cacheTtlSeconds)))
                .build();
        log.info("Query expansion initialized (timeout={}ms, cacheSize={}, cacheTtl={}s)",
                this.timeoutMs, this.cacheSize, this.cacheTtlSeconds);
    }

    public QueryExpansion expand(String query, RoutingCategory category, List<ExtractedEntity> entities,
                                 List<ConversationTurn> history) {
        AmbiguityAssessment ambiguity = this.ambiguityDetector.assess(query, history);
        if (ambiguity.isAmbiguous()) {
            log.info("Expansion: {} ambiguous (score={}, indicators={}), multi-variant expansion",
                    LogSanitizer.querySummary(query), String.format("%.2f", ambiguity.score()), ambiguity.indicators());
        }
        CompletableFuture<HypotheticalDocument> hyde;
        try {
            hyde = CompletableFuture.supplyAsync(
                    () -> this.hypotheticalDocumentService.generate(query, category, history, ambiguity), this.executor);
        } catch (Exception e) {
            log.warn("Expansion: could not schedule hypothetical document ({}), skipping it", e.getMessage());
            hyde = CompletableFuture.completedFuture(HypotheticalDocument.skipped("scheduling failed"));
        }
        QueryVariantSet variants = this.expandVariants(query, entities, history);
        HypotheticalDocument document;
        try {
            document = hyde.join();
        } catch (Exception e) {
            log.warn("Expansion: hypothetical document failed ({}), skipping it", e.getMessage());
            document = HypotheticalDocument.skipped("generation failed");
        }
        return new QueryExpansion(variants, document, ambiguity);
    }

    public QueryVariantSet expandVariants(String query, List<ExtractedEntity> entities, List<ConversationTurn> history) {
        if (query == null || query.isBlank()) {
            return QueryVariantSet.passthrough(query == null ? "" : query);
        }
        List<ConversationTurn> recent = ConversationTurn.lastTurns(history, HISTORY_TURNS);
        String cacheKey = recent.isEmpty() ? cacheKey(query, entities) : null;
        if (cacheKey != null) {
            QueryVariantSet cached = this.expansionCache.getIfPresent(cacheKey);
            if (cached != null) {
                log.debug("Expansion: cache hit {}", LogSanitizer.querySummary(query));
                return cached;
            }
        }
        String entityText = entities == null || entities.isEmpty() ? "(nessuna)"
                : entities.stream().map(e -> e.text() + " [" + e.type() + "]").collect(Collectors.joining(", "));
        String historyText = recent.isEmpty() ? "(nessuna)" : ConversationTurn.format(recent);
        String prompt = String.format(USER_TEMPLATE, entityText, historyText, query);
        try {
            ModelReply reply = this.modelOrchestrator.invoke(ModelTier.BASIC, SYSTEM_PROMPT, prompt,
                    ModelCallOptions.of(0.3, 300, this.timeoutMs));
            Optional<JsonNode> json = ModelJsonParser.parseObject(reply.text());
            if (json.isEmpty()) {
                log.warn("Expansion: unparseable variants {}, using original query", LogSanitizer.excerpt(reply.text(), 120));
                return QueryVariantSet.passthrough(query);
            }
            String keyword = ModelJsonParser.text(json.get(), "keyword", query);
            String semantic = ModelJsonParser.text(json.get(), "semantic", query);
            String entity = ModelJsonParser.text(json.get(), "entity", query);
            QueryVariantSet variants = new QueryVariantSet(query, expandAbbreviations(keyword), semantic, entity, false);
            if (cacheKey != null) {
                this.expansionCache.put(cacheKey, variants);
            }
            return variants;
        } catch (Exception e) {
            log.warn("Expansion: model call failed for {} ({}), using original query", LogSanitizer.querySummary(query), e.getMessage());
            return QueryVariantSet.passthrough(query);
        }
    }

    /**
     * Appends the spelled-out form of known abbreviations so lexical search matches either.
     */
    static String expandAbbreviations(String keywordQuery) {
        StringBuilder expanded = new StringBuilder(keywordQuery);
        String lower = keywordQuery.toLowerCase(Locale.ITALIAN);
        for (Map.Entry<String, String> entry : ABBREVIATIONS.entrySet()) {
            Pattern word = Pattern.compile("\\b" + entry.getKey() + "\\b");
            if (word.matcher(lower).find() && !lower.contains(entry.getValue())) {
                expanded.append(' ').append(entry.getValue());
            }
        }
        return expanded.toString();
    }

    private static String cacheKey(String query, List<ExtractedEntity> entities) {
        String entityKey = entities == null ? "" : entities.stream().map(ExtractedEntity::text).sorted().collect(Collectors.joining(","));
        return query.trim().toLowerCase(Locale.ROOT) + "|" + entityKey;
    }
}
