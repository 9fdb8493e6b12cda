package com.jreinhal.norma.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.norma.foundation.ExecutionPlan;
import com.jreinhal.norma.foundation.ModelOrchestrator;
import com.jreinhal.norma.foundation.ModelReply;
import com.jreinhal.norma.foundation.ReasoningStrategy;
import com.jreinhal.norma.rag.fusion.RankedDocument;
import com.jreinhal.norma.rag.fusion.SourceHierarchy;
import com.jreinhal.norma.rag.fusion.SourceType;
import com.jreinhal.norma.util.EvidenceFormatter;
import com.jreinhal.norma.util.ModelJsonParser;
import com.jreinhal.norma.util.ValueExtractor;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Multi-hypothesis reasoning. Each hypothesis is scored by
 * {@code confidence × sourceWeightScore}, where the source weight is the mean hierarchy
 * weight of the sources it cites (0.5 when it cites none). Risk analysis runs on every
 * hypothesis; HIGH and CRITICAL alternatives are flagged whether or not they win.
 *
 * <p>Hypotheses are generated either with one call per perspective in parallel, each under
 * its own timeout, or with a single call returning all of them.
 */
@Service
public class TreeOfThoughtsReasoner {
    private static final Logger log = LoggerFactory.getLogger(TreeOfThoughtsReasoner.class);
    static final double NO_SOURCE_WEIGHT = 0.5;
    static final double REVIEW_THRESHOLD = 0.5;
    static final String CROSS_DOMAIN = "trasversale";

    private static final Pattern NEGATIVE_VERDICT = Pattern.compile(
            "\\b(non\\s+(spetta|è\\s+dovut[oa]|si\\s+applica|è\\s+deducibile|è\\s+detraibile|è\\s+ammess[oa]|è\\s+consentit[oa]|sussiste)|"
                    + "esclus[oaie]|indeducibil[ei]|vietat[oaie]|esent[ei])\\b");
    private static final Pattern POSITIVE_VERDICT = Pattern.compile(
            "\\b(spetta|è\\s+dovut[oa]|si\\s+applica|deducibil[ei]|detraibil[ei]|ammess[oaie]|consentit[oaie]|obbligatori[oa]|sussiste)\\b");

    private static final List<Perspective> PERSPECTIVES = List.of(
            new Perspective("letterale", "Applica la lettera della norma primaria, senza estensioni interpretative."),
            new Perspective("prassi", "Segui l'orientamento dell'amministrazione finanziaria (circolari, risoluzioni, interpelli)."),
            new Perspective("sostanziale", "Valuta la sostanza economica dell'operazione e i casi di eccezione."),
            new Perspective("rischio", "Considera lo scenario sfavorevole: contestazioni, sanzioni ed eventuali profili penali."));

    private static final String SYSTEM_PROMPT = """
            Sei un esperto di diritto tributario e del lavoro italiano. Esplori ipotesi interpretative alternative
            per un collega professionista, citando solo le fonti fornite con il loro numero tra parentesi quadre.
            Rispondi SOLO con JSON valido.
            """;

    private static final String SINGLE_TEMPLATE = """
            Fonti:
            %s

            Domanda: %s

            Prospettiva: %s
            %s

            Sviluppa UNA ipotesi da questa prospettiva e valuta il rischio sanzionatorio indipendentemente dalla probabilità.

            JSON: {"path": "ragionamento", "conclusion": "...", "confidence": 0.0-1.0, "sources_cited": ["[1]"], "risk_level": "low|medium|high|critical", "risk_factors": ["..."]}
            """;

    private static final String BATCH_TEMPLATE = """
            Fonti:
            %s

            Domanda: %s

            Sviluppa %d ipotesi alternative, una per ciascuna prospettiva:
            %s

            Per ogni ipotesi valuta il rischio sanzionatorio indipendentemente dalla probabilità.

            JSON: {"hypotheses": [{"perspective": "...", "domain": "...", "path": "...", "conclusion": "...", "confidence": 0.0-1.0, "sources_cited": ["[1]"], "risk_level": "low|medium|high|critical", "risk_factors": ["..."]}]}
            """;

    private final ModelOrchestrator modelOrchestrator;
    private final SourceHierarchy sourceHierarchy;
    private final RiskAnalyzer riskAnalyzer;
    private final Executor executor;

    @Value("${norma.reasoning.tot.parallel:true}")
    private boolean parallel;
    @Value("${norma.reasoning.tot.hypothesis-timeout-ms:20000}")
    private long hypothesisTimeoutMs;

    public TreeOfThoughtsReasoner(ModelOrchestrator modelOrchestrator, SourceHierarchy sourceHierarchy,
                                  RiskAnalyzer riskAnalyzer, @Qualifier("ragExecutor") Executor executor) {
        this.modelOrchestrator = modelOrchestrator;
        this.sourceHierarchy = sourceHierarchy;
        this.riskAnalyzer = riskAnalyzer;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        if (this.hypothesisTimeoutMs <= 0L) {
            log.warn("Invalid norma.reasoning.tot.hypothesis-timeout-ms {}, using 20000", this.hypothesisTimeoutMs);
            this.hypothesisTimeoutMs = 20_000L;
        }
        log.info("Tree-of-thoughts reasoner initialized (parallel={}, hypothesisTimeout={}ms)", this.parallel,
                this.hypothesisTimeoutMs);
    }

    public Optional<TreeOfThoughts> reason(String query, List<RankedDocument> documents, ExecutionPlan plan,
                                           List<String> domains, long budgetMs) {
        boolean multiDomain = plan.strategy() == ReasoningStrategy.TREE_OF_THOUGHTS_MULTI_DOMAIN
                && domains != null && domains.size() > 1;
        List<Perspective> perspectives = perspectives(plan.maxHypotheses(), multiDomain ? domains : List.of());
        String evidence = EvidenceFormatter.format(documents, ChainOfThoughtReasoner.MAX_CONTEXT_DOCUMENTS,
                ChainOfThoughtReasoner.MAX_CONTEXT_CHARS);
        long timeout = budgetMs > 0L ? Math.min(this.hypothesisTimeoutMs, budgetMs) : this.hypothesisTimeoutMs;

        List<Hypothesis> generated = this.parallel
                ? this.generateParallel(query, evidence, perspectives, plan, timeout)
                : this.generateSequential(query, evidence, perspectives, plan, budgetMs > 0L ? budgetMs : plan.timeoutMs());
        if (generated.isEmpty()) {
            log.warn("ToT: no hypothesis generated ({} perspectives)", perspectives.size());
            return Optional.empty();
        }
        List<Hypothesis> scored = new ArrayList<>();
        for (Hypothesis hypothesis : this.riskAnalyzer.analyzeAll(generated)) {
            scored.add(this.score(hypothesis, documents));
        }
        return Optional.of(multiDomain ? this.selectMultiDomain(scored) : this.select(scored, List.of(), false));
    }

    static List<Perspective> perspectives(int maxHypotheses, List<String> domains) {
        int max = Math.max(1, maxHypotheses);
        if (domains.isEmpty()) {
            return PERSPECTIVES.subList(0, Math.min(max, PERSPECTIVES.size()));
        }
        List<Perspective> result = new ArrayList<>();
        for (String domain : domains) {
            if (result.size() >= max - 1) {
                break;
            }
            result.add(new Perspective(domain, "Analizza la questione dal punto di vista della disciplina " + domain
                    + ", indicando la conclusione propria di questo ambito.", domain));
        }
        Perspective risk = PERSPECTIVES.get(PERSPECTIVES.size() - 1);
        result.add(new Perspective(risk.name(), risk.instruction(), CROSS_DOMAIN));
        return result;
    }

    private List<Hypothesis> generateParallel(String query, String evidence, List<Perspective> perspectives,
                                              ExecutionPlan plan, long timeoutMs) {
        Map<Perspective, CompletableFuture<Optional<Hypothesis>>> futures = new LinkedHashMap<>();
        int index = 1;
        for (Perspective perspective : perspectives) {
            String id = "H" + index++;
            String prompt = String.format(SINGLE_TEMPLATE, evidence, query, perspective.name(), perspective.instruction());
            CompletableFuture<Optional<Hypothesis>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> this.generateOne(id, perspective, prompt, plan, timeoutMs),
                        this.executor);
            } catch (RejectedExecutionException e) {
                log.warn("ToT: executor saturated, perspective {} skipped", perspective.name());
                future = CompletableFuture.completedFuture(Optional.empty());
            }
            futures.put(perspective, future);
        }
        long deadline = System.currentTimeMillis() + timeoutMs;
        List<Hypothesis> hypotheses = new ArrayList<>();
        for (Map.Entry<Perspective, CompletableFuture<Optional<Hypothesis>>> entry : futures.entrySet()) {
            CompletableFuture<Optional<Hypothesis>> future = entry.getValue();
            long remaining = Math.max(1L, deadline - System.currentTimeMillis());
            try {
                future.get(remaining, TimeUnit.MILLISECONDS).ifPresent(hypotheses::add);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                log.warn("ToT: interrupted while waiting for perspective {}", entry.getKey().name());
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("ToT: perspective {} timed out after {}ms", entry.getKey().name(), timeoutMs);
            } catch (ExecutionException e) {
                log.warn("ToT: perspective {} failed: {}", entry.getKey().name(),
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            }
        }
        return hypotheses;
    }

    private Optional<Hypothesis> generateOne(String id, Perspective perspective, String prompt, ExecutionPlan plan,
                                             long timeoutMs) {
        try {
            ModelReply reply = this.modelOrchestrator.invoke(plan.tier(), SYSTEM_PROMPT, prompt,
                    plan.callOptions().withTimeoutMs(timeoutMs));
            return ModelJsonParser.parseObject(reply.text()).flatMap(node -> toHypothesis(id, node, perspective));
        } catch (Exception e) {
            log.warn("ToT: perspective {} model call failed: {}", perspective.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private List<Hypothesis> generateSequential(String query, String evidence, List<Perspective> perspectives,
                                                ExecutionPlan plan, long timeoutMs) {
        StringBuilder list = new StringBuilder();
        for (Perspective perspective : perspectives) {
            list.append("- ").append(perspective.name());
            if (perspective.domain() != null) {
                list.append(" (ambito: ").append(perspective.domain()).append(')');
            }
            list.append(": ").append(perspective.instruction()).append('\n');
        }
        String prompt = String.format(BATCH_TEMPLATE, evidence, query, perspectives.size(), list.toString().trim());
        try {
            ModelReply reply = this.modelOrchestrator.invoke(plan.tier(), SYSTEM_PROMPT, prompt,
                    plan.callOptions().withTimeoutMs(timeoutMs));
            Optional<JsonNode> json = ModelJsonParser.parseObject(reply.text());
            JsonNode array = json.map(node -> node.get("hypotheses")).orElse(null);
            if (array == null || !array.isArray()) {
                array = ModelJsonParser.parseArray(reply.text()).orElse(null);
            }
            if (array == null) {
                log.warn("ToT: unparseable batch output");
                return List.of();
            }
            List<Hypothesis> hypotheses = new ArrayList<>();
            for (int i = 0; i < array.size() && i < perspectives.size(); i++) {
                toHypothesis("H" + (i + 1), array.get(i), perspectives.get(i)).ifPresent(hypotheses::add);
            }
            return hypotheses;
        } catch (Exception e) {
            log.warn("ToT: batch model call failed: {}", e.getMessage());
            return List.of();
        }
    }

    static Optional<Hypothesis> toHypothesis(String id, JsonNode node, Perspective perspective) {
        String conclusion = ModelJsonParser.text(node, "conclusion", "");
        if (conclusion.isBlank()) {
            return Optional.empty();
        }
        String domain = ModelJsonParser.text(node, "domain", perspective.domain());
        if (perspective.domain() != null) {
            domain = perspective.domain();
        }
        return Optional.of(new Hypothesis(id, ModelJsonParser.text(node, "path", perspective.name()), conclusion,
                ModelJsonParser.number(node, "confidence", 0.5), ModelJsonParser.stringList(node, "sources_cited"),
                0.0, 0.0, RiskLevel.fromLabel(ModelJsonParser.text(node, "risk_level", null)),
                ModelJsonParser.stringList(node, "risk_factors"), domain));
    }

    Hypothesis score(Hypothesis hypothesis, List<RankedDocument> documents) {
        double total = 0.0;
        int counted = 0;
        for (String citation : hypothesis.sourcesCited()) {
            SourceType type = EvidenceFormatter.resolve(citation, documents)
                    .map(RankedDocument::sourceType)
                    .orElseGet(() -> SourceType.infer(citation));
            total += this.sourceHierarchy.weight(type);
            counted++;
        }
        double sourceWeight = counted == 0 ? NO_SOURCE_WEIGHT : total / counted;
        return hypothesis.withScoring(sourceWeight, hypothesis.confidence() * sourceWeight);
    }

    TreeOfThoughts select(List<Hypothesis> hypotheses, List<DomainConflict> conflicts, boolean multiDomain) {
        Hypothesis best = hypotheses.stream().min(ranking()).orElseThrow();
        List<String> flagged = hypotheses.stream()
                .filter(h -> !h.id().equals(best.id()) && h.riskLevel().isFlagged())
                .map(Hypothesis::id)
                .toList();
        String reasoning = String.format(Locale.ROOT,
                "%s selezionata con punteggio %.3f (confidenza %.2f × peso fonti %.2f) su %d ipotesi",
                best.id(), best.score(), best.confidence(), best.sourceWeightScore(), hypotheses.size());
        if (!flagged.isEmpty()) {
            reasoning += "; alternative a rischio elevato segnalate: " + String.join(", ", flagged);
        }
        boolean needsReview = best.confidence() < REVIEW_THRESHOLD;
        if (needsReview) {
            log.info("ToT: selected hypothesis {} below review threshold (confidence={})", best.id(), best.confidence());
        }
        return new TreeOfThoughts(hypotheses, best.id(), reasoning, flagged, conflicts, needsReview, multiDomain);
    }

    TreeOfThoughts selectMultiDomain(List<Hypothesis> hypotheses) {
        Map<String, Hypothesis> bestPerDomain = new LinkedHashMap<>();
        for (Hypothesis hypothesis : hypotheses) {
            String domain = hypothesis.domain() == null ? CROSS_DOMAIN : hypothesis.domain();
            if (CROSS_DOMAIN.equals(domain)) {
                continue;
            }
            bestPerDomain.merge(domain, hypothesis, (a, b) -> ranking().compare(a, b) <= 0 ? a : b);
        }
        List<DomainConflict> conflicts = detectConflicts(new ArrayList<>(bestPerDomain.values()));
        if (!conflicts.isEmpty()) {
            log.info("ToT: {} cross-domain conflict(s) detected", conflicts.size());
        }
        return this.select(hypotheses, conflicts, true);
    }

    static List<DomainConflict> detectConflicts(List<Hypothesis> domainBests) {
        List<DomainConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < domainBests.size(); i++) {
            for (int j = i + 1; j < domainBests.size(); j++) {
                Hypothesis a = domainBests.get(i);
                Hypothesis b = domainBests.get(j);
                Set<String> valuesA = values(a.conclusion());
                Set<String> valuesB = values(b.conclusion());
                if (!valuesA.isEmpty() && !valuesB.isEmpty() && disjoint(valuesA, valuesB)) {
                    conflicts.add(new DomainConflict(a.domain(), a.id(), b.domain(), b.id(),
                            "Valori diversi: " + valuesA + " (" + a.domain() + ") contro " + valuesB + " (" + b.domain() + ")"));
                    continue;
                }
                int polarityA = polarity(a.conclusion());
                int polarityB = polarity(b.conclusion());
                if (polarityA != 0 && polarityB != 0 && polarityA != polarityB) {
                    conflicts.add(new DomainConflict(a.domain(), a.id(), b.domain(), b.id(),
                            "Conclusioni di segno opposto tra " + a.domain() + " e " + b.domain()));
                }
            }
        }
        return conflicts;
    }

    static int polarity(String text) {
        String lower = text == null ? "" : text.toLowerCase(Locale.ITALIAN);
        if (NEGATIVE_VERDICT.matcher(lower).find()) {
            return -1;
        }
        return POSITIVE_VERDICT.matcher(lower).find() ? 1 : 0;
    }

    private static Set<String> values(String text) {
        Set<String> values = new HashSet<>();
        for (String value : ValueExtractor.percentages(text)) {
            values.add(ValueExtractor.normalize(value));
        }
        for (String value : ValueExtractor.amounts(text)) {
            values.add(ValueExtractor.normalize(value));
        }
        return values;
    }

    private static boolean disjoint(Set<String> a, Set<String> b) {
        for (String value : a) {
            if (b.contains(value)) {
                return false;
            }
        }
        return true;
    }

    private static Comparator<Hypothesis> ranking() {
        return Comparator.comparingDouble(Hypothesis::score).reversed()
                .thenComparing(Comparator.comparingDouble(Hypothesis::confidence).reversed())
                .thenComparing(Hypothesis::id);
    }

    record Perspective(String name, String instruction, String domain) {

        Perspective(String name, String instruction) {
            this(name, instruction, null);
        }
    }
}
