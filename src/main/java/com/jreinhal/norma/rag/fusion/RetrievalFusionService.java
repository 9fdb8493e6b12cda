package com.jreinhal.norma.rag.fusion;

import com.jreinhal.norma.rag.expansion.QueryVariantSet;
import com.jreinhal.norma.rag.hyde.HypotheticalDocument;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Parallel multi-strategy retrieval with weighted Reciprocal Rank Fusion.
 *
 * <pre>
 * score(doc) = Σ weight(channel) / (k + rank(doc, list))        over every ranked list containing doc
 * final(doc) = score(doc) × (1 + recencyBoost if published within recencyDays) × hierarchyWeight(type)
 * </pre>
 *
 * A channel whose provider is missing, fails or times out contributes no ranks; fusion
 * always completes with whatever lists arrived. Ties are broken by document id so repeated
 * fusion of the same lists yields the same order and scores.
 */
@Service
public class RetrievalFusionService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalFusionService.class);

    private final Map<SearchBackend, SearchProvider> providers = new EnumMap<>(SearchBackend.class);
    private final SourceHierarchy sourceHierarchy;
    private final DocumentMetadataExtractor metadataExtractor;
    private final ExecutorService ragExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Value("${norma.fusion.rrf-k:60}")
    private int rrfK;
    @Value("${norma.fusion.weights.lexical:0.3}")
    private double lexicalWeight;
    @Value("${norma.fusion.weights.vector:0.4}")
    private double vectorWeight;
    @Value("${norma.fusion.weights.hypothetical:0.3}")
    private double hypotheticalWeight;
    @Value("${norma.fusion.weights.entity:0.2}")
    private double entityWeight;
    @Value("${norma.fusion.top-k:10}")
    private int topK;
    @Value("${norma.fusion.per-strategy-limit:20}")
    private int perStrategyLimit;
    @Value("${norma.fusion.timeout-ms:2000}")
    private long timeoutMs;
    @Value("${norma.fusion.recency-boost:0.5}")
    private double recencyBoost;
    @Value("${norma.fusion.recency-days:365}")
    private int recencyDays;

    public RetrievalFusionService(List<SearchProvider> searchProviders, SourceHierarchy sourceHierarchy,
                                  DocumentMetadataExtractor metadataExtractor,
                                  @Qualifier("ragExecutor") ExecutorService ragExecutor, Clock clock,
                                  MeterRegistry meterRegistry) {
        for (SearchProvider provider : searchProviders) {
            this.providers.putIfAbsent(provider.backend(), provider);
        }
        this.sourceHierarchy = sourceHierarchy;
        this.metadataExtractor = metadataExtractor;
        this.ragExecutor = ragExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        if (this.rrfK <= 0) {
            log.warn("Invalid norma.fusion.rrf-k {}, using 60", this.rrfK);
            this.rrfK = 60;
        }
        this.lexicalWeight = validWeight("lexical", this.lexicalWeight, 0.3);
        this.vectorWeight = validWeight("vector", this.vectorWeight, 0.4);
        this.hypotheticalWeight = validWeight("hypothetical", this.hypotheticalWeight, 0.3);
        this.entityWeight = validWeight("entity", this.entityWeight, 0.2);
        if (this.topK <= 0) {
            log.warn("Invalid norma.fusion.top-k {}, using 10", this.topK);
            this.topK = 10;
        }
        if (this.perStrategyLimit <= 0) {
            this.perStrategyLimit = 20;
        }
        if (this.timeoutMs <= 0L) {
            log.warn("Invalid norma.fusion.timeout-ms {}, using 2000", this.timeoutMs);
            this.timeoutMs = 2000L;
        }
        if (this.recencyBoost < 0.0) {
            this.recencyBoost = 0.5;
        }
        if (this.recencyDays <= 0) {
            this.recencyDays = 365;
        }
        log.info("Retrieval fusion initialized (rrfK={}, weights lexical={} vector={} hypothetical={} entity={}, topK={}, providers={})",
                this.rrfK, this.lexicalWeight, this.vectorWeight, this.hypotheticalWeight, this.entityWeight,
                this.topK, this.providers.keySet());
    }

    private static double validWeight(String name, double value, double fallback) {
        if (Double.isNaN(value) || value < 0.0) {
            log.warn("Invalid norma.fusion.weights.{} {}, using {}", name, value, fallback);
            return fallback;
        }
        return value;
    }

    public RetrievalResult retrieve(QueryVariantSet variants, HypotheticalDocument hypotheticalDocument) {
        return this.retrieve(variants, hypotheticalDocument, this.timeoutMs);
    }

    public RetrievalResult retrieve(QueryVariantSet variants, HypotheticalDocument hypotheticalDocument, long budgetMs) {
        long startTime = System.currentTimeMillis();
        List<ChannelTask> tasks = new ArrayList<>();
        this.schedule(tasks, FusionChannel.LEXICAL, variants.keywordVariant());
        this.schedule(tasks, FusionChannel.VECTOR, variants.semanticVariant());
        this.schedule(tasks, FusionChannel.ENTITY, variants.entityVariant());
        if (hypotheticalDocument != null) {
            for (String text : hypotheticalDocument.searchTexts()) {
                this.schedule(tasks, FusionChannel.HYPOTHETICAL, text);
            }
        }
        long deadlineMs = startTime + Math.max(1L, Math.min(budgetMs, this.timeoutMs));
        List<RankedList> lists = new ArrayList<>();
        Set<FusionChannel> failed = new HashSet<>();
        for (ChannelTask task : tasks) {
            long remainingMs = deadlineMs - System.currentTimeMillis();
            if (remainingMs <= 0L) {
                log.warn("Fusion: retrieval budget exhausted, dropping {} results", task.channel());
                task.future().cancel(true);
                failed.add(task.channel());
                continue;
            }
            try {
                lists.add(new RankedList(task.channel(), task.future().get(remainingMs, TimeUnit.MILLISECONDS)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Fusion: interrupted waiting for {}", task.channel());
                failed.add(task.channel());
            } catch (TimeoutException e) {
                log.warn("Fusion: {} timed out (remaining {}ms)", task.channel(), remainingMs);
                task.future().cancel(true);
                failed.add(task.channel());
            } catch (Exception e) {
                log.warn("Fusion: {} search failed: {}", task.channel(), e.getMessage());
                failed.add(task.channel());
            }
        }
        for (FusionChannel channel : failed) {
            Counter.builder("norma.retrieval.channel.failures")
                    .tag("channel", channel.name())
                    .register(this.meterRegistry)
                    .increment();
        }
        List<RankedDocument> fused = this.fuse(lists);
        Map<FusionChannel, Integer> hits = new EnumMap<>(FusionChannel.class);
        for (RankedList list : lists) {
            hits.merge(list.channel(), list.documents().size(), Integer::sum);
        }
        long elapsed = System.currentTimeMillis() - startTime;
        List<FusionChannel> failedChannels = failed.stream().sorted().toList();
        log.info("Fusion: {} lists, {} fused documents, failed={} ({}ms)", lists.size(), fused.size(), failedChannels, elapsed);
        return new RetrievalResult(fused, hits, failedChannels, elapsed);
    }

    private void schedule(List<ChannelTask> tasks, FusionChannel channel, String query) {
        if (query == null || query.isBlank()) {
            return;
        }
        SearchProvider provider = this.providers.get(channel.backend());
        if (provider == null || !provider.isAvailable()) {
            log.debug("Fusion: no {} provider, channel {} skipped", channel.backend(), channel);
            return;
        }
        int limit = this.perStrategyLimit;
        CompletableFuture<List<SourceDocument>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> provider.search(query, limit), this.ragExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Fusion: executor saturated, {} skipped", channel);
            future = CompletableFuture.failedFuture(e);
        }
        tasks.add(new ChannelTask(channel, future));
    }

    /**
     * Weighted RRF over the given lists followed by recency and authority boosts,
     * deduplication and top-K truncation. Deterministic for identical input.
     */
    public List<RankedDocument> fuse(List<RankedList> lists) {
        Map<String, Candidate> candidates = new LinkedHashMap<>();
        for (RankedList list : lists) {
            double weight = this.weight(list.channel());
            Set<String> seenInList = new HashSet<>();
            int rank = 0;
            for (SourceDocument doc : list.documents()) {
                if (doc == null || doc.id() == null || !seenInList.add(doc.id())) {
                    continue;
                }
                rank++;
                double contribution = weight / (double) (this.rrfK + rank);
                candidates.computeIfAbsent(doc.id(), id -> new Candidate()).add(list.channel(), contribution, doc);
            }
        }
        LocalDate cutoff = LocalDate.now(this.clock).minusDays(this.recencyDays);
        List<Scored> scored = new ArrayList<>(candidates.size());
        for (Map.Entry<String, Candidate> entry : candidates.entrySet()) {
            Candidate candidate = entry.getValue();
            SourceDocument best = candidate.best;
            double score = candidate.rrfScore;
            if (best.publishedDate() != null && !best.publishedDate().isBefore(cutoff)) {
                score *= 1.0 + this.recencyBoost;
            }
            score *= this.sourceHierarchy.weight(best.sourceType());
            scored.add(new Scored(entry.getKey(), score, candidate));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed().thenComparing(Scored::id));
        List<RankedDocument> results = new ArrayList<>(Math.min(this.topK, scored.size()));
        for (Scored s : scored) {
            if (results.size() >= this.topK) {
                break;
            }
            SourceDocument doc = s.candidate().best;
            double hierarchyWeight = this.sourceHierarchy.weight(doc.sourceType());
            results.add(new RankedDocument(doc.id(), doc.content(), doc.sourceName(), doc.sourceType(), doc.publishedDate(),
                    s.candidate().rawScores, s.score(), doc.metadata(), this.metadataExtractor.extract(doc, hierarchyWeight)));
        }
        return results;
    }

    double weight(FusionChannel channel) {
        return switch (channel) {
            case LEXICAL -> this.lexicalWeight;
            case VECTOR -> this.vectorWeight;
            case HYPOTHETICAL -> this.hypotheticalWeight;
            case ENTITY -> this.entityWeight;
        };
    }

    private record ChannelTask(FusionChannel channel, CompletableFuture<List<SourceDocument>> future) {
    }

    private record Scored(String id, double score, Candidate candidate) {
    }

    private static final class Candidate {
        private double rrfScore;
        private SourceDocument best;
        private final Map<FusionChannel, Double> rawScores = new EnumMap<>(FusionChannel.class);

        void add(FusionChannel channel, double contribution, SourceDocument doc) {
            this.rrfScore += contribution;
            this.rawScores.merge(channel, doc.score(), Math::max);
            if (this.best == null || doc.score() > this.best.score()) {
                this.best = doc;
            }
        }
    }
}
