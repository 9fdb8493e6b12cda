package com.jreinhal.norma.foundation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * Accumulates model spend per request, per session and per complexity class.
 * Request and session ids come from the MDC set by the pipeline.
 */
@Component
public class CostTracker {
    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SESSION_ID = "sessionId";

    private final MeterRegistry meterRegistry;
    private final Cache<String, CostSnapshot> requestCosts = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofMinutes(30))
            .build();
    private final Cache<String, CostSnapshot> sessionCosts = Caffeine.newBuilder()
            .maximumSize(50_000)
            .expireAfterAccess(Duration.ofHours(2))
            .build();
    private final Map<QueryComplexity, CostSnapshot> complexityCosts = new ConcurrentHashMap<>();

    public CostTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(ModelReply reply) {
        CostSnapshot delta = CostSnapshot.of(reply);
        String requestId = MDC.get(MDC_REQUEST_ID);
        String sessionId = MDC.get(MDC_SESSION_ID);
        if (requestId != null) {
            this.requestCosts.asMap().merge(requestId, delta, CostSnapshot::plus);
        }
        if (sessionId != null) {
            this.sessionCosts.asMap().merge(sessionId, delta, CostSnapshot::plus);
        }
        Counter.builder("norma.llm.tokens")
                .tag("tier", reply.tier().name())
                .tag("direction", "in")
                .register(this.meterRegistry)
                .increment(reply.tokensIn());
        Counter.builder("norma.llm.tokens")
                .tag("tier", reply.tier().name())
                .tag("direction", "out")
                .register(this.meterRegistry)
                .increment(reply.tokensOut());
        Counter.builder("norma.llm.cost.usd")
                .description("Estimated model spend")
                .tag("tier", reply.tier().name())
                .tag("provider", reply.provider())
                .register(this.meterRegistry)
                .increment(reply.costUsd());
        if (log.isDebugEnabled()) {
            log.debug("Model cost: tier={} provider={} tokensIn={} tokensOut={} cost=${}",
                    reply.tier(), reply.provider(), reply.tokensIn(), reply.tokensOut(), String.format("%.6f", reply.costUsd()));
        }
    }

    /**
     * Attributes a finished request's spend to its complexity class.
     */
    public void attribute(QueryComplexity complexity, CostSnapshot requestCost) {
        if (complexity == null || requestCost == null) {
            return;
        }
        this.complexityCosts.merge(complexity, requestCost, CostSnapshot::plus);
    }

    public CostSnapshot forRequest(String requestId) {
        CostSnapshot snapshot = requestId == null ? null : this.requestCosts.getIfPresent(requestId);
        return snapshot == null ? CostSnapshot.EMPTY : snapshot;
    }

    public CostSnapshot forSession(String sessionId) {
        CostSnapshot snapshot = sessionId == null ? null : this.sessionCosts.getIfPresent(sessionId);
        return snapshot == null ? CostSnapshot.EMPTY : snapshot;
    }

    public Map<QueryComplexity, CostSnapshot> byComplexity() {
        Map<QueryComplexity, CostSnapshot> copy = new EnumMap<>(QueryComplexity.class);
        for (QueryComplexity complexity : QueryComplexity.values()) {
            copy.put(complexity, this.complexityCosts.getOrDefault(complexity, CostSnapshot.EMPTY));
        }
        return copy;
    }

    public static double price(ModelTierProperties.TierSettings settings, int tokensIn, int tokensOut) {
        return tokensIn / 1000.0 * settings.getInputCostPer1k() + tokensOut / 1000.0 * settings.getOutputCostPer1k();
    }
}
