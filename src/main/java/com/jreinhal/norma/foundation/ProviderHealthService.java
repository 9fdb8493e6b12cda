package com.jreinhal.norma.foundation;

import com.jreinhal.norma.util.SimpleCircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Per-provider circuit breakers plus a startup probe and a periodic re-check,
 * so a dead API key or an outage is known before user traffic hits it.
 */
@Service
public class ProviderHealthService {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthService.class);
    private static final String PROBE_PROMPT = "Rispondi solo con: ok";

    private final ModelProviderRegistry registry;
    private final Executor executor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Map<String, SimpleCircuitBreaker> breakers = new ConcurrentHashMap<>();

    @Value("${norma.health.failure-threshold:3}")
    private int failureThreshold;
    @Value("${norma.health.open-duration-seconds:30}")
    private long openDurationSeconds;
    @Value("${norma.health.probe-on-startup:true}")
    private boolean probeOnStartup;
    @Value("${norma.health.probe-timeout-ms:10000}")
    private long probeTimeoutMs;

    public ProviderHealthService(ModelProviderRegistry registry, @Qualifier("reasoningExecutor") Executor executor,
                                 Clock clock, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.executor = executor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        if (this.failureThreshold <= 0) {
            log.warn("Invalid norma.health.failure-threshold {}, using 3", this.failureThreshold);
            this.failureThreshold = 3;
        }
        if (this.openDurationSeconds <= 0L) {
            log.warn("Invalid norma.health.open-duration-seconds {}, using 30", this.openDurationSeconds);
            this.openDurationSeconds = 30L;
        }
        if (this.probeTimeoutMs <= 0L) {
            this.probeTimeoutMs = 10_000L;
        }
        for (String provider : this.registry.names()) {
            this.breakers.put(provider, this.newBreaker(provider));
        }
        if (this.registry.isEmpty()) {
            log.warn("No model provider configured: every model call will fail over to degraded answers");
        }
        log.info("Provider health initialized: providers={}, failureThreshold={}, openDuration={}s",
                this.registry.names(), this.failureThreshold, this.openDurationSeconds);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (this.probeOnStartup) {
            this.probeAll();
        }
    }

    /**
     * Re-probes providers whose circuit is not closed so they recover without user traffic.
     */
    @Scheduled(fixedDelayString = "${norma.health.recheck-interval-ms:300000}",
            initialDelayString = "${norma.health.recheck-interval-ms:300000}")
    public void recheck() {
        for (Map.Entry<String, SimpleCircuitBreaker> entry : this.breakers.entrySet()) {
            if (entry.getValue().getState() != SimpleCircuitBreaker.State.CLOSED) {
                this.probe(entry.getKey());
            }
        }
    }

    public void probeAll() {
        for (String provider : this.registry.names()) {
            this.probe(provider);
        }
    }

    public boolean probe(String provider) {
        ChatModel model = this.registry.get(provider).orElse(null);
        if (model == null) {
            return false;
        }
        SimpleCircuitBreaker breaker = this.breaker(provider);
        Prompt prompt = new Prompt(new UserMessage(PROBE_PROMPT), ChatOptions.builder().maxTokens(5).build());
        CompletableFuture<Object> future;
        try {
            future = CompletableFuture.supplyAsync(() -> model.call(prompt), this.executor);
        } catch (RejectedExecutionException e) {
            log.warn("Provider '{}' probe skipped, executor saturated", provider);
            return false;
        }
        try {
            future.get(this.probeTimeoutMs, TimeUnit.MILLISECONDS);
            breaker.recordSuccess();
            log.info("Provider '{}' probe succeeded", provider);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return false;
        } catch (TimeoutException e) {
            future.cancel(true);
            breaker.forceOpen(e);
            log.warn("Provider '{}' probe timed out after {}ms, circuit opened", provider, this.probeTimeoutMs);
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            breaker.forceOpen(cause);
            log.warn("Provider '{}' probe failed ({}), circuit opened", provider, breaker.getLastFailure());
            return false;
        }
    }

    public boolean isAvailable(String provider) {
        if (this.registry.get(provider).isEmpty()) {
            return false;
        }
        return this.breaker(provider).allowRequest();
    }

    public void recordSuccess(String provider) {
        this.breaker(provider).recordSuccess();
    }

    public void recordFailure(String provider, Throwable error) {
        SimpleCircuitBreaker breaker = this.breaker(provider);
        breaker.recordFailure(error);
        Counter.builder("norma.llm.provider.failures")
                .description("Model provider call failures")
                .tag("provider", provider)
                .register(this.meterRegistry)
                .increment();
        if (breaker.getState() == SimpleCircuitBreaker.State.OPEN) {
            log.warn("Provider '{}' circuit OPEN after failure: {}", provider, breaker.getLastFailure());
        }
    }

    public Map<String, SimpleCircuitBreaker.State> snapshot() {
        Map<String, SimpleCircuitBreaker.State> states = new LinkedHashMap<>();
        for (String provider : this.registry.names()) {
            states.put(provider, this.breaker(provider).getState());
        }
        return states;
    }

    private SimpleCircuitBreaker breaker(String provider) {
        return this.breakers.computeIfAbsent(provider, this::newBreaker);
    }

    private SimpleCircuitBreaker newBreaker(String provider) {
        return new SimpleCircuitBreaker(provider, this.failureThreshold, Duration.ofSeconds(this.openDurationSeconds), 1, this.clock);
    }
}
