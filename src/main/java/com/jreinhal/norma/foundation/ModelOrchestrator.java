package com.jreinhal.norma.foundation;

import com.jreinhal.norma.exception.ModelUnavailableException;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Single entry point for model calls. Resolves a {@link ModelTier} to its primary
 * provider/model, enforces the per-call timeout, switches to the configured fallback
 * when the primary is unavailable and records token spend.
 */
@Service
public class ModelOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ModelOrchestrator.class);

    private final ModelProviderRegistry registry;
    private final ProviderHealthService healthService;
    private final ModelTierProperties tierProperties;
    private final CostTracker costTracker;
    private final Executor executor;

    public ModelOrchestrator(ModelProviderRegistry registry, ProviderHealthService healthService,
                             ModelTierProperties tierProperties, CostTracker costTracker,
                             @Qualifier("reasoningExecutor") Executor executor) {
        this.registry = registry;
        this.healthService = healthService;
        this.tierProperties = tierProperties;
        this.costTracker = costTracker;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        this.tierProperties.validate();
        for (ModelTier tier : ModelTier.values()) {
            ModelTierProperties.TierSettings s = this.tierProperties.forTier(tier);
            log.info("Model tier {}: primary={}/{} fallback={} timeout={}ms", tier, s.getPrimaryProvider(),
                    s.getPrimaryModel(), s.hasFallback() ? s.getFallbackProvider() + "/" + s.getFallbackModel() : "none",
                    s.getTimeoutMs());
        }
    }

    public ModelReply invoke(ModelTier tier, String systemPrompt, String userPrompt) {
        return this.invoke(tier, systemPrompt, userPrompt, ModelCallOptions.defaults());
    }

    /**
     * @throws ModelUnavailableException when both primary and fallback fail or are unavailable
     */
    public ModelReply invoke(ModelTier tier, String systemPrompt, String userPrompt, ModelCallOptions options) {
        ModelTierProperties.TierSettings settings = this.tierProperties.forTier(tier);
        ModelCallOptions effective = options == null ? ModelCallOptions.defaults() : options;
        long timeoutMs = effective.timeoutMs() != null && effective.timeoutMs() > 0L ? effective.timeoutMs() : settings.getTimeoutMs();
        Throwable lastError = null;
        List<Route> routes = this.routes(settings);
        for (int i = 0; i < routes.size(); i++) {
            Route route = routes.get(i);
            boolean fallback = i > 0;
            ChatModel model = this.registry.get(route.provider()).orElse(null);
            if (model == null) {
                lastError = new IllegalStateException("Provider '" + route.provider() + "' is not configured");
                continue;
            }
            if (!this.healthService.isAvailable(route.provider())) {
                log.warn("Model tier {}: provider '{}' circuit open, skipping", tier, route.provider());
                lastError = new IllegalStateException("Provider '" + route.provider() + "' circuit open");
                continue;
            }
            Prompt prompt = this.buildPrompt(systemPrompt, userPrompt, route.model(), settings, effective);
            long start = System.currentTimeMillis();
            CompletableFuture<ChatResponse> future;
            try {
                future = CompletableFuture.supplyAsync(() -> model.call(prompt), this.executor);
            } catch (RejectedExecutionException e) {
                log.warn("Model tier {}: call to {}/{} rejected, reasoning executor saturated", tier, route.provider(), route.model());
                lastError = e;
                continue;
            }
            try {
                ChatResponse response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                long latency = System.currentTimeMillis() - start;
                ModelReply reply = this.toReply(response, route, tier, settings, systemPrompt, userPrompt, latency, fallback);
                this.healthService.recordSuccess(route.provider());
                this.costTracker.record(reply);
                if (fallback) {
                    log.warn("Model tier {}: served by fallback {}/{} (degraded) after: {}", tier, route.provider(),
                            route.model(), lastError != null ? lastError.getMessage() : "primary unavailable");
                }
                return reply;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new ModelUnavailableException(tier, "Interrupted while waiting for " + route.provider(), e);
            } catch (TimeoutException e) {
                future.cancel(true);
                this.healthService.recordFailure(route.provider(), e);
                log.warn("Model tier {}: {}/{} timed out after {}ms", tier, route.provider(), route.model(), timeoutMs);
                lastError = e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                this.healthService.recordFailure(route.provider(), cause);
                log.warn("Model tier {}: {}/{} failed: {}", tier, route.provider(), route.model(), cause.getMessage());
                lastError = cause;
            }
        }
        throw new ModelUnavailableException(tier, "No provider available for tier " + tier, lastError);
    }

    /**
     * Streams text deltas. Falls back to the secondary provider only if the primary fails
     * before emitting anything; a failure mid-stream is propagated.
     */
    public Flux<String> stream(ModelTier tier, String systemPrompt, String userPrompt, ModelCallOptions options) {
        ModelTierProperties.TierSettings settings = this.tierProperties.forTier(tier);
        ModelCallOptions effective = options == null ? ModelCallOptions.defaults() : options;
        long timeoutMs = effective.timeoutMs() != null && effective.timeoutMs() > 0L ? effective.timeoutMs() : settings.getTimeoutMs();
        return this.streamRoute(tier, this.routes(settings), 0, settings, effective, systemPrompt, userPrompt, timeoutMs, null);
    }

    private Flux<String> streamRoute(ModelTier tier, List<Route> routes, int index, ModelTierProperties.TierSettings settings,
                                     ModelCallOptions options, String systemPrompt, String userPrompt, long timeoutMs,
                                     Throwable lastError) {
        if (index >= routes.size()) {
            return Flux.error(new ModelUnavailableException(tier, "No provider available for streaming tier " + tier, lastError));
        }
        Route route = routes.get(index);
        ChatModel model = this.registry.get(route.provider()).orElse(null);
        if (model == null || !this.healthService.isAvailable(route.provider())) {
            return this.streamRoute(tier, routes, index + 1, settings, options, systemPrompt, userPrompt, timeoutMs,
                    new IllegalStateException("Provider '" + route.provider() + "' unavailable"));
        }
        Prompt prompt = this.buildPrompt(systemPrompt, userPrompt, route.model(), settings, options);
        AtomicBoolean emitted = new AtomicBoolean(false);
        return Flux.defer(() -> model.stream(prompt))
                .map(ModelOrchestrator::textOf)
                .filter(text -> !text.isEmpty())
                .doOnNext(text -> emitted.set(true))
                .timeout(Duration.ofMillis(timeoutMs))
                .doOnComplete(() -> this.healthService.recordSuccess(route.provider()))
                .onErrorResume(error -> {
                    this.healthService.recordFailure(route.provider(), error);
                    if (emitted.get()) {
                        log.warn("Model tier {}: stream from {} failed mid-response: {}", tier, route.provider(), error.getMessage());
                        return Flux.error(error);
                    }
                    log.warn("Model tier {}: stream from {} failed before first token, trying next provider", tier, route.provider());
                    return this.streamRoute(tier, routes, index + 1, settings, options, systemPrompt, userPrompt, timeoutMs, error);
                });
    }

    private List<Route> routes(ModelTierProperties.TierSettings settings) {
        List<Route> routes = new ArrayList<>(2);
        routes.add(new Route(settings.getPrimaryProvider(), settings.getPrimaryModel()));
        if (settings.hasFallback()) {
            routes.add(new Route(settings.getFallbackProvider(), settings.getFallbackModel()));
        }
        return routes;
    }

    private Prompt buildPrompt(String systemPrompt, String userPrompt, String model,
                               ModelTierProperties.TierSettings settings, ModelCallOptions options) {
        List<Message> messages = new ArrayList<>(2);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(new SystemMessage(systemPrompt));
        }
        messages.add(new UserMessage(userPrompt == null ? "" : userPrompt));
        ChatOptions chatOptions = ChatOptions.builder()
                .model(model)
                .temperature(options.temperature() != null ? options.temperature() : settings.getTemperature())
                .maxTokens(options.maxTokens() != null ? options.maxTokens() : settings.getMaxTokens())
                .build();
        return new Prompt(messages, chatOptions);
    }

    private ModelReply toReply(ChatResponse response, Route route, ModelTier tier, ModelTierProperties.TierSettings settings,
                               String systemPrompt, String userPrompt, long latencyMs, boolean degraded) {
        String text = textOf(response);
        int tokensIn = 0;
        int tokensOut = 0;
        Usage usage = response != null && response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        if (usage != null) {
            tokensIn = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            tokensOut = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
        }
        if (tokensIn == 0 && tokensOut == 0) {
            tokensIn = estimateTokens(systemPrompt) + estimateTokens(userPrompt);
            tokensOut = estimateTokens(text);
        }
        double cost = CostTracker.price(settings, tokensIn, tokensOut);
        return new ModelReply(text, route.provider(), route.model(), tier, tokensIn, tokensOut, cost, latencyMs, degraded);
    }

    static String textOf(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return "";
        }
        String text = response.getResult().getOutput().getText();
        return text == null ? "" : text;
    }

    static int estimateTokens(String text) {
        return text == null ? 0 : (text.length() + 3) / 4;
    }

    private record Route(String provider, String model) {
    }
}
