package com.jreinhal.norma.foundation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Chat models available to this process, keyed by provider name ("openai", "anthropic").
 * A provider whose API key is not configured is simply absent.
 */
@Component
public class ModelProviderRegistry {
    private final Map<String, ChatModel> providers = new LinkedHashMap<>();

    @Autowired
    public ModelProviderRegistry(Optional<OpenAiChatModel> openAiModel, Optional<AnthropicChatModel> anthropicModel) {
        openAiModel.ifPresent(m -> this.providers.put("openai", m));
        anthropicModel.ifPresent(m -> this.providers.put("anthropic", m));
    }

    public ModelProviderRegistry(Map<String, ChatModel> providers) {
        providers.forEach((name, model) -> this.providers.put(name.toLowerCase(), model));
    }

    public Optional<ChatModel> get(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.providers.get(provider.toLowerCase()));
    }

    public Set<String> names() {
        return this.providers.keySet();
    }

    public boolean isEmpty() {
        return this.providers.isEmpty();
    }
}
