package com.jreinhal.norma.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds provider chat models only for providers whose API key is set, so a deployment
 * with a single provider starts cleanly and simply runs without a fallback.
 */
@Configuration
public class ModelProviderConfig {
    private static final Logger log = LoggerFactory.getLogger(ModelProviderConfig.class);

    @Bean
    @ConditionalOnExpression("'${norma.providers.openai.api-key:}' != ''")
    public OpenAiChatModel openAiChatModel(
            @Value("${norma.providers.openai.api-key}") String apiKey,
            @Value("${norma.providers.openai.base-url:https://api.openai.com}") String baseUrl,
            @Value("${norma.providers.openai.default-model:gpt-4o-mini}") String defaultModel) {
        OpenAiApi api = OpenAiApi.builder().apiKey(apiKey).baseUrl(baseUrl).build();
        log.info("Provider 'openai' configured (baseUrl={}, defaultModel={})", baseUrl, defaultModel);
        return OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(defaultModel).build())
                .build();
    }

    @Bean
    @ConditionalOnExpression("'${norma.providers.anthropic.api-key:}' != ''")
    public AnthropicChatModel anthropicChatModel(
            @Value("${norma.providers.anthropic.api-key}") String apiKey,
            @Value("${norma.providers.anthropic.default-model:claude-3-5-haiku-latest}") String defaultModel) {
        AnthropicApi api = AnthropicApi.builder().apiKey(apiKey).build();
        log.info("Provider 'anthropic' configured (defaultModel={})", defaultModel);
        return AnthropicChatModel.builder()
                .anthropicApi(api)
                .defaultOptions(AnthropicChatOptions.builder().model(defaultModel).maxTokens(1024).build())
                .build();
    }
}
