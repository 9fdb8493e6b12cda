package com.jreinhal.norma.foundation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tier to provider/model mapping, bound from {@code norma.models.*}.
 */
@Component
@ConfigurationProperties(prefix = "norma.models")
public class ModelTierProperties {
    private static final Logger log = LoggerFactory.getLogger(ModelTierProperties.class);

    private TierSettings basic = TierSettings.basicDefaults();
    private TierSettings advanced = TierSettings.advancedDefaults();

    public TierSettings forTier(ModelTier tier) {
        return tier == ModelTier.ADVANCED ? this.advanced : this.basic;
    }

    /**
     * Replaces missing or out-of-range values with the hard-coded defaults.
     */
    public void validate() {
        this.basic = TierSettings.validated("basic", this.basic, TierSettings.basicDefaults());
        this.advanced = TierSettings.validated("advanced", this.advanced, TierSettings.advancedDefaults());
    }

    public TierSettings getBasic() {
        return this.basic;
    }

    public void setBasic(TierSettings basic) {
        this.basic = basic;
    }

    public TierSettings getAdvanced() {
        return this.advanced;
    }

    public void setAdvanced(TierSettings advanced) {
        this.advanced = advanced;
    }

    public static class TierSettings {
        private String primaryProvider;
        private String primaryModel;
        private String fallbackProvider;
        private String fallbackModel;
        private double temperature;
        private int maxTokens;
        private long timeoutMs;
        private double inputCostPer1k;
        private double outputCostPer1k;

        public static TierSettings basicDefaults() {
            TierSettings s = new TierSettings();
            s.primaryProvider = "openai";
            s.primaryModel = "gpt-4o-mini";
            s.fallbackProvider = "anthropic";
            s.fallbackModel = "claude-3-5-haiku-latest";
            s.temperature = 0.3;
            s.maxTokens = 1500;
            s.timeoutMs = 30_000L;
            s.inputCostPer1k = 0.00015;
            s.outputCostPer1k = 0.0006;
            return s;
        }

        public static TierSettings advancedDefaults() {
            TierSettings s = new TierSettings();
            s.primaryProvider = "openai";
            s.primaryModel = "gpt-4o";
            s.fallbackProvider = "anthropic";
            s.fallbackModel = "claude-sonnet-4-20250514";
            s.temperature = 0.4;
            s.maxTokens = 2500;
            s.timeoutMs = 45_000L;
            s.inputCostPer1k = 0.005;
            s.outputCostPer1k = 0.015;
            return s;
        }

        static TierSettings validated(String name, TierSettings configured, TierSettings defaults) {
            if (configured == null) {
                log.warn("Model tier '{}' not configured, using defaults", name);
                return defaults;
            }
            if (isBlank(configured.primaryProvider) || isBlank(configured.primaryModel)) {
                log.warn("Model tier '{}' has no primary provider/model, using {}/{}", name,
                        defaults.primaryProvider, defaults.primaryModel);
                configured.primaryProvider = defaults.primaryProvider;
                configured.primaryModel = defaults.primaryModel;
            }
            if (isBlank(configured.fallbackProvider) != isBlank(configured.fallbackModel)) {
                log.warn("Model tier '{}' fallback is half-configured, fallback disabled", name);
                configured.fallbackProvider = null;
                configured.fallbackModel = null;
            }
            if (configured.temperature < 0.0 || configured.temperature > 2.0) {
                log.warn("Model tier '{}' temperature {} out of range, using {}", name, configured.temperature, defaults.temperature);
                configured.temperature = defaults.temperature;
            }
            if (configured.maxTokens <= 0) {
                log.warn("Model tier '{}' maxTokens {} invalid, using {}", name, configured.maxTokens, defaults.maxTokens);
                configured.maxTokens = defaults.maxTokens;
            }
            if (configured.timeoutMs <= 0L) {
                log.warn("Model tier '{}' timeoutMs {} invalid, using {}", name, configured.timeoutMs, defaults.timeoutMs);
                configured.timeoutMs = defaults.timeoutMs;
            }
            if (configured.inputCostPer1k < 0.0 || configured.outputCostPer1k < 0.0) {
                log.warn("Model tier '{}' has negative prices, using defaults", name);
                configured.inputCostPer1k = defaults.inputCostPer1k;
                configured.outputCostPer1k = defaults.outputCostPer1k;
            }
            return configured;
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }

        public boolean hasFallback() {
            return !isBlank(this.fallbackProvider) && !isBlank(this.fallbackModel);
        }

        public String getPrimaryProvider() {
            return this.primaryProvider;
        }

        public void setPrimaryProvider(String primaryProvider) {
            this.primaryProvider = primaryProvider;
        }

        public String getPrimaryModel() {
            return this.primaryModel;
        }

        public void setPrimaryModel(String primaryModel) {
            this.primaryModel = primaryModel;
        }

        public String getFallbackProvider() {
            return this.fallbackProvider;
        }

        public void setFallbackProvider(String fallbackProvider) {
            this.fallbackProvider = fallbackProvider;
        }

        public String getFallbackModel() {
            return this.fallbackModel;
        }

        public void setFallbackModel(String fallbackModel) {
            this.fallbackModel = fallbackModel;
        }

        public double getTemperature() {
            return this.temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return this.maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public long getTimeoutMs() {
            return this.timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public double getInputCostPer1k() {
            return this.inputCostPer1k;
        }

        public void setInputCostPer1k(double inputCostPer1k) {
            this.inputCostPer1k = inputCostPer1k;
        }

        public double getOutputCostPer1k() {
            return this.outputCostPer1k;
        }

        public void setOutputCostPer1k(double outputCostPer1k) {
            this.outputCostPer1k = outputCostPer1k;
        }
    }
}
