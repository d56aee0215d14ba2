package com.linlay.reasoningrelay.config;

import com.linlay.reasoningrelay.model.ReasoningMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "relay")
public class RelayProviderProperties {

    public static final String REASONING_PROVIDER = "reasoning";
    public static final String ANSWER_PROVIDER = "answer";

    @Valid
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public ProviderConfig getProvider(String key) {
        return providers.get(key);
    }

    public ProviderConfig requireProvider(String key) {
        ProviderConfig config = providers.get(key);
        if (config == null) {
            throw new IllegalStateException("No provider config found for key: " + key);
        }
        return config;
    }

    public static class ProviderConfig {
        @NotBlank
        private String baseUrl;
        private String apiKey;
        private String model;
        private ReasoningMode reasoningMode = ReasoningMode.AUTO;
        private Integer maxTokens;
        private Double temperature;
        private boolean acceptEventStream;
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public ReasoningMode getReasoningMode() {
            return reasoningMode;
        }

        public void setReasoningMode(ReasoningMode reasoningMode) {
            this.reasoningMode = reasoningMode == null ? ReasoningMode.AUTO : reasoningMode;
        }

        public Integer getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public boolean isAcceptEventStream() {
            return acceptEventStream;
        }

        public void setAcceptEventStream(boolean acceptEventStream) {
            this.acceptEventStream = acceptEventStream;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers == null ? new LinkedHashMap<>() : headers;
        }
    }
}
