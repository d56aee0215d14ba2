package com.linlay.reasoningrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "relay.stream")
public record RelayStreamProperties(
        Duration deadline,
        String modelId,
        Duration transportIdleTimeout
) {

    public static final Duration DEFAULT_DEADLINE = Duration.ofMinutes(10);
    public static final String DEFAULT_MODEL_ID = "deepclaude";
    public static final Duration DEFAULT_TRANSPORT_IDLE_TIMEOUT = Duration.ofSeconds(60);

    public RelayStreamProperties {
        if (deadline == null) {
            deadline = DEFAULT_DEADLINE;
        }
        if (modelId == null || modelId.isBlank()) {
            modelId = DEFAULT_MODEL_ID;
        }
        if (transportIdleTimeout == null) {
            transportIdleTimeout = DEFAULT_TRANSPORT_IDLE_TIMEOUT;
        }
    }
}
