package com.linlay.reasoningrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * provider 调用日志配置。{@code maxLoggedChars} 限制写入日志的请求体与流式增量长度。
 */
@ConfigurationProperties(prefix = "relay.llm.interaction-log")
public record LlmInteractionLogProperties(
        Boolean enabled,
        Boolean maskSensitive,
        Integer maxLoggedChars
) {

    public static final int DEFAULT_MAX_LOGGED_CHARS = 4_000;

    public LlmInteractionLogProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (maskSensitive == null) {
            maskSensitive = Boolean.TRUE;
        }
        if (maxLoggedChars == null || maxLoggedChars <= 0) {
            maxLoggedChars = DEFAULT_MAX_LOGGED_CHARS;
        }
    }

    public static LlmInteractionLogProperties defaults() {
        return new LlmInteractionLogProperties(null, null, null);
    }
}
