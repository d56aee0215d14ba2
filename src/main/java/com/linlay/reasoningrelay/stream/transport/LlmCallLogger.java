package com.linlay.reasoningrelay.stream.transport;

import com.linlay.reasoningrelay.config.LlmInteractionLogProperties;
import com.linlay.reasoningrelay.model.ChatMessage;
import org.slf4j.Logger;
import org.springframework.http.HttpHeaders;

import java.util.List;

/**
 * LLM 调用日志：开关、脱敏、截断与耗时计算，传输层和 provider 客户端共用。
 */
public class LlmCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;
    private final int maxLoggedChars;

    public LlmCallLogger() {
        this(LlmInteractionLogProperties.defaults());
    }

    public LlmCallLogger(LlmInteractionLogProperties properties) {
        LlmInteractionLogProperties resolved = properties == null ? LlmInteractionLogProperties.defaults() : properties;
        this.enabled = resolved.enabled();
        this.maskSensitive = resolved.maskSensitive();
        this.maxLoggedChars = resolved.maxLoggedChars();
    }

    public long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    /**
     * Masks credentials, then cuts the text to the configured length.
     */
    public String sanitizeText(String text) {
        String masked = LlmLogSanitizer.maskText(text, maskSensitive);
        if (masked.length() <= maxLoggedChars) {
            return masked;
        }
        return masked.substring(0, maxLoggedChars) + "...(" + masked.length() + " chars)";
    }

    public HttpHeaders sanitizeHeaders(HttpHeaders headers) {
        return LlmLogSanitizer.maskHeaders(headers, maskSensitive);
    }

    public void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    public void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled && logger.isDebugEnabled()) {
            logger.debug(pattern, arguments);
        }
    }

    public void logMessages(Logger logger, String providerKey, List<ChatMessage> messages) {
        if (!enabled || !logger.isDebugEnabled() || messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            ChatMessage message = messages.get(i);
            if (message == null) {
                continue;
            }
            builder.append('#').append(i).append(' ')
                    .append(message.role().value())
                    .append(": ")
                    .append(sanitizeText(message.content()))
                    .append('\n');
        }
        logger.debug("[{}] forwarding {} messages:\n{}", providerKey, messages.size(), builder);
    }
}
