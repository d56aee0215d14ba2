package com.linlay.reasoningrelay.stream.transport;

import com.linlay.reasoningrelay.config.LlmInteractionLogProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import static org.assertj.core.api.Assertions.assertThat;

class LlmCallLoggerTest {

    @Test
    void shouldMaskCredentialHeadersButKeepScheme() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("sk-or-v1-0123456789abcdef");
        headers.set("X-Title", "reasoning-relay");
        headers.set("X-Api-Key", "plain");

        HttpHeaders masked = new LlmCallLogger().sanitizeHeaders(headers);

        assertThat(masked.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer ***");
        assertThat(masked.getFirst("X-Api-Key")).isEqualTo("***");
        assertThat(masked.getFirst("X-Title")).isEqualTo("reasoning-relay");
        assertThat(headers.getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-or-v1-0123456789abcdef");
    }

    @Test
    void shouldMaskSecretsInsideText() {
        String text = "{\"api_key\":\"abc\",\"error\":\"Incorrect API key provided: sk-1234567890abcd\"}";

        String masked = new LlmCallLogger().sanitizeText(text);

        assertThat(masked).contains("\"api_key\":\"***\"").contains("sk-***").doesNotContain("1234567890");
    }

    @Test
    void shouldTruncateLongTextAndKeepSecretsWhenMaskingIsOff() {
        LlmCallLogger logger = new LlmCallLogger(new LlmInteractionLogProperties(true, false, 10));

        assertThat(logger.sanitizeText("Bearer sk-1234567890abcd")).isEqualTo("Bearer sk-...(24 chars)");
        assertThat(logger.sanitizeText(null)).isEmpty();
    }
}
