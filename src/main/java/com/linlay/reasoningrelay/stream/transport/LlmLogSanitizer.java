package com.linlay.reasoningrelay.stream.transport;

import org.springframework.http.HttpHeaders;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 日志脱敏：provider 密钥可能出现在请求头、错误响应体或请求体回显中。
 */
public final class LlmLogSanitizer {

    static final String MASK = "***";

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|[a-z_]*token|secret|password)\"\\s*:\\s*)\"[^\"]*\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)\\S+");
    private static final Pattern PROVIDER_KEY_PATTERN = Pattern.compile("\\bsk-[A-Za-z0-9_\\-]{8,}");

    private LlmLogSanitizer() {
    }

    /**
     * Copies the headers and masks credential values, keeping the auth scheme visible.
     */
    public static HttpHeaders maskHeaders(HttpHeaders headers, boolean maskSensitive) {
        HttpHeaders safeHeaders = new HttpHeaders();
        if (headers == null) {
            return safeHeaders;
        }
        headers.forEach((name, values) -> {
            if (maskSensitive && isCredentialHeader(name)) {
                safeHeaders.put(name, values.stream().map(LlmLogSanitizer::maskCredential).toList());
            } else {
                safeHeaders.put(name, values);
            }
        });
        return safeHeaders;
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null) {
            return "";
        }
        if (text.isEmpty() || !maskSensitive) {
            return text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"" + MASK + "\"");
        masked = BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1" + MASK);
        return PROVIDER_KEY_PATTERN.matcher(masked).replaceAll("sk-" + MASK);
    }

    static boolean isCredentialHeader(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return lower.equals("authorization")
                || lower.contains("api-key")
                || lower.contains("token")
                || lower.contains("secret");
    }

    private static String maskCredential(String value) {
        if (value == null) {
            return MASK;
        }
        int space = value.indexOf(' ');
        return space > 0 ? value.substring(0, space + 1) + MASK : MASK;
    }
}
