package com.linlay.reasoningrelay.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

/**
 * 中继输出的帧格式：每帧 {@code data: {json}\n\n}。
 */
public class RelayFrames {

    public static final String DONE_FRAME = "data: [DONE]\n\n";
    public static final String TIMEOUT_MESSAGE = "Operation timeout";

    private final ObjectMapper objectMapper;

    public RelayFrames(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public String data(Object payload) {
        return "data: " + toJson(payload) + "\n\n";
    }

    public String timeoutError() {
        return data(Map.of("error", TIMEOUT_MESSAGE));
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize relay frame", ex);
        }
    }
}
