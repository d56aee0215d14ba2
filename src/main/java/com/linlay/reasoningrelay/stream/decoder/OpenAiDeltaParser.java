package com.linlay.reasoningrelay.stream.decoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class OpenAiDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiDeltaParser.class);

    private final ObjectMapper objectMapper;

    public OpenAiDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public ProviderDelta parseOrNull(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode choices = root.path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                return null;
            }
            JsonNode deltaNode = choices.get(0).path("delta");
            if (!deltaNode.isObject()) {
                return null;
            }
            return new ProviderDelta(
                    optionalText(deltaNode.get("reasoning_content")),
                    optionalText(deltaNode.get("content"))
            );
        } catch (Exception ex) {
            log.warn("Failed to parse provider SSE payload: {}", payload, ex);
            return null;
        }
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }
}
