package com.linlay.reasoningrelay.stream.client;

import com.linlay.reasoningrelay.config.RelayProviderProperties;
import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.SemanticEvent;
import com.linlay.reasoningrelay.stream.decoder.ChunkDecoder;
import com.linlay.reasoningrelay.stream.decoder.ChunkDecoderFactory;
import com.linlay.reasoningrelay.stream.decoder.DecodedChunk;
import com.linlay.reasoningrelay.stream.transport.LlmCallLogger;
import com.linlay.reasoningrelay.stream.transport.StreamTransport;
import com.linlay.reasoningrelay.stream.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * OpenAI 兼容的 SSE provider 客户端：构建请求，经传输层拉取原始块，逐块解码为语义事件。
 */
public class SseProviderStreamClient implements ProviderStreamClient {

    private static final Logger log = LoggerFactory.getLogger(SseProviderStreamClient.class);
    private static final String COMPLETIONS_PATH = "/chat/completions";

    private final String providerKey;
    private final RelayProviderProperties.ProviderConfig config;
    private final StreamTransport transport;
    private final ChunkDecoderFactory decoderFactory;
    private final LlmCallLogger callLogger;

    public SseProviderStreamClient(
            String providerKey,
            RelayProviderProperties.ProviderConfig config,
            StreamTransport transport,
            ChunkDecoderFactory decoderFactory,
            LlmCallLogger callLogger
    ) {
        this.providerKey = Objects.requireNonNull(providerKey, "providerKey cannot be null");
        this.config = config;
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.decoderFactory = Objects.requireNonNull(decoderFactory, "decoderFactory cannot be null");
        this.callLogger = callLogger == null ? new LlmCallLogger() : callLogger;
    }

    @Override
    public Flux<SemanticEvent> streamChat(List<ChatMessage> messages, String model) {
        return Flux.defer(() -> {
            validateConfig();
            String resolvedModel = resolveModel(model);
            ChunkDecoder decoder = decoderFactory.create(resolvedModel);
            long startNanos = System.nanoTime();

            callLogger.info(log, "[{}] LLM stream request start model={}, messages={}",
                    providerKey, resolvedModel, messages == null ? 0 : messages.size());
            callLogger.logMessages(log, providerKey, messages);

            return transport.stream(
                            resolveCompletionsUri(config.getBaseUrl()),
                            buildHeaders(),
                            buildRequestBody(messages, resolvedModel)
                    )
                    .map(decoder::decode)
                    .takeUntil(DecodedChunk::endOfStream)
                    .concatMapIterable(DecodedChunk::events)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(decoder.finish())))
                    .doOnNext(event -> callLogger.debug(log, "[{}][delta] {}: {}",
                            providerKey, event.kind().value(), callLogger.sanitizeText(event.text())))
                    .doOnComplete(() -> callLogger.info(log, "[{}] LLM stream finished in {} ms",
                            providerKey, callLogger.elapsedMs(startNanos)))
                    .doOnCancel(() -> callLogger.info(log, "[{}] LLM stream canceled in {} ms",
                            providerKey, callLogger.elapsedMs(startNanos)))
                    .onErrorResume(TransportException.class, ex -> {
                        log.error("[{}] LLM stream failed in {} ms, ending stream early: {}",
                                providerKey, callLogger.elapsedMs(startNanos), ex.getMessage(), ex);
                        return Flux.empty();
                    });
        });
    }

    public String providerKey() {
        return providerKey;
    }

    Map<String, Object> buildRequestBody(List<ChatMessage> messages, String model) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", model);
        request.put("messages", toRawMessages(messages));
        request.put("stream", true);
        if (config.getMaxTokens() != null && config.getMaxTokens() > 0) {
            request.put("max_tokens", config.getMaxTokens());
        }
        if (config.getTemperature() != null) {
            request.put("temperature", config.getTemperature());
        }
        return request;
    }

    HttpHeaders buildHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(config.getApiKey());
        if (config.isAcceptEventStream()) {
            headers.setAccept(List.of(MediaType.TEXT_EVENT_STREAM));
        }
        config.getHeaders().forEach((name, value) -> {
            if (StringUtils.hasText(name) && value != null) {
                headers.set(name, value);
            }
        });
        return headers;
    }

    String resolveCompletionsUri(String baseUrl) {
        String trimmed = baseUrl == null ? "" : baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT);
        if (normalized.endsWith(COMPLETIONS_PATH)) {
            return trimmed;
        }
        if (normalized.endsWith("/v1")) {
            return trimmed + COMPLETIONS_PATH;
        }
        return trimmed + "/v1" + COMPLETIONS_PATH;
    }

    private List<Map<String, Object>> toRawMessages(List<ChatMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<Map<String, Object>> rawMessages = new ArrayList<>(messages.size());
        for (ChatMessage message : messages) {
            if (message == null) {
                continue;
            }
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("role", message.role().value());
            raw.put("content", message.content());
            rawMessages.add(raw);
        }
        return rawMessages;
    }

    private String resolveModel(String model) {
        if (StringUtils.hasText(model)) {
            return model.trim();
        }
        if (StringUtils.hasText(config.getModel())) {
            return config.getModel().trim();
        }
        throw new IllegalStateException("No model configured for provider: " + providerKey);
    }

    private void validateConfig() {
        if (config == null) {
            throw new IllegalStateException("No provider config found for key: " + providerKey);
        }
        if (!StringUtils.hasText(config.getBaseUrl())) {
            throw new IllegalStateException("Missing base-url for key: " + providerKey);
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            throw new IllegalStateException("Missing api-key for key: " + providerKey);
        }
    }
}
