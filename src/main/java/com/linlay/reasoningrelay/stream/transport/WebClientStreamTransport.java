package com.linlay.reasoningrelay.stream.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * 原生 WebClient 流式传输：POST JSON 请求体，按到达顺序透传原始响应字节块。
 */
public class WebClientStreamTransport implements StreamTransport {

    private static final Logger log = LoggerFactory.getLogger(WebClientStreamTransport.class);
    private static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(60);
    private static final int MAX_ERROR_BODY_CHARS = 2_000;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final LlmCallLogger callLogger;
    private final Duration idleTimeout;

    public WebClientStreamTransport(WebClient webClient, ObjectMapper objectMapper, LlmCallLogger callLogger) {
        this(webClient, objectMapper, callLogger, DEFAULT_IDLE_TIMEOUT);
    }

    public WebClientStreamTransport(WebClient webClient, ObjectMapper objectMapper,
                                    LlmCallLogger callLogger, Duration idleTimeout) {
        this.webClient = Objects.requireNonNull(webClient, "webClient cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.callLogger = callLogger == null ? new LlmCallLogger() : callLogger;
        this.idleTimeout = idleTimeout == null || idleTimeout.isZero() || idleTimeout.isNegative()
                ? DEFAULT_IDLE_TIMEOUT
                : idleTimeout;
    }

    @Override
    public Flux<byte[]> stream(String endpoint, HttpHeaders headers, Object body) {
        return Flux.defer(() -> {
            long startNanos = System.nanoTime();
            callLogger.info(log, "[transport] POST {} headers={}", endpoint, callLogger.sanitizeHeaders(headers));
            callLogger.debug(log, "[transport] request body:\n{}", safeJson(body));

            return webClient.post()
                    .uri(endpoint)
                    .headers(target -> {
                        if (headers != null) {
                            target.addAll(headers);
                        }
                    })
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(errorBody -> new TransportException(
                                    response.statusCode().value(),
                                    "Provider responded with status " + response.statusCode().value()
                                            + ": " + truncate(callLogger.sanitizeText(errorBody))
                            )))
                    .bodyToFlux(byte[].class)
                    .timeout(idleTimeout)
                    .onErrorMap(ex -> !(ex instanceof TransportException), this::toTransportException)
                    .doOnComplete(() -> callLogger.info(
                            log, "[transport] POST {} completed in {} ms", endpoint, callLogger.elapsedMs(startNanos)
                    ))
                    .doOnCancel(() -> callLogger.debug(
                            log, "[transport] POST {} canceled in {} ms", endpoint, callLogger.elapsedMs(startNanos)
                    ));
        });
    }

    private TransportException toTransportException(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return new TransportException("Provider stream idle for more than " + idleTimeout, ex);
        }
        return new TransportException("Provider stream failed: " + ex.getMessage(), ex);
    }

    private String safeJson(Object value) {
        try {
            return callLogger.sanitizeText(objectMapper.writeValueAsString(value));
        } catch (Exception ex) {
            return callLogger.sanitizeText(String.valueOf(value));
        }
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_BODY_CHARS) {
            return text;
        }
        return text.substring(0, MAX_ERROR_BODY_CHARS) + "...";
    }
}
