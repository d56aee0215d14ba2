package com.linlay.reasoningrelay.controller;

import com.linlay.reasoningrelay.config.RelayProviderProperties;
import com.linlay.reasoningrelay.config.RelayStreamProperties;
import com.linlay.reasoningrelay.model.api.ChatCompletionRequest;
import com.linlay.reasoningrelay.model.api.ModelListResponse;
import com.linlay.reasoningrelay.relay.ReasoningRelayCoordinator;
import com.linlay.reasoningrelay.relay.RelayRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/v1")
public class ChatCompletionController {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionController.class);
    private static final String OWNER = "reasoning-relay";

    private final ReasoningRelayCoordinator coordinator;
    private final SseFrameWriter frameWriter;
    private final RelayProviderProperties providerProperties;
    private final RelayStreamProperties streamProperties;
    private final long startedAt = Instant.now().getEpochSecond();

    public ChatCompletionController(
            ReasoningRelayCoordinator coordinator,
            SseFrameWriter frameWriter,
            RelayProviderProperties providerProperties,
            RelayStreamProperties streamProperties
    ) {
        this.coordinator = coordinator;
        this.frameWriter = frameWriter;
        this.providerProperties = providerProperties;
        this.streamProperties = streamProperties;
    }

    @PostMapping(value = "/chat/completions", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> chatCompletions(
            @Valid @RequestBody ChatCompletionRequest request,
            ServerHttpResponse response
    ) {
        if (Boolean.FALSE.equals(request.stream())) {
            log.debug("stream=false requested for model={}, responding with a stream anyway", request.model());
        }
        RelayRequest relayRequest = new RelayRequest(
                request.messages(),
                resolveModel(request.reasoningModel(), RelayProviderProperties.REASONING_PROVIDER),
                resolveModel(request.answerModel(), RelayProviderProperties.ANSWER_PROVIDER)
        );
        return frameWriter.write(response, coordinator.relay(relayRequest));
    }

    @GetMapping("/models")
    public ModelListResponse models() {
        return ModelListResponse.of(List.of(new ModelListResponse.ModelEntry(
                streamProperties.modelId(),
                "model",
                startedAt,
                OWNER
        )));
    }

    private String resolveModel(String requested, String providerKey) {
        if (StringUtils.hasText(requested)) {
            return requested.trim();
        }
        RelayProviderProperties.ProviderConfig config = providerProperties.requireProvider(providerKey);
        if (!StringUtils.hasText(config.getModel())) {
            throw new IllegalStateException("No model configured for provider: " + providerKey);
        }
        return config.getModel().trim();
    }
}
