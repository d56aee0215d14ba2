package com.linlay.reasoningrelay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.reasoningrelay.model.ReasoningMode;
import com.linlay.reasoningrelay.relay.ReasoningRelayCoordinator;
import com.linlay.reasoningrelay.relay.RelayFrames;
import com.linlay.reasoningrelay.stream.client.ProviderStreamClient;
import com.linlay.reasoningrelay.stream.client.SseProviderStreamClient;
import com.linlay.reasoningrelay.stream.decoder.AnswerChunkDecoder;
import com.linlay.reasoningrelay.stream.decoder.OpenAiDeltaParser;
import com.linlay.reasoningrelay.stream.decoder.ReasoningChunkDecoder;
import com.linlay.reasoningrelay.stream.transport.LlmCallLogger;
import com.linlay.reasoningrelay.stream.transport.LlmLogSanitizer;
import com.linlay.reasoningrelay.stream.transport.StreamTransport;
import com.linlay.reasoningrelay.stream.transport.WebClientStreamTransport;
import io.netty.handler.logging.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;
import java.util.function.Consumer;

@Configuration
public class RelayConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RelayConfiguration.class);
    private static final String LLM_WIRETAP_LOGGER = "com.linlay.reasoningrelay.llm.wiretap";

    @Bean
    public ConnectionProvider llmConnectionProvider() {
        return ConnectionProvider.builder("llm-pool")
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public WebClient llmWebClient(LlmInteractionLogProperties logProperties, ConnectionProvider llmConnectionProvider) {
        HttpClient httpClient = HttpClient.create(llmConnectionProvider);
        if (logProperties.enabled() && !logProperties.maskSensitive()) {
            httpClient = httpClient.wiretap(LLM_WIRETAP_LOGGER, LogLevel.DEBUG, AdvancedByteBufFormat.TEXTUAL);
        }
        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient));
        if (!logProperties.enabled()) {
            return builder.build();
        }

        boolean maskSensitive = logProperties.maskSensitive();
        return builder.filter((request, next) -> {
                    log.debug("[llm-webclient][request] {} {}", request.method(), request.url());
                    log.debug("[llm-webclient][request-headers] {}",
                            LlmLogSanitizer.maskHeaders(request.headers(), maskSensitive));
                    return next.exchange(request)
                            .doOnNext(logResponse(maskSensitive, request));
                })
                .build();
    }

    @Bean
    public LlmCallLogger llmCallLogger(LlmInteractionLogProperties logProperties) {
        return new LlmCallLogger(logProperties);
    }

    @Bean
    public StreamTransport streamTransport(
            WebClient llmWebClient,
            ObjectMapper objectMapper,
            LlmCallLogger llmCallLogger,
            RelayStreamProperties streamProperties
    ) {
        return new WebClientStreamTransport(llmWebClient, objectMapper, llmCallLogger,
                streamProperties.transportIdleTimeout());
    }

    @Bean
    public OpenAiDeltaParser openAiDeltaParser(ObjectMapper objectMapper) {
        return new OpenAiDeltaParser(objectMapper);
    }

    @Bean
    public ProviderStreamClient reasoningStreamClient(
            RelayProviderProperties providerProperties,
            StreamTransport streamTransport,
            OpenAiDeltaParser openAiDeltaParser,
            LlmCallLogger llmCallLogger
    ) {
        RelayProviderProperties.ProviderConfig config =
                providerProperties.getProvider(RelayProviderProperties.REASONING_PROVIDER);
        ReasoningMode configuredMode = config == null ? ReasoningMode.AUTO : config.getReasoningMode();
        return new SseProviderStreamClient(
                RelayProviderProperties.REASONING_PROVIDER,
                config,
                streamTransport,
                model -> new ReasoningChunkDecoder(openAiDeltaParser, configuredMode.resolve(model)),
                llmCallLogger
        );
    }

    @Bean
    public ProviderStreamClient answerStreamClient(
            RelayProviderProperties providerProperties,
            StreamTransport streamTransport,
            OpenAiDeltaParser openAiDeltaParser,
            LlmCallLogger llmCallLogger
    ) {
        return new SseProviderStreamClient(
                RelayProviderProperties.ANSWER_PROVIDER,
                providerProperties.getProvider(RelayProviderProperties.ANSWER_PROVIDER),
                streamTransport,
                model -> new AnswerChunkDecoder(openAiDeltaParser),
                llmCallLogger
        );
    }

    @Bean
    public RelayFrames relayFrames(ObjectMapper objectMapper) {
        return new RelayFrames(objectMapper);
    }

    @Bean
    public ReasoningRelayCoordinator reasoningRelayCoordinator(
            @Qualifier("reasoningStreamClient") ProviderStreamClient reasoningStreamClient,
            @Qualifier("answerStreamClient") ProviderStreamClient answerStreamClient,
            RelayFrames relayFrames,
            RelayStreamProperties streamProperties
    ) {
        return new ReasoningRelayCoordinator(reasoningStreamClient, answerStreamClient, relayFrames,
                streamProperties.deadline());
    }

    private Consumer<ClientResponse> logResponse(boolean maskSensitive, ClientRequest request) {
        return response -> {
            log.debug("[llm-webclient][response] {} {} status={}",
                    request.method(), request.url(), response.statusCode().value());
            log.debug("[llm-webclient][response-headers] {}",
                    LlmLogSanitizer.maskHeaders(response.headers().asHttpHeaders(), maskSensitive));
        };
    }
}
