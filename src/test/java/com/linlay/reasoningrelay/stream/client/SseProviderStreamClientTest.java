package com.linlay.reasoningrelay.stream.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.reasoningrelay.config.RelayProviderProperties;
import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.ReasoningMode;
import com.linlay.reasoningrelay.model.SemanticEvent;
import com.linlay.reasoningrelay.stream.decoder.AnswerChunkDecoder;
import com.linlay.reasoningrelay.stream.decoder.OpenAiDeltaParser;
import com.linlay.reasoningrelay.stream.decoder.ReasoningChunkDecoder;
import com.linlay.reasoningrelay.stream.transport.StreamTransport;
import com.linlay.reasoningrelay.stream.transport.TransportException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SseProviderStreamClientTest {

    private final OpenAiDeltaParser parser = new OpenAiDeltaParser(new ObjectMapper());

    @Test
    void shouldStopAtDoneSentinelAndCancelUpstream() {
        AtomicBoolean upstreamCanceled = new AtomicBoolean();
        StreamTransport transport = (endpoint, headers, body) -> Flux.concat(
                        Flux.just(
                                bytes(frame("{\"content\":\"Hi\"}")),
                                bytes(frame("{\"content\":\" there\"}") + "data: [DONE]\n\n")
                        ),
                        Flux.<byte[]>never()
                )
                .doOnCancel(() -> upstreamCanceled.set(true));

        List<SemanticEvent> events = answerClient(transport, answerConfig())
                .streamChat(List.of(ChatMessage.user("hello")), null)
                .collectList()
                .block(Duration.ofSeconds(3));

        assertThat(events).containsExactly(SemanticEvent.answer("Hi"), SemanticEvent.answer(" there"));
        assertThat(upstreamCanceled).isTrue();
    }

    @Test
    void shouldEndReasoningStreamWithEmptyContentWhenTransportEndsWithoutSentinel() {
        StreamTransport transport = (endpoint, headers, body) -> Flux.just(
                bytes(frame("{\"reasoning_content\":\"thinking\"}"))
        );
        RelayProviderProperties.ProviderConfig config = answerConfig();
        SseProviderStreamClient client = new SseProviderStreamClient(
                RelayProviderProperties.REASONING_PROVIDER,
                config,
                transport,
                model -> new ReasoningChunkDecoder(parser, ReasoningMode.AUTO.resolve(model)),
                null
        );

        List<SemanticEvent> events = client.streamChat(List.of(ChatMessage.user("q")), "deepseek-reasoner")
                .collectList()
                .block(Duration.ofSeconds(3));

        assertThat(events).containsExactly(SemanticEvent.reasoning("thinking"), SemanticEvent.content(""));
    }

    @Test
    void transportFailureShouldEndTheStreamEarlyWithoutError() {
        StreamTransport transport = (endpoint, headers, body) -> Flux.concat(
                Flux.just(bytes(frame("{\"content\":\"partial\"}"))),
                Flux.<byte[]>error(new TransportException(502, "Provider responded with status 502"))
        );

        List<SemanticEvent> events = answerClient(transport, answerConfig())
                .streamChat(List.of(ChatMessage.user("q")), null)
                .collectList()
                .block(Duration.ofSeconds(3));

        assertThat(events).containsExactly(SemanticEvent.answer("partial"));
    }

    @Test
    void shouldSendConfiguredModelHeadersAndBody() {
        AtomicReference<String> endpointRef = new AtomicReference<>();
        AtomicReference<HttpHeaders> headersRef = new AtomicReference<>();
        AtomicReference<Object> bodyRef = new AtomicReference<>();
        StreamTransport transport = (endpoint, headers, body) -> {
            endpointRef.set(endpoint);
            headersRef.set(headers);
            bodyRef.set(body);
            return Flux.just(bytes("data: [DONE]\n\n"));
        };
        RelayProviderProperties.ProviderConfig config = answerConfig();
        config.setMaxTokens(8192);
        config.setTemperature(0.7);
        config.setHeaders(Map.of("X-Title", "reasoning-relay"));

        answerClient(transport, config)
                .streamChat(List.of(ChatMessage.system("rules"), ChatMessage.user("hi")), null)
                .collectList()
                .block(Duration.ofSeconds(3));

        assertThat(endpointRef.get()).isEqualTo("https://answer.example.com/api/v1/chat/completions");
        assertThat(headersRef.get().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer answer-key");
        assertThat(headersRef.get().getFirst("X-Title")).isEqualTo("reasoning-relay");
        assertThat(headersRef.get().getAccept()).isEmpty();

        @SuppressWarnings("unchecked")
        Map<String, Object> body = (Map<String, Object>) bodyRef.get();
        assertThat(body).containsEntry("model", "answer-model")
                .containsEntry("stream", true)
                .containsEntry("max_tokens", 8192)
                .containsEntry("temperature", 0.7);
        assertThat(body.get("messages")).isEqualTo(List.of(
                Map.of("role", "system", "content", "rules"),
                Map.of("role", "user", "content", "hi")
        ));
    }

    @Test
    void reasoningRequestShouldAcceptEventStreamAndOmitSamplingFields() {
        RelayProviderProperties.ProviderConfig config = answerConfig();
        config.setAcceptEventStream(true);
        SseProviderStreamClient client = answerClient((endpoint, headers, body) -> Flux.empty(), config);

        assertThat(client.buildHeaders().getAccept()).containsExactly(MediaType.TEXT_EVENT_STREAM);
        assertThat(client.buildRequestBody(List.of(ChatMessage.user("q")), "r1"))
                .containsOnlyKeys("model", "messages", "stream");
    }

    @Test
    void shouldResolveCompletionsUriFromBaseUrl() {
        SseProviderStreamClient client = answerClient((endpoint, headers, body) -> Flux.empty(), answerConfig());

        assertThat(client.resolveCompletionsUri("https://api.deepseek.com")).isEqualTo("https://api.deepseek.com/v1/chat/completions");
        assertThat(client.resolveCompletionsUri("https://api.deepseek.com/v1/")).isEqualTo("https://api.deepseek.com/v1/chat/completions");
        assertThat(client.resolveCompletionsUri("https://gw.example.com/chat/completions"))
                .isEqualTo("https://gw.example.com/chat/completions");
    }

    @Test
    void missingApiKeyShouldFailOnSubscribe() {
        RelayProviderProperties.ProviderConfig config = answerConfig();
        config.setApiKey(" ");
        Flux<SemanticEvent> events = answerClient((endpoint, headers, body) -> Flux.empty(), config)
                .streamChat(List.of(ChatMessage.user("q")), null);

        assertThatThrownBy(() -> events.collectList().block(Duration.ofSeconds(3)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("api-key");
    }

    private SseProviderStreamClient answerClient(StreamTransport transport, RelayProviderProperties.ProviderConfig config) {
        return new SseProviderStreamClient(
                RelayProviderProperties.ANSWER_PROVIDER,
                config,
                transport,
                model -> new AnswerChunkDecoder(parser),
                null
        );
    }

    private static RelayProviderProperties.ProviderConfig answerConfig() {
        RelayProviderProperties.ProviderConfig config = new RelayProviderProperties.ProviderConfig();
        config.setBaseUrl("https://answer.example.com/api/v1");
        config.setApiKey("answer-key");
        config.setModel("answer-model");
        return config;
    }

    private static String frame(String deltaJson) {
        return "data: {\"choices\":[{\"delta\":" + deltaJson + "}]}\n\n";
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
