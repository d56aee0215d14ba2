package com.linlay.reasoningrelay.stream.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientStreamTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void shouldPostJsonAndPassThroughResponseBytes() throws Exception {
        ArrayBlockingQueue<String> captured = new ArrayBlockingQueue<>(2);
        String payload = "data: {\"choices\":[{\"delta\":{\"content\":\"思考\"}}]}\n\ndata: [DONE]\n\n";
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            captured.offer(readBody(exchange.getRequestBody()));
            captured.offer(String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        });
        server.start();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth("sk-test");
        List<byte[]> chunks = transport(Duration.ofSeconds(5))
                .stream(endpoint(), headers, Map.of("model", "m", "stream", true))
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(chunks).isNotNull();
        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            joined.write(chunk);
        }
        assertThat(joined.toString(StandardCharsets.UTF_8)).isEqualTo(payload);

        String body = captured.poll(3, TimeUnit.SECONDS);
        assertThat(objectMapper.readTree(body).path("model").asText()).isEqualTo("m");
        assertThat(captured.poll(3, TimeUnit.SECONDS)).isEqualTo("Bearer sk-test");
    }

    @Test
    void nonSuccessStatusShouldFailWithStatusCode() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            byte[] bytes = "{\"error\":\"invalid api key\"}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(401, bytes.length);
            try (OutputStream output = exchange.getResponseBody()) {
                output.write(bytes);
            }
        });
        server.start();

        assertThatThrownBy(() -> transport(Duration.ofSeconds(5))
                .stream(endpoint(), new HttpHeaders(), Map.of("model", "m"))
                .collectList()
                .block(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(TransportException.class, ex -> {
                    assertThat(ex.statusCode()).isEqualTo(401);
                    assertThat(ex.getMessage()).contains("401").contains("invalid api key");
                });
    }

    @Test
    void unreachableProviderShouldFailAsTransportError() throws Exception {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        int port = server.getAddress().getPort();
        server.stop(0);
        server = null;

        assertThatThrownBy(() -> transport(Duration.ofSeconds(5))
                .stream("http://127.0.0.1:" + port + "/v1/chat/completions", new HttpHeaders(), Map.of("model", "m"))
                .collectList()
                .block(Duration.ofSeconds(5)))
                .isInstanceOfSatisfying(TransportException.class, ex -> assertThat(ex.statusCode()).isNull());
    }

    private WebClientStreamTransport transport(Duration idleTimeout) {
        return new WebClientStreamTransport(WebClient.builder().build(), objectMapper, new LlmCallLogger(), idleTimeout);
    }

    private String endpoint() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/v1/chat/completions";
    }

    private static String readBody(InputStream inputStream) throws IOException {
        return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
    }
}
