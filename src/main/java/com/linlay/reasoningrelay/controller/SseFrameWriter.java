package com.linlay.reasoningrelay.controller;

import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * 写出已成帧的 {@code data: ...\n\n} 字符串，每帧之后立即 flush。
 */
@Component
public class SseFrameWriter {

    public Mono<Void> write(ServerHttpResponse response, Flux<String> frames) {
        response.getHeaders().setContentType(MediaType.TEXT_EVENT_STREAM);
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache, no-transform");
        response.getHeaders().set("Connection", "keep-alive");

        return response.writeAndFlushWith(
                frames.map(frame -> frame.getBytes(StandardCharsets.UTF_8))
                        .map(response.bufferFactory()::wrap)
                        .map(Mono::just)
        );
    }
}
