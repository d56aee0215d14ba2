package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.SemanticEvent;

import java.util.List;

/**
 * 单个原始块解码出的事件；读到结束标记后 {@code endOfStream} 为 true。
 */
public record DecodedChunk(
        List<SemanticEvent> events,
        boolean endOfStream
) {

    public DecodedChunk {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static DecodedChunk empty() {
        return new DecodedChunk(List.of(), false);
    }
}
