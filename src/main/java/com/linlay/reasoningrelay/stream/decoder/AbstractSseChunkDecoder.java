package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.SemanticEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 共用的 {@code data:} 分帧与结束标记处理，子类负责对每个解析出的增量分类。
 */
public abstract class AbstractSseChunkDecoder implements ChunkDecoder {

    private final SseLineFramer framer = new SseLineFramer();
    private final OpenAiDeltaParser deltaParser;
    private boolean ended;

    protected AbstractSseChunkDecoder(OpenAiDeltaParser deltaParser) {
        this.deltaParser = Objects.requireNonNull(deltaParser, "deltaParser cannot be null");
    }

    @Override
    public final DecodedChunk decode(byte[] chunk) {
        if (ended) {
            return new DecodedChunk(List.of(), true);
        }
        return consume(framer.feed(chunk));
    }

    @Override
    public final List<SemanticEvent> finish() {
        if (ended) {
            return List.of();
        }
        DecodedChunk tail = consume(framer.flush());
        if (tail.endOfStream()) {
            return tail.events();
        }
        List<SemanticEvent> events = new ArrayList<>(tail.events());
        ended = true;
        onStreamEnd(events);
        return events;
    }

    protected abstract void onDelta(ProviderDelta delta, List<SemanticEvent> out);

    protected void onStreamEnd(List<SemanticEvent> out) {
    }

    private DecodedChunk consume(List<String> payloads) {
        if (payloads.isEmpty()) {
            return DecodedChunk.empty();
        }
        List<SemanticEvent> events = new ArrayList<>();
        for (String payload : payloads) {
            if (SseLineFramer.DONE_SENTINEL.equals(payload)) {
                ended = true;
                onStreamEnd(events);
                return new DecodedChunk(events, true);
            }
            ProviderDelta delta = deltaParser.parseOrNull(payload);
            if (delta != null) {
                onDelta(delta, events);
            }
        }
        return new DecodedChunk(events, false);
    }
}
