package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.ReasoningMode;
import com.linlay.reasoningrelay.model.SemanticEvent;
import com.linlay.reasoningrelay.model.SemanticEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 推理 provider 的帧。
 * <p>
 * 非空的 {@code reasoning_content} 一律视为推理。{@link ReasoningMode#NATIVE} 模式下，第一个不带推理字段的
 * content 标志推理结束；{@link ReasoningMode#INLINE_MARKER} 模式下，content 交给 {@link ThinkMarkerTracker}
 * 判断。流结束时若从未产出 content 事件，补发一个 {@code (content, "")}，让消费方仍能看到推理结束。
 */
public class ReasoningChunkDecoder extends AbstractSseChunkDecoder {

    private static final Logger log = LoggerFactory.getLogger(ReasoningChunkDecoder.class);

    private final ReasoningMode mode;
    private final ThinkMarkerTracker markerTracker;
    private boolean contentEmitted;

    public ReasoningChunkDecoder(OpenAiDeltaParser deltaParser, ReasoningMode mode) {
        this(deltaParser, mode, new ThinkMarkerTracker());
    }

    public ReasoningChunkDecoder(OpenAiDeltaParser deltaParser, ReasoningMode mode, ThinkMarkerTracker markerTracker) {
        super(deltaParser);
        if (mode == null || mode == ReasoningMode.AUTO) {
            throw new IllegalArgumentException("reasoning mode must be resolved before decoding");
        }
        this.mode = mode;
        this.markerTracker = Objects.requireNonNull(markerTracker, "markerTracker cannot be null");
    }

    public ReasoningMode mode() {
        return mode;
    }

    @Override
    protected void onDelta(ProviderDelta delta, List<SemanticEvent> out) {
        if (delta.hasReasoningText()) {
            out.add(SemanticEvent.reasoning(delta.reasoning()));
            return;
        }
        if (!delta.hasContentText()) {
            return;
        }
        if (mode == ReasoningMode.NATIVE) {
            if (delta.reasoning() == null) {
                log.debug("Reasoning channel closed, first content: {}", delta.content());
                contentEmitted = true;
                out.add(SemanticEvent.content(delta.content()));
            }
            return;
        }
        for (SemanticEvent event : markerTracker.accept(delta.content())) {
            if (event.kind() == SemanticEventKind.CONTENT) {
                contentEmitted = true;
            }
            out.add(event);
        }
    }

    @Override
    protected void onStreamEnd(List<SemanticEvent> out) {
        if (contentEmitted) {
            return;
        }
        log.info("Reasoning stream ended without content, emitting empty content (insideMarker={})",
                markerTracker.insideMarker());
        contentEmitted = true;
        out.add(SemanticEvent.content(""));
    }
}
