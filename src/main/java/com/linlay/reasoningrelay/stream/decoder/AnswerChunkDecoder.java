package com.linlay.reasoningrelay.stream.decoder;

import com.linlay.reasoningrelay.model.SemanticEvent;

import java.util.List;

/**
 * 回答 provider 的帧：每个非 null 的 {@code content} 都产出一个 {@code answer} 事件。
 */
public class AnswerChunkDecoder extends AbstractSseChunkDecoder {

    public AnswerChunkDecoder(OpenAiDeltaParser deltaParser) {
        super(deltaParser);
    }

    @Override
    protected void onDelta(ProviderDelta delta, List<SemanticEvent> out) {
        if (delta.content() != null) {
            out.add(SemanticEvent.answer(delta.content()));
        }
    }
}
