package com.linlay.reasoningrelay.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 对外输出的流式块，每个语义事件对应一个。{@code id} 与 {@code created} 在同一请求内保持不变。
 */
public record ChatCompletionChunk(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices
) {

    public static final String OBJECT_TYPE = "chat.completion.chunk";
    public static final String ASSISTANT_ROLE = "assistant";

    public static ChatCompletionChunk of(String id, long created, String model, Delta delta) {
        return new ChatCompletionChunk(id, OBJECT_TYPE, created, model, List.of(new Choice(0, delta)));
    }

    public record Choice(
            int index,
            Delta delta
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delta(
            String role,
            String content,
            String reasoningContent
    ) {

        /**
         * Reasoning text goes into both fields so clients that only read {@code content} still show it.
         */
        public static Delta reasoning(String text) {
            return new Delta(ASSISTANT_ROLE, text, text);
        }

        public static Delta answer(String text) {
            return new Delta(ASSISTANT_ROLE, text, null);
        }
    }
}
