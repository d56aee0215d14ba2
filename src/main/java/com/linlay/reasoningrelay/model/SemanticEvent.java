package com.linlay.reasoningrelay.model;

/**
 * 解码器输出的语义事件。
 * <p>
 * {@code text} 为空串时只在流结束处作为"没有产出内容"的显式信号出现。
 */
public record SemanticEvent(
        SemanticEventKind kind,
        String text
) {

    public SemanticEvent {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (text == null) {
            text = "";
        }
    }

    public static SemanticEvent reasoning(String text) {
        return new SemanticEvent(SemanticEventKind.REASONING, text);
    }

    public static SemanticEvent content(String text) {
        return new SemanticEvent(SemanticEventKind.CONTENT, text);
    }

    public static SemanticEvent answer(String text) {
        return new SemanticEvent(SemanticEventKind.ANSWER, text);
    }

    public boolean hasText() {
        return !text.isEmpty();
    }
}
