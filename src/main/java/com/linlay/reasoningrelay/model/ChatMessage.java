package com.linlay.reasoningrelay.model;

import jakarta.validation.constraints.NotNull;

/**
 * 会话中的一条消息，构造后不可变。
 * <p>
 * 请求体中的 {@code content} 为 null 时由参数校验拒绝；工厂方法把 null 视为空串。
 */
public record ChatMessage(
        @NotNull
        MessageRole role,
        @NotNull
        String content
) {

    public ChatMessage {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content == null ? "" : content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content == null ? "" : content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content == null ? "" : content);
    }
}
