package com.linlay.reasoningrelay.model.api;

import com.linlay.reasoningrelay.model.ChatMessage;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * OpenAI 兼容的对话请求。{@code reasoningModel} / {@code answerModel} 为空时使用各 provider 的配置模型。
 */
public record ChatCompletionRequest(
        String model,
        @NotEmpty
        List<@Valid @NotNull ChatMessage> messages,
        Boolean stream,
        String reasoningModel,
        String answerModel
) {
}
