package com.linlay.reasoningrelay.relay;

import com.linlay.reasoningrelay.model.ChatMessage;

import java.util.List;

public record RelayRequest(
        List<ChatMessage> messages,
        String reasoningModel,
        String answerModel
) {

    public RelayRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        if (reasoningModel == null || reasoningModel.isBlank()) {
            throw new IllegalArgumentException("reasoningModel must not be blank");
        }
        if (answerModel == null || answerModel.isBlank()) {
            throw new IllegalArgumentException("answerModel must not be blank");
        }
        messages = List.copyOf(messages);
    }
}
