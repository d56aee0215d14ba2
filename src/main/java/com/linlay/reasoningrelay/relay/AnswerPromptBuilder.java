package com.linlay.reasoningrelay.relay;

import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.MessageRole;

import java.util.ArrayList;
import java.util.List;

/**
 * 根据调用方消息与交接的推理内容，构造发送给回答 provider 的会话；不修改调用方的列表。
 */
public class AnswerPromptBuilder {

    static final String REASONING_TEMPLATE =
            "Here's my reasoning process:\n%s\n\nBased on this reasoning, I will now provide my response:";

    public List<ChatMessage> build(List<ChatMessage> messages, String reasoning) {
        List<ChatMessage> forwarded = new ArrayList<>(messages == null ? List.of() : messages);
        if (reasoning != null && !reasoning.isEmpty()) {
            forwarded.add(ChatMessage.assistant(REASONING_TEMPLATE.formatted(reasoning)));
        }
        forwarded.removeIf(message -> message == null || message.role() == MessageRole.SYSTEM);
        return List.copyOf(forwarded);
    }
}
