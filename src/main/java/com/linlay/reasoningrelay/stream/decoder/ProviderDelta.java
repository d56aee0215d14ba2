package com.linlay.reasoningrelay.stream.decoder;

/**
 * 单帧的 {@code choices[0].delta}。字段为 null 表示缺失或 JSON null。
 */
public record ProviderDelta(
        String reasoning,
        String content
) {

    public boolean hasReasoningText() {
        return reasoning != null && !reasoning.isEmpty();
    }

    public boolean hasContentText() {
        return content != null && !content.isEmpty();
    }
}
