package com.linlay.reasoningrelay.stream.client;

import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.SemanticEvent;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * 单个 provider 的流式对话入口。
 * <p>
 * 返回惰性事件序列，按 provider 到达顺序逐个产出；传输或解析失败只会让序列提前结束，不会以错误信号抛给调用方。
 */
public interface ProviderStreamClient {

    Flux<SemanticEvent> streamChat(List<ChatMessage> messages, String model);
}
