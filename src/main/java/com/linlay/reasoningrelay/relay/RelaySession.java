package com.linlay.reasoningrelay.relay;

import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.api.ChatCompletionChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单次中继请求的状态：请求标识、状态机、推理累积、一次性交接通道与阶段完成计数。
 * <p>
 * 推理累积只由推理阶段写入；交接通道容量为一，写入永不阻塞，只有第一次写入生效。
 */
final class RelaySession {

    private static final Logger log = LoggerFactory.getLogger(RelaySession.class);

    private final String requestId;
    private final long created;
    private final RelayRequest request;
    private final AtomicReference<RelayState> state = new AtomicReference<>(RelayState.INIT);
    private final Sinks.One<String> handoff = Sinks.one();
    private final List<String> reasoningParts = new ArrayList<>();
    private final AtomicInteger completedStages = new AtomicInteger();

    RelaySession(String requestId, long created, RelayRequest request) {
        this.requestId = requestId;
        this.created = created;
        this.request = request;
    }

    String requestId() {
        return requestId;
    }

    RelayRequest request() {
        return request;
    }

    RelayState state() {
        return state.get();
    }

    /**
     * Moves forward unless the session already reached a terminal state.
     */
    boolean advance(RelayState next) {
        while (true) {
            RelayState current = state.get();
            if (current.isTerminal() || current == next || current.ordinal() > next.ordinal()) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                log.debug("[{}] relay state {} -> {}", requestId, current, next);
                return true;
            }
        }
    }

    ChatCompletionChunk envelope(String model, ChatCompletionChunk.Delta delta) {
        return ChatCompletionChunk.of(requestId, created, model, delta);
    }

    synchronized void appendReasoning(String text) {
        reasoningParts.add(text);
    }

    synchronized String accumulatedReasoning() {
        return String.join("", reasoningParts);
    }

    /**
     * Delivers the handoff payload; later calls are ignored. Returns whether this call delivered it.
     */
    boolean handOff(String reasoning) {
        boolean delivered = handoff.tryEmitValue(reasoning == null ? "" : reasoning).isSuccess();
        if (delivered) {
            log.debug("[{}] reasoning handed off, length={}", requestId, reasoning == null ? 0 : reasoning.length());
            synchronized (this) {
                reasoningParts.clear();
            }
        }
        return delivered;
    }

    Mono<String> awaitHandoff() {
        return handoff.asMono();
    }

    int markStageCompleted() {
        return completedStages.incrementAndGet();
    }

    int completedStages() {
        return completedStages.get();
    }
}
