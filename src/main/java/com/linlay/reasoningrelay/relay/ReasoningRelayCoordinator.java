package com.linlay.reasoningrelay.relay;

import com.linlay.reasoningrelay.model.ChatMessage;
import com.linlay.reasoningrelay.model.SemanticEvent;
import com.linlay.reasoningrelay.model.SemanticEventKind;
import com.linlay.reasoningrelay.model.api.ChatCompletionChunk;
import com.linlay.reasoningrelay.stream.client.ProviderStreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 推理/回答两阶段流式中继。
 * <p>
 * 每个请求并发订阅两个阶段：推理阶段把推理事件写入输出并累积，遇到第一个 content 事件时把累积内容
 * 一次性交给回答阶段并停止消费；回答阶段等待交接后调用回答 provider。两阶段的输出按到达顺序合并，
 * 整体受一个截止时间约束，超时则取消两阶段并输出错误帧。任何退出路径都以 {@code [DONE]} 帧结束。
 */
public class ReasoningRelayCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReasoningRelayCoordinator.class);
    private static final int STAGE_COUNT = 2;

    private final ProviderStreamClient reasoningClient;
    private final ProviderStreamClient answerClient;
    private final AnswerPromptBuilder promptBuilder;
    private final RelayFrames frames;
    private final Duration deadline;
    private final Clock clock;
    private final Scheduler timerScheduler;

    public ReasoningRelayCoordinator(
            ProviderStreamClient reasoningClient,
            ProviderStreamClient answerClient,
            RelayFrames frames,
            Duration deadline
    ) {
        this(reasoningClient, answerClient, new AnswerPromptBuilder(), frames, deadline,
                Clock.systemUTC(), Schedulers.parallel());
    }

    public ReasoningRelayCoordinator(
            ProviderStreamClient reasoningClient,
            ProviderStreamClient answerClient,
            AnswerPromptBuilder promptBuilder,
            RelayFrames frames,
            Duration deadline,
            Clock clock,
            Scheduler timerScheduler
    ) {
        this.reasoningClient = Objects.requireNonNull(reasoningClient, "reasoningClient cannot be null");
        this.answerClient = Objects.requireNonNull(answerClient, "answerClient cannot be null");
        this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder cannot be null");
        this.frames = Objects.requireNonNull(frames, "frames cannot be null");
        this.deadline = Objects.requireNonNull(deadline, "deadline cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler cannot be null");
    }

    public Flux<String> relay(RelayRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        return Flux.defer(() -> {
            RelaySession session = openSession(request);
            if (deadline.isZero() || deadline.isNegative()) {
                session.advance(RelayState.TIMEOUT);
                log.warn("[{}] relay deadline {} already elapsed, no stage started", session.requestId(), deadline);
                return Flux.just(frames.timeoutError(), RelayFrames.DONE_FRAME);
            }

            Mono<Long> deadlineTimer = Mono.delay(deadline, timerScheduler)
                    .filter(tick -> session.advance(RelayState.TIMEOUT));

            Flux<String> drained = Flux.merge(reasoningStage(session), answerStage(session))
                    .doOnSubscribe(subscription -> session.advance(RelayState.RUNNING))
                    .map(chunk -> {
                        session.advance(RelayState.DRAINING);
                        return frames.data(chunk);
                    })
                    .doOnComplete(() -> session.advance(RelayState.DONE))
                    .takeUntilOther(deadlineTimer)
                    .onErrorResume(ex -> {
                        log.error("[{}] relay drain failed in state {}", session.requestId(), session.state(), ex);
                        return Flux.empty();
                    });

            return drained
                    .concatWith(Flux.defer(() -> closingFrames(session)))
                    .doOnCancel(() -> log.info("[{}] relay canceled by downstream in state {}",
                            session.requestId(), session.state()));
        });
    }

    private RelaySession openSession(RelayRequest request) {
        long nowMillis = clock.millis();
        String requestId = "chatcmpl-" + Long.toHexString(nowMillis);
        RelaySession session = new RelaySession(requestId, nowMillis / 1000, request);
        log.info("[{}] relay start reasoningModel={}, answerModel={}, messages={}, deadline={}",
                requestId, request.reasoningModel(), request.answerModel(), request.messages().size(), deadline);
        return session;
    }

    private Flux<String> closingFrames(RelaySession session) {
        if (session.state() == RelayState.TIMEOUT) {
            log.warn("[{}] relay timed out after {}, stages completed={}",
                    session.requestId(), deadline, session.completedStages());
            return Flux.just(frames.timeoutError(), RelayFrames.DONE_FRAME);
        }
        session.advance(RelayState.DONE);
        log.info("[{}] relay finished, stages completed={}", session.requestId(), session.completedStages());
        return Flux.just(RelayFrames.DONE_FRAME);
    }

    private Flux<ChatCompletionChunk> reasoningStage(RelaySession session) {
        String requestId = session.requestId();
        String model = session.request().reasoningModel();
        return reasoningClient.streamChat(session.request().messages(), model)
                .takeUntil(event -> event.kind() == SemanticEventKind.CONTENT)
                .<ChatCompletionChunk>handle((event, sink) -> {
                    if (event.kind() == SemanticEventKind.REASONING) {
                        session.appendReasoning(event.text());
                        sink.next(session.envelope(model, ChatCompletionChunk.Delta.reasoning(event.text())));
                    } else if (event.kind() == SemanticEventKind.CONTENT) {
                        String reasoning = session.accumulatedReasoning();
                        if (reasoning.isEmpty()) {
                            log.warn("[{}][reasoning] content signal arrived without any reasoning", requestId);
                        }
                        session.handOff(reasoning);
                    }
                })
                .doOnComplete(() -> {
                    if (session.handOff(session.accumulatedReasoning())) {
                        log.warn("[{}][reasoning] stream ended without a content signal", requestId);
                    }
                })
                .onErrorResume(ex -> {
                    log.error("[{}][reasoning] stage failed", requestId, ex);
                    session.handOff("");
                    return Flux.empty();
                })
                .doFinally(signal -> stageCompleted(session, "reasoning", signal));
    }

    private Flux<ChatCompletionChunk> answerStage(RelaySession session) {
        String requestId = session.requestId();
        String model = session.request().answerModel();
        return session.awaitHandoff()
                .flatMapMany(reasoning -> {
                    if (session.state().isTerminal()) {
                        return Flux.<SemanticEvent>empty();
                    }
                    if (reasoning.isEmpty()) {
                        log.warn("[{}][answer] no reasoning received, forwarding original messages", requestId);
                    }
                    List<ChatMessage> forwarded = promptBuilder.build(session.request().messages(), reasoning);
                    return answerClient.streamChat(forwarded, model);
                })
                .filter(event -> event.kind() == SemanticEventKind.ANSWER && event.hasText())
                .map(SemanticEvent::text)
                .map(text -> session.envelope(model, ChatCompletionChunk.Delta.answer(text)))
                .onErrorResume(ex -> {
                    log.error("[{}][answer] stage failed", requestId, ex);
                    return Flux.empty();
                })
                .doFinally(signal -> stageCompleted(session, "answer", signal));
    }

    private void stageCompleted(RelaySession session, String stage, SignalType signal) {
        int completed = session.markStageCompleted();
        log.debug("[{}][{}] stage exited with {} ({}/{})", session.requestId(), stage, signal, completed, STAGE_COUNT);
    }
}
