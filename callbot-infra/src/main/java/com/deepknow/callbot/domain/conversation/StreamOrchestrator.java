package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.agent.HandoffNotice;
import com.deepknow.callbot.domain.agent.HandoffNotifier;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ExchangeCancelledException;
import com.deepknow.callbot.domain.conversation.event.StreamEvent;
import com.deepknow.callbot.domain.conversation.event.StreamEventSink;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.ExchangeMetrics;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.model.HandoffReason;
import com.deepknow.callbot.domain.conversation.model.Turn;
import com.deepknow.callbot.domain.conversation.service.AssistantService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单次问答编排：清洗 → 短路判定 → 缓存/生成 → 回复过滤 → 写会话与转人工通知。
 * <p>
 * 流式路径保证事件顺序 meta → retrieval(start) → retrieval(done) → token* → final → metrics，
 * retrieval(done) 只发一次。调用方取消后不再发事件、不写会话、不发通知；单次调用超时则按转人工处理。
 */
public class StreamOrchestrator implements AssistantService {
    private static final Logger log = LoggerFactory.getLogger(StreamOrchestrator.class);

    private final ConversationPolicy policy;
    private final SessionStore sessions;
    private final ResponseCache cache;
    private final GenerationClient generation;
    private final HandoffNotifier handoffNotifier;
    private final ScheduledExecutorService scheduler;
    private final long requestTimeoutMs;
    private final int phraseMinWords;
    private final int phraseMaxWords;

    public StreamOrchestrator(ConversationPolicy policy,
                              SessionStore sessions,
                              ResponseCache cache,
                              GenerationClient generation,
                              HandoffNotifier handoffNotifier,
                              ScheduledExecutorService scheduler,
                              long requestTimeoutMs,
                              int phraseMinWords,
                              int phraseMaxWords) {
        this.policy = policy;
        this.sessions = sessions;
        this.cache = cache;
        this.generation = generation;
        this.handoffNotifier = handoffNotifier;
        this.scheduler = scheduler;
        this.requestTimeoutMs = requestTimeoutMs;
        this.phraseMinWords = phraseMinWords;
        this.phraseMaxWords = phraseMaxWords;
    }

    @Override
    public ExchangeResult respond(ExchangeRequest request) {
        long startedAt = System.nanoTime();
        String sessionId = request.getSessionId();
        ExchangeMetrics metrics = new ExchangeMetrics();
        metrics.setCacheBypass(request.isBypassCache());

        String cleanText = policy.cleanUserText(request.getUserText());
        metrics.setCleanMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));

        Answer answer = shortCircuit(request, cleanText);
        if (answer == null) {
            List<Turn> history = sessions.get(sessionId);
            GenerationRequest genReq = new GenerationRequest(sessionId, cleanText, history, request.getScopeId());
            String key = ResponseCache.key(request.getScopeId(), cleanText);
            AtomicReference<Double> backendMs = new AtomicReference<>();
            ResponseCache.Resolution resolution = cache.resolve(key, request.isBypassCache(), () -> {
                long t0 = System.nanoTime();
                try {
                    return generateBlocking(genReq, cleanText);
                } finally {
                    backendMs.set(ExchangeMetrics.elapsedMs(t0, System.nanoTime()));
                }
            });
            answer = resolution.getAnswer();
            metrics.setCacheHit(resolution.getSource() == ResponseCache.Source.HIT);
            metrics.setInflightJoined(resolution.getSource() == ResponseCache.Source.JOINED);
            metrics.setBackendMs(backendMs.get());
        }

        completeExchange(request, answer);
        metrics.setTotalMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));
        log.info("Exchange done: sessionId={} decision={} reason={} cacheHit={} joined={} backendMs={} totalMs={}",
                sessionId, answer.getDecision().wireName(), reasonCode(answer),
                metrics.isCacheHit(), metrics.isInflightJoined(), metrics.getBackendMs(), metrics.getTotalMs());
        return ExchangeResult.completed(sessionId, answer, metrics);
    }

    @Override
    public ExchangeResult stream(ExchangeRequest request, StreamEventSink sink, CancellationToken cancel) {
        long startedAt = System.nanoTime();
        String sessionId = request.getSessionId();
        CancellationToken caller = cancel == null ? CancellationToken.create() : cancel;
        ExchangeMetrics metrics = new ExchangeMetrics();
        metrics.setCacheBypass(request.isBypassCache());
        EventGate gate = new EventGate(sink, caller, sessionId, startedAt, metrics);

        gate.emit(StreamEvent.meta(sessionId));
        gate.emit(StreamEvent.retrievalStart());

        String cleanText = policy.cleanUserText(request.getUserText());
        metrics.setCleanMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));

        PhraseBuffer phrases = new PhraseBuffer(phraseMinWords, phraseMaxWords, gate::token);
        Answer answer = shortCircuit(request, cleanText);
        if (answer == null) {
            String key = ResponseCache.key(request.getScopeId(), cleanText);
            Answer cached = request.isBypassCache() ? null : cache.lookup(key);
            if (cached != null) {
                metrics.setCacheHit(true);
                gate.retrievalDone(cached.getCitations());
                phrases.push(cached.getText());
                answer = cached;
            } else {
                List<Turn> history = sessions.get(sessionId);
                GenerationRequest genReq = new GenerationRequest(sessionId, cleanText, history, request.getScopeId());
                long t0 = System.nanoTime();
                try {
                    answer = generateStreaming(genReq, cleanText, caller, gate, phrases);
                } catch (ExchangeCancelledException e) {
                    log.info("Exchange cancelled: sessionId={} reason={}", sessionId, e.getReason());
                    return ExchangeResult.cancelled(sessionId, metrics);
                } finally {
                    metrics.setBackendMs(ExchangeMetrics.elapsedMs(t0, System.nanoTime()));
                }
                if (!request.isBypassCache() && answer.isAnswer()) {
                    cache.store(key, answer);
                }
            }
        }

        gate.retrievalDone(answer.getCitations());
        phrases.flush();
        Answer settled = answer;
        if (!gate.commitFinal(settled, () -> completeExchange(request, settled))) {
            log.info("Exchange cancelled before final: sessionId={} reason={}", sessionId, caller.getReason());
            return ExchangeResult.cancelled(sessionId, metrics);
        }
        metrics.setTotalMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));
        gate.emit(StreamEvent.metrics(metrics));
        log.info("Stream exchange done: sessionId={} decision={} reason={} cacheHit={} retrievalMs={} firstTokenMs={} totalMs={}",
                sessionId, answer.getDecision().wireName(), reasonCode(answer), metrics.isCacheHit(),
                metrics.getRetrievalMs(), metrics.getFirstTokenMs(), metrics.getTotalMs());
        return ExchangeResult.completed(sessionId, answer, metrics);
    }

    /**
     * @return 需要直接转人工时的固定答案；可以继续调用后端时返回 null
     */
    private Answer shortCircuit(ExchangeRequest request, String cleanText) {
        if (cleanText.isEmpty()) {
            return policy.handoff(request.getUserText(), HandoffReason.EMPTY_INPUT);
        }
        if (policy.isRestricted(cleanText)) {
            return policy.handoff(cleanText, HandoffReason.RESTRICTED_TOPIC);
        }
        String scopeId = request.getScopeId();
        if (scopeId == null || scopeId.isBlank()) {
            return policy.handoff(cleanText, HandoffReason.NO_SCOPE);
        }
        return null;
    }

    private Answer generateBlocking(GenerationRequest genReq, String cleanText) {
        try (CancellationToken call = CancellationToken.linked(null, requestTimeoutMs, scheduler)) {
            Answer raw = generation.generate(genReq, call);
            return policy.finalizeAnswer(raw, cleanText);
        } catch (ExchangeCancelledException e) {
            log.warn("Generation timed out: sessionId={} backend={} timeoutMs={}", genReq.getSessionId(), generation.name(), requestTimeoutMs);
            return policy.handoff(cleanText, HandoffReason.TIMEOUT);
        } catch (BackendFailureException e) {
            log.warn("Generation failed: sessionId={} backend={} status={}", genReq.getSessionId(), generation.name(), e.getStatus(), e);
            return policy.handoff(cleanText, HandoffReason.BACKEND_FAILURE);
        } catch (RuntimeException e) {
            log.error("Generation failed unexpectedly: sessionId={} backend={}", genReq.getSessionId(), generation.name(), e);
            return policy.handoff(cleanText, HandoffReason.BACKEND_FAILURE);
        }
    }

    /**
     * 调用方取消时抛出 ExchangeCancelledException；超时与后端失败转为 handoff。
     */
    private Answer generateStreaming(GenerationRequest genReq, String cleanText, CancellationToken caller,
                                     EventGate gate, PhraseBuffer phrases) {
        try (CancellationToken call = CancellationToken.linked(caller, requestTimeoutMs, scheduler)) {
            Answer raw = generation.generateStream(genReq, call,
                    gate::retrievalDone,
                    delta -> {
                        gate.retrievalDone(Collections.emptyList());
                        phrases.push(delta);
                    });
            return policy.finalizeAnswer(raw, cleanText);
        } catch (ExchangeCancelledException e) {
            if (caller.isCancelled()) {
                throw e;
            }
            log.warn("Stream generation timed out: sessionId={} backend={} timeoutMs={}", genReq.getSessionId(), generation.name(), requestTimeoutMs);
            return policy.handoff(cleanText, HandoffReason.TIMEOUT);
        } catch (BackendFailureException e) {
            if (caller.isCancelled()) {
                throw new ExchangeCancelledException(caller.getReason());
            }
            log.warn("Stream generation failed: sessionId={} backend={} status={}", genReq.getSessionId(), generation.name(), e.getStatus(), e);
            return policy.handoff(cleanText, HandoffReason.BACKEND_FAILURE);
        } catch (RuntimeException e) {
            if (caller.isCancelled()) {
                throw new ExchangeCancelledException(caller.getReason());
            }
            log.error("Stream generation failed unexpectedly: sessionId={} backend={}", genReq.getSessionId(), generation.name(), e);
            return policy.handoff(cleanText, HandoffReason.BACKEND_FAILURE);
        }
    }

    private void completeExchange(ExchangeRequest request, Answer answer) {
        sessions.addExchange(request.getSessionId(), request.getUserText(), answer.getText());
        if (answer.isAnswer()) {
            return;
        }
        try {
            handoffNotifier.notifyHandoff(new HandoffNotice(
                    request.getSessionId(), answer.getHandoffReason(), request.getUserText(), Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Handoff notify failed: sessionId={}", request.getSessionId(), e);
        }
    }

    private static String reasonCode(Answer answer) {
        return answer.getHandoffReason() == null ? "-" : answer.getHandoffReason().code();
    }

    /**
     * 事件出口：调用方取消后丢弃事件；写出失败视为客户端断开并触发取消。
     */
    private static final class EventGate {
        private final StreamEventSink sink;
        private final CancellationToken caller;
        private final String sessionId;
        private final long startedAt;
        private final ExchangeMetrics metrics;
        private final AtomicBoolean retrievalDone = new AtomicBoolean(false);

        EventGate(StreamEventSink sink, CancellationToken caller, String sessionId, long startedAt, ExchangeMetrics metrics) {
            this.sink = sink;
            this.caller = caller;
            this.sessionId = sessionId;
            this.startedAt = startedAt;
            this.metrics = metrics;
        }

        void retrievalDone(List<String> citations) {
            if (!retrievalDone.compareAndSet(false, true)) {
                return;
            }
            metrics.setRetrievalMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));
            emit(StreamEvent.retrievalDone(citations));
        }

        void token(String phrase) {
            if (metrics.getFirstTokenMs() == null) {
                metrics.setFirstTokenMs(ExchangeMetrics.elapsedMs(startedAt, System.nanoTime()));
            }
            emit(StreamEvent.token(phrase));
        }

        /**
         * final 是交换的提交点：与取消检查在同一把锁内先执行写会话、转人工通知，再发出 final。
         * 已取消时不执行任何副作用。
         *
         * @return final 是否已提交
         */
        synchronized boolean commitFinal(Answer answer, Runnable sideEffects) {
            if (caller.isCancelled()) {
                return false;
            }
            sideEffects.run();
            emit(StreamEvent.fin(answer));
            return true;
        }

        synchronized void emit(StreamEvent event) {
            if (caller.isCancelled()) {
                return;
            }
            try {
                sink.emit(event);
            } catch (RuntimeException e) {
                log.info("Event sink failed, cancel exchange: sessionId={} event={}", sessionId, event.getType().wireName());
                caller.cancel(CancellationToken.REASON_CLIENT_CLOSED);
            }
        }
    }
}
