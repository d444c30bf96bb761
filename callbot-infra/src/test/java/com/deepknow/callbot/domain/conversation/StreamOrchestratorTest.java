package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.config.PolicyProperties;
import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.agent.HandoffNotice;
import com.deepknow.callbot.domain.agent.HandoffNotifier;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.conversation.event.StreamEvent;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.Decision;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.model.HandoffReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class StreamOrchestratorTest {

    private static final String REPLY = "We open at nine every weekday.";

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final HandoffNotifier notifier = mock(HandoffNotifier.class);
    private final FakeGeneration generation = new FakeGeneration();
    private SessionStore sessions;
    private ResponseCache cache;
    private StreamOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        sessions = new SessionStore(4, Duration.ofMinutes(30), null, Clock.systemUTC());
        cache = new ResponseCache(60_000, 100, Clock.systemUTC());
        orchestrator = newOrchestrator(5_000);
    }

    @AfterEach
    void tearDown() {
        sessions.close();
        scheduler.shutdownNow();
    }

    private StreamOrchestrator newOrchestrator(long timeoutMs) {
        ConversationPolicy policy = new ConversationPolicy(new PolicyProperties(), 2000, 1200);
        return new StreamOrchestrator(policy, sessions, cache, generation, notifier, scheduler, timeoutMs, 2, 4);
    }

    @Test
    void streamEmitsEventsInOrder() {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        ExchangeResult result = orchestrator.stream(request("s1", "When do you open?"), events::add, CancellationToken.create());

        assertThat(result.isCancelled()).isFalse();
        assertThat(result.getAnswer().getText()).isEqualTo(REPLY);
        assertThat(types(events)).startsWith("meta", "retrieval", "retrieval").endsWith("final", "metrics");
        assertThat(events.get(1).getPayload()).containsEntry("status", "start");
        assertThat(events.get(2).isRetrievalDone()).isTrue();
        assertThat(events.get(2).getPayload().get("citations")).isEqualTo(List.of("doc-1"));
        assertThat(events.stream().filter(StreamEvent::isRetrievalDone).count()).isEqualTo(1);

        List<StreamEvent> tokens = events.subList(3, events.size() - 2);
        assertThat(tokens).allMatch(e -> e.getType() == StreamEvent.Type.TOKEN);
        assertThat(tokens.stream().map(e -> (String) e.getPayload().get("text")).collect(Collectors.joining(" ")))
                .isEqualTo(REPLY);

        StreamEvent fin = events.get(events.size() - 2);
        assertThat(fin.getPayload()).containsEntry("decision", "answer").containsEntry("reply", REPLY);
        assertThat(sessions.get("s1")).hasSize(2);
        verify(notifier, never()).notifyHandoff(any());
    }

    @Test
    void emptyInputHandsOffWithoutBackendCall() {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        ExchangeResult result = orchestrator.stream(request("s1", "   \u0001 "), events::add, CancellationToken.create());

        assertThat(result.getAnswer().getDecision()).isEqualTo(Decision.HANDOFF);
        assertThat(result.getAnswer().getHandoffReason()).isEqualTo(HandoffReason.EMPTY_INPUT);
        assertThat(types(events)).containsExactly("meta", "retrieval", "retrieval", "final", "metrics");
        assertThat(generation.streamCalls).hasValue(0);
        assertHandoffNotified(HandoffReason.EMPTY_INPUT);
    }

    @Test
    void restrictedTopicHandsOffWithoutBackendCall() {
        ExchangeResult result = orchestrator.respond(request("s1", "What is the ibuprofen dosage for adults?"));

        assertThat(result.getAnswer().getHandoffReason()).isEqualTo(HandoffReason.RESTRICTED_TOPIC);
        assertThat(result.getAnswer().getText()).isEqualTo(PolicyProperties.DEFAULT_HANDOFF_MESSAGE_PRIMARY);
        assertThat(result.getAnswer().getCitations()).isEmpty();
        assertThat(generation.generateCalls).hasValue(0);
        assertHandoffNotified(HandoffReason.RESTRICTED_TOPIC);
    }

    @Test
    void missingScopeHandsOff() {
        ExchangeResult result = orchestrator.respond(new ExchangeRequest("s1", "When do you open?", null, false));

        assertThat(result.getAnswer().getHandoffReason()).isEqualTo(HandoffReason.NO_SCOPE);
        assertThat(generation.generateCalls).hasValue(0);
    }

    @Test
    void respondStoresHistoryAndCachesAnswer() {
        orchestrator.respond(request("s1", "When do you open?"));
        ExchangeResult second = orchestrator.respond(request("s2", "when do you OPEN?"));

        assertThat(second.getMetrics().isCacheHit()).isTrue();
        assertThat(generation.generateCalls).hasValue(1);
        assertThat(sessions.get("s1")).hasSize(2);
        assertThat(sessions.get("s2")).hasSize(2);
    }

    @Test
    void streamServesCachedAnswerWithoutBackend() {
        orchestrator.respond(request("s1", "When do you open?"));
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        ExchangeResult result = orchestrator.stream(request("s2", "When do you open?"), events::add, CancellationToken.create());

        assertThat(result.getMetrics().isCacheHit()).isTrue();
        assertThat(generation.streamCalls).hasValue(0);
        assertThat(types(events)).contains("token").endsWith("final", "metrics");
    }

    @Test
    void bypassSkipsCache() {
        orchestrator.respond(request("s1", "When do you open?"));

        ExchangeResult result = orchestrator.respond(new ExchangeRequest("s2", "When do you open?", "kb", true));

        assertThat(result.getMetrics().isCacheHit()).isFalse();
        assertThat(result.getMetrics().isCacheBypass()).isTrue();
        assertThat(generation.generateCalls).hasValue(2);
    }

    @Test
    void backendFailureBecomesHandoff() {
        generation.failure = new BackendFailureException("fake", 503, "unavailable", null);

        ExchangeResult result = orchestrator.respond(request("s1", "When do you open?"));

        assertThat(result.getAnswer().getHandoffReason()).isEqualTo(HandoffReason.BACKEND_FAILURE);
        assertThat(cache.size()).isZero();
        assertHandoffNotified(HandoffReason.BACKEND_FAILURE);
    }

    @Test
    void timeoutBecomesHandoff() {
        orchestrator = newOrchestrator(100);
        generation.blockUntilCancelled = true;
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        ExchangeResult result = orchestrator.stream(request("s1", "When do you open?"), events::add, CancellationToken.create());

        assertThat(result.isCancelled()).isFalse();
        assertThat(result.getAnswer().getHandoffReason()).isEqualTo(HandoffReason.TIMEOUT);
        assertThat(events.get(events.size() - 2).getPayload()).containsEntry("decision", "handoff");
        assertHandoffNotified(HandoffReason.TIMEOUT);
    }

    @Test
    void callerCancellationStopsEventsAndSkipsSideEffects() throws Exception {
        generation.blockUntilCancelled = true;
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CancellationToken caller = CancellationToken.create();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ExchangeResult> running = pool.submit(() -> orchestrator.stream(request("s1", "When do you open?"), events::add, caller));
            assertThat(generation.started.await(5, TimeUnit.SECONDS)).isTrue();

            caller.cancel(CancellationToken.REASON_CLIENT_CLOSED);
            ExchangeResult result = running.get(5, TimeUnit.SECONDS);

            assertThat(result.isCancelled()).isTrue();
            assertThat(result.getAnswer()).isNull();
            assertThat(types(events)).doesNotContain("final", "metrics");
            assertThat(sessions.get("s1")).isEmpty();
            verify(notifier, never()).notifyHandoff(any());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void cancellationAfterGenerationSkipsHistoryAndNotification() {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();
        CancellationToken caller = CancellationToken.create();

        ExchangeResult result = orchestrator.stream(request("s1", "What is the ibuprofen dosage for adults?"), event -> {
            events.add(event);
            if (event.isRetrievalDone()) {
                caller.cancel(CancellationToken.REASON_CLIENT_CLOSED);
            }
        }, caller);

        assertThat(result.isCancelled()).isTrue();
        assertThat(types(events)).containsExactly("meta", "retrieval", "retrieval");
        assertThat(sessions.get("s1")).isEmpty();
        verify(notifier, never()).notifyHandoff(any());
    }

    @Test
    void cachedAnswerCancelledBeforeFinalLeavesNoHistory() {
        orchestrator.respond(request("s0", "When do you open?"));
        CancellationToken caller = CancellationToken.create();

        ExchangeResult result = orchestrator.stream(request("s1", "When do you open?"), event -> {
            if (event.getType() == StreamEvent.Type.TOKEN) {
                caller.cancel(CancellationToken.REASON_CLIENT_CLOSED);
            }
        }, caller);

        assertThat(result.isCancelled()).isTrue();
        assertThat(sessions.get("s1")).isEmpty();
    }

    @Test
    void sinkFailureCancelsExchange() {
        List<StreamEvent> events = new CopyOnWriteArrayList<>();

        ExchangeResult result = orchestrator.stream(request("s1", "When do you open?"), event -> {
            if (event.getType() == StreamEvent.Type.TOKEN) {
                throw new IllegalStateException("client gone");
            }
            events.add(event);
        }, CancellationToken.create());

        assertThat(result.isCancelled()).isTrue();
        assertThat(types(events)).doesNotContain("final");
        assertThat(sessions.get("s1")).isEmpty();
    }

    @Test
    void concurrentIdenticalQueriesShareOneBackendCall() throws Exception {
        generation.gate = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<ExchangeResult> first = pool.submit(() -> orchestrator.respond(request("s1", "When do you open?")));
            assertThat(generation.started.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ExchangeResult> second = pool.submit(() -> orchestrator.respond(request("s2", "When do you open?")));
            Thread.sleep(100);
            generation.gate.countDown();

            ExchangeResult a = first.get(5, TimeUnit.SECONDS);
            ExchangeResult b = second.get(5, TimeUnit.SECONDS);

            assertThat(generation.generateCalls).hasValue(1);
            assertThat(a.getAnswer().getText()).isEqualTo(REPLY);
            assertThat(b.getAnswer().getText()).isEqualTo(REPLY);
            assertThat(b.getMetrics().isInflightJoined() || b.getMetrics().isCacheHit()).isTrue();
        } finally {
            pool.shutdownNow();
        }
    }

    private void assertHandoffNotified(HandoffReason reason) {
        ArgumentCaptor<HandoffNotice> captor = ArgumentCaptor.forClass(HandoffNotice.class);
        verify(notifier, timeout(1000)).notifyHandoff(captor.capture());
        assertThat(captor.getValue().getReason()).isEqualTo(reason);
    }

    private static ExchangeRequest request(String sessionId, String text) {
        return new ExchangeRequest(sessionId, text, "kb", false);
    }

    private static List<String> types(List<StreamEvent> events) {
        return events.stream().map(e -> e.getType().wireName()).collect(Collectors.toList());
    }

    private static final class FakeGeneration implements GenerationClient {
        final AtomicInteger generateCalls = new AtomicInteger();
        final AtomicInteger streamCalls = new AtomicInteger();
        final CountDownLatch started = new CountDownLatch(1);
        volatile boolean blockUntilCancelled;
        volatile RuntimeException failure;
        volatile CountDownLatch gate;

        @Override
        public Answer generate(GenerationRequest request, CancellationToken cancel) {
            generateCalls.incrementAndGet();
            started.countDown();
            awaitGate();
            return produce(cancel);
        }

        @Override
        public Answer generateStream(GenerationRequest request, CancellationToken cancel,
                                     Consumer<List<String>> onRetrievalDone, Consumer<String> onToken) {
            streamCalls.incrementAndGet();
            onRetrievalDone.accept(List.of("doc-1"));
            started.countDown();
            Answer answer = produce(cancel);
            for (String word : REPLY.split(" ")) {
                onToken.accept(word + " ");
            }
            return answer;
        }

        private Answer produce(CancellationToken cancel) {
            if (failure != null) {
                throw failure;
            }
            while (blockUntilCancelled && !cancel.isCancelled()) {
                sleep();
            }
            cancel.throwIfCancelled();
            return Answer.answer(REPLY, List.of("doc-1"));
        }

        private void awaitGate() {
            CountDownLatch g = gate;
            if (g == null) {
                return;
            }
            try {
                g.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private static void sleep() {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
