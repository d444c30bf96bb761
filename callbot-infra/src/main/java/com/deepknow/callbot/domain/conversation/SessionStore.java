package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.domain.conversation.model.Role;
import com.deepknow.callbot.domain.conversation.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 进程内会话历史：每个会话最多保留 2 × maxTurns 条发言（FIFO 淘汰），空闲超过 TTL 的会话由后台定时清理。
 * 所有读写都通过 ConcurrentHashMap 的原子 compute 完成，清理任务不阻塞前台请求。
 */
public class SessionStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentHashMap<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final int maxTurns;
    private final Duration ttl;
    private final Clock clock;
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param sweepInterval 为 null 或非正数时不启动后台清理（可手动调用 {@link #sweep()}）
     */
    public SessionStore(int maxTurns, Duration ttl, Duration sweepInterval, Clock clock) {
        this.maxTurns = Math.max(1, maxTurns);
        this.ttl = ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (sweepInterval != null && !sweepInterval.isZero() && !sweepInterval.isNegative()) {
            this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "session-sweep");
                t.setDaemon(true);
                return t;
            });
            long periodMs = sweepInterval.toMillis();
            this.sweeper.scheduleAtFixedRate(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
        } else {
            this.sweeper = null;
        }
    }

    /**
     * 返回历史副本；仅当会话存在时刷新最近活跃时间。
     */
    public List<Turn> get(String sessionId) {
        if (sessionId == null) return Collections.emptyList();
        AtomicReference<List<Turn>> snapshot = new AtomicReference<>(Collections.emptyList());
        sessions.computeIfPresent(sessionId, (id, state) -> {
            state.lastSeenMillis = clock.millis();
            snapshot.set(List.copyOf(state.turns));
            return state;
        });
        return snapshot.get();
    }

    public void addTurn(String sessionId, Role role, String text) {
        sessions.compute(sessionId, (id, state) -> {
            SessionState s = state == null ? new SessionState() : state;
            s.append(new Turn(role, text), maxTurns * 2);
            s.lastSeenMillis = clock.millis();
            return s;
        });
    }

    /**
     * 原子地追加一问一答，保证同一会话的历史成对出现。
     */
    public void addExchange(String sessionId, String userText, String assistantText) {
        sessions.compute(sessionId, (id, state) -> {
            SessionState s = state == null ? new SessionState() : state;
            int limit = maxTurns * 2;
            s.append(Turn.user(userText), limit);
            s.append(Turn.assistant(assistantText), limit);
            s.lastSeenMillis = clock.millis();
            return s;
        });
    }

    /**
     * @return 本次清理掉的会话数
     */
    public int sweep() {
        long now = clock.millis();
        long maxAgeMs = ttl.toMillis();
        int[] removed = {0};
        for (String id : sessions.keySet()) {
            sessions.computeIfPresent(id, (k, state) -> {
                if (now - state.lastSeenMillis > maxAgeMs) {
                    removed[0]++;
                    return null;
                }
                return state;
            });
        }
        return removed[0];
    }

    private void sweepSafely() {
        try {
            int removed = sweep();
            if (removed > 0) {
                logger.info("Session sweep: removed={} remaining={}", removed, sessions.size());
            }
        } catch (RuntimeException e) {
            logger.warn("Session sweep failed", e);
        }
    }

    public int size() {
        return sessions.size();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** 停止后台清理；已有会话保持不变。 */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweeper != null) {
            sweeper.shutdownNow();
        }
        logger.info("SessionStore closed: sessions={}", sessions.size());
    }

    private static final class SessionState {
        private final ArrayDeque<Turn> turns = new ArrayDeque<>();
        private long lastSeenMillis;

        void append(Turn turn, int limit) {
            turns.addLast(turn);
            while (turns.size() > limit) {
                turns.removeFirst();
            }
        }
    }
}
