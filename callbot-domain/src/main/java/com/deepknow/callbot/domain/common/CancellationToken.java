package com.deepknow.callbot.domain.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 可组合的取消信号。
 * <p>
 * 取消只生效一次，监听器在取消时各执行一次；已取消后注册的监听器立即执行。
 * 通过 {@link #linked(CancellationToken, long, ScheduledExecutorService)} 可把调用方的取消与单次调用超时合并为一个信号，
 * 任一先到即生效。派生令牌用完后需 {@link #close()}，以释放对父令牌的监听与超时任务。
 */
public class CancellationToken implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);
    public static final String REASON_TIMEOUT = "timeout";
    public static final String REASON_CLIENT_CLOSED = "client_closed";

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> releaseActions = new CopyOnWriteArrayList<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * 派生令牌：父令牌取消或超时到达时取消。
     */
    public static CancellationToken linked(CancellationToken parent, long timeoutMs, ScheduledExecutorService scheduler) {
        CancellationToken child = new CancellationToken();
        if (parent != null) {
            Registration reg = parent.onCancel(() -> child.cancel(parent.getReason()));
            child.releaseActions.add(reg::remove);
        }
        if (timeoutMs > 0 && scheduler != null) {
            ScheduledFuture<?> timer = scheduler.schedule(() -> child.cancel(REASON_TIMEOUT), timeoutMs, TimeUnit.MILLISECONDS);
            child.releaseActions.add(() -> timer.cancel(false));
        }
        return child;
    }

    /**
     * @return 本次调用是否真正触发了取消（重复取消返回 false）
     */
    public boolean cancel(String why) {
        if (!reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            return false;
        }
        for (Listener l : listeners) {
            l.fire();
        }
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public boolean isTimedOut() {
        return REASON_TIMEOUT.equals(reason.get());
    }

    public String getReason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String r = reason.get();
        if (r != null) {
            throw new ExchangeCancelledException(r);
        }
    }

    public Registration onCancel(Runnable action) {
        Listener l = new Listener(action);
        listeners.add(l);
        if (isCancelled()) {
            // cancel() 与注册并发时由 Listener 自身保证只执行一次
            l.fire();
            listeners.remove(l);
        }
        return () -> listeners.remove(l);
    }

    /** 释放派生关系与超时任务，不会触发取消。 */
    @Override
    public void close() {
        for (Runnable r : releaseActions) {
            r.run();
        }
        releaseActions.clear();
    }

    @FunctionalInterface
    public interface Registration {
        void remove();
    }

    private static final class Listener {
        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        Listener(Runnable action) {
            this.action = action;
        }

        void fire() {
            if (fired.compareAndSet(false, true)) {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    log.warn("Cancellation listener failed", e);
                }
            }
        }
    }
}
