package com.deepknow.callbot.domain.agent;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 统一的调度器提供者：后端调用超时、转写握手超时、Mock 后端的延时回调共用。
 */
public final class AgentSchedulers {
    private static final AtomicInteger SEQ = new AtomicInteger();
    private static final ScheduledExecutorService SCHEDULER = Executors.newScheduledThreadPool(2, r -> {
        Thread t = new Thread(r, "callbot-timer-" + SEQ.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private AgentSchedulers() {}

    public static ScheduledExecutorService get() {
        return SCHEDULER;
    }
}
