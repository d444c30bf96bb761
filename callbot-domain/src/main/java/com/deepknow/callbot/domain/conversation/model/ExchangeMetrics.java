package com.deepknow.callbot.domain.conversation.model;

import lombok.Data;

/**
 * 单次交换的耗时与缓存命中情况，毫秒保留两位小数；未发生的阶段为 null。
 */
@Data
public class ExchangeMetrics {
    private Double cleanMs;
    private Double retrievalMs;
    private Double firstTokenMs;
    private Double backendMs;
    private Double totalMs;
    private boolean cacheHit;
    private boolean cacheBypass;
    private boolean inflightJoined;

    public static Double elapsedMs(long startNanos, long endNanos) {
        double ms = (endNanos - startNanos) / 1_000_000.0;
        return Math.round(ms * 100.0) / 100.0;
    }
}
