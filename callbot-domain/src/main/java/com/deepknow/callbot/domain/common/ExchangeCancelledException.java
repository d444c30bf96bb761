package com.deepknow.callbot.domain.common;

/**
 * 后端调用因 {@link CancellationToken} 触发而中止。与失败区分：调用方断开时不产生 handoff。
 */
public class ExchangeCancelledException extends CallbotException {
    private final String reason;

    public ExchangeCancelledException(String reason) {
        super("exchange cancelled: " + reason);
        this.reason = reason;
    }

    public String getReason() { return reason; }

    public boolean isTimeout() {
        return CancellationToken.REASON_TIMEOUT.equals(reason);
    }
}
