package com.deepknow.callbot.domain.conversation.model;

/**
 * 编排结果。CANCELLED 表示调用方中止：无答案、不写会话、不触发转人工通知。
 */
public final class ExchangeResult {

    public enum Status { COMPLETED, CANCELLED }

    private final String sessionId;
    private final Status status;
    private final Answer answer;
    private final ExchangeMetrics metrics;

    private ExchangeResult(String sessionId, Status status, Answer answer, ExchangeMetrics metrics) {
        this.sessionId = sessionId;
        this.status = status;
        this.answer = answer;
        this.metrics = metrics;
    }

    public static ExchangeResult completed(String sessionId, Answer answer, ExchangeMetrics metrics) {
        return new ExchangeResult(sessionId, Status.COMPLETED, answer, metrics);
    }

    public static ExchangeResult cancelled(String sessionId, ExchangeMetrics metrics) {
        return new ExchangeResult(sessionId, Status.CANCELLED, null, metrics);
    }

    public String getSessionId() { return sessionId; }
    public Status getStatus() { return status; }
    public Answer getAnswer() { return answer; }
    public ExchangeMetrics getMetrics() { return metrics; }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
