package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.conversation.model.HandoffReason;

import java.time.Instant;

public final class HandoffNotice {
    private final String sessionId;
    private final HandoffReason reason;
    private final String text;
    private final Instant createdAt;

    public HandoffNotice(String sessionId, HandoffReason reason, String text, Instant createdAt) {
        this.sessionId = sessionId;
        this.reason = reason;
        this.text = text;
        this.createdAt = createdAt;
    }

    public String getSessionId() { return sessionId; }
    public HandoffReason getReason() { return reason; }
    public String getText() { return text; }
    public Instant getCreatedAt() { return createdAt; }
}
