package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.conversation.model.Turn;

import java.util.Collections;
import java.util.List;

public final class GenerationRequest {
    private final String sessionId;
    private final String query;
    private final List<Turn> history;
    private final String scopeId;

    public GenerationRequest(String sessionId, String query, List<Turn> history, String scopeId) {
        this.sessionId = sessionId;
        this.query = query;
        this.history = history == null ? Collections.emptyList() : List.copyOf(history);
        this.scopeId = scopeId;
    }

    public String getSessionId() { return sessionId; }
    public String getQuery() { return query; }
    public List<Turn> getHistory() { return history; }
    public String getScopeId() { return scopeId; }
}
