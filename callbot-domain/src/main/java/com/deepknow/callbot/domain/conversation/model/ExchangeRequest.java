package com.deepknow.callbot.domain.conversation.model;

/**
 * 进入编排层的一次查询。scopeId 已由调用方解析，可能为空。
 */
public final class ExchangeRequest {
    private final String sessionId;
    private final String userText;
    private final String scopeId;
    private final boolean bypassCache;

    public ExchangeRequest(String sessionId, String userText, String scopeId, boolean bypassCache) {
        this.sessionId = sessionId;
        this.userText = userText;
        this.scopeId = scopeId;
        this.bypassCache = bypassCache;
    }

    public String getSessionId() { return sessionId; }
    public String getUserText() { return userText; }
    public String getScopeId() { return scopeId; }
    public boolean isBypassCache() { return bypassCache; }
}
