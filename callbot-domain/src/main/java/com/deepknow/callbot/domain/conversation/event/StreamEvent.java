package com.deepknow.callbot.domain.conversation.event;

import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.ExchangeMetrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次交换内的有序事件：meta → retrieval(start) → retrieval(done) → token* → final → metrics。
 */
public final class StreamEvent {

    public enum Type {
        META("meta"),
        RETRIEVAL("retrieval"),
        TOKEN("token"),
        FINAL("final"),
        METRICS("metrics");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() { return wireName; }
    }

    public static final String RETRIEVAL_START = "start";
    public static final String RETRIEVAL_DONE = "done";

    private final Type type;
    private final Map<String, Object> payload;

    private StreamEvent(Type type, Map<String, Object> payload) {
        this.type = type;
        this.payload = Collections.unmodifiableMap(payload);
    }

    public static StreamEvent meta(String sessionId) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("sessionId", sessionId);
        return new StreamEvent(Type.META, p);
    }

    public static StreamEvent retrievalStart() {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("status", RETRIEVAL_START);
        return new StreamEvent(Type.RETRIEVAL, p);
    }

    public static StreamEvent retrievalDone(List<String> citations) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("status", RETRIEVAL_DONE);
        p.put("citations", citations == null ? Collections.emptyList() : List.copyOf(citations));
        return new StreamEvent(Type.RETRIEVAL, p);
    }

    public static StreamEvent token(String text) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("text", text);
        return new StreamEvent(Type.TOKEN, p);
    }

    public static StreamEvent fin(Answer answer) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("decision", answer.getDecision().wireName());
        p.put("reply", answer.getText());
        p.put("citations", answer.getCitations());
        return new StreamEvent(Type.FINAL, p);
    }

    public static StreamEvent metrics(ExchangeMetrics metrics) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("retrieval_ms", metrics.getRetrievalMs());
        p.put("llm_first_token_ms", metrics.getFirstTokenMs());
        p.put("total_ms", metrics.getTotalMs());
        return new StreamEvent(Type.METRICS, p);
    }

    public Type getType() { return type; }

    /** 事件载荷，字段名即线上 JSON 字段名。 */
    public Map<String, Object> getPayload() { return payload; }

    public boolean isRetrievalDone() {
        return type == Type.RETRIEVAL && RETRIEVAL_DONE.equals(payload.get("status"));
    }

    @Override
    public String toString() {
        return type.wireName() + payload;
    }
}
