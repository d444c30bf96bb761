package com.deepknow.callbot.domain.conversation.model;

/**
 * 一次交换的终态分类。
 */
public enum Decision {
    ANSWER("answer"),
    HANDOFF("handoff");

    private final String wireName;

    Decision(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public static Decision fromWire(String value) {
        if (value != null && "answer".equalsIgnoreCase(value.trim())) {
            return ANSWER;
        }
        return HANDOFF;
    }
}
