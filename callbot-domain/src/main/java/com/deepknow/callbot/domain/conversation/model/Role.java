package com.deepknow.callbot.domain.conversation.model;

public enum Role {
    USER("user"),
    ASSISTANT("assistant");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
