package com.deepknow.callbot.domain.conversation.model;

import java.util.Objects;

/**
 * 会话中的一轮发言。不可变。
 */
public final class Turn {
    private final Role role;
    private final String text;

    public Turn(Role role, String text) {
        this.role = Objects.requireNonNull(role, "role");
        this.text = text == null ? "" : text;
    }

    public static Turn user(String text) { return new Turn(Role.USER, text); }

    public static Turn assistant(String text) { return new Turn(Role.ASSISTANT, text); }

    public Role getRole() { return role; }
    public String getText() { return text; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Turn)) return false;
        Turn turn = (Turn) o;
        return role == turn.role && text.equals(turn.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, text);
    }

    @Override
    public String toString() {
        return "Turn{" + role.wireName() + ": '" + text + "'}";
    }
}
