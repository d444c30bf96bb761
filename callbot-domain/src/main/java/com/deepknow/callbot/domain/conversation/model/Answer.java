package com.deepknow.callbot.domain.conversation.model;

import java.util.Collections;
import java.util.List;

/**
 * 一次交换的答案载荷：决策、文本与引用列表。handoff 时引用恒为空。
 */
public final class Answer {
    private final Decision decision;
    private final String text;
    private final List<String> citations;
    private final HandoffReason handoffReason;

    private Answer(Decision decision, String text, List<String> citations, HandoffReason handoffReason) {
        this.decision = decision;
        this.text = text == null ? "" : text;
        this.citations = citations == null ? Collections.emptyList() : List.copyOf(citations);
        this.handoffReason = handoffReason;
    }

    public static Answer answer(String text, List<String> citations) {
        return new Answer(Decision.ANSWER, text, citations, null);
    }

    public static Answer handoff(String message, HandoffReason reason) {
        return new Answer(Decision.HANDOFF, message, Collections.emptyList(), reason);
    }

    public Decision getDecision() { return decision; }
    public String getText() { return text; }
    public List<String> getCitations() { return citations; }
    /** 仅 handoff 时非空。 */
    public HandoffReason getHandoffReason() { return handoffReason; }

    public boolean isAnswer() {
        return decision == Decision.ANSWER;
    }

    @Override
    public String toString() {
        return "Answer{" +
                "decision=" + decision.wireName() +
                ", textLen=" + text.length() +
                ", citations=" + citations +
                (handoffReason == null ? "" : ", reason=" + handoffReason.code()) +
                '}';
    }
}
