package com.deepknow.callbot.domain.conversation.event;

/**
 * 编排事件的接收方，由各传输层适配。
 */
@FunctionalInterface
public interface StreamEventSink {
    void emit(StreamEvent event);
}
