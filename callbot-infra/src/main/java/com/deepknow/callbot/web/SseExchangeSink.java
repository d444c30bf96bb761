package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.conversation.event.StreamEvent;
import com.deepknow.callbot.domain.conversation.event.StreamEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 把交换事件写成 SSE：一个事件对应一组 event:/data:。写失败视为客户端已断开，由编排器取消交换。
 */
public class SseExchangeSink implements StreamEventSink {
    private static final Logger log = LoggerFactory.getLogger(SseExchangeSink.class);

    private final SseEmitter emitter;
    private final String sessionId;

    public SseExchangeSink(SseEmitter emitter, String sessionId) {
        this.emitter = emitter;
        this.sessionId = sessionId;
    }

    @Override
    public void emit(StreamEvent event) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.getType().wireName())
                    .data(event.getPayload(), MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            log.debug("SSE write failed: sessionId={} event={}", sessionId, event.getType().wireName());
            throw new UncheckedIOException(e);
        }
    }
}
