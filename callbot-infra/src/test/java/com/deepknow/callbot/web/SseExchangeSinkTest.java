package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.conversation.event.StreamEvent;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SseExchangeSinkTest {

    @Test
    void sendsNamedEvent() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);

        new SseExchangeSink(emitter, "s1").emit(StreamEvent.token("hello"));

        verify(emitter).send(any(SseEmitter.SseEventBuilder.class));
    }

    @Test
    void writeFailureSurfacesAsUnchecked() throws IOException {
        SseEmitter emitter = mock(SseEmitter.class);
        doThrow(new IOException("broken pipe")).when(emitter).send(any(SseEmitter.SseEventBuilder.class));

        assertThatThrownBy(() -> new SseExchangeSink(emitter, "s1").emit(StreamEvent.meta("s1")))
                .isInstanceOf(UncheckedIOException.class);
    }
}
