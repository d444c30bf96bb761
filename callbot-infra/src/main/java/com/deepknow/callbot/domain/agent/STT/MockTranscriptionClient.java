package com.deepknow.callbot.domain.agent.STT;

import com.deepknow.callbot.domain.agent.TranscriptionClient;
import com.deepknow.callbot.domain.agent.TranscriptionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 开发用 Mock 转写：不解析音频，收到首个音频帧后推送一条 partial 和一条 final 文本。
 */
public class MockTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(MockTranscriptionClient.class);

    private final ScheduledExecutorService scheduler;
    private volatile TranscriptionListener listener;
    private volatile boolean closed = false;
    private volatile boolean heard = false;

    public MockTranscriptionClient(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void start(String sessionId, TranscriptionListener listener) {
        this.listener = listener;
        log.info("Mock STT session started: sessionId={}", sessionId);
        scheduler.execute(() -> { if (!closed) listener.onReady(); });
    }

    @Override
    public void sendAudio(byte[] pcmChunk) {
        if (heard || closed) return;
        heard = true;
        scheduler.schedule(() -> { if (!closed) listener.onTranscript("[mock] what are your", false); }, 300, TimeUnit.MILLISECONDS);
        scheduler.schedule(() -> { if (!closed) listener.onTranscript("[mock] what are your opening hours", true); }, 1000, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        closed = true;
        log.info("Mock STT closed");
    }
}
