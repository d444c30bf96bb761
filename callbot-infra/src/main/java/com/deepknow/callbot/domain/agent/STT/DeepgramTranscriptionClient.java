package com.deepknow.callbot.domain.agent.STT;

import com.deepknow.callbot.domain.agent.TranscriptionClient;
import com.deepknow.callbot.domain.agent.TranscriptionListener;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deepgram 实时转写客户端（JDK WebSocket）。
 * 连接未建立前的音频帧先缓冲，上限 maxPendingFrames，超出丢弃最旧帧；就绪后按序补发。
 * 发送串成一条 future 链，保证同一时刻只有一个未完成的发送。
 */
public class DeepgramTranscriptionClient implements TranscriptionClient {
    private static final Logger log = LoggerFactory.getLogger(DeepgramTranscriptionClient.class);

    private final SttConfigProperties config;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    private volatile TranscriptionListener listener;
    private volatile String sessionId;
    private volatile WebSocket webSocket;

    // 就绪门控与缓冲
    private volatile boolean ready = false;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ConcurrentLinkedQueue<byte[]> pending = new ConcurrentLinkedQueue<>();
    private final Object sendLock = new Object();
    private CompletableFuture<WebSocket> sendChain;

    public DeepgramTranscriptionClient(SttConfigProperties config, ObjectMapper mapper) {
        this(config, mapper, HttpClient.newHttpClient());
    }

    DeepgramTranscriptionClient(SttConfigProperties config, ObjectMapper mapper, HttpClient httpClient) {
        this.config = config;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    @Override
    public void start(String sessionId, TranscriptionListener listener) {
        this.sessionId = sessionId;
        this.listener = listener;
        String apiKey = config.resolveApiKey();
        if (apiKey == null || apiKey.isEmpty()) {
            listener.onError(new IllegalStateException("transcription api key is not configured"));
            return;
        }

        URI uri = listenUri(config);
        log.info("Deepgram STT connecting: model={} sampleRate={} sessionId={}", config.getModel(), config.getSampleRate(), sessionId);
        httpClient.newWebSocketBuilder()
                .header("Authorization", "Token " + apiKey)
                .connectTimeout(Duration.ofMillis(config.getHandshakeTimeoutMs()))
                .buildAsync(uri, new InboundListener())
                .whenComplete((ws, ex) -> {
                    if (ex != null) {
                        log.warn("Deepgram STT connect failed: sessionId={}", sessionId, ex);
                        if (!closed.get()) listener.onError(ex);
                        return;
                    }
                    onConnected(ws);
                });
    }

    private void onConnected(WebSocket ws) {
        if (closed.get()) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye");
            return;
        }
        synchronized (sendLock) {
            webSocket = ws;
            sendChain = CompletableFuture.completedFuture(ws);
            log.info("Deepgram STT ready; draining {} buffered frames, sessionId={}", pending.size(), sessionId);
            byte[] buf;
            while ((buf = pending.poll()) != null) {
                enqueueBinary(buf);
            }
            ready = true;
        }
        TranscriptionListener l = listener;
        if (l != null) l.onReady();
    }

    @Override
    public void sendAudio(byte[] pcmChunk) {
        if (closed.get() || pcmChunk == null || pcmChunk.length == 0) return;
        synchronized (sendLock) {
            if (!ready) {
                // 缓冲未就绪的音频帧，设置上限避免无限增长
                if (pending.size() >= Math.max(1, config.getMaxPendingFrames())) {
                    pending.poll();
                }
                pending.offer(Arrays.copyOf(pcmChunk, pcmChunk.length));
                return;
            }
            enqueueBinary(Arrays.copyOf(pcmChunk, pcmChunk.length));
        }
    }

    // 调用方持有 sendLock
    private void enqueueBinary(byte[] frame) {
        sendChain = sendChain
                .thenCompose(ws -> ws.sendBinary(ByteBuffer.wrap(frame), true))
                .exceptionally(ex -> {
                    log.warn("Deepgram STT send failed: sessionId={}", sessionId, ex);
                    return webSocket;
                });
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        pending.clear();
        synchronized (sendLock) {
            WebSocket ws = webSocket;
            if (ws == null || sendChain == null) return;
            sendChain.thenCompose(w -> w.sendText("{\"type\":\"CloseStream\"}", true))
                    .thenCompose(w -> w.sendClose(WebSocket.NORMAL_CLOSURE, "bye"))
                    .whenComplete((w, ex) -> {
                        if (ex != null) {
                            log.debug("Deepgram STT close handshake failed, abort: sessionId={}", sessionId, ex);
                            ws.abort();
                        }
                    });
        }
        log.info("Deepgram STT closed: sessionId={}", sessionId);
    }

    static URI listenUri(SttConfigProperties config) {
        StringBuilder sb = new StringBuilder(config.getListenUrl());
        sb.append(config.getListenUrl().contains("?") ? '&' : '?');
        sb.append("encoding=linear16");
        sb.append("&sample_rate=").append(config.getSampleRate());
        sb.append("&channels=1&interim_results=true&punctuate=true");
        if (config.getModel() != null && !config.getModel().isBlank()) {
            sb.append("&model=").append(URLEncoder.encode(config.getModel(), StandardCharsets.UTF_8));
        }
        if (config.getLanguage() != null && !config.getLanguage().isBlank()) {
            sb.append("&language=").append(URLEncoder.encode(config.getLanguage(), StandardCharsets.UTF_8));
        }
        return URI.create(sb.toString());
    }

    private class InboundListener implements WebSocket.Listener {
        private final StringBuilder textBuf = new StringBuilder();

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            textBuf.append(data);
            if (last) {
                String message = textBuf.toString();
                textBuf.setLength(0);
                handleMessage(message);
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            log.info("Deepgram STT remote closed: code={} reason={} sessionId={}", statusCode, reason, sessionId);
            TranscriptionListener l = listener;
            if (l != null) l.onClosed(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            log.warn("Deepgram STT socket error: sessionId={}", sessionId, error);
            TranscriptionListener l = listener;
            if (l != null && !closed.get()) l.onError(error);
        }

        private void handleMessage(String message) {
            try {
                TranscriptEventParser.ParsedTranscript t = TranscriptEventParser.parse(mapper, message);
                if (t == null) return;
                log.debug("Deepgram STT transcript: final={} len={} sessionId={}", t.isFinal(), t.getText().length(), sessionId);
                TranscriptionListener l = listener;
                if (l != null) l.onTranscript(t.getText(), t.isFinal());
            } catch (JsonProcessingException e) {
                log.debug("Deepgram STT skip unparsable message: sessionId={}", sessionId);
            } catch (RuntimeException e) {
                log.warn("Handle transcription result failed: sessionId={}", sessionId, e);
            }
        }
    }
}
