package com.deepknow.callbot.domain.bridge;

import com.deepknow.callbot.config.BridgeProperties;
import com.deepknow.callbot.domain.agent.AgentFactory;
import com.deepknow.callbot.domain.agent.STT.SttConfigProperties;
import com.deepknow.callbot.domain.agent.TranscriptionClient;
import com.deepknow.callbot.domain.agent.TranscriptionListener;
import com.deepknow.callbot.domain.bridge.service.AudioBridgeService;
import com.deepknow.callbot.domain.bridge.service.BridgeProtocol;
import com.deepknow.callbot.domain.bridge.service.ClientChannel;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ProtocolViolationException;
import com.deepknow.callbot.domain.conversation.event.StreamEvent;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.service.AssistantService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class AudioBridgeServiceImpl implements AudioBridgeService {
    private static final Logger logger = LoggerFactory.getLogger(AudioBridgeServiceImpl.class);

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_TOO_LARGE = 1009;
    static final int CLOSE_UNEXPECTED = 1011;
    static final int CLOSE_TRY_AGAIN_LATER = 1013;

    static final String TRANSFER_MARK = "transfer_to_human";

    private final ConcurrentHashMap<String, BridgeSession> activeSessions = new ConcurrentHashMap<>();

    private final AssistantService assistantService;
    private final AgentFactory agentFactory;
    private final SttConfigProperties sttConfig;
    private final BridgeProperties bridgeProperties;
    private final ObjectMapper objectMapper;

    public AudioBridgeServiceImpl(AssistantService assistantService,
                                  AgentFactory agentFactory,
                                  SttConfigProperties sttConfig,
                                  BridgeProperties bridgeProperties,
                                  ObjectMapper objectMapper) {
        this.assistantService = assistantService;
        this.agentFactory = agentFactory;
        this.sttConfig = sttConfig;
        this.bridgeProperties = bridgeProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String open(String wsId, ClientChannel channel, String scopeId, BridgeProtocol protocol) {
        String sessionId = UUID.randomUUID().toString();
        TranscriptionClient transcription = agentFactory.createTranscription(sttConfig);
        BridgeSession session = new BridgeSession(wsId, sessionId, scopeId, protocol, channel, transcription);
        BridgeSession previous = activeSessions.put(wsId, session);
        if (previous != null) {
            logger.warn("Replace stale bridge session: wsId={} sessionId={}", wsId, previous.sessionId);
            previous.shutdown("replaced", CLOSE_NORMAL);
        }
        logger.info("Open bridge: wsId={} sessionId={} scopeId={} protocol={}", wsId, sessionId, scopeId, session.protocol);
        transcription.start(sessionId, new TranscriptRelay(session));
        return sessionId;
    }

    @Override
    public void onAudio(String wsId, byte[] frame) {
        BridgeSession session = activeSessions.get(wsId);
        if (session == null || session.closed.get()) return;
        if (session.protocol == BridgeProtocol.TWILIO) {
            // Twilio 的音频只在 media 事件里
            logger.trace("Ignore binary frame on twilio stream: wsId={}", wsId);
            return;
        }
        forwardAudio(session, frame);
    }

    private void forwardAudio(BridgeSession session, byte[] frame) {
        if (frame == null || frame.length == 0 || frame.length > bridgeProperties.getMaxAudioBytes()) {
            logger.debug("Drop audio frame: wsId={} bytes={}", session.wsId, frame == null ? 0 : frame.length);
            return;
        }
        session.transcription.sendAudio(frame);
    }

    @Override
    public void onText(String wsId, String text) {
        BridgeSession session = activeSessions.get(wsId);
        if (session == null || session.closed.get() || text == null) return;
        if (text.getBytes(StandardCharsets.UTF_8).length > bridgeProperties.getMaxMessageBytes()) {
            logger.warn("Text frame too large, close: wsId={} sessionId={}", wsId, session.sessionId);
            close(session, "message_too_large", CLOSE_TOO_LARGE, "Message too large");
            return;
        }
        try {
            handleControl(session, text);
        } catch (ProtocolViolationException e) {
            logger.debug("Drop malformed frame: wsId={} sessionId={} cause={}", wsId, session.sessionId, e.getMessage());
        }
    }

    private void handleControl(BridgeSession session, String text) {
        JsonNode msg;
        try {
            msg = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolViolationException("frame is not JSON", e);
        }
        if (msg == null || !msg.isObject()) {
            throw new ProtocolViolationException("frame is not a JSON object");
        }
        String event = msg.path("event").asText("");
        if (session.protocol == BridgeProtocol.TWILIO) {
            handleTwilioEvent(session, event, msg);
            return;
        }
        switch (event) {
            case "start":
                logger.debug("Bridge start received: wsId={} sessionId={}", session.wsId, session.sessionId);
                break;
            case "audio":
                forwardAudio(session, decodeAudio(msg.path("audio")));
                break;
            case "stop":
                logger.info("Bridge stop received: wsId={} sessionId={}", session.wsId, session.sessionId);
                close(session, "client_stop", CLOSE_NORMAL, "bye");
                break;
            default:
                throw new ProtocolViolationException("unknown event: " + event);
        }
    }

    private void handleTwilioEvent(BridgeSession session, String event, JsonNode msg) {
        switch (event) {
            case "connected":
            case "mark":
            case "dtmf":
                logger.trace("Ignore twilio event: wsId={} event={}", session.wsId, event);
                break;
            case "start":
                String streamSid = msg.path("start").path("streamSid").asText("");
                if (!streamSid.isEmpty()) {
                    session.streamSid = streamSid;
                }
                logger.info("Twilio stream started: wsId={} sessionId={} streamSid={}", session.wsId, session.sessionId, session.streamSid);
                break;
            case "media":
                forwardAudio(session, decodeAudio(msg.path("media").path("payload")));
                break;
            case "stop":
                logger.info("Twilio stream stopped: wsId={} sessionId={} streamSid={}", session.wsId, session.sessionId, session.streamSid);
                close(session, "client_stop", CLOSE_NORMAL, "bye");
                break;
            default:
                throw new ProtocolViolationException("unknown twilio event: " + event);
        }
    }

    private byte[] decodeAudio(JsonNode payload) {
        if (!payload.isTextual()) {
            throw new ProtocolViolationException("audio payload must be base64 text");
        }
        try {
            return Base64.getDecoder().decode(payload.asText());
        } catch (IllegalArgumentException e) {
            throw new ProtocolViolationException("audio payload is not base64", e);
        }
    }

    @Override
    public void close(String wsId, String reason) {
        BridgeSession session = activeSessions.remove(wsId);
        if (session == null) return;
        session.shutdown(reason, CLOSE_NORMAL, "bye");
    }

    // 只关闭指定会话，不误伤同一 wsId 上已替换的新会话
    private void close(BridgeSession session, String reason, int code, String closeText) {
        activeSessions.remove(session.wsId, session);
        session.shutdown(reason, code, closeText);
    }

    @Override
    public int activeCount() {
        return activeSessions.size();
    }

    @PreDestroy
    public void shutdown() {
        for (String wsId : activeSessions.keySet()) {
            close(wsId, "server_shutdown");
        }
    }

    private void enqueueTranscript(BridgeSession session, String transcript) {
        if (session.closed.get()) return;
        logger.info("Transcript queued: wsId={} sessionId={} len={}", session.wsId, session.sessionId, transcript.length());
        session.exchangeExecutor.execute(() -> runExchange(session, transcript));
    }

    // 在会话的单线程执行器中运行，同一会话的交换严格串行
    private void runExchange(BridgeSession session, String transcript) {
        if (session.closed.get()) return;
        CancellationToken token = CancellationToken.create();
        session.activeToken.set(token);
        if (session.closed.get()) {
            token.cancel(CancellationToken.REASON_CLIENT_CLOSED);
        }
        try {
            ExchangeRequest request = new ExchangeRequest(session.sessionId, transcript, session.scopeId, false);
            ExchangeResult result = assistantService.stream(request, event -> relayEvent(session, event), token);
            if (result.isCancelled()) {
                logger.info("Bridge exchange cancelled: wsId={} sessionId={} reason={}", session.wsId, session.sessionId, token.getReason());
            } else if (session.protocol == BridgeProtocol.TWILIO && !result.getAnswer().isAnswer()) {
                sendTransferMark(session);
            }
        } catch (RuntimeException e) {
            logger.error("Bridge exchange failed: wsId={} sessionId={}", session.wsId, session.sessionId, e);
        } finally {
            session.activeToken.compareAndSet(token, null);
            token.close();
        }
    }

    // 呼叫方据此把通话转给人工坐席；没有 streamSid 时 Twilio 无法识别，不发
    private void sendTransferMark(BridgeSession session) {
        String streamSid = session.streamSid;
        if (streamSid.isEmpty()) return;
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("event", "mark");
        out.put("streamSid", streamSid);
        out.put("mark", Map.of("name", TRANSFER_MARK));
        session.send(out);
        logger.info("Transfer mark sent: wsId={} sessionId={} streamSid={}", session.wsId, session.sessionId, streamSid);
    }

    private void relayEvent(BridgeSession session, StreamEvent event) {
        Map<String, Object> payload = event.getPayload();
        Map<String, Object> out;
        switch (event.getType()) {
            case META:
                return;
            case RETRIEVAL:
                out = session.newEvent("assistant_retrieval");
                out.putAll(payload);
                break;
            case TOKEN:
                out = session.newEvent("assistant_token");
                out.put("text", payload.get("text"));
                break;
            case FINAL:
                out = session.newEvent("assistant_response");
                out.put("decision", payload.get("decision"));
                out.put("text", payload.get("reply"));
                out.put("citations", payload.get("citations"));
                break;
            case METRICS:
                out = session.newEvent("assistant_metrics");
                out.putAll(payload);
                break;
            default:
                return;
        }
        session.send(out);
    }

    /**
     * 转写回调到桥接会话的适配：partial/final 转发给客户端（Twilio 流不回传），final 文本入队等待问答。
     */
    private class TranscriptRelay implements TranscriptionListener {
        private final BridgeSession session;

        TranscriptRelay(BridgeSession session) {
            this.session = session;
        }

        @Override
        public void onReady() {
            if (session.protocol == BridgeProtocol.TWILIO) return;
            session.send(session.newEvent("ready"));
        }

        @Override
        public void onTranscript(String text, boolean isFinal) {
            if (session.closed.get() || text == null || text.isBlank()) return;
            if (session.protocol != BridgeProtocol.TWILIO) {
                Map<String, Object> out = session.newEvent(isFinal ? "transcript_final" : "transcript_partial");
                out.put("text", text);
                session.send(out);
            }
            if (isFinal) {
                enqueueTranscript(session, text);
            }
        }

        @Override
        public void onError(Throwable error) {
            logger.warn("Transcription error, close bridge: wsId={} sessionId={}", session.wsId, session.sessionId, error);
            close(session, "transcription_error", CLOSE_UNEXPECTED, "Transcription failed");
        }

        @Override
        public void onClosed(int code, String reason) {
            if (session.closed.get()) return;
            logger.info("Transcription closed, close bridge: wsId={} sessionId={} code={} reason={}",
                    session.wsId, session.sessionId, code, reason);
            close(session, "transcription_closed", CLOSE_UNEXPECTED, "Transcription closed");
        }
    }

    private final class BridgeSession {
        final String wsId;
        final String sessionId;
        final String scopeId;
        final BridgeProtocol protocol;
        final ClientChannel channel;
        final TranscriptionClient transcription;
        final ThreadPoolExecutor exchangeExecutor;
        final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();
        final AtomicBoolean closed = new AtomicBoolean(false);
        volatile String streamSid = "";

        BridgeSession(String wsId, String sessionId, String scopeId, BridgeProtocol protocol,
                      ClientChannel channel, TranscriptionClient transcription) {
            this.wsId = wsId;
            this.sessionId = sessionId;
            this.scopeId = scopeId;
            this.protocol = protocol == null ? BridgeProtocol.NATIVE : protocol;
            this.channel = channel;
            this.transcription = transcription;
            this.exchangeExecutor = new ThreadPoolExecutor(
                    1,
                    1,
                    1,
                    TimeUnit.MINUTES,
                    new LinkedBlockingQueue<>(Math.max(1, bridgeProperties.getMaxQueuedTranscripts())),
                    r -> {
                        Thread t = new Thread(r, "bridge-exchange-" + wsId);
                        t.setDaemon(true);
                        return t;
                    },
                    (r, executor) -> onQueueOverflow(executor)
            );
        }

        // 最终转写不能静默丢失：积压超过上限视为资源耗尽，以 1013 关闭桥接
        private void onQueueOverflow(ThreadPoolExecutor executor) {
            if (executor.isShutdown() || closed.get()) {
                logger.debug("Bridge closed, transcript discarded: wsId={} sessionId={}", wsId, sessionId);
                return;
            }
            logger.warn("Bridge transcript queue full, close: wsId={} sessionId={} queued={}",
                    wsId, sessionId, executor.getQueue().size());
            close(this, "transcript_queue_full", CLOSE_TRY_AGAIN_LATER, "Too many pending transcripts");
        }

        Map<String, Object> newEvent(String name) {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("event", name);
            if (protocol == BridgeProtocol.TWILIO) {
                out.put("streamSid", streamSid);
            }
            out.put("sessionId", sessionId);
            return out;
        }

        void send(Map<String, Object> event) {
            if (closed.get() || !channel.isOpen()) return;
            channel.send(event);
        }

        void shutdown(String reason, int code) {
            shutdown(reason, code, "bye");
        }

        // 幂等：只有第一次调用生效
        void shutdown(String reason, int code, String closeText) {
            if (!closed.compareAndSet(false, true)) return;
            CancellationToken token = activeToken.getAndSet(null);
            if (token != null) {
                token.cancel(CancellationToken.REASON_CLIENT_CLOSED);
            }
            exchangeExecutor.shutdownNow();
            try {
                transcription.close();
            } catch (RuntimeException e) {
                logger.warn("Close transcription failed: wsId={} sessionId={}", wsId, sessionId, e);
            }
            if (channel.isOpen()) {
                channel.close(code, closeText);
            }
            logger.info("Bridge closed: wsId={} sessionId={} reason={}", wsId, sessionId, reason);
        }
    }
}
