package com.deepknow.callbot.websocket;

import com.deepknow.callbot.domain.bridge.service.AudioBridgeService;
import com.deepknow.callbot.domain.bridge.service.BridgeProtocol;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 双工音频桥接端点：二进制帧为 PCM 音频，文本帧为 JSON 控制事件（start / audio / stop）。
 * 查询参数 scopeId / agentId / tenantCode 决定知识范围；需携带 token 参数或 X-Callbot-Token 头，
 * 未配置入站令牌时一律以 1008 拒绝（显式开启 allow-unauthenticated 的开发模式除外）。
 */
@Component
@ServerEndpoint(value = "/audio/bridge", configurator = TokenHandshakeConfigurator.class)
public class AudioBridgeWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(AudioBridgeWebSocketHandler.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    // 端点实例由容器按连接创建，依赖通过 Injector 静态注入
    private static AudioBridgeService audioBridgeService;
    private static ScopeResolver scopeResolver;
    private static volatile String inboundToken;
    private static volatile boolean allowUnauthenticated;
    private static volatile int maxMessageBytes = 1_000_000;

    public static void setAudioBridgeService(AudioBridgeService service) { audioBridgeService = service; }
    public static void setScopeResolver(ScopeResolver resolver) { scopeResolver = resolver; }
    public static void setInboundToken(String token) { inboundToken = token; }
    public static void setAllowUnauthenticated(boolean allow) { allowUnauthenticated = allow; }
    public static void setMaxMessageBytes(int bytes) { maxMessageBytes = bytes; }

    private static AudioBridgeService ensureService() {
        if (audioBridgeService == null) {
            try {
                audioBridgeService = SpringContextHolder.getBean(AudioBridgeService.class);
            } catch (RuntimeException e) {
                log.warn("Lookup AudioBridgeService failed: {}", e.getMessage());
            }
        }
        return audioBridgeService;
    }

    @OnOpen
    public void onOpen(Session session) {
        openBridge(session, BridgeProtocol.NATIVE);
    }

    static void openBridge(Session session, BridgeProtocol protocol) {
        String wsId = session.getId();
        log.info("WS connected: wsId={} protocol={}", wsId, protocol);
        if (ensureService() == null) {
            log.warn("AudioBridgeService not injected; refuse open for wsId={}", wsId);
            closeQuietly(session, CloseReason.CloseCodes.UNEXPECTED_CONDITION, "SERVICE_NOT_READY");
            return;
        }
        if (!authorized(session)) {
            log.warn("WS unauthorized, close: wsId={}", wsId);
            closeQuietly(session, CloseReason.CloseCodes.VIOLATED_POLICY, "Unauthorized");
            return;
        }
        // 放宽容器默认的帧缓冲上限，超限判断交给桥接服务（1009）
        session.setMaxTextMessageBufferSize(maxMessageBytes + 1024);
        session.setMaxBinaryMessageBufferSize(maxMessageBytes + 1024);

        String scopeId = parseQueryParam(session, "scopeId");
        if (scopeResolver != null) {
            scopeId = scopeResolver.resolve(scopeId, parseQueryParam(session, "agentId"), parseQueryParam(session, "tenantCode"));
        }
        String sessionId = audioBridgeService.open(wsId, new WebSocketClientChannel(session, objectMapper), scopeId, protocol);
        log.info("WS bridge opened: wsId={} sessionId={} scopeId={}", wsId, sessionId, scopeId);
    }

    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        relayBinary(message, session);
    }

    static void relayBinary(ByteBuffer message, Session session) {
        log.trace("Received audio chunk: wsId={} bytes={}", session.getId(), message.remaining());
        if (ensureService() == null) {
            log.warn("AudioBridgeService not injected; drop audio chunk for wsId={}", session.getId());
            return;
        }
        byte[] bytes = new byte[message.remaining()];
        message.get(bytes);
        audioBridgeService.onAudio(session.getId(), bytes);
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        relayText(text, session);
    }

    static void relayText(String text, Session session) {
        log.trace("Received text frame: wsId={} len={}", session.getId(), text == null ? 0 : text.length());
        if (ensureService() == null) {
            log.warn("AudioBridgeService not injected; drop text frame for wsId={}", session.getId());
            return;
        }
        audioBridgeService.onText(session.getId(), text);
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        closeBridge(session, reason);
    }

    static void closeBridge(Session session, CloseReason reason) {
        String wsId = session != null ? session.getId() : null;
        log.info("WS closed: wsId={} status={}", wsId, reason);
        if (wsId == null || ensureService() == null) return;
        audioBridgeService.close(wsId, "client_closed");
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        failBridge(session, throwable);
    }

    static void failBridge(Session session, Throwable throwable) {
        String wsId = session != null ? session.getId() : null;
        log.warn("WS error: wsId={} msg={}", wsId, throwable != null ? throwable.getMessage() : "unknown", throwable);
        if (wsId == null || ensureService() == null) return;
        audioBridgeService.close(wsId, "socket_error");
    }

    static boolean authorized(Session session) {
        String expected = inboundToken;
        if (expected == null || expected.isEmpty()) {
            return allowUnauthenticated;
        }
        String provided = parseQueryParam(session, "token");
        if (provided == null) {
            Object header = session.getUserProperties().get(TokenHandshakeConfigurator.TOKEN_ATTR);
            provided = header == null ? null : header.toString();
        }
        return constantTimeEquals(expected, provided);
    }

    static boolean constantTimeEquals(String expected, String provided) {
        if (provided == null) return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }

    static String parseQueryParam(Session session, String key) {
        URI uri = session.getRequestURI();
        String query = uri == null ? null : uri.getRawQuery();
        if (query == null || query.isEmpty()) return null;
        for (String p : query.split("&")) {
            int i = p.indexOf('=');
            if (i > 0 && key.equals(p.substring(0, i))) {
                try {
                    return URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    log.warn("Failed to decode query param {}", key);
                    return null;
                }
            }
        }
        return null;
    }

    private static void closeQuietly(Session session, CloseReason.CloseCode code, String reason) {
        try {
            session.close(new CloseReason(code, reason));
        } catch (IOException e) {
            log.debug("WS close failed: wsId={}", session.getId(), e);
        }
    }
}
