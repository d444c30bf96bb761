package com.deepknow.callbot.websocket;

import com.deepknow.callbot.domain.bridge.service.ClientChannel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.io.IOException;
import java.util.Map;

/**
 * javax.websocket 会话到 {@link ClientChannel} 的适配。BasicRemote 不允许并发发送，这里按会话加锁。
 */
public class WebSocketClientChannel implements ClientChannel {
    private static final Logger log = LoggerFactory.getLogger(WebSocketClientChannel.class);

    private final Session session;
    private final ObjectMapper objectMapper;

    public WebSocketClientChannel(Session session, ObjectMapper objectMapper) {
        this.session = session;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(Map<String, Object> event) {
        synchronized (session) {
            if (!session.isOpen()) return;
            try {
                String json = objectMapper.writeValueAsString(event);
                log.trace("WS push: wsId={} event={}", session.getId(), event.get("event"));
                session.getBasicRemote().sendText(json);
            } catch (IOException e) {
                log.warn("WS send failed: wsId={} event={}", session.getId(), event.get("event"), e);
            }
        }
    }

    @Override
    public void close(int code, String reason) {
        synchronized (session) {
            if (!session.isOpen()) return;
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.getCloseCode(code), reason));
            } catch (IOException e) {
                log.debug("WS close failed: wsId={} code={}", session.getId(), code, e);
            }
        }
    }
}
