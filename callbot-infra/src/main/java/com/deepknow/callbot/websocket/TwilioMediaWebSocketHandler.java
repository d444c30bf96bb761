package com.deepknow.callbot.websocket;

import com.deepknow.callbot.domain.bridge.service.BridgeProtocol;
import org.springframework.stereotype.Component;

import javax.websocket.CloseReason;
import javax.websocket.OnClose;
import javax.websocket.OnError;
import javax.websocket.OnMessage;
import javax.websocket.OnOpen;
import javax.websocket.Session;
import javax.websocket.server.ServerEndpoint;
import java.nio.ByteBuffer;

/**
 * Twilio Media Streams 端点。鉴权、知识范围解析与桥接服务和 /audio/bridge 共用，
 * 帧协议差异（media 负载、streamSid、转人工标记）由桥接服务按 TWILIO 协议处理。
 */
@Component
@ServerEndpoint(value = "/twilio-media", configurator = TokenHandshakeConfigurator.class)
public class TwilioMediaWebSocketHandler {

    @OnOpen
    public void onOpen(Session session) {
        AudioBridgeWebSocketHandler.openBridge(session, BridgeProtocol.TWILIO);
    }

    // Twilio 不发二进制帧；收到时交给桥接服务丢弃，避免容器以 1003 断开
    @OnMessage
    public void onBinaryMessage(ByteBuffer message, Session session) {
        AudioBridgeWebSocketHandler.relayBinary(message, session);
    }

    @OnMessage
    public void onTextMessage(String text, Session session) {
        AudioBridgeWebSocketHandler.relayText(text, session);
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        AudioBridgeWebSocketHandler.closeBridge(session, reason);
    }

    @OnError
    public void onError(Session session, Throwable throwable) {
        AudioBridgeWebSocketHandler.failBridge(session, throwable);
    }
}
