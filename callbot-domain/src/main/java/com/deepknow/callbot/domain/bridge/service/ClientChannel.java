package com.deepknow.callbot.domain.bridge.service;

import java.util.Map;

/**
 * 面向客户端的套接字抽象，屏蔽具体 WebSocket 实现。
 */
public interface ClientChannel {
    String getId();

    boolean isOpen();

    /** 以 JSON 文本帧发送；通道已关闭时静默忽略。 */
    void send(Map<String, Object> event);

    void close(int code, String reason);
}
