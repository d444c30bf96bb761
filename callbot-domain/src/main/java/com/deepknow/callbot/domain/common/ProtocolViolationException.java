package com.deepknow.callbot.domain.common;

/**
 * 套接字入站帧格式不合法。帧被丢弃，会话继续。
 */
public class ProtocolViolationException extends CallbotException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
