package com.deepknow.callbot.domain.common;

/**
 * 应用内所有业务异常的基类，便于在边界层统一处理。
 */
public class CallbotException extends RuntimeException {

    public CallbotException(String message) {
        super(message);
    }

    public CallbotException(String message, Throwable cause) {
        super(message, cause);
    }

    public CallbotException(Throwable cause) {
        super(cause);
    }
}
