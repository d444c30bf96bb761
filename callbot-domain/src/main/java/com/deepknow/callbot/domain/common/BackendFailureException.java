package com.deepknow.callbot.domain.common;

/**
 * 检索/生成/转写后端调用失败：网络错误、非 2xx 状态或无法解析的响应体。
 */
public class BackendFailureException extends CallbotException {
    private final String backend;
    private final int status;

    public BackendFailureException(String backend, String message) {
        this(backend, -1, message, null);
    }

    public BackendFailureException(String backend, String message, Throwable cause) {
        this(backend, -1, message, cause);
    }

    public BackendFailureException(String backend, int status, String message, Throwable cause) {
        super(backend + ": " + message, cause);
        this.backend = backend;
        this.status = status;
    }

    public String getBackend() { return backend; }

    /** HTTP 状态码；非 HTTP 失败时为 -1。 */
    public int getStatus() { return status; }
}
