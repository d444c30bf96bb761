package com.deepknow.callbot.domain.agent;

/**
 * 转写后端回调。实现方不应在回调中执行阻塞操作。
 */
public interface TranscriptionListener {
    void onReady();

    void onTranscript(String text, boolean isFinal);

    void onError(Throwable error);

    void onClosed(int code, String reason);
}
