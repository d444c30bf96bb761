package com.deepknow.callbot.domain.agent;

/**
 * 每个桥接会话独占一个转写客户端：音频帧进，partial/final 文本出。
 */
public interface TranscriptionClient extends AutoCloseable {
    void start(String sessionId, TranscriptionListener listener);

    /** 连接未就绪时由实现自行缓冲。 */
    void sendAudio(byte[] pcmChunk);

    @Override
    void close();
}
