package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {
    private int maxMessageBytes = 1_000_000;  // 文本帧上限，超出以 1009 关闭
    private int maxAudioBytes = 512_000;      // 单个音频帧上限，超出静默丢弃
    private int maxQueuedTranscripts = 32;    // 排队中的最终转写上限，超出以 1013 关闭

    public int getMaxMessageBytes() { return maxMessageBytes; }
    public void setMaxMessageBytes(int maxMessageBytes) { this.maxMessageBytes = maxMessageBytes; }
    public int getMaxAudioBytes() { return maxAudioBytes; }
    public void setMaxAudioBytes(int maxAudioBytes) { this.maxAudioBytes = maxAudioBytes; }
    public int getMaxQueuedTranscripts() { return maxQueuedTranscripts; }
    public void setMaxQueuedTranscripts(int maxQueuedTranscripts) { this.maxQueuedTranscripts = maxQueuedTranscripts; }
}
