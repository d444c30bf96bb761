package com.deepknow.callbot.domain.agent.STT;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stt")
public class SttConfigProperties {
    private String provider = "mock"; // deepgram | aliyun | mock
    private String apiKeyEnv = "DEEPGRAM_API_KEY";
    private String apiKey; // 直接配置的密钥（优先级高于 apiKeyEnv）
    private String listenUrl = "wss://api.deepgram.com/v1/listen";
    private String model = "nova-2";
    private int sampleRate = 16000;
    private String language;
    private int handshakeTimeoutMs = 7000;
    private int maxPendingFrames = 50;
    // DashScope 实时识别
    private String aliyunModel = "gummy-realtime-v1";
    private String aliyunApiKeyEnv = "DASHSCOPE_API_KEY";

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) return apiKey;
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }

    public String resolveAliyunApiKey() {
        return aliyunApiKeyEnv == null ? null : System.getenv(aliyunApiKeyEnv);
    }

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getListenUrl() { return listenUrl; }
    public void setListenUrl(String listenUrl) { this.listenUrl = listenUrl; }
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }
    public int getSampleRate() { return sampleRate; }
    public void setSampleRate(int sampleRate) { this.sampleRate = sampleRate; }
    public String getLanguage() { return language; }
    public void setLanguage(String language) { this.language = language; }
    public int getHandshakeTimeoutMs() { return handshakeTimeoutMs; }
    public void setHandshakeTimeoutMs(int handshakeTimeoutMs) { this.handshakeTimeoutMs = handshakeTimeoutMs; }
    public int getMaxPendingFrames() { return maxPendingFrames; }
    public void setMaxPendingFrames(int maxPendingFrames) { this.maxPendingFrames = maxPendingFrames; }
    public String getAliyunModel() { return aliyunModel; }
    public void setAliyunModel(String aliyunModel) { this.aliyunModel = aliyunModel; }
    public String getAliyunApiKeyEnv() { return aliyunApiKeyEnv; }
    public void setAliyunApiKeyEnv(String aliyunApiKeyEnv) { this.aliyunApiKeyEnv = aliyunApiKeyEnv; }
}
