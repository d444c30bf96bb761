package com.deepknow.callbot.domain.agent.LLM;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "generation")
public class GenerationConfigProperties {
    private String backend = "mock"; // responses | search | mock
    // Responses API（托管 file_search）
    private String endpoint;
    private String apiKeyEnv = "AZURE_OPENAI_API_KEY";
    private String apiKey; // 直接配置的密钥（优先于 apiKeyEnv）
    private String deployment = "gpt-4.1-mini";
    private String apiVersion = "2025-04-01-preview";
    private int maxOutputTokens = 120;
    private int requestTimeoutMs = 8000;
    private int historyTurns = 2;
    private int fileSearchTopK = 3;
    // search 后端使用的 chat completions
    private String chatEndpoint = "https://api.openai.com/v1";
    private String chatApiKeyEnv = "OPENAI_API_KEY";
    private String chatApiKey;
    private String chatModel = "gpt-4.1-mini";
    private double temperature = 0.1;

    public String resolveApiKey() {
        return resolve(apiKey, apiKeyEnv);
    }

    public String resolveChatApiKey() {
        return resolve(chatApiKey, chatApiKeyEnv);
    }

    static String resolve(String explicit, String envName) {
        if (explicit != null && !explicit.isEmpty()) return explicit;
        return envName == null ? null : System.getenv(envName);
    }

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getDeployment() { return deployment; }
    public void setDeployment(String deployment) { this.deployment = deployment; }
    public String getApiVersion() { return apiVersion; }
    public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }
    public int getMaxOutputTokens() { return maxOutputTokens; }
    public void setMaxOutputTokens(int maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; }
    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    public int getHistoryTurns() { return historyTurns; }
    public void setHistoryTurns(int historyTurns) { this.historyTurns = historyTurns; }
    public int getFileSearchTopK() { return fileSearchTopK; }
    public void setFileSearchTopK(int fileSearchTopK) { this.fileSearchTopK = fileSearchTopK; }
    public String getChatEndpoint() { return chatEndpoint; }
    public void setChatEndpoint(String chatEndpoint) { this.chatEndpoint = chatEndpoint; }
    public String getChatApiKeyEnv() { return chatApiKeyEnv; }
    public void setChatApiKeyEnv(String chatApiKeyEnv) { this.chatApiKeyEnv = chatApiKeyEnv; }
    public String getChatApiKey() { return chatApiKey; }
    public void setChatApiKey(String chatApiKey) { this.chatApiKey = chatApiKey; }
    public String getChatModel() { return chatModel; }
    public void setChatModel(String chatModel) { this.chatModel = chatModel; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double temperature) { this.temperature = temperature; }
}
