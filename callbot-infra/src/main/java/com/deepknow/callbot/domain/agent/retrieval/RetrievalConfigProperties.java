package com.deepknow.callbot.domain.agent.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval")
public class RetrievalConfigProperties {
    private String endpoint;
    private String apiKeyEnv = "AZURE_SEARCH_API_KEY";
    private String apiKey;
    private String indexName;
    private String apiVersion = "2024-07-01";
    private String idField = "id";
    private String titleField = "title";
    private String contentField = "content";
    private String vectorField = "contentVector";
    private int topK = 5;
    private double minScore = 0.5;
    // 向量化
    private String embeddingsEndpoint = "https://api.openai.com/v1";
    private String embeddingsApiKeyEnv = "OPENAI_API_KEY";
    private String embeddingsApiKey;
    private String embeddingModel = "text-embedding-3-small";
    private int timeoutMs = 8000;

    public String resolveApiKey() {
        if (apiKey != null && !apiKey.isEmpty()) return apiKey;
        return apiKeyEnv == null ? null : System.getenv(apiKeyEnv);
    }

    public String resolveEmbeddingsApiKey() {
        if (embeddingsApiKey != null && !embeddingsApiKey.isEmpty()) return embeddingsApiKey;
        return embeddingsApiKeyEnv == null ? null : System.getenv(embeddingsApiKeyEnv);
    }

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getApiKeyEnv() { return apiKeyEnv; }
    public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getIndexName() { return indexName; }
    public void setIndexName(String indexName) { this.indexName = indexName; }
    public String getApiVersion() { return apiVersion; }
    public void setApiVersion(String apiVersion) { this.apiVersion = apiVersion; }
    public String getIdField() { return idField; }
    public void setIdField(String idField) { this.idField = idField; }
    public String getTitleField() { return titleField; }
    public void setTitleField(String titleField) { this.titleField = titleField; }
    public String getContentField() { return contentField; }
    public void setContentField(String contentField) { this.contentField = contentField; }
    public String getVectorField() { return vectorField; }
    public void setVectorField(String vectorField) { this.vectorField = vectorField; }
    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }
    public double getMinScore() { return minScore; }
    public void setMinScore(double minScore) { this.minScore = minScore; }
    public String getEmbeddingsEndpoint() { return embeddingsEndpoint; }
    public void setEmbeddingsEndpoint(String embeddingsEndpoint) { this.embeddingsEndpoint = embeddingsEndpoint; }
    public String getEmbeddingsApiKeyEnv() { return embeddingsApiKeyEnv; }
    public void setEmbeddingsApiKeyEnv(String embeddingsApiKeyEnv) { this.embeddingsApiKeyEnv = embeddingsApiKeyEnv; }
    public String getEmbeddingsApiKey() { return embeddingsApiKey; }
    public void setEmbeddingsApiKey(String embeddingsApiKey) { this.embeddingsApiKey = embeddingsApiKey; }
    public String getEmbeddingModel() { return embeddingModel; }
    public void setEmbeddingModel(String embeddingModel) { this.embeddingModel = embeddingModel; }
    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
}
