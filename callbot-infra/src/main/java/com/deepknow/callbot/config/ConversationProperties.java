package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {
    private int maxUserTextChars = 600;
    private int maxReplyChars = 700;
    private int maxHistoryTurns = 10;
    private int sessionTtlMinutes = 30;
    private int sweepIntervalMinutes = 5;
    private long cacheTtlMs = 120000; // <= 0 关闭缓存
    private int cacheMaxEntries = 500;
    private int phraseMinWords = 10;
    private int phraseMaxWords = 20;
    private String defaultScopeId; // 未解析到知识范围时的兜底

    public int getMaxUserTextChars() { return maxUserTextChars; }
    public void setMaxUserTextChars(int maxUserTextChars) { this.maxUserTextChars = maxUserTextChars; }
    public int getMaxReplyChars() { return maxReplyChars; }
    public void setMaxReplyChars(int maxReplyChars) { this.maxReplyChars = maxReplyChars; }
    public int getMaxHistoryTurns() { return maxHistoryTurns; }
    public void setMaxHistoryTurns(int maxHistoryTurns) { this.maxHistoryTurns = maxHistoryTurns; }
    public int getSessionTtlMinutes() { return sessionTtlMinutes; }
    public void setSessionTtlMinutes(int sessionTtlMinutes) { this.sessionTtlMinutes = sessionTtlMinutes; }
    public int getSweepIntervalMinutes() { return sweepIntervalMinutes; }
    public void setSweepIntervalMinutes(int sweepIntervalMinutes) { this.sweepIntervalMinutes = sweepIntervalMinutes; }
    public long getCacheTtlMs() { return cacheTtlMs; }
    public void setCacheTtlMs(long cacheTtlMs) { this.cacheTtlMs = cacheTtlMs; }
    public int getCacheMaxEntries() { return cacheMaxEntries; }
    public void setCacheMaxEntries(int cacheMaxEntries) { this.cacheMaxEntries = cacheMaxEntries; }
    public int getPhraseMinWords() { return phraseMinWords; }
    public void setPhraseMinWords(int phraseMinWords) { this.phraseMinWords = phraseMinWords; }
    public int getPhraseMaxWords() { return phraseMaxWords; }
    public void setPhraseMaxWords(int phraseMaxWords) { this.phraseMaxWords = phraseMaxWords; }
    public String getDefaultScopeId() { return defaultScopeId; }
    public void setDefaultScopeId(String defaultScopeId) { this.defaultScopeId = defaultScopeId; }
}
