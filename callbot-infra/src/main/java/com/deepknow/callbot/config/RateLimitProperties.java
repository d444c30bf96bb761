package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 按客户端地址的请求限流：每分钟固定窗口，白名单地址不计数。
 */
@ConfigurationProperties(prefix = "rate-limit")
public class RateLimitProperties {
    private boolean enabled = true;
    private int maxPerMinute = 60;
    private long maxClients = 100_000;
    private List<String> allowList = new ArrayList<>(List.of("127.0.0.1", "::1", "0:0:0:0:0:0:0:1"));

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getMaxPerMinute() { return maxPerMinute; }
    public void setMaxPerMinute(int maxPerMinute) { this.maxPerMinute = maxPerMinute; }
    public long getMaxClients() { return maxClients; }
    public void setMaxClients(long maxClients) { this.maxClients = maxClients; }
    public List<String> getAllowList() { return allowList; }
    public void setAllowList(List<String> allowList) { this.allowList = allowList; }
}
