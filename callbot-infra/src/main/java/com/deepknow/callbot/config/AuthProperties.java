package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 接口鉴权令牌。未配置令牌时对应入口一律拒绝；
 * 仅当显式开启 allowUnauthenticated（本地开发）时才放行。
 */
@ConfigurationProperties(prefix = "security")
public class AuthProperties {
    private String serviceApiToken;
    private String inboundWsToken;
    private boolean allowUnauthenticated = false;

    public String getServiceApiToken() { return serviceApiToken; }
    public void setServiceApiToken(String serviceApiToken) { this.serviceApiToken = serviceApiToken; }
    public String getInboundWsToken() { return inboundWsToken; }
    public void setInboundWsToken(String inboundWsToken) { this.inboundWsToken = inboundWsToken; }
    public boolean isAllowUnauthenticated() { return allowUnauthenticated; }
    public void setAllowUnauthenticated(boolean allowUnauthenticated) { this.allowUnauthenticated = allowUnauthenticated; }
}
