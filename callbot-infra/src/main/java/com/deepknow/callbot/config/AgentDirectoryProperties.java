package com.deepknow.callbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agents")
public class AgentDirectoryProperties {
    private String storePath = "./data/agents.json";

    public String getStorePath() { return storePath; }
    public void setStorePath(String storePath) { this.storePath = storePath; }
}
