package com.deepknow.callbot.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class RespondBody {
    private String text;
    private String sessionId;
    private String agentId;
    private String tenantCode;
    private String scopeId;
    @JsonProperty("no_cache")
    private String noCache;
}
