package com.deepknow.callbot.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class RespondRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    private String text;
    private String sessionId;   // 为空时服务端生成
    private String agentId;
    private String tenantCode;
    private String scopeId;
    private boolean noCache;
}
