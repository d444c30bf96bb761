package com.deepknow.callbot.domain.agent;

import lombok.Data;

/**
 * 目录中的一条坐席配置：按 id 或租户编码定位其知识范围。
 */
@Data
public class AgentRecord {
    private String id;
    private String tenantCode;
    private String scopeId;
    private String name;
}
