package com.deepknow.callbot.domain.agent;

import java.util.List;
import java.util.Optional;

public interface AgentDirectory {

    /** 读取失败时返回空列表，不抛异常。 */
    List<AgentRecord> listAgents();

    default Optional<AgentRecord> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return listAgents().stream().filter(a -> id.equals(a.getId())).findFirst();
    }

    default Optional<AgentRecord> findByTenantCode(String tenantCode) {
        if (tenantCode == null || tenantCode.isBlank()) return Optional.empty();
        return listAgents().stream().filter(a -> tenantCode.equals(a.getTenantCode())).findFirst();
    }
}
