package com.deepknow.callbot.domain.conversation;

import com.deepknow.callbot.domain.agent.AgentDirectory;
import com.deepknow.callbot.domain.agent.AgentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 知识范围解析：显式 scopeId → 目录按 agentId → 目录按 tenantCode → 默认范围 → null。
 * 目录记录没有 scopeId 时继续向下查找。
 */
public class ScopeResolver {
    private static final Logger log = LoggerFactory.getLogger(ScopeResolver.class);

    private final AgentDirectory directory;
    private final String defaultScopeId;

    public ScopeResolver(AgentDirectory directory, String defaultScopeId) {
        this.directory = directory;
        this.defaultScopeId = blankToNull(defaultScopeId);
    }

    public String resolve(String scopeId, String agentId, String tenantCode) {
        String explicit = blankToNull(scopeId);
        if (explicit != null) {
            return explicit;
        }
        String fromAgent = scopeOf(directory.findById(blankToNull(agentId)));
        if (fromAgent != null) {
            return fromAgent;
        }
        String fromTenant = scopeOf(directory.findByTenantCode(blankToNull(tenantCode)));
        if (fromTenant != null) {
            return fromTenant;
        }
        if (agentId != null || tenantCode != null) {
            log.debug("Scope not found in directory: agentId={} tenantCode={}", agentId, tenantCode);
        }
        return defaultScopeId;
    }

    private static String scopeOf(Optional<AgentRecord> agent) {
        return agent.map(AgentRecord::getScopeId).map(ScopeResolver::blankToNull).orElse(null);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
