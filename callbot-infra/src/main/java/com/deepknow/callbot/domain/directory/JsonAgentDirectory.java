package com.deepknow.callbot.domain.directory;

import com.deepknow.callbot.domain.agent.AgentDirectory;
import com.deepknow.callbot.domain.agent.AgentRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * 基于 JSON 文件的坐席目录：{"agents":[{"id","tenantCode","scopeId","name"}]}。
 * 每次查询都重新读取文件，以便外部管理端修改后即时生效；读取或解析失败时视为空目录。
 */
public class JsonAgentDirectory implements AgentDirectory {
    private static final Logger log = LoggerFactory.getLogger(JsonAgentDirectory.class);
    private static final TypeReference<List<AgentRecord>> AGENT_LIST = new TypeReference<>() {};

    private final Path storePath;
    private final ObjectMapper mapper;
    private final ObjectReader agentReader;

    public JsonAgentDirectory(Path storePath, ObjectMapper mapper) {
        this.storePath = storePath;
        this.mapper = mapper;
        this.agentReader = mapper.readerFor(AGENT_LIST)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<AgentRecord> listAgents() {
        if (storePath == null || !Files.isReadable(storePath)) {
            log.debug("Agent store not readable, treat as empty: path={}", storePath);
            return Collections.emptyList();
        }
        try {
            JsonNode root = mapper.readTree(storePath.toFile());
            JsonNode agents = root == null ? null : root.get("agents");
            if (agents == null || !agents.isArray()) {
                return Collections.emptyList();
            }
            List<AgentRecord> list = agentReader.readValue(agents);
            return list == null ? Collections.emptyList() : list;
        } catch (IOException e) {
            log.warn("Agent store read failed, treat as empty: path={} cause={}", storePath, e.getMessage());
            return Collections.emptyList();
        }
    }
}
