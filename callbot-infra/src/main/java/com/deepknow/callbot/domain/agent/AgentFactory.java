package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.agent.LLM.GenerationConfigProperties;
import com.deepknow.callbot.domain.agent.LLM.MockGenerationClient;
import com.deepknow.callbot.domain.agent.LLM.ResponsesGenerationClient;
import com.deepknow.callbot.domain.agent.LLM.SearchGenerationClient;
import com.deepknow.callbot.domain.agent.STT.AliyunTranscriptionClient;
import com.deepknow.callbot.domain.agent.STT.DeepgramTranscriptionClient;
import com.deepknow.callbot.domain.agent.STT.MockTranscriptionClient;
import com.deepknow.callbot.domain.agent.STT.SttConfigProperties;
import com.deepknow.callbot.domain.agent.retrieval.RetrievalConfigProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * 简单的客户端工厂：按配置的 backend / provider 选择实现，未知取值回落到 mock。
 */
public class AgentFactory {
    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    private final ObjectMapper mapper;

    public AgentFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public GenerationClient createGeneration(GenerationConfigProperties config,
                                             RetrievalClient retrieval,
                                             RetrievalConfigProperties retrievalConfig,
                                             int maxHistoryTurns) {
        String backend = normalize(config.getBackend());
        switch (backend) {
            case "responses":
                return new ResponsesGenerationClient(config, maxHistoryTurns, mapper, new BackendHttp("responses"));
            case "search":
                if (retrieval == null) {
                    throw new IllegalStateException("search backend requires a retrieval client");
                }
                return new SearchGenerationClient(retrieval, config, retrievalConfig.getTopK(), retrievalConfig.getMinScore(),
                        Math.min(maxHistoryTurns, config.getHistoryTurns()), mapper, new BackendHttp("chat"));
            case "mock":
                return new MockGenerationClient(30);
            default:
                log.warn("Unknown generation backend={}, fallback to mock", backend);
                return new MockGenerationClient(30);
        }
    }

    // 每个桥接会话一个新实例
    public TranscriptionClient createTranscription(SttConfigProperties config) {
        String provider = normalize(config.getProvider());
        switch (provider) {
            case "deepgram":
                return new DeepgramTranscriptionClient(config, mapper);
            case "aliyun":
                return new AliyunTranscriptionClient(config, AgentSchedulers.get());
            case "mock":
                return new MockTranscriptionClient(AgentSchedulers.get());
            default:
                log.warn("Unknown stt provider={}, fallback to mock", provider);
                return new MockTranscriptionClient(AgentSchedulers.get());
        }
    }

    private static String normalize(String v) {
        return v == null ? "mock" : v.trim().toLowerCase(Locale.ROOT);
    }
}
