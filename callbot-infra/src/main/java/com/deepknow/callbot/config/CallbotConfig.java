package com.deepknow.callbot.config;

import com.deepknow.callbot.domain.agent.AgentDirectory;
import com.deepknow.callbot.domain.agent.AgentFactory;
import com.deepknow.callbot.domain.agent.AgentSchedulers;
import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.HandoffNotifier;
import com.deepknow.callbot.domain.agent.LLM.GenerationConfigProperties;
import com.deepknow.callbot.domain.agent.RetrievalClient;
import com.deepknow.callbot.domain.agent.STT.SttConfigProperties;
import com.deepknow.callbot.domain.agent.retrieval.AzureSearchRetrievalClient;
import com.deepknow.callbot.domain.agent.retrieval.RetrievalConfigProperties;
import com.deepknow.callbot.domain.conversation.ConversationPolicy;
import com.deepknow.callbot.domain.conversation.ResponseCache;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import com.deepknow.callbot.domain.conversation.SessionStore;
import com.deepknow.callbot.domain.conversation.StreamOrchestrator;
import com.deepknow.callbot.domain.directory.JsonAgentDirectory;
import com.deepknow.callbot.domain.handoff.WebhookHandoffNotifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({
        ConversationProperties.class,
        PolicyProperties.class,
        BridgeProperties.class,
        HandoffProperties.class,
        AgentDirectoryProperties.class,
        AuthProperties.class,
        RateLimitProperties.class,
        GenerationConfigProperties.class,
        RetrievalConfigProperties.class,
        SttConfigProperties.class
})
public class CallbotConfig {
    private static final Logger log = LoggerFactory.getLogger(CallbotConfig.class);

    @Bean
    public ConversationPolicy conversationPolicy(PolicyProperties policy, ConversationProperties conversation) {
        return new ConversationPolicy(policy, conversation.getMaxUserTextChars(), conversation.getMaxReplyChars());
    }

    @Bean(destroyMethod = "close")
    public SessionStore sessionStore(ConversationProperties conversation) {
        return new SessionStore(conversation.getMaxHistoryTurns(),
                Duration.ofMinutes(conversation.getSessionTtlMinutes()),
                Duration.ofMinutes(conversation.getSweepIntervalMinutes()),
                Clock.systemUTC());
    }

    @Bean
    public ResponseCache responseCache(ConversationProperties conversation) {
        return new ResponseCache(conversation.getCacheTtlMs(), conversation.getCacheMaxEntries(), Clock.systemUTC());
    }

    @Bean
    public AgentFactory agentFactory(ObjectMapper objectMapper) {
        return new AgentFactory(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "generation", name = "backend", havingValue = "search")
    public RetrievalClient retrievalClient(RetrievalConfigProperties retrieval, ObjectMapper objectMapper) {
        return new AzureSearchRetrievalClient(retrieval, objectMapper);
    }

    @Bean
    public GenerationClient generationClient(AgentFactory agentFactory,
                                             GenerationConfigProperties generation,
                                             ObjectProvider<RetrievalClient> retrievalClient,
                                             RetrievalConfigProperties retrieval,
                                             ConversationProperties conversation) {
        GenerationClient client = agentFactory.createGeneration(generation, retrievalClient.getIfAvailable(), retrieval,
                conversation.getMaxHistoryTurns());
        log.info("Generation backend selected: backend={} requestTimeoutMs={}", client.name(), generation.getRequestTimeoutMs());
        return client;
    }

    @Bean
    public HandoffNotifier handoffNotifier(HandoffProperties handoff, ObjectMapper objectMapper) {
        WebhookHandoffNotifier notifier = new WebhookHandoffNotifier(handoff.getWebhookUrl(), handoff.getTimeoutMs(), objectMapper);
        if (!notifier.isEnabled()) {
            log.info("Handoff webhook not configured; notifications disabled");
        }
        return notifier;
    }

    @Bean
    public AgentDirectory agentDirectory(AgentDirectoryProperties agents, ObjectMapper objectMapper) {
        return new JsonAgentDirectory(Paths.get(agents.getStorePath()), objectMapper);
    }

    @Bean
    public ScopeResolver scopeResolver(AgentDirectory agentDirectory, ConversationProperties conversation) {
        return new ScopeResolver(agentDirectory, conversation.getDefaultScopeId());
    }

    @Bean
    public StreamOrchestrator streamOrchestrator(ConversationPolicy policy,
                                                 SessionStore sessionStore,
                                                 ResponseCache responseCache,
                                                 GenerationClient generationClient,
                                                 HandoffNotifier handoffNotifier,
                                                 GenerationConfigProperties generation,
                                                 ConversationProperties conversation) {
        return new StreamOrchestrator(policy, sessionStore, responseCache, generationClient, handoffNotifier,
                AgentSchedulers.get(), generation.getRequestTimeoutMs(),
                conversation.getPhraseMinWords(), conversation.getPhraseMaxWords());
    }

    /**
     * 服务端推送（SSE）交换的执行线程池。
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService streamExchangeExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return new ThreadPoolExecutor(
                4,
                32,
                1,
                TimeUnit.MINUTES,
                new LinkedBlockingQueue<>(1000),
                r -> {
                    Thread t = new Thread(r, "sse-exchange-" + seq.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy()
        );
    }
}
