package com.deepknow.callbot.domain.agent;

import com.deepknow.callbot.domain.agent.LLM.GenerationConfigProperties;
import com.deepknow.callbot.domain.agent.LLM.MockGenerationClient;
import com.deepknow.callbot.domain.agent.LLM.ResponsesGenerationClient;
import com.deepknow.callbot.domain.agent.LLM.SearchGenerationClient;
import com.deepknow.callbot.domain.agent.STT.DeepgramTranscriptionClient;
import com.deepknow.callbot.domain.agent.STT.MockTranscriptionClient;
import com.deepknow.callbot.domain.agent.STT.SttConfigProperties;
import com.deepknow.callbot.domain.agent.retrieval.RetrievalConfigProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AgentFactoryTest {

    private final AgentFactory factory = new AgentFactory(new ObjectMapper());

    @Test
    void selectsGenerationBackendByName() {
        assertThat(factory.createGeneration(generation("Responses"), null, new RetrievalConfigProperties(), 2))
                .isInstanceOf(ResponsesGenerationClient.class);
        assertThat(factory.createGeneration(generation("search"), mock(RetrievalClient.class), new RetrievalConfigProperties(), 2))
                .isInstanceOf(SearchGenerationClient.class);
        assertThat(factory.createGeneration(generation("mock"), null, new RetrievalConfigProperties(), 2))
                .isInstanceOf(MockGenerationClient.class);
        assertThat(factory.createGeneration(generation("unknown"), null, new RetrievalConfigProperties(), 2))
                .isInstanceOf(MockGenerationClient.class);
    }

    @Test
    void searchBackendRequiresRetrievalClient() {
        assertThatThrownBy(() -> factory.createGeneration(generation("search"), null, new RetrievalConfigProperties(), 2))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void selectsTranscriptionProviderByName() {
        SttConfigProperties deepgram = new SttConfigProperties();
        deepgram.setProvider("deepgram");
        SttConfigProperties fallback = new SttConfigProperties();
        fallback.setProvider(null);

        assertThat(factory.createTranscription(deepgram)).isInstanceOf(DeepgramTranscriptionClient.class);
        assertThat(factory.createTranscription(fallback)).isInstanceOf(MockTranscriptionClient.class);
    }

    private static GenerationConfigProperties generation(String backend) {
        GenerationConfigProperties props = new GenerationConfigProperties();
        props.setBackend(backend);
        props.setEndpoint("https://example.openai.azure.com");
        return props;
    }
}
