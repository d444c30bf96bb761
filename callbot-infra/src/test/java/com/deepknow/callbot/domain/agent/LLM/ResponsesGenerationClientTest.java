package com.deepknow.callbot.domain.agent.LLM;

import com.deepknow.callbot.domain.agent.BackendHttp;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.Turn;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResponsesGenerationClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final BackendHttp http = mock(BackendHttp.class);

    @Test
    void extractsOutputTextFromContentParts() throws Exception {
        JsonNode resp = mapper.readTree("{\"output\":[{\"type\":\"file_search_call\"},"
                + "{\"content\":[{\"type\":\"output_text\",\"text\":\"We open at nine.\"}]}]}");

        assertThat(ResponsesGenerationClient.extractOutputText(resp)).isEqualTo("We open at nine.");
        assertThat(ResponsesGenerationClient.extractOutputText(mapper.readTree("{\"output_text\":\" direct \"}"))).isEqualTo("direct");
        assertThat(ResponsesGenerationClient.extractOutputText(null)).isEmpty();
    }

    @Test
    void extractsDistinctFileCitations() throws Exception {
        JsonNode resp = mapper.readTree("{\"output\":[{\"content\":[{\"annotations\":["
                + "{\"type\":\"file_citation\",\"filename\":\"hours.pdf\",\"file_id\":\"file-1\"},"
                + "{\"type\":\"file_citation\",\"filename\":\"hours.pdf\"},"
                + "{\"type\":\"url_citation\",\"filename\":\"web\"}]}]}]}");

        assertThat(ResponsesGenerationClient.extractCitations(resp)).containsExactly("hours.pdf", "file-1");
    }

    @Test
    void recognisesFileSearchCompletionEvents() {
        assertThat(ResponsesGenerationClient.isFileSearchDone("response.file_search_call.completed")).isTrue();
        assertThat(ResponsesGenerationClient.isFileSearchDone("response.file_search_call.searching")).isFalse();
        assertThat(ResponsesGenerationClient.isFileSearchDone("response.output_text.done")).isFalse();
    }

    @Test
    void requestBodyCarriesScopeAndRecentHistory() throws Exception {
        ResponsesGenerationClient client = new ResponsesGenerationClient(props(), 1, mapper, http);
        List<Turn> history = List.of(Turn.user("old q"), Turn.assistant("old a"), Turn.user("q"), Turn.assistant("a"));

        JsonNode body = mapper.readTree(client.writeBody(new GenerationRequest("s1", "hours?", history, "vs_1"), true));

        assertThat(body.path("tools").path(0).path("vector_store_ids").path(0).asText()).isEqualTo("vs_1");
        assertThat(body.path("input")).hasSize(3);
        assertThat(body.path("input").path(2).path("content").asText()).isEqualTo("hours?");
        assertThat(body.path("stream").asBoolean()).isTrue();
    }

    @Test
    void streamSignalsRetrievalThenTokens() {
        String sse = "data: {\"type\":\"response.file_search_call.completed\"}\n\n"
                + "data: {\"type\":\"response.output_text.delta\",\"delta\":\"We open \"}\n\n"
                + "data: {\"type\":\"response.output_text.delta\",\"delta\":\"at nine.\"}\n\n"
                + "data: {\"type\":\"response.completed\",\"response\":{\"output\":[{\"content\":[{\"annotations\":"
                + "[{\"type\":\"file_citation\",\"filename\":\"hours.pdf\"}]}]}]}}\n\n";
        when(http.postStream(contains("/openai/responses"), anyMap(), anyString(), anyLong(), any()))
                .thenReturn(new ByteArrayInputStream(sse.getBytes(StandardCharsets.UTF_8)));
        ResponsesGenerationClient client = new ResponsesGenerationClient(props(), 2, mapper, http);
        List<String> calls = new ArrayList<>();

        Answer answer = client.generateStream(new GenerationRequest("s1", "hours?", List.of(), "vs_1"),
                CancellationToken.create(), ids -> calls.add("retrieval"), delta -> calls.add("token:" + delta));

        assertThat(calls).containsExactly("retrieval", "token:We open ", "token:at nine.");
        assertThat(answer.getText()).isEqualTo("We open at nine.");
        assertThat(answer.getCitations()).containsExactly("hours.pdf");
    }

    private static GenerationConfigProperties props() {
        GenerationConfigProperties props = new GenerationConfigProperties();
        props.setBackend("responses");
        props.setEndpoint("https://example.openai.azure.com/");
        props.setApiKey("k");
        return props;
    }
}
