package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.agent.RetrievalClient;
import com.deepknow.callbot.domain.agent.RetrievedDocument;
import com.deepknow.callbot.domain.agent.retrieval.RetrievalConfigProperties;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.web.dto.SearchBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SearchControllerTest {

    private final RetrievalClient retrievalClient = mock(RetrievalClient.class);
    @SuppressWarnings("unchecked")
    private final ObjectProvider<RetrievalClient> provider = mock(ObjectProvider.class);
    private SearchController controller;

    @BeforeEach
    void setUp() {
        RetrievalConfigProperties config = new RetrievalConfigProperties();
        config.setMinScore(0.5);
        controller = new SearchController(provider, config);
        when(provider.getIfAvailable()).thenReturn(retrievalClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void returnsFilteredHitsWithTruncatedContent() {
        when(retrievalClient.retrieve(eq("hours"), eq(5), any())).thenReturn(List.of(
                new RetrievedDocument("a", "Hours", "x".repeat(900), 0.9),
                new RetrievedDocument("b", "Noise", "y", 0.2)));

        ResponseEntity<Map<String, Object>> response = controller.search(body("hours", 5, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> out = response.getBody();
        assertThat(out).containsEntry("query", "hours").containsEntry("topK", 5).containsEntry("totalHits", 1);
        List<Map<String, Object>> hits = (List<Map<String, Object>>) out.get("hits");
        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit).containsEntry("id", "a");
            assertThat((String) hit.get("content")).hasSize(700);
        });
    }

    @Test
    void backendFailureIsBadGateway() {
        when(retrievalClient.retrieve(any(), eq(3), any())).thenThrow(new BackendFailureException("search", 500, "boom", null));

        ResponseEntity<Map<String, Object>> response = controller.search(body("hours", 3, 0.0));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).containsEntry("errorCode", "SearchFailed");
    }

    @Test
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> controller.search(body(" ", 3, null))).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> controller.search(body("hours", 21, null))).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> controller.search(body("hours", 0, null))).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void missingBackendIsBadRequest() {
        when(provider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> controller.search(body("hours", 3, null)))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessageContaining("not configured");
    }

    private static SearchBody body(String text, Integer topK, Double minScore) {
        SearchBody body = new SearchBody();
        body.setText(text);
        body.setTopK(topK);
        body.setMinScore(minScore);
        return body;
    }
}
