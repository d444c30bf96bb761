package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.agent.AgentSchedulers;
import com.deepknow.callbot.domain.agent.RetrievalClient;
import com.deepknow.callbot.domain.agent.RetrievedDocument;
import com.deepknow.callbot.domain.agent.retrieval.RetrievalConfigProperties;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.web.dto.SearchBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 原始检索调试接口，仅在 search 后端下可用。
 */
@RestController
public class SearchController {
    private static final Logger log = LoggerFactory.getLogger(SearchController.class);
    private static final int CONTENT_PREVIEW_CHARS = 700;

    private final ObjectProvider<RetrievalClient> retrievalClient;
    private final RetrievalConfigProperties retrievalConfig;

    public SearchController(ObjectProvider<RetrievalClient> retrievalClient, RetrievalConfigProperties retrievalConfig) {
        this.retrievalClient = retrievalClient;
        this.retrievalConfig = retrievalConfig;
    }

    @PostMapping("/api/search")
    public ResponseEntity<Map<String, Object>> search(@RequestBody SearchBody body) {
        if (body == null || body.getText() == null || body.getText().isBlank()) {
            throw new InvalidRequestException("text is required");
        }
        if (body.getText().length() > RespondController.MAX_TEXT_CHARS) {
            throw new InvalidRequestException("text is too long");
        }
        int topK = body.getTopK() == null ? retrievalConfig.getTopK() : body.getTopK();
        double minScore = body.getMinScore() == null ? retrievalConfig.getMinScore() : body.getMinScore();
        if (topK < 1 || topK > 20) {
            throw new InvalidRequestException("topK must be between 1 and 20");
        }

        RetrievalClient client = retrievalClient.getIfAvailable();
        if (client == null) {
            throw new InvalidRequestException("search backend is not configured; use /api/respond");
        }

        List<RetrievedDocument> docs;
        try (CancellationToken call = CancellationToken.linked(null, retrievalConfig.getTimeoutMs(), AgentSchedulers.get())) {
            docs = client.retrieve(body.getText(), topK, call);
        } catch (BackendFailureException e) {
            log.error("Search endpoint failed: backend={} status={}", e.getBackend(), e.getStatus(), e);
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("errorCode", "SearchFailed");
            err.put("message", "Search query failed");
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(err);
        }

        List<Map<String, Object>> hits = docs.stream()
                .filter(d -> !Double.isNaN(d.getScore()) && d.getScore() >= minScore)
                .map(d -> {
                    Map<String, Object> hit = new LinkedHashMap<>();
                    hit.put("id", d.getId());
                    hit.put("title", d.getTitle());
                    hit.put("score", d.getScore());
                    String content = d.getContent() == null ? "" : d.getContent();
                    hit.put("content", content.length() > CONTENT_PREVIEW_CHARS ? content.substring(0, CONTENT_PREVIEW_CHARS) : content);
                    return hit;
                })
                .collect(Collectors.toList());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("query", body.getText());
        out.put("topK", topK);
        out.put("minScore", minScore);
        out.put("totalHits", hits.size());
        out.put("hits", hits);
        return ResponseEntity.ok(out);
    }
}
