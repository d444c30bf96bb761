package com.deepknow.callbot.domain.agent.retrieval;

import com.deepknow.callbot.domain.agent.BackendHttp;
import com.deepknow.callbot.domain.agent.RetrievalClient;
import com.deepknow.callbot.domain.agent.RetrievedDocument;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 混合检索：先向量化查询，再向搜索索引同时提交全文与向量查询。
 */
public class AzureSearchRetrievalClient implements RetrievalClient {
    private static final Logger log = LoggerFactory.getLogger(AzureSearchRetrievalClient.class);
    private static final int MAX_TOP_K = 20;

    private final RetrievalConfigProperties props;
    private final ObjectMapper mapper;
    private final BackendHttp searchHttp;
    private final BackendHttp embeddingsHttp;

    public AzureSearchRetrievalClient(RetrievalConfigProperties props, ObjectMapper mapper) {
        this(props, mapper, new BackendHttp("search"), new BackendHttp("embeddings"));
    }

    public AzureSearchRetrievalClient(RetrievalConfigProperties props, ObjectMapper mapper,
                                      BackendHttp searchHttp, BackendHttp embeddingsHttp) {
        this.props = props;
        this.mapper = mapper;
        this.searchHttp = searchHttp;
        this.embeddingsHttp = embeddingsHttp;
    }

    @Override
    public List<RetrievedDocument> retrieve(String query, int topK, CancellationToken cancel) {
        int k = topK <= 0 ? props.getTopK() : Math.min(Math.max(topK, 1), MAX_TOP_K);
        long t0 = System.nanoTime();
        List<Double> vector = embed(query, cancel);
        if (vector.isEmpty()) {
            log.warn("Embedding returned empty vector: qLen={}", query.length());
            return List.of();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("search", query);
        payload.put("top", k);
        payload.put("select", String.join(",", props.getIdField(), props.getTitleField(), props.getContentField()));
        Map<String, Object> vq = new LinkedHashMap<>();
        vq.put("kind", "vector");
        vq.put("vector", vector);
        vq.put("fields", props.getVectorField());
        vq.put("k", k);
        payload.put("vectorQueries", List.of(vq));

        String url = trimSlash(props.getEndpoint()) + "/indexes/" + encode(props.getIndexName())
                + "/docs/search?api-version=" + encode(props.getApiVersion());
        String apiKey = props.resolveApiKey();
        String resp = searchHttp.postJson(url, apiKey == null ? Map.of() : Map.of("api-key", apiKey),
                write(payload), props.getTimeoutMs(), cancel);

        List<RetrievedDocument> docs = parseDocuments(read(resp));
        log.info("Search done: hits={} topK={} costMs={}", docs.size(), k, (System.nanoTime() - t0) / 1_000_000);
        return docs;
    }

    List<RetrievedDocument> parseDocuments(JsonNode root) {
        List<RetrievedDocument> docs = new ArrayList<>();
        for (JsonNode doc : root.path("value")) {
            docs.add(new RetrievedDocument(
                    doc.path(props.getIdField()).asText("unknown"),
                    doc.path(props.getTitleField()).asText("Untitled"),
                    doc.path(props.getContentField()).asText(""),
                    doc.path("@search.score").asDouble(0)));
        }
        return docs;
    }

    private List<Double> embed(String text, CancellationToken cancel) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", props.getEmbeddingModel());
        payload.put("input", text);
        String key = props.resolveEmbeddingsApiKey();
        String resp = embeddingsHttp.postJson(trimSlash(props.getEmbeddingsEndpoint()) + "/embeddings",
                key == null ? Map.of() : Map.of("Authorization", "Bearer " + key),
                write(payload), props.getTimeoutMs(), cancel);
        List<Double> vector = new ArrayList<>();
        for (JsonNode v : read(resp).path("data").path(0).path("embedding")) {
            vector.add(v.asDouble());
        }
        return vector;
    }

    private String write(Object payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException("search", "serialize request failed", e);
        }
    }

    private JsonNode read(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException("search", "unparsable response", e);
        }
    }

    private static String trimSlash(String s) {
        return s == null ? "" : s.replaceAll("/$", "");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s == null ? "" : s, StandardCharsets.UTF_8);
    }
}
