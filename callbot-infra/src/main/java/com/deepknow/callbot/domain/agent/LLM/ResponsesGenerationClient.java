package com.deepknow.callbot.domain.agent.LLM;

import com.deepknow.callbot.domain.agent.BackendHttp;
import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ExchangeCancelledException;
import com.deepknow.callbot.domain.conversation.ConversationPolicy;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.Role;
import com.deepknow.callbot.domain.conversation.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 托管 file_search 的 Responses API 客户端：知识范围 id 即向量库 id，检索与生成在一次调用内完成。
 */
public class ResponsesGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(ResponsesGenerationClient.class);

    static final String SYSTEM_POLICY = String.join(" ",
            "You are a phone assistant for the organization whose documents are available through file search.",
            "You must answer ONLY from those uploaded documents.",
            "Never invent facts and never use outside knowledge.",
            "If context is missing or unrelated, reply with transfer to human call center.",
            "If asked for treatment advice, diagnosis, medication, dosage, or clinical recommendations, reply with transfer.",
            "Reply in the user's language (Turkish for Turkish users).",
            "Keep a calm and concise tone.");

    private static final int MAX_CITATIONS = 10;
    private static final int HISTORY_TURN_CHARS = 400;

    private final ObjectMapper mapper;
    private final BackendHttp http;
    private final GenerationConfigProperties props;
    private final int maxHistoryTurns;
    private final String apiKey;

    public ResponsesGenerationClient(GenerationConfigProperties props, int maxHistoryTurns, ObjectMapper mapper, BackendHttp http) {
        this.props = props;
        this.maxHistoryTurns = maxHistoryTurns;
        this.mapper = mapper;
        this.http = http;
        this.apiKey = props.resolveApiKey();
        log.info("Responses backend init: deployment={} apiVersion={} maxOutputTokens={} fileSearchTopK={}",
                props.getDeployment(), props.getApiVersion(), props.getMaxOutputTokens(), props.getFileSearchTopK());
    }

    @Override
    public Answer generate(GenerationRequest request, CancellationToken cancel) {
        String body = writeBody(request, false);
        String resp = http.postJson(requestUrl(), headers(), body, props.getRequestTimeoutMs(), cancel);
        JsonNode root;
        try {
            root = mapper.readTree(resp);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException(name(), "unparsable response", e);
        }
        String text = extractOutputText(root);
        List<String> citations = extractCitations(root);
        log.info("Responses call done: sessionId={} textLen={} citations={}", request.getSessionId(), text.length(), citations.size());
        return Answer.answer(text, citations);
    }

    @Override
    public Answer generateStream(GenerationRequest request, CancellationToken cancel,
                                 Consumer<List<String>> onRetrievalDone, Consumer<String> onToken) {
        log.info("Responses stream start: deployment={} qLen={} historyLen={} sessionId={}",
                props.getDeployment(), request.getQuery().length(), request.getHistory().size(), request.getSessionId());
        String body = writeBody(request, true);
        AtomicBoolean retrievalDone = new AtomicBoolean(false);
        Runnable markRetrievalDone = () -> {
            if (retrievalDone.compareAndSet(false, true)) {
                onRetrievalDone.accept(List.of());
            }
        };
        StringBuilder output = new StringBuilder(512);
        AtomicReference<JsonNode> completed = new AtomicReference<>();
        int[] chunks = {0};

        InputStream in = http.postStream(requestUrl(), headers(), body, props.getRequestTimeoutMs(), cancel);
        CancellationToken.Registration reg = BackendHttp.closeOnCancel(cancel, in);
        try (InputStream is = in) {
            EventStreamReader.read(is, (eventType, data) -> {
                JsonNode payload;
                try {
                    payload = mapper.readTree(data);
                } catch (JsonProcessingException e) {
                    log.debug("Responses stream skip unparsable event: sessionId={}", request.getSessionId());
                    return true;
                }
                String type = payload.path("type").asText(eventType);
                if (isFileSearchDone(type)) {
                    markRetrievalDone.run();
                } else if ("response.output_text.delta".equals(type)) {
                    markRetrievalDone.run();
                    String delta = payload.path("delta").asText("");
                    if (!delta.isEmpty()) {
                        chunks[0]++;
                        output.append(delta);
                        onToken.accept(delta);
                    }
                } else if ("response.completed".equals(type)) {
                    completed.set(payload.has("response") ? payload.get("response") : payload);
                }
                return !cancel.isCancelled();
            });
        } catch (IOException e) {
            if (cancel.isCancelled()) {
                throw new ExchangeCancelledException(cancel.getReason());
            }
            throw new BackendFailureException(name(), "stream read failed", e);
        } finally {
            reg.remove();
        }
        cancel.throwIfCancelled();
        markRetrievalDone.run();

        String text = output.length() > 0 ? output.toString() : extractOutputText(completed.get());
        List<String> citations = extractCitations(completed.get());
        log.info("Responses stream end: chunks={} totalChars={} citations={} sessionId={}",
                chunks[0], text.length(), citations.size(), request.getSessionId());
        return Answer.answer(text, citations);
    }

    @Override
    public String name() {
        return "responses";
    }

    String writeBody(GenerationRequest request, boolean stream) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("model", props.getDeployment());
        root.put("instructions", SYSTEM_POLICY);
        List<Map<String, Object>> input = new ArrayList<>();
        for (Turn t : recentHistory(request.getHistory())) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("role", t.getRole() == Role.ASSISTANT ? "assistant" : "user");
            m.put("content", ConversationPolicy.sanitize(t.getText(), HISTORY_TURN_CHARS));
            input.add(m);
        }
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("role", "user");
        user.put("content", request.getQuery());
        input.add(user);
        root.put("input", input);
        root.put("temperature", 0);
        root.put("max_output_tokens", props.getMaxOutputTokens());
        root.put("stream", stream);
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("type", "file_search");
        tool.put("vector_store_ids", List.of(request.getScopeId()));
        tool.put("max_num_results", props.getFileSearchTopK());
        root.put("tools", List.of(tool));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException(name(), "serialize request failed", e);
        }
    }

    private List<Turn> recentHistory(List<Turn> history) {
        int keep = Math.max(0, Math.min(maxHistoryTurns, props.getHistoryTurns())) * 2;
        if (history.size() <= keep) return history;
        return history.subList(history.size() - keep, history.size());
    }

    private String requestUrl() {
        String endpoint = props.getEndpoint() == null ? "" : props.getEndpoint().replaceAll("/$", "");
        return endpoint + "/openai/responses?api-version=" + URLEncoder.encode(props.getApiVersion(), StandardCharsets.UTF_8);
    }

    private Map<String, String> headers() {
        return apiKey == null ? Map.of() : Map.of("api-key", apiKey);
    }

    static boolean isFileSearchDone(String type) {
        return type != null && type.contains("file_search") && (type.endsWith("done") || type.endsWith("completed"));
    }

    static String extractOutputText(JsonNode response) {
        if (response == null || response.isMissingNode() || response.isNull()) {
            return "";
        }
        String direct = response.path("output_text").asText("");
        if (!direct.isBlank()) {
            return direct.trim();
        }
        List<String> collected = new ArrayList<>();
        for (JsonNode item : response.path("output")) {
            if (item.path("text").isTextual()) {
                collected.add(item.path("text").asText());
            }
            for (JsonNode part : item.path("content")) {
                if (part.path("text").isTextual()) {
                    collected.add(part.path("text").asText());
                }
                if (part.path("output_text").isTextual()) {
                    collected.add(part.path("output_text").asText());
                }
            }
        }
        return String.join("\n", collected).trim();
    }

    static List<String> extractCitations(JsonNode response) {
        Set<String> refs = new LinkedHashSet<>();
        if (response == null) {
            return List.of();
        }
        for (JsonNode item : response.path("output")) {
            for (JsonNode part : item.path("content")) {
                for (JsonNode annotation : part.path("annotations")) {
                    String type = annotation.path("type").asText("");
                    if (!type.isEmpty() && !"file_citation".equals(type)) {
                        continue;
                    }
                    addRef(refs, annotation.path("filename").asText(""));
                    addRef(refs, annotation.path("file_id").asText(""));
                }
            }
        }
        List<String> out = new ArrayList<>(refs);
        return out.size() > MAX_CITATIONS ? out.subList(0, MAX_CITATIONS) : out;
    }

    private static void addRef(Set<String> refs, String value) {
        if (value != null && !value.isBlank()) {
            refs.add(value.trim());
        }
    }
}
