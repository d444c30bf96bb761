package com.deepknow.callbot.domain.agent.LLM;

import com.deepknow.callbot.domain.agent.BackendHttp;
import com.deepknow.callbot.domain.agent.GenerationClient;
import com.deepknow.callbot.domain.agent.GenerationRequest;
import com.deepknow.callbot.domain.agent.RetrievalClient;
import com.deepknow.callbot.domain.agent.RetrievedDocument;
import com.deepknow.callbot.domain.common.BackendFailureException;
import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.common.ExchangeCancelledException;
import com.deepknow.callbot.domain.conversation.ConversationPolicy;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.Decision;
import com.deepknow.callbot.domain.conversation.model.HandoffReason;
import com.deepknow.callbot.domain.conversation.model.Turn;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 检索 + chat completions 的生成后端：先按分数过滤检索结果，再用编号片段构造有据提示词。
 * 阻塞调用要求模型输出严格 JSON，仅保留指向已检索文档的引用。
 */
public class SearchGenerationClient implements GenerationClient {
    private static final Logger log = LoggerFactory.getLogger(SearchGenerationClient.class);

    static final String SYSTEM_POLICY = String.join(" ",
            "You are a phone assistant.",
            "Use only the provided knowledge snippets.",
            "If the user asks for medical treatment advice, diagnosis, medication, dosage, or any clinical recommendation, choose handoff.",
            "If the snippets are insufficient or unrelated, choose handoff.",
            "Reply in the same language as the user (Turkish if the user writes/speaks Turkish).",
            "Keep replies short and suitable for voice.",
            "If handoff is needed, reply that the call will be transferred to a human call center agent.",
            "Return citations as the ids of the snippets you used.");

    static final String SYSTEM_POLICY_STREAM = String.join(" ",
            "You are a phone assistant.",
            "Use only the provided knowledge snippets.",
            "If the snippets are insufficient or unrelated, say you will transfer the call to a human call center agent.",
            "If the user asks for medical treatment advice, diagnosis, medication, dosage, or any clinical recommendation, say you will transfer.",
            "When answering, be concise, calm, and non-alarmist.",
            "Reply in the same language as the user (Turkish if the user writes/speaks Turkish).",
            "Output only the assistant reply text. Do not output JSON.");

    private static final int SNIPPET_CHARS = 1200;
    private static final int HISTORY_TURN_CHARS = 400;

    private final RetrievalClient retrieval;
    private final GenerationConfigProperties props;
    private final int topK;
    private final double minScore;
    private final int maxHistoryTurns;
    private final ObjectMapper mapper;
    private final BackendHttp http;
    private final String apiKey;

    public SearchGenerationClient(RetrievalClient retrieval, GenerationConfigProperties props,
                                  int topK, double minScore, int maxHistoryTurns,
                                  ObjectMapper mapper, BackendHttp http) {
        this.retrieval = retrieval;
        this.props = props;
        this.topK = topK;
        this.minScore = minScore;
        this.maxHistoryTurns = maxHistoryTurns;
        this.mapper = mapper;
        this.http = http;
        this.apiKey = props.resolveChatApiKey();
        log.info("Search backend init: chatModel={} topK={} minScore={}", props.getChatModel(), topK, minScore);
    }

    @Override
    public Answer generate(GenerationRequest request, CancellationToken cancel) {
        List<RetrievedDocument> docs = retrieveFiltered(request, cancel);
        if (docs.isEmpty()) {
            return Answer.handoff("", HandoffReason.NO_DOCUMENTS);
        }

        Map<String, Object> body = chatBody(request, docs, SYSTEM_POLICY, false);
        body.put("response_format", responseFormat());
        String resp = http.postJson(chatUrl(), headers(), write(body), props.getRequestTimeoutMs(), cancel);

        String raw;
        JsonNode parsed;
        try {
            raw = mapper.readTree(resp).path("choices").path(0).path("message").path("content").asText("");
            parsed = mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException(name(), "unparsable structured reply", e);
        }

        Set<String> allowed = docs.stream().map(RetrievedDocument::getId).collect(Collectors.toSet());
        List<String> citations = new ArrayList<>();
        for (JsonNode c : parsed.path("citations")) {
            String id = c.asText("");
            if (allowed.contains(id) && !citations.contains(id)) {
                citations.add(id);
            }
        }
        Decision decision = Decision.fromWire(parsed.path("decision").asText(""));
        String reply = parsed.path("reply").asText("");
        log.info("Chat call done: sessionId={} decision={} replyLen={} citations={}",
                request.getSessionId(), decision.wireName(), reply.length(), citations.size());
        if (decision != Decision.ANSWER || citations.isEmpty()) {
            return Answer.handoff(reply, HandoffReason.BACKEND_DECLINED);
        }
        return Answer.answer(reply, citations);
    }

    @Override
    public Answer generateStream(GenerationRequest request, CancellationToken cancel,
                                 Consumer<List<String>> onRetrievalDone, Consumer<String> onToken) {
        List<RetrievedDocument> docs = retrieveFiltered(request, cancel);
        List<String> ids = docs.stream().map(RetrievedDocument::getId).collect(Collectors.toList());
        onRetrievalDone.accept(ids);
        if (docs.isEmpty()) {
            return Answer.handoff("", HandoffReason.NO_DOCUMENTS);
        }

        log.info("Chat stream start: model={} qLen={} docs={} sessionId={}",
                props.getChatModel(), request.getQuery().length(), docs.size(), request.getSessionId());
        Map<String, Object> body = chatBody(request, docs, SYSTEM_POLICY_STREAM, true);
        StringBuilder output = new StringBuilder(512);
        int[] chunks = {0};

        InputStream in = http.postStream(chatUrl(), headers(), write(body), props.getRequestTimeoutMs(), cancel);
        CancellationToken.Registration reg = BackendHttp.closeOnCancel(cancel, in);
        try (InputStream is = in) {
            EventStreamReader.read(is, (eventType, data) -> {
                try {
                    JsonNode node = mapper.readTree(data);
                    JsonNode delta = node.path("choices").path(0).path("delta").path("content");
                    if (delta.isTextual() && !delta.asText().isEmpty()) {
                        chunks[0]++;
                        output.append(delta.asText());
                        onToken.accept(delta.asText());
                    }
                } catch (JsonProcessingException e) {
                    log.warn("Chat stream parse failed. sessionId={}", request.getSessionId(), e);
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
        log.info("Chat stream end: chunks={} totalChars={} sessionId={}", chunks[0], output.length(), request.getSessionId());
        return Answer.answer(output.toString(), ids);
    }

    @Override
    public String name() {
        return "search";
    }

    /**
     * 检索并按最低分过滤，截取前 topK 条。
     */
    public List<RetrievedDocument> retrieveFiltered(String query, CancellationToken cancel) {
        return retrieval.retrieve(query, topK, cancel).stream()
                .filter(d -> !Double.isNaN(d.getScore()) && d.getScore() >= minScore)
                .limit(topK)
                .collect(Collectors.toList());
    }

    private List<RetrievedDocument> retrieveFiltered(GenerationRequest request, CancellationToken cancel) {
        long t0 = System.nanoTime();
        List<RetrievedDocument> docs = retrieveFiltered(request.getQuery(), cancel);
        log.info("Retrieval done: sessionId={} kept={} costMs={}", request.getSessionId(), docs.size(), (System.nanoTime() - t0) / 1_000_000);
        return docs;
    }

    String buildPrompt(String query, List<Turn> history, List<RetrievedDocument> docs) {
        int keep = maxHistoryTurns * 2;
        List<Turn> recent = history.size() <= keep ? history : history.subList(history.size() - keep, history.size());
        String safeHistory = recent.stream()
                .map(t -> t.getRole().wireName() + ": " + ConversationPolicy.sanitize(t.getText(), HISTORY_TURN_CHARS))
                .collect(Collectors.joining("\n"));
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < docs.size(); i++) {
            RetrievedDocument d = docs.get(i);
            if (i > 0) context.append("\n\n");
            String content = d.getContent() == null ? "" : d.getContent();
            context.append('[').append(i + 1).append("] id=").append(d.getId())
                    .append(" | title=").append(d.getTitle())
                    .append(" | score=").append(String.format(Locale.ROOT, "%.3f", d.getScore()))
                    .append('\n')
                    .append(content.length() > SNIPPET_CHARS ? content.substring(0, SNIPPET_CHARS) : content);
        }
        return String.join("\n\n",
                "Conversation history:\n" + (safeHistory.isEmpty() ? "(empty)" : safeHistory),
                "Knowledge snippets:\n" + context,
                "User message:\n" + query,
                "If answer is not fully grounded in snippets, choose handoff.");
    }

    private Map<String, Object> chatBody(GenerationRequest request, List<RetrievedDocument> docs, String system, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getChatModel());
        body.put("temperature", props.getTemperature());
        body.put("stream", stream);
        Map<String, Object> mSystem = new LinkedHashMap<>();
        mSystem.put("role", "system");
        mSystem.put("content", system);
        Map<String, Object> mUser = new LinkedHashMap<>();
        mUser.put("role", "user");
        mUser.put("content", buildPrompt(request.getQuery(), request.getHistory(), docs));
        body.put("messages", List.of(mSystem, mUser));
        return body;
    }

    private static Map<String, Object> responseFormat() {
        Map<String, Object> citations = new LinkedHashMap<>();
        citations.put("type", "array");
        citations.put("items", Map.of("type", "string"));
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("decision", Map.of("type", "string", "enum", List.of("answer", "handoff")));
        properties.put("reply", Map.of("type", "string"));
        properties.put("citations", citations);
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("additionalProperties", false);
        schema.put("properties", properties);
        schema.put("required", List.of("decision", "reply", "citations"));
        Map<String, Object> jsonSchema = new LinkedHashMap<>();
        jsonSchema.put("name", "callbot_response");
        jsonSchema.put("strict", true);
        jsonSchema.put("schema", schema);
        Map<String, Object> format = new LinkedHashMap<>();
        format.put("type", "json_schema");
        format.put("json_schema", jsonSchema);
        return format;
    }

    private String chatUrl() {
        String endpoint = props.getChatEndpoint() == null ? "" : props.getChatEndpoint().replaceAll("/$", "");
        return endpoint + "/chat/completions";
    }

    private Map<String, String> headers() {
        return apiKey == null ? Map.of() : Map.of("Authorization", "Bearer " + apiKey);
    }

    private String write(Object body) {
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new BackendFailureException(name(), "serialize request failed", e);
        }
    }
}
