package com.deepknow.callbot.domain.handoff;

import com.deepknow.callbot.domain.agent.BackendHttp;
import com.deepknow.callbot.domain.agent.HandoffNotice;
import com.deepknow.callbot.domain.agent.HandoffNotifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 转人工 webhook 通知：异步 POST，不等待结果，非 2xx 与异常只记录日志。
 */
public class WebhookHandoffNotifier implements HandoffNotifier {
    private static final Logger log = LoggerFactory.getLogger(WebhookHandoffNotifier.class);

    private final String webhookUrl;
    private final long timeoutMs;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    public WebhookHandoffNotifier(String webhookUrl, long timeoutMs, ObjectMapper mapper) {
        this(webhookUrl, timeoutMs, mapper, HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build());
    }

    WebhookHandoffNotifier(String webhookUrl, long timeoutMs, ObjectMapper mapper, HttpClient httpClient) {
        this.webhookUrl = webhookUrl;
        this.timeoutMs = timeoutMs;
        this.mapper = mapper;
        this.httpClient = httpClient;
    }

    public boolean isEnabled() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    @Override
    public void notifyHandoff(HandoffNotice notice) {
        send(notice);
    }

    /**
     * @return 发送中的请求；未配置 webhook 时为 null
     */
    CompletableFuture<HttpResponse<String>> send(HandoffNotice notice) {
        if (!isEnabled()) {
            return null;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sessionId", notice.getSessionId());
        body.put("reason", notice.getReason().code());
        body.put("text", notice.getText());
        body.put("createdAt", notice.getCreatedAt().toString());
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            log.error("Handoff webhook serialize failed: sessionId={}", notice.getSessionId(), e);
            return null;
        }

        HttpRequest req = HttpRequest.newBuilder(URI.create(webhookUrl))
                .timeout(Duration.ofMillis(timeoutMs))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return httpClient.sendAsync(req, HttpResponse.BodyHandlers.ofString())
                .whenComplete((resp, ex) -> {
                    if (ex != null) {
                        log.error("Handoff webhook request failed: sessionId={} reason={}", notice.getSessionId(), notice.getReason().code(), ex);
                    } else if (resp.statusCode() / 100 != 2) {
                        log.warn("Handoff webhook returned non-2xx: status={} body=\"{}\" sessionId={}",
                                resp.statusCode(), BackendHttp.preview(resp.body(), 200), notice.getSessionId());
                    } else {
                        log.info("Handoff webhook sent: sessionId={} reason={}", notice.getSessionId(), notice.getReason().code());
                    }
                });
    }
}
