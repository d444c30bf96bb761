package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.common.CancellationToken;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.ExchangeMetrics;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.service.AssistantService;
import com.deepknow.callbot.web.dto.RespondBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * 问答 HTTP 接口：阻塞 JSON、SSE 推送（X-Stream: true 或 /stream）与带指标的调试接口。
 */
@RestController
@RequestMapping("/api/respond")
public class RespondController {
    private static final Logger log = LoggerFactory.getLogger(RespondController.class);
    private static final Set<String> TRUE_FLAGS = Set.of("1", "true", "yes", "on");
    static final int MAX_TEXT_CHARS = 2000;
    static final int MAX_ID_CHARS = 128;

    private final AssistantService assistantService;
    private final ScopeResolver scopeResolver;
    private final ExecutorService streamExchangeExecutor;

    public RespondController(AssistantService assistantService,
                             ScopeResolver scopeResolver,
                             @Qualifier("streamExchangeExecutor") ExecutorService streamExchangeExecutor) {
        this.assistantService = assistantService;
        this.scopeResolver = scopeResolver;
        this.streamExchangeExecutor = streamExchangeExecutor;
    }

    @PostMapping
    public Object respond(@RequestBody RespondBody body,
                          @RequestHeader(value = "X-Stream", required = false) String stream,
                          @RequestHeader(value = "X-Bypass-Cache", required = false) String bypassHeader,
                          @RequestParam(value = "no_cache", required = false) String noCache) {
        ExchangeRequest request = toRequest(body, bypassHeader, noCache);
        if (isTrue(stream)) {
            return stream(request);
        }
        ExchangeResult result = assistantService.respond(request);
        return toResponse(result, false);
    }

    @RequestMapping(value = "/stream", method = {RequestMethod.GET, RequestMethod.POST})
    public SseEmitter respondStream(RespondBody body,
                                    @RequestHeader(value = "X-Bypass-Cache", required = false) String bypassHeader,
                                    @RequestParam(value = "no_cache", required = false) String noCache) {
        return stream(toRequest(body, bypassHeader, noCache));
    }

    @PostMapping("/debug")
    public Map<String, Object> respondDebug(@RequestBody RespondBody body,
                                            @RequestHeader(value = "X-Bypass-Cache", required = false) String bypassHeader,
                                            @RequestParam(value = "no_cache", required = false) String noCache) {
        ExchangeResult result = assistantService.respond(toRequest(body, bypassHeader, noCache));
        return toResponse(result, true);
    }

    private SseEmitter stream(ExchangeRequest request) {
        SseEmitter emitter = new SseEmitter(0L);
        CancellationToken token = CancellationToken.create();
        emitter.onCompletion(() -> token.cancel(CancellationToken.REASON_CLIENT_CLOSED));
        emitter.onTimeout(() -> token.cancel(CancellationToken.REASON_CLIENT_CLOSED));
        emitter.onError(e -> token.cancel(CancellationToken.REASON_CLIENT_CLOSED));
        SseExchangeSink sink = new SseExchangeSink(emitter, request.getSessionId());
        try {
            streamExchangeExecutor.execute(() -> {
                try {
                    ExchangeResult result = assistantService.stream(request, sink, token);
                    if (result.isCancelled()) {
                        log.info("Respond stream aborted: sessionId={}", request.getSessionId());
                    }
                    emitter.complete();
                } catch (RuntimeException e) {
                    log.error("Respond stream failed: sessionId={}", request.getSessionId(), e);
                    emitter.completeWithError(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Stream executor saturated, reject: sessionId={}", request.getSessionId());
            throw e;
        }
        return emitter;
    }

    ExchangeRequest toRequest(RespondBody body, String bypassHeader, String noCacheParam) {
        if (body == null || body.getText() == null) {
            throw new InvalidRequestException("text is required");
        }
        if (body.getText().length() > MAX_TEXT_CHARS) {
            throw new InvalidRequestException("text is too long");
        }
        checkId("sessionId", body.getSessionId());
        checkId("agentId", body.getAgentId());
        checkId("tenantCode", body.getTenantCode());
        checkId("scopeId", body.getScopeId());

        String sessionId = body.getSessionId() == null || body.getSessionId().isBlank()
                ? UUID.randomUUID().toString() : body.getSessionId();
        String scopeId = scopeResolver.resolve(body.getScopeId(), body.getAgentId(), body.getTenantCode());
        boolean bypass = isTrue(bypassHeader) || isTrue(noCacheParam) || isTrue(body.getNoCache());
        return new ExchangeRequest(sessionId, body.getText(), scopeId, bypass);
    }

    private static void checkId(String name, String value) {
        if (value != null && value.length() > MAX_ID_CHARS) {
            throw new InvalidRequestException(name + " is too long");
        }
    }

    static boolean isTrue(String flag) {
        return flag != null && TRUE_FLAGS.contains(flag.trim().toLowerCase(Locale.ROOT));
    }

    private static Map<String, Object> toResponse(ExchangeResult result, boolean debug) {
        Answer answer = result.getAnswer();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sessionId", result.getSessionId());
        out.put("decision", answer.getDecision().wireName());
        out.put("reply", answer.getText());
        out.put("citations", answer.getCitations());
        if (debug) {
            ExchangeMetrics m = result.getMetrics();
            if (answer.getHandoffReason() != null) {
                out.put("reason", answer.getHandoffReason().code());
            }
            Map<String, Object> metrics = new LinkedHashMap<>();
            metrics.put("cacheHit", m.isCacheHit());
            metrics.put("cacheBypass", m.isCacheBypass());
            metrics.put("inflightJoined", m.isInflightJoined());
            metrics.put("cleanMs", m.getCleanMs());
            metrics.put("backendMs", m.getBackendMs());
            metrics.put("totalMs", m.getTotalMs());
            out.put("metrics", metrics);
        }
        return out;
    }
}
