package com.deepknow.callbot.service;

import com.deepknow.callbot.api.RespondRpcService;
import com.deepknow.callbot.api.request.RespondRequest;
import com.deepknow.callbot.api.response.RespondResponse;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.service.AssistantService;
import org.apache.dubbo.config.annotation.DubboService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.UUID;

@DubboService
@Service
public class RespondRpcServiceImpl implements RespondRpcService {
    private static final Logger log = LoggerFactory.getLogger(RespondRpcServiceImpl.class);

    private final AssistantService assistantService;
    private final ScopeResolver scopeResolver;

    public RespondRpcServiceImpl(AssistantService assistantService, ScopeResolver scopeResolver) {
        this.assistantService = assistantService;
        this.scopeResolver = scopeResolver;
    }

    @Override
    public RespondResponse respond(RespondRequest req) {
        if (req == null || req.getText() == null) {
            throw new IllegalArgumentException("text is required");
        }
        String sessionId = req.getSessionId() == null || req.getSessionId().isBlank()
                ? UUID.randomUUID().toString() : req.getSessionId();
        String scopeId = scopeResolver.resolve(req.getScopeId(), req.getAgentId(), req.getTenantCode());
        log.debug("RPC respond: sessionId={} scopeId={} noCache={}", sessionId, scopeId, req.isNoCache());

        ExchangeResult result = assistantService.respond(new ExchangeRequest(sessionId, req.getText(), scopeId, req.isNoCache()));
        Answer answer = result.getAnswer();
        RespondResponse resp = new RespondResponse();
        resp.setSessionId(result.getSessionId());
        resp.setDecision(answer.getDecision().wireName());
        resp.setReply(answer.getText());
        // 不可变列表在部分序列化协议下无法反序列化
        resp.setCitations(new ArrayList<>(answer.getCitations()));
        return resp;
    }
}
