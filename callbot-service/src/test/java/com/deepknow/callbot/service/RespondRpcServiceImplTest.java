package com.deepknow.callbot.service;

import com.deepknow.callbot.api.request.RespondRequest;
import com.deepknow.callbot.api.response.RespondResponse;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import com.deepknow.callbot.domain.conversation.model.Answer;
import com.deepknow.callbot.domain.conversation.model.ExchangeMetrics;
import com.deepknow.callbot.domain.conversation.model.ExchangeRequest;
import com.deepknow.callbot.domain.conversation.model.ExchangeResult;
import com.deepknow.callbot.domain.conversation.model.HandoffReason;
import com.deepknow.callbot.domain.conversation.service.AssistantService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RespondRpcServiceImplTest {

    private final AssistantService assistantService = mock(AssistantService.class);
    private final ScopeResolver scopeResolver = mock(ScopeResolver.class);
    private final RespondRpcServiceImpl service = new RespondRpcServiceImpl(assistantService, scopeResolver);

    @Test
    void mapsAnswerToResponse() {
        when(scopeResolver.resolve("vs_1", "a1", null)).thenReturn("vs_1");
        when(assistantService.respond(any())).thenAnswer(inv -> {
            ExchangeRequest r = inv.getArgument(0);
            return ExchangeResult.completed(r.getSessionId(), Answer.answer("We open at nine.", List.of("doc-1")), new ExchangeMetrics());
        });
        RespondRequest req = new RespondRequest();
        req.setText("When do you open?");
        req.setSessionId("s1");
        req.setScopeId("vs_1");
        req.setAgentId("a1");
        req.setNoCache(true);

        RespondResponse resp = service.respond(req);

        assertThat(resp.getSessionId()).isEqualTo("s1");
        assertThat(resp.getDecision()).isEqualTo("answer");
        assertThat(resp.getReply()).isEqualTo("We open at nine.");
        assertThat(resp.getCitations()).isInstanceOf(ArrayList.class).containsExactly("doc-1");
        ArgumentCaptor<ExchangeRequest> captor = ArgumentCaptor.forClass(ExchangeRequest.class);
        verify(assistantService).respond(captor.capture());
        assertThat(captor.getValue().isBypassCache()).isTrue();
        assertThat(captor.getValue().getScopeId()).isEqualTo("vs_1");
    }

    @Test
    void generatesSessionIdAndMapsHandoff() {
        when(assistantService.respond(any())).thenAnswer(inv -> {
            ExchangeRequest r = inv.getArgument(0);
            return ExchangeResult.completed(r.getSessionId(), Answer.handoff("transfer", HandoffReason.NO_SCOPE), new ExchangeMetrics());
        });
        RespondRequest req = new RespondRequest();
        req.setText("hi");

        RespondResponse resp = service.respond(req);

        assertThat(resp.getSessionId()).isNotBlank();
        assertThat(resp.getDecision()).isEqualTo("handoff");
        assertThat(resp.getCitations()).isEmpty();
    }

    @Test
    void rejectsMissingText() {
        assertThatThrownBy(() -> service.respond(new RespondRequest())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.respond(null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(assistantService);
    }
}
