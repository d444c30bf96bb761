package com.deepknow.callbot.websocket;

import com.deepknow.callbot.domain.bridge.service.AudioBridgeService;
import com.deepknow.callbot.domain.bridge.service.BridgeProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import javax.websocket.CloseReason;
import javax.websocket.Session;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AudioBridgeWebSocketHandlerTest {

    private final AudioBridgeService bridge = mock(AudioBridgeService.class);

    @BeforeEach
    void setUp() {
        AudioBridgeWebSocketHandler.setAudioBridgeService(bridge);
        AudioBridgeWebSocketHandler.setScopeResolver(null);
    }

    @AfterEach
    void tearDown() {
        AudioBridgeWebSocketHandler.setAudioBridgeService(null);
        AudioBridgeWebSocketHandler.setInboundToken(null);
        AudioBridgeWebSocketHandler.setAllowUnauthenticated(false);
    }

    @Test
    void parsesAndDecodesQueryParams() {
        Session session = mock(Session.class);
        when(session.getRequestURI()).thenReturn(URI.create("/audio/bridge?token=a%2Bb&scopeId=vs_1&empty="));

        assertThat(AudioBridgeWebSocketHandler.parseQueryParam(session, "token")).isEqualTo("a+b");
        assertThat(AudioBridgeWebSocketHandler.parseQueryParam(session, "scopeId")).isEqualTo("vs_1");
        assertThat(AudioBridgeWebSocketHandler.parseQueryParam(session, "empty")).isEmpty();
        assertThat(AudioBridgeWebSocketHandler.parseQueryParam(session, "agentId")).isNull();
    }

    @Test
    void noQueryYieldsNull() {
        Session session = mock(Session.class);
        when(session.getRequestURI()).thenReturn(URI.create("/audio/bridge"));

        assertThat(AudioBridgeWebSocketHandler.parseQueryParam(session, "token")).isNull();
    }

    @Test
    void comparesTokensExactly() {
        assertThat(AudioBridgeWebSocketHandler.constantTimeEquals("s3cret", "s3cret")).isTrue();
        assertThat(AudioBridgeWebSocketHandler.constantTimeEquals("s3cret", "s3cre")).isFalse();
        assertThat(AudioBridgeWebSocketHandler.constantTimeEquals("s3cret", null)).isFalse();
    }

    @Test
    void unsetInboundTokenClosesWithPolicyViolation() throws Exception {
        Session session = session("/audio/bridge?token=anything", new HashMap<>());

        new AudioBridgeWebSocketHandler().onOpen(session);

        assertThat(closeCode(session)).isEqualTo(CloseReason.CloseCodes.VIOLATED_POLICY.getCode());
        verify(bridge, never()).open(anyString(), any(), any(), any());
    }

    @Test
    void unsetInboundTokenIsAcceptedInUnauthenticatedMode() {
        AudioBridgeWebSocketHandler.setAllowUnauthenticated(true);
        Session session = session("/audio/bridge?scopeId=vs_1", new HashMap<>());

        new AudioBridgeWebSocketHandler().onOpen(session);

        verify(bridge).open(eq("ws-1"), any(), eq("vs_1"), eq(BridgeProtocol.NATIVE));
    }

    @Test
    void wrongTokenClosesWithPolicyViolation() throws Exception {
        AudioBridgeWebSocketHandler.setInboundToken("s3cret");
        Session session = session("/audio/bridge?token=nope", new HashMap<>());

        new AudioBridgeWebSocketHandler().onOpen(session);

        assertThat(closeCode(session)).isEqualTo(CloseReason.CloseCodes.VIOLATED_POLICY.getCode());
        verify(bridge, never()).open(anyString(), any(), any(), any());
    }

    @Test
    void twilioEndpointAuthenticatesByHeaderAndOpensTwilioBridge() {
        AudioBridgeWebSocketHandler.setInboundToken("s3cret");
        Map<String, Object> props = new HashMap<>();
        props.put(TokenHandshakeConfigurator.TOKEN_ATTR, "s3cret");
        Session session = session("/twilio-media", props);

        new TwilioMediaWebSocketHandler().onOpen(session);

        verify(bridge).open(eq("ws-1"), any(), isNull(), eq(BridgeProtocol.TWILIO));
    }

    private static Session session(String uri, Map<String, Object> userProperties) {
        Session session = mock(Session.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.getRequestURI()).thenReturn(URI.create(uri));
        when(session.getUserProperties()).thenReturn(userProperties);
        return session;
    }

    private static int closeCode(Session session) throws Exception {
        ArgumentCaptor<CloseReason> captor = ArgumentCaptor.forClass(CloseReason.class);
        verify(session).close(captor.capture());
        return captor.getValue().getCloseCode().getCode();
    }
}
