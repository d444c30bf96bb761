package com.deepknow.callbot.websocket;

import com.deepknow.callbot.config.AuthProperties;
import com.deepknow.callbot.config.BridgeProperties;
import com.deepknow.callbot.domain.bridge.service.AudioBridgeService;
import com.deepknow.callbot.domain.conversation.ScopeResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;

@Component
public class AudioBridgeServiceInjector {
    private static final Logger log = LoggerFactory.getLogger(AudioBridgeServiceInjector.class);

    private final AudioBridgeService audioBridgeService;
    private final ScopeResolver scopeResolver;
    private final AuthProperties authProperties;
    private final BridgeProperties bridgeProperties;

    public AudioBridgeServiceInjector(AudioBridgeService audioBridgeService,
                                      ScopeResolver scopeResolver,
                                      AuthProperties authProperties,
                                      BridgeProperties bridgeProperties) {
        this.audioBridgeService = audioBridgeService;
        this.scopeResolver = scopeResolver;
        this.authProperties = authProperties;
        this.bridgeProperties = bridgeProperties;
    }

    @PostConstruct
    public void inject() {
        AudioBridgeWebSocketHandler.setAudioBridgeService(audioBridgeService);
        AudioBridgeWebSocketHandler.setScopeResolver(scopeResolver);
        AudioBridgeWebSocketHandler.setInboundToken(authProperties.getInboundWsToken());
        AudioBridgeWebSocketHandler.setAllowUnauthenticated(authProperties.isAllowUnauthenticated());
        if (authProperties.isAllowUnauthenticated()) {
            log.warn("Unauthenticated access enabled; do not use outside local development");
        }
        AudioBridgeWebSocketHandler.setMaxMessageBytes(bridgeProperties.getMaxMessageBytes());
    }
}
