package com.deepknow.callbot.websocket;

import javax.websocket.HandshakeResponse;
import javax.websocket.server.HandshakeRequest;
import javax.websocket.server.ServerEndpointConfig;
import java.util.List;

/**
 * 握手阶段把令牌请求头放入会话属性，供 @OnOpen 校验。
 */
public class TokenHandshakeConfigurator extends ServerEndpointConfig.Configurator {
    public static final String TOKEN_HEADER = "X-Callbot-Token";
    static final String TOKEN_ATTR = "callbot.token";

    @Override
    public void modifyHandshake(ServerEndpointConfig sec, HandshakeRequest request, HandshakeResponse response) {
        List<String> values = null;
        for (var entry : request.getHeaders().entrySet()) {
            if (TOKEN_HEADER.equalsIgnoreCase(entry.getKey())) {
                values = entry.getValue();
                break;
            }
        }
        if (values != null && !values.isEmpty()) {
            sec.getUserProperties().put(TOKEN_ATTR, values.get(0));
        } else {
            sec.getUserProperties().remove(TOKEN_ATTR);
        }
    }
}
