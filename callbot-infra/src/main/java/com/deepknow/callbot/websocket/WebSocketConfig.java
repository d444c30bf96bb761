package com.deepknow.callbot.websocket;

import org.springframework.boot.web.servlet.ServletContextInitializer;
import org.springframework.context.annotation.Configuration;

import javax.servlet.ServletContext;
import javax.servlet.ServletException;
import javax.websocket.server.ServerContainer;

@Configuration
public class WebSocketConfig implements ServletContextInitializer {

    @Override
    public void onStartup(ServletContext servletContext) throws ServletException {
        Object attr = servletContext.getAttribute("javax.websocket.server.ServerContainer");
        if (attr instanceof ServerContainer) {
            ServerContainer container = (ServerContainer) attr;
            try {
                container.addEndpoint(AudioBridgeWebSocketHandler.class);
                container.addEndpoint(TwilioMediaWebSocketHandler.class);
            } catch (Exception e) {
                // 记录但不抛出，HTTP 接口仍可用
                servletContext.log("Failed to register audio bridge endpoints: " + e.getMessage());
            }
        }
    }
}
