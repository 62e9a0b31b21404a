package com.ai.prescreening.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import com.ai.prescreening.websocket.CallStreamHandler;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final CallStreamHandler callStreamHandler;

    public WebSocketConfig(CallStreamHandler callStreamHandler) {
        this.callStreamHandler = callStreamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(callStreamHandler, "/call-stream")
                .setAllowedOrigins("*");
    }
}
