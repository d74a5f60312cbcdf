package com.odin.call_signaling_service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import com.odin.call_signaling_service.utility.SignalingWebSocketHandler;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SignalingWebSocketHandler signalingWebSocketHandler;
    private final SignalingProperties signalingProperties;

    public WebSocketConfig(SignalingWebSocketHandler signalingWebSocketHandler,
                           SignalingProperties signalingProperties) {
        this.signalingWebSocketHandler = signalingWebSocketHandler;
        this.signalingProperties = signalingProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(signalingWebSocketHandler, signalingProperties.getPath())
                .addInterceptors(new WebSocketLoggingInterceptor())
                .setAllowedOriginPatterns(signalingProperties.getAllowedOrigins().toArray(new String[0]));

        log.info("WebSocket handler registered - Path: {}, Handler: SignalingWebSocketHandler",
                signalingProperties.getPath());
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(signalingProperties.getMaxTextMessageSize());
        container.setMaxBinaryMessageBufferSize(signalingProperties.getMaxTextMessageSize());
        return container;
    }
}
