package com.odin.call_signaling_service.config;

import com.odin.call_signaling_service.utility.CorrelationIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.util.Map;

/**
 * Tags each signaling upgrade with a handshake id so the upgrade and its outcome can be
 * matched in the logs. The query string is never logged since it carries the token.
 */
@Slf4j
public class WebSocketLoggingInterceptor implements HandshakeInterceptor {

    public static final String HANDSHAKE_ID_ATTRIBUTE = "handshakeId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String handshakeId = CorrelationIdUtil.generateCorrelationId();
        attributes.put(HANDSHAKE_ID_ATTRIBUTE, handshakeId);
        log.debug("[{}] Signaling upgrade on {} from {}", handshakeId, request.getURI().getPath(),
                request.getRemoteAddress());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception == null) {
            return;
        }
        log.error("Signaling upgrade on {} from {} failed: {}", request.getURI().getPath(),
                request.getRemoteAddress(), exception.getMessage(), exception);
    }
}
