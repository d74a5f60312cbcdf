package com.odin.call_signaling_service.utility;

import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.service.ConnectionRegistryService;
import com.odin.call_signaling_service.service.SignalingRelayService;

import lombok.extern.slf4j.Slf4j;

/**
 * Socket lifecycle of {@code /v1/ws/signaling?token=...}: authenticate on open,
 * hand text frames to the relay, unregister on close. The container delivers one
 * connection's frames sequentially, which keeps their relative order.
 */
@Slf4j
@Component
public class SignalingWebSocketHandler implements WebSocketHandler {

    private final JwtUtil jwtUtil;
    private final ConnectionRegistryService connectionRegistryService;
    private final SignalingRelayService signalingRelayService;

    public SignalingWebSocketHandler(JwtUtil jwtUtil,
                                     ConnectionRegistryService connectionRegistryService,
                                     SignalingRelayService signalingRelayService) {
        this.jwtUtil = jwtUtil;
        this.connectionRegistryService = connectionRegistryService;
        this.signalingRelayService = signalingRelayService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String token = getQueryParam(session, ApplicationConstants.TOKEN_QUERY_PARAM);
        Optional<String> userId = jwtUtil.resolveUserId(token);
        if (userId.isEmpty()) {
            log.warn("Invalid or missing token. Closing session: {}", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        boolean firstConnection = connectionRegistryService.connect(session, userId.get());
        connectionRegistryService.sendToConnection(session, SignalingFrames.connected(userId.get()));
        log.info("User {} connected with session {} (firstConnection={})", userId.get(), session.getId(),
                firstConnection);
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) throws Exception {
        String userId = connectionRegistryService.getUserId(session);
        if (userId == null) {
            log.warn("Frame on unregistered session {}, closing", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        CorrelationIdUtil.setCorrelationId(CorrelationIdUtil.generateCorrelationId());
        try {
            if (!(message instanceof TextMessage)) {
                connectionRegistryService.sendToConnection(session, SignalingFrames.error(
                        ApplicationConstants.ERROR_UNSUPPORTED_FRAME, "Only text frames are supported"));
                return;
            }
            String payload = ((TextMessage) message).getPayload();
            log.debug("Frame from userId={} session={} ({} chars)", userId, session.getId(), payload.length());
            signalingRelayService.handleFrame(session, userId, payload);
        } finally {
            CorrelationIdUtil.clear();
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) throws Exception {
        log.error("Transport error for session {} (userId={}): {}", session.getId(),
                connectionRegistryService.getUserId(session), exception.getMessage(), exception);
        if (session.isOpen()) {
            session.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) throws Exception {
        ConnectionRegistryService.Disconnection disconnection = connectionRegistryService.disconnect(session);
        if (disconnection == null) {
            log.debug("Session {} closed before registration ({})", session.getId(), closeStatus);
            return;
        }
        log.info("User {} disconnected session {} with code {} (reason={}, wentOffline={})",
                disconnection.getUserId(), session.getId(), closeStatus.getCode(), closeStatus.getReason(),
                disconnection.isWentOffline());
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    private String getQueryParam(WebSocketSession session, String name) {
        if (session.getUri() == null) {
            return null;
        }
        return UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams().getFirst(name);
    }
}
