package com.odin.call_signaling_service.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.UpdateMediaStateRequest;
import com.odin.call_signaling_service.enums.SignalType;
import com.odin.call_signaling_service.exception.CallServiceException;
import com.odin.call_signaling_service.utility.SignalingFrames;

import lombok.extern.slf4j.Slf4j;

/**
 * Validates, authorizes and forwards signaling frames of one connection.
 *
 * <p>Checks run in a fixed order: JSON, required fields, identifier format, frame
 * type, payload fields, then call membership. Any failure is answered with an
 * {@code error} frame on the originating connection only; nothing is forwarded.
 * The durable participant row is the authority on who may signal into a call.
 */
@Slf4j
@Service
public class SignalingRelayService {

    static final Pattern USER_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_\\-]{1,64}$");

    private final ObjectMapper objectMapper;
    private final ConnectionRegistryService connectionRegistryService;
    private final CallOrchestratorService callOrchestratorService;

    public SignalingRelayService(ObjectMapper objectMapper,
                                 ConnectionRegistryService connectionRegistryService,
                                 CallOrchestratorService callOrchestratorService) {
        this.objectMapper = objectMapper;
        this.connectionRegistryService = connectionRegistryService;
        this.callOrchestratorService = callOrchestratorService;
    }

    public void handleFrame(WebSocketSession session, String userId, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            reject(session, userId, ApplicationConstants.ERROR_INVALID_JSON, "Invalid JSON");
            return;
        }
        if (root == null || !root.isObject()) {
            reject(session, userId, ApplicationConstants.ERROR_INVALID_JSON, "Frame must be a JSON object");
            return;
        }

        String type = text(root, "type");
        if (type == null) {
            reject(session, userId, ApplicationConstants.ERROR_MISSING_FIELDS, "Missing type");
            return;
        }
        if (SignalType.PING.getWireName().equals(type)) {
            connectionRegistryService.sendToConnection(session, SignalingFrames.pong());
            return;
        }

        String rawCallId = text(root, "call_id");
        if (rawCallId == null) {
            reject(session, userId, ApplicationConstants.ERROR_MISSING_FIELDS, "Missing type or call_id");
            return;
        }
        UUID callId = parseUuid(rawCallId);
        if (callId == null) {
            reject(session, userId, ApplicationConstants.ERROR_INVALID_IDENTIFIER, "call_id is not a valid id");
            return;
        }
        String toUserId = text(root, "to_user_id");
        if (toUserId != null && !USER_ID_PATTERN.matcher(toUserId).matches()) {
            reject(session, userId, ApplicationConstants.ERROR_INVALID_IDENTIFIER, "to_user_id is not a valid id");
            return;
        }

        Optional<SignalType> signalType = SignalType.fromWireName(type);
        if (signalType.isEmpty()) {
            reject(session, userId, ApplicationConstants.ERROR_UNKNOWN_TYPE, "Unknown message type: " + type);
            return;
        }

        String missing = missingPayloadField(signalType.get(), root);
        if (missing != null) {
            reject(session, userId, ApplicationConstants.ERROR_MISSING_FIELDS, "Missing " + missing);
            return;
        }

        try {
            if (!isAuthorized(signalType.get(), callId, userId)) {
                reject(session, userId, ApplicationConstants.ERROR_NOT_IN_CALL, "Not an active participant of this call");
                return;
            }
            dispatch(session, signalType.get(), root, callId, userId, toUserId);
        } catch (CallServiceException e) {
            reject(session, userId, e.getErrorCode().getReason(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Signaling frame {} from userId={} for call {} failed: {}", type, userId, callId,
                    ExceptionUtils.getStackTrace(e));
            reject(session, userId, ApplicationConstants.ERROR_INTERNAL, "Internal error");
        }
    }

    private boolean isAuthorized(SignalType type, UUID callId, String userId) {
        if (type == SignalType.LEAVE_CALL) {
            return callOrchestratorService.isParticipant(callId, userId);
        }
        return callOrchestratorService.isJoinedParticipant(callId, userId);
    }

    private void dispatch(WebSocketSession session, SignalType type, JsonNode root, UUID callId, String userId,
                          String toUserId) {
        if (type == SignalType.LEAVE_CALL) {
            connectionRegistryService.removeFromCall(callId, userId);
            connectionRegistryService.sendToCall(SignalingFrames.participantLeft(callId, userId), callId, userId);
            log.info("userId={} left signaling of call {}", userId, callId);
            return;
        }

        connectionRegistryService.addToCall(callId, userId);
        switch (type) {
            case OFFER:
            case ANSWER:
                relay(session, type, callId, userId, toUserId, "sdp", root.get("sdp"));
                break;
            case ICE_CANDIDATE:
                relay(session, type, callId, userId, toUserId, "candidate", root.get("candidate"));
                break;
            case MEDIA_STATE_UPDATE:
                callOrchestratorService.updateMediaState(callId, userId, UpdateMediaStateRequest.builder()
                        .isMuted(flag(root, "is_muted"))
                        .isVideoEnabled(flag(root, "is_video_enabled"))
                        .isScreenSharing(flag(root, "is_screen_sharing"))
                        .build());
                break;
            case JOIN_CALL:
                connectionRegistryService.sendToCall(SignalingFrames.participantJoined(callId, userId), callId, userId);
                log.info("userId={} joined signaling of call {}", userId, callId);
                break;
            default:
                reject(session, userId, ApplicationConstants.ERROR_UNKNOWN_TYPE,
                        "Unknown message type: " + type.getWireName());
        }
    }

    /**
     * Sends an offer, answer or ICE candidate to one peer, or to everyone else in the
     * call when no peer is named.
     */
    private void relay(WebSocketSession session, SignalType type, UUID callId, String userId, String toUserId,
                       String field, JsonNode value) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type.getWireName());
        frame.put(field, value);

        if (toUserId == null) {
            frame.put("call_id", callId.toString());
            frame.put("from_user_id", userId);
            connectionRegistryService.sendToCall(frame, callId, userId);
            return;
        }
        boolean delivered = connectionRegistryService.sendToPeer(frame, userId, toUserId, callId);
        if (!delivered) {
            log.info("{} from userId={} to {} in call {} not delivered", type.getWireName(), userId, toUserId,
                    callId);
            reject(session, userId, ApplicationConstants.ERROR_PEER_UNREACHABLE,
                    "Peer " + toUserId + " is not connected to this call");
        }
    }

    private String missingPayloadField(SignalType type, JsonNode root) {
        if (type.isSessionDescription() && isAbsent(root, "sdp")) {
            return "sdp";
        }
        if (type == SignalType.ICE_CANDIDATE && isAbsent(root, "candidate")) {
            return "candidate";
        }
        if (type == SignalType.MEDIA_STATE_UPDATE && flag(root, "is_muted") == null
                && flag(root, "is_video_enabled") == null && flag(root, "is_screen_sharing") == null) {
            return "media flags";
        }
        return null;
    }

    private void reject(WebSocketSession session, String userId, String code, String message) {
        log.debug("Rejecting frame from userId={}: {} ({})", userId, code, message);
        connectionRegistryService.sendToConnection(session, SignalingFrames.error(code, message));
    }

    private static boolean isAbsent(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    private static Boolean flag(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isBoolean() ? node.booleanValue() : null;
    }

    private static UUID parseUuid(String value) {
        try {
            UUID uuid = UUID.fromString(value);
            return uuid.toString().equalsIgnoreCase(value) ? uuid : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
