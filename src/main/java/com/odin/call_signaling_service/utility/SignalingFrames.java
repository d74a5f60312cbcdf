package com.odin.call_signaling_service.utility;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallResponse;
import com.odin.call_signaling_service.dto.IceServer;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.entity.CallParticipant;

/**
 * Server-to-client frames. Keys are snake_case and ids are strings.
 */
public final class SignalingFrames {

    private SignalingFrames() {
    }

    public static Map<String, Object> connected(String userId) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_CONNECTED);
        frame.put("user_id", userId);
        frame.put("message", "WebSocket connected successfully");
        return frame;
    }

    public static Map<String, Object> pong() {
        return frame(ApplicationConstants.EVENT_PONG);
    }

    public static Map<String, Object> error(String code, String message) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_ERROR);
        frame.put("code", code);
        frame.put("message", message);
        return frame;
    }

    public static Map<String, Object> incomingCall(CallResponse call, List<IceServer> iceServers) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_INCOMING_CALL);
        frame.put("call_id", call.getId().toString());
        frame.put("call", call);
        frame.put("ice_servers", iceServers);
        return frame;
    }

    public static Map<String, Object> participantJoined(UUID callId, String userId) {
        return participantEvent(ApplicationConstants.EVENT_PARTICIPANT_JOINED, callId, userId);
    }

    public static Map<String, Object> participantLeft(UUID callId, String userId) {
        return participantEvent(ApplicationConstants.EVENT_PARTICIPANT_LEFT, callId, userId);
    }

    public static Map<String, Object> participantDeclined(UUID callId, String userId, String reason) {
        Map<String, Object> frame = participantEvent(ApplicationConstants.EVENT_PARTICIPANT_DECLINED, callId, userId);
        frame.put("reason", reason);
        return frame;
    }

    public static Map<String, Object> participantInvited(UUID callId, String invitedBy, Collection<String> userIds) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_PARTICIPANT_INVITED);
        frame.put("call_id", callId.toString());
        frame.put("invited_by", invitedBy);
        frame.put("user_ids", userIds);
        return frame;
    }

    /**
     * Terminal notification. A call without an end reason reports its status instead.
     */
    public static Map<String, Object> callEnded(Call call) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_CALL_ENDED);
        frame.put("call_id", call.getId().toString());
        frame.put("status", call.getStatus().getValue());
        frame.put("reason", call.getEndReason() != null ? call.getEndReason() : call.getStatus().getValue());
        frame.put("ended_by", call.getEndedBy());
        frame.put("duration_seconds", call.getDurationSeconds());
        return frame;
    }

    public static Map<String, Object> callMissed(Call call) {
        Map<String, Object> frame = frame(ApplicationConstants.EVENT_CALL_MISSED);
        frame.put("call_id", call.getId().toString());
        frame.put("caller_id", call.getInitiatorId());
        frame.put("call_type", call.getCallType().getValue());
        return frame;
    }

    public static Map<String, Object> mediaStateUpdate(UUID callId, CallParticipant participant) {
        return mediaStateUpdate(callId, participant.getUserId(), participant.isMuted(),
                participant.isVideoEnabled(), participant.isScreenSharing());
    }

    public static Map<String, Object> mediaStateUpdate(UUID callId, String userId, Boolean muted,
                                                       Boolean videoEnabled, Boolean screenSharing) {
        Map<String, Object> frame = participantEvent(ApplicationConstants.EVENT_MEDIA_STATE_UPDATE, callId, userId);
        frame.put("is_muted", muted);
        frame.put("is_video_enabled", videoEnabled);
        frame.put("is_screen_sharing", screenSharing);
        return frame;
    }

    private static Map<String, Object> participantEvent(String type, UUID callId, String userId) {
        Map<String, Object> frame = frame(type);
        frame.put("call_id", callId.toString());
        frame.put("user_id", userId);
        return frame;
    }

    private static Map<String, Object> frame(String type) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type);
        return frame;
    }
}
