package com.odin.call_signaling_service.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.dto.CallResponse;
import com.odin.call_signaling_service.dto.IceServer;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.entity.CallParticipant;
import com.odin.call_signaling_service.utility.CallResponseMapper;
import com.odin.call_signaling_service.utility.SignalingFrames;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes call lifecycle events to connected users and falls back to push
 * notifications for users with no open connection. Called after a state change is
 * committed; a delivery problem is logged and never rolls the change back.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallNotificationService {

    private final ConnectionRegistryService connectionRegistryService;
    private final CallResponseMapper callResponseMapper;
    private final WebRtcConfigService webRtcConfigService;
    private final KafkaNotificationService kafkaNotificationService;

    public void callInitiated(Call call) {
        connectionRegistryService.addToCall(call.getId(), call.getInitiatorId());
        notifyInvitees(call, call.getInvitees().stream()
                .map(CallParticipant::getUserId)
                .collect(Collectors.toList()));
    }

    public void participantJoined(Call call, String userId) {
        connectionRegistryService.addToCall(call.getId(), userId);
        safely(call, () -> connectionRegistryService.sendToCall(
                SignalingFrames.participantJoined(call.getId(), userId), call.getId(), userId));
    }

    public void participantDeclined(Call call, String userId, String reason) {
        safely(call, () -> connectionRegistryService.sendToCall(
                SignalingFrames.participantDeclined(call.getId(), userId, reason), call.getId(), userId));
        if (!call.isLive()) {
            callEnded(call);
        }
    }

    public void participantLeft(Call call, String userId) {
        connectionRegistryService.removeFromCall(call.getId(), userId);
        if (!call.isLive()) {
            callEnded(call);
            return;
        }
        safely(call, () -> connectionRegistryService.sendToCall(
                SignalingFrames.participantLeft(call.getId(), userId), call.getId(), userId));
    }

    public void participantsInvited(Call call, String inviterId, List<CallParticipant> invited) {
        if (invited.isEmpty()) {
            return;
        }
        List<String> userIds = invited.stream().map(CallParticipant::getUserId).collect(Collectors.toList());
        notifyInvitees(call, userIds);
        safely(call, () -> connectionRegistryService.sendToCall(
                SignalingFrames.participantInvited(call.getId(), inviterId, userIds), call.getId(), inviterId));
    }

    public void mediaStateChanged(Call call, CallParticipant participant) {
        safely(call, () -> connectionRegistryService.sendToCall(
                SignalingFrames.mediaStateUpdate(call.getId(), participant), call.getId(), participant.getUserId()));
    }

    /**
     * Tells every participant, joined or not, that the call is over, then drops
     * the call's signaling membership.
     */
    public void callEnded(Call call) {
        Map<String, Object> frame = SignalingFrames.callEnded(call);
        for (String userId : call.getParticipantUserIds()) {
            safely(call, () -> connectionRegistryService.sendPersonalMessage(frame, userId));
        }
        connectionRegistryService.clearCall(call.getId());
        log.info("Call {} finished with status={} reason={}", call.getId(), call.getStatus().getValue(),
                call.getEndReason());
    }

    public void callMissed(Call call, Collection<String> missedUserIds) {
        Map<String, Object> frame = SignalingFrames.callMissed(call);
        for (String userId : missedUserIds) {
            int delivered = deliver(call, frame, userId);
            if (delivered == 0) {
                kafkaNotificationService.publishMissedCall(userId, call);
            }
        }
        if (!call.isLive()) {
            callEnded(call);
        }
    }

    private void notifyInvitees(Call call, List<String> inviteeIds) {
        CallResponse response = callResponseMapper.toResponse(call);
        List<IceServer> iceServers = webRtcConfigService.getIceServers();
        Map<String, Object> frame = SignalingFrames.incomingCall(response, iceServers);
        for (String inviteeId : inviteeIds) {
            int delivered = deliver(call, frame, inviteeId);
            if (delivered == 0) {
                log.info("Invitee {} of call {} has no open connection, sending push", inviteeId, call.getId());
                kafkaNotificationService.publishIncomingCall(inviteeId, call);
            }
        }
    }

    private int deliver(Call call, Map<String, Object> frame, String userId) {
        try {
            return connectionRegistryService.sendPersonalMessage(frame, userId);
        } catch (RuntimeException e) {
            log.error("Failed to deliver {} for call {} to userId={}: {}", frame.get("type"), call.getId(), userId,
                    ExceptionUtils.getStackTrace(e));
            return 0;
        }
    }

    private void safely(Call call, Runnable delivery) {
        try {
            delivery.run();
        } catch (RuntimeException e) {
            log.error("Event delivery for call {} failed: {}", call.getId(), ExceptionUtils.getStackTrace(e));
        }
    }
}
