package com.odin.call_signaling_service.utility;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.dto.CallHistoryItem;
import com.odin.call_signaling_service.dto.CallParticipantResponse;
import com.odin.call_signaling_service.dto.CallResponse;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.entity.CallParticipant;
import com.odin.call_signaling_service.service.ConnectionRegistryService;

import lombok.RequiredArgsConstructor;

/**
 * Maps call aggregates to the snake_case shapes clients see over REST and on the socket.
 */
@Component
@RequiredArgsConstructor
public class CallResponseMapper {

    private final ConnectionRegistryService connectionRegistryService;
    private final Clock clock;

    public CallResponse toResponse(Call call) {
        Instant now = clock.instant();
        List<CallParticipantResponse> participants = call.getParticipants().stream()
                .map(p -> toParticipantResponse(p, now))
                .collect(Collectors.toList());
        return CallResponse.builder()
                .id(call.getId())
                .initiatorId(call.getInitiatorId())
                .callType(call.getCallType())
                .callMode(call.getCallMode())
                .status(call.getStatus())
                .maxParticipants(call.getMaxParticipants())
                .startedAt(call.getStartedAt())
                .endedAt(call.getEndedAt())
                .durationSeconds(call.getDurationSeconds())
                .endedBy(call.getEndedBy())
                .endReason(call.getEndReason())
                .metadata(call.getMetadata())
                .createdAt(call.getCreatedAt())
                .updatedAt(call.getUpdatedAt())
                .participants(participants)
                .activeParticipantCount(call.getJoinedParticipantCount())
                .build();
    }

    public List<CallResponse> toResponses(List<Call> calls) {
        return calls.stream().map(this::toResponse).collect(Collectors.toList());
    }

    public CallParticipantResponse toParticipantResponse(CallParticipant participant) {
        return toParticipantResponse(participant, clock.instant());
    }

    private CallParticipantResponse toParticipantResponse(CallParticipant participant, Instant now) {
        return CallParticipantResponse.builder()
                .id(participant.getId())
                .callId(participant.getCallId())
                .userId(participant.getUserId())
                .role(participant.getRole())
                .status(participant.getStatus())
                .invitedAt(participant.getInvitedAt())
                .joinedAt(participant.getJoinedAt())
                .leftAt(participant.getLeftAt())
                .isMuted(participant.isMuted())
                .isVideoEnabled(participant.isVideoEnabled())
                .isScreenSharing(participant.isScreenSharing())
                .connectionQuality(participant.getConnectionQuality())
                .durationSeconds(participant.getDurationSeconds(now))
                .isOnline(connectionRegistryService.isOnline(participant.getUserId()))
                .build();
    }

    public CallHistoryItem toHistoryItem(Call call, String userId) {
        return CallHistoryItem.builder()
                .id(call.getId())
                .callType(call.getCallType())
                .callMode(call.getCallMode())
                .status(call.getStatus())
                .initiatorId(call.getInitiatorId())
                .isOutgoing(userId.equals(call.getInitiatorId()))
                .userRole(call.findParticipant(userId).map(CallParticipant::getRole).orElse(null))
                .myStatus(call.findParticipant(userId).map(CallParticipant::getStatus).orElse(null))
                .participantCount(call.getParticipants().size())
                .otherParticipantIds(call.getParticipantUserIds().stream()
                        .filter(id -> !id.equals(userId))
                        .collect(Collectors.toList()))
                .startedAt(call.getStartedAt())
                .endedAt(call.getEndedAt())
                .durationSeconds(call.getDurationSeconds())
                .endReason(call.getEndReason())
                .build();
    }
}
