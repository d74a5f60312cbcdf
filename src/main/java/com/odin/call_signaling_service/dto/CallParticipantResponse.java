package com.odin.call_signaling_service.dto;

import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.enums.ParticipantStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CallParticipantResponse {

    private UUID id;
    private UUID callId;
    private String userId;
    private ParticipantRole role;
    private ParticipantStatus status;
    private Instant invitedAt;
    private Instant joinedAt;
    private Instant leftAt;
    private Boolean isMuted;
    private Boolean isVideoEnabled;
    private Boolean isScreenSharing;
    private String connectionQuality;
    private Long durationSeconds;
    private Boolean isOnline;
}
