package com.odin.call_signaling_service.dto;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.odin.call_signaling_service.enums.CallMode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.enums.ParticipantStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A call as seen from one user's history: who else was in it and how it went for them.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CallHistoryItem {

    private UUID id;
    private CallType callType;
    private CallMode callMode;
    private CallStatus status;
    private String initiatorId;
    private Boolean isOutgoing;
    private ParticipantRole userRole;
    private ParticipantStatus myStatus;
    private List<String> otherParticipantIds;
    private int participantCount;
    private Instant startedAt;
    private Instant endedAt;
    private Long durationSeconds;
    private String endReason;
}
