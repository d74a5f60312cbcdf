package com.odin.call_signaling_service.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.odin.call_signaling_service.enums.CallMode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CallResponse {

    private UUID id;
    private String initiatorId;
    private CallType callType;
    private CallMode callMode;
    private CallStatus status;
    private Integer maxParticipants;
    private Instant startedAt;
    private Instant endedAt;
    private Long durationSeconds;
    private String endedBy;
    private String endReason;
    private Map<String, Object> metadata;
    private Instant createdAt;
    private Instant updatedAt;
    private List<CallParticipantResponse> participants;
    private long activeParticipantCount;
}
