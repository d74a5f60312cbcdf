package com.odin.call_signaling_service.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.enums.ParticipantStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One user's membership in a call. Rows are never deleted, only moved to a
 * terminal status.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class CallParticipant {

    private UUID id;
    private UUID callId;
    private String userId;

    private ParticipantRole role;
    private ParticipantStatus status;

    private Instant invitedAt;
    private Instant joinedAt;
    private Instant leftAt;

    private boolean muted;
    private boolean videoEnabled;
    private boolean screenSharing;
    private String connectionQuality;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    public boolean isJoined() {
        return status == ParticipantStatus.JOINED;
    }

    public boolean isRinging() {
        return status == ParticipantStatus.RINGING;
    }

    /**
     * Seconds spent in the call; {@code null} until the participant has joined.
     */
    public Long getDurationSeconds(Instant now) {
        if (joinedAt == null) {
            return null;
        }
        Instant end = leftAt != null ? leftAt : now;
        return Duration.between(joinedAt, end).getSeconds();
    }

    public void join(Instant now) {
        status = ParticipantStatus.JOINED;
        joinedAt = now;
        updatedAt = now;
    }

    public void leave(Instant now) {
        status = ParticipantStatus.LEFT;
        leftAt = now;
        updatedAt = now;
    }

    public void markStatus(ParticipantStatus newStatus, Instant now) {
        status = newStatus;
        updatedAt = now;
    }

    public CallParticipant copy() {
        CallParticipant copy = toBuilder().build();
        copy.setMetadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata));
        return copy;
    }
}
