package com.odin.call_signaling_service.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

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
 * Call aggregate: the call row together with its participants and invitations.
 * The store reads and writes it as one unit, guarded by {@link #version}.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class Call {

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

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private Instant updatedAt;

    private long version;

    @Builder.Default
    private List<CallParticipant> participants = new ArrayList<>();

    @Builder.Default
    private List<CallInvitation> invitations = new ArrayList<>();

    public boolean isLive() {
        return status != null && status.isLive();
    }

    public boolean isGroupCall() {
        return callMode == CallMode.GROUP;
    }

    public Optional<CallParticipant> findParticipant(String userId) {
        return participants.stream()
                .filter(p -> p.getUserId().equals(userId))
                .findFirst();
    }

    public boolean hasParticipant(String userId) {
        return findParticipant(userId).isPresent();
    }

    public long countParticipants(ParticipantStatus status) {
        return participants.stream().filter(p -> p.getStatus() == status).count();
    }

    public long getJoinedParticipantCount() {
        return countParticipants(ParticipantStatus.JOINED);
    }

    /** Rows still holding a seat: ringing or joined. */
    public long getOccupiedSeatCount() {
        return participants.stream()
                .filter(p -> p.isRinging() || p.isJoined())
                .count();
    }

    public List<CallParticipant> getInvitees() {
        return participants.stream()
                .filter(p -> p.getRole() == ParticipantRole.PARTICIPANT)
                .collect(Collectors.toList());
    }

    public List<String> getParticipantUserIds() {
        return participants.stream().map(CallParticipant::getUserId).collect(Collectors.toList());
    }

    public Optional<CallInvitation> findPendingInvitation(String userId) {
        return invitations.stream()
                .filter(i -> i.getInvitedUserId().equals(userId) && i.isPending())
                .findFirst();
    }

    /**
     * Moves the call to a terminal status. Duration is only recorded for calls
     * that were actually connected.
     */
    public void terminate(CallStatus terminalStatus, String endedByUser, String reason, Instant now) {
        if (status == CallStatus.ACTIVE && startedAt != null) {
            durationSeconds = Duration.between(startedAt, now).getSeconds();
        }
        status = terminalStatus;
        endedAt = now;
        endedBy = endedByUser;
        endReason = reason;
        updatedAt = now;
    }

    public Call copy() {
        Call copy = toBuilder().build();
        copy.setMetadata(metadata == null ? new HashMap<>() : new HashMap<>(metadata));
        copy.setParticipants(participants.stream().map(CallParticipant::copy).collect(Collectors.toCollection(ArrayList::new)));
        copy.setInvitations(invitations.stream().map(CallInvitation::copy).collect(Collectors.toCollection(ArrayList::new)));
        return copy;
    }
}
