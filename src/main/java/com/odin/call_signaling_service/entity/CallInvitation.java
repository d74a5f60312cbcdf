package com.odin.call_signaling_service.entity;

import java.time.Instant;
import java.util.UUID;

import com.odin.call_signaling_service.enums.InvitationStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of an invite into an already active group call. Call membership
 * itself lives on the {@link CallParticipant} row created alongside it.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
public class CallInvitation {

    private UUID id;
    private UUID callId;
    private String invitedUserId;
    private String invitedBy;

    private InvitationStatus status;

    private Instant invitedAt;
    private Instant respondedAt;
    private Instant expiresAt;

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public void respond(InvitationStatus response, Instant now) {
        status = response;
        respondedAt = now;
    }

    public CallInvitation copy() {
        return toBuilder().build();
    }
}
