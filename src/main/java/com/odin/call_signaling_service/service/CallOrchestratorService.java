package com.odin.call_signaling_service.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.CallInitiateRequest;
import com.odin.call_signaling_service.dto.UpdateMediaStateRequest;
import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.entity.CallInvitation;
import com.odin.call_signaling_service.entity.CallPage;
import com.odin.call_signaling_service.entity.CallParticipant;
import com.odin.call_signaling_service.enums.CallMode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.CallType;
import com.odin.call_signaling_service.enums.InvitationStatus;
import com.odin.call_signaling_service.enums.ParticipantRole;
import com.odin.call_signaling_service.enums.ParticipantStatus;
import com.odin.call_signaling_service.exception.CallServiceException;
import com.odin.call_signaling_service.exception.ErrorCode;
import com.odin.call_signaling_service.repo.CallRepository;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Call state machine. Every transition of an existing call runs under that call's
 * lock and is persisted with a versioned save; creating a call runs under the locks
 * of every user involved. Events go out only after the lock is released.
 */
@Slf4j
@Service
public class CallOrchestratorService {

    private final CallRepository callRepository;
    private final CallLockManager callLockManager;
    private final ProfileService profileService;
    private final CallNotificationService callNotificationService;
    private final CallProperties callProperties;
    private final Clock clock;

    public CallOrchestratorService(CallRepository callRepository,
                                   CallLockManager callLockManager,
                                   ProfileService profileService,
                                   CallNotificationService callNotificationService,
                                   CallProperties callProperties,
                                   Clock clock) {
        this.callRepository = callRepository;
        this.callLockManager = callLockManager;
        this.profileService = profileService;
        this.callNotificationService = callNotificationService;
        this.callProperties = callProperties;
        this.clock = clock;
    }

    // ============================================
    // Initiation
    // ============================================

    public Call initiateCall(String initiatorId, CallInitiateRequest request) {
        List<String> inviteeIds = validateInitiate(initiatorId, request);

        List<String> unavailable = profileService.findUnavailable(inviteeIds);
        if (!unavailable.isEmpty()) {
            log.warn("initiateCall: participants not found or inactive: {}", unavailable);
            throw new CallServiceException(ErrorCode.PARTICIPANT_NOT_FOUND,
                    "One or more participants not found: " + unavailable);
        }

        List<String> involved = new ArrayList<>(inviteeIds);
        involved.add(initiatorId);
        Call created = callLockManager.withUserLocks(involved, () -> {
            for (String inviteeId : inviteeIds) {
                Optional<Call> existing = callRepository.findLiveOneOnOneBetween(initiatorId, inviteeId);
                if (existing.isPresent()) {
                    log.info("initiateCall: {} and {} already share live call {}", initiatorId, inviteeId,
                            existing.get().getId());
                    throw new CallServiceException(ErrorCode.ALREADY_IN_CALL,
                            "User " + inviteeId + " is in another call");
                }
            }
            return callRepository.insert(newCall(initiatorId, inviteeIds, request));
        });

        log.info("Call {} initiated by {} ({} {}, invitees={})", created.getId(), initiatorId,
                created.getCallMode().getValue(), created.getCallType().getValue(), inviteeIds);
        callNotificationService.callInitiated(created);
        return created;
    }

    private List<String> validateInitiate(String initiatorId, CallInitiateRequest request) {
        if (request == null || request.getParticipantIds() == null || request.getParticipantIds().isEmpty()) {
            throw validation("At least one participant is required");
        }
        List<String> inviteeIds = request.getParticipantIds();
        if (inviteeIds.size() > callProperties.getMaxParticipants()) {
            throw validation("At most " + callProperties.getMaxParticipants() + " participants are allowed");
        }
        if (inviteeIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw validation("Participant ids must not be blank");
        }
        if (new HashSet<>(inviteeIds).size() != inviteeIds.size()) {
            throw validation("Participant ids must be unique");
        }
        if (request.getCallType() == null) {
            throw validation("call_type is required");
        }
        Integer maxParticipants = request.getMaxParticipants();
        if (maxParticipants != null
                && (maxParticipants < 2 || maxParticipants > callProperties.getMaxParticipants())) {
            throw validation("max_participants must be between 2 and " + callProperties.getMaxParticipants());
        }
        if (inviteeIds.contains(initiatorId)) {
            throw new CallServiceException(ErrorCode.CANNOT_CALL_SELF, "Cannot call yourself");
        }
        if (maxParticipants != null && CallMode.forInviteeCount(inviteeIds.size()) == CallMode.GROUP
                && inviteeIds.size() + 1 > maxParticipants) {
            throw new CallServiceException(ErrorCode.EXCEEDS_MAX_PARTICIPANTS,
                    "Call would have " + (inviteeIds.size() + 1) + " participants, limit is " + maxParticipants);
        }
        return inviteeIds;
    }

    private Call newCall(String initiatorId, List<String> inviteeIds, CallInitiateRequest request) {
        Instant now = clock.instant();
        UUID callId = UUID.randomUUID();
        CallMode mode = CallMode.forInviteeCount(inviteeIds.size());
        boolean video = request.getCallType() == CallType.VIDEO;

        Call call = Call.builder()
                .id(callId)
                .initiatorId(initiatorId)
                .callType(request.getCallType())
                .callMode(mode)
                .status(CallStatus.RINGING)
                .maxParticipants(mode == CallMode.GROUP ? request.getMaxParticipants() : null)
                .startedAt(now)
                .metadata(request.getMetadata() == null ? new HashMap<>() : new HashMap<>(request.getMetadata()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        CallParticipant initiator = newParticipant(callId, initiatorId, ParticipantRole.INITIATOR, video, now);
        initiator.join(now);
        call.getParticipants().add(initiator);
        for (String inviteeId : inviteeIds) {
            call.getParticipants().add(newParticipant(callId, inviteeId, ParticipantRole.PARTICIPANT, video, now));
        }
        return call;
    }

    private CallParticipant newParticipant(UUID callId, String userId, ParticipantRole role, boolean video,
                                           Instant now) {
        return CallParticipant.builder()
                .id(UUID.randomUUID())
                .callId(callId)
                .userId(userId)
                .role(role)
                .status(ParticipantStatus.RINGING)
                .invitedAt(now)
                .videoEnabled(video)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // ============================================
    // Call actions
    // ============================================

    public Call answerCall(UUID callId, String userId, Map<String, Object> metadata) {
        Call answered = callLockManager.withCallLock(callId, () -> {
            Instant now = clock.instant();
            Call call = loadForUpdate(callId, now);
            if (!call.isLive()) {
                throw new CallServiceException(ErrorCode.INVALID_CALL_STATE,
                        "Cannot join call with status: " + call.getStatus().getValue());
            }
            CallParticipant participant = call.findParticipant(userId)
                    .orElseThrow(() -> new CallServiceException(ErrorCode.NOT_A_PARTICIPANT, "Not a participant"));
            if (!participant.isRinging()) {
                throw new CallServiceException(ErrorCode.CANNOT_ANSWER_NOW, "Cannot answer now");
            }

            participant.join(now);
            if (metadata != null) {
                participant.getMetadata().putAll(metadata);
            }
            if (call.getStatus() == CallStatus.RINGING) {
                call.setStatus(CallStatus.ACTIVE);
            }
            call.findPendingInvitation(userId).ifPresent(i -> i.respond(InvitationStatus.ACCEPTED, now));
            call.setUpdatedAt(now);
            return callRepository.save(call);
        });

        log.info("Call {} answered by {} (status={})", callId, userId, answered.getStatus().getValue());
        callNotificationService.participantJoined(answered, userId);
        return answered;
    }

    public Call declineCall(UUID callId, String userId, String reason) {
        String declineReason = reason == null || reason.isBlank() ? ApplicationConstants.REASON_DECLINED : reason;
        Call declined = callLockManager.withCallLock(callId, () -> {
            Instant now = clock.instant();
            Call call = loadForUpdate(callId, now);
            if (!call.isLive()) {
                throw new CallServiceException(ErrorCode.INVALID_CALL_STATE,
                        "Cannot decline call with status: " + call.getStatus().getValue());
            }
            CallParticipant participant = call.findParticipant(userId)
                    .filter(CallParticipant::isRinging)
                    .orElseThrow(() -> new CallServiceException(ErrorCode.CANNOT_DECLINE, "Cannot decline"));

            participant.markStatus(ParticipantStatus.DECLINED, now);
            call.findPendingInvitation(userId).ifPresent(i -> i.respond(InvitationStatus.DECLINED, now));

            if (call.isGroupCall()) {
                if (allInviteesUnanswered(call)) {
                    call.terminate(CallStatus.DECLINED, null, ApplicationConstants.REASON_ALL_DECLINED, now);
                }
            } else {
                call.terminate(CallStatus.DECLINED, userId, null, now);
            }
            call.setUpdatedAt(now);
            return callRepository.save(call);
        });

        log.info("Call {} declined by {} (reason={}, status={})", callId, userId, declineReason,
                declined.getStatus().getValue());
        callNotificationService.participantDeclined(declined, userId, declineReason);
        return declined;
    }

    public Call endCall(UUID callId, String userId, String reason) {
        String endReason = reason == null || reason.isBlank() ? ApplicationConstants.REASON_USER_HANGUP : reason;
        Transition transition = callLockManager.withCallLock(callId, () -> {
            Instant now = clock.instant();
            Call call = loadForUpdate(callId, now);
            CallParticipant participant = call.findParticipant(userId)
                    .orElseThrow(() -> new CallServiceException(ErrorCode.NOT_A_PARTICIPANT, "Not a participant"));
            if (!call.isLive()) {
                return new Transition(call, false);
            }

            boolean wasJoined = participant.isJoined();
            if (wasJoined) {
                participant.leave(now);
            }
            if (call.isGroupCall()) {
                boolean othersJoined = call.getParticipants().stream()
                        .anyMatch(p -> p.isJoined() && !p.getUserId().equals(userId));
                if (!othersJoined) {
                    markRingingMissed(call, userId, now);
                    call.terminate(CallStatus.ENDED, userId, ApplicationConstants.REASON_ALL_LEFT, now);
                }
            } else {
                for (CallParticipant other : call.getParticipants()) {
                    if (other.getUserId().equals(userId)) {
                        continue;
                    }
                    if (other.isJoined()) {
                        other.leave(now);
                    }
                }
                markRingingMissed(call, userId, now);
                call.terminate(CallStatus.ENDED, userId, endReason, now);
            }
            if (!wasJoined && call.isLive()) {
                return new Transition(call, false);
            }
            if (participant.isRinging()) {
                // Hanging up while still ringing counts as a decline.
                participant.markStatus(ParticipantStatus.DECLINED, now);
                call.findPendingInvitation(userId).ifPresent(i -> i.respond(InvitationStatus.DECLINED, now));
            }
            call.setUpdatedAt(now);
            return new Transition(callRepository.save(call), true);
        });

        Call ended = transition.getCall();
        if (!transition.isChanged()) {
            log.debug("endCall: nothing to do for {} on call {} (status={})", userId, callId,
                    ended.getStatus().getValue());
            return ended;
        }
        log.info("Call {} left by {} (status={}, reason={})", callId, userId, ended.getStatus().getValue(),
                ended.getEndReason());
        callNotificationService.participantLeft(ended, userId);
        return ended;
    }

    private void markRingingMissed(Call call, String exceptUserId, Instant now) {
        for (CallParticipant p : call.getParticipants()) {
            if (p.isRinging() && !p.getUserId().equals(exceptUserId)) {
                p.markStatus(ParticipantStatus.MISSED, now);
                call.findPendingInvitation(p.getUserId()).ifPresent(i -> i.respond(InvitationStatus.EXPIRED, now));
            }
        }
    }

    // ============================================
    // Group call management
    // ============================================

    /**
     * Adds users to an active group call. Users already on the roster are skipped.
     *
     * @return the participant rows created by this request
     */
    public List<CallParticipant> inviteToCall(UUID callId, String inviterId, List<String> userIds) {
        if (userIds == null || userIds.isEmpty() || userIds.size() > callProperties.getMaxInviteBatch()) {
            throw validation("Between 1 and " + callProperties.getMaxInviteBatch() + " user ids are required");
        }
        if (userIds.stream().anyMatch(id -> id == null || id.isBlank())) {
            throw validation("User ids must not be blank");
        }

        List<String> candidates = peekNewInvitees(callId, inviterId, userIds);
        List<String> unavailable = profileService.findUnavailable(candidates);
        if (!unavailable.isEmpty()) {
            throw new CallServiceException(ErrorCode.PARTICIPANT_NOT_FOUND,
                    "One or more users not found: " + unavailable);
        }

        Outcome outcome = callLockManager.withCallLock(callId, () -> {
            Instant now = clock.instant();
            Call call = loadForUpdate(callId, now);
            checkCanInvite(call, inviterId);

            List<String> newIds = newInvitees(call, userIds);
            if (newIds.isEmpty()) {
                return new Outcome(call, new ArrayList<>());
            }
            if (call.getMaxParticipants() != null
                    && call.getOccupiedSeatCount() + newIds.size() > call.getMaxParticipants()) {
                throw new CallServiceException(ErrorCode.EXCEEDS_MAX_PARTICIPANTS,
                        "Call is limited to " + call.getMaxParticipants() + " participants");
            }

            boolean video = call.getCallType() == CallType.VIDEO;
            Instant expiresAt = now.plusSeconds(callProperties.getInvitationTtlSeconds());
            List<UUID> createdIds = new ArrayList<>();
            for (String newId : newIds) {
                CallParticipant participant = newParticipant(callId, newId, ParticipantRole.PARTICIPANT, video, now);
                call.getParticipants().add(participant);
                createdIds.add(participant.getId());
                call.getInvitations().add(CallInvitation.builder()
                        .id(UUID.randomUUID())
                        .callId(callId)
                        .invitedUserId(newId)
                        .invitedBy(inviterId)
                        .status(InvitationStatus.PENDING)
                        .invitedAt(now)
                        .expiresAt(expiresAt)
                        .build());
            }
            call.setUpdatedAt(now);
            Call saved = callRepository.save(call);
            List<CallParticipant> created = saved.getParticipants().stream()
                    .filter(p -> createdIds.contains(p.getId()))
                    .collect(Collectors.toList());
            return new Outcome(saved, created);
        });

        if (!outcome.getParticipants().isEmpty()) {
            log.info("{} invited {} to call {}", inviterId,
                    outcome.getParticipants().stream().map(CallParticipant::getUserId).collect(Collectors.toList()),
                    callId);
            callNotificationService.participantsInvited(outcome.getCall(), inviterId, outcome.getParticipants());
        }
        return outcome.getParticipants();
    }

    /**
     * Checks invite preconditions without the lock, so the user directory is never
     * queried while a call lock is held. Re-checked under the lock.
     */
    private List<String> peekNewInvitees(UUID callId, String inviterId, List<String> userIds) {
        Call call = callRepository.findById(callId)
                .orElseThrow(() -> new CallServiceException(ErrorCode.CALL_NOT_FOUND, "Call not found"));
        checkCanInvite(call, inviterId);
        return newInvitees(call, userIds);
    }

    private void checkCanInvite(Call call, String inviterId) {
        if (!call.isGroupCall() || call.getStatus() != CallStatus.ACTIVE) {
            throw new CallServiceException(ErrorCode.INVALID_CALL_STATE, "Invalid call state");
        }
        boolean inviterJoined = call.findParticipant(inviterId).map(CallParticipant::isJoined).orElse(false);
        if (!inviterJoined) {
            throw new CallServiceException(ErrorCode.INVITER_NOT_ACTIVE, "Must be active to invite");
        }
    }

    private List<String> newInvitees(Call call, List<String> userIds) {
        Set<String> unique = new LinkedHashSet<>(userIds);
        return unique.stream().filter(id -> !call.hasParticipant(id)).collect(Collectors.toList());
    }

    // ============================================
    // Media state
    // ============================================

    public CallParticipant updateMediaState(UUID callId, String userId, UpdateMediaStateRequest request) {
        Transition transition = callLockManager.withCallLock(callId, () -> {
            Instant now = clock.instant();
            Call call = loadForUpdate(callId, now);
            CallParticipant participant = call.findParticipant(userId)
                    .filter(p -> call.isLive() && p.isJoined())
                    .orElseThrow(() -> new CallServiceException(ErrorCode.PARTICIPANT_NOT_FOUND,
                            "Participant not found"));
            if (request == null || request.isEmpty()) {
                return new Transition(call, false);
            }
            if (request.getIsMuted() != null) {
                participant.setMuted(request.getIsMuted());
            }
            if (request.getIsVideoEnabled() != null) {
                participant.setVideoEnabled(request.getIsVideoEnabled());
            }
            if (request.getIsScreenSharing() != null) {
                participant.setScreenSharing(request.getIsScreenSharing());
            }
            participant.setUpdatedAt(now);
            return new Transition(callRepository.save(call), true);
        });

        CallParticipant updated = transition.getCall().findParticipant(userId)
                .orElseThrow(() -> new IllegalStateException("Participant vanished from call " + callId));
        if (transition.isChanged()) {
            log.debug("Media state of {} in call {}: muted={}, video={}, screen={}", userId, callId,
                    updated.isMuted(), updated.isVideoEnabled(), updated.isScreenSharing());
            callNotificationService.mediaStateChanged(transition.getCall(), updated);
        }
        return updated;
    }

    // ============================================
    // Queries
    // ============================================

    public Call getCall(UUID callId, String userId) {
        Call call = callRepository.findById(callId)
                .orElseThrow(() -> new CallServiceException(ErrorCode.CALL_NOT_FOUND, "Call not found"));
        if (!call.hasParticipant(userId)) {
            throw new CallServiceException(ErrorCode.ACCESS_DENIED, "Access denied");
        }
        expireDueInvitations(call, clock.instant());
        return call;
    }

    public CallPage getCallHistory(String userId, Integer limit, Integer offset) {
        int pageLimit = limit == null ? callProperties.getHistoryDefaultLimit() : limit;
        int pageOffset = offset == null ? 0 : offset;
        if (pageLimit < 1 || pageLimit > callProperties.getHistoryMaxLimit()) {
            throw validation("limit must be between 1 and " + callProperties.getHistoryMaxLimit());
        }
        if (pageOffset < 0) {
            throw validation("offset must not be negative");
        }
        List<Call> calls = callRepository.findByParticipant(userId, pageLimit, pageOffset);
        long total = callRepository.countByParticipant(userId);
        return new CallPage(calls, total, pageLimit, pageOffset);
    }

    public List<Call> getActiveCalls(String userId) {
        return callRepository.findLiveForUser(userId);
    }

    /**
     * True when the user's row in a live call is joined. This is what authorizes
     * signaling frames.
     */
    public boolean isJoinedParticipant(UUID callId, String userId) {
        return callRepository.findById(callId)
                .filter(Call::isLive)
                .flatMap(call -> call.findParticipant(userId))
                .map(CallParticipant::isJoined)
                .orElse(false);
    }

    public boolean isParticipant(UUID callId, String userId) {
        return callRepository.findById(callId).map(call -> call.hasParticipant(userId)).orElse(false);
    }

    // ============================================
    // Sweeps
    // ============================================

    /**
     * Expires pending invitations whose deadline has passed.
     *
     * @return number of invitations expired
     */
    public int expirePendingInvitations() {
        Instant now = clock.instant();
        int expired = 0;
        for (Call candidate : callRepository.findAllLive()) {
            boolean due = candidate.getInvitations().stream().anyMatch(i -> i.isPending() && i.isExpiredAt(now));
            if (!due) {
                continue;
            }
            try {
                expired += callLockManager.withCallLock(candidate.getId(), () -> {
                    Call call = callRepository.findById(candidate.getId()).orElse(null);
                    if (call == null) {
                        return 0;
                    }
                    int count = expireDueInvitations(call, now);
                    if (count > 0) {
                        callRepository.save(call);
                    }
                    return count;
                });
            } catch (CallServiceException e) {
                log.warn("Invitation sweep skipped call {}: {}", candidate.getId(), e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expired {} pending invitations", expired);
        }
        return expired;
    }

    /**
     * Marks participants that have been ringing longer than the configured timeout
     * as missed, ending calls nobody can answer any more. No-op unless enabled.
     *
     * @return number of participants marked missed
     */
    public int timeOutRingingParticipants() {
        if (!callProperties.isRingTimeoutEnabled()) {
            return 0;
        }
        Instant now = clock.instant();
        Instant cutoff = now.minus(Duration.ofSeconds(callProperties.getRingTimeoutSeconds()));
        int missed = 0;
        for (Call candidate : callRepository.findAllLive()) {
            boolean due = candidate.getParticipants().stream().anyMatch(p -> isRingingSince(p, cutoff));
            if (!due) {
                continue;
            }
            try {
                Outcome outcome = callLockManager.withCallLock(candidate.getId(),
                        () -> timeOutRinging(candidate.getId(), cutoff, now));
                if (outcome != null && !outcome.getParticipants().isEmpty()) {
                    missed += outcome.getParticipants().size();
                    callNotificationService.callMissed(outcome.getCall(), outcome.getParticipants().stream()
                            .map(CallParticipant::getUserId)
                            .collect(Collectors.toList()));
                }
            } catch (CallServiceException e) {
                log.warn("Ring timeout sweep skipped call {}: {}", candidate.getId(), e.getMessage());
            }
        }
        if (missed > 0) {
            log.info("Timed out {} ringing participants", missed);
        }
        return missed;
    }

    private Outcome timeOutRinging(UUID callId, Instant cutoff, Instant now) {
        Call call = callRepository.findById(callId).orElse(null);
        if (call == null || !call.isLive()) {
            return null;
        }
        List<CallParticipant> timedOut = call.getParticipants().stream()
                .filter(p -> isRingingSince(p, cutoff))
                .collect(Collectors.toList());
        if (timedOut.isEmpty()) {
            return null;
        }
        for (CallParticipant p : timedOut) {
            p.markStatus(ParticipantStatus.MISSED, now);
            call.findPendingInvitation(p.getUserId()).ifPresent(i -> i.respond(InvitationStatus.EXPIRED, now));
        }
        boolean unanswerable = !call.isGroupCall()
                || (call.getStatus() == CallStatus.RINGING && allInviteesUnanswered(call));
        if (unanswerable) {
            call.terminate(CallStatus.MISSED, null, ApplicationConstants.REASON_NO_ANSWER, now);
        }
        call.setUpdatedAt(now);
        Call saved = callRepository.save(call);
        Set<String> timedOutIds = timedOut.stream().map(CallParticipant::getUserId).collect(Collectors.toSet());
        List<CallParticipant> savedRows = saved.getParticipants().stream()
                .filter(p -> timedOutIds.contains(p.getUserId()))
                .collect(Collectors.toList());
        return new Outcome(saved, savedRows);
    }

    private boolean isRingingSince(CallParticipant participant, Instant cutoff) {
        return participant.isRinging() && participant.getInvitedAt() != null
                && !participant.getInvitedAt().isAfter(cutoff);
    }

    // ============================================
    // Helpers
    // ============================================

    private Call loadForUpdate(UUID callId, Instant now) {
        Call call = callRepository.findById(callId)
                .orElseThrow(() -> new CallServiceException(ErrorCode.CALL_NOT_FOUND, "Call not found"));
        expireDueInvitations(call, now);
        return call;
    }

    private int expireDueInvitations(Call call, Instant now) {
        int count = 0;
        for (CallInvitation invitation : call.getInvitations()) {
            if (invitation.isPending() && invitation.isExpiredAt(now)) {
                invitation.respond(InvitationStatus.EXPIRED, now);
                count++;
            }
        }
        return count;
    }

    private boolean allInviteesUnanswered(Call call) {
        return call.getInvitees().stream().allMatch(p -> p.getStatus().isUnanswered());
    }

    private CallServiceException validation(String message) {
        return new CallServiceException(ErrorCode.VALIDATION_ERROR, message);
    }

    @Getter
    @AllArgsConstructor
    private static class Transition {
        private final Call call;
        private final boolean changed;
    }

    /**
     * A call together with the participant rows an operation touched.
     */
    @Getter
    @AllArgsConstructor
    private static class Outcome {
        private final Call call;
        private final List<CallParticipant> participants;
    }
}
