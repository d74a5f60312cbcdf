package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.odin.call_signaling_service.config.CallProperties;
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
import com.odin.call_signaling_service.repo.InMemoryCallRepository;
import com.odin.call_signaling_service.support.MutableClock;

class CallOrchestratorServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryCallRepository repository;
    private ProfileService profileService;
    private CallNotificationService notifications;
    private CallProperties properties;
    private MutableClock clock;
    private CallOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCallRepository();
        profileService = mock(ProfileService.class);
        notifications = mock(CallNotificationService.class);
        properties = new CallProperties();
        clock = new MutableClock(T0);
        orchestrator = new CallOrchestratorService(repository, new CallLockManager(properties), profileService,
                notifications, properties, clock);
    }

    private Call initiate(String initiatorId, CallType type, Integer maxParticipants, String... inviteeIds) {
        return orchestrator.initiateCall(initiatorId, CallInitiateRequest.builder()
                .participantIds(List.of(inviteeIds))
                .callType(type)
                .maxParticipants(maxParticipants)
                .build());
    }

    private static ParticipantStatus statusOf(Call call, String userId) {
        return call.findParticipant(userId).orElseThrow().getStatus();
    }

    private static void assertRejected(ThrowingCallable action, ErrorCode errorCode) {
        assertThatThrownBy(action)
                .isInstanceOf(CallServiceException.class)
                .extracting(e -> ((CallServiceException) e).getErrorCode())
                .isEqualTo(errorCode);
    }

    // ---- initiation ----

    @Test
    void oneOnOneCallStartsRingingWithInitiatorJoined() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertThat(call.getCallMode()).isEqualTo(CallMode.ONE_ON_ONE);
        assertThat(call.getStatus()).isEqualTo(CallStatus.RINGING);
        assertThat(call.getParticipants()).hasSize(2);
        CallParticipant initiator = call.findParticipant("u1").orElseThrow();
        assertThat(initiator.getRole()).isEqualTo(ParticipantRole.INITIATOR);
        assertThat(initiator.getStatus()).isEqualTo(ParticipantStatus.JOINED);
        assertThat(initiator.getJoinedAt()).isEqualTo(T0);
        CallParticipant callee = call.findParticipant("u2").orElseThrow();
        assertThat(callee.getRole()).isEqualTo(ParticipantRole.PARTICIPANT);
        assertThat(callee.getStatus()).isEqualTo(ParticipantStatus.RINGING);
        assertThat(call.getMaxParticipants()).isNull();
        assertThat(call.getStartedAt()).isEqualTo(T0);
        verify(notifications).callInitiated(any(Call.class));
    }

    @Test
    void videoCallEnablesVideoForEveryRow() {
        Call call = initiate("u1", CallType.VIDEO, 5, "u2", "u3");

        assertThat(call.getCallMode()).isEqualTo(CallMode.GROUP);
        assertThat(call.getMaxParticipants()).isEqualTo(5);
        assertThat(call.getParticipants()).allMatch(CallParticipant::isVideoEnabled);
        assertThat(call.getParticipants()).noneMatch(CallParticipant::isMuted);
    }

    @Test
    void cannotCallYourself() {
        assertRejected(() -> initiate("u1", CallType.AUDIO, null, "u1"), ErrorCode.CANNOT_CALL_SELF);
        verify(notifications, never()).callInitiated(any());
    }

    @Test
    void initiationValidatesTheRoster() {
        assertRejected(() -> orchestrator.initiateCall("u1", CallInitiateRequest.builder()
                .participantIds(List.of()).callType(CallType.AUDIO).build()), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> initiate("u1", CallType.AUDIO, null, "u2", "u2"), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> initiate("u1", CallType.AUDIO, null, "u2", " "), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> initiate("u1", null, null, "u2"), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> initiate("u1", CallType.AUDIO, 1, "u2", "u3"), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> initiate("u1", CallType.AUDIO, 2, "u2", "u3"), ErrorCode.EXCEEDS_MAX_PARTICIPANTS);
        assertThat(repository.findAllLive()).isEmpty();
    }

    @Test
    void unknownOrInactiveInviteeRejectsTheWholeCall() {
        when(profileService.findUnavailable(anyCollection())).thenReturn(List.of("ghost"));

        assertRejected(() -> initiate("u1", CallType.AUDIO, null, "u2", "ghost"), ErrorCode.PARTICIPANT_NOT_FOUND);
        assertThat(repository.findAllLive()).isEmpty();
    }

    @Test
    void secondLiveOneOnOneBetweenSamePairConflicts() {
        initiate("u1", CallType.AUDIO, null, "u2");

        assertRejected(() -> initiate("u2", CallType.VIDEO, null, "u1"), ErrorCode.ALREADY_IN_CALL);
        assertThat(initiate("u1", CallType.AUDIO, null, "u3").getStatus()).isEqualTo(CallStatus.RINGING);
    }

    // ---- answer / decline ----

    @Test
    void answeringFlipsCallToActiveAndMergesMetadata() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");
        clock.advance(Duration.ofSeconds(5));

        Call answered = orchestrator.answerCall(call.getId(), "u2", Map.of("device", "phone"));

        assertThat(answered.getStatus()).isEqualTo(CallStatus.ACTIVE);
        CallParticipant callee = answered.findParticipant("u2").orElseThrow();
        assertThat(callee.getStatus()).isEqualTo(ParticipantStatus.JOINED);
        assertThat(callee.getJoinedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(callee.getMetadata()).containsEntry("device", "phone");
        verify(notifications).participantJoined(any(Call.class), eq("u2"));
    }

    @Test
    void answerIsRejectedForOutsidersAndRepeatAnswers() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertRejected(() -> orchestrator.answerCall(call.getId(), "u9", null), ErrorCode.NOT_A_PARTICIPANT);
        assertRejected(() -> orchestrator.answerCall(call.getId(), "u1", null), ErrorCode.CANNOT_ANSWER_NOW);
        orchestrator.answerCall(call.getId(), "u2", null);
        assertRejected(() -> orchestrator.answerCall(call.getId(), "u2", null), ErrorCode.CANNOT_ANSWER_NOW);
        assertRejected(() -> orchestrator.answerCall(UUID.randomUUID(), "u2", null), ErrorCode.CALL_NOT_FOUND);
    }

    @Test
    void oneOnOneDeclineEndsTheCallWithoutEndReason() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");
        clock.advance(Duration.ofSeconds(3));

        Call declined = orchestrator.declineCall(call.getId(), "u2", null);

        assertThat(declined.getStatus()).isEqualTo(CallStatus.DECLINED);
        assertThat(declined.getEndedBy()).isEqualTo("u2");
        assertThat(declined.getEndedAt()).isEqualTo(T0.plusSeconds(3));
        assertThat(declined.getEndReason()).isNull();
        assertThat(declined.getDurationSeconds()).isNull();
        assertThat(statusOf(declined, "u2")).isEqualTo(ParticipantStatus.DECLINED);
        assertThat(statusOf(declined, "u1")).isEqualTo(ParticipantStatus.JOINED);
        verify(notifications).participantDeclined(any(Call.class), eq("u2"), eq("declined"));
    }

    @Test
    void declineAfterCallEndedIsRejected() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");
        orchestrator.declineCall(call.getId(), "u2", "busy");

        assertRejected(() -> orchestrator.declineCall(call.getId(), "u2", null), ErrorCode.INVALID_CALL_STATE);
        assertRejected(() -> orchestrator.answerCall(call.getId(), "u2", null), ErrorCode.INVALID_CALL_STATE);
    }

    @Test
    void groupCallEndsOnlyWhenEveryInviteeDeclined() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");

        Call afterFirst = orchestrator.declineCall(call.getId(), "u2", null);
        assertThat(afterFirst.getStatus()).isEqualTo(CallStatus.RINGING);

        Call afterSecond = orchestrator.declineCall(call.getId(), "u3", null);
        assertThat(afterSecond.getStatus()).isEqualTo(CallStatus.DECLINED);
        assertThat(afterSecond.getEndReason()).isEqualTo("all_declined");
        assertThat(afterSecond.getEndedBy()).isNull();
    }

    @Test
    void answeredInviteeCannotDecline() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);

        assertRejected(() -> orchestrator.declineCall(call.getId(), "u2", null), ErrorCode.CANNOT_DECLINE);
        assertRejected(() -> orchestrator.declineCall(call.getId(), "u9", null), ErrorCode.CANNOT_DECLINE);
    }

    // ---- end ----

    @Test
    void hangingUpAnswered1on1CallRecordsDuration() {
        Call call = initiate("u1", CallType.VIDEO, null, "u2");
        orchestrator.answerCall(call.getId(), "u2", null);
        clock.advance(Duration.ofSeconds(30));

        Call ended = orchestrator.endCall(call.getId(), "u1", null);

        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(ended.getEndedBy()).isEqualTo("u1");
        assertThat(ended.getEndReason()).isEqualTo("user_hangup");
        assertThat(ended.getDurationSeconds()).isEqualTo(30L);
        assertThat(statusOf(ended, "u1")).isEqualTo(ParticipantStatus.LEFT);
        assertThat(statusOf(ended, "u2")).isEqualTo(ParticipantStatus.LEFT);
        verify(notifications).participantLeft(any(Call.class), eq("u1"));
    }

    @Test
    void cancellingUnanswered1on1CallMarksCalleeMissed() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        Call ended = orchestrator.endCall(call.getId(), "u1", "cancelled");

        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(ended.getEndReason()).isEqualTo("cancelled");
        assertThat(ended.getDurationSeconds()).isNull();
        assertThat(statusOf(ended, "u2")).isEqualTo(ParticipantStatus.MISSED);
    }

    @Test
    void calleeHangingUpWhileRingingMarksTheirRowDeclined() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        Call ended = orchestrator.endCall(call.getId(), "u2", null);

        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(ended.getEndedBy()).isEqualTo("u2");
        assertThat(statusOf(ended, "u1")).isEqualTo(ParticipantStatus.LEFT);
        assertThat(statusOf(ended, "u2")).isEqualTo(ParticipantStatus.DECLINED);
        assertThat(ended.getParticipants()).noneMatch(CallParticipant::isRinging);
        assertThat(repository.findById(call.getId()).orElseThrow().getParticipants())
                .noneMatch(CallParticipant::isRinging);
    }

    @Test
    void ringingGroupMemberHangingUpChangesNothing() {
        Call call = initiate("u1", CallType.AUDIO, 5, "u2", "u3");
        Call answered = orchestrator.answerCall(call.getId(), "u2", null);

        Call result = orchestrator.endCall(call.getId(), "u3", null);

        assertThat(result.getStatus()).isEqualTo(CallStatus.ACTIVE);
        assertThat(statusOf(result, "u3")).isEqualTo(ParticipantStatus.RINGING);
        assertThat(repository.findById(call.getId()).orElseThrow().getVersion()).isEqualTo(answered.getVersion());
        verify(notifications, never()).participantLeft(any(Call.class), anyString());
    }

    @Test
    void racingAnswerAndEndAlwaysLeavesTheCallEnded() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 50; round++) {
                Call call = initiate("u1", CallType.AUDIO, null, "u2");
                CountDownLatch start = new CountDownLatch(1);
                Future<Call> answer = pool.submit(() -> {
                    start.await();
                    return orchestrator.answerCall(call.getId(), "u2", null);
                });
                Future<Call> end = pool.submit(() -> {
                    start.await();
                    return orchestrator.endCall(call.getId(), "u1", null);
                });
                start.countDown();

                boolean answered = succeeded(answer);
                assertThat(end.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(CallStatus.ENDED);

                Call stored = repository.findById(call.getId()).orElseThrow();
                assertThat(stored.getStatus()).isEqualTo(CallStatus.ENDED);
                assertThat(statusOf(stored, "u1")).isEqualTo(ParticipantStatus.LEFT);
                assertThat(statusOf(stored, "u2"))
                        .isEqualTo(answered ? ParticipantStatus.LEFT : ParticipantStatus.MISSED);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static boolean succeeded(Future<Call> future) throws Exception {
        try {
            future.get(10, TimeUnit.SECONDS);
            return true;
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(CallServiceException.class);
            return false;
        }
    }

    @Test
    void endingAFinishedCallIsANoOp() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");
        Call first = orchestrator.endCall(call.getId(), "u1", null);

        Call second = orchestrator.endCall(call.getId(), "u2", "again");

        assertThat(second.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(second.getEndReason()).isEqualTo(first.getEndReason());
        assertThat(second.getEndedBy()).isEqualTo("u1");
        assertThat(second.getVersion()).isEqualTo(first.getVersion());
        verify(notifications, times(1)).participantLeft(any(Call.class), anyString());
    }

    @Test
    void outsiderCannotEndACall() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertRejected(() -> orchestrator.endCall(call.getId(), "u9", null), ErrorCode.NOT_A_PARTICIPANT);
        assertRejected(() -> orchestrator.endCall(UUID.randomUUID(), "u1", null), ErrorCode.CALL_NOT_FOUND);
    }

    @Test
    void groupCallActivatesOnFirstAnswerAndKeepsOthersRinging() {
        Call call = initiate("u1", CallType.VIDEO, 3, "u2", "u3");

        Call answered = orchestrator.answerCall(call.getId(), "u2", null);

        assertThat(answered.getStatus()).isEqualTo(CallStatus.ACTIVE);
        assertThat(statusOf(answered, "u3")).isEqualTo(ParticipantStatus.RINGING);
    }

    @Test
    void groupCallStaysActiveUntilTheLastJoinedParticipantLeaves() {
        Call call = initiate("u1", CallType.VIDEO, 3, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        orchestrator.answerCall(call.getId(), "u3", null);

        assertThat(orchestrator.endCall(call.getId(), "u2", null).getStatus()).isEqualTo(CallStatus.ACTIVE);
        assertThat(orchestrator.endCall(call.getId(), "u3", null).getStatus()).isEqualTo(CallStatus.ACTIVE);

        Call ended = orchestrator.endCall(call.getId(), "u1", null);
        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(ended.getEndReason()).isEqualTo("all_left");
        assertThat(ended.getEndedBy()).isEqualTo("u1");
        assertThat(ended.getParticipants()).allMatch(p -> p.getStatus() == ParticipantStatus.LEFT);
    }

    @Test
    void lastLeaverOfGroupCallMarksStillRingingInviteesMissed() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        orchestrator.endCall(call.getId(), "u1", null);

        Call ended = orchestrator.endCall(call.getId(), "u2", null);

        assertThat(ended.getStatus()).isEqualTo(CallStatus.ENDED);
        assertThat(statusOf(ended, "u3")).isEqualTo(ParticipantStatus.MISSED);
    }

    // ---- invite ----

    @Test
    void inviteIntoFullGroupCallIsRejected() {
        Call call = initiate("u1", CallType.VIDEO, 3, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);

        assertRejected(() -> orchestrator.inviteToCall(call.getId(), "u1", List.of("u4")),
                ErrorCode.EXCEEDS_MAX_PARTICIPANTS);
        assertThat(repository.findById(call.getId()).orElseThrow().getParticipants()).hasSize(3);
    }

    @Test
    void inviteAddsRingingRowsAndPendingInvitations() {
        Call call = initiate("u1", CallType.VIDEO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);

        List<CallParticipant> invited = orchestrator.inviteToCall(call.getId(), "u2", List.of("u4", "u5", "u4"));

        assertThat(invited).extracting(CallParticipant::getUserId).containsExactly("u4", "u5");
        assertThat(invited).allMatch(p -> p.isRinging() && p.isVideoEnabled());
        Call stored = repository.findById(call.getId()).orElseThrow();
        assertThat(stored.getInvitations()).hasSize(2).allSatisfy(invitation -> {
            assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.PENDING);
            assertThat(invitation.getInvitedBy()).isEqualTo("u2");
            assertThat(invitation.getExpiresAt()).isEqualTo(T0.plusSeconds(properties.getInvitationTtlSeconds()));
        });
        verify(notifications).participantsInvited(any(Call.class), eq("u2"), anyList());
    }

    @Test
    void reInvitingExistingParticipantsChangesNothing() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        long version = repository.findById(call.getId()).orElseThrow().getVersion();

        assertThat(orchestrator.inviteToCall(call.getId(), "u1", List.of("u2", "u3"))).isEmpty();

        assertThat(repository.findById(call.getId()).orElseThrow().getVersion()).isEqualTo(version);
        verify(notifications, never()).participantsInvited(any(), anyString(), anyList());
    }

    @Test
    void inviteRequiresActiveGroupCallAndJoinedInviter() {
        Call oneOnOne = initiate("u1", CallType.AUDIO, null, "u2");
        orchestrator.answerCall(oneOnOne.getId(), "u2", null);
        assertRejected(() -> orchestrator.inviteToCall(oneOnOne.getId(), "u1", List.of("u4")),
                ErrorCode.INVALID_CALL_STATE);

        Call group = initiate("u5", CallType.AUDIO, null, "u6", "u7");
        assertRejected(() -> orchestrator.inviteToCall(group.getId(), "u5", List.of("u8")),
                ErrorCode.INVALID_CALL_STATE);

        orchestrator.answerCall(group.getId(), "u6", null);
        assertRejected(() -> orchestrator.inviteToCall(group.getId(), "u7", List.of("u8")),
                ErrorCode.INVITER_NOT_ACTIVE);
        assertRejected(() -> orchestrator.inviteToCall(group.getId(), "u6", List.of()),
                ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> orchestrator.inviteToCall(UUID.randomUUID(), "u6", List.of("u8")),
                ErrorCode.CALL_NOT_FOUND);
    }

    @Test
    void invitedUserCanAnswerAndAcceptsInvitation() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        orchestrator.inviteToCall(call.getId(), "u1", List.of("u4"));

        Call answered = orchestrator.answerCall(call.getId(), "u4", null);

        assertThat(statusOf(answered, "u4")).isEqualTo(ParticipantStatus.JOINED);
        assertThat(answered.getInvitations()).singleElement()
                .extracting(CallInvitation::getStatus).isEqualTo(InvitationStatus.ACCEPTED);
    }

    @Test
    void pendingInvitationsExpireOnSweepAndOnRead() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        orchestrator.inviteToCall(call.getId(), "u1", List.of("u4"));
        clock.advance(Duration.ofSeconds(properties.getInvitationTtlSeconds()));

        assertThat(orchestrator.getCall(call.getId(), "u1").getInvitations()).singleElement()
                .extracting(CallInvitation::getStatus).isEqualTo(InvitationStatus.EXPIRED);

        assertThat(orchestrator.expirePendingInvitations()).isEqualTo(1);
        assertThat(orchestrator.expirePendingInvitations()).isZero();
        assertThat(repository.findById(call.getId()).orElseThrow().getInvitations()).singleElement()
                .extracting(CallInvitation::getStatus).isEqualTo(InvitationStatus.EXPIRED);
    }

    // ---- media ----

    @Test
    void mediaUpdateOnlyTouchesProvidedFlags() {
        Call call = initiate("u1", CallType.VIDEO, null, "u2");
        orchestrator.answerCall(call.getId(), "u2", null);

        CallParticipant updated = orchestrator.updateMediaState(call.getId(), "u2",
                UpdateMediaStateRequest.builder().isMuted(true).build());

        assertThat(updated.isMuted()).isTrue();
        assertThat(updated.isVideoEnabled()).isTrue();
        assertThat(updated.isScreenSharing()).isFalse();
        verify(notifications).mediaStateChanged(any(Call.class), any(CallParticipant.class));
    }

    @Test
    void emptyMediaUpdateIsNotBroadcast() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        CallParticipant unchanged = orchestrator.updateMediaState(call.getId(), "u1", new UpdateMediaStateRequest());

        assertThat(unchanged.isMuted()).isFalse();
        verify(notifications, never()).mediaStateChanged(any(), any());
    }

    @Test
    void mediaUpdateRequiresJoinedRow() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertRejected(() -> orchestrator.updateMediaState(call.getId(), "u2",
                UpdateMediaStateRequest.builder().isMuted(true).build()), ErrorCode.PARTICIPANT_NOT_FOUND);
        assertRejected(() -> orchestrator.updateMediaState(call.getId(), "u9",
                UpdateMediaStateRequest.builder().isMuted(true).build()), ErrorCode.PARTICIPANT_NOT_FOUND);
    }

    // ---- queries ----

    @Test
    void getCallIsLimitedToParticipants() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertThat(orchestrator.getCall(call.getId(), "u2").getId()).isEqualTo(call.getId());
        assertRejected(() -> orchestrator.getCall(call.getId(), "u9"), ErrorCode.ACCESS_DENIED);
        assertRejected(() -> orchestrator.getCall(UUID.randomUUID(), "u1"), ErrorCode.CALL_NOT_FOUND);
    }

    @Test
    void historyIsPagedNewestFirst() {
        Call first = initiate("u1", CallType.AUDIO, null, "u2");
        orchestrator.endCall(first.getId(), "u1", null);
        clock.advance(Duration.ofMinutes(1));
        Call second = initiate("u3", CallType.AUDIO, null, "u1");
        clock.advance(Duration.ofMinutes(1));
        Call third = initiate("u1", CallType.VIDEO, null, "u4");

        CallPage page = orchestrator.getCallHistory("u1", 2, 0);

        assertThat(page.getCalls()).extracting(Call::getId).containsExactly(third.getId(), second.getId());
        assertThat(page.getTotal()).isEqualTo(3);
        assertThat(page.hasMore()).isTrue();
        assertThat(orchestrator.getCallHistory("u1", 2, 2).hasMore()).isFalse();
        assertThat(orchestrator.getCallHistory("u1", null, null).getLimit()).isEqualTo(50);
    }

    @Test
    void historyRejectsOutOfRangePaging() {
        assertRejected(() -> orchestrator.getCallHistory("u1", 0, 0), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> orchestrator.getCallHistory("u1", 101, 0), ErrorCode.VALIDATION_ERROR);
        assertRejected(() -> orchestrator.getCallHistory("u1", 10, -1), ErrorCode.VALIDATION_ERROR);
    }

    @Test
    void activeCallsAndSignalingAuthorizationFollowParticipantRows() {
        Call call = initiate("u1", CallType.AUDIO, null, "u2");

        assertThat(orchestrator.getActiveCalls("u2")).extracting(Call::getId).containsExactly(call.getId());
        assertThat(orchestrator.isJoinedParticipant(call.getId(), "u1")).isTrue();
        assertThat(orchestrator.isJoinedParticipant(call.getId(), "u2")).isFalse();
        assertThat(orchestrator.isParticipant(call.getId(), "u2")).isTrue();

        orchestrator.declineCall(call.getId(), "u2", null);
        assertThat(orchestrator.getActiveCalls("u2")).isEmpty();
        assertThat(orchestrator.isJoinedParticipant(call.getId(), "u1")).isFalse();
    }

    // ---- ring timeout ----

    @Test
    void ringTimeoutIsOffByDefault() {
        initiate("u1", CallType.AUDIO, null, "u2");
        clock.advance(Duration.ofHours(1));

        assertThat(orchestrator.timeOutRingingParticipants()).isZero();
    }

    @Test
    void ringTimeoutMarksUnanswered1on1CallMissed() {
        properties.setRingTimeoutEnabled(true);
        Call call = initiate("u1", CallType.AUDIO, null, "u2");
        clock.advance(Duration.ofSeconds(properties.getRingTimeoutSeconds()));

        assertThat(orchestrator.timeOutRingingParticipants()).isEqualTo(1);

        Call missed = repository.findById(call.getId()).orElseThrow();
        assertThat(missed.getStatus()).isEqualTo(CallStatus.MISSED);
        assertThat(missed.getEndReason()).isEqualTo("no_answer");
        assertThat(statusOf(missed, "u2")).isEqualTo(ParticipantStatus.MISSED);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<String>> missedIds = ArgumentCaptor.forClass(List.class);
        verify(notifications).callMissed(any(Call.class), missedIds.capture());
        assertThat(missedIds.getValue()).containsExactly("u2");
    }

    @Test
    void ringTimeoutKeepsActiveGroupCallRunning() {
        properties.setRingTimeoutEnabled(true);
        Call call = initiate("u1", CallType.AUDIO, null, "u2", "u3");
        orchestrator.answerCall(call.getId(), "u2", null);
        clock.advance(Duration.ofSeconds(properties.getRingTimeoutSeconds() + 1));

        assertThat(orchestrator.timeOutRingingParticipants()).isEqualTo(1);

        Call stored = repository.findById(call.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(CallStatus.ACTIVE);
        assertThat(statusOf(stored, "u3")).isEqualTo(ParticipantStatus.MISSED);
    }
}
