package com.odin.call_signaling_service.utility;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.service.CallOrchestratorService;
import com.odin.call_signaling_service.service.ConnectionRegistryService;
import com.odin.call_signaling_service.service.PresenceService;

import lombok.extern.slf4j.Slf4j;

/**
 * Periodic soft timeouts: pending invitations, unanswered ringing, and presence
 * entries of users connected to this pod.
 */
@Slf4j
@Component
public class CallHousekeepingScheduler {

    private final CallOrchestratorService callOrchestratorService;
    private final ConnectionRegistryService connectionRegistryService;
    private final PresenceService presenceService;

    public CallHousekeepingScheduler(CallOrchestratorService callOrchestratorService,
                                     ConnectionRegistryService connectionRegistryService,
                                     PresenceService presenceService) {
        this.callOrchestratorService = callOrchestratorService;
        this.connectionRegistryService = connectionRegistryService;
        this.presenceService = presenceService;
    }

    @Scheduled(fixedDelayString = "${call.sweep-interval-ms:30000}")
    public void sweepCalls() {
        try {
            callOrchestratorService.expirePendingInvitations();
            callOrchestratorService.timeOutRingingParticipants();
        } catch (RuntimeException e) {
            log.error("Call sweep failed: {}", ExceptionUtils.getStackTrace(e));
        }
    }

    @Scheduled(fixedRateString = "${presence.refresh-interval-ms:1800000}")
    public void refreshPresence() {
        var onlineUsers = connectionRegistryService.getOnlineUsers();
        log.debug("CallHousekeepingScheduler: refreshing presence for {} users", onlineUsers.size());
        presenceService.refresh(onlineUsers);
    }
}
