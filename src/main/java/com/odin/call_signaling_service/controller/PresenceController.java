package com.odin.call_signaling_service.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.UserStatusResponse;
import com.odin.call_signaling_service.service.ConnectionRegistryService;
import com.odin.call_signaling_service.service.PresenceService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping(ApplicationConstants.API_VERSION + ApplicationConstants.WEBSOCKET)
public class PresenceController {

    private final PresenceService presenceService;
    private final ConnectionRegistryService connectionRegistryService;

    public PresenceController(PresenceService presenceService,
                              ConnectionRegistryService connectionRegistryService) {
        this.presenceService = presenceService;
        this.connectionRegistryService = connectionRegistryService;
    }

    /**
     * GET /v1/websocket/user-status/{userId}
     * Whether the user holds a signaling connection anywhere in the cluster, the pod
     * holding it, and how many connections this pod has for the user.
     */
    @GetMapping("/user-status/{userId}")
    public ResponseEntity<UserStatusResponse> userStatus(@PathVariable("userId") String userId) {
        var podOpt = presenceService.getConnectionPod(userId);
        int localConnections = connectionRegistryService.getConnectionCount(userId);
        boolean online = podOpt.isPresent() || localConnections > 0;
        log.debug("User status for {} => online={}, pod={}, localConnections={}", userId, online,
                podOpt.orElse(null), localConnections);
        return ResponseEntity.ok(new UserStatusResponse(online, podOpt.orElse(null), localConnections));
    }
}
