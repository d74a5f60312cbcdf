package com.odin.call_signaling_service.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Call lifecycle limits and timers.
 */
@Data
@Component
@ConfigurationProperties(prefix = "call")
public class CallProperties {

    /**
     * Invitees per initiate request. Also the upper bound for max-participants.
     */
    private int maxParticipants = 50;

    /**
     * Invitees per invite request.
     */
    private int maxInviteBatch = 10;

    /**
     * How long an invitation stays pending before it is expired.
     */
    private long invitationTtlSeconds = 120;

    /**
     * Bounded wait for the per-call lock. A caller that cannot acquire it within
     * this window gets a concurrent_modification conflict.
     */
    private long lockTimeoutMs = 2000;

    /**
     * Number of lock stripes shared by all calls and users.
     */
    private int lockStripes = 64;

    private boolean ringTimeoutEnabled = false;

    private long ringTimeoutSeconds = 60;

    /**
     * Period of the invitation / ring-timeout sweeper.
     */
    private long sweepIntervalMs = 30000;

    private int historyDefaultLimit = 50;

    private int historyMaxLimit = 100;
}
