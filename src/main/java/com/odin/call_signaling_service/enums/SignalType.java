package com.odin.call_signaling_service.enums;

import java.util.Optional;

/**
 * Inbound signaling frame kinds accepted on the signaling socket.
 */
public enum SignalType {

    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    MEDIA_STATE_UPDATE("media-state-update"),
    JOIN_CALL("join-call"),
    LEAVE_CALL("leave-call"),
    PING("ping");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<SignalType> fromWireName(String wireName) {
        for (SignalType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public boolean isSessionDescription() {
        return this == OFFER || this == ANSWER;
    }
}
