package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallMode {

    ONE_ON_ONE("1-on-1"),
    GROUP("group");

    private final String value;

    CallMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * More than one invitee at creation time makes the call a group call.
     */
    public static CallMode forInviteeCount(int invitees) {
        return invitees > 1 ? GROUP : ONE_ON_ONE;
    }
}
