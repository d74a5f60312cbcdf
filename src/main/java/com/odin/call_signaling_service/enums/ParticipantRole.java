package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantRole {

    INITIATOR("initiator"),
    PARTICIPANT("participant");

    private final String value;

    ParticipantRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
