package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallStatus {

    RINGING("ringing"),
    ACTIVE("active"),
    ENDED("ended"),
    MISSED("missed"),
    DECLINED("declined"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    CallStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isLive() {
        return this == RINGING || this == ACTIVE;
    }

    public boolean isTerminal() {
        return !isLive();
    }
}
