package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ParticipantStatus {

    RINGING("ringing"),
    JOINED("joined"),
    LEFT("left"),
    DECLINED("declined"),
    MISSED("missed");

    private final String value;

    ParticipantStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Declined or missed: the user never took part and will not. */
    public boolean isUnanswered() {
        return this == DECLINED || this == MISSED;
    }
}
