package com.odin.call_signaling_service.entity;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One page of a user's call history.
 */
@Getter
@AllArgsConstructor
public class CallPage {

    private final List<Call> calls;
    private final long total;
    private final int limit;
    private final int offset;

    public boolean hasMore() {
        return offset + calls.size() < total;
    }
}
