package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial media update. Null flags are left untouched.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateMediaStateRequest {

    private Boolean isMuted;
    private Boolean isVideoEnabled;
    private Boolean isScreenSharing;

    @JsonIgnore
    public boolean isEmpty() {
        return isMuted == null && isVideoEnabled == null && isScreenSharing == null;
    }
}
