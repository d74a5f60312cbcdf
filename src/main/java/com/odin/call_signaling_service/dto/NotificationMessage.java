package com.odin.call_signaling_service.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.NotificationChannel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Push notification event consumed by the notification service.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationMessage {

    private String customerId;
    private Long notificationId;  // 3001 incoming call, 3002 missed call
    private NotificationChannel channel;
    private Map<String, String> map;
    private String mobile;
    private String email;
}
