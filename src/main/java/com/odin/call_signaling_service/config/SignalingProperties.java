package com.odin.call_signaling_service.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Signaling socket endpoint and per-connection send limits.
 */
@Data
@Component
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    private String path = "/v1/ws/signaling";

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * Upper bound for a single send to one connection. A connection that stays
     * blocked longer is closed and pruned.
     */
    private int sendTimeLimitMs = 10000;

    /**
     * Bytes buffered for a slow connection before it is closed.
     */
    private int sendBufferSizeLimit = 512 * 1024;

    /**
     * Largest inbound text frame accepted by the container.
     */
    private int maxTextMessageSize = 64 * 1024;
}
