package com.odin.call_signaling_service.config;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * STUN/TURN servers handed to clients for peer connection setup.
 */
@Data
@Component
@ConfigurationProperties(prefix = "webrtc")
public class IceServerProperties {

    private List<String> stunUrls = new ArrayList<>(List.of(
            "stun:stun.l.google.com:19302",
            "stun:stun1.l.google.com:19302",
            "stun:stun2.l.google.com:19302",
            "stun:stun3.l.google.com:19302",
            "stun:stun4.l.google.com:19302"));

    /**
     * Optional TURN relay. Only advertised when url, username and credential are all set.
     */
    private String turnUrl;

    private String turnUsername;

    private String turnCredential;

    private String iceTransportPolicy = "all";

    public boolean isTurnConfigured() {
        return hasText(turnUrl) && hasText(turnUsername) && hasText(turnCredential);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
