package com.odin.call_signaling_service.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.config.IceServerProperties;
import com.odin.call_signaling_service.dto.IceServer;
import com.odin.call_signaling_service.dto.WebRTCConfig;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class WebRtcConfigService {

    private final IceServerProperties iceServerProperties;

    public List<IceServer> getIceServers() {
        List<IceServer> servers = new ArrayList<>();
        if (!iceServerProperties.getStunUrls().isEmpty()) {
            servers.add(IceServer.builder().urls(new ArrayList<>(iceServerProperties.getStunUrls())).build());
        }
        if (iceServerProperties.isTurnConfigured()) {
            servers.add(IceServer.builder()
                    .urls(List.of(iceServerProperties.getTurnUrl()))
                    .username(iceServerProperties.getTurnUsername())
                    .credential(iceServerProperties.getTurnCredential())
                    .build());
        }
        return servers;
    }

    public WebRTCConfig getConfig() {
        return WebRTCConfig.builder()
                .iceServers(getIceServers())
                .iceTransportPolicy(iceServerProperties.getIceTransportPolicy())
                .build();
    }
}
