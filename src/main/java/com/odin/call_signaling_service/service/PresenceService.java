package com.odin.call_signaling_service.service;

import java.util.Collection;
import java.util.Optional;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Cluster-wide presence: which pod holds a user's signaling connections. Written on
 * the user's first connection and removed when the last one closes. Redis failures
 * are logged and never break the socket lifecycle.
 */
@Slf4j
@Service
public class PresenceService {

    private static final String KEY_PREFIX = "websocket:connection:";

    private final StringRedisTemplate redisTemplate;
    private final String podName;

    public PresenceService(StringRedisTemplate redisTemplate, @Value("${pod.name:dev}") String podName) {
        this.redisTemplate = redisTemplate;
        this.podName = podName;
    }

    public void markOnline(String userId) {
        try {
            redisTemplate.opsForValue().set(registryKey(userId), podName);
            log.info("Registered presence for userId='{}' on pod='{}'", userId, podName);
        } catch (Exception e) {
            log.error("Failed to register presence for userId='{}': {}", userId, e.getMessage(), e);
        }
    }

    public void markOffline(String userId) {
        try {
            redisTemplate.delete(registryKey(userId));
            log.info("Removed presence for userId='{}'", userId);
        } catch (Exception e) {
            log.error("Failed to remove presence for userId='{}': {}", userId, e.getMessage(), e);
        }
    }

    /**
     * Re-asserts presence for users connected to this pod, e.g. after a Redis restart.
     */
    public void refresh(Collection<String> userIds) {
        for (String userId : userIds) {
            try {
                redisTemplate.opsForValue().setIfAbsent(registryKey(userId), podName);
            } catch (Exception e) {
                log.error("Failed to refresh presence for userId='{}': {}", userId, e.getMessage(), e);
                return;
            }
        }
        log.debug("Presence refreshed for {} users on pod {}", userIds.size(), podName);
    }

    public Optional<String> getConnectionPod(String userId) {
        try {
            String pod = redisTemplate.opsForValue().get(registryKey(userId));
            if (pod != null && !pod.isEmpty()) {
                return Optional.of(pod);
            }
        } catch (Exception e) {
            log.error("Failed to get connection pod for userId='{}': {}", userId, e.getMessage(), e);
        }
        return Optional.empty();
    }

    public boolean hasConnection(String userId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(registryKey(userId)));
        } catch (Exception e) {
            log.error("Failed to check presence for userId='{}': {}", userId, e.getMessage(), e);
            return false;
        }
    }

    private String registryKey(String userId) {
        return KEY_PREFIX + userId;
    }
}
