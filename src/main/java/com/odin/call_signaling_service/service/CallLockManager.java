package com.odin.call_signaling_service.service;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.config.CallProperties;
import com.odin.call_signaling_service.exception.CallServiceException;
import com.odin.call_signaling_service.exception.ErrorCode;

import lombok.extern.slf4j.Slf4j;

/**
 * Striped locks serializing state transitions of one call, and call creation
 * between the same users. Waits are bounded; a caller that cannot get the lock
 * in time receives a concurrent_modification conflict instead of blocking.
 */
@Slf4j
@Service
public class CallLockManager {

    private final ReentrantLock[] stripes;
    private final long timeoutMs;

    public CallLockManager(CallProperties callProperties) {
        int count = Math.max(1, callProperties.getLockStripes());
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock();
        }
        this.timeoutMs = callProperties.getLockTimeoutMs();
    }

    public <T> T withCallLock(UUID callId, Supplier<T> action) {
        return withStripes(new TreeSet<>(List.of(stripeIndex("call:" + callId))), action);
    }

    /**
     * Runs the action holding the stripes of every user id. Stripes are taken in
     * ascending order so two overlapping initiations cannot deadlock.
     */
    public <T> T withUserLocks(Collection<String> userIds, Supplier<T> action) {
        TreeSet<Integer> indexes = new TreeSet<>();
        for (String userId : userIds) {
            indexes.add(stripeIndex("user:" + userId));
        }
        return withStripes(indexes, action);
    }

    private <T> T withStripes(TreeSet<Integer> indexes, Supplier<T> action) {
        Deque<ReentrantLock> held = new ArrayDeque<>();
        try {
            for (Integer index : indexes) {
                ReentrantLock lock = stripes[index];
                if (!acquire(lock)) {
                    log.warn("Timed out after {}ms waiting for lock stripe {}", timeoutMs, index);
                    throw new CallServiceException(ErrorCode.CONCURRENT_MODIFICATION,
                            "Call is being modified concurrently, retry the request");
                }
                held.push(lock);
            }
            return action.get();
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }
    }

    private boolean acquire(ReentrantLock lock) {
        try {
            return lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CallServiceException(ErrorCode.CONCURRENT_MODIFICATION,
                    "Interrupted while waiting for call lock", e);
        }
    }

    int stripeIndex(String key) {
        return Math.floorMod(key.hashCode(), stripes.length);
    }

    int stripeCount() {
        return stripes.length;
    }
}
