package com.odin.call_signaling_service.repo;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.odin.call_signaling_service.entity.Call;
import com.odin.call_signaling_service.enums.CallMode;
import com.odin.call_signaling_service.exception.CallServiceException;
import com.odin.call_signaling_service.exception.ErrorCode;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Repository
public class InMemoryCallRepository implements CallRepository {

    private final Map<UUID, Call> calls = new ConcurrentHashMap<>();

    @Override
    public Call insert(Call call) {
        Call stored = call.copy();
        stored.setVersion(1L);
        Call previous = calls.putIfAbsent(stored.getId(), stored);
        if (previous != null) {
            throw new CallServiceException(ErrorCode.CONCURRENT_MODIFICATION,
                    "Call " + call.getId() + " already exists");
        }
        log.debug("Inserted call {} (mode={}, participants={})", stored.getId(), stored.getCallMode(),
                stored.getParticipants().size());
        return stored.copy();
    }

    @Override
    public Call save(Call call) {
        Call result = calls.compute(call.getId(), (id, existing) -> {
            if (existing == null) {
                throw new CallServiceException(ErrorCode.CALL_NOT_FOUND, "Call not found");
            }
            if (existing.getVersion() != call.getVersion()) {
                log.warn("Stale write rejected for call {}: expected version {}, found {}",
                        id, call.getVersion(), existing.getVersion());
                throw new CallServiceException(ErrorCode.CONCURRENT_MODIFICATION,
                        "Call was modified concurrently, retry the operation");
            }
            Call stored = call.copy();
            stored.setVersion(existing.getVersion() + 1);
            return stored;
        });
        return result.copy();
    }

    @Override
    public Optional<Call> findById(UUID callId) {
        Call call = calls.get(callId);
        return call == null ? Optional.empty() : Optional.of(call.copy());
    }

    @Override
    public Optional<Call> findLiveOneOnOneBetween(String userId, String otherUserId) {
        return calls.values().stream()
                .filter(Call::isLive)
                .filter(c -> c.getCallMode() == CallMode.ONE_ON_ONE)
                .filter(c -> c.hasParticipant(userId) && c.hasParticipant(otherUserId))
                .findFirst()
                .map(Call::copy);
    }

    @Override
    public List<Call> findByParticipant(String userId, int limit, int offset) {
        return calls.values().stream()
                .filter(c -> c.hasParticipant(userId))
                .sorted(Comparator.comparing(Call::getStartedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                        .reversed())
                .skip(offset)
                .limit(limit)
                .map(Call::copy)
                .collect(Collectors.toList());
    }

    @Override
    public long countByParticipant(String userId) {
        return calls.values().stream().filter(c -> c.hasParticipant(userId)).count();
    }

    @Override
    public List<Call> findLiveForUser(String userId) {
        return calls.values().stream()
                .filter(Call::isLive)
                .filter(c -> c.findParticipant(userId)
                        .map(p -> p.isJoined() || p.isRinging())
                        .orElse(false))
                .sorted(Comparator.comparing(Call::getStartedAt).reversed())
                .map(Call::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Call> findAllLive() {
        return calls.values().stream()
                .filter(Call::isLive)
                .map(Call::copy)
                .collect(Collectors.toList());
    }

    int size() {
        return calls.size();
    }
}
