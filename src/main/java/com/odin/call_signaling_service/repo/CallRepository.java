package com.odin.call_signaling_service.repo;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.odin.call_signaling_service.entity.Call;

/**
 * Durable store of call aggregates. Implementations hand out detached copies;
 * changes become visible only through {@link #save(Call)}.
 */
public interface CallRepository {

    /**
     * Stores a new aggregate. Fails if the id is already taken.
     */
    Call insert(Call call);

    /**
     * Replaces the stored aggregate if its version still matches the one the
     * caller read. Throws a conflict otherwise. The returned copy carries the
     * new version.
     */
    Call save(Call call);

    Optional<Call> findById(UUID callId);

    /**
     * A ringing or active 1-on-1 call in which both users are participants.
     */
    Optional<Call> findLiveOneOnOneBetween(String userId, String otherUserId);

    /**
     * Calls the user participates in, newest first.
     */
    List<Call> findByParticipant(String userId, int limit, int offset);

    long countByParticipant(String userId);

    /**
     * Ringing or active calls where the user's row is joined or ringing.
     */
    List<Call> findLiveForUser(String userId);

    List<Call> findAllLive();
}
