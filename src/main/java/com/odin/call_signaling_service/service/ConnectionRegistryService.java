package com.odin.call_signaling_service.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.config.SignalingProperties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory registry of this pod's signaling connections.
 *
 * <p>A user may hold any number of connections (devices, tabs); every personal
 * message fans out to all of them. Independently, each call has a membership set
 * of user ids that receives call-wide broadcasts and peer-to-peer signaling.
 * Dropping a connection never touches call membership.
 *
 * <p>Every connection is wrapped in a {@link ConcurrentWebSocketSessionDecorator},
 * so sends to one slow device are buffered up to a bound instead of blocking other
 * senders, and frames to one connection keep their order. A connection whose send
 * fails or which is found closed is pruned on the spot.
 */
@Slf4j
@Service
public class ConnectionRegistryService {

    private static final int PRESENCE_STRIPES = 32;

    private final ObjectMapper objectMapper;
    private final SignalingProperties signalingProperties;
    private final PresenceService presenceService;

    // sessionId -> connection
    private final Map<String, RegisteredConnection> connections = new ConcurrentHashMap<>();
    // userId -> sessionIds
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    // callId -> userIds
    private final Map<UUID, Set<String>> callMembers = new ConcurrentHashMap<>();
    // serializes presence writes per user
    private final ReentrantLock[] presenceStripes = new ReentrantLock[PRESENCE_STRIPES];

    public ConnectionRegistryService(ObjectMapper objectMapper,
                                     SignalingProperties signalingProperties,
                                     PresenceService presenceService) {
        this.objectMapper = objectMapper;
        this.signalingProperties = signalingProperties;
        this.presenceService = presenceService;
        for (int i = 0; i < presenceStripes.length; i++) {
            presenceStripes[i] = new ReentrantLock();
        }
    }

    /**
     * Registers an authenticated connection.
     *
     * @return true if this is the user's first open connection on this pod
     */
    public boolean connect(WebSocketSession session, String userId) {
        WebSocketSession decorated = new ConcurrentWebSocketSessionDecorator(session,
                signalingProperties.getSendTimeLimitMs(), signalingProperties.getSendBufferSizeLimit());
        connections.put(session.getId(), new RegisteredConnection(userId, decorated));

        boolean[] first = {false};
        userConnections.compute(userId, (key, sessionIds) -> {
            Set<String> ids = sessionIds != null ? sessionIds : ConcurrentHashMap.newKeySet();
            first[0] = ids.isEmpty();
            ids.add(session.getId());
            return ids;
        });

        if (first[0]) {
            syncPresence(userId);
        }
        log.info("Registered connection {} for userId={} (firstConnection={}, totalConnections={})",
                session.getId(), userId, first[0], connections.size());
        return first[0];
    }

    /**
     * Removes a connection. Unknown connections are ignored.
     *
     * @return owner of the connection and whether it was the user's last one,
     *         or null if the connection was not registered
     */
    public Disconnection disconnect(WebSocketSession session) {
        return disconnect(session.getId());
    }

    private Disconnection disconnect(String sessionId) {
        RegisteredConnection removed = connections.remove(sessionId);
        if (removed == null) {
            return null;
        }
        String userId = removed.getUserId();
        boolean[] wentOffline = {false};
        userConnections.computeIfPresent(userId, (key, sessionIds) -> {
            sessionIds.remove(sessionId);
            if (sessionIds.isEmpty()) {
                wentOffline[0] = true;
                return null;
            }
            return sessionIds;
        });

        if (wentOffline[0]) {
            syncPresence(userId);
        }
        log.info("Removed connection {} for userId={} (wentOffline={})", sessionId, userId, wentOffline[0]);
        return new Disconnection(userId, wentOffline[0]);
    }

    /**
     * Writes the user's current online state to the presence store. The state is read
     * under the user's stripe, so when a last disconnect races a new first connect the
     * write that lands last reflects the registry as it is now.
     */
    private void syncPresence(String userId) {
        ReentrantLock lock = presenceStripes[Math.floorMod(userId.hashCode(), presenceStripes.length)];
        lock.lock();
        try {
            if (isOnline(userId)) {
                presenceService.markOnline(userId);
            } else {
                presenceService.markOffline(userId);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isOnline(String userId) {
        Set<String> sessionIds = userConnections.get(userId);
        return sessionIds != null && !sessionIds.isEmpty();
    }

    public Set<String> getOnlineUsers() {
        return new HashSet<>(userConnections.keySet());
    }

    public int getConnectionCount() {
        return connections.size();
    }

    public int getConnectionCount(String userId) {
        Set<String> sessionIds = userConnections.get(userId);
        return sessionIds == null ? 0 : sessionIds.size();
    }

    public String getUserId(WebSocketSession session) {
        RegisteredConnection connection = connections.get(session.getId());
        return connection == null ? null : connection.getUserId();
    }

    // ---- call membership ----

    /**
     * @return true if the user was not yet a member
     */
    public boolean addToCall(UUID callId, String userId) {
        boolean[] added = {false};
        callMembers.compute(callId, (key, members) -> {
            Set<String> ids = members != null ? members : ConcurrentHashMap.newKeySet();
            added[0] = ids.add(userId);
            return ids;
        });
        if (added[0]) {
            log.debug("userId={} joined signaling membership of call {}", userId, callId);
        }
        return added[0];
    }

    public boolean removeFromCall(UUID callId, String userId) {
        boolean[] removed = {false};
        callMembers.computeIfPresent(callId, (key, members) -> {
            removed[0] = members.remove(userId);
            return members.isEmpty() ? null : members;
        });
        return removed[0];
    }

    public Set<String> clearCall(UUID callId) {
        Set<String> members = callMembers.remove(callId);
        if (members == null) {
            return Collections.emptySet();
        }
        log.debug("Cleared signaling membership of call {} ({} members)", callId, members.size());
        return new HashSet<>(members);
    }

    public Set<String> getCallMembers(UUID callId) {
        Set<String> members = callMembers.get(callId);
        return members == null ? Collections.emptySet() : new HashSet<>(members);
    }

    public int getCallParticipantCount(UUID callId) {
        Set<String> members = callMembers.get(callId);
        return members == null ? 0 : members.size();
    }

    public boolean isInCall(UUID callId, String userId) {
        Set<String> members = callMembers.get(callId);
        return members != null && members.contains(userId);
    }

    // ---- delivery ----

    /**
     * Sends the message to every open connection of the user.
     *
     * @return number of connections the message was handed to
     */
    public int sendPersonalMessage(Object message, String userId) {
        return deliverToUser(toTextMessage(message), userId);
    }

    /**
     * Sends the message to every member of the call except {@code excludeUserId}.
     *
     * @return number of connections the message was handed to
     */
    public int sendToCall(Object message, UUID callId, String excludeUserId) {
        TextMessage text = toTextMessage(message);
        int delivered = 0;
        for (String member : getCallMembers(callId)) {
            if (member.equals(excludeUserId)) {
                continue;
            }
            delivered += deliverToUser(text, member);
        }
        log.debug("Broadcast to call {} reached {} connections", callId, delivered);
        return delivered;
    }

    /**
     * Routes a signaling message between two members of the same call. The
     * outgoing copy carries {@code from_user_id} and {@code call_id}.
     *
     * @return whether at least one of the recipient's connections received it
     */
    public boolean sendToPeer(Map<String, Object> message, String fromUserId, String toUserId, UUID callId) {
        if (!isInCall(callId, fromUserId) || !isInCall(callId, toUserId)) {
            log.debug("Peer message {} -> {} dropped: not both in call {}", fromUserId, toUserId, callId);
            return false;
        }
        Map<String, Object> stamped = new LinkedHashMap<>(message);
        stamped.put("from_user_id", fromUserId);
        stamped.put("call_id", callId.toString());
        return deliverToUser(toTextMessage(stamped), toUserId) > 0;
    }

    /**
     * Replies to exactly one connection.
     */
    public boolean sendToConnection(WebSocketSession session, Object message) {
        TextMessage text = toTextMessage(message);
        RegisteredConnection connection = connections.get(session.getId());
        if (connection != null) {
            return deliver(session.getId(), connection, text);
        }
        // not registered (yet), e.g. a rejected handshake
        try {
            if (session.isOpen()) {
                session.sendMessage(text);
                return true;
            }
        } catch (IOException e) {
            log.warn("Failed to send to unregistered connection {}: {}", session.getId(), e.getMessage());
        }
        return false;
    }

    private int deliverToUser(TextMessage text, String userId) {
        Set<String> sessionIds = userConnections.get(userId);
        if (sessionIds == null) {
            return 0;
        }
        int delivered = 0;
        for (String sessionId : new ArrayList<>(sessionIds)) {
            RegisteredConnection connection = connections.get(sessionId);
            if (connection != null && deliver(sessionId, connection, text)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(String sessionId, RegisteredConnection connection, TextMessage text) {
        WebSocketSession session = connection.getSession();
        if (!session.isOpen()) {
            log.info("Pruning closed connection {} of userId={}", sessionId, connection.getUserId());
            disconnect(sessionId);
            return false;
        }
        try {
            session.sendMessage(text);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Send to connection {} of userId={} failed, pruning: {}",
                    sessionId, connection.getUserId(), e.getMessage());
            disconnect(sessionId);
            closeQuietly(session);
            return false;
        }
    }

    private void closeQuietly(WebSocketSession session) {
        try {
            session.close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException | RuntimeException e) {
            log.debug("Closing pruned connection {} failed: {}", session.getId(), e.getMessage());
        }
    }

    private TextMessage toTextMessage(Object message) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable outbound message: " + message.getClass().getName(), e);
        }
    }


    @Getter
    @AllArgsConstructor
    private static class RegisteredConnection {
        private final String userId;
        private final WebSocketSession session;
    }

    /**
     * Outcome of removing a connection.
     */
    @Getter
    @AllArgsConstructor
    public static class Disconnection {
        private final String userId;
        private final boolean wentOffline;
    }
}
