package com.odin.call_signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;

import com.odin.call_signaling_service.config.SignalingProperties;
import com.odin.call_signaling_service.support.RecordingSession;
import com.odin.call_signaling_service.support.TestJson;

class ConnectionRegistryServiceTest {

    private PresenceService presenceService;
    private ConnectionRegistryService registry;

    @BeforeEach
    void setUp() {
        presenceService = mock(PresenceService.class);
        registry = new ConnectionRegistryService(TestJson.mapper(), new SignalingProperties(), presenceService);
    }

    @Test
    void firstAndLastConnectionDrivePresence() {
        RecordingSession phone = RecordingSession.open("s1");
        RecordingSession laptop = RecordingSession.open("s2");

        assertThat(registry.connect(phone.session(), "alice")).isTrue();
        assertThat(registry.connect(laptop.session(), "alice")).isFalse();
        verify(presenceService, times(1)).markOnline("alice");
        assertThat(registry.getConnectionCount("alice")).isEqualTo(2);
        assertThat(registry.getUserId(phone.session())).isEqualTo("alice");

        ConnectionRegistryService.Disconnection first = registry.disconnect(phone.session());
        assertThat(first.getUserId()).isEqualTo("alice");
        assertThat(first.isWentOffline()).isFalse();
        verify(presenceService, never()).markOffline("alice");

        ConnectionRegistryService.Disconnection last = registry.disconnect(laptop.session());
        assertThat(last.isWentOffline()).isTrue();
        verify(presenceService).markOffline("alice");
        assertThat(registry.isOnline("alice")).isFalse();
        assertThat(registry.getConnectionCount()).isZero();
    }

    @Test
    void disconnectOfUnknownConnectionIsIgnored() {
        assertThat(registry.disconnect(RecordingSession.open("ghost").session())).isNull();
        assertThat(registry.getUserId(RecordingSession.open("ghost").session())).isNull();
    }

    @Test
    void personalMessageFansOutToEveryConnectionOfTheUser() {
        RecordingSession phone = RecordingSession.open("s1");
        RecordingSession laptop = RecordingSession.open("s2");
        RecordingSession other = RecordingSession.open("s3");
        registry.connect(phone.session(), "alice");
        registry.connect(laptop.session(), "alice");
        registry.connect(other.session(), "bob");

        int delivered = registry.sendPersonalMessage(Map.of("type", "hello"), "alice");

        assertThat(delivered).isEqualTo(2);
        assertThat(phone.frameTypes()).containsExactly("hello");
        assertThat(laptop.frameTypes()).containsExactly("hello");
        assertThat(other.payloads()).isEmpty();
        assertThat(registry.sendPersonalMessage(Map.of("type", "hello"), "nobody")).isZero();
    }

    @Test
    void failedSendPrunesTheConnectionAndClosesIt() throws IOException {
        RecordingSession healthy = RecordingSession.open("s1");
        RecordingSession broken = RecordingSession.open("s2");
        registry.connect(healthy.session(), "alice");
        registry.connect(broken.session(), "alice");
        broken.failSends();

        int delivered = registry.sendPersonalMessage(Map.of("type", "hello"), "alice");

        assertThat(delivered).isEqualTo(1);
        assertThat(registry.getConnectionCount("alice")).isEqualTo(1);
        verify(broken.session()).close(CloseStatus.SESSION_NOT_RELIABLE);
        verify(presenceService, never()).markOffline("alice");
    }

    @Test
    void closedConnectionIsPrunedOnDeliveryAndUserGoesOffline() {
        RecordingSession session = RecordingSession.open("s1");
        registry.connect(session.session(), "alice");
        session.markClosed();

        assertThat(registry.sendPersonalMessage(Map.of("type", "hello"), "alice")).isZero();

        assertThat(registry.isOnline("alice")).isFalse();
        verify(presenceService).markOffline("alice");
    }

    @Test
    void callMembershipIsIndependentOfConnections() {
        UUID callId = UUID.randomUUID();
        RecordingSession alice = RecordingSession.open("s1");
        registry.connect(alice.session(), "alice");

        assertThat(registry.addToCall(callId, "alice")).isTrue();
        assertThat(registry.addToCall(callId, "alice")).isFalse();
        assertThat(registry.addToCall(callId, "bob")).isTrue();
        registry.disconnect(alice.session());

        assertThat(registry.isInCall(callId, "alice")).isTrue();
        assertThat(registry.getCallParticipantCount(callId)).isEqualTo(2);
        assertThat(registry.removeFromCall(callId, "bob")).isTrue();
        assertThat(registry.removeFromCall(callId, "bob")).isFalse();
        assertThat(registry.clearCall(callId)).containsExactly("alice");
        assertThat(registry.getCallMembers(callId)).isEmpty();
    }

    @Test
    void callBroadcastSkipsTheExcludedMember() {
        UUID callId = UUID.randomUUID();
        RecordingSession alice = RecordingSession.open("s1");
        RecordingSession bob = RecordingSession.open("s2");
        RecordingSession carol = RecordingSession.open("s3");
        registry.connect(alice.session(), "alice");
        registry.connect(bob.session(), "bob");
        registry.connect(carol.session(), "carol");
        registry.addToCall(callId, "alice");
        registry.addToCall(callId, "bob");

        int delivered = registry.sendToCall(Map.of("type", "participant-joined"), callId, "alice");

        assertThat(delivered).isEqualTo(1);
        assertThat(bob.frameTypes()).containsExactly("participant-joined");
        assertThat(alice.payloads()).isEmpty();
        assertThat(carol.payloads()).isEmpty();
    }

    @Test
    void peerMessageRequiresBothUsersInTheCallAndIsStamped() {
        UUID callId = UUID.randomUUID();
        RecordingSession bob = RecordingSession.open("s2");
        registry.connect(bob.session(), "bob");
        registry.addToCall(callId, "alice");

        assertThat(registry.sendToPeer(Map.of("type", "offer", "sdp", "v=0"), "alice", "bob", callId)).isFalse();
        assertThat(bob.payloads()).isEmpty();

        registry.addToCall(callId, "bob");
        assertThat(registry.sendToPeer(Map.of("type", "offer", "sdp", "v=0"), "alice", "bob", callId)).isTrue();

        Map<String, Object> frame = bob.lastFrame();
        assertThat(frame).containsEntry("type", "offer")
                .containsEntry("sdp", "v=0")
                .containsEntry("from_user_id", "alice")
                .containsEntry("call_id", callId.toString());
    }

    @Test
    void peerMessageToMemberWithoutConnectionIsNotDelivered() {
        UUID callId = UUID.randomUUID();
        registry.addToCall(callId, "alice");
        registry.addToCall(callId, "bob");

        assertThat(registry.sendToPeer(Map.of("type", "answer", "sdp", "v=0"), "alice", "bob", callId)).isFalse();
    }

    @Test
    void replyReachesUnregisteredConnection() {
        RecordingSession pending = RecordingSession.open("s9");

        assertThat(registry.sendToConnection(pending.session(), Map.of("type", "error"))).isTrue();
        assertThat(pending.frameTypes()).containsExactly("error");
    }

    @Test
    void concurrentConnectAndDisconnectKeepsCountsAndPresenceConsistent() throws Exception {
        AtomicReference<String> lastPresenceWrite = new AtomicReference<>();
        doAnswer(invocation -> {
            lastPresenceWrite.set("online");
            return null;
        }).when(presenceService).markOnline("alice");
        doAnswer(invocation -> {
            lastPresenceWrite.set("offline");
            return null;
        }).when(presenceService).markOffline("alice");

        int threads = 8;
        List<RecordingSession> devices = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            devices.add(RecordingSession.open("device-" + i));
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                RecordingSession device = devices.get(i);
                boolean stayConnected = i % 2 == 0;
                results.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 200; round++) {
                        registry.connect(device.session(), "alice");
                        registry.disconnect(device.session());
                    }
                    if (stayConnected) {
                        registry.connect(device.session(), "alice");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.isOnline("alice")).isTrue();
        assertThat(registry.getConnectionCount("alice")).isEqualTo(threads / 2);
        assertThat(registry.getConnectionCount()).isEqualTo(threads / 2);
        assertThat(lastPresenceWrite.get()).isEqualTo("online");

        for (int i = 0; i < threads; i += 2) {
            registry.disconnect(devices.get(i).session());
        }
        assertThat(registry.isOnline("alice")).isFalse();
        assertThat(lastPresenceWrite.get()).isEqualTo("offline");
    }

    @Test
    void concurrentMembershipChangesAndBroadcastsKeepEveryMember() throws Exception {
        UUID callId = UUID.randomUUID();
        int threads = 8;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String userId = "user-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 200; round++) {
                        registry.addToCall(callId, userId);
                        registry.sendToCall(Map.of("type", "ping"), callId, userId);
                        registry.removeFromCall(callId, userId);
                    }
                    registry.addToCall(callId, userId);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.getCallParticipantCount(callId)).isEqualTo(threads);
        assertThat(registry.getCallMembers(callId))
                .containsExactlyInAnyOrder("user-0", "user-1", "user-2", "user-3",
                        "user-4", "user-5", "user-6", "user-7");
    }
}
