package club.duocall.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

import club.duocall.client.media.MediaConstraints;
import club.duocall.client.negotiation.EndReason;
import club.duocall.client.negotiation.NegotiationState;
import club.duocall.dto.IceServer;
import club.duocall.dto.ServerStatusDto;
import club.duocall.exception.RoomFullException;
import club.duocall.model.ParticipantRole;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;

/**
 * 两个客户端通过真实的信令服务器完成一次通话。
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CallSignalingIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private CallClientSettings settings;
    private final RelayConnector connector = new WebSocketRelayConnector();
    private Party alice;
    private Party bob;

    @BeforeEach
    void setUp() {
        settings = new CallClientSettings(URI.create("ws://localhost:" + port), CallClientSettings.DEFAULT_ICE_SERVERS,
                10, MediaConstraints.defaults(), Duration.ofSeconds(5), Duration.ofSeconds(30));
        alice = new Party("alice");
        bob = new Party("bob");
    }

    @AfterEach
    void tearDown() {
        alice.controller.end();
        bob.controller.end();
    }

    @Test
    void twoParticipantsConnectAndThirdIsTurnedAway() throws Exception {
        var roomId = alice.controller.host();
        var bobRole = bob.controller.joinFromLink(RoomLinks.shareLink("http://localhost:" + port + "/", roomId));

        assertThat(alice.controller.role()).isEqualTo(ParticipantRole.FIRST);
        assertThat(bobRole).isEqualTo(ParticipantRole.SECOND);
        waitUntil(() -> alice.controller.state() == NegotiationState.CONNECTED
                && bob.controller.state() == NegotiationState.CONNECTED);
        waitUntil(() -> alice.factory.last().remoteCandidates.size() == 1
                && bob.factory.last().remoteCandidates.size() == 1);
        assertThat(bob.factory.last().remoteDescription.sdp()).isEqualTo("v=0 offer from alice");
        assertThat(alice.factory.last().remoteDescription.sdp()).isEqualTo("v=0 answer from bob");

        var status = restTemplate.getForObject("/api/monitor/status", ServerStatusDto.class);
        assertThat(status.fullRooms()).isGreaterThanOrEqualTo(1);

        var carol = new Party("carol");
        assertThatThrownBy(() -> carol.controller.start(roomId)).isInstanceOf(RoomFullException.class);
        assertThat(carol.controller.snapshot().endReason()).isEqualTo(EndReason.ROOM_FULL);
        assertThat(carol.media.releases).hasValue(1);

        Thread.sleep(200);
        assertThat(alice.controller.state()).isEqualTo(NegotiationState.CONNECTED);
        assertThat(bob.controller.state()).isEqualTo(NegotiationState.CONNECTED);

        alice.controller.end();
        waitUntil(() -> bob.controller.state() == NegotiationState.ENDED);
        assertThat(bob.controller.snapshot().endReason()).isEqualTo(EndReason.CALL_ENDED_BY_PEER);
        assertThat(bob.listener.endings).containsExactly(EndReason.CALL_ENDED_BY_PEER);
    }

    @Test
    void servesConfiguredIceServers() {
        var servers = restTemplate.getForObject("/api/call/ice-servers", IceServer[].class);

        assertThat(servers).hasSize(5);
        assertThat(servers[0].urls()).containsExactly("stun:stun.l.google.com:19302");
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("条件在10秒内未满足");
            }
            Thread.sleep(20);
        }
    }

    private final class Party {
        final FakeMediaDevices media = new FakeMediaDevices();
        final FakePeerConnectionFactory factory;
        final RecordingListener listener = new RecordingListener();
        final CallController controller;

        Party(String name) {
            this.factory = new FakePeerConnectionFactory(name);
            this.controller = new CallController(settings, media, factory, connector, listener);
        }
    }
}
