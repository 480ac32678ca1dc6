package com.flowo.live.core.upstream;

import com.flowo.live.core.model.NotificationEvent;
import com.flowo.live.core.model.UpstreamHealth;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.BDDAssertions.then;

class UpstreamLinkTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final RecordingChangeFeedSource source = new RecordingChangeFeedSource();
    private final Set<String> registryChannels = ConcurrentHashMap.newKeySet();
    private final List<NotificationEvent> received = new CopyOnWriteArrayList<>();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final UpstreamLink link = new UpstreamLink(
            source,
            new UpstreamSettings(
                    Duration.ofHours(1),
                    Duration.ofSeconds(1),
                    Duration.ofSeconds(1),
                    2,
                    Duration.ofMillis(10),
                    Duration.ofMillis(50)),
            () -> Set.copyOf(registryChannels),
            received::add,
            clock);

    @AfterEach
    void tearDown() {
        link.close();
    }

    /** Mirrors what the registry does on an empty to non-empty transition. */
    private void goLive(String channel) {
        registryChannels.add(channel);
        link.onChannelLive(channel);
    }

    private void goIdle(String channel) {
        registryChannels.remove(channel);
        link.onChannelIdle(channel);
    }

    private void drain() {
        link.drain().block(WAIT);
    }

    @Test
    void givenLiveChannels_whenConnected_thenEveryChannelListened() {
        registryChannels.add("wf-1");
        registryChannels.add("wf-2");

        StepVerifier.create(link.connect()).verifyComplete();

        then(link.isConnected()).isTrue();
        then(source.listened()).containsExactlyInAnyOrder("wf-1", "wf-2");
        then(link.listeningChannels()).containsExactlyInAnyOrder("wf-1", "wf-2");
    }

    @Test
    void givenUnreachableSource_whenConnect_thenUpstreamUnavailable() {
        source.failNextConnects(1);

        StepVerifier.create(link.connect())
                .expectError(UpstreamUnavailableException.class)
                .verify(WAIT);

        then(link.isConnected()).isFalse();
    }

    @Test
    void givenTwoLiveChannels_whenReconnected_thenExactlyThoseChannelsRestored() {
        link.connect().block(WAIT);
        goLive("wf-1");
        goLive("wf-2");
        drain();

        source.failNextConnects(1);
        StepVerifier.create(link.reconnect()).verifyComplete();

        then(source.listened()).containsExactlyInAnyOrder("wf-1", "wf-2");
        then(link.reconnectCount()).isEqualTo(1);
        then(source.connectCount()).isEqualTo(3);
    }

    @Test
    void givenRetriesExhausted_whenReconnect_thenErrorsAndNextHealthCheckRecovers() {
        link.connect().block(WAIT);
        goLive("wf-1");
        drain();

        source.failNextConnects(3);
        StepVerifier.create(link.reconnect())
                .expectError(UpstreamUnavailableException.class)
                .verify(WAIT);
        then(link.isConnected()).isFalse();

        StepVerifier.create(link.checkHealth()).verifyComplete();
        then(link.isConnected()).isTrue();
        then(source.listened()).containsExactly("wf-1");
    }

    @Test
    void givenChannelGoesLiveThenIdle_whenDrained_thenListenedThenUnlistened() {
        link.connect().block(WAIT);

        goLive("wf-3");
        drain();
        then(source.listened()).containsExactly("wf-3");

        goIdle("wf-3");
        drain();
        then(source.listened()).isEmpty();
        then(source.count("LISTEN wf-3")).isEqualTo(1);
        then(source.count("UNLISTEN wf-3")).isEqualTo(1);
    }

    @Test
    void givenRepeatedRegistration_whenAlreadyRequested_thenSingleListen() {
        link.connect().block(WAIT);

        link.registerChannel("wf-1");
        link.registerChannel("wf-1");
        link.deregisterChannel("wf-2");
        drain();

        then(source.count("LISTEN wf-1")).isEqualTo(1);
        then(source.calls()).doesNotContain("UNLISTEN wf-2");
    }

    @Test
    void givenLiveIdleLiveBeforeOwnerRuns_whenDrained_thenChannelStaysListened() {
        link.connect().block(WAIT);

        goLive("wf-1");
        goIdle("wf-1");
        goLive("wf-1");
        drain();

        then(source.listened()).containsExactly("wf-1");
        then(link.listeningChannels()).containsExactly("wf-1");
    }

    @Test
    void givenChannelsRequestedWhileDisconnected_whenConnected_thenRegistered() {
        goLive("wf-1");
        drain();
        then(source.calls()).isEmpty();

        link.connect().block(WAIT);

        then(source.listened()).containsExactly("wf-1");
    }

    @Test
    void givenRejectedListen_whenHealthCheckPasses_thenRegistrationRetried() {
        link.connect().block(WAIT);
        source.failListen("wf-bad");

        goLive("wf-bad");
        goLive("wf-ok");
        drain();

        then(source.listened()).containsExactly("wf-ok");
        then(link.registrationFailureCount()).isEqualTo(1);

        source.allowListen("wf-bad");
        link.checkHealth().block(WAIT);

        then(source.listened()).containsExactlyInAnyOrder("wf-ok", "wf-bad");
        then(link.reconnectCount()).isZero();
    }

    @Test
    void givenFailingProbe_whenHealthChecked_thenReconnectsAndRestoresChannels() {
        link.connect().block(WAIT);
        goLive("wf-1");
        drain();

        source.setProbeFails(true);
        link.checkHealth().block(WAIT);
        source.setProbeFails(false);

        then(link.reconnectCount()).isEqualTo(1);
        then(link.isConnected()).isTrue();
        then(source.listened()).containsExactly("wf-1");
    }

    @Test
    void givenTransportReportsLoss_whenDrained_thenReconnectedWithChannels() {
        link.connect().block(WAIT);
        goLive("wf-1");
        goLive("wf-2");
        drain();

        source.dropConnection();
        drain();

        then(link.isConnected()).isTrue();
        then(link.reconnectCount()).isEqualTo(1);
        then(source.listened()).containsExactlyInAnyOrder("wf-1", "wf-2");
    }

    @Test
    void givenNotification_whenReceived_thenHandedToSinkWithArrivalTime() {
        link.connect().block(WAIT);

        source.emit("wf-1", "{\"id\":1}");

        then(received).containsExactly(new NotificationEvent("wf-1", "{\"id\":1}", clock.instant()));
        then(link.notificationsReceived()).isEqualTo(1);
    }

    @Test
    void givenConnected_whenDisconnectedTwice_thenSecondIsNoop() {
        link.connect().block(WAIT);

        StepVerifier.create(link.disconnect()).verifyComplete();
        StepVerifier.create(link.disconnect()).verifyComplete();

        then(link.isConnected()).isFalse();
        then(source.count("CLOSE")).isEqualTo(1);
    }

    @Test
    void givenConnected_whenHealthRequested_thenHealthy() {
        link.connect().block(WAIT);
        goLive("wf-1");
        drain();

        StepVerifier.create(link.health())
                .assertNext(h -> {
                    then(h.status()).isEqualTo(UpstreamHealth.Status.HEALTHY);
                    then(h.details()).containsEntry("connection", "active").containsEntry("listeners", 1);
                })
                .verifyComplete();
    }

    @Test
    void givenDisconnected_whenHealthRequested_thenUnhealthyWithoutError() {
        StepVerifier.create(link.health())
                .assertNext(h -> {
                    then(h.isHealthy()).isFalse();
                    then(h.details()).containsEntry("connection", "inactive");
                })
                .verifyComplete();
    }

    @Test
    void givenClosedLink_whenCommandIssued_thenRejected() {
        link.close();

        StepVerifier.create(link.connect())
                .expectError(IllegalStateException.class)
                .verify(WAIT);
    }
}
