package com.flowo.live.web;

import com.flowo.live.config.JacksonConfig;
import com.flowo.live.core.dispatch.FanoutDispatcher;
import com.flowo.live.core.model.OverflowPolicy;
import com.flowo.live.core.registry.ChannelInterestListener;
import com.flowo.live.core.registry.SubscriptionRegistry;
import com.flowo.live.core.session.HubSettings;
import com.flowo.live.core.session.LiveUpdateHub;
import com.flowo.live.core.upstream.RecordingChangeFeedSource;
import com.flowo.live.core.upstream.UpstreamLink;
import com.flowo.live.core.upstream.UpstreamSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

class LiveEventsControllerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE =
            new ParameterizedTypeReference<>() {
            };

    private final RecordingChangeFeedSource source = new RecordingChangeFeedSource();
    private final SseEventMapper mapper = new SseEventMapper(new JacksonConfig().objectMapper());

    private SubscriptionRegistry registry;
    private UpstreamLink link;
    private LiveUpdateHub hub;

    @BeforeEach
    void setUp() {
        registry = new SubscriptionRegistry(new ChannelInterestListener() {
            @Override
            public void onChannelLive(String channel) {
                link.registerChannel(channel);
            }

            @Override
            public void onChannelIdle(String channel) {
                link.deregisterChannel(channel);
            }
        });
        FanoutDispatcher dispatcher = new FanoutDispatcher(registry);
        link = new UpstreamLink(
                source,
                new UpstreamSettings(Duration.ofHours(1), Duration.ofSeconds(1), Duration.ofSeconds(1), 1,
                        Duration.ofMillis(10), Duration.ofMillis(10)),
                registry::currentChannels,
                dispatcher::dispatch,
                Clock.systemUTC());
        // Long poll timeout keeps heartbeat comments out of the asserted frames.
        hub = new LiveUpdateHub(registry, dispatcher, link,
                new HubSettings(10, OverflowPolicy.DROP_NEWEST, Duration.ofSeconds(30), 2),
                Clock.systemUTC());
        link.connect().block(WAIT);
    }

    @AfterEach
    void tearDown() {
        hub.close();
        link.close();
    }

    private WebTestClient client(ChannelAuthorizer authorizer) {
        return WebTestClient
                .bindToController(new LiveEventsController(hub, authorizer, mapper), new LiveHubAdminController(hub))
                .controllerAdvice(new LiveHubExceptionHandler())
                .configureClient()
                .responseTimeout(WAIT)
                .build();
    }

    private WebTestClient client() {
        return client(new DefaultChannelAuthorizer());
    }

    @Test
    void givenNoChannelParameters_whenEventsRequested_thenBadRequest() {
        client().get().uri("/api/v1/sse/events")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("bad_request");

        then(hub.sessionCount()).isZero();
    }

    @Test
    void givenMalformedWorkflowId_whenEventsRequested_thenBadRequest() {
        client().get().uri("/api/v1/sse/events?workflow_ids=wf 1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("bad_request");
    }

    @Test
    void givenUnauthorizedChannels_whenEventsRequested_thenForbidden() {
        ChannelAuthorizer denyAll = mock(ChannelAuthorizer.class);
        given(denyAll.authorize(anyCollection())).willReturn(Set.of());

        client(denyAll).get().uri("/api/v1/sse/events?workflow_ids=wf-1")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("forbidden_channel");

        then(registry.currentChannels()).isEmpty();
    }

    @Test
    void givenHubFull_whenEventsRequested_thenServiceUnavailable() {
        hub.attach(List.of("workflow_events_a"), Set.of("workflow_events_a"), null);
        hub.attach(List.of("workflow_events_b"), Set.of("workflow_events_b"), null);

        client().get().uri("/api/v1/sse/events?workflow_ids=c")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.code").isEqualTo("session_limit");
    }

    @Test
    void givenSubscribedClient_whenNotificationArrives_thenConnectedThenMessage() {
        Flux<ServerSentEvent<String>> body = client().get()
                .uri("/api/v1/sse/events?workflow_ids=wf-1&global_insert=true")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SSE)
                .getResponseBody();

        StepVerifier.create(body)
                .assertNext(sse -> {
                    then(sse.event()).isEqualTo("connected");
                    then(sse.data()).isEqualTo("ok");
                })
                .then(() -> {
                    then(registry.currentChannels())
                            .containsExactlyInAnyOrder("workflow_events_wf-1", "workflows_global_insert");
                    source.emit("workflow_events_wf-1", "{\"workflow_id\":\"wf-1\",\"timestamp\":1700000000.5}");
                })
                .assertNext(sse -> {
                    then(sse.event()).isEqualTo("message");
                    then(sse.id()).isEqualTo("1700000000.5");
                    then(sse.data()).isEqualTo("{\"workflow_id\":\"wf-1\",\"timestamp\":1700000000.5}");
                })
                .thenCancel()
                .verify(WAIT);
    }

    @Test
    void givenStreamingClient_whenBodyCancelled_thenChannelReleased() {
        Flux<ServerSentEvent<String>> body = client().get()
                .uri("/api/v1/sse/events?workflow_ids=wf-1")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SSE)
                .getResponseBody();

        StepVerifier.create(body)
                .expectNextMatches(sse -> "connected".equals(sse.event()))
                .then(() -> then(registry.currentChannels()).containsExactly("workflow_events_wf-1"))
                .thenCancel()
                .verify(WAIT);

        then(hub.sessionCount()).isZero();
        then(registry.currentChannels()).doesNotContain("workflow_events_wf-1");
        link.drain().block(WAIT);
        then(source.count("UNLISTEN workflow_events_wf-1")).isEqualTo(1);
    }

    @Test
    void givenResponseBodyNotSubscribed_whenHandled_thenNoSessionAttached() {
        LiveEventsController controller = new LiveEventsController(hub, new DefaultChannelAuthorizer(), mapper);

        Flux<ServerSentEvent<String>> body = controller.events("wf-1", false, null);

        then(hub.sessionCount()).isZero();
        then(registry.currentChannels()).isEmpty();

        StepVerifier.create(body)
                .expectNextMatches(sse -> "connected".equals(sse.event()))
                .then(() -> then(hub.sessionCount()).isEqualTo(1))
                .thenCancel()
                .verify(WAIT);

        then(hub.sessionCount()).isZero();
        then(registry.currentChannels()).isEmpty();
    }

    @Test
    void givenScopedClient_whenOtherWorkflowNotified_thenOnlyOwnPayloadsDelivered() {
        Flux<ServerSentEvent<String>> body = client().get()
                .uri("/api/v1/sse/events?global_insert=true&workflow_id=wf-1")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SSE)
                .getResponseBody();

        StepVerifier.create(body)
                .expectNextMatches(sse -> "connected".equals(sse.event()))
                .then(() -> {
                    source.emit("workflows_global_insert", "{\"workflow_id\":\"wf-2\"}");
                    source.emit("workflows_global_insert", "{\"workflow_id\":\"wf-1\"}");
                })
                .assertNext(sse -> then(sse.data()).isEqualTo("{\"workflow_id\":\"wf-1\"}"))
                .thenCancel()
                .verify(WAIT);
    }

    @Test
    void givenSessions_whenStatsRequested_thenCountsReturned() {
        hub.attach(List.of("workflow_events_wf-1"), Set.of("workflow_events_wf-1"), null);

        client().get().uri("/api/v1/sse/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.connectedClients").isEqualTo(1)
                .jsonPath("$.upstreamConnected").isEqualTo(true)
                .jsonPath("$.channelSubscribers['workflow_events_wf-1']").isEqualTo(1);
    }

    @Test
    void givenConnectedUpstream_whenHealthRequested_thenOk() {
        client().get().uri("/api/v1/sse/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("HEALTHY");
    }

    @Test
    void givenDisconnectedUpstream_whenHealthRequested_thenServiceUnavailable() {
        link.disconnect().block(WAIT);

        client().get().uri("/api/v1/sse/health")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.status").isEqualTo("UNHEALTHY");
    }
}
