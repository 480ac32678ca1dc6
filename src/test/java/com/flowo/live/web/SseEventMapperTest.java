package com.flowo.live.web;

import com.flowo.live.config.JacksonConfig;
import com.flowo.live.core.model.Heartbeat;
import com.flowo.live.core.model.LiveItem;
import com.flowo.live.core.model.NotificationEvent;
import org.junit.jupiter.api.Test;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.BDDAssertions.then;

class SseEventMapperTest {

    private final SseEventMapper mapper = new SseEventMapper(new JacksonConfig().objectMapper());

    private static NotificationEvent event(String payload) {
        return new NotificationEvent("workflow_events_wf-1", payload, Instant.EPOCH);
    }

    @Test
    void givenStream_whenMapped_thenConnectedFrameFirst() {
        Flux<LiveItem> items = Flux.just(new Heartbeat(Instant.EPOCH));

        StepVerifier.create(mapper.toSse(items, null))
                .assertNext(sse -> {
                    then(sse.event()).isEqualTo("connected");
                    then(sse.data()).isEqualTo("ok");
                })
                .assertNext(sse -> then(sse.comment()).isEqualTo("heartbeat"))
                .verifyComplete();
    }

    @Test
    void givenTriggerPayload_whenMapped_thenMessageWithTimestampId() {
        String payload = "{ \"table\": \"workflows\", \"operation\": \"UPDATE\", \"workflow_id\": \"wf-1\","
                + " \"timestamp\": 1700000000.25, \"new_status\": \"RUNNING\" }";

        Optional<ServerSentEvent<String>> sse = mapper.map(event(payload), null);

        then(sse).hasValueSatisfying(e -> {
            then(e.event()).isEqualTo("message");
            then(e.id()).isEqualTo("1700000000.25");
            then(e.data()).isEqualTo("{\"table\":\"workflows\",\"operation\":\"UPDATE\",\"workflow_id\":\"wf-1\","
                    + "\"timestamp\":1700000000.25,\"new_status\":\"RUNNING\"}");
        });
    }

    @Test
    void givenIntegerTimestamp_whenMapped_thenPlainId() {
        then(mapper.map(event("{\"timestamp\":1700000000}"), null))
                .hasValueSatisfying(e -> then(e.id()).isEqualTo("1700000000"));
    }

    @Test
    void givenNoTimestamp_whenMapped_thenNoId() {
        then(mapper.map(event("{\"id\":7}"), null))
                .hasValueSatisfying(e -> then(e.id()).isNull());
    }

    @Test
    void givenMalformedPayload_whenStreamed_thenSkippedAndStreamContinues() {
        Flux<LiveItem> items = Flux.just(event("not json"), event(""), event("{\"ok\":true}"));

        StepVerifier.create(mapper.toSse(items, null))
                .expectNextMatches(sse -> "connected".equals(sse.event()))
                .expectNextMatches(sse -> "{\"ok\":true}".equals(sse.data()))
                .verifyComplete();
    }

    @Test
    void givenScopeKey_whenPayloadOfOtherWorkflow_thenFiltered() {
        then(mapper.map(event("{\"workflow_id\":\"wf-2\"}"), "wf-1")).isEmpty();
        then(mapper.map(event("{\"workflow_id\":\"wf-1\"}"), "wf-1")).isPresent();
        then(mapper.map(event("{\"table\":\"jobs\"}"), "wf-1")).isPresent();
    }
}
