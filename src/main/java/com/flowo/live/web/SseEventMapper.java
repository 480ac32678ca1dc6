package com.flowo.live.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowo.live.core.model.Heartbeat;
import com.flowo.live.core.model.LiveItem;
import com.flowo.live.core.model.NotificationEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Optional;

/**
 * Frames a session's live stream as Server-Sent Events.
 *
 * <h2>Wire format</h2>
 * <pre>
 * event: connected          first frame of every stream
 * data: ok
 *
 * event: message            one per notification
 * id: 1700000000.12         the payload's "timestamp", when present
 * data: {"table":"workflows",...}
 *
 * :heartbeat                after each idle poll timeout
 * </pre>
 *
 * <h2>Filtering</h2>
 * <ul>
 *   <li>Payloads that are not valid JSON are logged and skipped; the stream continues.</li>
 *   <li>With a scope key, payloads carrying a different {@code workflow_id} are skipped.</li>
 * </ul>
 */
@Component
public class SseEventMapper {

    private static final Logger log = LoggerFactory.getLogger(SseEventMapper.class);

    static final String CONNECTED_EVENT = "connected";
    static final String MESSAGE_EVENT = "message";
    static final String HEARTBEAT_COMMENT = "heartbeat";

    private final ObjectMapper objectMapper;

    public SseEventMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Flux<ServerSentEvent<String>> toSse(Flux<LiveItem> items, String scopeKey) {
        return Flux.concat(
                Flux.just(connected()),
                items.<ServerSentEvent<String>>handle((item, sink) -> map(item, scopeKey).ifPresent(sink::next)));
    }

    ServerSentEvent<String> connected() {
        return ServerSentEvent.<String>builder()
                .event(CONNECTED_EVENT)
                .data("ok")
                .build();
    }

    Optional<ServerSentEvent<String>> map(LiveItem item, String scopeKey) {
        if (item instanceof Heartbeat) {
            return Optional.of(ServerSentEvent.<String>builder().comment(HEARTBEAT_COMMENT).build());
        }
        if (item instanceof NotificationEvent event) {
            return message(event, scopeKey);
        }
        log.warn("Unsupported live item type={}", item == null ? null : item.getClass().getName());
        return Optional.empty();
    }

    private Optional<ServerSentEvent<String>> message(NotificationEvent event, String scopeKey) {
        JsonNode payload;
        String data;
        try {
            payload = objectMapper.readTree(event.payload());
            if (payload == null || payload.isMissingNode()) {
                log.warn("Skipping empty payload channel={}", event.channel());
                return Optional.empty();
            }
            data = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed payload channel={} err={}", event.channel(), e.getOriginalMessage());
            return Optional.empty();
        }

        if (scopeKey != null && !matchesScope(payload, scopeKey)) {
            return Optional.empty();
        }

        ServerSentEvent.Builder<String> builder = ServerSentEvent.<String>builder()
                .event(MESSAGE_EVENT)
                .data(data);
        eventId(payload).ifPresent(builder::id);
        return Optional.of(builder.build());
    }

    private static boolean matchesScope(JsonNode payload, String scopeKey) {
        JsonNode workflowId = payload.get("workflow_id");
        if (workflowId == null || workflowId.isNull()) {
            return true;
        }
        return scopeKey.equals(workflowId.asText());
    }

    /**
     * Event id from the payload's {@code timestamp}. Numbers keep their plain decimal form.
     */
    private static Optional<String> eventId(JsonNode payload) {
        JsonNode ts = payload.get("timestamp");
        if (ts == null || ts.isNull()) {
            return Optional.empty();
        }
        if (ts.isNumber()) {
            return Optional.of(ts.decimalValue().toPlainString());
        }
        return Optional.of(ts.asText());
    }
}
