package com.flowo.live.web;

import com.flowo.live.core.channel.LiveChannels;
import com.flowo.live.core.session.ClientSession;
import com.flowo.live.core.session.ForbiddenChannelException;
import com.flowo.live.core.session.LiveUpdateHub;
import com.flowo.live.core.session.SessionLimitExceededException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import reactor.core.publisher.Flux;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Server-Sent Events endpoint for dashboard live updates.
 *
 * <pre>
 * GET /api/v1/sse/events?workflow_ids=wf-1,wf-2&amp;global_insert=true&amp;workflow_id=wf-1
 * </pre>
 *
 * <ul>
 *   <li>{@code workflow_ids}: comma-separated workflow ids; each maps to its {@code workflow_events_<id>} channel.</li>
 *   <li>{@code global_insert}: also subscribe to {@code workflows_global_insert}.</li>
 *   <li>{@code workflow_id}: optional scope key; payloads of other workflows are filtered out.</li>
 * </ul>
 *
 * Malformed and forbidden requests are rejected before the response starts. The session is attached
 * when the response body is subscribed and detached when the client goes away.
 */
@RestController
@RequestMapping(path = "/api/v1/sse")
public class LiveEventsController {

    private final LiveUpdateHub hub;
    private final ChannelAuthorizer authorizer;
    private final SseEventMapper mapper;

    public LiveEventsController(LiveUpdateHub hub, ChannelAuthorizer authorizer, SseEventMapper mapper) {
        this.hub = hub;
        this.authorizer = authorizer;
        this.mapper = mapper;
    }

    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> events(
            @RequestParam(name = "workflow_ids", required = false) String workflowIds,
            @RequestParam(name = "global_insert", defaultValue = "false") boolean globalInsert,
            @RequestParam(name = "workflow_id", required = false) String workflowId
    ) {
        List<String> requested = LiveChannels.forRequest(splitIds(workflowIds), globalInsert);
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("Specify workflow_ids or global_insert=true");
        }

        requested.forEach(LiveChannels::requireValid);
        Set<String> authorized = authorizer.authorize(requested);
        if (requested.stream().noneMatch(authorized::contains)) {
            throw new ForbiddenChannelException(requested);
        }

        // Attached on subscription, detached when the body terminates or is cancelled.
        return Flux.using(
                () -> hub.attach(requested, authorized, workflowId),
                session -> mapper.toSse(session.events(), session.scopeKey().orElse(null)),
                ClientSession::detach);
    }

    private static List<String> splitIds(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}

/**
 * Centralized exception mapping for the live-update API.
 *
 * Avoids leaking internal stack traces to callers and provides a consistent error shape.
 */
@RestControllerAdvice
class LiveHubExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LiveHubExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(ForbiddenChannelException.class)
    public ResponseEntity<ApiError> forbidden(ForbiddenChannelException e) {
        log.info("Rejected live subscription requested={}", e.getRequested());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(new ApiError("forbidden_channel", e.getMessage()));
    }

    @ExceptionHandler(SessionLimitExceededException.class)
    public ResponseEntity<ApiError> sessionLimit(SessionLimitExceededException e) {
        log.warn(e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ApiError("session_limit", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        // Log full detail server-side; return a safe message to clients.
        log.error("Live update endpoint failure", e);
        return ResponseEntity.status(500).body(new ApiError("internal_error", "Request failed"));
    }

    record ApiError(String code, String message) {
    }
}
