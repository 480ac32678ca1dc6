package com.flowo.live.web;

import com.flowo.live.core.model.HubStats;
import com.flowo.live.core.model.UpstreamHealth;
import com.flowo.live.core.session.LiveUpdateHub;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Operational endpoints of the live-update hub.
 *
 * <ul>
 *   <li>{@code GET /api/v1/sse/stats}: connection counts, per-channel subscribers, delivery counters.</li>
 *   <li>{@code GET /api/v1/sse/health}: upstream probe; HTTP 503 when unhealthy.</li>
 * </ul>
 */
@RestController
@RequestMapping(path = "/api/v1/sse", produces = MediaType.APPLICATION_JSON_VALUE)
public class LiveHubAdminController {

    private final LiveUpdateHub hub;

    public LiveHubAdminController(LiveUpdateHub hub) {
        this.hub = hub;
    }

    @GetMapping("/stats")
    public Mono<HubStats> stats() {
        return Mono.fromSupplier(hub::stats);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<UpstreamHealth>> health() {
        return hub.health()
                .map(h -> ResponseEntity
                        .status(h.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(h));
    }
}
