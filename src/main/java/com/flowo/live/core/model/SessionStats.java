package com.flowo.live.core.model;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Point-in-time view of one attached session.
 *
 * @param queued  events currently waiting in the session's queue
 * @param dropped events discarded because the queue was full
 */
public record SessionStats(UUID id, Set<String> channels, String scopeKey, int queued, long dropped,
        Instant createdAt) {
}
