package com.flowo.live.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * =====================================================================
 * NotificationEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * One change notification received from the upstream change feed.
 *
 * The payload is opaque to the hub: it is whatever text the database
 * trigger (or publisher) attached to the notification, typically a small
 * JSON document such as
 *
 *   {"table":"workflows","operation":"UPDATE","id":"...","workflow_id":"...",
 *    "timestamp":1700000000.12,"new_status":"RUNNING"}
 *
 * LIFECYCLE
 * ---------
 *  - Created only by the upstream link when a notification arrives
 *  - Shared by reference across every subscriber queue of its channel
 *  - Never persisted
 *
 * Immutable, therefore safe to hand to many consumers at once.
 */
public record NotificationEvent(String channel, String payload, Instant receivedAt) implements LiveItem {

    public NotificationEvent {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(receivedAt, "receivedAt");
        if (payload == null) {
            payload = "";
        }
    }
}
