package com.flowo.live.core.model;

import java.time.Instant;

/**
 * Keep-alive marker produced by a session when no event arrived within the poll timeout.
 */
public record Heartbeat(Instant at) implements LiveItem {
}
