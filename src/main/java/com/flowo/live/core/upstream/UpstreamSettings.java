package com.flowo.live.core.upstream;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing knobs of the {@link UpstreamLink}.
 *
 * @param healthInterval       period of the health loop
 * @param probeTimeout         max time for a probe or a single LISTEN/UNLISTEN
 * @param connectTimeout       max time for a single connect attempt
 * @param reconnectMaxAttempts retries per reconnect cycle before waiting for the next health tick
 * @param reconnectMinBackoff  first retry delay
 * @param reconnectMaxBackoff  retry delay ceiling
 */
public record UpstreamSettings(
        Duration healthInterval,
        Duration probeTimeout,
        Duration connectTimeout,
        int reconnectMaxAttempts,
        Duration reconnectMinBackoff,
        Duration reconnectMaxBackoff) {

    public UpstreamSettings {
        Objects.requireNonNull(healthInterval, "healthInterval");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(reconnectMinBackoff, "reconnectMinBackoff");
        Objects.requireNonNull(reconnectMaxBackoff, "reconnectMaxBackoff");
        if (reconnectMaxAttempts < 0) {
            throw new IllegalArgumentException("reconnectMaxAttempts must be >= 0");
        }
    }
}
