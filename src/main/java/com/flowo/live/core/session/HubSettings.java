package com.flowo.live.core.session;

import com.flowo.live.core.model.OverflowPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-session knobs of the {@link LiveUpdateHub}.
 *
 * @param queueCapacity  slots in each session's queue
 * @param overflowPolicy what a full queue discards
 * @param pollTimeout    idle time after which a session emits a heartbeat
 * @param maxSessions    concurrent sessions; also the size of the session thread pool
 */
public record HubSettings(int queueCapacity, OverflowPolicy overflowPolicy, Duration pollTimeout, int maxSessions) {

    public HubSettings {
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(pollTimeout, "pollTimeout");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (maxSessions < 1) {
            throw new IllegalArgumentException("maxSessions must be >= 1");
        }
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be positive");
        }
    }
}
