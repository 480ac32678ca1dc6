package com.flowo.live.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot returned by the hub's stats operation.
 *
 * <p>Counters are cumulative since process start; the remaining fields describe the
 * state at {@code timestamp}.</p>
 *
 * @param connectedClients      sessions currently attached
 * @param liveChannels          channels with at least one subscriber
 * @param upstreamConnected     whether the change-feed connection is up
 * @param channelSubscribers    subscriber count per live channel
 * @param notificationsReceived notifications received from upstream
 * @param eventsDelivered       events added to a subscriber queue (one per subscriber)
 * @param eventsDropped         events discarded by full queues, rejected or evicted
 * @param reconnects            reconnect cycles started
 * @param registrationFailures  failed LISTEN/subscribe attempts
 * @param sessions              per-session view
 */
public record HubStats(
        int connectedClients,
        int liveChannels,
        boolean upstreamConnected,
        Map<String, Integer> channelSubscribers,
        long notificationsReceived,
        long eventsDelivered,
        long eventsDropped,
        long reconnects,
        long registrationFailures,
        List<SessionStats> sessions,
        Instant timestamp) {
}
