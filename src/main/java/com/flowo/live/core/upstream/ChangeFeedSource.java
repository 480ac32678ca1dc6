package com.flowo.live.core.upstream;

import reactor.core.publisher.Mono;

/**
 * Transport seam for the single upstream change-feed connection.
 *
 * <p>The source holds at most one connection. It is driven by exactly one owner
 * ({@link UpstreamLink}), which serializes every call, so implementations need not
 * guard against concurrent use of the methods below.</p>
 *
 * <p>All methods are lazy: nothing happens until the returned {@link Mono} is subscribed.</p>
 */
public interface ChangeFeedSource {

    /**
     * Short transport name used in logs and health output ({@code postgres}, {@code nats}, ...).
     */
    String name();

    /**
     * Opens a new connection, closing any previous one first. Notifications for channels
     * registered later are delivered to {@code listener}.
     */
    Mono<Void> connect(ChangeFeedListener listener);

    /** Starts receiving notifications for {@code channel} on the current connection. */
    Mono<Void> listen(String channel);

    /** Stops receiving notifications for {@code channel} on the current connection. */
    Mono<Void> unlisten(String channel);

    /** Round trip on the current connection; errors if the connection is unusable. */
    Mono<Void> probe();

    /** Closes the current connection, if any. Does not report a connection loss. */
    Mono<Void> close();
}
