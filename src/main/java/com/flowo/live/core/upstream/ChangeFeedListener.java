package com.flowo.live.core.upstream;

/**
 * Callbacks from a {@link ChangeFeedSource} connection.
 */
public interface ChangeFeedListener {

    /**
     * A notification arrived. Called on the transport's I/O thread; must not block.
     */
    void onNotification(String channel, String payload);

    /**
     * The connection terminated without being closed by its owner.
     */
    void onConnectionLost(Throwable cause);
}
