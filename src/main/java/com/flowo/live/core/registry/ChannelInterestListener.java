package com.flowo.live.core.registry;

/**
 * Receives the empty/non-empty transitions of registry entries.
 *
 * <p>Both callbacks run while the registry's coordination lock is held, so implementations
 * must return quickly and must not block or call back into the registry from another thread.</p>
 */
public interface ChannelInterestListener {

    /** First subscriber appeared on {@code channel}. */
    void onChannelLive(String channel);

    /** Last subscriber left {@code channel}. */
    void onChannelIdle(String channel);
}
