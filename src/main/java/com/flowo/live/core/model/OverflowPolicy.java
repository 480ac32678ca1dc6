package com.flowo.live.core.model;

/**
 * What a full subscriber queue does with an incoming event.
 */
public enum OverflowPolicy {

    /** Keep the queued events, discard the incoming one. */
    DROP_NEWEST,

    /** Evict the oldest queued event to make room for the incoming one. */
    DROP_OLDEST
}
