package com.flowo.live.core.model;

/**
 * Lifecycle of a client session.
 *
 * <pre>
 *   ATTACHING ──subscribed to every channel──▶ STREAMING
 *       │                                          │
 *       └───────── detach / failure ──────▶ DETACHED ◀┘
 * </pre>
 *
 * {@code DETACHED} is terminal.
 */
public enum SessionState {

    /** Queue created, channel subscriptions in progress. */
    ATTACHING,

    /** Registered on every channel; the stream may be consumed. */
    STREAMING,

    /** Unsubscribed and discarded. No further events are delivered. */
    DETACHED
}
