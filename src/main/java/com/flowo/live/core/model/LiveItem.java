package com.flowo.live.core.model;

/**
 * Element of a client session's live stream: either a {@link NotificationEvent}
 * or a synthetic {@link Heartbeat}.
 */
public interface LiveItem {
}
