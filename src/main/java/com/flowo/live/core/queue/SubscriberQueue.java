package com.flowo.live.core.queue;

import com.flowo.live.core.model.NotificationEvent;
import com.flowo.live.core.model.OverflowPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Bounded mailbox owned by exactly one client session.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #offer(NotificationEvent)} never blocks. It is called from the upstream
 *       notification thread, so a slow consumer must never stall it.</li>
 *   <li>{@link #poll(Duration)} blocks the consuming thread up to the given timeout.</li>
 *   <li>Order is FIFO for the events that were accepted.</li>
 * </ul>
 *
 * <h2>Overflow</h2>
 * With {@link OverflowPolicy#DROP_NEWEST} a full queue rejects the incoming event.
 * With {@link OverflowPolicy#DROP_OLDEST} the oldest queued events are evicted until the
 * incoming one fits. Either way every discarded event is counted in {@link #droppedCount()}.
 */
public final class SubscriberQueue {

    private final int capacity;
    private final OverflowPolicy policy;
    private final BlockingQueue<NotificationEvent> buffer;
    private final LongAdder dropped = new LongAdder();

    public SubscriberQueue(int capacity, OverflowPolicy policy) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
        this.policy = Objects.requireNonNull(policy, "policy");
        this.buffer = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Result of one {@link #offer(NotificationEvent)}.
     */
    public enum Offer {
        /** Queued; nothing discarded. */
        QUEUED,
        /** Queued after evicting the oldest event (DROP_OLDEST). */
        QUEUED_EVICTING_OLDEST,
        /** Not queued (DROP_NEWEST). */
        REJECTED;

        public boolean isQueued() {
            return this != REJECTED;
        }
    }

    /**
     * Enqueues without blocking. A full queue applies the overflow policy.
     */
    public Offer offer(NotificationEvent event) {
        Objects.requireNonNull(event, "event");
        if (buffer.offer(event)) {
            return Offer.QUEUED;
        }
        switch (policy) {
            case DROP_NEWEST -> {
                dropped.increment();
                return Offer.REJECTED;
            }
            case DROP_OLDEST -> {
                while (!buffer.offer(event)) {
                    if (buffer.poll() != null) {
                        dropped.increment();
                    }
                }
                return Offer.QUEUED_EVICTING_OLDEST;
            }
            default -> throw new IllegalStateException("Unhandled overflow policy: " + policy);
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the next event, or {@code null} if none arrived in time
     */
    public NotificationEvent poll(Duration timeout) throws InterruptedException {
        return buffer.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /** Discards everything still queued. */
    public void clear() {
        buffer.clear();
    }

    public int size() {
        return buffer.size();
    }

    public int capacity() {
        return capacity;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    public long droppedCount() {
        return dropped.sum();
    }
}
