package com.flowo.live.core.registry;

import com.flowo.live.core.queue.SubscriberQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routing table: channel name to the set of subscriber queues that want it.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Queues are compared by identity. The same queue is held at most once per channel.</li>
 *   <li>An entry exists only while it is non-empty. A channel is "live" exactly while it has an entry.</li>
 *   <li>{@link ChannelInterestListener#onChannelLive} fires once per empty to non-empty transition
 *       and {@link ChannelInterestListener#onChannelIdle} once per non-empty to empty transition,
 *       both inside the lock, so the upstream registration decision cannot interleave with a
 *       concurrent subscribe/unsubscribe of the same channel.</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * One lock guards the table. It is held for the table mutation and the registration decision
 * only, never while pushing into a queue or waiting on I/O. Readers receive copies.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Set<SubscriberQueue>> routes = new HashMap<>();
    private final ChannelInterestListener interest;

    public SubscriptionRegistry(ChannelInterestListener interest) {
        this.interest = Objects.requireNonNull(interest, "interest");
    }

    /**
     * Adds {@code queue} to {@code channel}. When it is the channel's first subscriber the
     * upstream registration is requested before this method returns, so the caller starts
     * receiving as soon as the upstream confirms.
     */
    public void subscribe(String channel, SubscriberQueue queue) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(queue, "queue");
        lock.lock();
        try {
            Set<SubscriberQueue> subscribers = routes.get(channel);
            boolean first = subscribers == null;
            if (first) {
                subscribers = Collections.newSetFromMap(new IdentityHashMap<>());
                routes.put(channel, subscribers);
            }
            if (!subscribers.add(queue)) {
                return;
            }
            if (first) {
                try {
                    interest.onChannelLive(channel);
                } catch (RuntimeException e) {
                    routes.remove(channel);
                    throw e;
                }
                log.debug("Channel live: {}", channel);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes {@code queue} from {@code channel}. Idempotent: unknown channels and queues are ignored.
     * Removing the last subscriber deletes the entry and requests upstream deregistration.
     */
    public void unsubscribe(String channel, SubscriberQueue queue) {
        lock.lock();
        try {
            Set<SubscriberQueue> subscribers = routes.get(channel);
            if (subscribers == null || !subscribers.remove(queue)) {
                return;
            }
            if (subscribers.isEmpty()) {
                routes.remove(channel);
                interest.onChannelIdle(channel);
                log.debug("Channel idle: {}", channel);
            }
        } finally {
            lock.unlock();
        }
    }

    /** Point-in-time copy of the channel's subscribers; empty if the channel is not live. */
    public List<SubscriberQueue> subscribersOf(String channel) {
        lock.lock();
        try {
            Set<SubscriberQueue> subscribers = routes.get(channel);
            return subscribers == null ? List.of() : List.copyOf(subscribers);
        } finally {
            lock.unlock();
        }
    }

    /** Point-in-time copy of the live channel names. */
    public Set<String> currentChannels() {
        lock.lock();
        try {
            return Set.copyOf(routes.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** Subscriber count per live channel, sorted by channel name. */
    public Map<String, Integer> subscriberCounts() {
        lock.lock();
        try {
            Map<String, Integer> out = new TreeMap<>();
            routes.forEach((channel, subscribers) -> out.put(channel, subscribers.size()));
            return out;
        } finally {
            lock.unlock();
        }
    }
}
