package com.flowo.live.core.dispatch;

import com.flowo.live.core.model.NotificationEvent;
import com.flowo.live.core.queue.SubscriberQueue;
import com.flowo.live.core.registry.SubscriptionRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * Delivers each upstream notification to every subscriber queue of its channel.
 *
 * <p>Runs on the upstream notification thread. Every offer is non-blocking and a full
 * queue only costs its own subscriber the event, so delivery to one subscriber never
 * depends on the state of another subscriber's queue.</p>
 */
public class FanoutDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FanoutDispatcher.class);

    private final SubscriptionRegistry registry;

    private final LongAdder delivered = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public FanoutDispatcher(SubscriptionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return number of subscriber queues the event was added to
     */
    public int dispatch(NotificationEvent event) {
        List<SubscriberQueue> targets = registry.subscribersOf(event.channel());
        if (targets.isEmpty()) {
            log.debug("No subscribers for channel={}, notification discarded", event.channel());
            return 0;
        }

        int accepted = 0;
        for (SubscriberQueue queue : targets) {
            try {
                SubscriberQueue.Offer offer = queue.offer(event);
                if (offer.isQueued()) {
                    accepted++;
                }
                if (offer != SubscriberQueue.Offer.QUEUED) {
                    dropped.increment();
                    log.debug("Subscriber queue full channel={} capacity={} policy={} dropsForQueue={}",
                            event.channel(), queue.capacity(), queue.policy(), queue.droppedCount());
                }
            } catch (RuntimeException e) {
                dropped.increment();
                log.warn("Delivery failed channel={} err={}", event.channel(), e.toString(), e);
            }
        }
        delivered.add(accepted);
        return accepted;
    }

    public long deliveredCount() {
        return delivered.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }
}
