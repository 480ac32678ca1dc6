package com.flowo.live.core.session;

import com.flowo.live.core.model.Heartbeat;
import com.flowo.live.core.model.LiveItem;
import com.flowo.live.core.model.NotificationEvent;
import com.flowo.live.core.model.SessionState;
import com.flowo.live.core.model.SessionStats;
import com.flowo.live.core.queue.SubscriberQueue;

import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * One connected live-update consumer.
 *
 * <p>Created by {@link LiveUpdateHub#attach}. The session owns its {@link SubscriberQueue};
 * the hub's registry holds the queue on each of the session's channels until
 * {@link #detach()}.</p>
 *
 * <h2>Stream</h2>
 * {@link #events()} is lazy, infinite and can be subscribed once. Its consume loop blocks
 * on the queue (on the hub's session scheduler) and emits:
 * <ul>
 *   <li>each {@link NotificationEvent} as soon as it is dequeued, in arrival order;</li>
 *   <li>a {@link Heartbeat} whenever the poll timeout elapses with nothing to deliver.</li>
 * </ul>
 * Cancellation, completion and error of the stream all detach the session.
 */
public final class ClientSession {

    private final UUID id;
    private final Set<String> channels;
    private final SubscriberQueue queue;
    private final String scopeKey;
    private final Instant createdAt;

    private final Duration pollTimeout;
    private final Scheduler scheduler;
    private final Clock clock;
    private final Consumer<ClientSession> detacher;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.ATTACHING);
    private final AtomicBoolean streamTaken = new AtomicBoolean();

    ClientSession(
            UUID id,
            Set<String> channels,
            SubscriberQueue queue,
            String scopeKey,
            Duration pollTimeout,
            Scheduler scheduler,
            Clock clock,
            Consumer<ClientSession> detacher
    ) {
        this.id = id;
        this.channels = Collections.unmodifiableSet(new LinkedHashSet<>(channels));
        this.queue = queue;
        this.scopeKey = scopeKey;
        this.pollTimeout = pollTimeout;
        this.scheduler = scheduler;
        this.clock = clock;
        this.detacher = detacher;
        this.createdAt = clock.instant();
    }

    public UUID id() {
        return id;
    }

    public Set<String> channels() {
        return channels;
    }

    public Optional<String> scopeKey() {
        return Optional.ofNullable(scopeKey);
    }

    public Instant createdAt() {
        return createdAt;
    }

    public SessionState state() {
        return state.get();
    }

    SubscriberQueue queue() {
        return queue;
    }

    /**
     * The session's event stream. A second subscription, or a subscription after detach,
     * errors with {@link IllegalStateException}.
     */
    public Flux<LiveItem> events() {
        return Flux.defer(() -> {
            if (state.get() != SessionState.STREAMING) {
                return Flux.error(new IllegalStateException("Session " + id + " is " + state.get()));
            }
            if (!streamTaken.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("Session " + id + " stream already consumed"));
            }
            return Flux.<LiveItem>generate(sink -> {
                        if (state.get() == SessionState.DETACHED) {
                            sink.complete();
                            return;
                        }
                        try {
                            NotificationEvent event = queue.poll(pollTimeout);
                            sink.next(event != null ? event : new Heartbeat(clock.instant()));
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            sink.complete();
                        }
                    })
                    .subscribeOn(scheduler)
                    .doFinally(signal -> detach());
        });
    }

    /**
     * Unregisters from every channel and discards queued events. Idempotent.
     */
    public void detach() {
        detacher.accept(this);
    }

    public SessionStats stats() {
        return new SessionStats(id, channels, scopeKey, queue.size(), queue.droppedCount(), createdAt);
    }

    boolean markStreaming() {
        return state.compareAndSet(SessionState.ATTACHING, SessionState.STREAMING);
    }

    /**
     * @return {@code true} only for the call that moved the session to DETACHED
     */
    boolean markDetached() {
        return state.getAndSet(SessionState.DETACHED) != SessionState.DETACHED;
    }

    @Override
    public String toString() {
        return "ClientSession{id=" + id + ", channels=" + channels + ", state=" + state.get() + "}";
    }
}
