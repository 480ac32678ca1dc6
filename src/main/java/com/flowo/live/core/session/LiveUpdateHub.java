package com.flowo.live.core.session;

import com.flowo.live.core.channel.LiveChannels;
import com.flowo.live.core.dispatch.FanoutDispatcher;
import com.flowo.live.core.model.HubStats;
import com.flowo.live.core.model.SessionStats;
import com.flowo.live.core.model.UpstreamHealth;
import com.flowo.live.core.queue.SubscriberQueue;
import com.flowo.live.core.registry.SubscriptionRegistry;
import com.flowo.live.core.upstream.UpstreamLink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Control surface of the live-update fan-out: attach, detach, stats and health.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>One instance per process, created at startup and passed by reference.</li>
 *   <li>{@link #close()} detaches every session and releases the session thread pool.
 *       The upstream link has its own lifecycle.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Each streaming session blocks one thread of a dedicated bounded-elastic scheduler while
 * it waits on its queue. The pool is capped at {@link HubSettings#maxSessions()}, and attach
 * refuses sessions beyond that cap.
 */
public class LiveUpdateHub implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LiveUpdateHub.class);

    private final SubscriptionRegistry registry;
    private final FanoutDispatcher dispatcher;
    private final UpstreamLink link;
    private final HubSettings settings;
    private final Clock clock;

    private final Scheduler sessionScheduler;
    private final Map<UUID, ClientSession> sessions = new ConcurrentHashMap<>();
    private final AtomicInteger slots = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    public LiveUpdateHub(
            SubscriptionRegistry registry,
            FanoutDispatcher dispatcher,
            UpstreamLink link,
            HubSettings settings,
            Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.link = Objects.requireNonNull(link, "link");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionScheduler = Schedulers.newBoundedElastic(
                settings.maxSessions(),
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "live-session",
                60,
                true);
    }

    /**
     * Attaches a new session to the authorized subset of {@code requested}.
     *
     * <p>Validation happens before any side effect: a forbidden or malformed request leaves
     * the registry and the upstream untouched.</p>
     *
     * @param requested  channels the client asked for
     * @param authorized channels the caller may subscribe to
     * @param scopeKey   optional secondary filter applied by the wire adapter; may be {@code null}
     * @throws IllegalArgumentException       if a requested channel name is malformed
     * @throws ForbiddenChannelException      if no requested channel is authorized
     * @throws SessionLimitExceededException  if the hub is at capacity
     */
    public ClientSession attach(Collection<String> requested, Set<String> authorized, String scopeKey) {
        Objects.requireNonNull(requested, "requested");
        Objects.requireNonNull(authorized, "authorized");
        if (closed.get()) {
            throw new IllegalStateException("Live update hub is closed");
        }

        Set<String> channels = new LinkedHashSet<>();
        for (String channel : requested) {
            LiveChannels.requireValid(channel);
            if (authorized.contains(channel)) {
                channels.add(channel);
            }
        }
        if (channels.isEmpty()) {
            throw new ForbiddenChannelException(requested);
        }

        if (slots.incrementAndGet() > settings.maxSessions()) {
            slots.decrementAndGet();
            throw new SessionLimitExceededException(settings.maxSessions());
        }

        ClientSession session = new ClientSession(
                UUID.randomUUID(),
                channels,
                new SubscriberQueue(settings.queueCapacity(), settings.overflowPolicy()),
                scopeKey == null || scopeKey.isBlank() ? null : scopeKey,
                settings.pollTimeout(),
                sessionScheduler,
                clock,
                this::detach);
        sessions.put(session.id(), session);

        try {
            for (String channel : channels) {
                registry.subscribe(channel, session.queue());
            }
        } catch (RuntimeException e) {
            detach(session);
            throw e;
        }
        session.markStreaming();

        log.info("Session attached id={} channels={} scope={} clients={}",
                session.id(), channels, session.scopeKey().orElse("-"), sessions.size());
        return session;
    }

    /**
     * Unregisters the session from every channel, discards its queue and forgets it.
     * A second call is a no-op.
     */
    public void detach(ClientSession session) {
        if (!session.markDetached()) {
            return;
        }
        try {
            for (String channel : session.channels()) {
                registry.unsubscribe(channel, session.queue());
            }
        } finally {
            session.queue().clear();
            if (sessions.remove(session.id()) != null) {
                slots.decrementAndGet();
            }
            log.info("Session detached id={} dropped={} clients={}",
                    session.id(), session.queue().droppedCount(), sessions.size());
        }
    }

    public HubStats stats() {
        List<SessionStats> perSession = new ArrayList<>();
        for (ClientSession session : sessions.values()) {
            perSession.add(session.stats());
        }
        perSession.sort(Comparator.comparing(SessionStats::createdAt));

        Map<String, Integer> counts = registry.subscriberCounts();
        return new HubStats(
                sessions.size(),
                counts.size(),
                link.isConnected(),
                counts,
                link.notificationsReceived(),
                dispatcher.deliveredCount(),
                dispatcher.droppedCount(),
                link.reconnectCount(),
                link.registrationFailureCount(),
                perSession,
                clock.instant());
    }

    /** Probes the upstream connection. */
    public Mono<UpstreamHealth> health() {
        return link.health();
    }

    public int sessionCount() {
        return sessions.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<ClientSession> open = new ArrayList<>(sessions.values());
        for (ClientSession session : open) {
            detach(session);
        }
        sessionScheduler.dispose();
        log.info("Live update hub closed, detached {} sessions", open.size());
    }
}
