package com.flowo.live.core.upstream;

import com.flowo.live.core.model.NotificationEvent;
import com.flowo.live.core.model.UpstreamHealth;
import com.flowo.live.core.registry.ChannelInterestListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Owner of the single upstream change-feed connection.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Keep exactly one connection to the {@link ChangeFeedSource}.</li>
 *   <li>Keep the set of channels registered upstream equal to the registry's live channels.</li>
 *   <li>Hand every incoming notification to the fan-out sink as a {@link NotificationEvent}.</li>
 *   <li>Probe the connection periodically and reconnect (re-registering every live channel) when it fails.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Every operation that touches the connection is a command executed by one owner loop
 * ({@code concatMap} over a single-threaded command stream). Callers only enqueue:
 * {@link #registerChannel(String)} and {@link #deregisterChannel(String)} return immediately,
 * which lets the registry call them while holding its lock. Asynchronous operations return a
 * {@link Mono} that completes when the owner has executed the command.
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>Connect failures surface as {@link UpstreamUnavailableException} and are retried by the
 *       health loop; they never reach client sessions.</li>
 *   <li>A failed LISTEN is logged and counted, and retried on the next healthy probe.</li>
 *   <li>Notifications sent while disconnected are lost. There is no replay.</li>
 * </ul>
 */
public class UpstreamLink implements ChannelInterestListener, ChangeFeedListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UpstreamLink.class);

    /**
     * Max time a producer spins when another thread is emitting a command at the same moment.
     */
    private static final Duration EMIT_SPIN = Duration.ofSeconds(1);

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private enum Kind { CONNECT, LISTEN, UNLISTEN, HEALTH, PROBE, RECONNECT, DISCONNECT, DRAIN }

    private record Command(Kind kind, String channel, Sinks.Empty<Void> done) {
    }

    private final ChangeFeedSource source;
    private final UpstreamSettings settings;
    private final Supplier<Set<String>> liveChannels;
    private final Consumer<NotificationEvent> sink;
    private final Clock clock;

    private final Scheduler ownerScheduler = Schedulers.newSingle("upstream-link", true);
    private final Sinks.Many<Command> commands = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Disposable owner;

    private final AtomicReference<Disposable> healthLoop = new AtomicReference<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    /** Channels the registry wants. Written by registry callbacks, read by the owner. */
    private final Set<String> requested = ConcurrentHashMap.newKeySet();

    /** Channels confirmed on the current connection. Owner only. */
    private final Set<String> listening = ConcurrentHashMap.newKeySet();

    private volatile boolean connected;

    private final LongAdder notificationsReceived = new LongAdder();
    private final LongAdder reconnects = new LongAdder();
    private final LongAdder registrationFailures = new LongAdder();

    /**
     * @param liveChannels point-in-time snapshot of the registry's live channels, used to
     *                     re-register after (re)connecting
     * @param sink         receives every notification; must not block
     */
    public UpstreamLink(
            ChangeFeedSource source,
            UpstreamSettings settings,
            Supplier<Set<String>> liveChannels,
            Consumer<NotificationEvent> sink,
            Clock clock
    ) {
        this.source = Objects.requireNonNull(source, "source");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.liveChannels = Objects.requireNonNull(liveChannels, "liveChannels");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.owner = commands.asFlux()
                .publishOn(ownerScheduler)
                .concatMap(this::execute)
                .subscribe(
                        v -> { },
                        err -> log.error("Upstream link owner terminated unexpectedly: {}", err.toString(), err)
                );
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Starts the periodic health loop and attempts the initial connection.
     *
     * <p>An unreachable upstream is not fatal: it is logged and the health loop keeps
     * retrying. Safe to call more than once.</p>
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Upstream link is closed");
        }
        Disposable loop = Flux.interval(settings.healthInterval(), settings.healthInterval())
                .onBackpressureDrop()
                .concatMap(tick -> checkHealth()
                        .onErrorResume(err -> {
                            log.debug("Health cycle ended with error: {}", err.toString());
                            return Mono.empty();
                        }))
                .subscribe();
        if (!healthLoop.compareAndSet(null, loop)) {
            loop.dispose();
            return;
        }

        log.info("Upstream link started source={} healthInterval={}", source.name(), settings.healthInterval());
        connect().subscribe(
                v -> { },
                err -> log.warn("Initial upstream connect failed, health loop will retry. source={} err={}",
                        source.name(), err.getMessage())
        );
    }

    /**
     * Establishes the connection (closing an existing one first) and registers every live channel.
     * Errors with {@link UpstreamUnavailableException} if the source cannot be reached.
     */
    public Mono<Void> connect() {
        return enqueue(Kind.CONNECT, null);
    }

    /**
     * Closes the connection and stops the health loop. Idempotent.
     */
    public Mono<Void> disconnect() {
        stopHealthLoop();
        return enqueue(Kind.DISCONNECT, null);
    }

    /**
     * One health cycle: probe, then either retry pending registrations or reconnect.
     */
    public Mono<Void> checkHealth() {
        return enqueue(Kind.HEALTH, null);
    }

    /**
     * Drops the current connection and reconnects with bounded exponential back-off,
     * then re-registers every live channel.
     */
    public Mono<Void> reconnect() {
        return enqueue(Kind.RECONNECT, null);
    }

    /**
     * Completes once every command enqueued before this call has been executed.
     */
    public Mono<Void> drain() {
        return enqueue(Kind.DRAIN, null);
    }

    /**
     * On-demand liveness probe for operators. Never errors.
     */
    public Mono<UpstreamHealth> health() {
        return enqueue(Kind.PROBE, null)
                .then(Mono.fromSupplier(() -> health(UpstreamHealth.Status.HEALTHY, "Upstream connection healthy")))
                .onErrorResume(err -> Mono.just(health(UpstreamHealth.Status.UNHEALTHY, err.getMessage())));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            disconnect().block(CLOSE_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("Upstream disconnect during close failed: {}", e.toString());
        } finally {
            accepting.set(false);
            commands.tryEmitComplete();
            owner.dispose();
            ownerScheduler.dispose();
        }
        log.info("Upstream link closed source={}", source.name());
    }

    // ---------------------------------------------------------------------
    // Channel interest (called by the registry under its lock)
    // ---------------------------------------------------------------------

    /**
     * Requests upstream registration of {@code channel}. Non-blocking; no-op if already requested.
     */
    public void registerChannel(String channel) {
        if (requested.add(channel)) {
            enqueue(Kind.LISTEN, channel);
        }
    }

    /**
     * Requests upstream deregistration of {@code channel}. Non-blocking; no-op if not requested.
     */
    public void deregisterChannel(String channel) {
        if (requested.remove(channel)) {
            enqueue(Kind.UNLISTEN, channel);
        }
    }

    @Override
    public void onChannelLive(String channel) {
        registerChannel(channel);
    }

    @Override
    public void onChannelIdle(String channel) {
        deregisterChannel(channel);
    }

    // ---------------------------------------------------------------------
    // Transport callbacks
    // ---------------------------------------------------------------------

    @Override
    public void onNotification(String channel, String payload) {
        notificationsReceived.increment();
        try {
            sink.accept(new NotificationEvent(channel, payload, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Notification hand-off failed channel={} err={}", channel, e.toString(), e);
        }
    }

    @Override
    public void onConnectionLost(Throwable cause) {
        if (closed.get() || !connected) {
            log.debug("Ignoring connection loss while not connected: {}", String.valueOf(cause));
            return;
        }
        connected = false;
        log.warn("Upstream connection lost source={} err={}, reconnecting", source.name(), String.valueOf(cause));
        reconnect().subscribe(
                v -> { },
                err -> log.debug("Reconnect after connection loss did not complete: {}", err.toString())
        );
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public boolean isConnected() {
        return connected;
    }

    public Set<String> listeningChannels() {
        return Set.copyOf(listening);
    }

    public long notificationsReceived() {
        return notificationsReceived.sum();
    }

    public long reconnectCount() {
        return reconnects.sum();
    }

    public long registrationFailureCount() {
        return registrationFailures.sum();
    }

    // ---------------------------------------------------------------------
    // Owner loop
    // ---------------------------------------------------------------------

    private Mono<Void> enqueue(Kind kind, String channel) {
        if (!accepting.get()) {
            return Mono.error(new IllegalStateException("Upstream link is closed"));
        }
        Command cmd = new Command(kind, channel, Sinks.empty());
        try {
            commands.emitNext(cmd, Sinks.EmitFailureHandler.busyLooping(EMIT_SPIN));
        } catch (Sinks.EmissionException e) {
            log.warn("Upstream command rejected kind={} channel={} reason={}", kind, channel, e.getReason());
            return Mono.error(new IllegalStateException("Upstream command rejected: " + kind, e));
        }
        return cmd.done().asMono();
    }

    private Mono<Void> execute(Command cmd) {
        return Mono.defer(() -> operation(cmd))
                .doOnSuccess(v -> cmd.done().tryEmitEmpty())
                .onErrorResume(err -> {
                    cmd.done().tryEmitError(err);
                    return Mono.empty();
                });
    }

    private Mono<Void> operation(Command cmd) {
        return switch (cmd.kind()) {
            case CONNECT -> open(false);
            case LISTEN -> doListen(cmd.channel());
            case UNLISTEN -> doUnlisten(cmd.channel());
            case HEALTH -> doHealthCheck();
            case PROBE -> doProbe();
            case RECONNECT -> doReconnect();
            case DISCONNECT -> dropConnection().doOnSuccess(v -> log.info("Disconnected from upstream source={}", source.name()));
            case DRAIN -> Mono.empty();
        };
    }

    /**
     * Closes any previous connection, opens a new one and re-registers the live channels.
     */
    private Mono<Void> open(boolean withRetry) {
        Mono<Void> attempt = Mono.defer(() -> source.connect(this)).timeout(settings.connectTimeout());
        if (withRetry) {
            attempt = attempt.retryWhen(Retry.backoff(settings.reconnectMaxAttempts(), settings.reconnectMinBackoff())
                    .maxBackoff(settings.reconnectMaxBackoff())
                    .doBeforeRetry(signal -> log.warn("Upstream connect attempt {} failed source={} err={}",
                            signal.totalRetries() + 1, source.name(), signal.failure().toString())));
        }
        return dropConnection()
                .then(attempt)
                .onErrorMap(err -> {
                    Throwable cause = Exceptions.isRetryExhausted(err) && err.getCause() != null ? err.getCause() : err;
                    if (cause instanceof UpstreamUnavailableException u) {
                        return u;
                    }
                    return new UpstreamUnavailableException(
                            "Cannot connect to " + source.name() + ": " + cause.getMessage(), cause);
                })
                .then(Mono.defer(this::restoreChannels));
    }

    private Mono<Void> restoreChannels() {
        connected = true;
        Set<String> snapshot = liveChannels.get();
        log.info("Connected to upstream source={} liveChannels={}", source.name(), snapshot.size());
        return Flux.fromIterable(snapshot)
                .concatMap(channel -> listenOne(channel)
                        .onErrorResume(ChannelRegistrationException.class, e -> Mono.empty()))
                .then();
    }

    private Mono<Void> doListen(String channel) {
        if (!requested.contains(channel) || listening.contains(channel)) {
            return Mono.empty();
        }
        if (!connected) {
            log.debug("LISTEN deferred until connected channel={}", channel);
            return Mono.empty();
        }
        return listenOne(channel);
    }

    private Mono<Void> listenOne(String channel) {
        return Mono.defer(() -> source.listen(channel))
                .timeout(settings.probeTimeout())
                .doOnSuccess(v -> {
                    listening.add(channel);
                    log.debug("LISTEN channel={}", channel);
                })
                .doOnError(err -> {
                    registrationFailures.increment();
                    log.warn("Channel registration failed channel={} err={}", channel, err.toString());
                })
                .onErrorMap(err -> new ChannelRegistrationException(channel, err));
    }

    private Mono<Void> doUnlisten(String channel) {
        if (requested.contains(channel)) {
            return Mono.empty();
        }
        if (!listening.remove(channel) || !connected) {
            return Mono.empty();
        }
        return Mono.defer(() -> source.unlisten(channel))
                .timeout(settings.probeTimeout())
                .doOnSuccess(v -> log.debug("UNLISTEN channel={}", channel))
                .doOnError(err -> log.warn("Channel deregistration failed channel={} err={}", channel, err.toString()));
    }

    private Mono<Void> doHealthCheck() {
        if (!connected) {
            log.warn("Upstream not connected source={}, reconnecting", source.name());
            return doReconnect();
        }
        return probeOnce()
                .then(Mono.just(true))
                .onErrorResume(err -> {
                    log.warn("Upstream probe failed source={} err={}, reconnecting", source.name(), err.toString());
                    return Mono.just(false);
                })
                .flatMap(healthy -> healthy ? retryPendingRegistrations() : doReconnect());
    }

    private Mono<Void> retryPendingRegistrations() {
        Set<String> pending = new LinkedHashSet<>(requested);
        pending.removeAll(listening);
        if (pending.isEmpty()) {
            return Mono.empty();
        }
        log.info("Retrying {} pending channel registrations", pending.size());
        return Flux.fromIterable(pending)
                .concatMap(channel -> listenOne(channel)
                        .onErrorResume(ChannelRegistrationException.class, e -> Mono.empty()))
                .then();
    }

    private Mono<Void> doReconnect() {
        reconnects.increment();
        log.info("Reconnecting to upstream source={}", source.name());
        return open(true)
                .doOnError(err -> log.error("Upstream reconnect failed source={} err={}. Next attempt on the next health check.",
                        source.name(), err.getMessage()));
    }

    private Mono<Void> doProbe() {
        if (!connected) {
            return Mono.error(new UpstreamUnavailableException("Not connected to " + source.name()));
        }
        return probeOnce();
    }

    private Mono<Void> probeOnce() {
        return Mono.defer(source::probe).timeout(settings.probeTimeout());
    }

    private Mono<Void> dropConnection() {
        connected = false;
        listening.clear();
        return Mono.defer(source::close)
                .timeout(settings.probeTimeout())
                .onErrorResume(err -> {
                    log.debug("Closing previous upstream connection failed (ignored): {}", err.toString());
                    return Mono.empty();
                });
    }

    private void stopHealthLoop() {
        Disposable d = healthLoop.getAndSet(null);
        if (d != null && !d.isDisposed()) {
            d.dispose();
        }
    }

    private UpstreamHealth health(UpstreamHealth.Status status, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", source.name());
        details.put("connection", connected ? "active" : "inactive");
        details.put("listeners", listening.size());
        details.put("requested", requested.size());
        details.put("reconnects", reconnects.sum());
        return new UpstreamHealth("live-updates", status, message, details);
    }
}
