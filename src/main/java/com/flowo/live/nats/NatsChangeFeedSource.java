package com.flowo.live.nats;

import com.flowo.live.core.upstream.ChangeFeedListener;
import com.flowo.live.core.upstream.ChangeFeedSource;
import com.flowo.live.core.upstream.CredentialMask;
import com.flowo.live.core.upstream.UpstreamUnavailableException;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Dispatcher;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Change feed over core NATS subjects: one subject per channel.
 *
 * <h2>Connection</h2>
 * <ul>
 *   <li>Client-side auto-reconnect is disabled ({@code maxReconnects(0)}); recovery and
 *       re-subscription are owned by the upstream link, exactly as for PostgreSQL.</li>
 *   <li>A single {@link Dispatcher} carries every channel subscription. Messages are delivered on
 *       the dispatcher thread and handed to the listener inline.</li>
 *   <li>{@code DISCONNECTED}/{@code CLOSED} events not caused by {@link #close()} are reported as
 *       connection loss.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * jNATS calls block on network round trips, so every call runs on {@link Schedulers#boundedElastic()}.
 */
public class NatsChangeFeedSource implements ChangeFeedSource {

    private static final Logger log = LoggerFactory.getLogger(NatsChangeFeedSource.class);

    private final NatsSettings settings;
    private final AtomicReference<Attached> current = new AtomicReference<>();

    private record Attached(Connection connection, Dispatcher dispatcher, AtomicBoolean closing) {
    }

    public NatsChangeFeedSource(NatsSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public String name() {
        return "nats";
    }

    @Override
    public Mono<Void> connect(ChangeFeedListener listener) {
        return close()
                .then(Mono.fromCallable(() -> {
                    AtomicBoolean closing = new AtomicBoolean();
                    Connection connection = Nats.connect(options(listener, closing));
                    Dispatcher dispatcher = connection.createDispatcher(msg -> listener.onNotification(
                            msg.getSubject(),
                            msg.getData() == null ? "" : new String(msg.getData(), StandardCharsets.UTF_8)));
                    current.set(new Attached(connection, dispatcher, closing));

                    log.info("Connected to NATS change feed (url={}, tls={}, user={}, creds={})",
                            settings.url(),
                            settings.tls(),
                            CredentialMask.mask(settings.user()),
                            settings.creds() == null ? "" : settings.creds());
                    return connection;
                }).subscribeOn(Schedulers.boundedElastic()))
                .then();
    }

    @Override
    public Mono<Void> listen(String channel) {
        return Mono.fromRunnable(() -> attached().dispatcher().subscribe(channel))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> unlisten(String channel) {
        return Mono.fromRunnable(() -> attached().dispatcher().unsubscribe(channel))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> probe() {
        return Mono.fromCallable(() -> {
                    Connection connection = attached().connection();
                    if (connection.getStatus() != Connection.Status.CONNECTED) {
                        throw new UpstreamUnavailableException("NATS connection status is " + connection.getStatus());
                    }
                    connection.flush(settings.connectTimeout());
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromCallable(() -> {
                    Attached a = current.getAndSet(null);
                    if (a != null) {
                        a.closing().set(true);
                        a.connection().close();
                        log.info("NATS change feed connection closed");
                    }
                    return true;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    /**
     * Builds client options. Auth (token, user/password, creds file) and TLS are applied only
     * when configured.
     */
    Options options(ChangeFeedListener listener, AtomicBoolean closing) throws Exception {
        Options.Builder builder = new Options.Builder()
                .server(settings.url())
                .connectionName("flowo-live-hub")
                .connectionTimeout(settings.connectTimeout())
                .maxReconnects(0)
                .connectionListener(new ConnectionListener() {
                    @Override
                    public void connectionEvent(Connection conn, Events type) {
                        if ((type == Events.DISCONNECTED || type == Events.CLOSED) && !closing.get()) {
                            closing.set(true);
                            listener.onConnectionLost(new UpstreamUnavailableException("NATS connection " + type));
                        }
                    }
                });

        if (settings.tls()) {
            builder.secure();
        }
        if (hasText(settings.token())) {
            builder.token(settings.token().toCharArray());
        }
        if (hasText(settings.user())) {
            builder.userInfo(settings.user(), settings.password() == null ? "" : settings.password());
        }
        if (hasText(settings.creds())) {
            builder.authHandler(Nats.credentials(settings.creds()));
        }
        return builder.build();
    }

    private Attached attached() {
        Attached a = current.get();
        if (a == null) {
            throw new UpstreamUnavailableException("NATS change feed is not connected");
        }
        return a;
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * Connection settings for the NATS change feed.
     */
    public record NatsSettings(String url, String user, String password, String token, String creds, boolean tls,
            Duration connectTimeout) {

        public NatsSettings {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(connectTimeout, "connectTimeout");
        }
    }
}
