package com.flowo.live.r2dbc;

import com.flowo.live.core.upstream.ChangeFeedListener;
import com.flowo.live.core.upstream.ChangeFeedSource;
import com.flowo.live.core.upstream.UpstreamUnavailableException;

import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import io.r2dbc.postgresql.api.PostgresqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * PostgreSQL LISTEN/NOTIFY change feed over a dedicated R2DBC connection.
 *
 * <h2>Connection</h2>
 * <ul>
 *   <li>One connection created straight from the {@link PostgresqlConnectionFactory}, never pooled:
 *       LISTEN registrations belong to the session that issued them.</li>
 *   <li>Notifications arrive on the driver's I/O thread through
 *       {@link PostgresqlConnection#getNotifications()} and are handed to the listener inline.</li>
 *   <li>If the notification stream terminates while the connection is still owned, the listener is
 *       told the connection was lost. A close initiated here is silent.</li>
 * </ul>
 *
 * <h2>Channel names</h2>
 * Channel names are sent as quoted identifiers, so their case is preserved and they match
 * {@code pg_notify('<channel>', ...)} exactly.
 */
public class PostgresChangeFeedSource implements ChangeFeedSource {

    private static final Logger log = LoggerFactory.getLogger(PostgresChangeFeedSource.class);

    private final PostgresqlConnectionFactory connectionFactory;
    private final AtomicReference<Attached> current = new AtomicReference<>();

    /**
     * A connection together with its notification subscription.
     *
     * @param closing set before an intentional close so stream termination is not reported as a loss
     */
    private record Attached(PostgresqlConnection connection, Disposable notifications, AtomicBoolean closing) {
    }

    public PostgresChangeFeedSource(PostgresqlConnectionFactory connectionFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    }

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public Mono<Void> connect(ChangeFeedListener listener) {
        return close()
                .then(Mono.defer(connectionFactory::create))
                .doOnNext(connection -> {
                    AtomicBoolean closing = new AtomicBoolean();
                    Disposable notifications = connection.getNotifications().subscribe(
                            n -> listener.onNotification(n.getName(), n.getParameter() == null ? "" : n.getParameter()),
                            err -> {
                                if (!closing.get()) {
                                    listener.onConnectionLost(err);
                                }
                            },
                            () -> {
                                if (!closing.get()) {
                                    listener.onConnectionLost(
                                            new UpstreamUnavailableException("PostgreSQL notification stream completed"));
                                }
                            });
                    current.set(new Attached(connection, notifications, closing));
                    log.info("PostgreSQL change feed connected");
                })
                .then();
    }

    @Override
    public Mono<Void> listen(String channel) {
        return execute("LISTEN " + quoteIdentifier(channel));
    }

    @Override
    public Mono<Void> unlisten(String channel) {
        return execute("UNLISTEN " + quoteIdentifier(channel));
    }

    @Override
    public Mono<Void> probe() {
        return Mono.defer(() -> attached().connection()
                .createStatement("SELECT 1")
                .execute()
                .flatMap(result -> result.map((row, meta) -> row.get(0)))
                .then());
    }

    @Override
    public Mono<Void> close() {
        return Mono.defer(() -> {
            Attached a = current.getAndSet(null);
            if (a == null) {
                return Mono.empty();
            }
            a.closing().set(true);
            a.notifications().dispose();
            return a.connection().close()
                    .doOnSuccess(v -> log.info("PostgreSQL change feed connection closed"));
        });
    }

    private Mono<Void> execute(String sql) {
        return Mono.defer(() -> attached().connection()
                .createStatement(sql)
                .execute()
                .flatMap(result -> result.getRowsUpdated())
                .then());
    }

    private Attached attached() {
        Attached a = current.get();
        if (a == null) {
            throw new UpstreamUnavailableException("PostgreSQL change feed is not connected");
        }
        return a;
    }

    /**
     * Quotes a channel name as a PostgreSQL identifier ({@code "} doubled inside).
     */
    static String quoteIdentifier(String channel) {
        return "\"" + channel.replace("\"", "\"\"") + "\"";
    }
}
