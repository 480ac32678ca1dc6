package com.flowo.live.config;

import com.flowo.live.core.dispatch.FanoutDispatcher;
import com.flowo.live.core.registry.ChannelInterestListener;
import com.flowo.live.core.registry.SubscriptionRegistry;
import com.flowo.live.core.session.HubSettings;
import com.flowo.live.core.session.LiveUpdateHub;
import com.flowo.live.core.upstream.ChangeFeedSource;
import com.flowo.live.core.upstream.CredentialMask;
import com.flowo.live.core.upstream.UpstreamLink;
import com.flowo.live.core.upstream.UpstreamSettings;
import com.flowo.live.nats.NatsChangeFeedSource;
import com.flowo.live.r2dbc.PostgresChangeFeedSource;
import com.flowo.live.web.ChannelAuthorizer;
import com.flowo.live.web.DefaultChannelAuthorizer;

import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that wires up the live-update fan-out:
 * <ul>
 *   <li>the upstream {@link ChangeFeedSource} selected by {@code flowo.live.upstream.type};</li>
 *   <li>the {@link SubscriptionRegistry}, {@link FanoutDispatcher} and {@link UpstreamLink};</li>
 *   <li>the {@link LiveUpdateHub} control surface.</li>
 * </ul>
 *
 * <h2>Cycle between registry and link</h2>
 * The registry tells the link when channels become live or idle, and the link reads the registry's
 * live channels when it reconnects. The registry therefore receives the link lazily through an
 * {@link ObjectProvider}; the first lookup happens on the first attach, long after both beans exist.
 *
 * <h2>Lifecycle</h2>
 * None of these beans connects on creation. {@link LiveHubLifecycle} starts the link once the
 * application is ready and closes everything on shutdown.
 */
@Configuration
@EnableConfigurationProperties(LiveHubProperties.class)
public class LiveHubConfig {

    private static final Logger log = LoggerFactory.getLogger(LiveHubConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * PostgreSQL LISTEN/NOTIFY source on a dedicated, non-pooled connection.
     *
     * <p><b>Security note</b>: the username is masked and the password is never logged.</p>
     */
    @Bean
    @ConditionalOnProperty(prefix = "flowo.live.upstream", name = "type", havingValue = "postgres", matchIfMissing = true)
    public ChangeFeedSource postgresChangeFeedSource(LiveHubProperties props) {
        LiveHubProperties.Postgres pg = props.getPostgres();
        PostgresqlConnectionConfiguration.Builder builder = PostgresqlConnectionConfiguration.builder()
                .host(pg.getHost())
                .port(pg.getPort())
                .database(pg.getDatabase())
                .username(pg.getUsername())
                .applicationName("flowo-live-hub")
                .connectTimeout(props.getUpstream().getConnectTimeout());
        if (pg.getPassword() != null && !pg.getPassword().isBlank()) {
            builder.password(pg.getPassword());
        }

        log.info("Change feed: PostgreSQL LISTEN/NOTIFY (host={}, port={}, database={}, user={})",
                pg.getHost(), pg.getPort(), pg.getDatabase(), CredentialMask.mask(pg.getUsername()));
        return new PostgresChangeFeedSource(new PostgresqlConnectionFactory(builder.build()));
    }

    /**
     * NATS source: one core subject per channel.
     */
    @Bean
    @ConditionalOnProperty(prefix = "flowo.live.upstream", name = "type", havingValue = "nats")
    public ChangeFeedSource natsChangeFeedSource(LiveHubProperties props) {
        LiveHubProperties.NatsConnection nats = props.getNats();
        log.info("Change feed: NATS (url={}, tls={})", nats.getUrl(), nats.isTls());
        return new NatsChangeFeedSource(new NatsChangeFeedSource.NatsSettings(
                nats.getUrl(),
                nats.getUser(),
                nats.getPassword(),
                nats.getToken(),
                nats.getCreds(),
                nats.isTls(),
                props.getUpstream().getConnectTimeout()));
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry(ObjectProvider<UpstreamLink> link) {
        return new SubscriptionRegistry(new ChannelInterestListener() {
            @Override
            public void onChannelLive(String channel) {
                link.getObject().registerChannel(channel);
            }

            @Override
            public void onChannelIdle(String channel) {
                link.getObject().deregisterChannel(channel);
            }
        });
    }

    @Bean
    public FanoutDispatcher fanoutDispatcher(SubscriptionRegistry registry) {
        return new FanoutDispatcher(registry);
    }

    @Bean(destroyMethod = "close")
    public UpstreamLink upstreamLink(
            ChangeFeedSource source,
            SubscriptionRegistry registry,
            FanoutDispatcher dispatcher,
            LiveHubProperties props,
            Clock clock
    ) {
        LiveHubProperties.Upstream up = props.getUpstream();
        UpstreamSettings settings = new UpstreamSettings(
                up.getHealthInterval(),
                up.getProbeTimeout(),
                up.getConnectTimeout(),
                up.getReconnectMaxAttempts(),
                up.getReconnectMinBackoff(),
                up.getReconnectMaxBackoff());
        return new UpstreamLink(source, settings, registry::currentChannels, dispatcher::dispatch, clock);
    }

    @Bean(destroyMethod = "close")
    public LiveUpdateHub liveUpdateHub(
            SubscriptionRegistry registry,
            FanoutDispatcher dispatcher,
            UpstreamLink link,
            LiveHubProperties props,
            Clock clock
    ) {
        HubSettings settings = new HubSettings(
                props.getQueueCapacity(),
                props.getOverflowPolicy(),
                props.getPollTimeout(),
                props.getMaxSessions());
        return new LiveUpdateHub(registry, dispatcher, link, settings, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelAuthorizer channelAuthorizer() {
        return new DefaultChannelAuthorizer();
    }
}
