package com.flowo.live.config;

import com.flowo.live.core.model.OverflowPolicy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration of the live-update hub and its upstream change feed.
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code flowo.live}, e.g.:
 * <pre>
 * flowo:
 *   live:
 *     queue-capacity: 100
 *     overflow-policy: drop-newest
 *     poll-timeout: 15s
 *     max-sessions: 1000
 *     upstream:
 *       type: postgres
 *       health-interval: 30s
 *     postgres:
 *       host: localhost
 *       database: flowo
 *     nats:
 *       url: nats://localhost:4222
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Secrets (database password, NATS password/token) should come from environment variables
 *       or a secrets manager rather than committed config files.</li>
 *   <li>Values are validated at startup; an invalid value fails the context.</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "flowo.live")
public class LiveHubProperties {

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /**
     * Slots in each session's queue.
     *
     * <p><b>Purpose</b></p>
     * <ul>
     *   <li>Absorbs bursts while a client is slow to read.</li>
     *   <li>Bounds memory per client: a full queue drops instead of growing.</li>
     * </ul>
     *
     * <p><b>Default</b>: {@code 100}</p>
     */
    @Min(1)
    private int queueCapacity = 100;

    /**
     * What a full session queue discards: {@code drop-newest} (keep what is queued) or
     * {@code drop-oldest} (favour fresh events).
     *
     * <p><b>Default</b>: {@code drop-newest}</p>
     */
    @NotNull
    private OverflowPolicy overflowPolicy = OverflowPolicy.DROP_NEWEST;

    /**
     * Idle time after which a session emits a heartbeat. Also the upper bound on how long a
     * cancelled session's worker thread stays blocked.
     *
     * <p><b>Default</b>: {@code 15s}</p>
     */
    @NotNull
    private Duration pollTimeout = Duration.ofSeconds(15);

    /**
     * Maximum concurrent sessions. Each streaming session holds one worker thread.
     *
     * <p><b>Default</b>: {@code 1000}</p>
     */
    @Min(1)
    private int maxSessions = 1000;

    @Valid
    private Upstream upstream = new Upstream();

    @Valid
    private Postgres postgres = new Postgres();

    @Valid
    private NatsConnection nats = new NatsConnection();

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public OverflowPolicy getOverflowPolicy() { return overflowPolicy; }
    public void setOverflowPolicy(OverflowPolicy overflowPolicy) { this.overflowPolicy = overflowPolicy; }

    public Duration getPollTimeout() { return pollTimeout; }
    public void setPollTimeout(Duration pollTimeout) { this.pollTimeout = pollTimeout; }

    public int getMaxSessions() { return maxSessions; }
    public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }

    public Upstream getUpstream() { return upstream; }
    public void setUpstream(Upstream upstream) { this.upstream = upstream; }

    public Postgres getPostgres() { return postgres; }
    public void setPostgres(Postgres postgres) { this.postgres = postgres; }

    public NatsConnection getNats() { return nats; }
    public void setNats(NatsConnection nats) { this.nats = nats; }

    // ---------------------------------------------------------------------
    // Upstream link
    // ---------------------------------------------------------------------

    public static class Upstream {

        /**
         * Change-feed transport: {@code postgres} (LISTEN/NOTIFY) or {@code nats} (core subjects).
         *
         * <p><b>Default</b>: {@code postgres}</p>
         */
        @NotBlank
        private String type = "postgres";

        /** Period of the health probe. Default {@code 30s}. */
        @NotNull
        private Duration healthInterval = Duration.ofSeconds(30);

        /** Max time for a probe or a single LISTEN/UNLISTEN. Default {@code 5s}. */
        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(5);

        /** Max time for one connect attempt. Default {@code 10s}. */
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Connect retries per reconnect cycle. When exhausted the link waits for the next
         * health tick and starts a new cycle, so the upstream is retried forever.
         */
        @Min(0)
        private int reconnectMaxAttempts = 5;

        @NotNull
        private Duration reconnectMinBackoff = Duration.ofSeconds(1);

        @NotNull
        private Duration reconnectMaxBackoff = Duration.ofSeconds(30);

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public Duration getHealthInterval() { return healthInterval; }
        public void setHealthInterval(Duration healthInterval) { this.healthInterval = healthInterval; }

        public Duration getProbeTimeout() { return probeTimeout; }
        public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public int getReconnectMaxAttempts() { return reconnectMaxAttempts; }
        public void setReconnectMaxAttempts(int reconnectMaxAttempts) { this.reconnectMaxAttempts = reconnectMaxAttempts; }

        public Duration getReconnectMinBackoff() { return reconnectMinBackoff; }
        public void setReconnectMinBackoff(Duration reconnectMinBackoff) { this.reconnectMinBackoff = reconnectMinBackoff; }

        public Duration getReconnectMaxBackoff() { return reconnectMaxBackoff; }
        public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) { this.reconnectMaxBackoff = reconnectMaxBackoff; }
    }

    // ---------------------------------------------------------------------
    // PostgreSQL (dedicated LISTEN connection)
    // ---------------------------------------------------------------------

    public static class Postgres {

        @NotBlank
        private String host = "localhost";

        @Min(1)
        private int port = 5432;

        @NotBlank
        private String database = "flowo";

        @NotBlank
        private String username = "flowo";

        /**
         * <p><b>Security</b>: treat as a secret; do not log it and do not commit to source control.</p>
         */
        private String password;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getDatabase() { return database; }
        public void setDatabase(String database) { this.database = database; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    // ---------------------------------------------------------------------
    // NATS
    // ---------------------------------------------------------------------

    public static class NatsConnection {

        /**
         * NATS server URL.
         *
         * <p><b>Examples</b>: {@code nats://localhost:4222}, {@code tls://nats.example.com:4222}</p>
         */
        @NotBlank
        private String url = "nats://localhost:4222";

        /** Optional username for user/password authentication. */
        private String user;

        /** Optional password. Secret. */
        private String password;

        /** Optional token for token-based authentication. Secret. */
        private String token;

        /** Optional path to a {@code .creds} file for NKey/JWT authentication. */
        private String creds;

        /** Enables TLS at the client level. */
        private boolean tls = false;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getCreds() { return creds; }
        public void setCreds(String creds) { this.creds = creds; }

        public boolean isTls() { return tls; }
        public void setTls(boolean tls) { this.tls = tls; }
    }
}
