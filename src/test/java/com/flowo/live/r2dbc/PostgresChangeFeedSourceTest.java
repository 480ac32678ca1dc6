package com.flowo.live.r2dbc;

import com.flowo.live.core.upstream.UpstreamUnavailableException;
import io.r2dbc.postgresql.PostgresqlConnectionConfiguration;
import io.r2dbc.postgresql.PostgresqlConnectionFactory;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.assertj.core.api.BDDAssertions.then;

class PostgresChangeFeedSourceTest {

    private final PostgresChangeFeedSource source = new PostgresChangeFeedSource(new PostgresqlConnectionFactory(
            PostgresqlConnectionConfiguration.builder()
                    .host("localhost")
                    .database("flowo")
                    .username("flowo")
                    .build()));

    @Test
    void givenChannelName_whenQuoted_thenCasePreservedAndQuotesDoubled() {
        then(PostgresChangeFeedSource.quoteIdentifier("workflow_events_Ab-1")).isEqualTo("\"workflow_events_Ab-1\"");
        then(PostgresChangeFeedSource.quoteIdentifier("a\"b")).isEqualTo("\"a\"\"b\"");
    }

    @Test
    void givenNoConnection_whenListen_thenUpstreamUnavailable() {
        StepVerifier.create(source.listen("wf-1"))
                .expectError(UpstreamUnavailableException.class)
                .verify();
    }

    @Test
    void givenNoConnection_whenProbe_thenUpstreamUnavailable() {
        StepVerifier.create(source.probe())
                .expectError(UpstreamUnavailableException.class)
                .verify();
    }

    @Test
    void givenNoConnection_whenClosed_thenCompletes() {
        StepVerifier.create(source.close()).verifyComplete();
    }
}
