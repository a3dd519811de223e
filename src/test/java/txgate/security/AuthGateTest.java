package txgate.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import txgate.config.DatabaseConfig;
import txgate.exception.FailureKind;
import txgate.model.Credentials;
import txgate.model.GatewayResponse;
import txgate.support.TestGateway;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the auth gate through the transaction service, so that short-circuiting is observable.
 */
class AuthGateTest {

    private static final String INSERT = """
            {%s"transaction": [{"statement": "INSERT INTO t (v) VALUES (1)"}]}
            """;

    private TestGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = TestGateway.of(
                TestGateway.memoryDatabase("inline")
                        .initStatement("CREATE TABLE t (v INT)")
                        .auth(new DatabaseConfig.AuthConfig(DatabaseConfig.AuthMode.INLINE, 0, null,
                                List.of(new DatabaseConfig.CredentialConfig("alice", "wonderland", null))))
                        .build(),
                TestGateway.memoryDatabase("basic")
                        .initStatement("CREATE TABLE t (v INT)")
                        .auth(new DatabaseConfig.AuthConfig(DatabaseConfig.AuthMode.HTTP_BASIC, 403, null,
                                List.of(new DatabaseConfig.CredentialConfig("admin", "secret", null))))
                        .build(),
                TestGateway.memoryDatabase("byquery")
                        .initStatement("CREATE TABLE t (v INT)")
                        .initStatement("CREATE TABLE accounts (name VARCHAR(64), pass VARCHAR(64))")
                        .initStatement("INSERT INTO accounts VALUES ('bob', 'builder')")
                        .auth(new DatabaseConfig.AuthConfig(DatabaseConfig.AuthMode.INLINE, 401,
                                "SELECT 1 FROM accounts WHERE name = :user AND pass = :password", List.of()))
                        .build(),
                TestGateway.memoryDatabase("open")
                        .initStatement("CREATE TABLE t (v INT)")
                        .build());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    private static String withCredentials(String user, String password) {
        return String.format(INSERT, "\"credentials\": {\"user\": \"" + user + "\", \"password\": \"" + password + "\"}, ");
    }

    @Test
    void testWhenInlineCredentialsValidThenTransactionRuns() {
        GatewayResponse response = gateway.run("inline", withCredentials("alice", "wonderland"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(gateway.count("inline", "t")).isEqualTo(1);
    }

    @Test
    void testWhenInlineCredentialsMissingThenUnauthorizedAndNothingExecuted() {
        GatewayResponse response = gateway.run("inline", String.format(INSERT, ""));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorCode()).isEqualTo(-1);
        assertThat(response.getMessage()).isEqualTo("Authorization failed");
        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getFailureKind()).isEqualTo(FailureKind.AUTH);
        assertThat(gateway.count("inline", "t")).isZero();
    }

    @Test
    void testWhenInlineCredentialsWrongThenUnauthorized() {
        GatewayResponse response = gateway.run("inline", withCredentials("alice", "nope"));

        assertThat(response.isSuccess()).isFalse();
        assertThat(gateway.count("inline", "t")).isZero();
    }

    @Test
    void testWhenBasicModeThenInlineCredentialsIgnored() {
        GatewayResponse response = gateway.run("basic", withCredentials("admin", "secret"));

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void testWhenBasicModeWithHeaderCredentialsThenTransactionRuns() {
        GatewayResponse response = gateway.run("basic", String.format(INSERT, ""),
                new Credentials("admin", "secret"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(gateway.count("basic", "t")).isEqualTo(1);
    }

    @Test
    void testWhenAuthQueryReturnsRowThenGranted() {
        assertThat(gateway.run("byquery", withCredentials("bob", "builder")).isSuccess()).isTrue();
        assertThat(gateway.run("byquery", withCredentials("bob", "wrong")).isSuccess()).isFalse();
    }

    @Test
    void testWhenCredentialsContainQuotesThenBoundNotInjected() {
        GatewayResponse response = gateway.run("byquery", withCredentials("bob", "' OR '1'='1"));

        assertThat(response.isSuccess()).isFalse();
    }

    @Test
    void testWhenDatabaseHasNoAuthThenCredentialsNotNeeded() {
        assertThat(gateway.run("open", String.format(INSERT, "")).isSuccess()).isTrue();
    }

    @Test
    void testWhenAuthFailsThenDatabaseReleased() {
        gateway.run("inline", String.format(INSERT, ""));

        assertThat(gateway.registry().get("inline").isBusy()).isFalse();
    }
}
