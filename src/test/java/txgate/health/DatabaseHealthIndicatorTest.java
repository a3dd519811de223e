package txgate.health;

import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import txgate.config.DatabaseSession;
import txgate.support.TestGateway;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class DatabaseHealthIndicatorTest {

    private TestGateway gateway;
    private DatabaseHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        gateway = TestGateway.of(
                TestGateway.memoryDatabase("one").build(),
                TestGateway.memoryDatabase("two").build());
        indicator = new DatabaseHealthIndicator(gateway.registry());
    }

    @AfterEach
    void tearDown() {
        gateway.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testWhenDatabasesIdleThenEachReportedUp() {
        HealthResult result = indicator.checkDatabases();

        assertThat((Object) result.getStatus()).isEqualTo(HealthStatus.UP);
        Map<String, Object> details = (Map<String, Object>) result.getDetails();
        assertThat(details).containsOnlyKeys("one", "two");
        assertThat((Map<String, Object>) details.get("one"))
                .containsEntry("status", "UP")
                .containsEntry("busy", false)
                .containsEntry("database", "H2");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testWhenDatabaseBusyThenReportedWithoutWaiting() throws Exception {
        DatabaseSession held = gateway.registry().openSession("one");
        try {
            // The indicator runs on another thread, as it would behind the health endpoint
            HealthResult result = CompletableFuture
                    .supplyAsync(indicator::checkDatabases)
                    .get(5, TimeUnit.SECONDS);

            Map<String, Object> details = (Map<String, Object>) result.getDetails();
            assertThat((Map<String, Object>) details.get("one")).containsEntry("busy", true);
            assertThat((Map<String, Object>) details.get("two")).containsEntry("busy", false);
        } finally {
            held.close();
        }
    }
}
