package txgate.health;

import com.zaxxer.hikari.HikariPoolMXBean;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import txgate.config.DatabaseRegistry;
import txgate.config.DatabaseSession;
import txgate.config.ManagedDatabase;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Health indicator that checks every served database.
 * A database busy with a transaction is reported UP without touching its connection,
 * since the connection belongs to that transaction.
 */
@Singleton
public class DatabaseHealthIndicator implements HealthIndicator {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseHealthIndicator.class);
    private static final String NAME = "databases";

    private final DatabaseRegistry registry;

    public DatabaseHealthIndicator(DatabaseRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Publisher<HealthResult> getResult() {
        return Mono.fromCallable(this::checkDatabases);
    }

    HealthResult checkDatabases() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean allUp = true;

        for (ManagedDatabase database : registry.getDatabases()) {
            Map<String, Object> databaseDetails = checkDatabase(database);
            allUp &= "UP".equals(databaseDetails.get("status"));
            details.put(database.getName(), databaseDetails);
        }

        return HealthResult.builder(NAME, allUp ? HealthStatus.UP : HealthStatus.DOWN)
                .details(details)
                .build();
    }

    private Map<String, Object> checkDatabase(ManagedDatabase database) {
        Map<String, Object> details = new LinkedHashMap<>();

        Optional<DatabaseSession> idle;
        try {
            idle = database.tryOpenSession();
        } catch (RuntimeException e) {
            return down(details, database, e);
        }

        if (idle.isEmpty()) {
            details.put("status", "UP");
            details.put("busy", true);
            addPoolMetrics(details, database);
            return details;
        }

        try (DatabaseSession session = idle.get()) {
            Connection connection = session.getConnection();
            if (connection.isValid(5)) {
                details.put("status", "UP");
                details.put("busy", false);
                details.put("database", connection.getMetaData().getDatabaseProductName());
                details.put("version", connection.getMetaData().getDatabaseProductVersion());
                details.put("storedStatements", database.getConfig().storedStatements().size());
            } else {
                details.put("status", "DOWN");
                details.put("reason", "Connection validation failed");
                LOG.warn("Health check failed for database {}: connection not valid", database.getName());
            }
            addPoolMetrics(details, database);
            return details;
        } catch (SQLException | RuntimeException e) {
            return down(details, database, e);
        }
    }

    private Map<String, Object> down(Map<String, Object> details, ManagedDatabase database, Exception e) {
        details.put("status", "DOWN");
        details.put("error", e.getClass().getSimpleName());
        details.put("message", e.getMessage());
        LOG.error("Health check failed for database {}", database.getName(), e);
        return details;
    }

    private void addPoolMetrics(Map<String, Object> details, ManagedDatabase database) {
        HikariPoolMXBean poolMXBean = database.getDataSource().getHikariPoolMXBean();
        if (poolMXBean != null) {
            details.put("pool.active", poolMXBean.getActiveConnections());
            details.put("pool.idle", poolMXBean.getIdleConnections());
            details.put("pool.waiting", poolMXBean.getThreadsAwaitingConnection());
        }
    }
}
