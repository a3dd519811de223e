package txgate.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.GatewayProperties;
import txgate.model.ItemKind;
import txgate.model.SqlValue;
import txgate.model.SqlValueType;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Logs SQL statements, parameters, and execution timing around each engine call.
 * Records metrics via Micrometer.
 */
@Singleton
public class SqlExecutionLogger {

    private static final Logger SQL_LOG = LoggerFactory.getLogger("SQL_LOGGER");
    private static final int MAX_TEXT_LENGTH = 100;

    /**
     * One engine call.
     */
    @FunctionalInterface
    public interface SqlCall<T> {
        T call() throws SQLException;
    }

    private final GatewayProperties.SqlLoggingConfig config;
    private final MeterRegistry meterRegistry;

    public SqlExecutionLogger(GatewayProperties properties, MeterRegistry meterRegistry) {
        this.config = properties.sqlLogging();
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs an engine call, logging it and recording its duration.
     *
     * @param database   database the call runs against
     * @param kind       whether the call is a query or a statement
     * @param sql        SQL as sent to the engine
     * @param parameters bound values in marker order
     * @param call       the engine call
     * @return whatever the call returns
     * @throws SQLException rethrown from the call after logging
     */
    public <T> T record(String database, ItemKind kind, String sql, List<SqlValue> parameters,
                        SqlCall<T> call) throws SQLException {
        if (!config.enabled()) {
            return call.call();
        }

        long startTime = System.currentTimeMillis();
        try {
            T result = call.call();
            long duration = System.currentTimeMillis() - startTime;
            logExecution(database, kind, sql, parameters, duration, null, describeResult(result));
            return result;
        } catch (SQLException | RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            logExecution(database, kind, sql, parameters, duration, e, null);
            throw e;
        }
    }

    private void logExecution(String database, ItemKind kind, String sql, List<SqlValue> parameters,
                              long duration, Exception error, String resultInfo) {
        boolean isSlowQuery = duration >= config.slowQueryThresholdMs();

        if (error != null || isSlowQuery || SQL_LOG.isDebugEnabled()) {
            StringBuilder logMessage = new StringBuilder();
            logMessage.append("\n=== SQL Execution ===\n");
            logMessage.append("Database: ").append(database).append(" (").append(kind).append(")\n");
            logMessage.append("SQL: ").append(normalizeSql(sql)).append("\n");
            logMessage.append("Parameters: ").append(describeParameters(parameters)).append("\n");
            logMessage.append("Duration: ").append(duration).append(" ms");
            if (isSlowQuery) {
                logMessage.append(" [SLOW QUERY]");
            }
            if (resultInfo != null) {
                logMessage.append("\nResult: ").append(resultInfo);
            }
            logMessage.append("\n=====================");

            if (error != null) {
                SQL_LOG.error(logMessage + "\nError: " + error.getMessage());
            } else if (isSlowQuery) {
                SQL_LOG.warn(logMessage.toString());
            } else {
                SQL_LOG.debug(logMessage.toString());
            }
        }

        recordMetrics(database, kind, duration, isSlowQuery, error != null);
    }

    private void recordMetrics(String database, ItemKind kind, long duration, boolean isSlowQuery, boolean hasError) {
        String kindTag = kind.name().toLowerCase();

        Timer.builder("gateway.sql.duration")
                .tag("database", database)
                .tag("kind", kindTag)
                .tag("slow", String.valueOf(isSlowQuery))
                .tag("error", String.valueOf(hasError))
                .register(meterRegistry)
                .record(Duration.ofMillis(duration));

        if (isSlowQuery) {
            meterRegistry.counter("gateway.sql.slow_queries", "database", database, "kind", kindTag).increment();
        }
        if (hasError) {
            meterRegistry.counter("gateway.sql.errors", "database", database, "kind", kindTag).increment();
        }
    }

    private String describeParameters(List<SqlValue> parameters) {
        if (parameters.isEmpty()) {
            return "(none)";
        }
        if (!config.logParameters()) {
            return parameters.size() + " value(s)";
        }

        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(formatValue(parameters.get(i)));
        }
        return sb.append("]").toString();
    }

    private String formatValue(SqlValue value) {
        if (value.getType() == SqlValueType.TEXT && value.asText().length() > MAX_TEXT_LENGTH) {
            return "'" + value.asText().substring(0, MAX_TEXT_LENGTH) + "...[truncated]'";
        }
        return value.toString();
    }

    private String normalizeSql(String sql) {
        return sql.replaceAll("\\s+", " ").trim();
    }

    private String describeResult(Object result) {
        if (result == null) {
            return "null";
        } else if (result instanceof List<?> list) {
            return list.size() + " rows";
        } else if (result instanceof Integer) {
            return result + " rows affected";
        }
        return result.getClass().getSimpleName();
    }
}
