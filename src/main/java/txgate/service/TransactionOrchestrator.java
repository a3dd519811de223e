package txgate.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.config.DatabaseSession;
import txgate.config.GatewayProperties;
import txgate.exception.FailureKind;
import txgate.exception.SqlExecutionException;
import txgate.exception.TransactionItemException;
import txgate.model.GatewayResponse;
import txgate.model.ItemKind;
import txgate.model.ParameterMode;
import txgate.model.ResponseItem;
import txgate.model.SqlValue;
import txgate.model.TransactionItem;
import txgate.model.TransactionItemRequest;
import txgate.model.TransactionRequest;
import txgate.validation.ValidationException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Runs the items of one request inside a single transaction.
 *
 * Items are processed strictly in order. A failing item either aborts the whole request
 * (the transaction is rolled back) or, when marked {@code noFail}, is reported in place
 * while processing continues. A {@code noFail} item runs under its own savepoint, so its
 * partial effects are undone without touching earlier items.
 *
 * H2 commits the open transaction around schema and transaction-control statements, so such a
 * statement is accepted only as the single statement of its request.
 */
@Singleton
public class TransactionOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionOrchestrator.class);

    // Leading keywords of statements H2 does not keep inside the open transaction
    static final Set<String> IMPLICIT_COMMIT_KEYWORDS = Set.of(
            "CREATE", "ALTER", "DROP", "TRUNCATE", "COMMENT", "GRANT", "REVOKE", "ANALYZE",
            "SET", "CHECKPOINT", "SHUTDOWN", "RUNSCRIPT",
            "COMMIT", "ROLLBACK", "BEGIN", "START", "SAVEPOINT", "RELEASE");

    private final StatementResolver statementResolver;
    private final ParameterTranslator parameterTranslator;
    private final ResultTranslator resultTranslator;
    private final SqlExecutionLogger sqlLogger;
    private final MeterRegistry meterRegistry;
    private final int engineErrorStatus;

    public TransactionOrchestrator(
            StatementResolver statementResolver,
            ParameterTranslator parameterTranslator,
            ResultTranslator resultTranslator,
            SqlExecutionLogger sqlLogger,
            MeterRegistry meterRegistry,
            GatewayProperties properties) {
        this.statementResolver = statementResolver;
        this.parameterTranslator = parameterTranslator;
        this.resultTranslator = resultTranslator;
        this.sqlLogger = sqlLogger;
        this.meterRegistry = meterRegistry;
        this.engineErrorStatus = properties.errorHandling().engineErrorStatus();
    }

    /**
     * Executes a request on a session the caller holds exclusively.
     * On return the transaction has been committed or rolled back.
     *
     * @param session open session on the target database, with no transaction open yet
     * @param config  configuration of the target database
     * @param request the parsed request
     * @return success envelope with one result per item, or the failure envelope of the aborting item
     */
    public GatewayResponse execute(DatabaseSession session, DatabaseConfig config, TransactionRequest request) {
        try {
            session.beginTransaction();
        } catch (SQLException e) {
            throw new IllegalStateException("Could not open a transaction on database " + config.name(), e);
        }

        List<TransactionItemRequest> items = request.transaction();
        List<ResponseItem> results = new ArrayList<>(items.size());
        boolean soleItem = items.size() == 1;

        for (int index = 0; index < items.size(); index++) {
            TransactionItemRequest item = items.get(index);

            if (item.noFail()) {
                results.add(soleItem
                        ? executeSole(session, config, item)
                        : executeGuarded(session, config, item, index));
                continue;
            }

            try {
                results.add(executeItem(session, config, item, soleItem));
            } catch (TransactionItemException e) {
                session.rollback();
                LOG.info("Transaction on {} aborted at item {} ({}): {}",
                        config.name(), index, e.getKind(), e.getMessage());
                countItem(config.name(), "aborted");
                return GatewayResponse.failure(statusFor(e.getKind()), e.getKind(), index, e.getMessage());
            }
        }

        if (session.isTransactionOpen()) {
            session.commit();
            LOG.debug("Transaction on {} committed with {} item(s)", config.name(), results.size());
        }
        return GatewayResponse.ok(results);
    }

    /**
     * Runs the only item of a request with {@code noFail} set. There is no earlier work to keep,
     * so a failure rolls back the whole transaction instead of a savepoint.
     */
    private ResponseItem executeSole(DatabaseSession session, DatabaseConfig config, TransactionItemRequest item) {
        try {
            return executeItem(session, config, item, true);
        } catch (TransactionItemException e) {
            LOG.debug("Only item on {} failed and was skipped: {}", config.name(), e.getMessage());
            session.rollback();
            countItem(config.name(), "skipped");
            return ResponseItem.forError(e.getMessage());
        }
    }

    /**
     * Runs a {@code noFail} item under a savepoint and turns its failure into a failed result.
     */
    private ResponseItem executeGuarded(DatabaseSession session, DatabaseConfig config,
                                        TransactionItemRequest item, int index) {
        Connection connection = session.getConnection();
        Savepoint savepoint;
        try {
            savepoint = connection.setSavepoint();
        } catch (SQLException e) {
            throw new IllegalStateException("Could not set a savepoint on database " + config.name(), e);
        }

        try {
            ResponseItem result = executeItem(session, config, item, false);
            connection.releaseSavepoint(savepoint);
            return result;
        } catch (TransactionItemException e) {
            LOG.debug("Item {} on {} failed and was skipped: {}", index, config.name(), e.getMessage());
            try {
                connection.rollback(savepoint);
                connection.releaseSavepoint(savepoint);
            } catch (SQLException rollbackError) {
                throw new IllegalStateException(
                        "Could not roll back to savepoint on database " + config.name(), rollbackError);
            }
            countItem(config.name(), "skipped");
            return ResponseItem.forError(e.getMessage());
        } catch (SQLException e) {
            throw new IllegalStateException("Could not release savepoint on database " + config.name(), e);
        }
    }

    private ResponseItem executeItem(DatabaseSession session, DatabaseConfig config,
                                     TransactionItemRequest request, boolean soleItem) {
        TransactionItem item = TransactionItem.from(request);
        String sql = statementResolver.resolve(item.getSql(), config);
        NamedParameterSql parsed = NamedParameterSql.parse(sql);
        requireTransactional(parsed, soleItem);

        ResponseItem result = item.getKind() == ItemKind.QUERY
                ? executeQuery(session, parsed, item)
                : executeStatement(session, parsed, item);
        countItem(config.name(), "success");
        return result;
    }

    private ResponseItem executeQuery(DatabaseSession session, NamedParameterSql sql, TransactionItem item) {
        List<SqlValue> parameters = parameterTranslator.translate(sql, item.getValues());

        try (PreparedStatement statement = session.getConnection().prepareStatement(sql.getJdbcSql())) {
            parameterTranslator.bind(statement, parameters);
            List<ObjectNode> rows = sqlLogger.record(session.getDatabase(), ItemKind.QUERY, sql.getJdbcSql(),
                    parameters, () -> {
                        if (!statement.execute()) {
                            return List.of();
                        }
                        try (ResultSet resultSet = statement.getResultSet()) {
                            return resultTranslator.translateAll(resultSet);
                        }
                    });
            return ResponseItem.forQuery(rows);
        } catch (SQLException e) {
            throw new SqlExecutionException(sql.getOriginalSql(), e);
        }
    }

    private ResponseItem executeStatement(DatabaseSession session, NamedParameterSql sql, TransactionItem item) {
        if (item.getParameterMode() == ParameterMode.BATCH) {
            return executeBatch(session, sql, item.getValuesBatch());
        }

        List<SqlValue> parameters = parameterTranslator.translate(sql, item.getValues());

        try (PreparedStatement statement = session.getConnection().prepareStatement(sql.getJdbcSql())) {
            parameterTranslator.bind(statement, parameters);
            int rowsUpdated = sqlLogger.record(session.getDatabase(), ItemKind.STATEMENT, sql.getJdbcSql(),
                    parameters, statement::executeUpdate);
            return ResponseItem.forStatement(rowsUpdated);
        } catch (SQLException e) {
            throw new SqlExecutionException(sql.getOriginalSql(), e);
        }
    }

    private ResponseItem executeBatch(DatabaseSession session, NamedParameterSql sql, List<ObjectNode> valuesBatch) {
        try (PreparedStatement statement = session.getConnection().prepareStatement(sql.getJdbcSql())) {
            List<Integer> counts = new ArrayList<>(valuesBatch.size());
            for (ObjectNode values : valuesBatch) {
                List<SqlValue> parameters = parameterTranslator.translate(sql, values);
                statement.clearParameters();
                parameterTranslator.bind(statement, parameters);
                counts.add(sqlLogger.record(session.getDatabase(), ItemKind.STATEMENT, sql.getJdbcSql(),
                        parameters, statement::executeUpdate));
            }
            return ResponseItem.forBatch(counts);
        } catch (SQLException e) {
            throw new SqlExecutionException(sql.getOriginalSql(), e);
        }
    }

    private static void requireTransactional(NamedParameterSql sql, boolean soleItem) {
        List<String> keywords = sql.getStatementKeywords();
        if (soleItem && keywords.size() <= 1) {
            return;
        }
        for (String keyword : keywords) {
            if (IMPLICIT_COMMIT_KEYWORDS.contains(keyword)) {
                throw new ValidationException(String.format(
                        "%s statements commit implicitly and must be the only statement of their request",
                        keyword));
            }
        }
    }

    private int statusFor(FailureKind kind) {
        return kind == FailureKind.ENGINE ? engineErrorStatus : 400;
    }

    private void countItem(String database, String outcome) {
        meterRegistry.counter("gateway.transaction.items", "database", database, "outcome", outcome).increment();
    }
}
