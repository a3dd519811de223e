package txgate.exception;

import java.sql.SQLException;

/**
 * Exception thrown when the engine rejects or fails a statement.
 * The engine's own message is kept as this exception's message.
 */
public class SqlExecutionException extends TransactionItemException {

    private final String sql;

    public SqlExecutionException(String sql, SQLException cause) {
        super(cause.getMessage(), cause);
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }

    public String getSqlState() {
        return ((SQLException) getCause()).getSQLState();
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.ENGINE;
    }
}
