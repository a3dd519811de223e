package txgate.config;

import org.apache.ibatis.session.SqlSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.Lock;

/**
 * Exclusive, scoped use of one database connection.
 * The session starts in auto-commit mode; {@link #beginTransaction()} opens the single
 * transaction, which must then be resolved by {@link #commit()} or {@link #rollback()}.
 * {@link #close()} rolls back a transaction left unresolved, returns the connection and
 * releases the database lock.
 */
public class DatabaseSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseSession.class);

    private final String database;
    private final SqlSession sqlSession;
    private final Lock lock;

    private boolean transactionOpen;
    private boolean closed;

    DatabaseSession(String database, SqlSession sqlSession, Lock lock) {
        this.database = database;
        this.sqlSession = sqlSession;
        this.lock = lock;
    }

    public String getDatabase() {
        return database;
    }

    public Connection getConnection() {
        return sqlSession.getConnection();
    }

    public void beginTransaction() throws SQLException {
        if (transactionOpen) {
            throw new IllegalStateException("Transaction already open on database " + database);
        }
        getConnection().setAutoCommit(false);
        transactionOpen = true;
        LOG.trace("Transaction opened on {}", database);
    }

    public boolean isTransactionOpen() {
        return transactionOpen;
    }

    public void commit() {
        requireOpenTransaction();
        sqlSession.commit(true);
        transactionOpen = false;
        LOG.trace("Transaction committed on {}", database);
    }

    public void rollback() {
        requireOpenTransaction();
        sqlSession.rollback(true);
        transactionOpen = false;
        LOG.trace("Transaction rolled back on {}", database);
    }

    private void requireOpenTransaction() {
        if (!transactionOpen) {
            throw new IllegalStateException("No open transaction on database " + database);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (transactionOpen) {
                LOG.warn("Rolling back unresolved transaction on {}", database);
                rollback();
            }
        } finally {
            try {
                sqlSession.close();
            } finally {
                lock.unlock();
            }
        }
    }
}
