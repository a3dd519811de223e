package txgate.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.apache.ibatis.jdbc.ScriptRunner;
import org.apache.ibatis.mapping.Environment;
import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.transaction.TransactionFactory;
import org.apache.ibatis.transaction.jdbc.JdbcTransactionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringReader;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One served database: its configuration, a single-connection pool, the MyBatis session
 * factory on top of it, and the lock that serializes transactions against it.
 */
public class ManagedDatabase implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ManagedDatabase.class);

    private final DatabaseConfig config;
    private final HikariDataSource dataSource;
    private final SqlSessionFactory sqlSessionFactory;

    // Fair, so waiting requests are served in arrival order
    private final ReentrantLock lock = new ReentrantLock(true);

    ManagedDatabase(DatabaseConfig config) {
        this.config = config;
        this.dataSource = createDataSource(config);
        this.sqlSessionFactory = createSqlSessionFactory(config, dataSource);
    }

    private static HikariDataSource createDataSource(DatabaseConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("txgate-" + config.name());
        hikari.setJdbcUrl(config.datasource().url());
        hikari.setUsername(config.datasource().username());
        hikari.setPassword(config.datasource().password());
        // A single long-lived connection: requests are serialized anyway, and an
        // in-memory engine lives only as long as one of its connections does.
        hikari.setMaximumPoolSize(1);
        hikari.setMinimumIdle(1);
        hikari.setMaxLifetime(0);
        hikari.setAutoCommit(true);
        return new HikariDataSource(hikari);
    }

    private static SqlSessionFactory createSqlSessionFactory(DatabaseConfig config, HikariDataSource dataSource) {
        TransactionFactory transactionFactory = new JdbcTransactionFactory();
        Environment environment = new Environment(config.name(), transactionFactory, dataSource);

        Configuration configuration = new Configuration(environment);
        configuration.setCacheEnabled(false);
        configuration.setLazyLoadingEnabled(false);

        return new SqlSessionFactoryBuilder().build(configuration);
    }

    /**
     * Runs the configured init statements in one transaction.
     */
    void initialize() {
        if (config.initStatements().isEmpty()) {
            return;
        }

        StringBuilder script = new StringBuilder();
        for (String sql : config.initStatements()) {
            String trimmed = sql.strip();
            while (trimmed.endsWith(";")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1).strip();
            }
            script.append(trimmed).append(";\n");
        }

        LOG.info("Running {} init statement(s) for database {}", config.initStatements().size(), config.name());

        try (SqlSession session = sqlSessionFactory.openSession(false)) {
            ScriptRunner runner = new ScriptRunner(session.getConnection());
            runner.setLogWriter(null);
            runner.setErrorLogWriter(null);
            runner.setStopOnError(true);
            runner.setAutoCommit(false);
            runner.setSendFullScript(false);
            runner.runScript(new StringReader(script.toString()));
        } catch (RuntimeException e) {
            throw new IllegalStateException(
                    "Init statements failed for database " + config.name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Acquires exclusive use of this database and opens a session on its connection.
     * The caller must close the returned session on every path.
     */
    public DatabaseSession openSession() {
        lock.lock();
        try {
            SqlSession sqlSession = sqlSessionFactory.openSession(true);
            return new DatabaseSession(config.name(), sqlSession, lock);
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
    }

    /**
     * Opens a session only if no transaction currently holds this database.
     */
    public Optional<DatabaseSession> tryOpenSession() {
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            SqlSession sqlSession = sqlSessionFactory.openSession(true);
            return Optional.of(new DatabaseSession(config.name(), sqlSession, lock));
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
    }

    /**
     * Waits until no transaction holds this database.
     *
     * @return true if the database became idle within the timeout
     */
    boolean awaitIdle(long timeoutMs) throws InterruptedException {
        if (lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
            lock.unlock();
            return true;
        }
        return false;
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    public String getName() {
        return config.name();
    }

    public DatabaseConfig getConfig() {
        return config;
    }

    public HikariDataSource getDataSource() {
        return dataSource;
    }

    public SqlSessionFactory getSqlSessionFactory() {
        return sqlSessionFactory;
    }

    @Override
    public void close() {
        LOG.info("Closing database {}", config.name());
        dataSource.close();
    }
}
