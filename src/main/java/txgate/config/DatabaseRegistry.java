package txgate.config;

import io.micronaut.context.annotation.Context;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.exception.DatabaseNotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns every served database and hands out exclusive sessions on them.
 * Built once at startup; the set of databases and their stored statements never change afterwards.
 */
@Singleton
@Context
public class DatabaseRegistry implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseRegistry.class);

    private final Map<String, ManagedDatabase> databases;
    private final AtomicBoolean closing = new AtomicBoolean(false);

    @Inject
    public DatabaseRegistry(DatabaseConfigLoader configLoader) {
        this(configLoader.loadConfiguration());
    }

    public DatabaseRegistry(List<DatabaseConfig> configs) {
        Map<String, ManagedDatabase> managed = new LinkedHashMap<>();
        try {
            for (DatabaseConfig config : configs) {
                if (managed.containsKey(config.name())) {
                    throw new IllegalStateException("Duplicate database name: " + config.name());
                }
                ManagedDatabase database = new ManagedDatabase(config);
                managed.put(config.name(), database);
                database.initialize();
                LOG.info("Database {} ready ({} stored statement(s), stored-only={}, auth={})",
                        config.name(), config.storedStatements().size(),
                        config.useOnlyStoredStatements(),
                        config.requiresAuth() ? config.auth().mode() : "none");
            }
        } catch (RuntimeException e) {
            managed.values().forEach(ManagedDatabase::close);
            throw e;
        }
        this.databases = Collections.unmodifiableMap(managed);
    }

    /**
     * Finds a database by name.
     */
    public Optional<ManagedDatabase> find(String name) {
        return Optional.ofNullable(databases.get(name));
    }

    /**
     * Gets a database by name.
     *
     * @throws DatabaseNotFoundException if no database has that name
     */
    public ManagedDatabase get(String name) {
        ManagedDatabase database = databases.get(name);
        if (database == null) {
            throw new DatabaseNotFoundException(name);
        }
        return database;
    }

    /**
     * Opens an exclusive session on the named database, waiting for any transaction
     * already running against it.
     */
    public DatabaseSession openSession(String name) {
        if (closing.get()) {
            throw new IllegalStateException("Gateway is shutting down");
        }
        return get(name).openSession();
    }

    public Collection<ManagedDatabase> getDatabases() {
        return databases.values();
    }

    /**
     * Stops handing out sessions and waits for running transactions to finish.
     *
     * @param timeoutMs maximum time to wait per database
     * @return true if every database became idle in time
     */
    public boolean drain(long timeoutMs) {
        closing.set(true);
        boolean idle = true;
        for (ManagedDatabase database : databases.values()) {
            try {
                if (!database.awaitIdle(timeoutMs)) {
                    LOG.warn("Database {} still busy after {} ms", database.getName(), timeoutMs);
                    idle = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return idle;
    }

    @PreDestroy
    @Override
    public void close() {
        closing.set(true);
        databases.values().forEach(ManagedDatabase::close);
    }
}
