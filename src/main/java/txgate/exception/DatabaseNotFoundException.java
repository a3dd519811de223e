package txgate.exception;

/**
 * Exception thrown when a request targets a database that is not configured.
 */
public class DatabaseNotFoundException extends RuntimeException {

    private final String database;

    public DatabaseNotFoundException(String database) {
        super(String.format("No database configured with name '%s'", database));
        this.database = database;
    }

    public String getDatabase() {
        return database;
    }
}
