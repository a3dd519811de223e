package txgate.service;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.exception.StatementResolutionException;

import java.util.Map;

/**
 * Turns the text of a transaction item into the SQL to run.
 * Text equal to a stored statement id is replaced by that statement's SQL; any other text
 * is raw SQL, unless the database only accepts stored statements.
 */
@Singleton
public class StatementResolver {

    private static final Logger LOG = LoggerFactory.getLogger(StatementResolver.class);

    public String resolve(String text, DatabaseConfig config) {
        return resolve(text, config.storedStatements(), config.useOnlyStoredStatements());
    }

    /**
     * @param text             stored statement id or raw SQL
     * @param storedStatements id to SQL registry, matched exactly
     * @param storedOnly       whether raw SQL is refused
     * @return the SQL to execute
     * @throws StatementResolutionException if raw SQL is refused
     */
    public String resolve(String text, Map<String, String> storedStatements, boolean storedOnly) {
        String stored = storedStatements.get(text);
        if (stored != null) {
            LOG.debug("Resolved stored statement {}", text);
            return stored;
        }
        if (storedOnly) {
            throw new StatementResolutionException(text);
        }
        return text;
    }
}
