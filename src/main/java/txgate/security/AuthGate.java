package txgate.security;

import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.model.Credentials;
import txgate.model.TransactionRequest;

import java.sql.Connection;
import java.util.List;

/**
 * Checks access to a database before any transaction is opened on it.
 */
@Singleton
public class AuthGate {

    private static final Logger LOG = LoggerFactory.getLogger(AuthGate.class);

    private final List<CredentialVerifier> verifiers;

    public AuthGate(List<CredentialVerifier> verifiers) {
        this.verifiers = verifiers;
    }

    /**
     * @param config            configuration of the target database
     * @param request           the parsed request, carrying inline credentials if any
     * @param headerCredentials credentials read from the Authorization header, if any
     * @param connection        the locked connection, in auto-commit mode
     * @return true if the database needs no auth or the credentials are accepted
     */
    public boolean authorize(DatabaseConfig config, TransactionRequest request,
                             @Nullable Credentials headerCredentials, Connection connection) {
        if (!config.requiresAuth()) {
            return true;
        }

        DatabaseConfig.AuthConfig auth = config.auth();
        Credentials credentials = auth.mode() == DatabaseConfig.AuthMode.HTTP_BASIC
                ? headerCredentials
                : request.credentials();

        if (credentials == null) {
            LOG.debug("No {} credentials presented for database {}", auth.mode(), config.name());
            return false;
        }

        for (CredentialVerifier verifier : verifiers) {
            if (verifier.supports(auth)) {
                boolean granted = verifier.verify(auth, credentials, connection);
                if (!granted) {
                    LOG.warn("Authorization failed for user {} on database {}", credentials.user(), config.name());
                }
                return granted;
            }
        }
        throw new IllegalStateException("No credential verifier for the auth configuration of database " + config.name());
    }
}
