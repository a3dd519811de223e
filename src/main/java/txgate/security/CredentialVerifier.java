package txgate.security;

import txgate.config.DatabaseConfig;
import txgate.model.Credentials;

import java.sql.Connection;

/**
 * Decides whether presented credentials grant access to a database.
 */
public interface CredentialVerifier {

    /**
     * Checks whether this verifier handles the given auth configuration.
     */
    boolean supports(DatabaseConfig.AuthConfig auth);

    /**
     * @param auth        auth configuration of the target database
     * @param credentials credentials presented by the client
     * @param connection  the database connection, held exclusively and outside any transaction
     * @return true if access is granted
     */
    boolean verify(DatabaseConfig.AuthConfig auth, Credentials credentials, Connection connection);
}
