package txgate.security;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.model.Credentials;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.util.HexFormat;

/**
 * Verifies credentials against the user list declared in the database configuration.
 * Passwords are declared in clear or as lowercase hex SHA-256 digests and are compared
 * in constant time.
 */
@Singleton
public class CredentialListVerifier implements CredentialVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(CredentialListVerifier.class);

    @Override
    public boolean supports(DatabaseConfig.AuthConfig auth) {
        return !auth.byCredentials().isEmpty();
    }

    @Override
    public boolean verify(DatabaseConfig.AuthConfig auth, Credentials credentials, Connection connection) {
        for (DatabaseConfig.CredentialConfig candidate : auth.byCredentials()) {
            if (!candidate.user().equals(credentials.user())) {
                continue;
            }
            if (passwordMatches(candidate, credentials.password())) {
                return true;
            }
        }
        LOG.debug("No matching credentials for user {}", credentials.user());
        return false;
    }

    private static boolean passwordMatches(DatabaseConfig.CredentialConfig candidate, String password) {
        byte[] presented = password.getBytes(StandardCharsets.UTF_8);
        if (candidate.password() != null) {
            return MessageDigest.isEqual(candidate.password().getBytes(StandardCharsets.UTF_8), presented);
        }
        byte[] expected = HexFormat.of().parseHex(candidate.hashedPassword().toLowerCase());
        return MessageDigest.isEqual(expected, sha256(presented));
    }

    static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Returns the lowercase hex SHA-256 digest of a password, the form used for hashed passwords.
     */
    public static String hash(String password) {
        return HexFormat.of().formatHex(sha256(password.getBytes(StandardCharsets.UTF_8)));
    }
}
