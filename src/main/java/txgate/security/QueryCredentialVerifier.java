package txgate.security;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.model.Credentials;
import txgate.model.SqlValue;
import txgate.service.NamedParameterSql;
import txgate.service.ParameterTranslator;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Verifies credentials by running the configured auth query with {@code :user} and
 * {@code :password} bound. Access is granted when the query returns at least one row.
 */
@Singleton
public class QueryCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(QueryCredentialVerifier.class);

    private final ParameterTranslator parameterTranslator;

    public QueryCredentialVerifier(ParameterTranslator parameterTranslator) {
        this.parameterTranslator = parameterTranslator;
    }

    @Override
    public boolean supports(DatabaseConfig.AuthConfig auth) {
        return auth.byQuery() != null;
    }

    @Override
    public boolean verify(DatabaseConfig.AuthConfig auth, Credentials credentials, Connection connection) {
        NamedParameterSql sql = NamedParameterSql.parse(auth.byQuery());

        List<SqlValue> values = new ArrayList<>(sql.getParameterNames().size());
        for (String name : sql.getParameterNames()) {
            switch (name) {
                case "user" -> values.add(SqlValue.ofText(credentials.user()));
                case "password" -> values.add(SqlValue.ofText(credentials.password()));
                default -> throw new IllegalStateException(
                        "Auth query may only use :user and :password, found :" + name);
            }
        }

        try (PreparedStatement statement = connection.prepareStatement(sql.getJdbcSql())) {
            parameterTranslator.bind(statement, values);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next();
            }
        } catch (SQLException e) {
            // A broken auth query denies access rather than failing open
            LOG.error("Auth query failed for user {}: {}", credentials.user(), e.getMessage(), e);
            return false;
        }
    }
}
