package txgate.config;

import io.micronaut.core.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration record representing one database served by the gateway.
 * Instances are immutable; the stored statement registry keeps declaration order.
 */
public record DatabaseConfig(
        String name,
        DataSourceConfig datasource,
        @Nullable AuthConfig auth,
        boolean useOnlyStoredStatements,
        Map<String, String> storedStatements,
        List<String> initStatements
) {

    public DatabaseConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (datasource == null) {
            throw new IllegalArgumentException("datasource is required for database " + name);
        }
        storedStatements = storedStatements != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(storedStatements))
                : Map.of();
        initStatements = initStatements != null ? List.copyOf(initStatements) : List.of();
    }

    /**
     * Checks if clients must authenticate before using this database.
     */
    public boolean requiresAuth() {
        return auth != null;
    }

    /**
     * JDBC connection settings for the embedded engine.
     */
    public record DataSourceConfig(
            String url,
            @Nullable String username,
            @Nullable String password
    ) {
        public DataSourceConfig {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("datasource url cannot be null or blank");
            }
            username = username != null ? username : "sa";
            password = password != null ? password : "";
        }

        @Override
        public String toString() {
            return "DataSourceConfig{url='" + url + "', username='" + username + "'}";
        }
    }

    /**
     * Where credentials are taken from.
     */
    public enum AuthMode {
        /**
         * The {@code credentials} member of the request body
         */
        INLINE,

        /**
         * The {@code Authorization: Basic} request header
         */
        HTTP_BASIC
    }

    /**
     * Authentication requirement for a database.
     * Exactly one of {@code byQuery} and {@code byCredentials} is set.
     */
    public record AuthConfig(
            AuthMode mode,
            int authErrorCode,
            @Nullable String byQuery,
            List<CredentialConfig> byCredentials
    ) {
        public AuthConfig {
            mode = mode != null ? mode : AuthMode.INLINE;
            if (authErrorCode <= 0) {
                authErrorCode = 401;
            }
            byCredentials = byCredentials != null ? List.copyOf(byCredentials) : List.of();
            boolean hasQuery = byQuery != null && !byQuery.isBlank();
            if (hasQuery == !byCredentials.isEmpty()) {
                throw new IllegalArgumentException("exactly one of by-query and by-credentials must be set");
            }
        }
    }

    /**
     * One accepted user. Exactly one of {@code password} and {@code hashedPassword}
     * (lowercase hex SHA-256) is set.
     */
    public record CredentialConfig(
            String user,
            @Nullable String password,
            @Nullable String hashedPassword
    ) {
        public CredentialConfig {
            if (user == null || user.isBlank()) {
                throw new IllegalArgumentException("credential user cannot be null or blank");
            }
            if ((password == null) == (hashedPassword == null)) {
                throw new IllegalArgumentException(
                        "exactly one of password and hashed-password must be set for user " + user);
            }
        }

        @Override
        public String toString() {
            return "CredentialConfig{user='" + user + "'}";
        }
    }

    /**
     * Builder for creating DatabaseConfig instances programmatically.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private DataSourceConfig datasource;
        private AuthConfig auth;
        private boolean useOnlyStoredStatements;
        private final Map<String, String> storedStatements = new LinkedHashMap<>();
        private final List<String> initStatements = new ArrayList<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder url(String url) {
            this.datasource = new DataSourceConfig(url, null, null);
            return this;
        }

        public Builder datasource(DataSourceConfig datasource) {
            this.datasource = datasource;
            return this;
        }

        public Builder auth(AuthConfig auth) {
            this.auth = auth;
            return this;
        }

        public Builder useOnlyStoredStatements(boolean useOnlyStoredStatements) {
            this.useOnlyStoredStatements = useOnlyStoredStatements;
            return this;
        }

        public Builder storedStatement(String id, String sql) {
            this.storedStatements.put(id, sql);
            return this;
        }

        public Builder initStatement(String sql) {
            this.initStatements.add(sql);
            return this;
        }

        public DatabaseConfig build() {
            return new DatabaseConfig(name, datasource, auth, useOnlyStoredStatements,
                    storedStatements, initStatements);
        }
    }
}
