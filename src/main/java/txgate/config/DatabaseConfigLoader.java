package txgate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Loads the served databases from an external YAML file.
 * The file is validated against {@code schemas/database-config.schema.json} before parsing.
 * A path starting with {@value #CLASSPATH_PREFIX} is resolved on the classpath.
 */
@Singleton
public class DatabaseConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseConfigLoader.class);

    static final String CLASSPATH_PREFIX = "classpath:";

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonSchema databaseSchema;

    public DatabaseConfigLoader(GatewayProperties properties) {
        this.properties = properties;
        this.databaseSchema = loadSchema();
    }

    /**
     * Loads and validates all database definitions.
     *
     * @return database configurations in declaration order
     * @throws IllegalStateException if the file is missing, malformed or invalid
     */
    public List<DatabaseConfig> loadConfiguration() {
        String configPath = properties.databaseConfigPath();
        LOG.info("Loading database configuration from: {}", configPath);

        String yamlContent = readConfig(configPath);
        Map<String, Object> config = loadYaml(yamlContent);
        validateAgainstSchema(config);

        List<DatabaseConfig> databases = parseDatabases(config);
        LOG.info("Loaded {} database configuration(s)", databases.size());
        return databases;
    }

    private String readConfig(String configPath) {
        try {
            if (configPath.startsWith(CLASSPATH_PREFIX)) {
                String resource = configPath.substring(CLASSPATH_PREFIX.length());
                try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
                    if (is == null) {
                        throw new IllegalStateException("Database configuration resource not found: " + resource);
                    }
                    return new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
            }

            Path path = Paths.get(configPath);
            if (!Files.exists(path)) {
                throw new IllegalStateException(
                        "Database configuration file does not exist: " + path.toAbsolutePath());
            }
            return Files.readString(path);
        } catch (IOException e) {
            LOG.error("Failed to read database configuration", e);
            throw new IllegalStateException("Failed to read database configuration", e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> loadYaml(String yamlContent) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(yamlContent);
        if (loaded == null) {
            throw new IllegalStateException("Database configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new IllegalStateException("Database configuration root must be a map");
        }
        return (Map<String, Object>) loaded;
    }

    private void validateAgainstSchema(Map<String, Object> config) {
        if (databaseSchema == null) {
            return;
        }
        Set<ValidationMessage> validationMessages = databaseSchema.validate(objectMapper.valueToTree(config));
        if (!validationMessages.isEmpty()) {
            String message = validationMessages.stream()
                    .map(ValidationMessage::getMessage)
                    .collect(Collectors.joining("; "));
            throw new IllegalStateException("Database configuration failed schema validation: " + message);
        }
    }

    private JsonSchema loadSchema() {
        try (InputStream schemaStream = getClass().getClassLoader()
                .getResourceAsStream("schemas/database-config.schema.json")) {
            if (schemaStream == null) {
                LOG.warn("Database config schema not found on classpath; skipping validation");
                return null;
            }
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
            return factory.getSchema(objectMapper.readTree(schemaStream));
        } catch (Exception e) {
            LOG.warn("Failed to load database config schema; validation disabled", e);
            return null;
        }
    }

    // --- Parsing ---

    private List<DatabaseConfig> parseDatabases(Map<String, Object> config) {
        Object databasesObj = config.get("databases");
        if (!(databasesObj instanceof List<?> databases) || databases.isEmpty()) {
            throw new IllegalStateException("'databases' must be a non-empty list");
        }

        List<DatabaseConfig> result = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Object dbObj : databases) {
            DatabaseConfig database = parseDatabase(asMap(dbObj, "databases[]", "configuration"));
            if (!names.add(database.name())) {
                throw new IllegalStateException("Duplicate database name: " + database.name());
            }
            result.add(database);
        }
        return result;
    }

    private DatabaseConfig parseDatabase(Map<String, Object> db) {
        String name = requireString(db, "name", "database");

        Map<String, Object> ds = asMap(db.get("datasource"), "datasource", name);
        DatabaseConfig.DataSourceConfig datasource = new DatabaseConfig.DataSourceConfig(
                requireString(ds, "url", name),
                optionalString(ds, "username"),
                optionalString(ds, "password"));

        DatabaseConfig.AuthConfig auth = null;
        Object authObj = db.get("auth");
        if (authObj != null) {
            auth = parseAuth(asMap(authObj, "auth", name), name);
        }

        boolean useOnlyStored = Boolean.TRUE.equals(db.get("use-only-stored-statements"));

        Map<String, String> storedStatements = new LinkedHashMap<>();
        Object storedObj = db.get("stored-statements");
        if (storedObj instanceof List<?> storedList) {
            for (Object entry : storedList) {
                Map<String, Object> stmt = asMap(entry, "stored-statements[]", name);
                String id = requireString(stmt, "id", "stored statement of " + name);
                String sql = requireString(stmt, "sql", "stored statement " + id + " of " + name);
                if (storedStatements.putIfAbsent(id, sql) != null) {
                    throw new IllegalStateException(
                            "Duplicate stored statement id '" + id + "' for database " + name);
                }
            }
        } else if (storedObj != null) {
            throw new IllegalStateException("'stored-statements' must be a list for database " + name);
        }

        if (useOnlyStored && storedStatements.isEmpty()) {
            LOG.warn("Database {} only accepts stored statements but declares none", name);
        }

        List<String> initStatements = new ArrayList<>();
        Object initObj = db.get("init-statements");
        if (initObj instanceof List<?> initList) {
            for (Object sql : initList) {
                initStatements.add(String.valueOf(sql));
            }
        } else if (initObj != null) {
            throw new IllegalStateException("'init-statements' must be a list for database " + name);
        }

        try {
            return new DatabaseConfig(name, datasource, auth, useOnlyStored, storedStatements, initStatements);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid configuration for database " + name + ": " + e.getMessage(), e);
        }
    }

    private DatabaseConfig.AuthConfig parseAuth(Map<String, Object> auth, String context) {
        String modeStr = optionalString(auth, "mode");
        DatabaseConfig.AuthMode mode = DatabaseConfig.AuthMode.INLINE;
        if (modeStr != null) {
            try {
                mode = DatabaseConfig.AuthMode.valueOf(modeStr.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid auth mode '" + modeStr + "' for database " + context);
            }
        }

        Integer errorCode = getInteger(auth, "auth-error-code");

        List<DatabaseConfig.CredentialConfig> credentials = new ArrayList<>();
        Object credentialsObj = auth.get("by-credentials");
        if (credentialsObj instanceof List<?> credentialList) {
            for (Object entry : credentialList) {
                Map<String, Object> credential = asMap(entry, "auth.by-credentials[]", context);
                try {
                    credentials.add(new DatabaseConfig.CredentialConfig(
                            requireString(credential, "user", "credential of " + context),
                            optionalString(credential, "password"),
                            optionalString(credential, "hashed-password")));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException(e.getMessage() + " (database " + context + ")", e);
                }
            }
        }

        try {
            return new DatabaseConfig.AuthConfig(
                    mode,
                    errorCode != null ? errorCode : 401,
                    optionalString(auth, "by-query"),
                    credentials);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid auth for database " + context + ": " + e.getMessage(), e);
        }
    }

    private Integer getInteger(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Integer) return (Integer) value;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asMap(Object value, String key, String context) {
        if (value == null) {
            throw new IllegalStateException("'" + key + "' entry cannot be null for " + context);
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new IllegalStateException("'" + key + "' must be an object for " + context);
    }

    private String optionalString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private String requireString(Map<String, Object> map, String key, String context) {
        Object value = map.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IllegalStateException("Missing required field '" + key + "' for " + context);
        }
        return value.toString();
    }
}
