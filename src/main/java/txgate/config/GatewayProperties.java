package txgate.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.bind.annotation.Bindable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Immutable configuration properties for the gateway.
 * Maps to the 'gateway' prefix in application.yml.
 */
@ConfigurationProperties("gateway")
public record GatewayProperties(
        @NotBlank @Bindable(defaultValue = "./config/databases.yml") String databaseConfigPath,
        SqlLoggingConfig sqlLogging,
        ErrorHandlingConfig errorHandling,
        ShutdownConfig shutdown
) {

    public GatewayProperties {
        databaseConfigPath = defaultIfBlank(databaseConfigPath, "./config/databases.yml");
        sqlLogging = sqlLogging != null ? sqlLogging : new SqlLoggingConfig(true, true, 1000);
        errorHandling = errorHandling != null ? errorHandling : new ErrorHandlingConfig(false, false, 400);
        shutdown = shutdown != null ? shutdown : new ShutdownConfig(10000);
    }

    /**
     * Creates properties with every section at its default.
     */
    public static GatewayProperties defaults(String databaseConfigPath) {
        return new GatewayProperties(databaseConfigPath, null, null, null);
    }

    @ConfigurationProperties("sql-logging")
    public record SqlLoggingConfig(
            @Bindable(defaultValue = "true") boolean enabled,
            @Bindable(defaultValue = "true") boolean logParameters,
            @Positive @Bindable(defaultValue = "1000") long slowQueryThresholdMs
    ) {
    }

    @ConfigurationProperties("error-handling")
    public record ErrorHandlingConfig(
            @Bindable(defaultValue = "false") boolean exposeDetails,
            @Bindable(defaultValue = "false") boolean exposeStackTrace,
            @Bindable(defaultValue = "400") int engineErrorStatus
    ) {
        /**
         * @param exposeDetails     Whether unexpected (non item-level) errors expose their message.
         * @param exposeStackTrace  Whether unexpected error responses carry the top stack frames.
         * @param engineErrorStatus Transport status for a transaction aborted by an engine failure.
         *                          Item validation failures always answer 400.
         */
        public ErrorHandlingConfig {
            if (engineErrorStatus < 400 || engineErrorStatus > 599) {
                engineErrorStatus = 400;
            }
        }
    }

    @ConfigurationProperties("shutdown")
    public record ShutdownConfig(
            @Positive @Bindable(defaultValue = "10000") long drainTimeoutMs
    ) {
    }

    private static String defaultIfBlank(String value, String defaultValue) {
        return (value == null || value.isBlank()) ? defaultValue : value;
    }
}
