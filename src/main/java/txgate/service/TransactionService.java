package txgate.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseConfig;
import txgate.config.DatabaseRegistry;
import txgate.config.DatabaseSession;
import txgate.model.Credentials;
import txgate.model.GatewayResponse;
import txgate.model.TransactionRequest;
import txgate.security.AuthGate;

/**
 * Processes one transaction request against a named database.
 * Holds the database exclusively for the whole call: auth check, then the transaction.
 */
@Singleton
public class TransactionService {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionService.class);

    private final DatabaseRegistry registry;
    private final AuthGate authGate;
    private final TransactionOrchestrator orchestrator;
    private final MeterRegistry meterRegistry;

    public TransactionService(
            DatabaseRegistry registry,
            AuthGate authGate,
            TransactionOrchestrator orchestrator,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.authGate = authGate;
        this.orchestrator = orchestrator;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param database          name of the target database
     * @param request           the parsed request
     * @param headerCredentials credentials from the Authorization header, if any
     * @return the response to send
     * @throws txgate.exception.DatabaseNotFoundException if the database is not configured
     */
    public GatewayResponse process(String database, TransactionRequest request,
                                   @Nullable Credentials headerCredentials) {
        DatabaseConfig config = registry.get(database).getConfig();
        LOG.debug("Processing {} item(s) on database {}", request.size(), database);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try (DatabaseSession session = registry.openSession(database)) {
            if (!authGate.authorize(config, request, headerCredentials, session.getConnection())) {
                outcome = "unauthorized";
                return GatewayResponse.unauthorized(config.auth().authErrorCode());
            }

            GatewayResponse response = orchestrator.execute(session, config, request);
            outcome = response.isSuccess() ? "commit" : "rollback";
            return response;
        } finally {
            sample.stop(Timer.builder("gateway.transaction")
                    .tag("database", database)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }
}
