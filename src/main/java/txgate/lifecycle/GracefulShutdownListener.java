package txgate.lifecycle;

import io.micronaut.context.event.ShutdownEvent;
import io.micronaut.runtime.event.annotation.EventListener;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.DatabaseRegistry;
import txgate.config.GatewayProperties;

/**
 * Lets running transactions finish before the databases are closed.
 */
@Singleton
public class GracefulShutdownListener {

    private static final Logger LOG = LoggerFactory.getLogger(GracefulShutdownListener.class);

    private final DatabaseRegistry registry;
    private final long drainTimeoutMs;

    public GracefulShutdownListener(DatabaseRegistry registry, GatewayProperties properties) {
        this.registry = registry;
        this.drainTimeoutMs = properties.shutdown().drainTimeoutMs();
    }

    @EventListener
    public void onShutdown(ShutdownEvent event) {
        LOG.info("Initiating graceful shutdown, waiting up to {} ms for running transactions", drainTimeoutMs);

        if (registry.drain(drainTimeoutMs)) {
            LOG.info("All databases idle, shutdown can proceed");
        } else {
            LOG.warn("Some transactions were still running when the drain timeout expired");
        }
    }
}
