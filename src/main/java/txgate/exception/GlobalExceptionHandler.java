package txgate.exception;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.config.GatewayProperties;
import txgate.model.GatewayResponse;
import txgate.service.ResponseSerializer;

/**
 * Global exception handler for the gateway.
 * Converts request-level exceptions into the failure envelope.
 * Error detail exposure is controlled by gateway.error-handling configuration.
 */
@Produces
@Singleton
@Requires(classes = {Exception.class, ExceptionHandler.class})
public class GlobalExceptionHandler implements ExceptionHandler<Exception, HttpResponse<String>> {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final int MAX_STACK_FRAMES = 10;

    private final GatewayProperties.ErrorHandlingConfig config;
    private final ResponseSerializer responseSerializer;

    public GlobalExceptionHandler(GatewayProperties properties, ResponseSerializer responseSerializer) {
        this.config = properties.errorHandling();
        this.responseSerializer = responseSerializer;
    }

    @Override
    public HttpResponse<String> handle(HttpRequest request, Exception exception) {
        HttpStatus status;
        String message;

        if (exception instanceof RequestBodyParseException) {
            LOG.debug("Request {} {} rejected: {}", request.getMethod(), request.getPath(), exception.getMessage());
            status = HttpStatus.BAD_REQUEST;
            message = exception.getMessage();
        } else if (exception instanceof DatabaseNotFoundException) {
            LOG.debug("Request {} {} rejected: {}", request.getMethod(), request.getPath(), exception.getMessage());
            status = HttpStatus.NOT_FOUND;
            message = exception.getMessage();
        } else {
            LOG.error("Request {} {} failed: {}",
                    request.getMethod(), request.getPath(), exception.getMessage(), exception);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            message = config.exposeDetails() && exception.getMessage() != null
                    ? exception.getMessage()
                    : "An unexpected error occurred";
        }

        ObjectNode body = GatewayResponse.failure(status.getCode(), null, GatewayResponse.NO_ITEM, message).toJson();
        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            addStackTraceIfEnabled(body, exception);
        }

        return HttpResponse.<String>status(status)
                .contentType(MediaType.APPLICATION_JSON_TYPE)
                .body(responseSerializer.toJson(body));
    }

    /**
     * Adds the top stack frames to the error body if enabled.
     */
    private void addStackTraceIfEnabled(ObjectNode body, Exception exception) {
        if (!config.exposeStackTrace()) {
            return;
        }
        StackTraceElement[] stackTrace = exception.getStackTrace();
        ArrayNode frames = body.putArray("stackTrace");
        for (int i = 0; i < Math.min(MAX_STACK_FRAMES, stackTrace.length); i++) {
            frames.add(stackTrace[i].toString());
        }
    }
}
