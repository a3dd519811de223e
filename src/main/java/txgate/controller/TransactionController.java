package txgate.controller;

import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Consumes;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.Produces;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.model.Credentials;
import txgate.model.GatewayResponse;
import txgate.model.TransactionRequest;
import txgate.security.BasicAuthHeaderReader;
import txgate.service.RequestParser;
import txgate.service.ResponseSerializer;
import txgate.service.TransactionService;

/**
 * Entry point for transaction requests: {@code POST /api/{database}}.
 * Runs on the IO executor since every request blocks on JDBC.
 */
@Controller("/api")
@ExecuteOn(TaskExecutors.IO)
public class TransactionController {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionController.class);

    private final RequestParser requestParser;
    private final BasicAuthHeaderReader headerReader;
    private final TransactionService transactionService;
    private final ResponseSerializer responseSerializer;

    public TransactionController(
            RequestParser requestParser,
            BasicAuthHeaderReader headerReader,
            TransactionService transactionService,
            ResponseSerializer responseSerializer) {
        this.requestParser = requestParser;
        this.headerReader = headerReader;
        this.transactionService = transactionService;
        this.responseSerializer = responseSerializer;
    }

    @Post("/{database}")
    @Consumes(MediaType.ALL)
    @Produces(MediaType.APPLICATION_JSON)
    public HttpResponse<String> handleTransaction(
            HttpRequest<?> request,
            @PathVariable String database,
            @Nullable @Body String body) {

        LOG.debug("Handling transaction request for database: {}", database);

        TransactionRequest transactionRequest = requestParser.parse(body);
        Credentials headerCredentials = headerReader.read(request).orElse(null);

        GatewayResponse response = transactionService.process(database, transactionRequest, headerCredentials);

        return HttpResponse
                .<String>status(toHttpStatus(response.getStatus()))
                .contentType(MediaType.APPLICATION_JSON_TYPE)
                .body(responseSerializer.toJson(response));
    }

    static HttpStatus toHttpStatus(int code) {
        try {
            return HttpStatus.valueOf(code);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unsupported status code {}, answering 400 instead", code);
            return HttpStatus.BAD_REQUEST;
        }
    }
}
