package txgate.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.Test;
import txgate.config.GatewayProperties;
import txgate.config.JsonMapperFactory;
import txgate.service.ResponseSerializer;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler.
 * Tests exception mapping and the exposure settings.
 */
class GlobalExceptionHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static GlobalExceptionHandler handler(boolean exposeDetails, boolean exposeStackTrace) {
        GatewayProperties properties = new GatewayProperties("unused.yml", null,
                new GatewayProperties.ErrorHandlingConfig(exposeDetails, exposeStackTrace, 400), null);
        return new GlobalExceptionHandler(properties, new ResponseSerializer(JsonMapperFactory.create()));
    }

    private static JsonNode body(HttpResponse<String> response) throws Exception {
        return MAPPER.readTree(response.body());
    }

    @Test
    void testWhenDatabaseNotFoundThenReturns404() throws Exception {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/api/missing", "");

        // Act
        HttpResponse<String> response = handler(false, false).handle(request, new DatabaseNotFoundException("missing"));

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(body(response).get("success").booleanValue()).isFalse();
        assertThat(body(response).get("errorCode").intValue()).isEqualTo(-1);
        assertThat(body(response).get("message").textValue()).contains("missing");
    }

    @Test
    void testWhenBodyUnparseableThenReturns400WithMessage() throws Exception {
        HttpRequest<?> request = HttpRequest.POST("/api/test", "");

        HttpResponse<String> response = handler(false, false)
                .handle(request, new RequestBodyParseException("Request body is required"));

        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(body(response).get("message").textValue()).isEqualTo("Request body is required");
    }

    @Test
    void testWhenUnexpectedErrorThenDetailsHidden() throws Exception {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/api/test", "");

        // Act
        HttpResponse<String> response = handler(false, false)
                .handle(request, new IllegalStateException("connection exploded"));

        // Assert
        assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(body(response).get("message").textValue()).isEqualTo("An unexpected error occurred");
        assertThat(body(response).has("stackTrace")).isFalse();
    }

    @Test
    void testWhenExposureEnabledThenMessageAndFramesIncluded() throws Exception {
        // Arrange
        HttpRequest<?> request = HttpRequest.POST("/api/test", "");

        // Act
        HttpResponse<String> response = handler(true, true)
                .handle(request, new IllegalStateException("connection exploded"));

        // Assert
        JsonNode body = body(response);
        assertThat(body.get("message").textValue()).isEqualTo("connection exploded");
        assertThat(body.get("stackTrace").isArray()).isTrue();
        assertThat(body.get("stackTrace").size()).isBetween(1, 10);
    }
}
