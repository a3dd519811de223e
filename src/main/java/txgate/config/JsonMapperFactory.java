package txgate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

/**
 * Factory for the Jackson mapper that reads request bodies and writes response bodies.
 */
@Factory
public class JsonMapperFactory {

    @Singleton
    public ObjectMapper gatewayObjectMapper() {
        return create();
    }

    /**
     * Builds the mapper outside the application context.
     * Trailing content after the top-level value is an error.
     */
    public static ObjectMapper create() {
        return JsonMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }
}
