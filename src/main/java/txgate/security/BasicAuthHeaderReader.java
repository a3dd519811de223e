package txgate.security;

import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.model.Credentials;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Extracts credentials from an {@code Authorization: Basic} request header.
 */
@Singleton
public class BasicAuthHeaderReader {

    private static final Logger LOG = LoggerFactory.getLogger(BasicAuthHeaderReader.class);
    private static final String PREFIX = "Basic ";

    public Optional<Credentials> read(HttpRequest<?> request) {
        return request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION).flatMap(this::parse);
    }

    /**
     * Parses the value of an Authorization header.
     */
    public Optional<Credentials> parse(String headerValue) {
        String value = headerValue.trim();
        if (!value.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
            LOG.debug("Authorization header present but missing Basic scheme");
            return Optional.empty();
        }

        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(value.substring(PREFIX.length()).trim());
            decoded = new String(bytes, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOG.debug("Authorization header is not valid base64: {}", e.getMessage());
            return Optional.empty();
        }

        int separator = decoded.indexOf(':');
        if (separator < 0) {
            LOG.debug("Authorization header has no user/password separator");
            return Optional.empty();
        }
        return Optional.of(new Credentials(decoded.substring(0, separator), decoded.substring(separator + 1)));
    }
}
