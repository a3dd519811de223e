package txgate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.model.GatewayResponse;

/**
 * Serializes gateway responses to their JSON wire form.
 */
@Singleton
public class ResponseSerializer {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseSerializer.class);

    static final String FALLBACK_BODY = "{\"success\":false,\"errorCode\":-1,\"message\":\"Serialization failed\"}";

    private final ObjectMapper jsonMapper;

    public ResponseSerializer(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    public String toJson(GatewayResponse response) {
        return toJson(response.toJson());
    }

    public String toJson(ObjectNode node) {
        try {
            return jsonMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize to JSON", e);
            return FALLBACK_BODY;
        }
    }
}
