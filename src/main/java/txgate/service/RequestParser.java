package txgate.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import txgate.exception.RequestBodyParseException;
import txgate.model.Credentials;
import txgate.model.TransactionItemRequest;
import txgate.model.TransactionRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses a raw request body into a {@link TransactionRequest}.
 * Only the envelope is checked here; the shape of each item is checked when the item runs,
 * so that item-level problems are reported with the item's index.
 */
@Singleton
public class RequestParser {

    private static final Logger LOG = LoggerFactory.getLogger(RequestParser.class);

    private final ObjectMapper objectMapper;

    public RequestParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TransactionRequest parse(@Nullable String body) {
        if (body == null || body.isBlank()) {
            throw new RequestBodyParseException("Request body is required");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            LOG.debug("Failed to parse request body: {}", e.getOriginalMessage());
            throw new RequestBodyParseException("Malformed JSON: " + e.getOriginalMessage(), e);
        }

        if (root == null || !root.isObject()) {
            throw new RequestBodyParseException("Request body must be a JSON object");
        }

        Credentials credentials = parseCredentials(root.get("credentials"));

        JsonNode transaction = root.get("transaction");
        if (transaction == null || !transaction.isArray()) {
            throw new RequestBodyParseException("'transaction' must be an array");
        }

        List<TransactionItemRequest> items = new ArrayList<>(transaction.size());
        for (int i = 0; i < transaction.size(); i++) {
            items.add(parseItem(transaction.get(i), i));
        }

        return new TransactionRequest(credentials, items);
    }

    private TransactionItemRequest parseItem(JsonNode node, int index) {
        if (!node.isObject()) {
            throw new RequestBodyParseException(String.format("transaction[%d] must be an object", index));
        }

        JsonNode noFail = member(node, "noFail");
        if (noFail != null && !noFail.isBoolean()) {
            throw new RequestBodyParseException(String.format("transaction[%d].noFail must be a boolean", index));
        }

        return new TransactionItemRequest(
                member(node, "query"),
                member(node, "statement"),
                member(node, "values"),
                member(node, "valuesBatch"),
                noFail != null && noFail.booleanValue());
    }

    private Credentials parseCredentials(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new RequestBodyParseException("'credentials' must be an object");
        }
        JsonNode user = node.get("user");
        JsonNode password = node.get("password");
        if (user == null || !user.isTextual() || password == null || !password.isTextual()) {
            throw new RequestBodyParseException("'credentials' must have string 'user' and 'password'");
        }
        return new Credentials(user.textValue(), password.textValue());
    }

    // Explicit JSON null counts as absent
    private static JsonNode member(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value;
    }
}
