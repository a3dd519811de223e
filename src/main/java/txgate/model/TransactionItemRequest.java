package txgate.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.micronaut.core.annotation.Nullable;

/**
 * A transaction item exactly as received on the wire, before shape validation.
 * Absent members and explicit JSON nulls are both represented as {@code null}.
 */
public record TransactionItemRequest(
        @Nullable JsonNode query,
        @Nullable JsonNode statement,
        @Nullable JsonNode values,
        @Nullable JsonNode valuesBatch,
        boolean noFail
) {
}
