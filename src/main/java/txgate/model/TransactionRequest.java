package txgate.model;

import io.micronaut.core.annotation.Nullable;

import java.util.List;

/**
 * A parsed transaction request: optional inline credentials and the ordered items.
 */
public record TransactionRequest(
        @Nullable Credentials credentials,
        List<TransactionItemRequest> transaction
) {

    public TransactionRequest {
        transaction = List.copyOf(transaction);
    }

    public int size() {
        return transaction.size();
    }
}
