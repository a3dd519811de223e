package txgate.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.core.annotation.Nullable;
import txgate.exception.FailureKind;

import java.util.List;

/**
 * Wire response for a transaction request.
 * Either a success envelope with one {@link ResponseItem} per request item, or a failure
 * envelope naming the failing item index ({@value #NO_ITEM} when no item was involved).
 */
public class GatewayResponse {

    public static final int NO_ITEM = -1;

    private final boolean success;
    private final List<ResponseItem> results;
    private final int errorCode;
    private final String message;
    private final int status;
    private final FailureKind failureKind;

    private GatewayResponse(
            boolean success,
            @Nullable List<ResponseItem> results,
            int errorCode,
            @Nullable String message,
            int status,
            @Nullable FailureKind failureKind) {
        this.success = success;
        this.results = results;
        this.errorCode = errorCode;
        this.message = message;
        this.status = status;
        this.failureKind = failureKind;
    }

    public static GatewayResponse ok(List<ResponseItem> results) {
        return new GatewayResponse(true, List.copyOf(results), 0, null, 200, null);
    }

    /**
     * Creates a failure envelope.
     *
     * @param status    transport status to answer with
     * @param kind      what kind of failure produced the envelope
     * @param errorCode failing item index, or {@link #NO_ITEM}
     * @param message   human-readable message
     */
    public static GatewayResponse failure(int status, FailureKind kind, int errorCode, String message) {
        return new GatewayResponse(false, null, errorCode, message, status, kind);
    }

    public static GatewayResponse unauthorized(int status) {
        return failure(status, FailureKind.AUTH, NO_ITEM, "Authorization failed");
    }

    public boolean isSuccess() {
        return success;
    }

    public List<ResponseItem> getResults() {
        return results;
    }

    public int getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Returns the transport status code this response should be sent with.
     */
    public int getStatus() {
        return status;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    /**
     * Converts this response to its JSON wire form.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);

        if (success) {
            ArrayNode items = node.putArray("results");
            results.forEach(item -> items.add(item.toJson()));
        } else {
            node.put("errorCode", errorCode);
            node.put("message", message);
        }

        return node;
    }

    @Override
    public String toString() {
        return "GatewayResponse{" +
                "success=" + success +
                ", status=" + status +
                ", items=" + (results != null ? results.size() : 0) +
                ", errorCode=" + errorCode +
                '}';
    }
}
