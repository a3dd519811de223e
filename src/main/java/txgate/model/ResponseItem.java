package txgate.model;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.core.annotation.Nullable;

import java.util.List;

/**
 * Outcome of one transaction item.
 * Only the members relevant to the outcome are present in the JSON form.
 */
public class ResponseItem {

    private final boolean success;
    private final String error;
    private final List<ObjectNode> resultSet;
    private final Integer rowsUpdated;
    private final List<Integer> rowsUpdatedBatch;

    private ResponseItem(
            boolean success,
            @Nullable String error,
            @Nullable List<ObjectNode> resultSet,
            @Nullable Integer rowsUpdated,
            @Nullable List<Integer> rowsUpdatedBatch) {
        this.success = success;
        this.error = error;
        this.resultSet = resultSet;
        this.rowsUpdated = rowsUpdated;
        this.rowsUpdatedBatch = rowsUpdatedBatch;
    }

    /**
     * Creates a result for a query item.
     *
     * @param rows translated rows in engine order
     * @return ResponseItem carrying the result set
     */
    public static ResponseItem forQuery(List<ObjectNode> rows) {
        return new ResponseItem(true, null, List.copyOf(rows), null, null);
    }

    /**
     * Creates a result for a statement executed once.
     *
     * @param rowsUpdated number of rows affected
     * @return ResponseItem carrying the affected row count
     */
    public static ResponseItem forStatement(int rowsUpdated) {
        return new ResponseItem(true, null, null, rowsUpdated, null);
    }

    /**
     * Creates a result for a statement executed once per batch parameter object.
     *
     * @param rowsUpdatedBatch affected row counts, one per execution in input order
     * @return ResponseItem carrying the affected row counts
     */
    public static ResponseItem forBatch(List<Integer> rowsUpdatedBatch) {
        return new ResponseItem(true, null, null, null, List.copyOf(rowsUpdatedBatch));
    }

    /**
     * Creates a failed result for an item whose failure did not abort the transaction.
     *
     * @param error human-readable failure message
     * @return ResponseItem indicating failure
     */
    public static ResponseItem forError(String error) {
        return new ResponseItem(false, error, null, null, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public List<ObjectNode> getResultSet() {
        return resultSet;
    }

    public Integer getRowsUpdated() {
        return rowsUpdated;
    }

    public List<Integer> getRowsUpdatedBatch() {
        return rowsUpdatedBatch;
    }

    /**
     * Converts this item to its JSON wire form.
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("success", success);

        if (error != null) {
            node.put("error", error);
        }

        if (resultSet != null) {
            ArrayNode rows = node.putArray("resultSet");
            resultSet.forEach(rows::add);
        }

        if (rowsUpdated != null) {
            node.put("rowsUpdated", rowsUpdated);
        }

        if (rowsUpdatedBatch != null) {
            ArrayNode counts = node.putArray("rowsUpdatedBatch");
            rowsUpdatedBatch.forEach(counts::add);
        }

        return node;
    }

    @Override
    public String toString() {
        return "ResponseItem{" +
                "success=" + success +
                ", rows=" + (resultSet != null ? resultSet.size() : 0) +
                ", rowsUpdated=" + rowsUpdated +
                ", batch=" + (rowsUpdatedBatch != null ? rowsUpdatedBatch.size() : 0) +
                '}';
    }
}
