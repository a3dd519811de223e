package txgate.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import txgate.validation.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A shape-validated transaction item.
 * The only way to obtain one is {@link #from(TransactionItemRequest)}, so every instance
 * carries exactly one SQL text and parameters consistent with its {@link ParameterMode}.
 */
public final class TransactionItem {

    private final ItemKind kind;
    private final String sql;
    private final ParameterMode parameterMode;
    private final ObjectNode values;
    private final List<ObjectNode> valuesBatch;
    private final boolean noFail;

    private TransactionItem(
            ItemKind kind,
            String sql,
            ParameterMode parameterMode,
            ObjectNode values,
            List<ObjectNode> valuesBatch,
            boolean noFail) {
        this.kind = kind;
        this.sql = sql;
        this.parameterMode = parameterMode;
        this.values = values;
        this.valuesBatch = valuesBatch;
        this.noFail = noFail;
    }

    /**
     * Validates a wire item and builds the corresponding variant.
     *
     * @param request the item as received
     * @return the validated item
     * @throws ValidationException if the item shape is invalid
     */
    public static TransactionItem from(TransactionItemRequest request) {
        List<String> errors = new ArrayList<>();

        JsonNode query = request.query();
        JsonNode statement = request.statement();
        JsonNode values = request.values();
        JsonNode valuesBatch = request.valuesBatch();

        if ((query == null) == (statement == null)) {
            errors.add("exactly one of 'query' and 'statement' must be provided");
        } else if (query != null && !query.isTextual()) {
            errors.add("'query' must be a string");
        } else if (statement != null && !statement.isTextual()) {
            errors.add("'statement' must be a string");
        }

        if (values != null && valuesBatch != null) {
            errors.add("at most one of 'values' and 'valuesBatch' must be provided");
        }
        if (values != null && !values.isObject()) {
            errors.add("'values' must be an object");
        }
        if (valuesBatch != null) {
            if (query != null) {
                errors.add("'valuesBatch' can only be used with 'statement'");
            }
            if (!valuesBatch.isArray()) {
                errors.add("'valuesBatch' must be an array of objects");
            } else {
                for (int i = 0; i < valuesBatch.size(); i++) {
                    if (!valuesBatch.get(i).isObject()) {
                        errors.add(String.format("'valuesBatch[%d]' must be an object", i));
                    }
                }
            }
        }

        if (errors.size() == 1) {
            throw new ValidationException(errors.get(0));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid transaction item", errors);
        }

        ItemKind kind = query != null ? ItemKind.QUERY : ItemKind.STATEMENT;
        String sql = query != null ? query.asText() : statement.asText();

        if (values != null) {
            return new TransactionItem(kind, sql, ParameterMode.SINGLE, (ObjectNode) values,
                    List.of(), request.noFail());
        }
        if (valuesBatch != null) {
            List<ObjectNode> batch = new ArrayList<>(valuesBatch.size());
            valuesBatch.forEach(node -> batch.add((ObjectNode) node));
            return new TransactionItem(kind, sql, ParameterMode.BATCH, null,
                    Collections.unmodifiableList(batch), request.noFail());
        }
        return new TransactionItem(kind, sql, ParameterMode.NONE, null, List.of(), request.noFail());
    }

    public ItemKind getKind() {
        return kind;
    }

    /**
     * Returns the SQL text or stored statement name as submitted.
     */
    public String getSql() {
        return sql;
    }

    public ParameterMode getParameterMode() {
        return parameterMode;
    }

    /**
     * Returns the single parameter object, or {@code null} unless the mode is {@link ParameterMode#SINGLE}.
     */
    public ObjectNode getValues() {
        return values;
    }

    /**
     * Returns the batch parameter objects; empty unless the mode is {@link ParameterMode#BATCH}.
     */
    public List<ObjectNode> getValuesBatch() {
        return valuesBatch;
    }

    public boolean isNoFail() {
        return noFail;
    }

    @Override
    public String toString() {
        return "TransactionItem{" +
                "kind=" + kind +
                ", parameterMode=" + parameterMode +
                ", noFail=" + noFail +
                '}';
    }
}
