package txgate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import txgate.model.SqlValue;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts engine rows into JSON objects keyed by column label, in column order.
 * Blobs are encoded as standard, padded base64.
 */
@Singleton
public class ResultTranslator {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    /**
     * Reads every remaining row of a result set.
     */
    public List<ObjectNode> translateAll(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        List<ObjectNode> rows = new ArrayList<>();
        while (resultSet.next()) {
            rows.add(translateRow(resultSet, metaData));
        }
        return rows;
    }

    /**
     * Translates the current row. A repeated column label keeps the last value.
     */
    public ObjectNode translateRow(ResultSet resultSet, ResultSetMetaData metaData) throws SQLException {
        ObjectNode row = NODES.objectNode();
        int columns = metaData.getColumnCount();
        for (int column = 1; column <= columns; column++) {
            SqlValue value = readValue(resultSet, column, metaData.getColumnType(column));
            row.set(metaData.getColumnLabel(column), toJson(value));
        }
        return row;
    }

    /**
     * Reads one column of the current row as an engine value, classified by its JDBC type.
     */
    public SqlValue readValue(ResultSet resultSet, int column, int jdbcType) throws SQLException {
        switch (jdbcType) {
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> {
                long value = resultSet.getLong(column);
                return resultSet.wasNull() ? SqlValue.ofNull() : SqlValue.ofInteger(value);
            }
            case Types.BOOLEAN, Types.BIT -> {
                boolean value = resultSet.getBoolean(column);
                return resultSet.wasNull() ? SqlValue.ofNull() : SqlValue.ofInteger(value ? 1 : 0);
            }
            case Types.REAL, Types.FLOAT, Types.DOUBLE -> {
                double value = resultSet.getDouble(column);
                return resultSet.wasNull() ? SqlValue.ofNull() : SqlValue.ofReal(value);
            }
            case Types.DECIMAL, Types.NUMERIC -> {
                return fromDecimal(resultSet.getBigDecimal(column));
            }
            case Types.BINARY, Types.VARBINARY, Types.LONGVARBINARY, Types.BLOB -> {
                return SqlValue.ofBlob(resultSet.getBytes(column));
            }
            default -> {
                return SqlValue.ofText(resultSet.getString(column));
            }
        }
    }

    private static SqlValue fromDecimal(BigDecimal value) {
        if (value == null) {
            return SqlValue.ofNull();
        }
        boolean integral = value.signum() == 0 || value.scale() <= 0 || value.stripTrailingZeros().scale() <= 0;
        if (integral && value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return SqlValue.ofInteger(value.longValueExact());
        }
        return SqlValue.ofReal(value.doubleValue());
    }

    /**
     * Converts an engine value to its JSON form.
     */
    public JsonNode toJson(SqlValue value) {
        return switch (value.getType()) {
            case NULL -> NODES.nullNode();
            case INTEGER -> NODES.numberNode(value.asLong());
            case REAL -> {
                double d = value.asDouble();
                // JSON has no literal for NaN or the infinities
                yield Double.isFinite(d) ? NODES.numberNode(d) : NODES.textNode(Double.toString(d));
            }
            case TEXT -> NODES.textNode(value.asText());
            case BLOB -> NODES.textNode(Base64.getEncoder().encodeToString(value.asBlob()));
        };
    }
}
