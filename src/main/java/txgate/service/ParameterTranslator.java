package txgate.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Singleton;
import txgate.exception.ParameterTranslationException;
import txgate.model.SqlValue;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts JSON parameter objects into engine values and binds them to statements.
 * This is the only place where JSON parameter values are coerced to engine types.
 */
@Singleton
public class ParameterTranslator {

    /**
     * Translates one JSON value.
     *
     * @param name  parameter name, used in error messages
     * @param value JSON scalar or null
     * @return the engine value
     * @throws ParameterTranslationException if the value is an object, an array, or an out-of-range integer
     */
    public SqlValue toSqlValue(String name, @Nullable JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return SqlValue.ofNull();
        }
        if (value.isBoolean()) {
            return SqlValue.ofInteger(value.booleanValue() ? 1 : 0);
        }
        if (value.isIntegralNumber()) {
            if (!value.canConvertToLong()) {
                throw new ParameterTranslationException(name,
                        String.format("Parameter '%s' is out of the 64-bit integer range: %s", name, value.asText()));
            }
            return SqlValue.ofInteger(value.longValue());
        }
        if (value.isNumber()) {
            return SqlValue.ofReal(value.doubleValue());
        }
        if (value.isTextual()) {
            return SqlValue.ofText(value.textValue());
        }
        throw new ParameterTranslationException(name,
                String.format("Parameter '%s' must be a scalar or null, got %s",
                        name, value.getNodeType().name().toLowerCase()));
    }

    /**
     * Translates a parameter object into a name to value map.
     * A leading ':' on a key is ignored.
     */
    public Map<String, SqlValue> translate(@Nullable ObjectNode values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, SqlValue> translated = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = normalizeName(field.getKey());
            if (translated.containsKey(name)) {
                throw new ParameterTranslationException(name,
                        String.format("Parameter '%s' is given more than once", name));
            }
            translated.put(name, toSqlValue(name, field.getValue()));
        }
        return translated;
    }

    /**
     * Translates a parameter object and lays the values out in marker order for the given SQL.
     * A placeholder the object leaves out is bound as NULL.
     *
     * @throws ParameterTranslationException if a value has no placeholder, or the SQL has
     *                                       placeholders but no parameter object was given
     */
    public List<SqlValue> translate(NamedParameterSql sql, @Nullable ObjectNode values) {
        if (values == null && sql.hasParameters()) {
            String first = sql.getParameterNames().get(0);
            throw new ParameterTranslationException(first,
                    String.format("Statement has %d parameter(s) but no values were given",
                            sql.getDistinctNames().size()));
        }

        Map<String, SqlValue> byName = translate(values);

        for (String supplied : byName.keySet()) {
            if (!sql.getDistinctNames().contains(supplied)) {
                throw new ParameterTranslationException(supplied,
                        String.format("Parameter '%s' does not appear in the statement", supplied));
            }
        }

        List<SqlValue> positional = new ArrayList<>(sql.getParameterNames().size());
        for (String name : sql.getParameterNames()) {
            positional.add(byName.getOrDefault(name, SqlValue.ofNull()));
        }
        return positional;
    }

    /**
     * Binds positional values to a prepared statement, starting at index 1.
     */
    public void bind(PreparedStatement statement, List<SqlValue> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            int index = i + 1;
            SqlValue value = values.get(i);
            switch (value.getType()) {
                case NULL -> statement.setNull(index, Types.NULL);
                case INTEGER -> statement.setLong(index, value.asLong());
                case REAL -> statement.setDouble(index, value.asDouble());
                case TEXT -> statement.setString(index, value.asText());
                case BLOB -> statement.setBytes(index, value.asBlob());
            }
        }
    }

    private static String normalizeName(String key) {
        return key.startsWith(":") ? key.substring(1) : key;
    }
}
