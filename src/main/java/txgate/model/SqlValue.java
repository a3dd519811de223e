package txgate.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * A typed engine value.
 * Instances are created through the static factories, one per {@link SqlValueType}.
 */
public final class SqlValue {

    private static final SqlValue NULL_VALUE = new SqlValue(SqlValueType.NULL, null);

    private final SqlValueType type;
    private final Object value;

    private SqlValue(SqlValueType type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static SqlValue ofNull() {
        return NULL_VALUE;
    }

    public static SqlValue ofInteger(long value) {
        return new SqlValue(SqlValueType.INTEGER, value);
    }

    public static SqlValue ofReal(double value) {
        return new SqlValue(SqlValueType.REAL, value);
    }

    public static SqlValue ofText(String value) {
        return value == null ? NULL_VALUE : new SqlValue(SqlValueType.TEXT, value);
    }

    public static SqlValue ofBlob(byte[] value) {
        return value == null ? NULL_VALUE : new SqlValue(SqlValueType.BLOB, value.clone());
    }

    public SqlValueType getType() {
        return type;
    }

    public boolean isNull() {
        return type == SqlValueType.NULL;
    }

    public long asLong() {
        requireType(SqlValueType.INTEGER);
        return (Long) value;
    }

    public double asDouble() {
        requireType(SqlValueType.REAL);
        return (Double) value;
    }

    public String asText() {
        requireType(SqlValueType.TEXT);
        return (String) value;
    }

    public byte[] asBlob() {
        requireType(SqlValueType.BLOB);
        return ((byte[]) value).clone();
    }

    private void requireType(SqlValueType expected) {
        if (type != expected) {
            throw new IllegalStateException("Value is " + type + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SqlValue other)) {
            return false;
        }
        if (type != other.type) {
            return false;
        }
        if (type == SqlValueType.BLOB) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        int valueHash = type == SqlValueType.BLOB ? Arrays.hashCode((byte[]) value) : Objects.hashCode(value);
        return 31 * type.hashCode() + valueHash;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NULL -> "NULL";
            case BLOB -> "BLOB[" + ((byte[]) value).length + " bytes]";
            case TEXT -> "'" + value + "'";
            default -> String.valueOf(value);
        };
    }
}
