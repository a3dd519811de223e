package txgate.model;

/**
 * Storage classes a value can take when it crosses the gateway boundary.
 */
public enum SqlValueType {
    /**
     * SQL NULL - maps to JSON null
     */
    NULL,

    /**
     * 64-bit signed integer - maps to a JSON integral number
     */
    INTEGER,

    /**
     * Double precision floating point - maps to a JSON number
     */
    REAL,

    /**
     * Character data - maps to a JSON string
     */
    TEXT,

    /**
     * Binary data - maps to a base64 JSON string
     */
    BLOB
}
