package txgate.exception;

/**
 * Classification of everything that can make a transaction request fail.
 * Kept separate so the transport can map each kind to its own status code.
 */
public enum FailureKind {
    /**
     * Malformed transaction item
     */
    VALIDATION,

    /**
     * Unknown stored statement while only stored statements are allowed
     */
    RESOLUTION,

    /**
     * JSON parameter value that has no engine counterpart
     */
    TRANSLATION,

    /**
     * SQL or runtime failure reported by the engine
     */
    ENGINE,

    /**
     * Missing or invalid credentials
     */
    AUTH
}
