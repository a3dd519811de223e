package txgate.model;

/**
 * What a transaction item asks the engine to do.
 */
public enum ItemKind {
    /**
     * Row-returning SQL - answered with a result set
     */
    QUERY,

    /**
     * Mutating SQL - answered with affected row counts
     */
    STATEMENT
}
