package txgate.model;

/**
 * How parameters accompany a transaction item.
 */
public enum ParameterMode {
    NONE,
    SINGLE,
    BATCH
}
