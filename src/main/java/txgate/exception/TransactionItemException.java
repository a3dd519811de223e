package txgate.exception;

/**
 * Base class for failures raised while processing a single transaction item.
 * These are the failures subject to the item's {@code noFail} policy.
 */
public abstract class TransactionItemException extends RuntimeException {

    protected TransactionItemException(String message) {
        super(message);
    }

    protected TransactionItemException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind getKind();
}
