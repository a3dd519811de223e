package txgate.exception;

/**
 * Exception thrown when raw SQL is submitted to a database that only accepts stored statements.
 */
public class StatementResolutionException extends TransactionItemException {

    private final String statement;

    public StatementResolutionException(String statement) {
        super("Stored statement not found and raw SQL is not allowed: " + statement);
        this.statement = statement;
    }

    public String getStatement() {
        return statement;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.RESOLUTION;
    }
}
