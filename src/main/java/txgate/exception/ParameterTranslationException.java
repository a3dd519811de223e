package txgate.exception;

/**
 * Exception thrown when a JSON parameter cannot be bound to the engine.
 */
public class ParameterTranslationException extends TransactionItemException {

    private final String parameterName;

    public ParameterTranslationException(String parameterName, String message) {
        super(message);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.TRANSLATION;
    }
}
