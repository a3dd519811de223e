package txgate.validation;

import txgate.exception.FailureKind;
import txgate.exception.TransactionItemException;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a transaction item has an invalid shape.
 * Contains a list of all validation errors encountered.
 */
public class ValidationException extends TransactionItemException {

    private final List<String> errors;

    /**
     * Creates a validation exception with a single error message.
     */
    public ValidationException(String message) {
        super(message);
        this.errors = Collections.singletonList(message);
    }

    /**
     * Creates a validation exception with multiple error messages.
     */
    public ValidationException(String message, List<String> errors) {
        super(message + ": " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public FailureKind getKind() {
        return FailureKind.VALIDATION;
    }
}
