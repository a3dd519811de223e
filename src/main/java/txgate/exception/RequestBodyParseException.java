package txgate.exception;

/**
 * Exception thrown when the request body is not a well-formed transaction request.
 * Results in HTTP 400 Bad Request response.
 */
public class RequestBodyParseException extends RuntimeException {

    public RequestBodyParseException(String message) {
        super(message);
    }

    public RequestBodyParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
