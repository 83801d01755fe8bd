package guraa.doccompare.exception;

/**
 * Base class of all failures raised by a comparison run.
 */
public class ComparisonException extends RuntimeException {

    public ComparisonException(String message) {
        super(message);
    }

    public ComparisonException(String message, Throwable cause) {
        super(message, cause);
    }
}
