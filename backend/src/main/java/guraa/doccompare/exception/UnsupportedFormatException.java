package guraa.doccompare.exception;

/**
 * Text could not be extracted from a file, either because its format is unknown or because it is unreadable.
 */
public class UnsupportedFormatException extends ComparisonException {

    public UnsupportedFormatException(String message) {
        super(message);
    }

    public UnsupportedFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
