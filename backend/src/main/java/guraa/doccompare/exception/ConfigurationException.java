package guraa.doccompare.exception;

/**
 * Invalid run parameter, such as a non-positive block size.
 */
public class ConfigurationException extends ComparisonException {

    public ConfigurationException(String message) {
        super(message);
    }
}
