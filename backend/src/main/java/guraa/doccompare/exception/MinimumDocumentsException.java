package guraa.doccompare.exception;

/**
 * Fewer than two documents were supplied to a full comparison.
 */
public class MinimumDocumentsException extends ComparisonException {

    public MinimumDocumentsException(int found) {
        super("At least two documents are required for comparison, found " + found);
    }
}
