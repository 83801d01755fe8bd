package guraa.doccompare.exception;

/**
 * No candidate document is left to compare the target against.
 */
public class NoCandidatesException extends ComparisonException {

    public NoCandidatesException(String targetName) {
        super("No comparable candidate documents remain for " + targetName);
    }
}
