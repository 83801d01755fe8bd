package guraa.doccompare.exception;

import guraa.doccompare.model.ScoreMatrix;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The summary report did not show up on disk in time. The scores themselves are still available.
 */
public class ReportNotPersistedException extends ComparisonException {

    private final transient ScoreMatrix matrix;
    private final transient Path summaryPath;

    public ReportNotPersistedException(Path summaryPath, Duration timeout, ScoreMatrix matrix) {
        super("Results file was not created within " + timeout.toSeconds() + "s: " + summaryPath);
        this.summaryPath = summaryPath;
        this.matrix = matrix;
    }

    public ScoreMatrix getMatrix() {
        return matrix;
    }

    public Path getSummaryPath() {
        return summaryPath;
    }
}
