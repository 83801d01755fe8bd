package guraa.doccompare.model;

import lombok.Value;

import java.util.List;

/**
 * Scores and rendered reports produced by one pass of the matrix builder.
 */
@Value
public class MatrixBuildResult {

    ScoreMatrix matrix;

    /**
     * Successfully rendered reports in iteration order.
     */
    List<PairReport> reports;

    /**
     * Problems that were absorbed instead of failing the run.
     */
    List<String> warnings;
}
