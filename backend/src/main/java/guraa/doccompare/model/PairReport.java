package guraa.doccompare.model;

import lombok.Builder;
import lombok.Value;

/**
 * A rendered side-by-side report for one ordered pair; the row document is shown on the left.
 */
@Value
@Builder
public class PairReport {

    int reportIndex;
    int row;
    int column;
    String leftName;
    String rightName;
    double overlap;

    /**
     * File name relative to the run's output directory, e.g. {@code 3.html}.
     */
    String fileName;
}
