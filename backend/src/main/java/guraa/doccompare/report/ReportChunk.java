package guraa.doccompare.report;

import lombok.Value;

/**
 * A run of at most {@code blockSize} tokens rendered as one highlighted span.
 */
@Value
public class ReportChunk {

    String text;

    /**
     * {@code diff} for unmatched text, {@code match match-<n>} for text of the n-th matching block.
     */
    String cssClass;

    public boolean isMatched() {
        return !PairwiseReportRenderer.UNMATCHED_CLASS.equals(cssClass);
    }
}
