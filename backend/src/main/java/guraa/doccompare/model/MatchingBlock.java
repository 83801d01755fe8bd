package guraa.doccompare.model;

import lombok.Value;

/**
 * A run of equal tokens: {@code a[offsetA, offsetA + length) == b[offsetB, offsetB + length)}.
 * A zero-length block terminates every decomposition.
 */
@Value
public class MatchingBlock {

    int offsetA;
    int offsetB;
    int length;

    public boolean isSentinel() {
        return length == 0;
    }

    /**
     * The same block seen from the other sequence's side.
     */
    public MatchingBlock transpose() {
        return new MatchingBlock(offsetB, offsetA, length);
    }
}
