package guraa.doccompare.model;

import lombok.Value;

import java.util.List;

/**
 * Overlap score of two token sequences together with the matching blocks it was derived from.
 */
@Value
public class SimilarityResult {

    /**
     * Normalised overlap in [0, 1].
     */
    double overlap;

    /**
     * Ordered, non-overlapping blocks ending with a zero-length sentinel. Empty when both sequences are empty.
     */
    List<MatchingBlock> blocks;

    public SimilarityResult(double overlap, List<MatchingBlock> blocks) {
        this.overlap = overlap;
        this.blocks = List.copyOf(blocks);
    }

    /**
     * Total number of matched tokens.
     */
    public int getMatchedTokens() {
        return blocks.stream().mapToInt(MatchingBlock::getLength).sum();
    }
}
