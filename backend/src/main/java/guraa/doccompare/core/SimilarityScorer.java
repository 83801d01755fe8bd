package guraa.doccompare.core;

import guraa.doccompare.model.MatchingBlock;
import guraa.doccompare.model.SimilarityResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores the overlap of two token sequences as {@code 2 * M / T}, where {@code M} is the number of
 * matched tokens and {@code T} the combined length of both sequences.
 *
 * <p>Matching always runs on a canonical orientation of the pair (shorter sequence first, then
 * lexicographic token order), and the blocks are transposed back when the caller passed the pair the
 * other way round. This keeps {@code score(a, b)} and {@code score(b, a)} identical.</p>
 *
 * <p>Ties between equally long blocks go to the earliest start in the first sequence of the
 * canonical orientation. For a pair passed the other way round that is the earliest start in
 * {@code tokensB}, then in {@code tokensA}.</p>
 *
 * <p>Pure and thread-safe.</p>
 */
@Component
public class SimilarityScorer {

    public SimilarityResult score(List<String> tokensA, List<String> tokensB) {
        int total = tokensA.size() + tokensB.size();
        if (total == 0) {
            return new SimilarityResult(0.0, List.of());
        }

        List<MatchingBlock> blocks;
        if (compareCanonical(tokensA, tokensB) <= 0) {
            blocks = new SequenceMatcher(tokensA, tokensB).getMatchingBlocks();
        } else {
            blocks = transpose(new SequenceMatcher(tokensB, tokensA).getMatchingBlocks());
        }

        int matched = 0;
        for (MatchingBlock block : blocks) {
            matched += block.getLength();
        }
        return new SimilarityResult(overlap(matched, total), blocks);
    }

    static double overlap(int matched, int total) {
        if (total == 0) {
            return 0.0;
        }
        return Math.min(1.0, 2.0 * matched / total);
    }

    static int compareCanonical(List<String> first, List<String> second) {
        int bySize = Integer.compare(first.size(), second.size());
        if (bySize != 0) {
            return bySize;
        }
        for (int i = 0; i < first.size(); i++) {
            int byToken = first.get(i).compareTo(second.get(i));
            if (byToken != 0) {
                return byToken;
            }
        }
        return 0;
    }

    // blocks are increasing in both offsets, so the transposed list stays ordered
    private static List<MatchingBlock> transpose(List<MatchingBlock> blocks) {
        List<MatchingBlock> result = new ArrayList<>(blocks.size());
        for (MatchingBlock block : blocks) {
            result.add(block.transpose());
        }
        return result;
    }
}
