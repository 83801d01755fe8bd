package guraa.doccompare.core;

import guraa.doccompare.model.MatchingBlock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the matching blocks between two token sequences.
 * The longest common run is located first, then the regions to its left and right are searched the
 * same way until no further match exists. Regions are kept on an explicit worklist so that very long
 * documents do not exhaust the call stack.
 *
 * <p>Among equally long candidates the one starting earliest in {@code a} wins, then the one
 * starting earliest in {@code b}.</p>
 */
public final class SequenceMatcher {

    private static final Comparator<MatchingBlock> BY_POSITION =
            Comparator.comparingInt(MatchingBlock::getOffsetA).thenComparingInt(MatchingBlock::getOffsetB);

    private final List<String> a;
    private final List<String> b;

    // token -> ascending positions in b
    private final Map<String, List<Integer>> b2j;

    public SequenceMatcher(List<String> a, List<String> b) {
        this.a = a;
        this.b = b;
        this.b2j = indexPositions(b);
    }

    /**
     * Longest block with {@code alo <= i < ahi} and {@code blo <= j < bhi}.
     * Returns a zero-length block at {@code (alo, blo)} if the ranges share no token.
     */
    public MatchingBlock findLongestMatch(int alo, int ahi, int blo, int bhi) {
        int bestI = alo;
        int bestJ = blo;
        int bestSize = 0;

        // j2len.get(j) is the length of the match ending at a[i - 1] and b[j]
        Map<Integer, Integer> j2len = new HashMap<>();
        for (int i = alo; i < ahi; i++) {
            Map<Integer, Integer> newJ2len = new HashMap<>();
            for (int j : b2j.getOrDefault(a.get(i), List.of())) {
                if (j < blo) {
                    continue;
                }
                if (j >= bhi) {
                    break;
                }
                int k = j2len.getOrDefault(j - 1, 0) + 1;
                newJ2len.put(j, k);
                if (k > bestSize) {
                    bestI = i - k + 1;
                    bestJ = j - k + 1;
                    bestSize = k;
                }
            }
            j2len = newJ2len;
        }
        return new MatchingBlock(bestI, bestJ, bestSize);
    }

    /**
     * All matching blocks in increasing order, adjacent blocks merged, terminated by a
     * {@code (a.size(), b.size(), 0)} sentinel. Two empty sequences yield an empty list.
     */
    public List<MatchingBlock> getMatchingBlocks() {
        if (a.isEmpty() && b.isEmpty()) {
            return List.of();
        }

        List<MatchingBlock> found = new ArrayList<>();
        Deque<int[]> worklist = new ArrayDeque<>();
        worklist.push(new int[]{0, a.size(), 0, b.size()});

        while (!worklist.isEmpty()) {
            int[] range = worklist.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            MatchingBlock match = findLongestMatch(alo, ahi, blo, bhi);
            int k = match.getLength();
            if (k == 0) {
                continue;
            }
            found.add(match);

            int i = match.getOffsetA();
            int j = match.getOffsetB();
            if (alo < i && blo < j) {
                worklist.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                worklist.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }

        found.sort(BY_POSITION);
        List<MatchingBlock> blocks = collapseAdjacent(found);
        blocks.add(new MatchingBlock(a.size(), b.size(), 0));
        return blocks;
    }

    private static List<MatchingBlock> collapseAdjacent(List<MatchingBlock> sorted) {
        List<MatchingBlock> result = new ArrayList<>();
        int i1 = 0, j1 = 0, k1 = 0;
        for (MatchingBlock block : sorted) {
            int i2 = block.getOffsetA(), j2 = block.getOffsetB(), k2 = block.getLength();
            if (i1 + k1 == i2 && j1 + k1 == j2) {
                k1 += k2;
            } else {
                if (k1 > 0) {
                    result.add(new MatchingBlock(i1, j1, k1));
                }
                i1 = i2;
                j1 = j2;
                k1 = k2;
            }
        }
        if (k1 > 0) {
            result.add(new MatchingBlock(i1, j1, k1));
        }
        return result;
    }

    private static Map<String, List<Integer>> indexPositions(List<String> tokens) {
        Map<String, List<Integer>> index = new HashMap<>();
        for (int j = 0; j < tokens.size(); j++) {
            index.computeIfAbsent(tokens.get(j), key -> new ArrayList<>()).add(j);
        }
        return index;
    }
}
