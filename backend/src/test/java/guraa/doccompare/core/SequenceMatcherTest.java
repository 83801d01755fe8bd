package guraa.doccompare.core;

import guraa.doccompare.model.MatchingBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequenceMatcherTest {

    @Test
    void tiesPreferEarliestInFirstSequence() {
        SequenceMatcher matcher = new SequenceMatcher(List.of("x", "y"), List.of("y", "x"));

        assertEquals(new MatchingBlock(0, 1, 1), matcher.findLongestMatch(0, 2, 0, 2));
    }

    @Test
    void tiesWithinSameStartPreferEarliestInSecondSequence() {
        SequenceMatcher matcher = new SequenceMatcher(List.of("x"), List.of("x", "x", "x"));

        assertEquals(new MatchingBlock(0, 0, 1), matcher.findLongestMatch(0, 1, 0, 3));
    }

    @Test
    void searchIsRestrictedToTheGivenRanges() {
        SequenceMatcher matcher = new SequenceMatcher(List.of("a", "b", "c"), List.of("a", "b", "c"));

        assertEquals(new MatchingBlock(1, 1, 2), matcher.findLongestMatch(1, 3, 1, 3));
        assertEquals(0, matcher.findLongestMatch(0, 1, 1, 3).getLength());
    }

    @Test
    void matchingBlocksSearchBothSidesOfTheLongestMatch() {
        SequenceMatcher matcher = new SequenceMatcher(
                List.of("a", "q", "b", "c", "d", "r", "e"),
                List.of("a", "b", "c", "d", "e"));

        assertEquals(List.of(
                new MatchingBlock(0, 0, 1),
                new MatchingBlock(2, 1, 3),
                new MatchingBlock(6, 4, 1),
                new MatchingBlock(7, 5, 0)), matcher.getMatchingBlocks());
    }

    @Test
    void bothEmptyYieldsNoBlocks() {
        assertTrue(new SequenceMatcher(List.of(), List.of()).getMatchingBlocks().isEmpty());
    }
}
