package com.autosort.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityScorerTest {

    @Test
    void identicalStringsScoreOne() {
        assertEquals(1.0, SimilarityScorer.ratio("Documents", "documents"), 1e-9);
        assertEquals(1.0, SimilarityScorer.ratio("", ""), 1e-9);
    }

    @Test
    void disjointStringsScoreZero() {
        assertEquals(0.0, SimilarityScorer.ratio("abc", "xyz"), 1e-9);
        assertEquals(0.0, SimilarityScorer.ratio(null, "xyz"), 1e-9);
    }

    @Test
    void countsRecursiveBlocks() {
        // "doc" + "ments" = 8 matching characters of 17
        assertEquals(16.0 / 17.0, SimilarityScorer.ratio("Docments", "Documents"), 1e-9);
    }

    @Test
    void closestMatchHonorsCutoff() {
        List<String> names = List.of("Documents", "Downloads", "Desktop");
        assertEquals("Documents", SimilarityScorer.closestMatch("Docments", names, 0.8));
        assertNull(SimilarityScorer.closestMatch("Music", names, 0.8));
    }

    @Test
    void closestMatchKeepsEarliestOnTie() {
        assertEquals("abcx", SimilarityScorer.closestMatch("abc", List.of("abcx", "abcy"), 0.5));
    }
}
