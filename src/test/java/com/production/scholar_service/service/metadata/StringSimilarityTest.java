package com.production.scholar_service.service.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StringSimilarityTest {

    @Test
    @DisplayName("should ignore case, accents and punctuation")
    void shouldNormalizeBeforeComparing() {
        assertEquals(1.0, StringSimilarity.ratio("Über Künstliche Intelligenz!", "uber kunstliche intelligenz"), 1e-9);
    }

    @Test
    @DisplayName("should score unrelated titles low")
    void shouldScoreUnrelatedTitlesLow() {
        assertTrue(StringSimilarity.ratio("Deep Learning", "Medieval Agriculture in Bavaria") < 0.4);
    }

    @Test
    @DisplayName("should score empty against non-empty as zero")
    void shouldScoreEmptyAsZero() {
        assertEquals(0.0, StringSimilarity.ratio("", "Title"), 1e-9);
        assertEquals(1.0, StringSimilarity.ratio(null, ""), 1e-9);
    }

    @Test
    @DisplayName("should extract surnames from both name orders")
    void shouldExtractSurnames() {
        assertEquals("doe", StringSimilarity.surname("Doe, Jane"));
        assertEquals("muller", StringSimilarity.surname("Hans Müller"));
        assertEquals("", StringSimilarity.surname(" "));
    }

    @Test
    @DisplayName("should measure the share of expected authors found")
    void shouldMeasureAuthorOverlap() {
        double overlap = StringSimilarity.authorOverlap(
                List.of("Jane Doe", "John Smith"), List.of("Doe, J.", "Miller, A."));
        assertEquals(0.5, overlap, 1e-9);
    }

    @Test
    @DisplayName("should weight title 50 and authors 30")
    void shouldWeightTitleAndAuthors() {
        double score = StringSimilarity.matchScore("Deep Learning", List.of("Jane Doe"),
                "Deep Learning", List.of("Someone Else"));
        assertEquals(50.0 / 80.0, score, 1e-9);
    }

    @Test
    @DisplayName("should use the title alone when no authors are expected")
    void shouldUseTitleOnlyWithoutAuthors() {
        assertEquals(1.0, StringSimilarity.matchScore("Deep Learning", List.of(), "deep learning", List.of("A B")), 1e-9);
    }
}
