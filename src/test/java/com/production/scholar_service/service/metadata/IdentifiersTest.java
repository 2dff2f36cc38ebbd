package com.production.scholar_service.service.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifiersTest {

    @Nested
    @DisplayName("DOI")
    class DoiTests {

        @Test
        @DisplayName("should strip resolver prefix, trailing punctuation and case")
        void shouldNormalizeResolverUrl() {
            assertEquals("10.1000/xyz123", Identifiers.normalizeDoi("https://doi.org/10.1000/XYZ123."));
        }

        @Test
        @DisplayName("should find a DOI inside running text")
        void shouldFindDoiInText() {
            assertEquals("10.1145/3368089.3409740",
                    Identifiers.normalizeDoi("Available as doi: 10.1145/3368089.3409740 (accessed 2021)"));
        }

        @Test
        @DisplayName("should return null when there is no DOI")
        void shouldReturnNullWithoutDoi() {
            assertNull(Identifiers.normalizeDoi("no identifier here"));
            assertNull(Identifiers.normalizeDoi(null));
        }

        @Test
        @DisplayName("should compare DOIs independent of spelling")
        void shouldCompareDois() {
            assertTrue(Identifiers.sameDoi("doi:10.1000/ABC", "https://doi.org/10.1000/abc"));
            assertFalse(Identifiers.sameDoi("10.1000/abc", "10.1000/abd"));
            assertFalse(Identifiers.sameDoi(null, null));
        }
    }

    @Nested
    @DisplayName("ISBN")
    class IsbnTests {

        @Test
        @DisplayName("should normalize a hyphenated ISBN-13 with prefix")
        void shouldNormalizeIsbn13() {
            assertEquals("9783161484100", Identifiers.normalizeIsbn("ISBN 978-3-16-148410-0"));
        }

        @Test
        @DisplayName("should take the first ISBN of a decorated value")
        void shouldTakeFirstIsbnRun() {
            assertEquals("9783161484100", Identifiers.normalizeIsbn("978-3-16-148410-0 (Print)"));
        }

        @Test
        @DisplayName("should normalize an ISBN-10")
        void shouldNormalizeIsbn10() {
            assertEquals("0306406152", Identifiers.normalizeIsbn("ISBN-10: 0-306-40615-2"));
        }

        @Test
        @DisplayName("should reject a wrong check digit")
        void shouldRejectBadChecksum() {
            assertNull(Identifiers.normalizeIsbn("978-3-16-148410-1"));
            assertFalse(Identifiers.isValidIsbn("0306406153"));
        }

        @Test
        @DisplayName("should treat ISBN-10 and ISBN-13 of the same book as equal")
        void shouldCompareAcrossLengths() {
            assertEquals("9780306406157", Identifiers.toIsbn13("0306406152"));
            assertTrue(Identifiers.sameIsbn("0-306-40615-2", "978-0-306-40615-7"));
            assertFalse(Identifiers.sameIsbn("0306406152", "9783161484100"));
        }
    }
}
