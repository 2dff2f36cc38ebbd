package com.production.scholar_service.service.segment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextCleaningServiceTest {

    private final TextCleaningService cleaner = new TextCleaningService();

    @Test
    @DisplayName("should drop page furniture and keep paragraph breaks")
    void shouldCleanPageText() {
        String raw = "Page 3 of 10\nThe  ﬁrst   line\n\n\n\nSecond paragraph\n42\n";

        assertEquals("The first line\n\nSecond paragraph", cleaner.cleanText(raw));
    }

    @Test
    @DisplayName("should join words hyphenated across lines")
    void shouldRemoveHyphenation() {
        assertEquals("pattern recognition works", cleaner.removeHyphenation("pattern recog-\nnition works"));
        assertEquals("Baden-\nWürttemberg", cleaner.removeHyphenation("Baden-\nWürttemberg"));
    }

    @Test
    @DisplayName("should normalize typographic quotes and dashes")
    void shouldNormalizeQuotes() {
        assertEquals("\"Zitat\" - Ende", cleaner.fullClean("„Zitat“ – Ende"));
    }

    @Test
    @DisplayName("should remove control characters and lone surrogates")
    void shouldRemoveBrokenCharacters() {
        assertEquals("a b", cleaner.cleanText("a\u0007b"));
        assertEquals("ab", cleaner.cleanText("a\uD800b"));
        assertEquals("", cleaner.cleanText(null));
    }
}
