package com.production.scholar_service.service.segment;

import com.production.scholar_service.service.segment.SentenceSplitter.Sentence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SentenceSplitterTest {

    private final SentenceSplitter splitter = new SentenceSplitter();

    @Test
    @DisplayName("should not split after abbreviations or initials")
    void shouldRespectAbbreviations() {
        String text = "Dr. Smith arrived. J. Doe wrote it, e.g. the results. He left.";

        assertEquals(List.of("Dr. Smith arrived.", "J. Doe wrote it, e.g. the results.", "He left."),
                texts(text, splitter.split(text, List.of())));
    }

    @Test
    @DisplayName("should mark sentences that close a paragraph")
    void shouldMarkParagraphEnds() {
        String text = "First para.\n\nSecond para. Still second.";

        List<Sentence> sentences = splitter.split(text, List.of());

        assertEquals(List.of("First para.", "Second para.", "Still second."), texts(text, sentences));
        assertTrue(sentences.get(0).endsParagraph());
        assertFalse(sentences.get(1).endsParagraph());
        assertTrue(sentences.get(2).endsParagraph());
    }

    @Test
    @DisplayName("should not split inside an entity span")
    void shouldRespectEntities() {
        String text = "Visit example.org/a. b for details. Done.";
        int start = text.indexOf("example");
        EntitySpan url = new EntitySpan(EntityRecognizer.URL, "example.org/a. b", start, start + "example.org/a. b".length());

        assertEquals(List.of("Visit example.org/a. b for details.", "Done."), texts(text, splitter.split(text, List.of(url))));
    }

    @Test
    @DisplayName("should return nothing for blank text")
    void shouldHandleBlank() {
        assertTrue(splitter.split("   ", List.of()).isEmpty());
        assertTrue(splitter.split(null, List.of()).isEmpty());
    }

    private static List<String> texts(String text, List<Sentence> sentences) {
        return sentences.stream().map(s -> text.substring(s.start(), s.end())).toList();
    }
}
