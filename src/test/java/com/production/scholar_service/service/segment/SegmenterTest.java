package com.production.scholar_service.service.segment;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.PageContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SegmenterTest {

    private AppConfig appConfig;
    private Segmenter segmenter;

    @BeforeEach
    void setUp() {
        appConfig = new AppConfig();
        appConfig.getChunking().setMaxTokens(10);
        appConfig.getChunking().setOverlapTokens(4);
        segmenter = new Segmenter(appConfig, new SentenceSplitter(), new EntityRecognizer(), new LanguageDetector());
    }

    @Test
    @DisplayName("should pack whole sentences with overlap and track pages")
    void shouldPackSentences() {
        List<PageContent> pages = List.of(
                page(1, "One two three four. Five six seven eight."),
                page(2, "Nine ten eleven twelve. Thirteen fourteen fifteen sixteen."));

        List<Chunk> chunks = segmenter.segment(pages, "doc1");

        assertEquals(3, chunks.size());
        assertEquals("One two three four. Five six seven eight.", chunks.get(0).getContent());
        assertTrue(chunks.get(1).getContent().startsWith("Five six seven eight."));
        assertTrue(chunks.get(1).getContent().endsWith("Nine ten eleven twelve."));
        assertEquals("Nine ten eleven twelve. Thirteen fourteen fifteen sixteen.", chunks.get(2).getContent());
        assertEquals(List.of(1, 1, 2), chunks.stream().map(Chunk::getPageNumber).toList());
        assertEquals(List.of("doc1_c0", "doc1_c1", "doc1_c2"), chunks.stream().map(Chunk::getChunkId).toList());
        chunks.forEach(chunk -> assertTrue(chunk.getTokenCount() <= 10));
    }

    @Test
    @DisplayName("should produce identical chunks for identical input")
    void shouldBeDeterministic() {
        List<PageContent> pages = List.of(page(1, "Alpha beta gamma delta. Epsilon zeta eta theta. Iota kappa lambda mu."));

        assertEquals(segmenter.segment(pages, "doc2"), segmenter.segment(pages, "doc2"));
    }

    @Test
    @DisplayName("should not cut a long sentence inside an entity")
    void shouldKeepEntitiesWhole() {
        appConfig.getChunking().setMaxTokens(3);
        appConfig.getChunking().setOverlapTokens(0);

        List<Chunk> chunks = segmenter.segment(
                List.of(page(1, "Contact Prof. Dr. Anna Schmidt today please now.")), "doc3");

        assertEquals(2, chunks.size());
        assertEquals("Contact Prof. Dr. Anna Schmidt", chunks.get(0).getContent());
        assertEquals(Set.of("Prof. Dr. Anna Schmidt"), chunks.get(0).getEntities().get(EntityRecognizer.PERSON));
        assertEquals("today please now.", chunks.get(1).getContent());
    }

    @Test
    @DisplayName("should prefer cleaned text and skip empty pages")
    void shouldUseCleanedText() {
        PageContent cleaned = PageContent.builder().pageNumber(3).rawText("raw  text").cleanedText("Clean text.").build();

        List<Chunk> chunks = segmenter.segment(List.of(page(1, "  "), cleaned), "doc4");

        assertEquals(1, chunks.size());
        assertEquals("Clean text.", chunks.get(0).getContent());
        assertEquals(3, chunks.get(0).getPageNumber());
    }

    @Test
    @DisplayName("should return no chunks for blank input")
    void shouldHandleBlankInput() {
        assertTrue(segmenter.segment(List.of(page(1, "")), "doc5").isEmpty());
        assertEquals(0, Segmenter.countTokens(null));
        assertEquals(3, Segmenter.countTokens(" a  b\nc "));
    }

    private static PageContent page(int number, String text) {
        return PageContent.builder().pageNumber(number).rawText(text).build();
    }
}
