package com.production.scholar_service.service.segment;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.Chunk;
import com.production.scholar_service.model.PageContent;
import com.production.scholar_service.service.segment.SentenceSplitter.Sentence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Packs sentences into chunks under a token budget.
 *
 * Chunks end at sentence boundaries, preferably at paragraph ends, and never inside a recognized entity.
 * Consecutive chunks share up to {@code overlapTokens} of whole trailing sentences. Output is a pure
 * function of the page texts, so reprocessing unchanged input yields identical chunks and ids.
 */
@Service
@Slf4j
public class Segmenter {

    private static final String PAGE_SEPARATOR = "\n\n";

    // A chunk this full is closed early when a paragraph ends
    private static final double PARAGRAPH_CLOSE_RATIO = 0.75;

    private final AppConfig appConfig;
    private final SentenceSplitter sentenceSplitter;
    private final EntityRecognizer entityRecognizer;
    private final LanguageDetector languageDetector;

    public Segmenter(AppConfig appConfig,
                     SentenceSplitter sentenceSplitter,
                     EntityRecognizer entityRecognizer,
                     LanguageDetector languageDetector) {
        this.appConfig = appConfig;
        this.sentenceSplitter = sentenceSplitter;
        this.entityRecognizer = entityRecognizer;
        this.languageDetector = languageDetector;
    }

    public List<Chunk> segment(List<PageContent> pages, String documentId) {
        StringBuilder fullText = new StringBuilder();
        List<int[]> pageStarts = new ArrayList<>();
        for (PageContent page : pages) {
            String text = page.getCleanedText() != null ? page.getCleanedText() : page.getRawText();
            if (text == null || text.isBlank()) {
                continue;
            }
            if (fullText.length() > 0) {
                fullText.append(PAGE_SEPARATOR);
            }
            pageStarts.add(new int[]{fullText.length(), page.getPageNumber()});
            fullText.append(text.trim());
        }
        return segment(fullText.toString(), pageStarts, documentId);
    }

    private List<Chunk> segment(String text, List<int[]> pageStarts, String documentId) {
        List<Chunk> chunks = new ArrayList<>();
        if (text.isBlank()) {
            return chunks;
        }

        int maxTokens = Math.max(1, appConfig.getChunking().getMaxTokens());
        int overlapTokens = Math.max(0, Math.min(appConfig.getChunking().getOverlapTokens(), maxTokens / 2));

        List<EntitySpan> entities = entityRecognizer.recognize(text);
        List<Unit> units = toUnits(text, sentenceSplitter.split(text, entities), entities, maxTokens);

        List<Unit> current = new ArrayList<>();
        int currentTokens = 0;
        int carried = 0;

        for (Unit unit : units) {
            if (currentTokens + unit.tokens > maxTokens) {
                if (current.size() > carried) {
                    chunks.add(buildChunk(text, current, chunks.size(), documentId, pageStarts, entities));
                    List<Unit> overlap = trailingOverlap(current, overlapTokens, unit.tokens, maxTokens);
                    current = new ArrayList<>(overlap);
                    currentTokens = tokens(overlap);
                    carried = overlap.size();
                } else {
                    // carried overlap leaves no room for this sentence
                    current.clear();
                    currentTokens = 0;
                    carried = 0;
                }
            }
            current.add(unit);
            currentTokens += unit.tokens;

            if (unit.endsParagraph && currentTokens >= maxTokens * PARAGRAPH_CLOSE_RATIO) {
                chunks.add(buildChunk(text, current, chunks.size(), documentId, pageStarts, entities));
                List<Unit> overlap = trailingOverlap(current, overlapTokens, 0, maxTokens);
                current = new ArrayList<>(overlap);
                currentTokens = tokens(overlap);
                carried = overlap.size();
            }
        }
        if (current.size() > carried) {
            chunks.add(buildChunk(text, current, chunks.size(), documentId, pageStarts, entities));
        }

        log.debug("Segmented document {} into {} chunks ({} sentences, {} entities)",
                documentId, chunks.size(), units.size(), entities.size());
        return chunks;
    }

    /**
     * Whole trailing sentences worth at most {@code overlapTokens}, leaving room for the next sentence
     * and never the complete previous chunk.
     */
    private List<Unit> trailingOverlap(List<Unit> emitted, int overlapTokens, int nextTokens, int maxTokens) {
        List<Unit> overlap = new ArrayList<>();
        int tokens = 0;
        for (int i = emitted.size() - 1; i > 0; i--) {
            Unit unit = emitted.get(i);
            if (tokens + unit.tokens > overlapTokens || tokens + unit.tokens + nextTokens > maxTokens) {
                break;
            }
            overlap.add(0, unit);
            tokens += unit.tokens;
        }
        return overlap;
    }

    private List<Unit> toUnits(String text, List<Sentence> sentences, List<EntitySpan> entities, int maxTokens) {
        List<Unit> units = new ArrayList<>();
        for (Sentence sentence : sentences) {
            int tokens = countTokens(text, sentence.start(), sentence.end());
            if (tokens <= maxTokens) {
                units.add(new Unit(sentence.start(), sentence.end(), tokens, sentence.endsParagraph()));
            } else {
                splitLongSentence(text, sentence, entities, maxTokens, units);
            }
        }
        return units;
    }

    // Cuts at whitespace that is not inside an entity span
    private void splitLongSentence(String text, Sentence sentence, List<EntitySpan> entities,
                                   int maxTokens, List<Unit> units) {
        int pieceStart = sentence.start();
        int tokens = 0;
        boolean inToken = false;
        for (int i = sentence.start(); i < sentence.end(); i++) {
            boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inToken) {
                if (tokens >= maxTokens && !insideEntity(i, entities)) {
                    int end = trimEnd(text, pieceStart, i);
                    units.add(new Unit(pieceStart, end, tokens, false));
                    pieceStart = i;
                    tokens = 0;
                }
                tokens++;
            }
            inToken = !whitespace;
        }
        units.add(new Unit(pieceStart, sentence.end(), tokens, sentence.endsParagraph()));
    }

    private Chunk buildChunk(String text, List<Unit> units, int index, String documentId,
                             List<int[]> pageStarts, List<EntitySpan> entities) {
        int start = units.get(0).start;
        int end = units.get(units.size() - 1).end;
        String content = text.substring(start, end);

        Map<String, Set<String>> found = new TreeMap<>();
        for (EntitySpan span : entities) {
            if (span.start() >= end) {
                break;
            }
            if (span.within(start, end)) {
                found.computeIfAbsent(span.type(), t -> new TreeSet<>()).add(span.text());
            }
        }

        return Chunk.builder()
                .chunkId(chunkId(documentId, index))
                .documentId(documentId)
                .chunkIndex(index)
                .content(content)
                .tokenCount(countTokens(text, start, end))
                .pageNumber(pageAt(start, pageStarts))
                .startOffset(start)
                .endOffset(end)
                .language(languageDetector.detect(content))
                .entities(found)
                .build();
    }

    public static String chunkId(String documentId, int index) {
        return documentId + "_c" + index;
    }

    private int pageAt(int offset, List<int[]> pageStarts) {
        int page = pageStarts.isEmpty() ? 1 : pageStarts.get(0)[1];
        for (int[] pageStart : pageStarts) {
            if (pageStart[0] > offset) {
                break;
            }
            page = pageStart[1];
        }
        return page;
    }

    private boolean insideEntity(int offset, List<EntitySpan> entities) {
        for (EntitySpan span : entities) {
            if (span.start() >= offset) {
                return false;
            }
            if (span.contains(offset)) {
                return true;
            }
        }
        return false;
    }

    private static int tokens(List<Unit> units) {
        return units.stream().mapToInt(u -> u.tokens).sum();
    }

    public static int countTokens(String text) {
        return text == null ? 0 : countTokens(text, 0, text.length());
    }

    private static int countTokens(String text, int start, int end) {
        int count = 0;
        boolean inToken = false;
        for (int i = start; i < end; i++) {
            boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inToken) {
                count++;
            }
            inToken = !whitespace;
        }
        return count;
    }

    private static int trimEnd(String text, int start, int end) {
        int i = end;
        while (i > start && Character.isWhitespace(text.charAt(i - 1))) {
            i--;
        }
        return i;
    }

    private record Unit(int start, int end, int tokens, boolean endsParagraph) {
    }
}
