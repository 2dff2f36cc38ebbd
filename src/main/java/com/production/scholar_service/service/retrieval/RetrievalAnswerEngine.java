package com.production.scholar_service.service.retrieval;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.lucene.LuceneSearchService;
import com.production.scholar_service.model.Citation;
import com.production.scholar_service.model.DocumentRecord;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.QueryMode;
import com.production.scholar_service.model.QueryRequest;
import com.production.scholar_service.model.QueryResponse;
import com.production.scholar_service.model.RetrievedChunk;
import com.production.scholar_service.model.SearchResult;
import com.production.scholar_service.model.SourceReference;
import com.production.scholar_service.repository.DocumentRecordRepository;
import com.production.scholar_service.service.embedding.ChunkEmbedder;
import dev.langchain4j.model.chat.ChatLanguageModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers queries over the indexed chunks.
 *
 * Semantic and question modes search by embedding, keyword mode by BM25. Hits are over-fetched so that
 * author and year filters, which live in the document metadata rather than the index, can still fill
 * the requested result count. In question mode the surviving chunks become numbered sources for the
 * language model, and the {@code [n]} markers of its answer are resolved back to chunks.
 */
@Service
@Slf4j
public class RetrievalAnswerEngine {

    private static final Pattern MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)]");
    private static final int MAX_PROMPT_AUTHORS = 3;

    private final LuceneSearchService searchService;
    private final ChunkEmbedder chunkEmbedder;
    private final ChatLanguageModel chatModel;
    private final DocumentRecordRepository documentRepository;
    private final CitationFormatter citationFormatter;
    private final AppConfig.Retrieval config;

    public RetrievalAnswerEngine(LuceneSearchService searchService,
                                 ChunkEmbedder chunkEmbedder,
                                 ChatLanguageModel chatModel,
                                 DocumentRecordRepository documentRepository,
                                 CitationFormatter citationFormatter,
                                 AppConfig appConfig) {
        this.searchService = searchService;
        this.chunkEmbedder = chunkEmbedder;
        this.chatModel = chatModel;
        this.documentRepository = documentRepository;
        this.citationFormatter = citationFormatter;
        this.config = appConfig.getRetrieval();
    }

    public QueryResponse query(QueryRequest request) throws IOException {
        long startTime = System.currentTimeMillis();
        validate(request);

        QueryMode mode = request.effectiveMode();
        CitationStyle style = CitationStyle.fromString(request.getCitationStyle() != null
                ? request.getCitationStyle() : config.getDefaultCitationStyle());
        int topK = request.getMaxResults() != null ? request.getMaxResults() : config.getDefaultTopK();

        List<Hit> hits = retrieve(request, mode, topK);
        long retrievalMs = System.currentTimeMillis() - startTime;
        log.info("[TIMING] Retrieval ({}) for '{}' kept {} chunks in {}ms", mode.key(), request.getQuery(), hits.size(), retrievalMs);

        Map<String, Long> timing = new LinkedHashMap<>();
        timing.put("retrievalMs", retrievalMs);

        QueryResponse.QueryResponseBuilder response = QueryResponse.builder()
                .query(request.getQuery())
                .mode(mode)
                .citationStyle(style.key())
                .totalResults(hits.size())
                .sources(sources(hits, style));

        List<RetrievedChunk> results = new ArrayList<>();
        if (mode == QueryMode.QUESTION) {
            long generationStart = System.currentTimeMillis();
            Answer answer = answer(request.getQuery(), hits, style);
            timing.put("generationMs", System.currentTimeMillis() - generationStart);
            response.answer(answer.text())
                    .answerError(answer.error())
                    .citations(answer.citations());
            for (int i = 0; i < hits.size(); i++) {
                Hit hit = hits.get(i);
                Integer marker = i < answer.contextSize() ? i + 1 : null;
                results.add(toRetrievedChunk(hit, i + 1, marker, style));
            }
        } else {
            for (int i = 0; i < hits.size(); i++) {
                results.add(toRetrievedChunk(hits.get(i), i + 1, null, style));
            }
        }

        timing.put("totalMs", System.currentTimeMillis() - startTime);
        return response.results(results).timing(timing).build();
    }

    private void validate(QueryRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        Integer maxResults = request.getMaxResults();
        if (maxResults != null && (maxResults < 1 || maxResults > config.getMaxTopK())) {
            throw new IllegalArgumentException("maxResults must be between 1 and " + config.getMaxTopK());
        }
        if (request.getYearFrom() != null && request.getYearTo() != null
                && request.getYearFrom() > request.getYearTo()) {
            throw new IllegalArgumentException("yearFrom must not be after yearTo");
        }
    }

    private List<Hit> retrieve(QueryRequest request, QueryMode mode, int topK) throws IOException {
        int fetchK = Math.max(topK, topK * Math.max(1, config.getOverFetchFactor()));
        List<String> documentIds = request.getDocumentIds();

        List<SearchResult> raw = mode == QueryMode.KEYWORD
                ? searchService.keywordSearch(request.getQuery(), documentIds, fetchK)
                : searchService.vectorSearch(chunkEmbedder.embedQuery(request.getQuery()), documentIds, fetchK);
        if (raw.isEmpty()) {
            return List.of();
        }

        Set<String> ids = raw.stream().map(SearchResult::getDocumentId).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, DocumentRecord> records = documentRepository.findByDocumentIdIn(ids).stream()
                .collect(Collectors.toMap(DocumentRecord::getDocumentId, Function.identity(), (a, b) -> a));

        List<Hit> hits = new ArrayList<>();
        for (SearchResult result : raw) {
            DocumentRecord record = records.get(result.getDocumentId());
            if (!isPublished(record)) {
                continue;
            }
            Metadata metadata = record.getMetadata() != null ? record.getMetadata() : new Metadata();
            if (matchesAuthor(metadata, request.getAuthor()) && matchesYear(metadata, request.getYearFrom(), request.getYearTo())) {
                hits.add(new Hit(result, metadata, result.getScore()));
            }
        }
        log.debug("Fetched {} chunks, {} left after document filters", raw.size(), hits.size());

        if (request.isRerankByRecency()) {
            hits = rerankByRecency(hits, config.getRecencyWeight());
        }
        return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
    }

    /**
     * Only documents whose chunk set has been published at least once are answerable; a running
     * reprocess keeps the previous set searchable until it is swapped.
     */
    private static boolean isPublished(DocumentRecord record) {
        return record != null && record.getProcessedAt() != null;
    }

    static boolean matchesAuthor(Metadata metadata, String author) {
        if (author == null || author.isBlank()) {
            return true;
        }
        String needle = author.trim().toLowerCase(Locale.ROOT);
        return metadata.getAuthors() != null && metadata.getAuthors().stream()
                .anyMatch(name -> name != null && name.toLowerCase(Locale.ROOT).contains(needle));
    }

    static boolean matchesYear(Metadata metadata, Integer yearFrom, Integer yearTo) {
        if (yearFrom == null && yearTo == null) {
            return true;
        }
        Integer year = metadata.getYear();
        if (year == null) {
            return false;
        }
        return (yearFrom == null || year >= yearFrom) && (yearTo == null || year <= yearTo);
    }

    /**
     * score * (1 + weight * normalizedYear), where the newest year among the hits maps to 1 and the oldest to 0.
     * Hits without a year keep their score. Ties keep retrieval order.
     */
    static List<Hit> rerankByRecency(List<Hit> hits, double weight) {
        int minYear = Integer.MAX_VALUE;
        int maxYear = Integer.MIN_VALUE;
        for (Hit hit : hits) {
            Integer year = hit.metadata().getYear();
            if (year != null) {
                minYear = Math.min(minYear, year);
                maxYear = Math.max(maxYear, year);
            }
        }
        if (minYear >= maxYear) {
            return hits;
        }

        List<Hit> reranked = new ArrayList<>(hits.size());
        for (Hit hit : hits) {
            Integer year = hit.metadata().getYear();
            double normalized = year == null ? 0.0 : (double) (year - minYear) / (maxYear - minYear);
            reranked.add(new Hit(hit.result(), hit.metadata(), (float) (hit.score() * (1 + weight * normalized))));
        }
        reranked.sort(Comparator.comparingDouble(Hit::score).reversed());
        return reranked;
    }

    private Answer answer(String question, List<Hit> hits, CitationStyle style) {
        if (hits.isEmpty()) {
            return new Answer(null, "No matching passages found", List.of(), 0);
        }

        StringBuilder context = new StringBuilder();
        int contextSize = 0;
        for (Hit hit : hits) {
            String source = sourceBlock(contextSize + 1, hit);
            if (contextSize > 0 && context.length() + source.length() > config.getMaxContextChars()) {
                break;
            }
            if (contextSize == 0 && source.length() > config.getMaxContextChars()) {
                source = source.substring(0, config.getMaxContextChars());
            }
            context.append(source);
            contextSize++;
        }

        String prompt = buildPrompt(question, context.toString());
        log.debug("Prompt with {} sources, {} chars", contextSize, prompt.length());

        String generated;
        try {
            generated = chatModel.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Answer generation failed, returning ranked chunks only: {}", e.getMessage());
            return new Answer(null, "Answer generation failed: " + e.getMessage(), List.of(), contextSize);
        }
        if (generated == null || generated.isBlank()) {
            return new Answer(null, "Language model returned an empty answer", List.of(), contextSize);
        }

        List<Citation> citations = new ArrayList<>();
        String text = resolveMarkers(generated.trim(), hits.subList(0, contextSize), style, citations);
        return new Answer(text, null, citations, contextSize);
    }

    private static String sourceBlock(int marker, Hit hit) {
        Metadata metadata = hit.metadata();
        StringBuilder block = new StringBuilder();
        block.append('[').append(marker).append("] ");
        List<String> authors = metadata.getAuthors() == null ? List.of() : metadata.getAuthors();
        if (!authors.isEmpty()) {
            block.append(String.join(", ", authors.subList(0, Math.min(MAX_PROMPT_AUTHORS, authors.size()))));
            if (authors.size() > MAX_PROMPT_AUTHORS) {
                block.append(" et al.");
            }
            block.append(' ');
        }
        block.append('(').append(metadata.getYear() != null ? metadata.getYear() : CitationFormatter.NO_DATE).append("): ");
        block.append(metadata.getTitle() != null ? metadata.getTitle() : CitationFormatter.UNTITLED);
        block.append(", p. ").append(hit.result().getPageNumber()).append('\n');
        block.append(hit.result().getContent()).append("\n\n");
        return block.toString();
    }

    static String buildPrompt(String question, String context) {
        return "You are a research assistant. Answer the question using only the numbered sources below.\n"
                + "Cite every statement with the number of its source in square brackets, for example [1] or [2][3].\n"
                + "If the sources do not contain the answer, say so. Answer in the language of the question.\n\n"
                + "### Sources:\n" + context
                + "### Question:\n" + question + "\n\n"
                + "### Answer:\n";
    }

    /**
     * Collects the distinct valid markers of the answer in order of appearance and strips the ones that
     * point past the sources the model was given.
     */
    String resolveMarkers(String answer, List<Hit> context, CitationStyle style, List<Citation> citations) {
        Set<Integer> seen = new LinkedHashSet<>();
        Matcher matcher = MARKER.matcher(answer);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            List<String> kept = new ArrayList<>();
            for (String number : matcher.group(1).split("\\s*,\\s*")) {
                int marker = Integer.parseInt(number);
                if (marker < 1 || marker > context.size()) {
                    continue;
                }
                kept.add(String.valueOf(marker));
                if (seen.add(marker)) {
                    Hit hit = context.get(marker - 1);
                    SearchResult result = hit.result();
                    citations.add(new Citation(marker, result.getDocumentId(), result.getChunkId(), result.getPageNumber(),
                            citationFormatter.inline(hit.metadata(), style, result.getPageNumber(), marker)));
                }
            }
            String replacement = kept.isEmpty() ? "" : "[" + String.join(", ", kept) + "]";
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(replacement));
            if (kept.isEmpty() && resolved.length() > 0 && resolved.charAt(resolved.length() - 1) == ' ') {
                resolved.setLength(resolved.length() - 1);
            }
        }
        matcher.appendTail(resolved);
        return resolved.toString().trim();
    }

    private List<SourceReference> sources(List<Hit> hits, CitationStyle style) {
        Map<String, SourceReference> sources = new LinkedHashMap<>();
        for (Hit hit : hits) {
            String documentId = hit.result().getDocumentId();
            if (!sources.containsKey(documentId)) {
                sources.put(documentId, new SourceReference(documentId, hit.metadata().getTitle(),
                        citationFormatter.format(hit.metadata(), style)));
            }
        }
        return new ArrayList<>(sources.values());
    }

    private RetrievedChunk toRetrievedChunk(Hit hit, int rank, Integer marker, CitationStyle style) {
        SearchResult result = hit.result();
        Metadata metadata = hit.metadata();
        return RetrievedChunk.builder()
                .rank(rank)
                .marker(marker)
                .chunkId(result.getChunkId())
                .documentId(result.getDocumentId())
                .content(result.getContent())
                .pageNumber(result.getPageNumber())
                .chunkIndex(result.getChunkIndex())
                .language(result.getLanguage())
                .score(hit.score())
                .title(metadata.getTitle())
                .authors(metadata.getAuthors())
                .year(metadata.getYear())
                .citation(citationFormatter.inline(metadata, style, result.getPageNumber(), marker != null ? marker : rank))
                .build();
    }

    record Hit(SearchResult result, Metadata metadata, float score) {
    }

    private record Answer(String text, String error, List<Citation> citations, int contextSize) {
    }
}
