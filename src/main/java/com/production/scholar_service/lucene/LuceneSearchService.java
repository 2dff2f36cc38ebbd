package com.production.scholar_service.lucene;

import com.production.scholar_service.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.MultiBits;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TermInSetQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_CHUNK_ID;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_CHUNK_INDEX_STORED;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_CONTENT;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_DOCUMENT_ID;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_EMBEDDING;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_LANGUAGE;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_PAGE_NUMBER_STORED;
import static com.production.scholar_service.lucene.LuceneIndexService.FIELD_TOKEN_COUNT;

@Service
@Slf4j
public class LuceneSearchService {

    private final IndexWriter indexWriter;
    private final StandardAnalyzer analyzer;
    private final BM25Similarity similarity;

    public LuceneSearchService(IndexWriter indexWriter,
                               StandardAnalyzer analyzer,
                               BM25Similarity similarity) {
        this.indexWriter = indexWriter;
        this.analyzer = analyzer;
        this.similarity = similarity;
    }

    /**
     * BM25 search over chunk content. Query syntax errors fall back to the escaped literal text.
     *
     * @param documentIds restricts hits to these documents; null or empty searches everything
     */
    public List<SearchResult> keywordSearch(String queryText, Collection<String> documentIds, int topK) throws IOException {
        long startTime = System.currentTimeMillis();

        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            searcher.setSimilarity(similarity);

            Query contentQuery = parse(queryText);
            Query query = contentQuery;
            Query filter = documentFilter(documentIds);
            if (filter != null) {
                BooleanQuery.Builder booleanQuery = new BooleanQuery.Builder();
                booleanQuery.add(contentQuery, BooleanClause.Occur.MUST);
                booleanQuery.add(filter, BooleanClause.Occur.FILTER);
                query = booleanQuery.build();
            }

            List<SearchResult> results = collect(searcher, searcher.search(query, topK));
            log.info("Keyword search for '{}' returned {} results in {}ms",
                    queryText, results.size(), System.currentTimeMillis() - startTime);
            return results;
        }
    }

    /**
     * Approximate nearest neighbours by cosine similarity, scores descending.
     *
     * @param documentIds restricts hits to these documents; null or empty searches everything
     */
    public List<SearchResult> vectorSearch(float[] vector, Collection<String> documentIds, int topK) throws IOException {
        long startTime = System.currentTimeMillis();

        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            if (reader.numDocs() == 0) {
                return List.of();
            }
            IndexSearcher searcher = new IndexSearcher(reader);
            Query query = new KnnFloatVectorQuery(FIELD_EMBEDDING, vector, topK, documentFilter(documentIds));

            List<SearchResult> results = collect(searcher, searcher.search(query, topK));
            log.info("Vector search returned {} results in {}ms", results.size(), System.currentTimeMillis() - startTime);
            return results;
        }
    }

    public Map<String, Object> getChunkStatistics() throws IOException {
        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            Bits liveDocs = MultiBits.getLiveDocs(reader);
            int numDocs = reader.numDocs();

            List<Integer> tokenCounts = new ArrayList<>();
            Set<String> documents = new HashSet<>();
            Map<String, Integer> languages = new TreeMap<>();
            int minTokens = Integer.MAX_VALUE;
            int maxTokens = 0;
            long totalTokens = 0;

            for (int i = 0; i < reader.maxDoc(); i++) {
                if (liveDocs != null && !liveDocs.get(i)) {
                    continue;
                }
                Document doc = reader.storedFields().document(i);
                int tokenCount = doc.getField(FIELD_TOKEN_COUNT).numericValue().intValue();
                tokenCounts.add(tokenCount);
                totalTokens += tokenCount;
                minTokens = Math.min(minTokens, tokenCount);
                maxTokens = Math.max(maxTokens, tokenCount);
                documents.add(doc.get(FIELD_DOCUMENT_ID));
                String language = doc.get(FIELD_LANGUAGE);
                languages.merge(language == null || language.isEmpty() ? "unknown" : language, 1, Integer::sum);
            }

            int under50 = 0, under100 = 0, under200 = 0, over200 = 0;
            for (int count : tokenCounts) {
                if (count < 50) under50++;
                else if (count < 100) under100++;
                else if (count < 200) under200++;
                else over200++;
            }

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("totalDocuments", documents.size());
            stats.put("totalChunks", numDocs);
            stats.put("totalTokens", totalTokens);
            stats.put("avgTokensPerChunk", numDocs > 0 ? totalTokens / numDocs : 0);
            stats.put("minTokens", numDocs > 0 ? minTokens : 0);
            stats.put("maxTokens", maxTokens);
            stats.put("chunksUnder50Tokens", under50);
            stats.put("chunks50to99Tokens", under100);
            stats.put("chunks100to199Tokens", under200);
            stats.put("chunks200PlusTokens", over200);
            stats.put("chunksByLanguage", languages);
            return stats;
        }
    }

    private Query parse(String queryText) {
        QueryParser parser = new QueryParser(FIELD_CONTENT, analyzer);
        try {
            return parser.parse(queryText);
        } catch (ParseException e) {
            log.debug("Query '{}' is not valid query syntax, searching it literally: {}", queryText, e.getMessage());
            try {
                return parser.parse(QueryParser.escape(queryText));
            } catch (ParseException escaped) {
                throw new IllegalArgumentException("Unsearchable query: " + queryText, escaped);
            }
        }
    }

    private static Query documentFilter(Collection<String> documentIds) {
        if (documentIds == null || documentIds.isEmpty()) {
            return null;
        }
        List<BytesRef> terms = documentIds.stream().map(BytesRef::new).toList();
        return new TermInSetQuery(FIELD_DOCUMENT_ID, terms);
    }

    private static List<SearchResult> collect(IndexSearcher searcher, TopDocs topDocs) throws IOException {
        List<SearchResult> results = new ArrayList<>();
        for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
            Document doc = searcher.storedFields().document(scoreDoc.doc);
            String language = doc.get(FIELD_LANGUAGE);
            results.add(SearchResult.builder()
                    .chunkId(doc.get(FIELD_CHUNK_ID))
                    .documentId(doc.get(FIELD_DOCUMENT_ID))
                    .content(doc.get(FIELD_CONTENT))
                    .pageNumber(doc.getField(FIELD_PAGE_NUMBER_STORED).numericValue().intValue())
                    .chunkIndex(doc.getField(FIELD_CHUNK_INDEX_STORED).numericValue().intValue())
                    .language(language == null || language.isEmpty() ? null : language)
                    .score(scoreDoc.score)
                    .build());
        }
        return results;
    }
}
