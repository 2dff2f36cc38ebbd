package com.production.scholar_service.lucene;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.model.Chunk;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.BytesRef;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One Lucene document per chunk: BM25 content, exact-match ids, a cosine vector for KNN
 * and a stored copy of everything needed to rebuild the chunk.
 * All mutations go through a single lock, so writes for the same document never interleave.
 */
@Service
@Slf4j
public class LuceneIndexService {

    public static final String FIELD_CONTENT = "content";
    public static final String FIELD_DOCUMENT_ID = "document_id";
    public static final String FIELD_CHUNK_ID = "chunk_id";
    public static final String FIELD_CHUNK_INDEX = "chunk_index";
    public static final String FIELD_PAGE_NUMBER = "page_number";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_EMBEDDING = "embedding";
    static final String FIELD_CHUNK_INDEX_STORED = "chunk_index_stored";
    static final String FIELD_PAGE_NUMBER_STORED = "page_number_stored";
    static final String FIELD_TOKEN_COUNT = "token_count";
    static final String FIELD_START_OFFSET = "start_offset";
    static final String FIELD_END_OFFSET = "end_offset";
    static final String FIELD_ENTITIES = "entities_json";
    static final String FIELD_EMBEDDING_STORED = "embedding_stored";

    private static final TypeReference<TreeMap<String, Set<String>>> ENTITIES_TYPE = new TypeReference<TreeMap<String, Set<String>>>() {
    };

    private final IndexWriter indexWriter;
    private final ObjectMapper objectMapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    public LuceneIndexService(IndexWriter indexWriter, ObjectMapper objectMapper) {
        this.indexWriter = indexWriter;
        this.objectMapper = objectMapper;
    }

    /**
     * Replaces every chunk of a document with the given set in one atomic update, then commits.
     * Readers see either the old set or the new one, never a mix.
     */
    public void replaceDocument(String documentId, List<IndexedChunk> entries) throws IOException {
        writeLock.lock();
        try {
            List<Document> docs = new ArrayList<>(entries.size());
            for (IndexedChunk entry : entries) {
                if (!documentId.equals(entry.chunk().getDocumentId())) {
                    throw new IllegalArgumentException("Chunk " + entry.chunk().getChunkId()
                            + " does not belong to document " + documentId);
                }
                docs.add(createDocument(entry));
            }
            indexWriter.updateDocuments(new Term(FIELD_DOCUMENT_ID, documentId), docs);
            indexWriter.commit();
            log.info("Replaced index entries for document {}: {} chunks", documentId, entries.size());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Insert-or-replace a single chunk keyed by its chunk id.
     */
    public void upsertChunk(IndexedChunk entry) throws IOException {
        writeLock.lock();
        try {
            indexWriter.updateDocument(new Term(FIELD_CHUNK_ID, entry.chunk().getChunkId()), createDocument(entry));
            indexWriter.commit();
            log.debug("Upserted chunk: {}", entry.chunk().getChunkId());
        } finally {
            writeLock.unlock();
        }
    }

    public void deleteByDocumentId(String documentId) throws IOException {
        writeLock.lock();
        try {
            indexWriter.deleteDocuments(new Term(FIELD_DOCUMENT_ID, documentId));
            indexWriter.commit();
            log.info("Deleted all chunks for document: {}", documentId);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * The document's current index entries in chunk order, vectors included. Used to restore
     * the previous state when a later publish step fails.
     */
    public List<IndexedChunk> snapshot(String documentId) throws IOException {
        List<IndexedChunk> entries = new ArrayList<>();
        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            IndexSearcher searcher = new IndexSearcher(reader);
            TopDocs topDocs = searcher.search(new TermQuery(new Term(FIELD_DOCUMENT_ID, documentId)),
                    Math.max(1, reader.maxDoc()), new Sort(new SortField(FIELD_CHUNK_INDEX_STORED, SortField.Type.INT)));
            for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
                Document doc = searcher.storedFields().document(scoreDoc.doc);
                entries.add(new IndexedChunk(toChunk(doc), decodeVector(doc.getBinaryValue(FIELD_EMBEDDING_STORED))));
            }
        }
        return entries;
    }

    /**
     * Chunk ids currently indexed for a document, in chunk order.
     */
    public List<String> chunkIds(String documentId) throws IOException {
        return snapshot(documentId).stream().map(e -> e.chunk().getChunkId()).toList();
    }

    public long countByDocumentId(String documentId) throws IOException {
        try (IndexReader reader = DirectoryReader.open(indexWriter)) {
            return new IndexSearcher(reader).count(new TermQuery(new Term(FIELD_DOCUMENT_ID, documentId)));
        }
    }

    public long getChunkCount() throws IOException {
        return indexWriter.getDocStats().numDocs;
    }

    private Document createDocument(IndexedChunk entry) throws IOException {
        Chunk chunk = entry.chunk();
        Document doc = new Document();

        doc.add(new TextField(FIELD_CONTENT, chunk.getContent(), Field.Store.YES));
        doc.add(new StringField(FIELD_DOCUMENT_ID, chunk.getDocumentId(), Field.Store.YES));
        doc.add(new StringField(FIELD_CHUNK_ID, chunk.getChunkId(), Field.Store.YES));
        doc.add(new StringField(FIELD_LANGUAGE, chunk.getLanguage() != null ? chunk.getLanguage() : "", Field.Store.YES));

        doc.add(new IntPoint(FIELD_PAGE_NUMBER, chunk.getPageNumber()));
        doc.add(new StoredField(FIELD_PAGE_NUMBER_STORED, chunk.getPageNumber()));

        doc.add(new IntPoint(FIELD_CHUNK_INDEX, chunk.getChunkIndex()));
        doc.add(new StoredField(FIELD_CHUNK_INDEX_STORED, chunk.getChunkIndex()));
        doc.add(new NumericDocValuesField(FIELD_CHUNK_INDEX_STORED, chunk.getChunkIndex()));

        doc.add(new StoredField(FIELD_TOKEN_COUNT, chunk.getTokenCount()));
        doc.add(new StoredField(FIELD_START_OFFSET, chunk.getStartOffset()));
        doc.add(new StoredField(FIELD_END_OFFSET, chunk.getEndOffset()));
        doc.add(new StoredField(FIELD_ENTITIES, objectMapper.writeValueAsString(chunk.getEntities())));

        doc.add(new KnnFloatVectorField(FIELD_EMBEDDING, entry.vector(), VectorSimilarityFunction.COSINE));
        doc.add(new StoredField(FIELD_EMBEDDING_STORED, encodeVector(entry.vector())));

        return doc;
    }

    Chunk toChunk(Document doc) throws IOException {
        String language = doc.get(FIELD_LANGUAGE);
        Map<String, Set<String>> entities = objectMapper.readValue(doc.get(FIELD_ENTITIES), ENTITIES_TYPE);
        return Chunk.builder()
                .chunkId(doc.get(FIELD_CHUNK_ID))
                .documentId(doc.get(FIELD_DOCUMENT_ID))
                .chunkIndex(doc.getField(FIELD_CHUNK_INDEX_STORED).numericValue().intValue())
                .content(doc.get(FIELD_CONTENT))
                .tokenCount(doc.getField(FIELD_TOKEN_COUNT).numericValue().intValue())
                .pageNumber(doc.getField(FIELD_PAGE_NUMBER_STORED).numericValue().intValue())
                .startOffset(doc.getField(FIELD_START_OFFSET).numericValue().intValue())
                .endOffset(doc.getField(FIELD_END_OFFSET).numericValue().intValue())
                .language(language == null || language.isEmpty() ? null : language)
                .entities(entities)
                .build();
    }

    static BytesRef encodeVector(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return new BytesRef(buffer.array());
    }

    static float[] decodeVector(BytesRef bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes.bytes, bytes.offset, bytes.length).order(ByteOrder.LITTLE_ENDIAN);
        float[] vector = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = buffer.getFloat();
        }
        return vector;
    }
}
