package com.production.scholar_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "scholar")
@Getter
@Setter
public class AppConfig {

    private Lucene lucene = new Lucene();
    private Storage storage = new Storage();
    private Extraction extraction = new Extraction();
    private Ocr ocr = new Ocr();
    private Metadata metadata = new Metadata();
    private Chunking chunking = new Chunking();
    private Embedding embedding = new Embedding();
    private Retrieval retrieval = new Retrieval();
    private Llm llm = new Llm();

    @Getter
    @Setter
    public static class Lucene {
        private String indexPath = "./lucene-index";
        private Bm25 bm25 = new Bm25();
        private String stopwordsPath = "classpath:stopwords.txt";

        @Getter
        @Setter
        public static class Bm25 {
            private float k1 = 1.2f;
            private float b = 0.75f;
        }
    }

    @Getter
    @Setter
    public static class Storage {
        /** Originals are kept here so failed or edited documents can be reprocessed without re-upload. */
        private String originalsPath = "./data/originals";
        private long maxUploadBytes = 100L * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Extraction {
        private int timeoutSeconds = 120;
        private int threads = 2;
    }

    @Getter
    @Setter
    public static class Ocr {
        private boolean enabled = true;
        /** Average non-whitespace characters per page below which a PDF is treated as scanned. */
        private int minCharsPerPage = 50;
        private float renderDpi = 300f;
        private int pageTimeoutSeconds = 60;
        /** Directory holding the tesseract binary; blank means look it up on the PATH. */
        private String tesseractPath = "";
        private Map<String, String> languages = new LinkedHashMap<>(Map.of(
                "de", "deu",
                "en", "eng",
                "auto", "deu+eng",
                "mixed", "deu+eng"));
    }

    @Getter
    @Setter
    public static class Metadata {
        private List<String> enabledSources = new ArrayList<>(
                List.of("crossref", "openalex", "openlibrary", "googlebooks", "k10plus"));
        /** Inter-source tie breaker, most trusted first. */
        private List<String> trustRanking = new ArrayList<>(
                List.of("crossref", "openalex", "k10plus", "googlebooks", "openlibrary"));
        private int sourceTimeoutSeconds = 10;
        private int connectTimeoutSeconds = 5;
        private int maxRetries = 2;
        private long retryBaseDelayMs = 1000;
        private double similarityFloor = 0.6;
        private int cacheTtlMinutes = 24 * 60;
        private int threads = 5;
        private String userAgent = "scholar-pipeline/0.1 (mailto:admin@example.org)";
        private String crossrefUrl = "https://api.crossref.org/works";
        private String openalexUrl = "https://api.openalex.org/works";
        private String openlibraryUrl = "https://openlibrary.org/search.json";
        private String googlebooksUrl = "https://www.googleapis.com/books/v1/volumes";
        private String googlebooksApiKey = "";
        private String k10plusUrl = "https://sru.k10plus.de/opac-de-627";
    }

    @Getter
    @Setter
    public static class Chunking {
        private int maxTokens = 250;
        private int overlapTokens = 40;
    }

    @Getter
    @Setter
    public static class Embedding {
        private int dimensions = 768;
        private int batchSize = 32;
        private int maxRetries = 3;
        private long retryBaseDelayMs = 500;
    }

    @Getter
    @Setter
    public static class Retrieval {
        private int defaultTopK = 10;
        private int maxTopK = 100;
        private int overFetchFactor = 4;
        private double recencyWeight = 0.1;
        private String defaultCitationStyle = "apa";
        private int maxContextChars = 12000;
    }

    @Getter
    @Setter
    public static class Llm {
        private String provider = "ollama";
        private int timeoutSeconds = 120;
        private Ollama ollama = new Ollama();
        private OpenAi openai = new OpenAi();

        @Getter
        @Setter
        public static class Ollama {
            private String baseUrl = "http://localhost:11434";
            private String chatModel = "llama3";
            private String embeddingModel = "nomic-embed-text";
        }

        @Getter
        @Setter
        public static class OpenAi {
            private String apiKey = "";
            private String chatModel = "gpt-4o-mini";
            private String embeddingModel = "text-embedding-3-small";
        }
    }
}
