package com.production.scholar_service.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.exception.SourceUnavailableException;
import com.production.scholar_service.model.MatchKey;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataCandidate;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared plumbing for sources reached over HTTP: GET with retry and exponential backoff on 429/503,
 * response caching, and scoring of parsed records against the hints.
 * Subclasses only build request URLs and map response bodies to {@link Metadata} records.
 */
@Slf4j
public abstract class AbstractHttpMetadataSource implements MetadataSource {

    private static final double MAX_FUZZY_CONFIDENCE = 0.99;

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final AppConfig appConfig;
    private final SourceResponseCache cache;

    protected AbstractHttpMetadataSource(HttpClient httpClient, ObjectMapper objectMapper,
                                         AppConfig appConfig, SourceResponseCache cache) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.appConfig = appConfig;
        this.cache = cache;
    }

    /**
     * Request URLs in order of preference, identifier lookups first. Later URLs are only tried
     * when earlier ones return no records.
     */
    protected abstract List<String> requestUrls(Metadata hints);

    /**
     * Records contained in one response body, in the source's relevance order.
     */
    protected abstract List<Metadata> parse(String body, Metadata hints) throws IOException;

    @Override
    public List<MetadataCandidate> lookup(Metadata hints) throws SourceUnavailableException {
        for (String url : requestUrls(hints)) {
            Optional<String> body = fetch(url);
            if (body.isEmpty()) {
                continue;
            }
            List<Metadata> records;
            try {
                records = parse(body.get(), hints);
            } catch (IOException e) {
                throw new SourceUnavailableException(name(), "unreadable response: " + e.getMessage(), e);
            }
            if (!records.isEmpty()) {
                return score(hints, records);
            }
        }
        return List.of();
    }

    /**
     * Turns parsed records into candidates: identifier agreement gives confidence 1.0,
     * otherwise the fuzzy title/author score capped below 1.
     */
    List<MetadataCandidate> score(Metadata hints, List<Metadata> records) {
        List<MetadataCandidate> candidates = new ArrayList<>();
        for (int rank = 0; rank < records.size(); rank++) {
            Metadata record = records.get(rank);
            MatchKey key;
            double confidence;
            if (hints.getDoi() != null && Identifiers.sameDoi(hints.getDoi(), record.getDoi())) {
                key = MatchKey.DOI;
                confidence = 1.0;
            } else if (hints.getIsbn() != null && Identifiers.sameIsbn(hints.getIsbn(), record.getIsbn())) {
                key = MatchKey.ISBN;
                confidence = 1.0;
            } else if (hints.getTitle() != null) {
                key = MatchKey.FUZZY;
                confidence = Math.min(MAX_FUZZY_CONFIDENCE, StringSimilarity.matchScore(
                        hints.getTitle(), hints.getAuthors(), record.getTitle(), record.getAuthors()));
            } else {
                key = MatchKey.FUZZY;
                confidence = 0.0;
            }
            candidates.add(MetadataCandidate.builder()
                    .source(name())
                    .confidence(confidence)
                    .matchKey(key)
                    .rank(rank)
                    .fields(record)
                    .build());
        }
        return candidates;
    }

    /**
     * GET with retry. Empty for 404, cached body for repeated URLs.
     */
    protected Optional<String> fetch(String url) throws SourceUnavailableException {
        Optional<String> cached = cache.get(url);
        if (cached.isPresent()) {
            log.debug("{}: cache hit for {}", name(), url);
            return cached;
        }

        var config = appConfig.getMetadata();
        int maxRetries = config.getMaxRetries();
        String lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long backoffMs = (long) Math.pow(2, attempt - 1) * config.getRetryBaseDelayMs();
                log.warn("{}: retry {}/{} - waiting {}ms", name(), attempt, maxRetries, backoffMs);
                sleep(backoffMs);
            }

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(config.getSourceTimeoutSeconds()))
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", acceptHeader())
                    .GET()
                    .build();

            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                int status = response.statusCode();
                if (status == 200) {
                    cache.put(url, response.body());
                    return Optional.of(response.body());
                } else if (status == 404) {
                    return Optional.empty();
                } else if (status == 429 || status == 503) {
                    log.warn("{} returned {} - will retry", name(), status);
                    lastError = "HTTP " + status;
                } else {
                    throw new SourceUnavailableException(name(), "HTTP " + status);
                }
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                if (attempt == maxRetries) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SourceUnavailableException(name(), "interrupted", e);
            }
        }

        throw new SourceUnavailableException(name(),
                "failed after " + (maxRetries + 1) + " attempts" + (lastError != null ? " (" + lastError + ")" : ""));
    }

    protected String acceptHeader() {
        return "application/json";
    }

    protected JsonNode readTree(String body) throws IOException {
        return objectMapper.readTree(body);
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Title plus the first author's surname, the query most sources rank best with.
     */
    protected static String bibliographicQuery(Metadata hints) {
        StringBuilder query = new StringBuilder(hints.getTitle());
        String firstAuthor = hints.firstAuthor();
        if (firstAuthor != null) {
            String surname = firstAuthor.contains(",")
                    ? firstAuthor.substring(0, firstAuthor.indexOf(',')).trim()
                    : firstAuthor.substring(firstAuthor.lastIndexOf(' ') + 1).trim();
            query.append(' ').append(surname);
        }
        return query.toString();
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isArray()) {
            value = value.path(0);
        }
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().replaceAll("\\s+", " ").trim();
        return text.isEmpty() ? null : text;
    }

    protected static Integer year(String value) {
        if (value == null || value.length() < 4 || !value.substring(0, 4).matches("\\d{4}")) {
            return null;
        }
        return Integer.parseInt(value.substring(0, 4));
    }

    /**
     * The hinted ISBN when the record lists it, else the record's first valid ISBN.
     */
    protected static String pickIsbn(List<String> isbns, Metadata hints) {
        String first = null;
        for (String raw : isbns) {
            String isbn = Identifiers.normalizeIsbn(raw);
            if (isbn == null) {
                continue;
            }
            if (hints.getIsbn() != null && Identifiers.sameIsbn(isbn, hints.getIsbn())) {
                return isbn;
            }
            if (first == null) {
                first = isbn;
            }
        }
        return first;
    }

    private static void sleep(long millis) throws SourceUnavailableException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnavailableException("http", "interrupted during backoff", e);
        }
    }
}
