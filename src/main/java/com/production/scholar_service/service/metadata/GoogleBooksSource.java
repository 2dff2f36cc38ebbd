package com.production.scholar_service.service.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.Metadata;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

import static com.production.scholar_service.service.metadata.CrossRefSource.joinTitle;
import static com.production.scholar_service.service.metadata.CrossRefSource.putExtra;

/**
 * Google Books volumes API. Works without a key at a lower quota.
 */
@Component
public class GoogleBooksSource extends AbstractHttpMetadataSource {

    public static final String NAME = "googlebooks";
    private static final int MAX_RESULTS = 5;

    public GoogleBooksSource(HttpClient metadataHttpClient, ObjectMapper objectMapper,
                             AppConfig appConfig, SourceResponseCache cache) {
        super(metadataHttpClient, objectMapper, appConfig, cache);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(Metadata hints) {
        return hints.getIsbn() != null || hints.getTitle() != null;
    }

    @Override
    protected List<String> requestUrls(Metadata hints) {
        var config = appConfig.getMetadata();
        String suffix = "&maxResults=" + MAX_RESULTS
                + (config.getGooglebooksApiKey().isBlank() ? "" : "&key=" + encode(config.getGooglebooksApiKey()));
        List<String> urls = new ArrayList<>();
        if (hints.getIsbn() != null) {
            urls.add(config.getGooglebooksUrl() + "?q=" + encode("isbn:" + hints.getIsbn()) + suffix);
        }
        if (hints.getTitle() != null) {
            String query = "intitle:" + hints.getTitle();
            if (hints.firstAuthor() != null) {
                query += " inauthor:" + StringSimilarity.surname(hints.firstAuthor());
            }
            urls.add(config.getGooglebooksUrl() + "?q=" + encode(query) + suffix);
        }
        return urls;
    }

    @Override
    protected List<Metadata> parse(String body, Metadata hints) throws IOException {
        List<Metadata> records = new ArrayList<>();
        for (JsonNode item : readTree(body).path("items")) {
            JsonNode info = item.path("volumeInfo");
            List<String> authors = new ArrayList<>();
            info.path("authors").forEach(a -> authors.add(a.asText()));
            List<String> isbns = new ArrayList<>();
            for (JsonNode identifier : info.path("industryIdentifiers")) {
                if (text(identifier, "type") != null && text(identifier, "type").startsWith("ISBN")) {
                    isbns.add(text(identifier, "identifier"));
                }
            }

            Metadata metadata = Metadata.builder()
                    .title(joinTitle(text(info, "title"), text(info, "subtitle")))
                    .authors(authors)
                    .year(year(text(info, "publishedDate")))
                    .publisher(text(info, "publisher"))
                    .isbn(pickIsbn(isbns, hints))
                    .build();
            putExtra(metadata, "type", "book");
            putExtra(metadata, "googleBooksId", text(item, "id"));
            if (info.path("pageCount").isInt()) {
                putExtra(metadata, "pages", info.path("pageCount").asInt());
            }
            putExtra(metadata, "sourceLanguage", text(info, "language"));
            records.add(metadata);
        }
        return records;
    }
}
