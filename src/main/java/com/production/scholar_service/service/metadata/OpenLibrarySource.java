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
 * Open Library search API, for books.
 */
@Component
public class OpenLibrarySource extends AbstractHttpMetadataSource {

    public static final String NAME = "openlibrary";
    private static final int LIMIT = 5;

    public OpenLibrarySource(HttpClient metadataHttpClient, ObjectMapper objectMapper,
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
        String base = appConfig.getMetadata().getOpenlibraryUrl();
        List<String> urls = new ArrayList<>();
        if (hints.getIsbn() != null) {
            urls.add(base + "?isbn=" + encode(hints.getIsbn()) + "&limit=" + LIMIT);
        }
        if (hints.getTitle() != null) {
            String url = base + "?title=" + encode(hints.getTitle());
            if (hints.firstAuthor() != null) {
                url += "&author=" + encode(StringSimilarity.surname(hints.firstAuthor()));
            }
            urls.add(url + "&limit=" + LIMIT);
        }
        return urls;
    }

    @Override
    protected List<Metadata> parse(String body, Metadata hints) throws IOException {
        List<Metadata> records = new ArrayList<>();
        for (JsonNode doc : readTree(body).path("docs")) {
            List<String> authors = new ArrayList<>();
            doc.path("author_name").forEach(a -> authors.add(a.asText()));
            List<String> isbns = new ArrayList<>();
            doc.path("isbn").forEach(i -> isbns.add(i.asText()));

            Integer year = doc.path("first_publish_year").isInt() ? doc.path("first_publish_year").asInt() : null;
            Metadata metadata = Metadata.builder()
                    .title(joinTitle(text(doc, "title"), text(doc, "subtitle")))
                    .authors(authors)
                    .year(year)
                    .publisher(text(doc, "publisher"))
                    .isbn(pickIsbn(isbns, hints))
                    .build();
            putExtra(metadata, "type", "book");
            putExtra(metadata, "openlibraryKey", text(doc, "key"));
            if (doc.path("number_of_pages_median").isInt()) {
                putExtra(metadata, "pages", doc.path("number_of_pages_median").asInt());
            }
            records.add(metadata);
        }
        return records;
    }
}
