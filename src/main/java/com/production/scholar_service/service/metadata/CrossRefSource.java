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

/**
 * CrossRef REST API. DOI lookup via /works/{doi}, bibliographic search otherwise.
 */
@Component
public class CrossRefSource extends AbstractHttpMetadataSource {

    public static final String NAME = "crossref";
    private static final int ROWS = 5;

    public CrossRefSource(HttpClient metadataHttpClient, ObjectMapper objectMapper,
                          AppConfig appConfig, SourceResponseCache cache) {
        super(metadataHttpClient, objectMapper, appConfig, cache);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(Metadata hints) {
        return hints.getDoi() != null || hints.getTitle() != null;
    }

    @Override
    protected List<String> requestUrls(Metadata hints) {
        String base = appConfig.getMetadata().getCrossrefUrl();
        List<String> urls = new ArrayList<>();
        if (hints.getDoi() != null) {
            urls.add(base + "/" + encode(hints.getDoi()));
        }
        if (hints.getTitle() != null) {
            urls.add(base + "?query.bibliographic=" + encode(bibliographicQuery(hints)) + "&rows=" + ROWS);
        }
        return urls;
    }

    @Override
    protected List<Metadata> parse(String body, Metadata hints) throws IOException {
        JsonNode message = readTree(body).path("message");
        List<Metadata> records = new ArrayList<>();
        if (message.has("items")) {
            for (JsonNode item : message.path("items")) {
                records.add(toMetadata(item));
            }
        } else if (message.isObject()) {
            records.add(toMetadata(message));
        }
        return records;
    }

    private Metadata toMetadata(JsonNode item) {
        List<String> authors = new ArrayList<>();
        for (JsonNode author : item.path("author")) {
            String given = text(author, "given");
            String family = text(author, "family");
            if (family != null) {
                authors.add(given != null ? given + " " + family : family);
            } else if (text(author, "name") != null) {
                authors.add(text(author, "name"));
            }
        }

        Metadata metadata = Metadata.builder()
                .title(joinTitle(text(item, "title"), text(item, "subtitle")))
                .authors(authors)
                .year(issuedYear(item))
                .journal(text(item, "container-title"))
                .publisher(text(item, "publisher"))
                .doi(Identifiers.normalizeDoi(text(item, "DOI")))
                .isbn(Identifiers.normalizeIsbn(text(item, "ISBN")))
                .build();
        putExtra(metadata, "type", text(item, "type"));
        putExtra(metadata, "issn", text(item, "ISSN"));
        putExtra(metadata, "volume", text(item, "volume"));
        putExtra(metadata, "issue", text(item, "issue"));
        putExtra(metadata, "pages", text(item, "page"));
        return metadata;
    }

    private static Integer issuedYear(JsonNode item) {
        for (String field : List.of("issued", "published-print", "published-online", "created")) {
            JsonNode year = item.path(field).path("date-parts").path(0).path(0);
            if (year.isInt()) {
                return year.asInt();
            }
        }
        return null;
    }

    static String joinTitle(String title, String subtitle) {
        if (title == null) {
            return null;
        }
        return subtitle != null ? title + ": " + subtitle : title;
    }

    static void putExtra(Metadata metadata, String key, Object value) {
        if (value != null) {
            metadata.getExtra().put(key, value);
        }
    }
}
