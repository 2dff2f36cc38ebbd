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

import static com.production.scholar_service.service.metadata.CrossRefSource.putExtra;

/**
 * OpenAlex works API.
 */
@Component
public class OpenAlexSource extends AbstractHttpMetadataSource {

    public static final String NAME = "openalex";
    private static final int PER_PAGE = 5;

    public OpenAlexSource(HttpClient metadataHttpClient, ObjectMapper objectMapper,
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
        String base = appConfig.getMetadata().getOpenalexUrl();
        List<String> urls = new ArrayList<>();
        if (hints.getDoi() != null) {
            urls.add(base + "/doi:" + encode(hints.getDoi()));
        }
        if (hints.getTitle() != null) {
            urls.add(base + "?search=" + encode(bibliographicQuery(hints)) + "&per-page=" + PER_PAGE);
        }
        return urls;
    }

    @Override
    protected List<Metadata> parse(String body, Metadata hints) throws IOException {
        JsonNode root = readTree(body);
        List<Metadata> records = new ArrayList<>();
        if (root.has("results")) {
            for (JsonNode work : root.path("results")) {
                records.add(toMetadata(work));
            }
        } else if (root.has("id")) {
            records.add(toMetadata(root));
        }
        return records;
    }

    private Metadata toMetadata(JsonNode work) {
        List<String> authors = new ArrayList<>();
        for (JsonNode authorship : work.path("authorships")) {
            String name = text(authorship.path("author"), "display_name");
            if (name != null) {
                authors.add(name);
            }
        }
        JsonNode source = work.path("primary_location").path("source");
        String title = text(work, "title") != null ? text(work, "title") : text(work, "display_name");
        Integer year = work.path("publication_year").isInt() ? work.path("publication_year").asInt() : null;

        Metadata metadata = Metadata.builder()
                .title(title)
                .authors(authors)
                .year(year)
                .journal(text(source, "display_name"))
                .publisher(text(source, "host_organization_name"))
                .doi(Identifiers.normalizeDoi(text(work, "doi")))
                .build();
        putExtra(metadata, "type", text(work, "type"));
        putExtra(metadata, "openalexId", text(work, "id"));
        if (work.path("cited_by_count").isInt()) {
            putExtra(metadata, "citedByCount", work.path("cited_by_count").asInt());
        }
        JsonNode biblio = work.path("biblio");
        putExtra(metadata, "volume", text(biblio, "volume"));
        putExtra(metadata, "issue", text(biblio, "issue"));
        String first = text(biblio, "first_page");
        String last = text(biblio, "last_page");
        if (first != null) {
            putExtra(metadata, "pages", last != null && !last.equals(first) ? first + "-" + last : first);
        }
        return metadata;
    }
}
