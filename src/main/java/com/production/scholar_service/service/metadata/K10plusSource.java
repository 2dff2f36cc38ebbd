package com.production.scholar_service.service.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.Metadata;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static com.production.scholar_service.service.metadata.CrossRefSource.putExtra;

/**
 * K10plus union catalogue (GBV/SWB) over SRU, returning MARCXML.
 * Strong for German-language books.
 */
@Component
public class K10plusSource extends AbstractHttpMetadataSource {

    public static final String NAME = "k10plus";
    private static final String MARC_NS = "http://www.loc.gov/MARC21/slim";

    public K10plusSource(HttpClient metadataHttpClient, ObjectMapper objectMapper,
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
    protected String acceptHeader() {
        return "application/xml";
    }

    @Override
    protected List<String> requestUrls(Metadata hints) {
        String base = appConfig.getMetadata().getK10plusUrl()
                + "?version=1.1&operation=searchRetrieve&recordSchema=marcxml";
        List<String> urls = new ArrayList<>();
        if (hints.getIsbn() != null) {
            urls.add(base + "&maximumRecords=1&query=" + encode("pica.isb=" + hints.getIsbn()));
        }
        if (hints.getTitle() != null) {
            String query = "pica.tit=\"" + hints.getTitle().replace("\"", "") + "\"";
            if (hints.firstAuthor() != null) {
                query += " and pica.per=\"" + StringSimilarity.surname(hints.firstAuthor()) + "\"";
            }
            urls.add(base + "&maximumRecords=5&query=" + encode(query));
        }
        return urls;
    }

    @Override
    protected List<Metadata> parse(String body, Metadata hints) throws IOException {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));

            NodeList marcRecords = doc.getElementsByTagNameNS(MARC_NS, "record");
            List<Metadata> records = new ArrayList<>();
            for (int i = 0; i < marcRecords.getLength(); i++) {
                records.add(toMetadata((Element) marcRecords.item(i), hints));
            }
            return records;
        } catch (Exception e) {
            throw new IOException("Failed to parse MARCXML: " + e.getMessage(), e);
        }
    }

    private Metadata toMetadata(Element record, Metadata hints) {
        String title = subfield(record, "245", 'a');
        String subtitle = subfield(record, "245", 'b');
        if (title != null) {
            title = stripPunctuation(title);
            if (subtitle != null) {
                title = title + ": " + stripPunctuation(subtitle);
            }
        }

        List<String> authors = new ArrayList<>();
        for (String tag : List.of("100", "700")) {
            for (String name : subfields(record, tag, 'a')) {
                authors.add(invertName(stripPunctuation(name)));
            }
        }

        String fixed = controlField(record, "008");
        Integer year = fixed != null && fixed.length() >= 11 ? year(fixed.substring(7, 11)) : null;
        if (year == null) {
            String date = firstNonNull(subfield(record, "264", 'c'), subfield(record, "260", 'c'));
            year = date != null ? year(date.replaceAll("\\D", "")) : null;
        }
        String publisher = firstNonNull(subfield(record, "264", 'b'), subfield(record, "260", 'b'));

        Metadata metadata = Metadata.builder()
                .title(title)
                .authors(authors)
                .year(year)
                .publisher(publisher != null ? stripPunctuation(publisher) : null)
                .isbn(pickIsbn(subfields(record, "020", 'a'), hints))
                .build();
        putExtra(metadata, "type", "book");
        if (fixed != null && fixed.length() >= 38) {
            putExtra(metadata, "sourceLanguage", marcLanguage(fixed.substring(35, 38)));
        }
        putExtra(metadata, "extent", subfield(record, "300", 'a'));
        List<String> subjects = subfields(record, "650", 'a');
        if (!subjects.isEmpty()) {
            putExtra(metadata, "subjects", subjects);
        }
        return metadata;
    }

    static String marcLanguage(String code) {
        return switch (code) {
            case "ger" -> "de";
            case "eng" -> "en";
            default -> code.trim().isEmpty() ? null : code;
        };
    }

    /** "Müller, Hans" becomes "Hans Müller". */
    static String invertName(String name) {
        int comma = name.indexOf(',');
        if (comma < 0) {
            return name;
        }
        return (name.substring(comma + 1).trim() + " " + name.substring(0, comma).trim()).trim();
    }

    private static String stripPunctuation(String value) {
        return value.replaceAll("[\\s/:;,.=]+$", "").trim();
    }

    private static String controlField(Element record, String tag) {
        NodeList fields = record.getElementsByTagNameNS(MARC_NS, "controlfield");
        for (int i = 0; i < fields.getLength(); i++) {
            Element field = (Element) fields.item(i);
            if (tag.equals(field.getAttribute("tag"))) {
                return field.getTextContent();
            }
        }
        return null;
    }

    private static String subfield(Element record, String tag, char code) {
        List<String> values = subfields(record, tag, code);
        return values.isEmpty() ? null : values.get(0);
    }

    private static List<String> subfields(Element record, String tag, char code) {
        List<String> values = new ArrayList<>();
        NodeList fields = record.getElementsByTagNameNS(MARC_NS, "datafield");
        for (int i = 0; i < fields.getLength(); i++) {
            Element field = (Element) fields.item(i);
            if (!tag.equals(field.getAttribute("tag"))) {
                continue;
            }
            NodeList subs = field.getElementsByTagNameNS(MARC_NS, "subfield");
            for (int j = 0; j < subs.getLength(); j++) {
                Element sub = (Element) subs.item(j);
                if (String.valueOf(code).equals(sub.getAttribute("code"))) {
                    String text = sub.getTextContent().trim();
                    if (!text.isEmpty()) {
                        values.add(text);
                    }
                }
            }
        }
        return values;
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }
}
