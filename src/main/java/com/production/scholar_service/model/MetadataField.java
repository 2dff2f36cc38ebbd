package com.production.scholar_service.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The structured fields of {@link Metadata}, with typed accessors so reconciliation can treat them uniformly.
 */
public enum MetadataField {
    TITLE("title", Metadata::getTitle, (m, v) -> m.setTitle((String) v)),
    AUTHORS("authors", Metadata::getAuthors, MetadataField::setAuthors),
    YEAR("year", Metadata::getYear, (m, v) -> m.setYear((Integer) v)),
    JOURNAL("journal", Metadata::getJournal, (m, v) -> m.setJournal((String) v)),
    PUBLISHER("publisher", Metadata::getPublisher, (m, v) -> m.setPublisher((String) v)),
    DOI("doi", Metadata::getDoi, (m, v) -> m.setDoi((String) v)),
    ISBN("isbn", Metadata::getIsbn, (m, v) -> m.setIsbn((String) v)),
    LANGUAGE("language", Metadata::getLanguage, (m, v) -> m.setLanguage((String) v)),
    PAGE_COUNT("pageCount", Metadata::getPageCount, (m, v) -> m.setPageCount((Integer) v));

    /** Fields that external bibliographic sources may supply. */
    public static final List<MetadataField> HARVESTED = List.of(TITLE, AUTHORS, YEAR, JOURNAL, PUBLISHER, DOI, ISBN);

    private final String key;
    private final Function<Metadata, Object> getter;
    private final BiConsumer<Metadata, Object> setter;

    MetadataField(String key, Function<Metadata, Object> getter, BiConsumer<Metadata, Object> setter) {
        this.key = key;
        this.getter = getter;
        this.setter = setter;
    }

    public String key() {
        return key;
    }

    public Object get(Metadata metadata) {
        return getter.apply(metadata);
    }

    public void set(Metadata metadata, Object value) {
        setter.accept(metadata, value);
    }

    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }

    private static void setAuthors(Metadata metadata, Object value) {
        List<String> authors = new ArrayList<>();
        if (value instanceof Collection<?> names) {
            names.stream().filter(Objects::nonNull).map(String::valueOf).forEach(authors::add);
        } else if (value != null) {
            throw new IllegalArgumentException("authors must be a list, got " + value.getClass().getSimpleName());
        }
        metadata.setAuthors(authors);
    }
}
