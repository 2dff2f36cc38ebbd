package com.production.scholar_service.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataFieldTest {

    @Test
    @DisplayName("should copy author lists and drop null entries")
    void shouldSetAuthors() {
        Metadata metadata = new Metadata();
        List<Object> names = Arrays.asList("Doe, Jane", null, "Roe, Richard");

        MetadataField.AUTHORS.set(metadata, names);

        assertEquals(List.of("Doe, Jane", "Roe, Richard"), metadata.getAuthors());
        assertEquals(List.of("Doe, Jane", "Roe, Richard"), MetadataField.AUTHORS.get(metadata));
    }

    @Test
    @DisplayName("should clear authors on null and reject a bare string")
    void shouldClearOrRejectAuthors() {
        Metadata metadata = Metadata.builder().authors(List.of("Doe, Jane")).build();

        MetadataField.AUTHORS.set(metadata, null);
        assertTrue(metadata.getAuthors().isEmpty());

        assertThrows(IllegalArgumentException.class, () -> MetadataField.AUTHORS.set(metadata, "Doe, Jane"));
    }
}
