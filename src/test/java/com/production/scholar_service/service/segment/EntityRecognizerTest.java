package com.production.scholar_service.service.segment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRecognizerTest {

    private final EntityRecognizer recognizer = new EntityRecognizer();

    @Test
    @DisplayName("should keep the enclosing URL over the DOI inside it")
    void shouldResolveOverlaps() {
        List<EntitySpan> spans = recognizer.recognize("See https://doi.org/10.1000/abc and contact jane@uni.de in 2019.");

        assertEquals(List.of(EntityRecognizer.URL, EntityRecognizer.EMAIL, EntityRecognizer.YEAR),
                spans.stream().map(EntitySpan::type).toList());
        assertEquals("https://doi.org/10.1000/abc", spans.get(0).text());
        assertEquals("jane@uni.de", spans.get(1).text());
    }

    @Test
    @DisplayName("should prefer a full date over the year inside it")
    void shouldPreferLongerDate() {
        List<EntitySpan> spans = recognizer.recognize("Submitted on 12 March 2020 to the board.");

        assertEquals(1, spans.size());
        assertEquals(EntityRecognizer.DATE, spans.get(0).type());
        assertEquals("12 March 2020", spans.get(0).text());
    }

    @Test
    @DisplayName("should find titled people and institutions")
    void shouldFindPeopleAndOrganizations() {
        List<EntitySpan> spans = recognizer.recognize("Prof. Dr. Anna Schmidt works at the University of Hamburg.");

        assertEquals(2, spans.size());
        assertEquals(new EntitySpan(EntityRecognizer.PERSON, "Prof. Dr. Anna Schmidt", 0, 22), spans.get(0));
        assertEquals(EntityRecognizer.ORG, spans.get(1).type());
        assertEquals("University of Hamburg", spans.get(1).text());
    }

    @Test
    @DisplayName("should return spans in text order without overlap")
    void shouldNotOverlap() {
        List<EntitySpan> spans = recognizer.recognize(
                "Smith et al. (2019) cite doi 10.1234/xyz.5 and ISBN 978-3-16-148410-0 in J. Miller's review.");

        for (int i = 1; i < spans.size(); i++) {
            assertTrue(spans.get(i).start() >= spans.get(i - 1).end());
        }
        assertTrue(spans.stream().anyMatch(s -> s.type().equals(EntityRecognizer.ISBN)));
        assertTrue(spans.stream().anyMatch(s -> s.text().equals("Smith et al.")));
        assertTrue(spans.stream().anyMatch(s -> s.text().equals("10.1234/xyz.5")));
    }

    @Test
    @DisplayName("should return nothing for empty text")
    void shouldHandleEmpty() {
        assertTrue(recognizer.recognize("").isEmpty());
        assertTrue(recognizer.recognize(null).isEmpty());
    }
}
