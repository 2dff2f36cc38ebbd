package com.production.scholar_service.service.metadata;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.FieldProvenance;
import com.production.scholar_service.model.MatchKey;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataCandidate;
import com.production.scholar_service.model.MetadataField;
import com.production.scholar_service.model.MetadataPatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataReconcilerTest {

    private MetadataReconciler reconciler;

    @BeforeEach
    void setUp() {
        reconciler = new MetadataReconciler(new AppConfig());
    }

    private static MetadataCandidate candidate(String source, double confidence, MatchKey key, int rank, Metadata fields) {
        return MetadataCandidate.builder()
                .source(source)
                .confidence(confidence)
                .matchKey(key)
                .rank(rank)
                .fields(fields)
                .build();
    }

    private static Metadata local() {
        Metadata local = new Metadata();
        local.set(MetadataField.TITLE, "Local Title", new FieldProvenance(FieldProvenance.LOCAL, 0.5));
        local.set(MetadataField.LANGUAGE, "en", new FieldProvenance(FieldProvenance.LOCAL, 0.5));
        local.set(MetadataField.PAGE_COUNT, 12, new FieldProvenance(FieldProvenance.LOCAL, 0.5));
        return local;
    }

    @Nested
    @DisplayName("reconcile")
    class ReconcileTests {

        @Test
        @DisplayName("should prefer an identifier match over a more confident fuzzy match")
        void shouldPreferIdentifierMatch() {
            MetadataCandidate fuzzy = candidate("openalex", 0.99, MatchKey.FUZZY, 0,
                    Metadata.builder().title("Fuzzy Title").year(2019).build());
            MetadataCandidate byDoi = candidate("crossref", 1.0, MatchKey.DOI, 0,
                    Metadata.builder().title("Exact Title").year(2020).build());

            Metadata result = reconciler.reconcile(List.of(fuzzy, byDoi), local());

            assertEquals("Exact Title", result.getTitle());
            assertEquals(2020, result.getYear());
            assertEquals("crossref", result.provenanceOf(MetadataField.TITLE).source());
            assertEquals(1.0, result.provenanceOf(MetadataField.TITLE).confidence(), 1e-9);
        }

        @Test
        @DisplayName("should break confidence ties by configured trust ranking")
        void shouldBreakTiesByTrust() {
            MetadataCandidate openLibrary = candidate("openlibrary", 0.8, MatchKey.FUZZY, 0,
                    Metadata.builder().title("From OpenLibrary").build());
            MetadataCandidate crossRef = candidate("crossref", 0.8, MatchKey.FUZZY, 0,
                    Metadata.builder().title("From CrossRef").build());

            Metadata result = reconciler.reconcile(List.of(openLibrary, crossRef), local());

            assertEquals("From CrossRef", result.getTitle());
        }

        @Test
        @DisplayName("should be independent of candidate order")
        void shouldBeDeterministic() {
            List<MetadataCandidate> candidates = new ArrayList<>(List.of(
                    candidate("crossref", 0.9, MatchKey.FUZZY, 0,
                            Metadata.builder().title("A").authors(List.of("Jane Doe")).build()),
                    candidate("openalex", 0.9, MatchKey.FUZZY, 1,
                            Metadata.builder().title("B").year(2001).publisher("P").build()),
                    candidate("googlebooks", 0.7, MatchKey.FUZZY, 0,
                            Metadata.builder().journal("J").authors(List.of("X Y", "Z W")).build())));

            Metadata first = reconciler.reconcile(candidates, local());
            Collections.reverse(candidates);
            Metadata second = reconciler.reconcile(candidates, local());

            assertEquals(first, second);
        }

        @Test
        @DisplayName("should take the author list of a single candidate")
        void shouldChooseAuthorsAtomically() {
            MetadataCandidate best = candidate("crossref", 0.95, MatchKey.FUZZY, 0,
                    Metadata.builder().title("T").authors(List.of("Jane Doe")).build());
            MetadataCandidate other = candidate("openalex", 0.9, MatchKey.FUZZY, 0,
                    Metadata.builder().title("T").authors(List.of("Jane Doe", "John Smith", "Ann Lee")).build());

            Metadata result = reconciler.reconcile(List.of(other, best), local());

            assertEquals(List.of("Jane Doe"), result.getAuthors());
            assertEquals("crossref", result.provenanceOf(MetadataField.AUTHORS).source());
        }

        @Test
        @DisplayName("should fill fields no candidate has from local extraction")
        void shouldFallBackToLocal() {
            MetadataCandidate candidate = candidate("crossref", 0.9, MatchKey.FUZZY, 0,
                    Metadata.builder().year(2018).build());

            Metadata result = reconciler.reconcile(List.of(candidate), local());

            assertEquals("Local Title", result.getTitle());
            assertEquals(FieldProvenance.LOCAL, result.provenanceOf(MetadataField.TITLE).source());
            assertEquals("en", result.getLanguage());
            assertEquals(12, result.getPageCount());
            assertNull(result.getJournal());
            assertNull(result.provenanceOf(MetadataField.JOURNAL));
        }

        @Test
        @DisplayName("should flag distinct DOIs for review and keep the identifier-matched one")
        void shouldFlagDoiConflict() {
            MetadataCandidate byDoi = candidate("crossref", 1.0, MatchKey.DOI, 0,
                    Metadata.builder().doi("10.1000/right").build());
            MetadataCandidate fuzzy = candidate("openalex", 0.8, MatchKey.FUZZY, 0,
                    Metadata.builder().doi("10.1000/other").build());

            Metadata result = reconciler.reconcile(List.of(fuzzy, byDoi), local());

            assertTrue(result.isNeedsReview());
            assertEquals("10.1000/right", result.getDoi());
            assertEquals(List.of("10.1000/other", "10.1000/right"), result.getExtra().get(MetadataReconciler.DOI_CONFLICT));
        }

        @Test
        @DisplayName("should prefer the document's own DOI over fuzzy candidates")
        void shouldPreferLocalDoiOverFuzzy() {
            Metadata local = local();
            local.set(MetadataField.DOI, "10.1000/printed", new FieldProvenance(FieldProvenance.LOCAL, 0.5));
            MetadataCandidate fuzzy = candidate("openalex", 0.8, MatchKey.FUZZY, 0,
                    Metadata.builder().doi("10.1000/other").build());

            Metadata result = reconciler.reconcile(List.of(fuzzy), local);

            assertTrue(result.isNeedsReview());
            assertEquals("10.1000/printed", result.getDoi());
            assertEquals(FieldProvenance.LOCAL, result.provenanceOf(MetadataField.DOI).source());
        }

        @Test
        @DisplayName("should carry extra attributes of the top candidate")
        void shouldCarryExtra() {
            Metadata fields = Metadata.builder().title("T").build();
            fields.getExtra().put("volume", "12");
            Metadata result = reconciler.reconcile(List.of(candidate("crossref", 0.9, MatchKey.FUZZY, 0, fields)), local());

            assertEquals("12", result.getExtra().get("volume"));
        }
    }

    @Nested
    @DisplayName("manual edits")
    class ManualTests {

        @Test
        @DisplayName("should mark patched fields as manual and leave the rest")
        void shouldApplyManualPatch() {
            Metadata original = reconciler.reconcile(List.of(), local());
            MetadataPatch patch = MetadataPatch.builder().title("Corrected").year(2022).build();

            Metadata patched = reconciler.applyManual(original, patch);

            assertEquals("Corrected", patched.getTitle());
            assertEquals(FieldProvenance.manual(), patched.provenanceOf(MetadataField.TITLE));
            assertEquals(FieldProvenance.manual(), patched.provenanceOf(MetadataField.YEAR));
            assertEquals("en", patched.getLanguage());
            assertEquals("Local Title", original.getTitle());
        }

        @Test
        @DisplayName("should settle a DOI conflict with a manual DOI")
        void shouldSettleDoiConflict() {
            Metadata conflicted = reconciler.reconcile(List.of(
                    candidate("crossref", 0.9, MatchKey.FUZZY, 0, Metadata.builder().doi("10.1000/a").build()),
                    candidate("openalex", 0.8, MatchKey.FUZZY, 0, Metadata.builder().doi("10.1000/b").build())),
                    local());
            assertTrue(conflicted.isNeedsReview());

            Metadata patched = reconciler.applyManual(conflicted,
                    MetadataPatch.builder().doi("https://doi.org/10.1000/B").build());

            assertEquals("10.1000/b", patched.getDoi());
            assertFalse(patched.isNeedsReview());
            assertFalse(patched.getExtra().containsKey(MetadataReconciler.DOI_CONFLICT));
        }

        @Test
        @DisplayName("should keep manual fields across a fresh reconciliation")
        void shouldRetainManualFields() {
            Metadata previous = reconciler.applyManual(reconciler.reconcile(List.of(), local()),
                    MetadataPatch.builder().authors(List.of("Manual Author")).build());
            Metadata fresh = reconciler.reconcile(List.of(candidate("crossref", 0.9, MatchKey.FUZZY, 0,
                    Metadata.builder().title("Harvested").authors(List.of("Harvested Author")).build())), local());

            Metadata merged = reconciler.retainManual(fresh, previous);

            assertEquals(List.of("Manual Author"), merged.getAuthors());
            assertEquals(FieldProvenance.MANUAL, merged.provenanceOf(MetadataField.AUTHORS).source());
            assertEquals("Harvested", merged.getTitle());
        }
    }
}
