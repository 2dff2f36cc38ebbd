package com.production.scholar_service.service.metadata;

import com.production.scholar_service.config.AppConfig;
import com.production.scholar_service.model.FieldProvenance;
import com.production.scholar_service.model.Metadata;
import com.production.scholar_service.model.MetadataCandidate;
import com.production.scholar_service.model.MetadataField;
import com.production.scholar_service.model.MetadataPatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges harvested candidates with locally extracted metadata, one field at a time.
 * The result depends only on its inputs, never on the order candidates arrived in.
 */
@Service
@Slf4j
public class MetadataReconciler {

    public static final String DOI_CONFLICT = "doiConflict";

    private final AppConfig appConfig;

    public MetadataReconciler(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    /**
     * @param candidates harvested candidates, already filtered by the similarity floor
     * @param local      metadata derived from the file itself, with its own provenance entries
     */
    public Metadata reconcile(List<MetadataCandidate> candidates, Metadata local) {
        List<MetadataCandidate> ordered = new ArrayList<>(candidates);
        ordered.sort(priority());

        Metadata result = new Metadata();
        for (MetadataField field : MetadataField.HARVESTED) {
            MetadataCandidate winner = ordered.stream()
                    .filter(c -> !MetadataField.isEmpty(field.get(c.getFields())))
                    .findFirst()
                    .orElse(null);
            if (winner != null) {
                result.set(field, copy(field.get(winner.getFields())),
                        new FieldProvenance(winner.getSource(), winner.getConfidence()));
            } else {
                fallBackToLocal(result, local, field);
            }
        }
        fallBackToLocal(result, local, MetadataField.LANGUAGE);
        fallBackToLocal(result, local, MetadataField.PAGE_COUNT);

        resolveDoiConflict(result, ordered, local);

        if (!ordered.isEmpty()) {
            Map<String, Object> extra = new TreeMap<>(ordered.get(0).getFields().getExtra());
            extra.putAll(result.getExtra());
            result.setExtra(extra);
        }

        log.debug("Reconciled {} candidates: provenance={}, needsReview={}",
                candidates.size(), result.getProvenance(), result.isNeedsReview());
        return result;
    }

    /**
     * Overwrites the fields present in the patch; each becomes provenance "manual" with confidence 1.0.
     * A manual DOI settles an earlier DOI conflict.
     */
    public Metadata applyManual(Metadata metadata, MetadataPatch patch) {
        Metadata result = metadata.toBuilder()
                .authors(new ArrayList<>(metadata.getAuthors()))
                .provenance(new TreeMap<>(metadata.getProvenance()))
                .extra(new TreeMap<>(metadata.getExtra()))
                .build();
        setManual(result, MetadataField.TITLE, patch.getTitle());
        setManual(result, MetadataField.AUTHORS, patch.getAuthors());
        setManual(result, MetadataField.YEAR, patch.getYear());
        setManual(result, MetadataField.JOURNAL, patch.getJournal());
        setManual(result, MetadataField.PUBLISHER, patch.getPublisher());
        setManual(result, MetadataField.DOI, patch.getDoi() != null ? normalizedOrRaw(patch.getDoi()) : null);
        setManual(result, MetadataField.ISBN, patch.getIsbn());
        setManual(result, MetadataField.LANGUAGE, patch.getLanguage());
        if (patch.getDoi() != null) {
            result.getExtra().remove(DOI_CONFLICT);
            result.setNeedsReview(false);
        }
        return result;
    }

    /**
     * Carries manually edited fields of a previous run over into a freshly reconciled record.
     */
    public Metadata retainManual(Metadata fresh, Metadata previous) {
        if (previous == null) {
            return fresh;
        }
        for (MetadataField field : MetadataField.values()) {
            FieldProvenance origin = previous.provenanceOf(field);
            if (origin != null && FieldProvenance.MANUAL.equals(origin.source())) {
                fresh.set(field, copy(field.get(previous)), origin);
                if (field == MetadataField.DOI) {
                    fresh.getExtra().remove(DOI_CONFLICT);
                    fresh.setNeedsReview(false);
                }
            }
        }
        return fresh;
    }

    /**
     * Identifier match first, then confidence, configured trust rank, the source's own rank and finally name.
     */
    Comparator<MetadataCandidate> priority() {
        List<String> trust = appConfig.getMetadata().getTrustRanking().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
        return Comparator.comparing(MetadataCandidate::isIdentifierMatch, Comparator.reverseOrder())
                .thenComparing(MetadataCandidate::getConfidence, Comparator.reverseOrder())
                .thenComparingInt(c -> trustRank(trust, c.getSource()))
                .thenComparingInt(MetadataCandidate::getRank)
                .thenComparing(MetadataCandidate::getSource);
    }

    /**
     * Distinct DOIs among candidates and the document itself are a conflict. The winning DOI stays
     * when it came from an identifier match; otherwise the DOI printed in the document is preferred.
     */
    private void resolveDoiConflict(Metadata result, List<MetadataCandidate> ordered, Metadata local) {
        TreeSet<String> dois = new TreeSet<>();
        for (MetadataCandidate candidate : ordered) {
            String doi = Identifiers.normalizeDoi(candidate.getFields().getDoi());
            if (doi != null) {
                dois.add(doi);
            }
        }
        String localDoi = local != null ? Identifiers.normalizeDoi(local.getDoi()) : null;
        if (localDoi != null) {
            dois.add(localDoi);
        }
        if (dois.size() < 2) {
            return;
        }

        result.setNeedsReview(true);
        result.getExtra().put(DOI_CONFLICT, new ArrayList<>(dois));

        boolean winnerIsIdentifierMatch = ordered.stream()
                .filter(c -> Identifiers.normalizeDoi(c.getFields().getDoi()) != null)
                .findFirst()
                .map(MetadataCandidate::isIdentifierMatch)
                .orElse(false);
        if (!winnerIsIdentifierMatch && localDoi != null) {
            result.set(MetadataField.DOI, local.getDoi(), local.provenanceOf(MetadataField.DOI));
        }
        log.warn("DOI conflict between sources: {} - accepted {}", dois, result.getDoi());
    }

    private static void fallBackToLocal(Metadata result, Metadata local, MetadataField field) {
        if (local == null) {
            return;
        }
        Object value = field.get(local);
        FieldProvenance origin = local.provenanceOf(field);
        if (!MetadataField.isEmpty(value) && origin != null) {
            result.set(field, copy(value), origin);
        }
    }

    private static void setManual(Metadata metadata, MetadataField field, Object value) {
        if (value != null) {
            metadata.set(field, value, FieldProvenance.manual());
        }
    }

    private static String normalizedOrRaw(String doi) {
        String normalized = Identifiers.normalizeDoi(doi);
        return normalized != null ? normalized : doi.trim();
    }

    private static Object copy(Object value) {
        return value instanceof List<?> list ? new ArrayList<>(list) : value;
    }

    private static int trustRank(List<String> trust, String source) {
        int index = trust.indexOf(source);
        return index < 0 ? trust.size() : index;
    }
}
