package com.production.scholar_service.repository;

import com.production.scholar_service.model.DocumentRecord;
import com.production.scholar_service.model.DocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, Long> {

    Optional<DocumentRecord> findByDocumentId(String documentId);

    List<DocumentRecord> findByDocumentIdIn(Collection<String> documentIds);

    List<DocumentRecord> findByStatus(DocumentStatus status);

    long countByStatus(DocumentStatus status);

    boolean existsByDocumentId(String documentId);
}
