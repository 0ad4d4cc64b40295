package com.flamingo.ai.docsearch.domain.repository;

import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Document entities, keyed by content fingerprint. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, String> {

  /** Counts documents by status. */
  long countByStatus(DocumentStatus status);
}
