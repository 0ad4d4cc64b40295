package com.flamingo.ai.docsearch.service.document;

import com.flamingo.ai.docsearch.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import java.util.List;

/** Service interface for document ingestion and management. */
public interface DocumentService {

  /**
   * Cleans, chunks, embeds and indexes a document. Idempotent on the cleaned content: ingesting
   * the same text again returns the existing document without creating chunks, unless that
   * document FAILED, in which case it is processed again.
   *
   * @param request the document text and its metadata
   * @return the stored document
   * @throws com.flamingo.ai.docsearch.exception.ValidationException if the text is blank or too
   *     long
   */
  Document ingest(IngestDocumentRequest request);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ai.docsearch.exception.DocumentNotFoundException if not found
   */
  Document getDocument(String documentId);

  /**
   * Gets the indexed chunks of a document ordered by chunk index.
   *
   * @param documentId the document ID
   * @return the chunks
   */
  List<DocumentChunk> getChunks(String documentId);

  /**
   * Deletes a document and its chunks.
   *
   * @param documentId the document ID
   */
  void deleteDocument(String documentId);

  /**
   * Chunks and indexes a COMPLETED or FAILED document again.
   *
   * @param documentId the document ID
   * @return the reprocessed document
   * @throws IllegalStateException if the document is still pending or processing
   */
  Document reprocess(String documentId);
}
