package com.flamingo.ai.docsearch.api.rest;

import com.flamingo.ai.docsearch.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.docsearch.api.dto.response.ChunkResponse;
import com.flamingo.ai.docsearch.api.dto.response.DocumentResponse;
import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.service.document.DocumentService;
import com.flamingo.ai.docsearch.service.rag.HybridSearchService;
import com.flamingo.ai.docsearch.service.rag.model.ScoredResult;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document ingestion and management. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

  private static final int DEFAULT_SIMILAR_LIMIT = 5;

  private final DocumentService documentService;
  private final HybridSearchService hybridSearchService;

  /** Ingests extracted document text. Identical text returns the existing document. */
  @PostMapping
  public ResponseEntity<DocumentResponse> ingestDocument(
      @Valid @RequestBody IngestDocumentRequest request) {
    Document document = documentService.ingest(request);
    return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.fromEntity(document));
  }

  /** Gets a document by ID. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable String documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(documentService.getDocument(documentId)));
  }

  /** Gets the chunks of a document in order. */
  @GetMapping("/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable String documentId) {
    List<ChunkResponse> chunks =
        documentService.getChunks(documentId).stream().map(ChunkResponse::fromChunk).toList();
    return ResponseEntity.ok(chunks);
  }

  /** Finds chunks of other documents close to this document's opening chunk. */
  @GetMapping("/{documentId}/similar")
  public ResponseEntity<List<ScoredResult>> findSimilar(
      @PathVariable String documentId,
      @RequestParam(value = "limit", required = false) Integer limit) {
    documentService.getDocument(documentId);
    int effectiveLimit = limit != null ? limit : DEFAULT_SIMILAR_LIMIT;
    return ResponseEntity.ok(hybridSearchService.findSimilar(documentId, effectiveLimit));
  }

  /** Deletes a document and its chunks. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable String documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }

  /** Chunks and indexes a completed or failed document again. */
  @PostMapping("/{documentId}/reprocess")
  public ResponseEntity<DocumentResponse> reprocessDocument(@PathVariable String documentId) {
    Document document = documentService.reprocess(documentId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }
}
