package com.flamingo.ai.docsearch.service.document;

import com.flamingo.ai.docsearch.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.domain.enums.DocumentStatus;
import com.flamingo.ai.docsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import com.flamingo.ai.docsearch.exception.DocumentNotFoundException;
import com.flamingo.ai.docsearch.exception.ValidationException;
import com.flamingo.ai.docsearch.service.cache.SearchCache;
import com.flamingo.ai.docsearch.service.rag.DocumentProcessingService;
import com.flamingo.ai.docsearch.service.rag.TextCleaner;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import com.flamingo.ai.docsearch.util.Fingerprints;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final String DEFAULT_FORMAT = "txt";

  private final DocumentRepository documentRepository;
  private final DocumentProcessingService documentProcessingService;
  private final ChunkIndexStore chunkIndexStore;
  private final TextCleaner textCleaner;
  private final SearchCache searchCache;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  // serializes ingest, reprocess and delete of the same document id
  private final Striped<Lock> documentLocks = Striped.lock(64);

  @Override
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public Document ingest(IngestDocumentRequest request) {
    String text = request.getText();
    if (text == null || text.isBlank()) {
      throw new ValidationException("text", "Document text must not be empty");
    }
    int maxChars = ragConfig.getIngestion().getMaxDocumentChars();
    if (text.length() > maxChars) {
      throw new ValidationException(
          "text", "Document text must be at most " + maxChars + " characters");
    }

    String format =
        request.getFormat() == null || request.getFormat().isBlank()
            ? DEFAULT_FORMAT
            : request.getFormat().toLowerCase(Locale.ROOT);
    String cleaned = textCleaner.clean(text, format);
    if (cleaned.isBlank()) {
      throw new ValidationException("text", "Document has no content after cleaning");
    }
    String documentId = Fingerprints.sha256(cleaned);

    return withDocumentLock(
        documentId,
        () -> {
          Optional<Document> existing = documentRepository.findById(documentId);
          if (existing.isPresent()) {
            Document document = existing.get();
            if (document.getStatus() == DocumentStatus.FAILED) {
              log.info("Re-ingested document {} had failed, processing again", documentId);
              return reprocessLocked(document);
            }
            meterRegistry.counter("document.duplicate").increment();
            log.info(
                "Document {} already ingested with status {}", documentId, document.getStatus());
            return document;
          }

          String fileName =
              request.getFileName() == null || request.getFileName().isBlank()
                  ? "document." + format
                  : request.getFileName();
          Document document =
              Document.builder()
                  .id(documentId)
                  .fileName(fileName)
                  .format(format)
                  .content(cleaned)
                  .metadata(
                      request.getMetadata() != null
                          ? new HashMap<>(request.getMetadata())
                          : new HashMap<>())
                  .build();
          Document saved = documentRepository.save(document);
          meterRegistry.counter("document.ingested", "format", format).increment();
          log.info(
              "Ingesting document {} ({} chars) as {}", fileName, cleaned.length(), documentId);

          try {
            return documentProcessingService.process(saved);
          } finally {
            invalidateSearchCache();
          }
        });
  }

  @Override
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(String documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Timed(value = "document.chunks", description = "Time to get document chunks")
  public List<DocumentChunk> getChunks(String documentId) {
    getDocument(documentId);
    return chunkIndexStore.getChunksByDocument(documentId);
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(String documentId) {
    withDocumentLock(
        documentId,
        () -> {
          Document document = getDocument(documentId);
          chunkIndexStore.deleteDocument(documentId);
          documentRepository.delete(document);
          invalidateSearchCache();
          meterRegistry.counter("document.deleted").increment();
          log.info("Deleted document: {}", documentId);
          return null;
        });
  }

  @Override
  @Timed(value = "document.reprocess", description = "Time to reprocess a document")
  public Document reprocess(String documentId) {
    return withDocumentLock(documentId, () -> reprocessLocked(getDocument(documentId)));
  }

  private Document reprocessLocked(Document document) {
    document.resetForReprocessing();
    Document saved = documentRepository.save(document);
    meterRegistry.counter("document.reprocessed").increment();
    try {
      return documentProcessingService.process(saved);
    } finally {
      invalidateSearchCache();
    }
  }

  private <T> T withDocumentLock(String documentId, Supplier<T> action) {
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  private void invalidateSearchCache() {
    try {
      searchCache.clear();
    } catch (RuntimeException e) {
      log.warn("Failed to clear search cache: {}", e.getMessage());
    }
  }
}
