package com.flamingo.ai.docsearch.service.rag;

import com.flamingo.ai.docsearch.config.RagConfig;
import com.flamingo.ai.docsearch.domain.entity.Document;
import com.flamingo.ai.docsearch.domain.repository.DocumentRepository;
import com.flamingo.ai.docsearch.elasticsearch.DocumentChunk;
import com.flamingo.ai.docsearch.exception.DocumentProcessingException;
import com.flamingo.ai.docsearch.exception.IndexStoreException;
import com.flamingo.ai.docsearch.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingBatch;
import com.flamingo.ai.docsearch.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.docsearch.service.rag.model.RawDocumentChunk;
import com.flamingo.ai.docsearch.store.ChunkIndexStore;
import com.flamingo.ai.docsearch.util.Fingerprints;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Orchestrates document processing: chunk, extract keywords, embed, and index.
 *
 * <p>Chunks are embedded in batches of {@code rag.embedding.batch-size} on the bounded embedding
 * executor. The document's previous chunks are replaced only once every batch has a vector.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private static final Pattern WORD_SEPARATOR = Pattern.compile("\\s+");

  private final DocumentRepository documentRepository;
  private final ChunkIndexStore chunkIndexStore;
  private final DocumentChunker documentChunker;
  private final KeywordExtractor keywordExtractor;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Qualifier("embeddingExecutor")
  private final ThreadPoolTaskExecutor embeddingExecutor;

  /**
   * Processes a PENDING document synchronously and persists every status change.
   *
   * @param document the document to process
   * @return the COMPLETED document
   * @throws DocumentProcessingException when chunking or embedding fails; the document is FAILED
   * @throws IndexStoreException when the index store fails; the document is FAILED
   */
  @Timed(value = "document.process", description = "Time to process document")
  public Document process(Document document) {
    String documentId = document.getId();
    document.startProcessing();
    documentRepository.save(document);

    try {
      List<RawDocumentChunk> rawChunks =
          documentChunker.chunk(document.getContent(), ragConfig.getChunking());
      if (rawChunks.isEmpty()) {
        throw new DocumentProcessingException(documentId, "No content to index");
      }
      log.info("Document {} split into {} chunks", abbreviate(documentId), rawChunks.size());

      List<DocumentChunk> chunks = buildChunks(document, rawChunks);
      embed(documentId, chunks);

      chunkIndexStore.deleteDocument(documentId);
      chunkIndexStore.upsertChunks(chunks);

      document.markCompleted(chunks.size());
      Document saved = documentRepository.save(document);
      meterRegistry.counter("document.processing.success").increment();
      log.info("Successfully processed document {}", abbreviate(documentId));
      return saved;
    } catch (RuntimeException e) {
      log.error("Failed to process document {}: {}", abbreviate(documentId), e.getMessage());
      meterRegistry.counter("document.processing.failure").increment();
      document.markFailed(e.getMessage());
      documentRepository.save(document);
      removePartialChunks(documentId, e);
      if (e instanceof DocumentProcessingException || e instanceof IndexStoreException) {
        throw e;
      }
      throw new DocumentProcessingException(
          documentId, "Failed to process document: " + e.getMessage(), e);
    }
  }

  private List<DocumentChunk> buildChunks(Document document, List<RawDocumentChunk> rawChunks) {
    Instant now = clock.instant();
    List<DocumentChunk> chunks = new ArrayList<>(rawChunks.size());
    for (RawDocumentChunk rawChunk : rawChunks) {
      String content = rawChunk.content();
      chunks.add(
          DocumentChunk.builder()
              .id(DocumentChunk.chunkId(document.getId(), rawChunk.chunkIndex()))
              .documentId(document.getId())
              .fileName(document.getFileName())
              .chunkIndex(rawChunk.chunkIndex())
              .content(content)
              .fingerprint(Fingerprints.sha256(content))
              .keywords(List.copyOf(keywordExtractor.extract(content)))
              .wordCount(countWords(content))
              .charCount(content.length())
              .createdAt(now)
              .build());
    }
    return chunks;
  }

  private void embed(String documentId, List<DocumentChunk> chunks) {
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    List<List<DocumentChunk>> batches = Lists.partition(chunks, batchSize);
    log.debug("Embedding {} chunks in {} batches", chunks.size(), batches.size());

    List<CompletableFuture<EmbeddingBatch>> futures = new ArrayList<>(batches.size());
    for (List<DocumentChunk> batch : batches) {
      List<String> texts = batch.stream().map(DocumentChunk::getContent).toList();
      futures.add(
          CompletableFuture.supplyAsync(
              () -> embeddingService.embedBatch(texts), embeddingExecutor));
    }

    try {
      for (int i = 0; i < batches.size(); i++) {
        EmbeddingBatch result = futures.get(i).join();
        List<DocumentChunk> batch = batches.get(i);
        for (int j = 0; j < batch.size(); j++) {
          DocumentChunk chunk = batch.get(j);
          chunk.setEmbedding(result.vector(j));
          chunk.setEmbeddingSource(result.source());
          chunk.setEmbeddingDimension(result.vector(j).size());
        }
        if (result.isFallback()) {
          log.warn("Batch {} of document {} embedded by fallback", i, abbreviate(documentId));
        }
      }
    } catch (CompletionException e) {
      futures.forEach(future -> future.cancel(true));
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new DocumentProcessingException(
          documentId, "Embedding failed: " + cause.getMessage(), cause);
    }
  }

  private void removePartialChunks(String documentId, RuntimeException failure) {
    try {
      chunkIndexStore.deleteDocument(documentId);
    } catch (RuntimeException cleanupFailure) {
      failure.addSuppressed(cleanupFailure);
      log.warn(
          "Could not remove chunks of failed document {}: {}",
          abbreviate(documentId),
          cleanupFailure.getMessage());
    }
  }

  private static int countWords(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? 0 : WORD_SEPARATOR.split(stripped).length;
  }

  private static String abbreviate(String documentId) {
    return documentId.substring(0, Math.min(12, documentId.length()));
  }
}
