package com.acme.pipeline.worker;

import com.acme.pipeline.domain.ClassificationResult;
import com.acme.pipeline.domain.Document;
import com.acme.pipeline.spi.ClassificationService;
import com.acme.pipeline.spi.DocumentRepository;
import com.acme.pipeline.spi.FileStorageService;
import com.acme.pipeline.spi.JobHandler;
import io.micrometer.core.instrument.Timer;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies one document: load metadata, read content, call the ML service, store the label.
 * Repository and storage calls block, so they run on the I/O executor. Any failure completes the
 * returned future exceptionally and the consumer dead-letters the job.
 */
@Singleton
@Requires(beans = {DocumentRepository.class, FileStorageService.class})
public class DocumentProcessor implements JobHandler {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentProcessor.class);

    static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private final DocumentRepository documents;
    private final FileStorageService storage;
    private final ClassificationService classifier;
    private final WorkerMetrics metrics;
    private final ExecutorService ioExecutor;

    public DocumentProcessor(
            DocumentRepository documents,
            FileStorageService storage,
            ClassificationService classifier,
            WorkerMetrics metrics,
            @Named(TaskExecutors.IO) ExecutorService ioExecutor) {
        this.documents = documents;
        this.storage = storage;
        this.classifier = classifier;
        this.metrics = metrics;
        this.ioExecutor = ioExecutor;
    }

    @Override
    public CompletableFuture<Void> handle(String documentId, String correlationId) {
        Timer.Sample sample = metrics.startProcessing();
        CompletableFuture<Void> result = CompletableFuture.supplyAsync(() -> load(documentId), ioExecutor)
                .thenCompose(loaded -> loaded.map(this::classifyAndStore)
                        .orElseGet(() -> CompletableFuture.completedFuture(null)));
        return result.whenComplete((ignored, error) -> metrics.recordProcessing(sample, error == null));
    }

    private Optional<Loaded> load(String documentId) {
        Optional<Document> found = documents.findById(documentId);
        if (found.isEmpty()) {
            LOG.warn("Document {} not found, nothing to classify", documentId);
            return Optional.empty();
        }
        Document document = found.get();
        byte[] content;
        try {
            content = storage.retrieve(document.getStoragePath())
                    .orElseThrow(() -> new DocumentProcessingException(
                            "Content missing for document " + documentId + " at " + document.getStoragePath()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read content of document " + documentId, e);
        }
        return Optional.of(new Loaded(document, content));
    }

    private CompletableFuture<Void> classifyAndStore(Loaded loaded) {
        Document document = loaded.document();
        String mimeType = document.getMimeType() == null || document.getMimeType().isBlank()
                ? DEFAULT_MIME_TYPE
                : document.getMimeType();
        return classifier.classify(loaded.content(), mimeType)
                .thenAcceptAsync(result -> store(document.getId(), result), ioExecutor);
    }

    private void store(String documentId, ClassificationResult result) {
        boolean updated = documents.updateClassification(documentId, result.classification(), result.confidence());
        if (!updated) {
            LOG.warn("Document {} disappeared before its classification could be stored", documentId);
            return;
        }
        metrics.documentClassified();
        LOG.info("Document {} classified as '{}' (confidence {})",
                documentId, result.classification(), result.confidence());
    }

    private record Loaded(Document document, byte[] content) {}
}
