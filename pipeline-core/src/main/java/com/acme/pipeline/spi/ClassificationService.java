package com.acme.pipeline.spi;

import com.acme.pipeline.domain.ClassificationResult;
import java.util.concurrent.CompletableFuture;

/** Calls the external ML service to classify document content. */
public interface ClassificationService {

  CompletableFuture<ClassificationResult> classify(byte[] content, String mimeType);
}
