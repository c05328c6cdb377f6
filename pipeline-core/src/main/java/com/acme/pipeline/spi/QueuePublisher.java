package com.acme.pipeline.spi;

import java.util.concurrent.CompletableFuture;

/** Enqueues document jobs for asynchronous processing. */
public interface QueuePublisher {

  /**
   * Publishes one classification job. The future completes once the broker has accepted the
   * message, or fails with the last transient error after the retry budget is spent.
   *
   * @param documentId UUID (as string) of the document to classify
   * @param correlationId optional tracing token, may be {@code null}
   */
  CompletableFuture<Void> publish(String documentId, String correlationId);

  default CompletableFuture<Void> publish(String documentId) {
    return publish(documentId, null);
  }
}
