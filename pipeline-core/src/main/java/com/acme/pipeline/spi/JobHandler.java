package com.acme.pipeline.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Processes one job taken off the queue. A normally completed future acknowledges the delivery;
 * an exceptionally completed one (or a thrown exception) dead-letters it.
 */
@FunctionalInterface
public interface JobHandler {

  CompletableFuture<Void> handle(String documentId, String correlationId);
}
