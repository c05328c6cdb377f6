package com.acme.pipeline.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job descriptor placed on the classification queue.
 *
 * <p>Wire form: {@code {"documentId": "...", "action": "classify", "correlationId": "..."}}.
 * {@code correlationId} is omitted when absent; unknown fields are ignored on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentJob(
    @JsonProperty("documentId") String documentId,
    @JsonProperty("action") JobAction action,
    @JsonProperty("correlationId") String correlationId) {

  public DocumentJob {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId is required");
    }
    if (action == null) {
      action = JobAction.CLASSIFY;
    }
  }

  public static DocumentJob classify(String documentId, String correlationId) {
    return new DocumentJob(documentId, JobAction.CLASSIFY, correlationId);
  }
}
