package com.acme.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Result from the ML classification service.
 *
 * @param classification predicted document label
 * @param confidence score between 0.0 and 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationResult(String classification, float confidence) {

  public ClassificationResult {
    if (classification == null || classification.isBlank()) {
      throw new IllegalArgumentException("classification is required");
    }
    if (!(confidence >= 0.0f && confidence <= 1.0f)) {
      throw new IllegalArgumentException(
          "Confidence must be between 0.0 and 1.0, got: " + confidence);
    }
  }
}
