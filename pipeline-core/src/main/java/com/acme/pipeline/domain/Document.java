package com.acme.pipeline.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** The parts of a stored document the worker needs to classify it. */
@Getter
@Builder
@AllArgsConstructor
public class Document {

  private final String id;
  private final String storagePath;
  private final String mimeType;
}
