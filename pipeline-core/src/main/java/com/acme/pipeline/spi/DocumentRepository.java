package com.acme.pipeline.spi;

import com.acme.pipeline.domain.Document;
import java.util.Optional;

/** Document metadata store. The relational implementation lives outside this repository. */
public interface DocumentRepository {

  Optional<Document> findById(String id);

  /**
   * Stores a classification for a document.
   *
   * @return {@code false} when the document no longer exists
   */
  boolean updateClassification(String id, String classification, float confidence);
}
