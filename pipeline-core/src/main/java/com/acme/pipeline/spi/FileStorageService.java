package com.acme.pipeline.spi;

import java.io.IOException;
import java.util.Optional;

/** Access to stored document content. */
public interface FileStorageService {

  Optional<byte[]> retrieve(String storagePath) throws IOException;
}
