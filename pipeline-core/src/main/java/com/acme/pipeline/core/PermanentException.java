package com.acme.pipeline.core;

/** Failure that retrying cannot fix, such as a document whose stored content is gone. */
public class PermanentException extends RuntimeException {

  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable cause) {
    super(message, cause);
  }
}
