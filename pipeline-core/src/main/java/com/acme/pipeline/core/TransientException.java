package com.acme.pipeline.core;

/** Failure that is expected to clear on its own, such as a broker refusing a publish confirm. */
public class TransientException extends RuntimeException {

  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable cause) {
    super(message, cause);
  }
}
