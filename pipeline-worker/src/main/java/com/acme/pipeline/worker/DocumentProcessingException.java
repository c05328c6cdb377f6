package com.acme.pipeline.worker;

import com.acme.pipeline.core.PermanentException;

/** A document exists but its content cannot be found in storage. */
public class DocumentProcessingException extends PermanentException {

    public DocumentProcessingException(String message) {
        super(message);
    }
}
