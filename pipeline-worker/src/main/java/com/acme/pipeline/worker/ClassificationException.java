package com.acme.pipeline.worker;

/** The ML service call failed: transport error, non-2xx response or an unreadable body. */
public class ClassificationException extends RuntimeException {

    public static final int NO_STATUS = -1;

    private final int statusCode;

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
    }

    public ClassificationException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    /** HTTP status of the failed response, or {@link #NO_STATUS} when no response arrived. */
    public int getStatusCode() {
        return statusCode;
    }
}
