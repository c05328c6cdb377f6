package com.acme.pipeline.mq;

import com.acme.pipeline.core.TransientException;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;

/**
 * Classifies broker-side failures worth retrying on a fresh channel: a closed channel
 * ({@link com.rabbitmq.client.AlreadyClosedException}), an abrupt shutdown signal, transport I/O
 * errors and {@link TransientException}. The cause chain is searched, so wrapped failures
 * classify the same way.
 */
public final class TransientFailures {

    private static final int MAX_CAUSE_DEPTH = 10;

    private TransientFailures() {
    }

    public static boolean isTransient(Throwable failure) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ShutdownSignalException
                    || current instanceof IOException
                    || current instanceof TransientException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
