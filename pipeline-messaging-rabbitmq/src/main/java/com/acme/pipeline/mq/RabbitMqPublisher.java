package com.acme.pipeline.mq;

import com.acme.pipeline.core.RetryExecutor;
import com.acme.pipeline.core.TransientException;
import com.acme.pipeline.job.DocumentJob;
import com.acme.pipeline.spi.QueuePublisher;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes classification jobs to {@link QueueTopology#DOCUMENT_EXCHANGE}.
 *
 * <p>All publishes share one lazily opened channel in confirm mode. A publish that fails with a
 * transient broker error invalidates the channel it used and is retried on a fresh one. The
 * channel reference is replaced only if it still points at the failed channel, so a burst of
 * concurrent failures on the same channel opens exactly one replacement. Broker I/O never runs
 * while the channel lock is held, except for opening the channel itself.
 *
 * <p>Retries with their backoff waits run on {@code ioExecutor}; the caller's thread only builds
 * the message.
 */
public class RabbitMqPublisher implements QueuePublisher, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqPublisher.class);

    private final Connection connection;
    private final RetryExecutor retryExecutor;
    private final Executor ioExecutor;
    private final Duration confirmTimeout;

    private final ReentrantLock channelLock = new ReentrantLock();
    private final AtomicInteger channelsOpened = new AtomicInteger();
    private volatile Channel channel;
    private volatile boolean closed;

    public RabbitMqPublisher(
            Connection connection, RetryExecutor retryExecutor, Executor ioExecutor, Duration confirmTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
    }

    @Override
    public CompletableFuture<Void> publish(String documentId, String correlationId) {
        DocumentJob job;
        try {
            job = DocumentJob.classify(documentId, correlationId);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Publisher is closed"));
        }
        byte[] body = Mappers.toBody(job);
        AMQP.BasicProperties properties = Mappers.jobProperties(job);

        return CompletableFuture.runAsync(
                () -> {
                    try {
                        retryExecutor.execute(
                                "Publish document " + documentId,
                                () -> {
                                    publishOnce(body, properties);
                                    return null;
                                },
                                TransientFailures::isTransient);
                        LOG.info("Published document {} for classification (correlationId={})",
                                documentId, correlationId);
                    } catch (Exception e) {
                        LOG.error("Failed to publish document {} after retries: {}", documentId, e.getMessage());
                        throw new CompletionException(e);
                    }
                },
                ioExecutor);
    }

    private void publishOnce(byte[] body, AMQP.BasicProperties properties) throws Exception {
        Channel ch = channel();
        try {
            ch.basicPublish(
                    QueueTopology.DOCUMENT_EXCHANGE, QueueTopology.CLASSIFICATION_ROUTING_KEY, properties, body);
            // closes the channel on nack or timeout
            ch.waitForConfirmsOrDie(confirmTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // outstanding confirm state is unknown, so the channel is not reused
            invalidate(ch);
            throw e;
        } catch (TimeoutException e) {
            invalidate(ch);
            throw new TransientException("Publish not confirmed within " + confirmTimeout.toMillis() + "ms", e);
        } catch (Exception e) {
            if (TransientFailures.isTransient(e)) {
                invalidate(ch);
            }
            throw e;
        }
    }

    Channel channel() throws IOException {
        Channel current = channel;
        if (current != null && current.isOpen()) {
            return current;
        }
        channelLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Publisher is closed");
            }
            current = channel;
            if (current == null || !current.isOpen()) {
                current = openChannel();
                channel = current;
            }
            return current;
        } finally {
            channelLock.unlock();
        }
    }

    private Channel openChannel() throws IOException {
        Channel fresh = Channels.open(connection);
        try {
            QueueTopology.declare(fresh, "publisher");
            fresh.confirmSelect();
        } catch (IOException | RuntimeException e) {
            Channels.closeQuietly(fresh);
            throw e;
        }
        int opened = channelsOpened.incrementAndGet();
        LOG.info("Publisher channel {} opened (total opened: {})", fresh.getChannelNumber(), opened);
        return fresh;
    }

    /** Drops {@code failed} if it is still the current channel; a replacement opened meanwhile stays. */
    void invalidate(Channel failed) {
        boolean replaced = false;
        channelLock.lock();
        try {
            if (channel == failed) {
                channel = null;
                replaced = true;
            }
        } finally {
            channelLock.unlock();
        }
        if (replaced) {
            LOG.warn("Publisher channel {} invalidated after failure", failed.getChannelNumber());
            Channels.closeQuietly(failed);
        }
    }

    int channelsOpened() {
        return channelsOpened.get();
    }

    /** Closes the publisher's channel. The connection belongs to the caller. */
    @Override
    public void close() {
        Channel current;
        channelLock.lock();
        try {
            closed = true;
            current = channel;
            channel = null;
        } finally {
            channelLock.unlock();
        }
        Channels.closeQuietly(current);
        LOG.info("Publisher closed");
    }
}
