package com.acme.pipeline.mq;

import com.acme.pipeline.job.DocumentJob;
import com.acme.pipeline.spi.JobHandler;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Consumes classification jobs from {@link QueueTopology#DOCUMENT_CLASSIFICATION_QUEUE} with manual
 * acknowledgement and a prefetch of one.
 *
 * <p>A job is acknowledged only after its handler future completes normally. A handler failure
 * rejects the delivery without requeue, so the broker routes it to the dead-letter exchange. A
 * body that does not parse is rejected the same way.
 *
 * <p>Handlers run on {@code dispatchExecutor}, never on the broker's delivery thread. {@link
 * #stop()} waits up to the shutdown timeout for in-flight handlers, then closes the channel; a
 * handler still running at that point loses its acknowledgement and the broker redelivers the job.
 */
public class RabbitMqConsumer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqConsumer.class);

    static final String MDC_DOCUMENT_ID = "documentId";
    static final String MDC_CORRELATION_ID = "correlationId";

    private final Connection connection;
    private final JobHandler handler;
    private final Executor dispatchExecutor;
    private final Duration shutdownTimeout;

    private final Object lifecycleLock = new Object();
    private final Set<CompletableFuture<Void>> inFlight = ConcurrentHashMap.newKeySet();
    private Channel channel;
    private String consumerTag;

    public RabbitMqConsumer(
            Connection connection, JobHandler handler, Executor dispatchExecutor, Duration shutdownTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    public void start() throws IOException {
        synchronized (lifecycleLock) {
            if (channel != null) {
                throw new IllegalStateException("Consumer already started");
            }
            Channel ch = Channels.open(connection);
            try {
                QueueTopology.declare(ch, "consumer");
                ch.basicQos(1);
                consumerTag = ch.basicConsume(
                        QueueTopology.DOCUMENT_CLASSIFICATION_QUEUE,
                        false,
                        (tag, delivery) -> onDelivery(ch, delivery),
                        tag -> LOG.warn("Consumer {} cancelled by broker", tag));
            } catch (IOException | RuntimeException e) {
                Channels.closeQuietly(ch);
                throw e;
            }
            channel = ch;
            LOG.info("Consuming from {} (consumerTag={})", QueueTopology.DOCUMENT_CLASSIFICATION_QUEUE, consumerTag);
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return channel != null && channel.isOpen();
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    void onDelivery(Channel ch, Delivery delivery) {
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        DocumentJob job;
        try {
            job = Mappers.toJob(delivery.getBody());
        } catch (IOException e) {
            LOG.error("Rejecting malformed message: {} ({})", Mappers.preview(delivery.getBody()), e.getMessage());
            reject(ch, deliveryTag);
            return;
        }

        CompletableFuture<Void> completion;
        try {
            completion = CompletableFuture.supplyAsync(() -> dispatch(job), dispatchExecutor)
                    .thenCompose(f -> f);
        } catch (RejectedExecutionException e) {
            LOG.warn("Dispatcher rejected job for document {}, requeueing", job.documentId());
            requeue(ch, deliveryTag);
            return;
        }

        CompletableFuture<Void> tracked = completion.handle((ignored, error) -> {
            try {
                settle(ch, deliveryTag, job, error);
            } catch (RuntimeException e) {
                LOG.error("Failed to settle delivery {}, rejecting it", deliveryTag, e);
                reject(ch, deliveryTag);
            }
            return null;
        });
        inFlight.add(tracked);
        tracked.whenComplete((ignored, error) -> inFlight.remove(tracked));
    }

    private CompletableFuture<Void> dispatch(DocumentJob job) {
        MDC.put(MDC_DOCUMENT_ID, job.documentId());
        if (job.correlationId() != null) {
            MDC.put(MDC_CORRELATION_ID, job.correlationId());
        }
        try {
            LOG.info("Processing job {} for document {}", job.action().wireName(), job.documentId());
            CompletableFuture<Void> result = handler.handle(job.documentId(), job.correlationId());
            return result != null ? result : CompletableFuture.completedFuture(null);
        } finally {
            MDC.remove(MDC_DOCUMENT_ID);
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    private void settle(Channel ch, long deliveryTag, DocumentJob job, Throwable error) {
        if (error == null) {
            try {
                ch.basicAck(deliveryTag, false);
                LOG.debug("Acked document {}", job.documentId());
            } catch (IOException | ShutdownSignalException e) {
                LOG.warn("Failed to ack document {}; the broker will redeliver it: {}",
                        job.documentId(), e.getMessage());
            }
        } else {
            Throwable cause = unwrap(error);
            LOG.error("Processing failed for document {}, routing to dead-letter queue: {}",
                    job.documentId(), cause.getMessage(), cause);
            reject(ch, deliveryTag);
        }
    }

    private static void reject(Channel ch, long deliveryTag) {
        try {
            ch.basicReject(deliveryTag, false);
        } catch (IOException | ShutdownSignalException e) {
            LOG.warn("Failed to reject delivery {}: {}", deliveryTag, e.getMessage());
        }
    }

    private static void requeue(Channel ch, long deliveryTag) {
        try {
            ch.basicNack(deliveryTag, false, true);
        } catch (IOException | ShutdownSignalException e) {
            LOG.warn("Failed to requeue delivery {}: {}", deliveryTag, e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException
                        || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /** Cancels the subscription, drains in-flight handlers up to the shutdown timeout, then closes the channel. */
    public void stop() {
        Channel ch;
        String tag;
        synchronized (lifecycleLock) {
            ch = channel;
            tag = consumerTag;
            channel = null;
            consumerTag = null;
        }
        if (ch == null) {
            return;
        }
        LOG.info("Stopping consumer {}", tag);
        if (tag != null && ch.isOpen()) {
            try {
                ch.basicCancel(tag);
            } catch (IOException | ShutdownSignalException e) {
                LOG.warn("Failed to cancel consumer {}: {}", tag, e.getMessage());
            }
        }
        awaitInFlight();
        Channels.closeQuietly(ch);
        LOG.info("Consumer stopped");
    }

    private void awaitInFlight() {
        CompletableFuture<?>[] pending = inFlight.toArray(new CompletableFuture<?>[0]);
        if (pending.length == 0) {
            return;
        }
        LOG.info("Waiting up to {}ms for {} in-flight job(s)", shutdownTimeout.toMillis(), pending.length);
        try {
            CompletableFuture.allOf(pending).get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("{} job(s) still running after {}ms; they will be redelivered",
                    inFlight.size(), shutdownTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining in-flight jobs");
        } catch (ExecutionException e) {
            LOG.warn("In-flight job failed during shutdown: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        stop();
    }
}
