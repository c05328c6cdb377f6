package com.acme.pipeline.mq;

import com.acme.pipeline.config.DlqReprocessorConfig;
import com.acme.pipeline.core.Backoff;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains {@link QueueTopology#DLX_QUEUE}, one message at a time.
 *
 * <p>A message that has died at most {@code maxRetryCycles} times is republished to the
 * classification route after a backoff of {@code Backoff.delay(base, max, deathCount - 1)}. A
 * message that has died more often is moved to the parking lot. The DLQ delivery is acknowledged
 * only after the broker confirms the outgoing publish; any failure requeues it.
 *
 * <p>The backoff wait runs on the broker's delivery thread, which is what holds further DLQ
 * deliveries back. {@link #stop()} ends a wait early and the pending message is requeued.
 */
public class DlqReprocessor implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(DlqReprocessor.class);

    private static final Runnable NO_CALLBACK = () -> {
    };

    private final Connection connection;
    private final DlqReprocessorConfig config;
    private final Runnable onReprocessed;
    private final Runnable onParked;
    private final Duration confirmTimeout;
    private final Duration shutdownTimeout;

    private final Object lifecycleLock = new Object();
    private final ReentrantLock processingLock = new ReentrantLock();
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private Channel channel;
    private String consumerTag;

    public DlqReprocessor(Connection connection, DlqReprocessorConfig config) {
        this(connection, config, NO_CALLBACK, NO_CALLBACK);
    }

    public DlqReprocessor(
            Connection connection, DlqReprocessorConfig config, Runnable onReprocessed, Runnable onParked) {
        this(connection, config, onReprocessed, onParked, Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    public DlqReprocessor(
            Connection connection,
            DlqReprocessorConfig config,
            Runnable onReprocessed,
            Runnable onParked,
            Duration confirmTimeout,
            Duration shutdownTimeout) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.config = Objects.requireNonNull(config, "config");
        this.onReprocessed = onReprocessed != null ? onReprocessed : NO_CALLBACK;
        this.onParked = onParked != null ? onParked : NO_CALLBACK;
        this.confirmTimeout = Objects.requireNonNull(confirmTimeout, "confirmTimeout");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    }

    public DlqReprocessorConfig config() {
        return config;
    }

    public void start() throws IOException {
        synchronized (lifecycleLock) {
            if (channel != null) {
                throw new IllegalStateException("DLQ reprocessor already started");
            }
            if (!config.enabled()) {
                LOG.info("DLQ reprocessor disabled, not consuming from {}", QueueTopology.DLX_QUEUE);
                return;
            }
            Channel ch = Channels.open(connection);
            try {
                QueueTopology.declare(ch, "dlq-reprocessor");
                ch.basicQos(1);
                ch.confirmSelect();
                stopSignal = new CountDownLatch(1);
                consumerTag = ch.basicConsume(
                        QueueTopology.DLX_QUEUE,
                        false,
                        (tag, delivery) -> onDelivery(ch, delivery),
                        tag -> LOG.warn("DLQ consumer {} cancelled by broker", tag));
            } catch (IOException | RuntimeException e) {
                stopSignal.countDown();
                Channels.closeQuietly(ch);
                throw e;
            }
            channel = ch;
            LOG.info("DLQ reprocessor started (maxRetryCycles={}, baseDelay={}ms, maxDelay={}ms)",
                    config.maxRetryCycles(), config.baseDelay().toMillis(), config.maxDelay().toMillis());
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return channel != null && channel.isOpen();
        }
    }

    void onDelivery(Channel ch, Delivery delivery) {
        processingLock.lock();
        try {
            process(ch, delivery);
        } finally {
            processingLock.unlock();
        }
    }

    private void process(Channel ch, Delivery delivery) {
        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        try {
            int deathCount = DeathCounts.from(delivery.getProperties());
            if (config.shouldPark(deathCount)) {
                park(ch, delivery, deathCount);
                return;
            }
            Duration delay = Backoff.delay(config.baseDelay(), config.maxDelay(), Math.max(0, deathCount - 1));
            LOG.info("Reprocessing DLQ message (death count {}/{}) after {}ms",
                    deathCount, config.maxRetryCycles(), delay.toMillis());
            if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.info("DLQ reprocessor stopping, requeueing pending message");
                requeue(ch, deliveryTag);
                return;
            }
            ch.basicPublish(
                    QueueTopology.DOCUMENT_EXCHANGE,
                    QueueTopology.CLASSIFICATION_ROUTING_KEY,
                    Mappers.republishProperties(delivery.getProperties(), deathCount),
                    delivery.getBody());
            ch.waitForConfirmsOrDie(confirmTimeout.toMillis());
            ch.basicAck(deliveryTag, false);
            notify(onReprocessed, "reprocessed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while reprocessing DLQ message, requeueing");
            requeue(ch, deliveryTag);
        } catch (Exception e) {
            LOG.error("Error reprocessing DLQ message, requeueing: {}", e.getMessage(), e);
            requeue(ch, deliveryTag);
        }
    }

    private void park(Channel ch, Delivery delivery, int deathCount) throws Exception {
        LOG.warn("Message exceeded {} retry cycles (death count {}), moving to parking lot: {}",
                config.maxRetryCycles(), deathCount, Mappers.preview(delivery.getBody()));
        ch.basicPublish(
                QueueTopology.PARKING_LOT_EXCHANGE, "", delivery.getProperties(), delivery.getBody());
        ch.waitForConfirmsOrDie(confirmTimeout.toMillis());
        ch.basicAck(delivery.getEnvelope().getDeliveryTag(), false);
        notify(onParked, "parked");
    }

    private static void notify(Runnable callback, String outcome) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("DLQ {} callback failed: {}", outcome, e.getMessage(), e);
        }
    }

    private static void requeue(Channel ch, long deliveryTag) {
        try {
            ch.basicNack(deliveryTag, false, true);
        } catch (IOException | ShutdownSignalException e) {
            LOG.warn("Failed to requeue DLQ delivery {}; the broker will redeliver it: {}",
                    deliveryTag, e.getMessage());
        }
    }

    /** Cancels the DLQ subscription, lets a pending message settle, then closes the channel. */
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
        LOG.info("Stopping DLQ reprocessor");
        stopSignal.countDown();
        if (tag != null && ch.isOpen()) {
            try {
                ch.basicCancel(tag);
            } catch (IOException | ShutdownSignalException e) {
                LOG.warn("Failed to cancel DLQ consumer {}: {}", tag, e.getMessage());
            }
        }
        awaitPendingMessage();
        Channels.closeQuietly(ch);
        LOG.info("DLQ reprocessor stopped");
    }

    private void awaitPendingMessage() {
        try {
            if (processingLock.tryLock(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                processingLock.unlock();
            } else {
                LOG.warn("DLQ message still in progress after {}ms; it will be redelivered",
                        shutdownTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
