package com.acme.pipeline.mq;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

import com.acme.pipeline.config.DlqReprocessorConfig;
import com.acme.pipeline.config.RetryConfig;
import com.acme.pipeline.core.RetryExecutor;
import com.acme.pipeline.spi.JobHandler;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Publish, fail, dead-letter, reprocess and park against a real broker. */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Dead-letter loop against RabbitMQ")
class RabbitMqPipelineContainerTest {

    @Container
    static final RabbitMQContainer RABBIT = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.13-management"));

    private Connection connection;
    private ExecutorService executor;
    private RabbitMqPublisher publisher;
    private RabbitMqConsumer consumer;
    private DlqReprocessor reprocessor;
    private final AtomicInteger reprocessed = new AtomicInteger();
    private final AtomicInteger parked = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        ConnectionFactory cf = new ConnectionFactory();
        cf.setHost(RABBIT.getHost());
        cf.setPort(RABBIT.getAmqpPort());
        cf.setUsername(RABBIT.getAdminUsername());
        cf.setPassword(RABBIT.getAdminPassword());
        connection = cf.newConnection("container-test");
        executor = Executors.newFixedThreadPool(4);

        try (Channel admin = connection.createChannel()) {
            QueueTopology.declare(admin, "test");
            admin.queuePurge(QueueTopology.DOCUMENT_CLASSIFICATION_QUEUE);
            admin.queuePurge(QueueTopology.DLX_QUEUE);
            admin.queuePurge(QueueTopology.PARKING_LOT_QUEUE);
        }

        publisher = new RabbitMqPublisher(connection,
                new RetryExecutor(new RetryConfig(3, Duration.ofMillis(50), Duration.ofMillis(500))),
                executor, Duration.ofSeconds(5));
        reprocessor = new DlqReprocessor(connection,
                new DlqReprocessorConfig(3, Duration.ofMillis(100), Duration.ofMillis(400), true),
                reprocessed::incrementAndGet, parked::incrementAndGet,
                Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        if (consumer != null) {
            consumer.stop();
        }
        reprocessor.stop();
        publisher.close();
        executor.shutdownNow();
        connection.close();
    }

    private long parkingLotDepth() throws Exception {
        try (Channel admin = connection.createChannel()) {
            return admin.messageCount(QueueTopology.PARKING_LOT_QUEUE);
        }
    }

    @Test
    @DisplayName("a job that fails once is dead-lettered, reprocessed and then acknowledged")
    void failsOnceThenSucceeds() throws Exception {
        List<String> handled = new CopyOnWriteArrayList<>();
        AtomicInteger attempts = new AtomicInteger();
        JobHandler handler = (documentId, correlationId) -> {
            handled.add(documentId);
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("ML service unavailable"));
            }
            return CompletableFuture.completedFuture(null);
        };
        consumer = new RabbitMqConsumer(connection, handler, executor, Duration.ofSeconds(5));
        consumer.start();
        reprocessor.start();

        publisher.publish("d1", "corr-1").get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            assertThat(handled).containsExactly("d1", "d1");
            assertThat(reprocessed).hasValue(1);
        });
        assertThat(parked).hasValue(0);
        assertThat(parkingLotDepth()).isZero();
    }

    @Test
    @DisplayName("a job that keeps failing is parked on its fourth arrival at the reprocessor")
    void parksAfterRetryBudget() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        JobHandler handler = (documentId, correlationId) -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("corrupt document"));
        };
        consumer = new RabbitMqConsumer(connection, handler, executor, Duration.ofSeconds(5));
        consumer.start();
        reprocessor.start();

        publisher.publish("d2").get(10, TimeUnit.SECONDS);

        await().atMost(Duration.ofSeconds(60)).untilAsserted(() -> assertThat(parked).hasValue(1));
        assertThat(reprocessed).hasValue(3);
        assertThat(attempts).hasValue(4);
        assertThat(parkingLotDepth()).isEqualTo(1);
    }
}
