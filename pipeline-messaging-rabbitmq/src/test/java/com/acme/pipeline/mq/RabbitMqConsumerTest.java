package com.acme.pipeline.mq;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.pipeline.spi.JobHandler;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

@DisplayName("RabbitMqConsumer - manual ack, dead-letter on failure")
class RabbitMqConsumerTest {

    private static final long TAG = 42L;

    private Connection connection;
    private Channel channel;
    private JobHandler handler;
    private RabbitMqConsumer consumer;

    @BeforeEach
    void setUp() throws Exception {
        connection = mock(Connection.class);
        channel = mock(Channel.class);
        handler = mock(JobHandler.class);
        when(connection.createChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);
        when(channel.basicConsume(anyString(), anyBoolean(), any(DeliverCallback.class), any(CancelCallback.class)))
                .thenReturn("ctag-1");
        consumer = new RabbitMqConsumer(connection, handler, Runnable::run, Duration.ofSeconds(5));
    }

    static Delivery delivery(long tag, String body) {
        return new Delivery(
                new Envelope(tag, false, "document.exchange", "document.classify"),
                new AMQP.BasicProperties(),
                body.getBytes(StandardCharsets.UTF_8));
    }

    private DeliverCallback startAndCaptureCallback() throws Exception {
        consumer.start();
        ArgumentCaptor<DeliverCallback> callback = ArgumentCaptor.forClass(DeliverCallback.class);
        verify(channel).basicConsume(
                eq("document.classification.queue"), eq(false), callback.capture(), any(CancelCallback.class));
        return callback.getValue();
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("declares topology, sets prefetch 1 and consumes with manual ack")
        void startsConsuming() throws Exception {
            consumer.start();

            verify(channel).queueDeclare(eq("document.classification.queue"), eq(true), eq(false), eq(false), anyMap());
            verify(channel).basicQos(1);
            verify(channel).basicConsume(
                    eq("document.classification.queue"), eq(false), any(DeliverCallback.class), any(CancelCallback.class));
            assertThat(consumer.isRunning()).isTrue();
        }

        @Test
        @DisplayName("a second start is rejected")
        void startTwice() throws Exception {
            consumer.start();

            assertThatThrownBy(() -> consumer.start()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("delivery settlement")
    class Settlement {

        @Test
        @DisplayName("acks after the handler succeeds")
        void acksOnSuccess() throws Exception {
            when(handler.handle("d1", "c1")).thenReturn(CompletableFuture.completedFuture(null));

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\",\"correlationId\":\"c1\"}"));

            verify(channel).basicAck(TAG, false);
            verify(channel, never()).basicReject(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("rejects without requeue when the handler future fails")
        void rejectsOnFailedFuture() throws Exception {
            when(handler.handle("d1", null))
                    .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("ML down")));

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));

            verify(channel).basicReject(TAG, false);
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("rejects without requeue when the handler throws")
        void rejectsOnThrow() throws Exception {
            when(handler.handle(anyString(), any())).thenThrow(new RuntimeException("boom"));

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));

            verify(channel).basicReject(TAG, false);
        }

        @Test
        @DisplayName("malformed body is rejected and never reaches the handler")
        void rejectsMalformed() throws Exception {
            DeliverCallback callback = startAndCaptureCallback();

            callback.handle("ctag-1", delivery(TAG, "{not json"));
            callback.handle("ctag-1", delivery(TAG + 1, "{\"action\":\"classify\"}"));

            verify(channel).basicReject(TAG, false);
            verify(channel).basicReject(TAG + 1, false);
            verifyNoInteractions(handler);
        }

        @Test
        @DisplayName("a JSON null body is rejected so it cannot hold the prefetch slot")
        void rejectsJsonNull() throws Exception {
            DeliverCallback callback = startAndCaptureCallback();

            callback.handle("ctag-1", delivery(TAG, "null"));

            verify(channel).basicReject(TAG, false);
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
            verifyNoInteractions(handler);
        }

        @Test
        @DisplayName("unknown fields are ignored")
        void ignoresUnknownFields() throws Exception {
            when(handler.handle("d1", null)).thenReturn(CompletableFuture.completedFuture(null));

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\",\"priority\":\"high\"}"));

            verify(channel).basicAck(TAG, false);
        }

        @Test
        @DisplayName("ack waits for the handler future to complete")
        void ackWaitsForCompletion() throws Exception {
            CompletableFuture<Void> pending = new CompletableFuture<>();
            when(handler.handle("d1", null)).thenReturn(pending);

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
            assertThat(consumer.inFlightCount()).isEqualTo(1);

            pending.complete(null);

            verify(channel).basicAck(TAG, false);
            assertThat(consumer.inFlightCount()).isZero();
        }

        @Test
        @DisplayName("handler sees document and correlation ids in the MDC")
        void populatesMdc() throws Exception {
            AtomicReference<String> seenDocument = new AtomicReference<>();
            AtomicReference<String> seenCorrelation = new AtomicReference<>();
            when(handler.handle("d1", "c1")).thenAnswer(inv -> {
                seenDocument.set(MDC.get("documentId"));
                seenCorrelation.set(MDC.get("correlationId"));
                return CompletableFuture.completedFuture(null);
            });

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\",\"correlationId\":\"c1\"}"));

            assertThat(seenDocument).hasValue("d1");
            assertThat(seenCorrelation).hasValue("c1");
            assertThat(MDC.get("documentId")).isNull();
        }

        @Test
        @DisplayName("requeues when the dispatcher refuses work")
        void requeuesOnRejectedDispatch() throws Exception {
            Executor refusing = task -> {
                throw new RejectedExecutionException("shutting down");
            };
            consumer = new RabbitMqConsumer(connection, handler, refusing, Duration.ofSeconds(1));

            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));

            verify(channel).basicNack(TAG, false, true);
            verifyNoInteractions(handler);
        }
    }

    @Nested
    @DisplayName("stop")
    class Stop {

        @Test
        @DisplayName("cancels, waits for in-flight work, acks it, then closes the channel")
        void drainsInFlight() throws Exception {
            CompletableFuture<Void> pending = new CompletableFuture<>();
            when(handler.handle("d1", null)).thenReturn(pending);
            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));

            CompletableFuture<Void> stopping = CompletableFuture.runAsync(consumer::stop);
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(channel).basicCancel("ctag-1"));
            verify(channel, never()).close();

            pending.complete(null);
            stopping.get();

            verify(channel).basicAck(TAG, false);
            verify(channel).close();
            assertThat(consumer.isRunning()).isFalse();
        }

        @Test
        @DisplayName("gives up after the shutdown timeout without acking")
        void boundedByTimeout() throws Exception {
            consumer = new RabbitMqConsumer(connection, handler, Runnable::run, Duration.ofMillis(100));
            when(handler.handle("d1", null)).thenReturn(new CompletableFuture<>());
            startAndCaptureCallback().handle("ctag-1", delivery(TAG, "{\"documentId\":\"d1\"}"));

            consumer.stop();

            verify(channel).close();
            verify(channel, never()).basicAck(anyLong(), anyBoolean());
        }

        @Test
        @DisplayName("stop before start is a no-op")
        void stopWithoutStart() {
            consumer.stop();

            verifyNoInteractions(connection);
        }
    }
}
