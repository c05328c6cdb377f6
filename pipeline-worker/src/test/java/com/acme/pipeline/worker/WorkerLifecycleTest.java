package com.acme.pipeline.worker;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.pipeline.mq.DlqReprocessor;
import com.acme.pipeline.mq.RabbitMqConsumer;
import io.micronaut.context.BeanProvider;
import io.micronaut.context.event.StartupEvent;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

@DisplayName("WorkerLifecycle")
class WorkerLifecycleTest {

    private BeanProvider<RabbitMqConsumer> provider;
    private RabbitMqConsumer consumer;
    private DlqReprocessor reprocessor;
    private WorkerLifecycle lifecycle;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        provider = mock(BeanProvider.class);
        consumer = mock(RabbitMqConsumer.class);
        reprocessor = mock(DlqReprocessor.class);
        lifecycle = new WorkerLifecycle(provider, reprocessor);
    }

    @Test
    @DisplayName("starts consumer and reprocessor, stops the consumer first")
    void startsAndStops() throws Exception {
        // Given
        when(provider.isPresent()).thenReturn(true);
        when(provider.get()).thenReturn(consumer);

        // When
        lifecycle.onApplicationEvent(mock(StartupEvent.class));
        lifecycle.shutdown();

        // Then
        InOrder order = inOrder(consumer, reprocessor);
        order.verify(consumer).start();
        order.verify(reprocessor).start();
        order.verify(consumer).stop();
        order.verify(reprocessor).stop();
    }

    @Test
    @DisplayName("without a handler only the reprocessor runs")
    void noConsumer() throws Exception {
        when(provider.isPresent()).thenReturn(false);

        lifecycle.onApplicationEvent(mock(StartupEvent.class));
        lifecycle.shutdown();

        verify(provider, never()).get();
        verify(reprocessor).start();
        verify(reprocessor).stop();
    }

    @Test
    @DisplayName("a broker failure on start aborts startup")
    void startFailure() throws Exception {
        when(provider.isPresent()).thenReturn(true);
        when(provider.get()).thenReturn(consumer);
        doThrow(new IOException("channel refused")).when(consumer).start();

        assertThatThrownBy(() -> lifecycle.onApplicationEvent(mock(StartupEvent.class)))
                .isInstanceOf(UncheckedIOException.class)
                .hasRootCauseMessage("channel refused");
        verify(reprocessor, never()).start();
    }
}
