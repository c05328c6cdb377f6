package com.acme.pipeline.worker;

import com.acme.pipeline.mq.DlqReprocessor;
import com.acme.pipeline.mq.RabbitMqConsumer;
import com.rabbitmq.client.Connection;
import io.micronaut.context.BeanProvider;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the classification consumer and the dead-letter reprocessor once the context is up and
 * stops them, consumer first, on shutdown.
 */
@Singleton
@Requires(beans = Connection.class)
public class WorkerLifecycle implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerLifecycle.class);

    private final BeanProvider<RabbitMqConsumer> consumerProvider;
    private final DlqReprocessor reprocessor;
    private RabbitMqConsumer consumer;

    public WorkerLifecycle(BeanProvider<RabbitMqConsumer> consumerProvider, DlqReprocessor reprocessor) {
        this.consumerProvider = consumerProvider;
        this.reprocessor = reprocessor;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        try {
            if (consumerProvider.isPresent()) {
                consumer = consumerProvider.get();
                consumer.start();
            } else {
                LOG.warn("No document repository/storage available, classification consumer not started");
            }
            reprocessor.start();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start queue consumers", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (consumer != null) {
            consumer.stop();
        }
        reprocessor.stop();
    }
}
