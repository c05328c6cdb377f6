package com.acme.pipeline.config;

import com.acme.pipeline.breaker.CircuitBreaker;
import com.acme.pipeline.core.RetryExecutor;
import com.acme.pipeline.mq.DlqReprocessor;
import com.acme.pipeline.mq.RabbitMqConsumer;
import com.acme.pipeline.mq.RabbitMqPublisher;
import com.acme.pipeline.mq.RabbitMqSettings;
import com.acme.pipeline.spi.ClassificationService;
import com.acme.pipeline.spi.JobHandler;
import com.acme.pipeline.worker.CircuitBreakerClassificationService;
import com.acme.pipeline.worker.HttpClassificationService;
import com.acme.pipeline.worker.WorkerMetrics;
import com.rabbitmq.client.Connection;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.TaskExecutors;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

/**
 * Wires the framework-free core and RabbitMQ components into Micronaut.
 *
 * <p>Settings POJOs are converted to the validated core records here, so a bad value in
 * application.yml fails application startup. Broker-facing beans are only defined when a broker
 * {@link Connection} exists, which is never the case in the {@code test} environment.
 */
@Factory
public class WorkerBeansFactory {

    public static final String CLASSIFICATION_BREAKER = "classification";

    @Singleton
    public RetryConfig publisherRetryConfig(RabbitMqSettings settings) {
        return settings.getPublisherRetry().toConfig();
    }

    @Singleton
    public DlqReprocessorConfig dlqReprocessorConfig(RabbitMqSettings settings) {
        return settings.getDlq().toConfig();
    }

    @Singleton
    public CircuitBreakerConfig circuitBreakerConfig(ClassificationSettings settings) {
        return settings.getCircuitBreaker().toConfig();
    }

    @Singleton
    @Bean(preDestroy = "close")
    public PrometheusMeterRegistry meterRegistry() {
        return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    }

    @Singleton
    @Named(CLASSIFICATION_BREAKER)
    public CircuitBreaker classificationCircuitBreaker(CircuitBreakerConfig config, WorkerMetrics metrics) {
        return new CircuitBreaker(
                CLASSIFICATION_BREAKER,
                config,
                Clock.systemUTC(),
                metrics.breakerListener(CLASSIFICATION_BREAKER));
    }

    @Singleton
    public ClassificationService classificationService(
            ClassificationSettings settings, @Named(CLASSIFICATION_BREAKER) CircuitBreaker breaker) {
        HttpClassificationService http = new HttpClassificationService(settings.getBaseUrl(), settings.getTimeout());
        return new CircuitBreakerClassificationService(http, breaker);
    }

    @Singleton
    @Requires(beans = Connection.class)
    @Bean(preDestroy = "close")
    public RabbitMqPublisher queuePublisher(
            Connection connection,
            RabbitMqSettings settings,
            RetryConfig publisherRetryConfig,
            @Named(TaskExecutors.IO) ExecutorService ioExecutor) {
        return new RabbitMqPublisher(
                connection, new RetryExecutor(publisherRetryConfig), ioExecutor, settings.getConfirmTimeout());
    }

    @Singleton
    @Requires(beans = {Connection.class, JobHandler.class})
    public RabbitMqConsumer classificationConsumer(
            Connection connection,
            JobHandler handler,
            RabbitMqSettings settings,
            @Named(TaskExecutors.IO) ExecutorService ioExecutor) {
        return new RabbitMqConsumer(connection, handler, ioExecutor, settings.getConsumerShutdownTimeout());
    }

    @Singleton
    @Requires(beans = Connection.class)
    public DlqReprocessor dlqReprocessor(
            Connection connection, DlqReprocessorConfig config, RabbitMqSettings settings, WorkerMetrics metrics) {
        return new DlqReprocessor(
                connection,
                config,
                metrics::dlqMessageReprocessed,
                metrics::dlqMessageParked,
                settings.getConfirmTimeout(),
                settings.getConsumerShutdownTimeout());
    }
}
