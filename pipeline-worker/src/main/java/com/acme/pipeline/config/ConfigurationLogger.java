package com.acme.pipeline.config;

import com.acme.pipeline.mq.RabbitMqSettings;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the effective broker and resilience configuration on startup. Credentials are never
 * printed. Disabled in the test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final RabbitMqSettings rabbitMq;
    private final ClassificationSettings classification;

    @Property(name = "micronaut.server.port")
    private int serverPort;

    public ConfigurationLogger(RabbitMqSettings rabbitMq, ClassificationSettings classification) {
        this.rabbitMq = rabbitMq;
        this.classification = classification;
    }

    @Override
    public void onApplicationEvent(ServerStartupEvent event) {
        RetryConfig retry = rabbitMq.getPublisherRetry().toConfig();
        DlqReprocessorConfig dlq = rabbitMq.getDlq().toConfig();
        CircuitBreakerConfig breaker = classification.getCircuitBreaker().toConfig();

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Server ━━━");
        LOG.info("  Port:               {} (/health and /metrics)", serverPort);
        LOG.info("");

        LOG.info("━━━ RabbitMQ ━━━");
        LOG.info("  Broker:             {}:{} vhost '{}'", rabbitMq.getHost(), rabbitMq.getPort(), rabbitMq.getVirtualHost());
        LOG.info("  Username:           {}", rabbitMq.getUsername());
        LOG.info("  Connection Name:    {}", rabbitMq.getConnectionName());
        LOG.info("  Recovery Interval:  {} (automatic connection recovery)", rabbitMq.getNetworkRecoveryInterval());
        LOG.info("  Confirm Timeout:    {} (wait for broker publish confirm)", rabbitMq.getConfirmTimeout());
        LOG.info("  Shutdown Timeout:   {} (drain in-flight jobs on stop)", rabbitMq.getConsumerShutdownTimeout());
        LOG.info("");

        LOG.info("━━━ Publisher Retry ━━━");
        LOG.info("  Max Retries:        {}", retry.maxRetries());
        LOG.info("  Base Delay:         {}", retry.baseDelay());
        LOG.info("  Max Delay:          {}", retry.maxDelay());
        LOG.info("");

        LOG.info("━━━ Dead-Letter Reprocessing ━━━");
        LOG.info("  Reprocessor:        {}", dlq.enabled() ? "ENABLED" : "DISABLED");
        LOG.info("  Max Retry Cycles:   {} (then parked)", dlq.maxRetryCycles());
        LOG.info("  Base Delay:         {}", dlq.baseDelay());
        LOG.info("  Max Delay:          {}", dlq.maxDelay());
        LOG.info("");

        LOG.info("━━━ ML Classification ━━━");
        LOG.info("  Service URL:        {}", classification.getBaseUrl());
        LOG.info("  Request Timeout:    {}", classification.getTimeout());
        LOG.info("  Breaker Threshold:  {} consecutive failures", breaker.failureThreshold());
        LOG.info("  Breaker Open For:   {}", breaker.openDuration());
        LOG.info("  Half-Open Trials:   {}", breaker.halfOpenMaxAttempts());
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                      WORKER READY FOR JOBS                                     ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
