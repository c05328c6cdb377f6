package com.acme.pipeline.mq;

import com.acme.pipeline.config.DlqReprocessorConfig;
import com.acme.pipeline.config.RetryConfig;
import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;

/**
 * Broker connection and delivery settings bound from {@code rabbitmq.*}. The nested retry and
 * dead-letter sections convert to the validated core records, so an inconsistent value fails
 * when the owning bean is created rather than at first use.
 */
@ConfigurationProperties("rabbitmq")
@Getter
@Setter
public class RabbitMqSettings {

    private String host = "localhost";
    private int port = 5672;
    private String username = "guest";
    private String password = "guest";
    private String virtualHost = "/";
    private String connectionName = "document-pipeline";
    private Duration networkRecoveryInterval = Duration.ofSeconds(5);
    private Duration confirmTimeout = Duration.ofSeconds(5);
    private Duration consumerShutdownTimeout = Duration.ofSeconds(30);

    private PublisherRetry publisherRetry = new PublisherRetry();
    private Dlq dlq = new Dlq();

    @ConfigurationProperties("publisher-retry")
    @Getter
    @Setter
    public static class PublisherRetry {
        private int maxRetries = RetryConfig.DEFAULT_MAX_RETRIES;
        private Duration baseDelay = RetryConfig.DEFAULT_BASE_DELAY;
        private Duration maxDelay = RetryConfig.DEFAULT_MAX_DELAY;

        public RetryConfig toConfig() {
            return new RetryConfig(maxRetries, baseDelay, maxDelay);
        }
    }

    @ConfigurationProperties("dlq")
    @Getter
    @Setter
    public static class Dlq {
        private boolean enabled = true;
        private int maxRetryCycles = DlqReprocessorConfig.DEFAULT_MAX_RETRY_CYCLES;
        private Duration baseDelay = DlqReprocessorConfig.DEFAULT_BASE_DELAY;
        private Duration maxDelay = DlqReprocessorConfig.DEFAULT_MAX_DELAY;

        public DlqReprocessorConfig toConfig() {
            return new DlqReprocessorConfig(maxRetryCycles, baseDelay, maxDelay, enabled);
        }
    }
}
