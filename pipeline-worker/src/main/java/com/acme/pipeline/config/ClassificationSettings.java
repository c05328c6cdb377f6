package com.acme.pipeline.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;

/** ML classification service endpoint and breaker settings, bound from {@code classification.*}. */
@ConfigurationProperties("classification")
@Getter
@Setter
public class ClassificationSettings {

    private String baseUrl = "http://localhost:8000";
    private Duration timeout = Duration.ofSeconds(30);
    private Breaker circuitBreaker = new Breaker();

    @ConfigurationProperties("circuit-breaker")
    @Getter
    @Setter
    public static class Breaker {
        private int failureThreshold = CircuitBreakerConfig.DEFAULT_FAILURE_THRESHOLD;
        private Duration openDuration = CircuitBreakerConfig.DEFAULT_OPEN_DURATION;
        private int halfOpenMaxAttempts = CircuitBreakerConfig.DEFAULT_HALF_OPEN_MAX_ATTEMPTS;

        public CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(failureThreshold, openDuration, halfOpenMaxAttempts);
        }
    }
}
