package com.acme.pipeline.worker;

import com.acme.pipeline.breaker.CircuitBreaker;
import com.acme.pipeline.domain.ClassificationResult;
import com.acme.pipeline.spi.ClassificationService;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Routes classification calls through a {@link CircuitBreaker}. While the circuit is open the
 * returned future fails with {@link com.acme.pipeline.breaker.CircuitBreakerOpenException} and the
 * ML service is not called; the job then dead-letters and is retried after the reprocessor's
 * backoff.
 */
public class CircuitBreakerClassificationService implements ClassificationService {

    private final ClassificationService delegate;
    private final CircuitBreaker breaker;

    public CircuitBreakerClassificationService(ClassificationService delegate, CircuitBreaker breaker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.breaker = Objects.requireNonNull(breaker, "breaker");
    }

    @Override
    public CompletableFuture<ClassificationResult> classify(byte[] content, String mimeType) {
        return breaker.callAsync(() -> delegate.classify(content, mimeType));
    }

    public CircuitBreaker breaker() {
        return breaker;
    }
}
