package com.acme.pipeline.worker;

import com.acme.pipeline.breaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker metrics, registered once at construction. The Prometheus registry adds the
 * {@code _total} and {@code _seconds} suffixes on scrape.
 */
@Singleton
public class WorkerMetrics {
    private static final Logger LOG = LoggerFactory.getLogger(WorkerMetrics.class);

    static final String DOCUMENTS_CLASSIFIED = "documents_classified";
    static final String CLASSIFICATION_ERRORS = "classification_errors";
    static final String PROCESSING_DURATION = "queue_message_processing_duration";
    static final String DLQ_REPROCESSED = "dlq_messages_reprocessed";
    static final String DLQ_PARKED = "dlq_messages_parked";
    static final String CLASSIFICATION_CALL_DURATION = "classification_call_duration";
    static final String CIRCUIT_BREAKER_STATE = "circuit_breaker_state";

    private final MeterRegistry registry;
    private final Counter documentsClassified;
    private final Counter classificationErrors;
    private final Timer processingTimer;
    private final Counter dlqReprocessed;
    private final Counter dlqParked;

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.documentsClassified = Counter.builder(DOCUMENTS_CLASSIFIED)
                .description("Documents classified and stored")
                .register(registry);
        this.classificationErrors = Counter.builder(CLASSIFICATION_ERRORS)
                .description("Jobs that failed and were routed to the dead-letter queue")
                .register(registry);
        this.processingTimer = Timer.builder(PROCESSING_DURATION)
                .description("Time to process one classification job")
                .register(registry);
        this.dlqReprocessed = Counter.builder(DLQ_REPROCESSED)
                .description("Dead-lettered jobs republished for another attempt")
                .register(registry);
        this.dlqParked = Counter.builder(DLQ_PARKED)
                .description("Dead-lettered jobs moved to the parking lot")
                .register(registry);
    }

    public Timer.Sample startProcessing() {
        return Timer.start(registry);
    }

    public void recordProcessing(Timer.Sample sample, boolean success) {
        sample.stop(processingTimer);
        if (!success) {
            classificationErrors.increment();
        }
    }

    public void documentClassified() {
        documentsClassified.increment();
    }

    public void dlqMessageReprocessed() {
        dlqReprocessed.increment();
    }

    public void dlqMessageParked() {
        dlqParked.increment();
    }

    /**
     * Listener that times calls through the named breaker and publishes its state as a gauge:
     * 0 closed, 1 half-open, 2 open.
     */
    public CircuitBreaker.Listener breakerListener(String breakerName) {
        AtomicInteger state = new AtomicInteger(stateCode(CircuitBreaker.State.CLOSED));
        Gauge.builder(CIRCUIT_BREAKER_STATE, state, AtomicInteger::get)
                .description("Circuit breaker state (0 closed, 1 half-open, 2 open)")
                .tag("breaker", breakerName)
                .strongReference(true)
                .register(registry);
        Timer success = callTimer(breakerName, "success");
        Timer failure = callTimer(breakerName, "failure");

        return new CircuitBreaker.Listener() {
            @Override
            public void onCallCompleted(String name, Duration duration, boolean succeeded) {
                (succeeded ? success : failure).record(duration);
            }

            @Override
            public void onStateChange(String name, CircuitBreaker.State from, CircuitBreaker.State to) {
                state.set(stateCode(to));
                LOG.debug("Breaker '{}' state gauge {} -> {}", name, from, to);
            }
        };
    }

    private Timer callTimer(String breakerName, String outcome) {
        return Timer.builder(CLASSIFICATION_CALL_DURATION)
                .description("ML classification call duration through the circuit breaker")
                .tag("breaker", breakerName)
                .tag("outcome", outcome)
                .register(registry);
    }

    static int stateCode(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
