package com.acme.pipeline.web;

import com.acme.pipeline.breaker.CircuitBreaker;
import com.acme.pipeline.config.WorkerBeansFactory;
import com.rabbitmq.client.Connection;
import io.micronaut.context.BeanProvider;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import jakarta.inject.Named;
import java.util.LinkedHashMap;
import java.util.Map;

/** UP only while the broker connection is open; the classification circuit is informational. */
@Controller
public class HealthController {

    private final BeanProvider<Connection> connection;
    private final CircuitBreaker classificationBreaker;

    public HealthController(
            BeanProvider<Connection> connection,
            @Named(WorkerBeansFactory.CLASSIFICATION_BREAKER) CircuitBreaker classificationBreaker) {
        this.connection = connection;
        this.classificationBreaker = classificationBreaker;
    }

    @Get("/health")
    public HttpResponse<Map<String, String>> health() {
        boolean brokerUp = connection.isPresent() && connection.get().isOpen();
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", brokerUp ? "UP" : "DOWN");
        body.put("broker", brokerUp ? "CONNECTED" : "DISCONNECTED");
        body.put("classificationCircuit", classificationBreaker.state().state().name());
        return brokerUp ? HttpResponse.ok(body) : HttpResponse.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
