package com.acme.pipeline.web;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.acme.pipeline.breaker.CircuitBreaker;
import com.acme.pipeline.config.CircuitBreakerConfig;
import com.rabbitmq.client.Connection;
import io.micronaut.context.BeanProvider;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HealthController")
class HealthControllerTest {

    private BeanProvider<Connection> provider;
    private Connection connection;
    private CircuitBreaker breaker;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        provider = mock(BeanProvider.class);
        connection = mock(Connection.class);
        breaker = new CircuitBreaker("classification", CircuitBreakerConfig.defaults());
    }

    @Test
    @DisplayName("UP while the broker connection is open")
    void up() {
        when(provider.isPresent()).thenReturn(true);
        when(provider.get()).thenReturn(connection);
        when(connection.isOpen()).thenReturn(true);

        HttpResponse<Map<String, String>> response = new HealthController(provider, breaker).health();

        assertThat((Object) response.status()).isEqualTo(HttpStatus.OK);
        assertThat(response.body())
                .containsEntry("status", "UP")
                .containsEntry("broker", "CONNECTED")
                .containsEntry("classificationCircuit", "CLOSED");
    }

    @Test
    @DisplayName("503 when the connection is closed")
    void closedConnection() {
        when(provider.isPresent()).thenReturn(true);
        when(provider.get()).thenReturn(connection);
        when(connection.isOpen()).thenReturn(false);

        HttpResponse<Map<String, String>> response = new HealthController(provider, breaker).health();

        assertThat((Object) response.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.body()).containsEntry("status", "DOWN");
    }

    @Test
    @DisplayName("503 when no broker connection is configured")
    void noConnection() {
        when(provider.isPresent()).thenReturn(false);

        HttpResponse<Map<String, String>> response = new HealthController(provider, breaker).health();

        assertThat((Object) response.status()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.body()).containsEntry("broker", "DISCONNECTED");
        verify(provider, never()).get();
    }
}
