package com.acme.pipeline.mq;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens the single broker connection shared by the publisher, the consumer and the reprocessor.
 * Automatic recovery is on: after a network failure the client reconnects and re-opens channels
 * and consumers on its own.
 */
@Requires(notEnv = "test")
@Factory
public class RabbitMqConnectionFactoryProvider {
    private static final Logger LOG = LoggerFactory.getLogger(RabbitMqConnectionFactoryProvider.class);

    @Singleton
    @Bean(preDestroy = "close")
    public Connection rabbitMqConnection(RabbitMqSettings settings) throws IOException, TimeoutException {
        ConnectionFactory cf = connectionFactory(settings);
        Connection connection = cf.newConnection(settings.getConnectionName());
        LOG.info("Connected to RabbitMQ at {}:{} (vhost {}) as '{}'",
                settings.getHost(), settings.getPort(), settings.getVirtualHost(), settings.getConnectionName());
        return connection;
    }

    static ConnectionFactory connectionFactory(RabbitMqSettings settings) {
        ConnectionFactory cf = new ConnectionFactory();
        cf.setHost(settings.getHost());
        cf.setPort(settings.getPort());
        cf.setUsername(settings.getUsername());
        cf.setPassword(settings.getPassword());
        cf.setVirtualHost(settings.getVirtualHost());
        cf.setAutomaticRecoveryEnabled(true);
        cf.setTopologyRecoveryEnabled(true);
        cf.setNetworkRecoveryInterval(settings.getNetworkRecoveryInterval().toMillis());
        return cf;
    }
}
