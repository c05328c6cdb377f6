package com.acme.pipeline.mq;

import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exchange and queue names plus the declaration shared by the publisher, the consumer and the
 * dead-letter reprocessor. Every declaration is idempotent, so each component declares the whole
 * topology on its own channel.
 */
public final class QueueTopology {
    private static final Logger LOG = LoggerFactory.getLogger(QueueTopology.class);

    public static final String DOCUMENT_EXCHANGE = "document.exchange";
    public static final String DOCUMENT_CLASSIFICATION_QUEUE = "document.classification.queue";
    public static final String CLASSIFICATION_ROUTING_KEY = "document.classify";

    public static final String DLX_EXCHANGE = "document.dlx.exchange";
    public static final String DLX_QUEUE = "document.dlx.queue";

    public static final String PARKING_LOT_EXCHANGE = "document.parking-lot.exchange";
    public static final String PARKING_LOT_QUEUE = "document.parking-lot.queue";

    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final String DEAD_LETTER_EXCHANGE_ARG = "x-dead-letter-exchange";

    private QueueTopology() {
    }

    public static void declare(Channel channel, String declaredBy) throws IOException {
        channel.exchangeDeclare(DOCUMENT_EXCHANGE, BuiltinExchangeType.TOPIC, true);

        channel.exchangeDeclare(DLX_EXCHANGE, BuiltinExchangeType.FANOUT, true);
        channel.queueDeclare(DLX_QUEUE, true, false, false, null);
        channel.queueBind(DLX_QUEUE, DLX_EXCHANGE, "");

        Map<String, Object> queueArgs = Map.of(DEAD_LETTER_EXCHANGE_ARG, DLX_EXCHANGE);
        channel.queueDeclare(DOCUMENT_CLASSIFICATION_QUEUE, true, false, false, queueArgs);
        channel.queueBind(DOCUMENT_CLASSIFICATION_QUEUE, DOCUMENT_EXCHANGE, CLASSIFICATION_ROUTING_KEY);

        channel.exchangeDeclare(PARKING_LOT_EXCHANGE, BuiltinExchangeType.FANOUT, true);
        channel.queueDeclare(PARKING_LOT_QUEUE, true, false, false, null);
        channel.queueBind(PARKING_LOT_QUEUE, PARKING_LOT_EXCHANGE, "");

        LOG.info("RabbitMQ topology declared ({})", declaredBy);
    }
}
