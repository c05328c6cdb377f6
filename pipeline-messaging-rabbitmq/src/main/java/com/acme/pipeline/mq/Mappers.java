package com.acme.pipeline.mq;

import com.acme.pipeline.core.Jsons;
import com.acme.pipeline.job.DocumentJob;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.MessageProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

/** Maps job descriptors to and from AMQP message bodies and properties. */
public final class Mappers {

    static final int MAX_LOG_BODY_LENGTH = 200;
    private static final int PERSISTENT = MessageProperties.PERSISTENT_BASIC.getDeliveryMode();

    private Mappers() {
    }

    public static byte[] toBody(DocumentJob job) {
        return Jsons.toBytes(job);
    }

    /**
     * Parses a delivery body. Unknown fields are ignored; a malformed body or a missing
     * {@code documentId} fails with {@link IOException}, as does a JSON {@code null} body.
     */
    public static DocumentJob toJob(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            throw new IOException("Empty message body");
        }
        DocumentJob job = Jsons.fromBytes(body, DocumentJob.class);
        if (job == null) {
            throw new IOException("Message body is JSON null");
        }
        return job;
    }

    public static AMQP.BasicProperties jobProperties(DocumentJob job) {
        return new AMQP.BasicProperties.Builder()
                .contentType(QueueTopology.CONTENT_TYPE_JSON)
                .deliveryMode(PERSISTENT)
                .correlationId(job.correlationId())
                .messageId(UUID.randomUUID().toString())
                .timestamp(new Date())
                .build();
    }

    /**
     * Fresh properties for a message leaving the dead-letter queue. Content type and delivery
     * mode carry over. Broker death history ({@code x-death}) does not; the running death count
     * goes in {@link DeathCounts#PRIOR_DEATHS_HEADER} instead.
     */
    public static AMQP.BasicProperties republishProperties(AMQP.BasicProperties original, int deathCount) {
        String contentType = original != null && original.getContentType() != null
                ? original.getContentType()
                : QueueTopology.CONTENT_TYPE_JSON;
        Integer deliveryMode = original != null && original.getDeliveryMode() != null
                ? original.getDeliveryMode()
                : PERSISTENT;
        return new AMQP.BasicProperties.Builder()
                .contentType(contentType)
                .deliveryMode(deliveryMode)
                .headers(Map.<String, Object>of(DeathCounts.PRIOR_DEATHS_HEADER, deathCount))
                .build();
    }

    public static String preview(byte[] body) {
        if (body == null) {
            return "";
        }
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() > MAX_LOG_BODY_LENGTH ? text.substring(0, MAX_LOG_BODY_LENGTH) : text;
    }
}
