package com.acme.pipeline.mq;

import com.rabbitmq.client.AMQP;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Reads how many times the broker has dead-lettered a message.
 *
 * <p>RabbitMQ attaches an {@code x-death} header: a list of tables, one per (queue, reason) pair,
 * each with a {@code count}. The count arrives as a {@code Long} from the broker but may be an
 * {@code Integer} when a message was built by a client. Counts are summed across entries; a missing
 * or malformed header counts as zero.
 *
 * <p>The reprocessor republishes without {@code x-death}, so the broker starts a fresh history on
 * the next death. The total from earlier cycles travels in {@value #PRIOR_DEATHS_HEADER} and is
 * added here.
 */
public final class DeathCounts {

    public static final String X_DEATH_HEADER = "x-death";
    public static final String PRIOR_DEATHS_HEADER = "x-prior-deaths";
    static final String COUNT_FIELD = "count";

    private DeathCounts() {
    }

    public static int from(AMQP.BasicProperties properties) {
        if (properties == null) {
            return 0;
        }
        return from(properties.getHeaders());
    }

    public static int from(Map<String, Object> headers) {
        if (headers == null) {
            return 0;
        }
        long total = countOf(headers.get(PRIOR_DEATHS_HEADER));
        Object xDeath = headers.get(X_DEATH_HEADER);
        if (xDeath instanceof List<?> entries) {
            for (Object entry : entries) {
                if (entry instanceof Map<?, ?> table) {
                    total = saturatedAdd(total, countOf(table.get(COUNT_FIELD)));
                }
            }
        }
        return (int) total;
    }

    // both operands are within [0, Integer.MAX_VALUE], so the long sum cannot wrap
    private static long saturatedAdd(long total, long count) {
        return Math.min(total + count, Integer.MAX_VALUE);
    }

    /** A single count in {@code [0, Integer.MAX_VALUE]}; other types and negatives read as 0. */
    private static long countOf(Object value) {
        long count;
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte) {
            count = ((Number) value).longValue();
        } else if (value instanceof BigInteger big) {
            count = big.bitLength() < Long.SIZE ? big.longValue() : Integer.MAX_VALUE;
        } else {
            count = 0;
        }
        return Math.min(Math.max(0, count), Integer.MAX_VALUE);
    }
}
