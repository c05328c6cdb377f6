package com.acme.pipeline;

import io.micronaut.runtime.Micronaut;

/**
 * Document pipeline worker. Consumes classification jobs from RabbitMQ, classifies each document
 * through the ML service and drains the dead-letter queue. Run several instances to scale out.
 */
public class WorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(WorkerApplication.class, args);
    }
}
