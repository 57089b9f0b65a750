package com.dispatch.listener;

import io.vertx.rabbitmq.RabbitMQMessage;

public interface QueueConsumer
{
    /**
     * Handles a message. Deliveries arrive one at a time, in broker order, already acknowledged.
     *
     * @param message The delivered message
     */
    void consume(RabbitMQMessage message);
}
