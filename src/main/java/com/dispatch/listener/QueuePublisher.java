package com.dispatch.listener;

import com.dispatch.listener.implementations.def.BrokerTopology;
import com.google.inject.Inject;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.rabbitmq.RabbitMQClient;
import lombok.EqualsAndHashCode;
import lombok.extern.log4j.Log4j2;

import java.nio.charset.StandardCharsets;

/**
 * Publishes text bodies to the listener's exchange, with its routing key unless told otherwise
 */
@EqualsAndHashCode(of = {"exchangeName", "routingKey"})
@Log4j2
public class QueuePublisher
{
    private final RabbitMQClient client;
    private final String exchangeName;
    private final String routingKey;

    @Inject
    public QueuePublisher(RabbitMQClient client, BrokerTopology topology)
    {
        this(client, topology.getExchange(), topology.getRoutingKey());
    }

    public QueuePublisher(RabbitMQClient client, String exchangeName, String routingKey)
    {
        this.client = client;
        this.exchangeName = exchangeName;
        this.routingKey = routingKey;
    }

    public Future<Void> publish(String body)
    {
        return publish(routingKey, body);
    }

    public Future<Void> publish(String routingKey, String body)
    {
        Buffer message = Buffer.buffer(body.getBytes(StandardCharsets.UTF_8));
        log.trace("Message publishing to exchange {} with routing key {} - {}", exchangeName, routingKey, body);
        return client.basicPublish(exchangeName, routingKey, message)
                     .onSuccess(v -> log.trace("Message published to exchange {} with routing key {}", exchangeName, routingKey))
                     .onFailure(t -> log.error("Failed to publish message to exchange {} with routing key {}", exchangeName, routingKey, t));
    }
}
