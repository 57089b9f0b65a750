package com.dispatch.listener.implementations;

import com.dispatch.listener.implementations.def.BrokerTopology;
import com.google.inject.Inject;
import com.rabbitmq.client.AMQP;
import io.vertx.core.Future;
import io.vertx.rabbitmq.RabbitMQClient;
import lombok.extern.log4j.Log4j2;

/**
 * Declares the exchange, then the queue, then the binding between them.
 * <p>
 * Declarations use the same arguments every time so running this again against a broker that
 * already holds the topology is a no-op.
 */
@Log4j2
public class TopologyDeclarer
{
    private final RabbitMQClient client;

    @Inject
    public TopologyDeclarer(RabbitMQClient client)
    {
        this.client = client;
    }

    public Future<Void> declare(BrokerTopology topology)
    {
        return declareExchange(topology)
                .compose(v -> declareQueue(topology))
                .compose(declareOk -> bindQueue(topology));
    }

    Future<Void> declareExchange(BrokerTopology topology)
    {
        return client.exchangeDeclare(topology.getExchange(), topology.getExchangeType()
                                                                      .toString(), topology.isDurable(), topology.isAutoDelete())
                     .onSuccess(v -> log.info("Exchange '{}' ({}) declared successfully.", topology.getExchange(), topology.getExchangeType()))
                     .onFailure(error -> log.error("Failed to declare exchange '{}': {}", topology.getExchange(), error.getMessage()));
    }

    Future<AMQP.Queue.DeclareOk> declareQueue(BrokerTopology topology)
    {
        return client.queueDeclare(topology.getQueue(), topology.isDurable(), topology.isExclusive(), topology.isAutoDelete())
                     .onSuccess(declareOk -> log.info("Queue '{}' declared successfully.", declareOk.getQueue()))
                     .onFailure(error -> log.error("Failed to declare queue '{}': {}", topology.getQueue(), error.getMessage()));
    }

    Future<Void> bindQueue(BrokerTopology topology)
    {
        return client.queueBind(topology.getQueue(), topology.getExchange(), topology.getRoutingKey())
                     .onSuccess(v -> log.info("Queue '{}' bound to exchange '{}' with routing key '{}'.",
                             topology.getQueue(), topology.getExchange(), topology.getRoutingKey()))
                     .onFailure(error -> log.error("Failed to bind queue '{}' to exchange '{}': {}",
                             topology.getQueue(), topology.getExchange(), error.getMessage()));
    }
}
