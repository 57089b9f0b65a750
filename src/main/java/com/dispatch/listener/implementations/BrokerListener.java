package com.dispatch.listener.implementations;

import com.dispatch.listener.QueueConsumer;
import com.dispatch.listener.implementations.def.BrokerTopology;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.rabbitmq.QueueOptions;
import io.vertx.rabbitmq.RabbitMQClient;
import io.vertx.rabbitmq.RabbitMQConsumer;
import io.vertx.rabbitmq.RabbitMQMessage;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Connects, declares the topology and hands every delivery on the queue to the {@link QueueConsumer}.
 * <p>
 * The consumer runs with automatic acknowledgement. Deliveries are handled one at a time on the client's
 * context, so the consumer sees them in the order the broker sent them.
 */
@Singleton
@Log4j2
public class BrokerListener
{
    private final RabbitMQClient client;
    private final TopologyDeclarer topologyDeclarer;
    private final BrokerTopology topology;
    private final QueueConsumer queueConsumer;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Promise<Void> terminated = Promise.promise();

    @Getter
    private RabbitMQConsumer consumer;

    @Inject
    public BrokerListener(RabbitMQClient client, TopologyDeclarer topologyDeclarer, BrokerTopology topology, QueueConsumer queueConsumer)
    {
        this.client = client;
        this.topologyDeclarer = topologyDeclarer;
        this.topology = topology;
        this.queueConsumer = queueConsumer;
    }

    /**
     * Completes once the consumer is registered on the queue
     */
    public Future<RabbitMQConsumer> listen()
    {
        if (!started.compareAndSet(false, true))
        {
            return Future.failedFuture(new IllegalStateException("Listener on queue [" + topology.getQueue() + "] is already started"));
        }
        return connect()
                .compose(v -> topologyDeclarer.declare(topology))
                .compose(v -> client.basicConsumer(topology.getQueue(), toOptions()))
                .onSuccess(this::setupConsumer)
                .onFailure(error -> terminated.tryFail(error));
    }

    /**
     * Fails when the consumer stream ends or breaks. It never completes successfully.
     */
    public Future<Void> terminated()
    {
        return terminated.future();
    }

    private Future<Void> connect()
    {
        if (client.isConnected())
        {
            return Future.succeededFuture();
        }
        return client.start()
                     .onSuccess(v -> log.info("RabbitMQ successfully connected"))
                     .onFailure(error -> log.error("Fail to connect to RabbitMQ - {}", error.getMessage()));
    }

    static QueueOptions toOptions()
    {
        QueueOptions options = new QueueOptions();
        options.setAutoAck(true);
        options.setKeepMostRecent(false);
        return options;
    }

    private void setupConsumer(RabbitMQConsumer consumer)
    {
        this.consumer = consumer;
        log.debug("RabbitMQ consumer {} for queue '{}' setting up.", consumer.consumerTag(), topology.getQueue());
        consumer.exceptionHandler(error -> {
            log.error("Consumer on queue '{}' failed", topology.getQueue(), error);
            terminated.tryFail(error);
        });
        consumer.endHandler(v -> {
            log.warn("Consumer on queue '{}' has ended", topology.getQueue());
            terminated.tryFail(new IllegalStateException("Consumer on queue [" + topology.getQueue() + "] ended"));
        });
        consumer.handler(this::processMessage);
    }

    void processMessage(RabbitMQMessage message)
    {
        try
        {
            queueConsumer.consume(message);
        }
        catch (RuntimeException e)
        {
            log.error("Error processing message for queue '{}'", topology.getQueue(), e);
            throw e;
        }
    }
}
