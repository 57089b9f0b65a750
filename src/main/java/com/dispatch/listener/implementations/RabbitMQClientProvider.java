package com.dispatch.listener.implementations;

import com.dispatch.listener.ListenerConfiguration;
import com.dispatch.listener.implementations.def.AmqpAddress;
import com.google.inject.Inject;
import com.google.inject.Provider;
import io.vertx.core.Vertx;
import io.vertx.rabbitmq.RabbitMQClient;
import io.vertx.rabbitmq.RabbitMQOptions;
import lombok.extern.log4j.Log4j2;

/**
 * Builds the client from the configured connection string. The client is created disconnected;
 * {@link BrokerListener#listen()} starts it.
 */
@Log4j2
public class RabbitMQClientProvider implements Provider<RabbitMQClient>
{
    public static final String CONNECTION_NAME = "dispatch-listener";

    private final Vertx vertx;
    private final ListenerConfiguration configuration;

    @Inject
    public RabbitMQClientProvider(Vertx vertx, ListenerConfiguration configuration)
    {
        this.vertx = vertx;
        this.configuration = configuration;
    }

    @Override
    public RabbitMQClient get()
    {
        RabbitMQOptions options = toOptions(configuration);
        log.debug("Creating RabbitMQ client for {}:{} on virtual host '{}'", options.getHost(), options.getPort(), options.getVirtualHost());
        return RabbitMQClient.create(vertx, options);
    }

    public static RabbitMQOptions toOptions(ListenerConfiguration configuration)
    {
        RabbitMQOptions options = new RabbitMQOptions();
        AmqpAddress.parse(configuration.getConnectionString())
                   .applyTo(options);
        options.setConnectionName(CONNECTION_NAME);
        // a lost connection ends the process instead of being recovered
        options.setAutomaticRecoveryEnabled(false);
        options.setReconnectAttempts(0);
        return options;
    }
}
