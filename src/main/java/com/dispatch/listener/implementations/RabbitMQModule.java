package com.dispatch.listener.implementations;

import com.dispatch.listener.ListenerConfiguration;
import com.dispatch.listener.QueueConsumer;
import com.dispatch.listener.QueuePublisher;
import com.dispatch.listener.implementations.def.BrokerTopology;
import com.google.inject.AbstractModule;
import com.google.inject.Key;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.inject.name.Names;
import io.vertx.core.Vertx;
import io.vertx.rabbitmq.RabbitMQClient;
import lombok.extern.log4j.Log4j2;

import java.io.PrintStream;

@Log4j2
public class RabbitMQModule extends AbstractModule
{
    private final ListenerConfiguration configuration;
    private final Class<? extends QueueConsumer> consumerClass;
    private final PrintStream output;

    public RabbitMQModule(ListenerConfiguration configuration)
    {
        this(configuration, ConsoleMessageConsumer.class, System.out);
    }

    public RabbitMQModule(ListenerConfiguration configuration, Class<? extends QueueConsumer> consumerClass, PrintStream output)
    {
        this.configuration = configuration;
        this.consumerClass = consumerClass;
        this.output = output;
    }

    @Override
    protected void configure()
    {
        log.debug("Configuring listener module with {}", configuration);
        bind(ListenerConfiguration.class).toInstance(configuration);
        bind(BrokerTopology.class).toInstance(BrokerTopology.from(configuration));
        bind(Key.get(PrintStream.class, Names.named(ConsoleMessageConsumer.OUTPUT))).toInstance(output);

        bind(RabbitMQClient.class).toProvider(RabbitMQClientProvider.class)
                                  .in(Singleton.class);
        bind(consumerClass).in(Singleton.class);
        bind(QueueConsumer.class).to(consumerClass);
        bind(TopologyDeclarer.class).in(Singleton.class);
        bind(QueuePublisher.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    Vertx vertx()
    {
        return Vertx.vertx();
    }
}
