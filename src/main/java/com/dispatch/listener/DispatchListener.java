package com.dispatch.listener;

import com.dispatch.listener.implementations.BrokerListener;
import com.dispatch.listener.implementations.ConsoleMessageConsumer;
import com.dispatch.listener.implementations.RabbitMQModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.name.Names;
import io.vertx.core.Vertx;
import lombok.extern.log4j.Log4j2;

import java.io.PrintStream;

/**
 * Prints every message routed to the configured queue until the process is stopped.
 * <p>
 * Startup and consumer failures are not handled: they are rethrown from {@link #main(String[])} once
 * Vert.x has been closed, which ends the process.
 */
@Log4j2
public class DispatchListener
{
    public static final String BANNER = "Waiting for events...";

    public static void main(String[] args)
    {
        ListenerConfiguration configuration = ListenerConfiguration.fromEnvironment();
        log.info("Starting listener {}", configuration);
        Injector injector = Guice.createInjector(new RabbitMQModule(configuration));
        try
        {
            run(injector);
        }
        finally
        {
            injector.getInstance(Vertx.class)
                    .close();
        }
    }

    static void run(Injector injector)
    {
        BrokerListener listener = injector.getInstance(BrokerListener.class);
        RabbitMQUtils.await(listener.listen());

        PrintStream out = injector.getInstance(Key.get(PrintStream.class, Names.named(ConsoleMessageConsumer.OUTPUT)));
        out.println(BANNER);
        out.flush();

        RabbitMQUtils.await(listener.terminated());
    }
}
