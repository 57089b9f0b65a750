package com.dispatch.listener;

import com.dispatch.listener.implementations.ConsoleMessageConsumer;
import com.dispatch.listener.implementations.RabbitMQModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class DispatchListenerTest
{
    @Container
    private static final RabbitMQContainer rabbit = new RabbitMQContainer(DockerImageName.parse("rabbitmq:3.12-management-alpine"));

    @Test
    void printsBannerThenMessages() throws Exception
    {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ListenerConfiguration configuration = ListenerConfiguration.fromMap(Map.of(
                ListenerConfiguration.CONNECTION_STRING_VARIABLE,
                "amqp://guest:guest@" + rabbit.getHost() + ":" + rabbit.getAmqpPort() + "/"));
        Injector injector = Guice.createInjector(new RabbitMQModule(configuration, ConsoleMessageConsumer.class,
                new PrintStream(output, true, StandardCharsets.UTF_8)));

        Thread listenerThread = new Thread(() -> DispatchListener.run(injector), "dispatch-listener");
        listenerThread.setDaemon(true);
        listenerThread.start();
        try
        {
            String banner = DispatchListener.BANNER + System.lineSeparator();
            awaitOutput(output, banner);

            RabbitMQUtils.await(injector.getInstance(QueuePublisher.class)
                                        .publish("hello"), 10, TimeUnit.SECONDS);

            awaitOutput(output, banner + "hello" + System.lineSeparator());
            assertTrue(listenerThread.isAlive());
        }
        finally
        {
            RabbitMQUtils.await(injector.getInstance(Vertx.class)
                                        .close(), 10, TimeUnit.SECONDS);
        }
    }

    private static void awaitOutput(ByteArrayOutputStream output, String expected) throws InterruptedException
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!output.toString(StandardCharsets.UTF_8)
                      .equals(expected) && System.nanoTime() < deadline)
        {
            TimeUnit.MILLISECONDS.sleep(50);
        }
        assertEquals(expected, output.toString(StandardCharsets.UTF_8));
    }
}
