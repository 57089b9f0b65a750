package com.dispatch.listener.implementations;

import com.dispatch.listener.QueueConsumer;
import com.google.inject.Inject;
import com.google.inject.name.Named;
import io.vertx.core.buffer.Buffer;
import io.vertx.rabbitmq.RabbitMQMessage;
import lombok.extern.log4j.Log4j2;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Writes every message body to the output stream as UTF-8 text, one line per message, flushing after each
 */
@Log4j2
public class ConsoleMessageConsumer implements QueueConsumer
{
    public static final String OUTPUT = "listener.output";

    private final PrintStream out;

    @Inject
    public ConsoleMessageConsumer(@Named(OUTPUT) PrintStream out)
    {
        this.out = out;
    }

    @Override
    public void consume(RabbitMQMessage message)
    {
        if (log.isTraceEnabled() && message.envelope() != null)
        {
            log.trace("Delivery {} on routing key '{}'", message.envelope()
                                                               .getDeliveryTag(), message.envelope()
                                                                                         .getRoutingKey());
        }
        print(message.body());
    }

    void print(Buffer body)
    {
        out.println(body.toString(StandardCharsets.UTF_8));
        out.flush();
    }
}
