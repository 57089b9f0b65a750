package com.dispatch.listener.implementations;

import io.vertx.core.buffer.Buffer;
import org.junit.jupiter.api.Test;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleMessageConsumerTest
{
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final ConsoleMessageConsumer consumer = new ConsoleMessageConsumer(new PrintStream(new BufferedOutputStream(output), false, StandardCharsets.UTF_8));

    @Test
    void printsEachBodyOnItsOwnLine()
    {
        consumer.print(Buffer.buffer("a"));
        consumer.print(Buffer.buffer("b"));

        assertEquals("a" + System.lineSeparator() + "b" + System.lineSeparator(), output.toString(StandardCharsets.UTF_8));
    }

    @Test
    void flushesAfterEveryMessage()
    {
        consumer.print(Buffer.buffer("hello"));

        assertEquals("hello" + System.lineSeparator(), output.toString(StandardCharsets.UTF_8));
    }

    @Test
    void decodesBodyAsUtf8()
    {
        consumer.print(Buffer.buffer("zürich ✓".getBytes(StandardCharsets.UTF_8)));

        assertEquals("zürich ✓" + System.lineSeparator(), output.toString(StandardCharsets.UTF_8));
    }
}
