package com.dispatch.listener;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentTest
{
    private static Properties properties(String name, String value)
    {
        Properties properties = new Properties();
        properties.setProperty(name, value);
        return properties;
    }

    @Test
    void unsetNameFallsBackToDefault()
    {
        Environment environment = new Environment(new Properties(), Map.of());

        assertNull(environment.get("RabbitMq__Exchange"));
        assertEquals("dispatch", environment.get("RabbitMq__Exchange", "dispatch"));
    }

    @Test
    void emptyValueIsReturnedAsIs()
    {
        Environment environment = new Environment(new Properties(), Map.of("RabbitMq__Exchange", ""));

        assertEquals("", environment.get("RabbitMq__Exchange", "dispatch"));
    }

    @Test
    void systemPropertyWinsOverEnvironmentVariable()
    {
        Environment environment = new Environment(properties("RabbitMq__Exchange", "from.property"),
                Map.of("RabbitMq__Exchange", "from.variable"));

        assertEquals("from.property", environment.get("RabbitMq__Exchange", "dispatch"));
    }

    @Test
    void environmentVariableUsedWhenNoPropertyIsSet()
    {
        Environment environment = new Environment(properties("unrelated", "x"), Map.of("RabbitMq__Exchange", "from.variable"));

        assertEquals("from.variable", environment.get("RabbitMq__Exchange", "dispatch"));
    }
}
