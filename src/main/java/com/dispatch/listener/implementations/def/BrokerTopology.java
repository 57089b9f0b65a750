package com.dispatch.listener.implementations.def;

import com.dispatch.listener.ExchangeType;
import com.dispatch.listener.ListenerConfiguration;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The exchange, queue and binding the listener declares before it consumes
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class BrokerTopology
{
    private final String exchange;
    private final ExchangeType exchangeType;
    private final boolean durable;
    private final boolean autoDelete;

    private final String queue;
    private final boolean exclusive;

    private final String routingKey;

    /**
     * A direct, non-durable exchange, and a non-durable queue named after the routing key
     */
    public static BrokerTopology from(ListenerConfiguration configuration)
    {
        return new BrokerTopology(configuration.getExchange(), ExchangeType.Direct, false, false,
                configuration.getRoutingKey(), false,
                configuration.getRoutingKey());
    }
}
