package com.dispatch.listener.implementations.def;

import com.google.common.base.Strings;
import io.vertx.rabbitmq.RabbitMQOptions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

/**
 * A broker address parsed from an {@code amqp://} or {@code amqps://} URL.
 * <p>
 * An empty path or a single {@code /} selects the default virtual host {@code /}.
 * Credentials are only present when the URL carries user info.
 */
@Getter
@EqualsAndHashCode
@ToString(exclude = "password")
public final class AmqpAddress
{
    public static final String DEFAULT_VIRTUAL_HOST = "/";
    public static final int AMQP_PORT = 5672;
    public static final int AMQPS_PORT = 5671;

    private final boolean secure;
    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String virtualHost;

    AmqpAddress(boolean secure, String host, int port, String user, String password, String virtualHost)
    {
        this.secure = secure;
        this.host = host;
        this.port = port;
        this.user = user;
        this.password = password;
        this.virtualHost = virtualHost;
    }

    public static AmqpAddress parse(String connectionString)
    {
        if (Strings.isNullOrEmpty(connectionString))
        {
            throw new IllegalArgumentException("Connection string cannot be empty");
        }
        URI uri;
        try
        {
            uri = new URI(connectionString.trim());
        }
        catch (URISyntaxException e)
        {
            throw new IllegalArgumentException("Malformed broker connection string", e);
        }

        String scheme = uri.getScheme();
        boolean secure;
        if ("amqp".equalsIgnoreCase(scheme))
        {
            secure = false;
        }
        else if ("amqps".equalsIgnoreCase(scheme))
        {
            secure = true;
        }
        else
        {
            throw new IllegalArgumentException("Unsupported broker connection scheme [" + scheme + "], expected amqp or amqps");
        }

        String host = uri.getHost();
        if (Strings.isNullOrEmpty(host))
        {
            throw new IllegalArgumentException("Broker connection string has no host");
        }
        int port = uri.getPort() == -1 ? (secure ? AMQPS_PORT : AMQP_PORT) : uri.getPort();

        String user = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (!Strings.isNullOrEmpty(userInfo))
        {
            user = decode(StringUtils.substringBefore(userInfo, ":"));
            if (userInfo.contains(":"))
            {
                password = decode(StringUtils.substringAfter(userInfo, ":"));
            }
        }

        return new AmqpAddress(secure, host, port, user, password, virtualHost(uri.getRawPath()));
    }

    private static String virtualHost(String rawPath)
    {
        String path = StringUtils.removeStart(Strings.nullToEmpty(rawPath), "/");
        if (path.isEmpty())
        {
            return DEFAULT_VIRTUAL_HOST;
        }
        if (path.contains("/"))
        {
            throw new IllegalArgumentException("Broker connection string path [" + rawPath + "] must name a single virtual host");
        }
        return decode(path);
    }

    private static String decode(String value)
    {
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    /**
     * Copies this address onto client options, leaving the client defaults for anything the URL did not carry
     */
    public RabbitMQOptions applyTo(RabbitMQOptions options)
    {
        options.setHost(host);
        options.setPort(port);
        options.setVirtualHost(virtualHost);
        if (user != null)
        {
            options.setUser(user);
        }
        if (password != null)
        {
            options.setPassword(password);
        }
        if (secure)
        {
            options.setSsl(true);
        }
        return options;
    }
}
