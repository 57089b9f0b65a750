package com.dispatch.listener;

import java.util.Map;
import java.util.Properties;

/**
 * Reads a setting from the JVM system properties first, then from the environment variables.
 * <p>
 * A value that is set but empty is returned as-is, only an unset name falls back to the default.
 */
public final class Environment
{
    private static final Environment SYSTEM = new Environment(System.getProperties(), System.getenv());

    private final Properties properties;
    private final Map<String, String> variables;

    public Environment(Properties properties, Map<String, String> variables)
    {
        this.properties = properties;
        this.variables = variables;
    }

    public static Environment system()
    {
        return SYSTEM;
    }

    /**
     * @return the value, or null when neither a system property nor an environment variable carries the name
     */
    public String get(String name)
    {
        String value = properties.getProperty(name);
        if (value == null)
        {
            value = variables.get(name);
        }
        return value;
    }

    public String get(String name, String defaultValue)
    {
        String value = get(name);
        return value == null ? defaultValue : value;
    }
}
