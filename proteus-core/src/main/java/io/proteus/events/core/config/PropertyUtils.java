package io.proteus.events.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class PropertyUtils
{
    private PropertyUtils()
    { }

    public static Properties loadFile(Path file)
        throws IOException
    {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        }
        return props;
    }

    /**
     * Copies properties into a Config keeping the dotted keys flat,
     * so {@code database.type} stays a single key.
     */
    public static Config toConfig(Properties props, ConfigFactory cf)
    {
        Config config = cf.create();
        for (String key : props.stringPropertyNames()) {
            config.set(key, props.getProperty(key));
        }
        return config;
    }
}
