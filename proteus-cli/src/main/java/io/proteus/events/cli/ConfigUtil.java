package io.proteus.events.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

public class ConfigUtil
{
    private ConfigUtil()
    { }

    public static Path defaultConfigPath(Map<String, String> env)
    {
        return proteusConfigHome(env).resolve("config");
    }

    public static Path proteusConfigHome(Map<String, String> env)
    {
        String proteusConfigHomeEnv = env.get("PROTEUS_CONFIG_HOME");
        if (proteusConfigHomeEnv != null) {
            return Paths.get(proteusConfigHomeEnv);
        }
        return configHome(env).resolve("proteus");
    }

    private static Path configHome(Map<String, String> env)
    {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null) {
            return Paths.get(configHome);
        }
        return Paths.get(System.getProperty("user.home"), ".config");
    }
}
