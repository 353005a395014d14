package io.proteus.events.core.config;

import java.util.List;
import java.util.Properties;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;

import static io.proteus.events.core.ObjectMappers.objectMapper;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

public class ConfigTest
{
    private ConfigFactory cf;
    private Config config;

    @Before
    public void setUp()
    {
        cf = new ConfigFactory(objectMapper());
        config = cf.create();
    }

    @Test
    public void testSetGetPrimitives()
    {
        config.set("int", 1);
        config.set("str", "s");
        config.set("bool", true);

        assertThat(config.get("int", int.class), is(1));
        assertThat(config.get("int", long.class), is(1L));
        assertThat(config.get("str", String.class), is("s"));
        assertThat(config.get("bool", boolean.class), is(true));
    }

    @Test
    public void verifyStringConvertsToPrimitives()
    {
        config.set("scheduler.enabled", "false");
        config.set("scheduler.shutdown-wait", "5");

        assertThat(config.get("scheduler.enabled", boolean.class, true), is(false));
        assertThat(config.get("scheduler.shutdown-wait", int.class), is(5));
    }

    @Test
    public void verifyDefaultsAndOptionals()
    {
        config.set("nothing", null);
        assertThat(config.has("nothing"), is(false));
        assertThat(config.get("missing", String.class, "default"), is("default"));
        assertThat(config.getOptional("missing", String.class), is(Optional.absent()));
        assertThat(config.getListOrEmpty("missing", String.class), is(ImmutableList.of()));

        config.set("list", ImmutableList.of("IT", "DE"));
        List<String> list = config.getListOrEmpty("list", String.class);
        assertThat(list, is(ImmutableList.of("IT", "DE")));
    }

    @Test
    public void missingRequiredKeyFails()
    {
        try {
            config.get("database.host", String.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("'database.host' is required"));
        }
    }

    @Test
    public void typeMismatchNamesTheKey()
    {
        config.set("scheduler.shutdown-wait", "soon");
        try {
            config.get("scheduler.shutdown-wait", int.class);
            fail();
        }
        catch (ConfigException ex) {
            assertThat(ex.getMessage(), containsString("Expected integer (int) type for key 'scheduler.shutdown-wait'"));
        }
    }

    @Test
    public void propertiesKeepDottedKeysFlat()
    {
        Properties props = new Properties();
        props.setProperty("database.type", "memory");
        props.setProperty("scheduler.enabled", "true");

        Config converted = PropertyUtils.toConfig(props, cf);
        assertThat(converted.get("database.type", String.class), is("memory"));
        assertThat(converted.has("database"), is(false));
    }
}
