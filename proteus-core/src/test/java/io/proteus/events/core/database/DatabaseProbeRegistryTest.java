package io.proteus.events.core.database;

import com.google.common.collect.ImmutableList;
import io.proteus.events.core.probe.Target;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static io.proteus.events.core.database.DatabaseTestingUtils.setupDatabase;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class DatabaseProbeRegistryTest
{
    private DatabaseFactory factory;
    private DatabaseProbeRegistry registry;

    @Before
    public void setUp()
            throws Exception
    {
        factory = setupDatabase();
        registry = factory.getProbeRegistry();

        factory.autoCommit(() -> {
            registry.putProbe("p1", "IT", "android");
            registry.putProbe("p2", "IT", "ios");
            registry.putProbe("p3", "DE", "android");
            registry.putProbe("p4", "US", "desktop");
        });
    }

    @After
    public void destroy()
    {
        factory.close();
    }

    @Test
    public void emptyFilterMatchesEveryone()
            throws Exception
    {
        assertThat(factory.autoCommit(() -> registry.resolveTargets(Target.everyone())),
                contains("p1", "p2", "p3", "p4"));
    }

    @Test
    public void orWithinAxisAndAcrossAxes()
            throws Exception
    {
        assertThat(factory.autoCommit(() -> registry.resolveTargets(ImmutableList.of("IT", "DE"), ImmutableList.of())),
                contains("p1", "p2", "p3"));
        assertThat(factory.autoCommit(() -> registry.resolveTargets(ImmutableList.of(), ImmutableList.of("android"))),
                contains("p1", "p3"));
        assertThat(factory.autoCommit(() -> registry.resolveTargets(ImmutableList.of("IT", "US"), ImmutableList.of("android", "desktop"))),
                contains("p1", "p4"));
        assertThat(factory.autoCommit(() -> registry.resolveTargets(ImmutableList.of("FR"), ImmutableList.of())),
                is(empty()));
    }

    @Test
    public void putProbeUpdatesExisting()
            throws Exception
    {
        factory.autoCommit(() -> registry.putProbe("p2", "FR", "ios"));
        assertThat(factory.autoCommit(() -> registry.resolveTargets(ImmutableList.of("FR"), ImmutableList.of())),
                contains("p2"));
        assertThat(factory.autoCommit(() -> registry.getProbeIds()),
                contains("p1", "p2", "p3", "p4"));
    }
}
