package io.proteus.events.core.database.migrate;

import org.jdbi.v3.core.Handle;

public class Migration_20161020103000_CreateTables
        implements Migration
{
    @Override
    public void migrate(Handle handle, MigrationContext context)
    {
        // jobs
        handle.execute(
                context.newCreateTableBuilder("jobs")
                .addStringId("id")
                .addMediumText("comment", "")
                .addString("schedule", "not null")
                .addLong("delay", "not null")
                .addMediumText("target_countries", "")
                .addMediumText("target_platforms", "")
                .addString("task_test_name", "not null")
                .addMediumText("task_arguments", "")
                .addInt("times_run", "not null")
                .addTimestamp("next_run_at", "not null")
                .addBoolean("is_done", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create index jobs_on_is_done on jobs (is_done)");

        // tasks
        handle.execute(
                context.newCreateTableBuilder("tasks")
                .addStringId("id")
                .addString("probe_id", "not null")
                .addString("test_name", "not null")
                .addMediumText("arguments", "")
                .addShort("state", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .addTimestamp("notify_time", "")
                .addTimestamp("accept_time", "")
                .addTimestamp("done_time", "")
                .build());
        handle.execute("create index tasks_on_state_and_probe_id_and_created_at on tasks (state, probe_id, created_at)");

        // probes
        handle.execute(
                context.newCreateTableBuilder("probes")
                .addStringId("id")
                .addString("country", "not null")
                .addString("platform", "not null")
                .addTimestamp("created_at", "not null")
                .addTimestamp("updated_at", "not null")
                .build());
        handle.execute("create index probes_on_country_and_platform on probes (country, platform)");
    }
}
