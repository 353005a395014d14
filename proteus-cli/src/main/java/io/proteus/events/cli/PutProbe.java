package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import io.proteus.events.core.ProteusEmbed;
import io.proteus.events.core.database.DatabaseProbeRegistry;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class PutProbe
    extends EmbedCommand
{
    @Parameter(names = {"--id"})
    String probeId = null;

    @Parameter(names = {"--country"})
    String country = null;

    @Parameter(names = {"--platform"})
    String platform = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }
        if (probeId == null || country == null || platform == null) {
            throw usage("--id, --country and --platform options are required");
        }

        try (ProteusEmbed embed = openEmbed()) {
            DatabaseProbeRegistry probes = embed.getInjector().getInstance(DatabaseProbeRegistry.class);
            embed.getTransactionManager().autoCommit(() -> {
                probes.putProbe(probeId, country, platform);
                return null;
            });
            out.println("Probe " + probeId + ": country=" + country + " platform=" + platform);
        }
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " probe --id ID --country CC --platform NAME");
        err.println("  Options:");
        showDatabaseOptions(err);
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
