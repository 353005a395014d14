package io.proteus.events.cli;

import com.beust.jcommander.Parameter;
import io.proteus.events.core.ProteusEmbed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;
import java.util.concurrent.CountDownLatch;

import static io.proteus.events.cli.SystemExitException.systemExit;

public class Server
    extends EmbedCommand
{
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    @Parameter(names = {"--disable-scheduler"})
    boolean disableScheduler = false;

    @Parameter(names = {"--shutdown-wait"})
    Integer shutdownWait = null;

    @Override
    public void main()
            throws Exception
    {
        if (!args.isEmpty()) {
            throw usage(null);
        }

        Properties props = buildSystemProperties();
        if (disableScheduler) {
            props.setProperty("scheduler.enabled", Boolean.toString(false));
        }
        if (shutdownWait != null) {
            props.setProperty("scheduler.shutdown-wait", Integer.toString(shutdownWait));
        }

        ProteusEmbed embed = new ProteusEmbed.Bootstrap()
            .setSystemConfig(props)
            .initialize();

        CountDownLatch closed = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down");
            try {
                embed.close();
            }
            finally {
                closed.countDown();
            }
        }, "shutdown"));

        logger.info("Server started");

        // job runners are daemon threads
        closed.await();
    }

    @Override
    public SystemExitException usage(String error)
    {
        err.println("Usage: " + programName + " server [options...]");
        err.println("  Options:");
        showDatabaseOptions(err);
        err.println("        --disable-scheduler          store jobs without running them");
        err.println("        --shutdown-wait SECONDS      wait for in-flight firings at shutdown (default: 30)");
        Main.showCommonOptions(env, err);
        return systemExit(error);
    }
}
