package io.proteus.events.core.task;

import java.util.List;

import com.google.inject.Inject;
import io.proteus.events.core.database.TransactionManager;
import io.proteus.events.core.probe.ProbeRegistry;
import io.proteus.events.core.probe.Target;
import io.proteus.events.core.schedule.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one firing of a job into one ready task per matching probe.
 *
 * Every insert commits on its own. A failure in the middle leaves the tasks
 * created so far in place.
 */
public class TaskMaterializer
{
    private static final Logger logger = LoggerFactory.getLogger(TaskMaterializer.class);

    private final TransactionManager tm;
    private final TaskStore taskStore;
    private final ProbeRegistry probeRegistry;
    private final TimeSource clock;

    @Inject
    public TaskMaterializer(
            TransactionManager tm,
            TaskStore taskStore,
            ProbeRegistry probeRegistry,
            TimeSource clock)
    {
        this.tm = tm;
        this.taskStore = taskStore;
        this.probeRegistry = probeRegistry;
        this.clock = clock;
    }

    /**
     * @return number of tasks created
     */
    public int materialize(Target target, TaskTemplate template)
    {
        List<String> probeIds = tm.autoCommit(() -> probeRegistry.resolveTargets(target));
        logger.info("Target countries={} platforms={} matched {} probes for test {}",
                target.getCountries(), target.getPlatforms(), probeIds.size(), template.getTestName());

        int created = 0;
        try {
            for (String probeId : probeIds) {
                tm.autoCommit(() -> taskStore.addTask(probeId, template, clock.now()));
                created++;
            }
        }
        catch (RuntimeException ex) {
            logger.error("Failed to materialize test {}: created {} of {} tasks",
                    template.getTestName(), created, probeIds.size(), ex);
            throw ex;
        }

        if (created > 0) {
            logger.info("Created {} tasks of test {}", created, template.getTestName());
        }
        return created;
    }
}
