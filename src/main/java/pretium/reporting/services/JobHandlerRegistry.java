package pretium.reporting.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.jobs.JobHandler;
import pretium.reporting.jobs.JobType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping {@link JobType} to its {@link JobHandler}, built once at startup from every CDI-managed handler.
 */
@ApplicationScoped
public class JobHandlerRegistry {

    private static final Logger LOG = Logger.getLogger(JobHandlerRegistry.class);

    private final Map<JobType, JobHandler> handlers;

    @Inject
    public JobHandlerRegistry(Instance<JobHandler> available) {
        this.handlers = buildRegistry(available);
        LOG.infof("Initialized job handler registry with %d handlers", handlers.size());
    }

    /**
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildRegistry(Iterable<JobHandler> available) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : available) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for %s", handler.getClass().getSimpleName(), type.getWireName());
        }
        return registry;
    }

    public Optional<JobHandler> find(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
