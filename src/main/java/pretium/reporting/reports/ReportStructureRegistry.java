package pretium.reporting.reports;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.exceptions.ValidationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Looks up the {@link ReportStructure} for a report type. Built once from every {@link ReportStructure} bean.
 */
@ApplicationScoped
public class ReportStructureRegistry {

    private static final Logger LOG = Logger.getLogger(ReportStructureRegistry.class);

    private final Map<String, ReportStructure> structures = new HashMap<>();

    @Inject
    public ReportStructureRegistry(Instance<ReportStructure> available) {
        for (ReportStructure structure : available) {
            ReportStructure existing = structures.putIfAbsent(structure.reportType(), structure);
            if (existing != null) {
                throw new IllegalStateException("Duplicate report structures for type " + structure.reportType()
                        + ": " + existing.getClass().getName() + " and " + structure.getClass().getName());
            }
        }
        LOG.infof("Registered %d report structures: %s", structures.size(), structures.keySet());
    }

    /**
     * Resolves a report type, falling back to {@link ObservationReportStructure#REPORT_TYPE} when none is given.
     *
     * @throws ValidationException
     *             if the type is not registered
     */
    public ReportStructure forType(String reportType) {
        String key = reportType == null || reportType.isBlank() ? ObservationReportStructure.REPORT_TYPE : reportType;
        ReportStructure structure = structures.get(key);
        if (structure == null) {
            throw new ValidationException("Unknown report type: " + key);
        }
        return structure;
    }

    public boolean supports(String reportType) {
        return reportType == null || reportType.isBlank() || structures.containsKey(reportType);
    }
}
