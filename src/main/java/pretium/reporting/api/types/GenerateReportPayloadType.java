package pretium.reporting.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Payload of a {@code generate_report} job.
 *
 * @param reportId
 *            report being drafted
 * @param projectId
 *            project whose specifications are searched, optional
 * @param bulletPoints
 *            author instructions for the final edit
 * @param contractName
 *            contract the report belongs to
 * @param location
 *            site location
 * @param reportType
 *            report structure key, {@code observation} when absent
 * @param images
 *            site photos, at least one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerateReportPayloadType(String reportId, String projectId, String bulletPoints, String contractName,
        String location, String reportType, List<ReportImageType> images) {
}
