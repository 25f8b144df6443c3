package pretium.reporting.api.types;

import java.util.List;

/**
 * Result stored on a completed {@code generate_report} job.
 *
 * @param reportId
 *            report that was drafted
 * @param content
 *            final plain-text report
 * @param sections
 *            content parsed into numbered sections, default sections of the structure first
 * @param metadata
 *            generation statistics
 */
public record GeneratedReportType(String reportId, String content, List<ReportSectionType> sections,
        MetadataType metadata) {

    /**
     * @param reportType
     *            structure used for numbering
     * @param batches
     *            number of model calls made for photo batches
     * @param imageCount
     *            photos processed
     * @param finalReviewApplied
     *            false when the final edit failed and the raw draft was kept
     */
    public record MetadataType(String reportType, int batches, int imageCount, boolean finalReviewApplied) {
    }
}
