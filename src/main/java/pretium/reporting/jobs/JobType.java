package pretium.reporting.jobs;

import java.util.Arrays;
import java.util.Optional;

/**
 * Enumeration of the job types the queue accepts, keyed by the wire tag stored in {@code jobs.job_type}.
 *
 * <p>
 * Every value has a registered {@link JobHandler}. The image and document types are registered with handlers that
 * always fail until their processing exists, so enqueueing them yields a failed job rather than a rejected request.
 *
 * @see JobHandler for handler contract
 */
public enum JobType {

    /**
     * Drafts an AI-written inspection report from site photos, bullet points and project specifications.
     * <p>
     * <b>Handler:</b> GenerateReportJobHandler
     */
    GENERATE_REPORT("generate_report", "AI report generation from photos and notes"),

    /**
     * Bulk image processing for an existing report.
     * <p>
     * <b>Handler:</b> ProcessImagesJobHandler (not implemented, always fails)
     */
    PROCESS_IMAGES("process_images", "Image processing (not yet implemented)"),

    /**
     * Document export of a finished report.
     * <p>
     * <b>Handler:</b> ExportDocumentJobHandler (not implemented, always fails)
     */
    EXPORT_DOCUMENT("export_document", "Document export (not yet implemented)");

    private final String wireName;
    private final String description;

    JobType(String wireName, String description) {
        this.wireName = wireName;
        this.description = description;
    }

    /**
     * Returns the tag persisted in {@code jobs.job_type} and accepted on the enqueue boundary.
     */
    public String getWireName() {
        return wireName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolves a persisted or requested job type tag.
     *
     * @param wireName
     *            tag such as {@code generate_report}
     * @return matching type, empty when the tag is unknown or null
     */
    public static Optional<JobType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(type -> type.wireName.equals(wireName)).findFirst();
    }
}
