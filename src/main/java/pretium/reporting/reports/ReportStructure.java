package pretium.reporting.reports;

import pretium.reporting.api.types.ReportSectionType;

import java.util.List;
import java.util.Optional;

/**
 * Capabilities of one kind of report layout. Implementations are CDI beans collected by
 * {@link ReportStructureRegistry} and selected by {@link #reportType()}.
 */
public interface ReportStructure {

    /**
     * Key matched against the {@code reportType} field of a {@code generate_report} payload.
     */
    String reportType();

    /**
     * Checks parsed sections against the layout's shape.
     *
     * @param sections
     *            sections to check
     * @throws pretium.reporting.exceptions.ValidationException
     *             describing the first offending section
     */
    void validate(List<ReportSectionType> sections);

    /**
     * Returns a copy of the tree with display numbers assigned.
     */
    List<ReportSectionType> autoNumber(List<ReportSectionType> sections);

    /**
     * Sections every report of this kind starts with.
     */
    List<ReportSectionType> defaultSections();

    /**
     * Custom renderer key for a section, empty when the default renderer applies.
     */
    Optional<String> rendererHint(ReportSectionType section);
}
