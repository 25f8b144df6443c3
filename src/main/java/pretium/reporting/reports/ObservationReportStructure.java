package pretium.reporting.reports;

import jakarta.enterprise.context.ApplicationScoped;
import pretium.reporting.api.types.ReportSectionType;
import pretium.reporting.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Site observation report: a location plan and staging area followed by observations grouped under numbered
 * subheadings.
 *
 * <p>
 * Numbering: top-level sections are {@code 1.}, {@code 2.}; nested sections drop the trailing period and append their
 * position ({@code 1.1}, {@code 1.1.2}).
 */
@ApplicationScoped
public class ObservationReportStructure implements ReportStructure {

    public static final String REPORT_TYPE = "observation";

    static final String HINT_LOCATION_PLAN = "locationPlan";
    static final String HINT_STAGING_AREA = "stagingArea";

    private static final Set<String> KNOWN_HINTS = Set.of(HINT_LOCATION_PLAN, HINT_STAGING_AREA);

    @Override
    public String reportType() {
        return REPORT_TYPE;
    }

    @Override
    public void validate(List<ReportSectionType> sections) {
        for (ReportSectionType section : sections) {
            if (section == null) {
                throw new ValidationException("Observation report contains an empty section");
            }
            boolean hasTitle = section.title() != null && !section.title().isBlank();
            boolean hasBody = section.body() != null && !section.body().isEmpty();
            if (!hasTitle && !hasBody) {
                throw new ValidationException("Observation report section has neither title nor body");
            }
            for (ReportSectionType.ImageRefType image : section.images()) {
                if (image.number() < 1) {
                    throw new ValidationException("Image reference must be numbered from 1: " + image.number());
                }
            }
            validate(section.children());
        }
    }

    @Override
    public List<ReportSectionType> autoNumber(List<ReportSectionType> sections) {
        return number(sections, "");
    }

    private List<ReportSectionType> number(List<ReportSectionType> sections, String parentNumber) {
        List<ReportSectionType> numbered = new ArrayList<>(sections.size());
        for (int i = 0; i < sections.size(); i++) {
            String num = parentNumber.isEmpty() ? (i + 1) + "."
                    : parentNumber.replaceAll("\\.$", "") + "." + (i + 1);
            ReportSectionType section = sections.get(i);
            numbered.add(section.withNumber(num).withChildren(number(section.children(), num)));
        }
        return numbered;
    }

    @Override
    public List<ReportSectionType> defaultSections() {
        return List.of(
                new ReportSectionType("", "Location Plan", List.of("Location plan content goes here."), List.of(),
                        HINT_LOCATION_PLAN, List.of()),
                new ReportSectionType("", "Staging Area", List.of("Staging area content goes here."), List.of(),
                        HINT_STAGING_AREA, List.of()));
    }

    @Override
    public Optional<String> rendererHint(ReportSectionType section) {
        return Optional.ofNullable(section.displayHint()).filter(KNOWN_HINTS::contains);
    }
}
