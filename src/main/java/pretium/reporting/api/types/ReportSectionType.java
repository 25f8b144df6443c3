package pretium.reporting.api.types;

import java.util.List;

/**
 * A numbered section of a generated report.
 *
 * @param number
 *            display number assigned by the report structure ({@code 1.}, {@code 1.2})
 * @param title
 *            heading, null for observation bullets
 * @param body
 *            paragraphs of plain text
 * @param images
 *            photo references found in the body
 * @param displayHint
 *            renderer hint for sections with a custom layout, null otherwise
 * @param children
 *            nested sections
 */
public record ReportSectionType(String number, String title, List<String> body, List<ImageRefType> images,
        String displayHint, List<ReportSectionType> children) {

    /**
     * Photo reference in the form {@code [IMAGE:<number>:<group>]}.
     */
    public record ImageRefType(int number, String group) {
    }

    public ReportSectionType withNumber(String newNumber) {
        return new ReportSectionType(newNumber, title, body, images, displayHint, children);
    }

    public ReportSectionType withChildren(List<ReportSectionType> newChildren) {
        return new ReportSectionType(number, title, body, images, displayHint, newChildren);
    }
}
