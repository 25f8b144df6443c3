package pretium.reporting.reports;

import pretium.reporting.api.types.ReportSectionType;
import pretium.reporting.api.types.ReportSectionType.ImageRefType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits model output into sections. Subheadings look like {@code 2. Roofing}; observations look like
 * {@code 2.1 Membrane seams lapped 150 mm [IMAGE:1:Roofing]}. Text before the first subheading goes under
 * "General Observations".
 */
public final class ReportTextParser {

    static final String GENERAL_OBSERVATIONS = "General Observations";

    private static final Pattern SUBHEADING = Pattern.compile("^\\d+\\.\\s+(\\S.*)$");
    private static final Pattern BULLET = Pattern.compile("^\\d+\\.\\d+(?:\\.\\d+)*\\.?\\s+(\\S.*)$");
    private static final Pattern IMAGE_REF = Pattern.compile("\\[IMAGE:(\\d+):([^\\]]*)\\]");

    private ReportTextParser() {
        // Utility class, no instantiation
    }

    public static List<ReportSectionType> parse(String content) {
        List<ReportSectionType> sections = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return sections;
        }

        String title = null;
        List<String> intro = new ArrayList<>();
        List<ReportSectionType> bullets = new ArrayList<>();

        for (String rawLine : content.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                bullets.add(observation(bullet.group(1)));
                continue;
            }
            Matcher heading = SUBHEADING.matcher(line);
            if (heading.matches()) {
                if (title != null || !intro.isEmpty() || !bullets.isEmpty()) {
                    sections.add(heading(title, intro, bullets));
                }
                title = heading.group(1);
                intro = new ArrayList<>();
                bullets = new ArrayList<>();
                continue;
            }
            if (!bullets.isEmpty()) {
                // continuation of the previous observation
                ReportSectionType last = bullets.remove(bullets.size() - 1);
                bullets.add(observation(String.join(" ", last.body()) + " " + line));
            } else {
                intro.add(line);
            }
        }
        if (title != null || !intro.isEmpty() || !bullets.isEmpty()) {
            sections.add(heading(title, intro, bullets));
        }
        return sections;
    }

    private static ReportSectionType heading(String title, List<String> intro, List<ReportSectionType> bullets) {
        return new ReportSectionType("", title != null ? title : GENERAL_OBSERVATIONS, List.copyOf(intro), List.of(),
                null, List.copyOf(bullets));
    }

    private static ReportSectionType observation(String text) {
        List<ImageRefType> images = new ArrayList<>();
        Matcher matcher = IMAGE_REF.matcher(text);
        while (matcher.find()) {
            images.add(new ImageRefType(Integer.parseInt(matcher.group(1)), matcher.group(2).strip()));
        }
        return new ReportSectionType("", null, List.of(text), List.copyOf(images), null, List.of());
    }
}
