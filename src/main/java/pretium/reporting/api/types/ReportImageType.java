package pretium.reporting.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One site photo in a {@code generate_report} payload.
 *
 * @param url
 *            image URL or data URL sent to the model
 * @param description
 *            point-form notes written on site
 * @param group
 *            report subheading the photo belongs to, null for general observations
 * @param number
 *            photo number within its group, null when the author did not number it
 * @param tag
 *            {@code OVERVIEW} or {@code DEFICIENCY}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportImageType(String url, String description, String group, Integer number, String tag) {
}
