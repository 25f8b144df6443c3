package pretium.reporting.services;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import pretium.reporting.api.types.GenerateReportPayloadType;
import pretium.reporting.api.types.GeneratedReportType;
import pretium.reporting.api.types.ReportImageType;
import pretium.reporting.api.types.ReportSectionType;
import pretium.reporting.api.types.SpecificationMatchType;
import pretium.reporting.exceptions.ReportGenerationException;
import pretium.reporting.exceptions.ValidationException;
import pretium.reporting.integration.knowledge.SpecificationSearchClient;
import pretium.reporting.reports.ReportStructure;
import pretium.reporting.reports.ReportStructureRegistry;
import pretium.reporting.reports.ReportTextParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drafts an observation report from site photos with the report {@link ChatModel}.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>Photos are split into batches of {@value #BATCH_SIZE}</li>
 * <li>For each photo, up to {@value #SPECIFICATIONS_PER_IMAGE} specification chunks are looked up by its
 * description</li>
 * <li>Each batch is one model call with the photo-writing prompt, the photo notes and the images; a failed batch fails
 * the whole report</li>
 * <li>The batch drafts are joined and sent through a final review call with the author's bullet points; if that call
 * fails the joined draft is kept with a note</li>
 * <li>The text is parsed into sections, prefixed with the structure's default sections and numbered</li>
 * </ol>
 */
@ApplicationScoped
public class ReportGenerationService {

    private static final Logger LOG = Logger.getLogger(ReportGenerationService.class);

    static final int BATCH_SIZE = 5;
    static final int SPECIFICATIONS_PER_IMAGE = 2;

    private static final Pattern DATA_URL = Pattern.compile("^data:([^;,]+);base64,(.+)$", Pattern.DOTALL);

    @Inject
    ChatModel chatModel;

    @Inject
    SpecificationSearchClient specificationSearchClient;

    @Inject
    ReportStructureRegistry structureRegistry;

    /**
     * Rejects payloads that can never produce a report.
     *
     * @throws ValidationException
     *             if the report id or photos are missing, or the report type is unknown
     */
    public void validate(GenerateReportPayloadType request) {
        if (request.reportId() == null || request.reportId().isBlank()) {
            throw new ValidationException("reportId is required for report generation");
        }
        if (request.images() == null || request.images().isEmpty()) {
            throw new ValidationException("No images provided for report generation");
        }
        for (ReportImageType image : request.images()) {
            if (image == null || image.url() == null || image.url().isBlank()) {
                throw new ValidationException("Every image needs a url");
            }
        }
        if (!structureRegistry.supports(request.reportType())) {
            throw new ValidationException("Unknown report type: " + request.reportType());
        }
    }

    /**
     * Generates the report.
     *
     * @param jobId
     *            job the draft belongs to, for logging
     * @param request
     *            report parameters and photos
     * @return final text, numbered sections and generation metadata
     * @throws ValidationException
     *             if the payload is unusable
     * @throws ReportGenerationException
     *             if a photo batch fails
     */
    public GeneratedReportType generate(UUID jobId, GenerateReportPayloadType request) {
        validate(request);
        ReportStructure structure = structureRegistry.forType(request.reportType());

        List<List<ReportImageType>> batches = partition(request.images(), BATCH_SIZE);
        LOG.infof("Generating report %s for job %s: %d images in %d batches", request.reportId(), jobId,
                request.images().size(), batches.size());

        List<String> batchDrafts = new ArrayList<>();
        for (int i = 0; i < batches.size(); i++) {
            batchDrafts.add(draftBatch(request.projectId(), batches.get(i), i, batches.size()));
        }
        String combinedDraft = String.join("\n\n", batchDrafts);

        String content;
        boolean finalReviewApplied;
        try {
            content = finalReview(request.bulletPoints(), combinedDraft, batchDrafts.size());
            finalReviewApplied = true;
        } catch (RuntimeException e) {
            LOG.warnf(e, "Final review failed for report %s, keeping combined draft", request.reportId());
            content = combinedDraft + "\n\n" + ReportPrompts.FINAL_REVIEW_FAILED_NOTE;
            finalReviewApplied = false;
        }

        List<ReportSectionType> sections = new ArrayList<>(structure.defaultSections());
        sections.addAll(ReportTextParser.parse(content));
        structure.validate(sections);
        List<ReportSectionType> numbered = structure.autoNumber(sections);

        LOG.infof("Report %s generated: %d sections, final review %s", request.reportId(), numbered.size(),
                finalReviewApplied ? "applied" : "skipped");
        return new GeneratedReportType(request.reportId(), content, numbered,
                new GeneratedReportType.MetadataType(structure.reportType(), batches.size(), request.images().size(),
                        finalReviewApplied));
    }

    private String draftBatch(String projectId, List<ReportImageType> batch, int batchIndex, int batchCount) {
        List<Content> contents = new ArrayList<>();
        contents.add(TextContent.from(ReportPrompts.BATCH_INTRO.formatted(batchIndex + 1, batchCount)));

        for (int j = 0; j < batch.size(); j++) {
            ReportImageType image = batch.get(j);
            int position = batchIndex * BATCH_SIZE + j + 1;
            contents.add(TextContent.from(describePhoto(projectId, image, position)));
            contents.add(toImageContent(image.url()));
        }

        List<ChatMessage> messages = List.of(SystemMessage.from(ReportPrompts.PHOTO_WRITING),
                UserMessage.from(contents));
        try {
            LOG.debugf("Sending photo batch %d/%d with %d images", batchIndex + 1, batchCount, batch.size());
            ChatResponse response = chatModel.chat(messages);
            String text = response.aiMessage().text();
            return text != null ? text : "";
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : "model call failed";
            throw new ReportGenerationException("Error processing batch " + (batchIndex + 1) + ": " + reason, e);
        }
    }

    private String finalReview(String bulletPoints, String combinedDraft, int sectionCount) {
        List<ChatMessage> messages = List.of(SystemMessage.from(ReportPrompts.FINAL_REVIEW),
                UserMessage.from(ReportPrompts.FINAL_REVIEW_REQUEST.formatted(
                        bulletPoints != null ? bulletPoints : "", sectionCount, combinedDraft)));
        String text = chatModel.chat(messages).aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new ReportGenerationException("Final review returned no content");
        }
        return text;
    }

    String describePhoto(String projectId, ReportImageType image, int position) {
        String description = image.description() != null && !image.description().isBlank() ? image.description()
                : "No description provided";
        String group = image.group() != null && !image.group().isBlank() ? image.group() : "NO GROUP";
        String numberLabel = image.number() != null ? image.number().toString()
                : "NO NUMBER: Position in batch " + position;
        int referenceNumber = image.number() != null ? image.number() : position;
        String tag = image.tag() != null && !image.tag().isBlank() ? image.tag().toUpperCase(Locale.ROOT) : "OVERVIEW";

        List<SpecificationMatchType> matches = image.description() == null ? List.of()
                : specificationSearchClient.search(projectId, image.description(), SPECIFICATIONS_PER_IMAGE);
        String specifications = matches.isEmpty() ? ReportPrompts.NO_SPECIFICATIONS
                : ReportPrompts.SPECIFICATIONS_FOUND.formatted(formatSpecifications(matches));

        return ReportPrompts.PHOTO_ENTRY.formatted(description, group, numberLabel, tag, specifications, group,
                referenceNumber, group);
    }

    static String formatSpecifications(List<SpecificationMatchType> matches) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < matches.size(); i++) {
            SpecificationMatchType match = matches.get(i);
            entries.add(String.format(Locale.ROOT, "[Specification %d - %.1f%% relevant from %s - General Content]:%n%s",
                    i + 1, match.similarity() * 100.0, documentName(match.fileName()), match.content()));
        }
        return String.join("\n\n", entries);
    }

    /**
     * Turns a file name into a citation title: {@code roofing_specs-v2.pdf} becomes {@code Roofing Specs V2}.
     */
    static String documentName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "Unknown Document";
        }
        String base = fileName.replaceAll("\\.[^/.]+$", "").replaceAll("[-_]", " ");
        Matcher matcher = Pattern.compile("\\b\\w").matcher(base);
        StringBuilder titled = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(titled, matcher.group().toUpperCase(Locale.ROOT));
        }
        matcher.appendTail(titled);
        return titled.toString();
    }

    private static Content toImageContent(String url) {
        Matcher dataUrl = DATA_URL.matcher(url);
        if (dataUrl.matches()) {
            return ImageContent.from(dataUrl.group(2), dataUrl.group(1));
        }
        return ImageContent.from(url);
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(i + size, items.size())));
        }
        return chunks;
    }
}
