package pretium.reporting.services;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.Content;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import pretium.reporting.api.types.GenerateReportPayloadType;
import pretium.reporting.api.types.GeneratedReportType;
import pretium.reporting.api.types.ReportImageType;
import pretium.reporting.api.types.ReportSectionType;
import pretium.reporting.api.types.SpecificationMatchType;
import pretium.reporting.exceptions.ReportGenerationException;
import pretium.reporting.exceptions.ValidationException;
import pretium.reporting.integration.knowledge.SpecificationSearchClient;
import pretium.reporting.reports.ObservationReportStructure;
import pretium.reporting.reports.ReportStructure;
import pretium.reporting.reports.ReportStructureRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ReportGenerationService} batching, final review fallback and section numbering.
 */
class ReportGenerationServiceTest {

    private static final String FINAL_TEXT = """
            1. Roofing
            1.1 Membrane seams lapped 150 mm [IMAGE:1:Roofing]
            1.2 Seam at parapet open, contractor to reseal [IMAGE:2:Roofing]
            2. Drainage
            2.1 Roof drain clear of debris [IMAGE:1:Drainage]
            """;

    @Mock
    ChatModel chatModel;

    @Mock
    SpecificationSearchClient specificationSearchClient;

    private ReportGenerationService service;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        MockitoAnnotations.openMocks(this);

        Instance<ReportStructure> structures = mock(Instance.class);
        when(structures.iterator())
                .thenAnswer(invocation -> List.<ReportStructure> of(new ObservationReportStructure()).iterator());

        service = new ReportGenerationService();
        service.chatModel = chatModel;
        service.specificationSearchClient = specificationSearchClient;
        service.structureRegistry = new ReportStructureRegistry(structures);

        when(specificationSearchClient.search(anyString(), anyString(), anyInt())).thenReturn(List.of());
    }

    @Test
    void testGenerate_BatchesOfFiveThenFinalReview() {
        when(chatModel.chat(anyList())).thenReturn(response("1.1 batch one [IMAGE:1:Roofing]"),
                response("1.1 batch two [IMAGE:6:Roofing]"), response(FINAL_TEXT));

        GeneratedReportType report = service.generate(UUID.randomUUID(), request(7));

        verify(chatModel, times(3)).chat(anyList());
        assertEquals(FINAL_TEXT, report.content());
        assertEquals(2, report.metadata().batches());
        assertEquals(7, report.metadata().imageCount());
        assertTrue(report.metadata().finalReviewApplied());
        assertEquals("observation", report.metadata().reportType());
    }

    @Test
    void testGenerate_SectionsNumberedAfterDefaults() {
        when(chatModel.chat(anyList())).thenReturn(response("draft"), response(FINAL_TEXT));

        List<ReportSectionType> sections = service.generate(UUID.randomUUID(), request(2)).sections();

        assertEquals(4, sections.size());
        assertEquals("1.", sections.get(0).number());
        assertEquals("Location Plan", sections.get(0).title());
        assertEquals("locationPlan", sections.get(0).displayHint());
        assertEquals("2.", sections.get(1).number());
        assertEquals("Staging Area", sections.get(1).title());

        ReportSectionType roofing = sections.get(2);
        assertEquals("3.", roofing.number());
        assertEquals("Roofing", roofing.title());
        assertEquals(2, roofing.children().size());
        assertEquals("3.1", roofing.children().get(0).number());
        assertEquals("3.2", roofing.children().get(1).number());
        assertEquals(2, roofing.children().get(1).images().get(0).number());
        assertEquals("Roofing", roofing.children().get(1).images().get(0).group());

        assertEquals("4.", sections.get(3).number());
        assertEquals("4.1", sections.get(3).children().get(0).number());
    }

    @Test
    void testGenerate_FinalReviewFailureKeepsDraft() {
        when(chatModel.chat(anyList())).thenReturn(response("1.1 seams lapped [IMAGE:1:Roofing]"))
                .thenThrow(new RuntimeException("request timed out"));

        GeneratedReportType report = service.generate(UUID.randomUUID(), request(3));

        assertTrue(report.content().startsWith("1.1 seams lapped [IMAGE:1:Roofing]"));
        assertTrue(report.content().contains("[Note: Final formatting step failed"));
        assertFalse(report.metadata().finalReviewApplied());
    }

    @Test
    void testGenerate_BatchFailureFailsReport() {
        when(chatModel.chat(anyList())).thenReturn(response("first batch"))
                .thenThrow(new RuntimeException("rate limited"));

        ReportGenerationException e = assertThrows(ReportGenerationException.class,
                () -> service.generate(UUID.randomUUID(), request(6)));

        assertEquals("Error processing batch 2: rate limited", e.getMessage());
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void testGenerate_NoImagesRejected() {
        GenerateReportPayloadType request = new GenerateReportPayloadType("report-1", "project-1", "", null, null,
                null, List.of());

        ValidationException e = assertThrows(ValidationException.class,
                () -> service.generate(UUID.randomUUID(), request));

        assertEquals("No images provided for report generation", e.getMessage());
        verify(chatModel, never()).chat(anyList());
    }

    @Test
    void testValidate_UnknownReportTypeRejected() {
        GenerateReportPayloadType request = new GenerateReportPayloadType("report-1", null, null, null, null,
                "inspection", List.of(new ReportImageType("https://img/1.jpg", "desc", null, 1, null)));

        assertThrows(ValidationException.class, () -> service.validate(request));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGenerate_PhotoMessageCarriesSpecificationsAndImage() {
        when(specificationSearchClient.search(eq("project-1"), anyString(), eq(2)))
                .thenReturn(List.of(new SpecificationMatchType("Laps shall be 150 mm minimum.", 0.873, 4, "k-1",
                        "roofing_specs-v2.pdf")));
        when(chatModel.chat(anyList())).thenReturn(response("draft"), response(FINAL_TEXT));

        service.generate(UUID.randomUUID(), request(1));

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel, times(2)).chat(captor.capture());
        UserMessage photoMessage = (UserMessage) captor.getAllValues().get(0).get(1);

        List<String> texts = new ArrayList<>();
        int images = 0;
        for (Content content : photoMessage.contents()) {
            if (content instanceof TextContent text) {
                texts.add(text.text());
            } else if (content instanceof ImageContent) {
                images++;
            }
        }
        assertEquals(1, images);
        String photoText = texts.get(1);
        assertTrue(photoText.contains("RELEVANT SPECIFICATIONS"));
        assertTrue(photoText.contains("87.3% relevant from Roofing Specs V2 - General Content"));
        assertTrue(photoText.contains("[IMAGE:1:Roofing]"));
    }

    @Test
    void testDocumentName() {
        assertEquals("Roofing Specs V2", ReportGenerationService.documentName("roofing_specs-v2.pdf"));
        assertEquals("Unknown Document", ReportGenerationService.documentName(null));
    }

    @Test
    void testPartition() {
        List<List<Integer>> chunks = ReportGenerationService.partition(List.of(1, 2, 3, 4, 5, 6, 7), 5);

        assertEquals(2, chunks.size());
        assertEquals(List.of(1, 2, 3, 4, 5), chunks.get(0));
        assertEquals(List.of(6, 7), chunks.get(1));
    }

    private static GenerateReportPayloadType request(int imageCount) {
        List<ReportImageType> images = new ArrayList<>();
        for (int i = 1; i <= imageCount; i++) {
            images.add(new ReportImageType("https://images.example.com/" + i + ".jpg", "Seam detail " + i, "Roofing",
                    i, "overview"));
        }
        return new GenerateReportPayloadType("report-1", "project-1", "Keep it short", "North Wing", "Building B",
                null, images);
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}
