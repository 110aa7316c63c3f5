package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.config.CampaignProperties;
import com.aivle0102.campaignengine.config.JacksonConfig;
import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.GenerationResult;
import com.aivle0102.campaignengine.domain.GenerationUnit;
import com.aivle0102.campaignengine.dto.CampaignValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.aivle0102.campaignengine.service.CampaignFixtures.PNG_BYTES;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CampaignFileManager}.
 * <p>
 * Every test writes into its own {@code @TempDir} base directory.
 */
class CampaignFileManagerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = JacksonConfig.campaignObjectMapper();
    private CampaignFileManager fileManager;
    private CampaignBrief brief;

    private static final String CAMPAIGN_ID = "campaign_20260101_120000_abc123";
    private static final String BRAND_CONTEXT = "{\"tone\":\"bold\",\"colors\":[\"#000\"]}";

    @BeforeEach
    void setUp() {
        CampaignProperties properties = new CampaignProperties();
        properties.setBaseDir(tempDir.toString());
        fileManager = new CampaignFileManager(properties, objectMapper);
        brief = new CampaignBriefValidator().validate(CampaignFixtures.brief("Widget Pro"));
        fileManager.createCampaignDirectory(CAMPAIGN_ID);
    }

    // ── Naming ───────────────────────────────────────────────────────

    @Test
    @DisplayName("campaign ids follow campaign_<timestamp>_<suffix>")
    void campaignIdFormat() {
        String id = fileManager.newCampaignId();
        assertTrue(id.matches("campaign_\\d{8}_\\d{6}_[a-z0-9]{6}"), id);
        assertNotEquals(id, fileManager.newCampaignId());
    }

    @Test
    @DisplayName("image file names are sanitized and versioned")
    void imageFileName() {
        assertEquals("widget_pro__x__16x9_v1.png", CampaignFileManager.imageFileName("Widget Pro (X)", AspectRatio.WIDE));
        assertEquals("gadget_mini_1x1_v1.png", CampaignFileManager.imageFileName("Gadget Mini", AspectRatio.SQUARE));
    }

    @Test
    @DisplayName("creates the input/output directory structure")
    void ensureDirectoryStructure() {
        fileManager.ensureDirectoryStructure();

        assertTrue(Files.isDirectory(tempDir.resolve("input/briefs")));
        assertTrue(Files.isDirectory(tempDir.resolve("input/assets/logos")));
        assertTrue(Files.isDirectory(tempDir.resolve("input/assets/backgrounds")));
        assertTrue(Files.isDirectory(tempDir.resolve("input/assets/product-images")));
        assertTrue(Files.isDirectory(tempDir.resolve("output")));
        assertTrue(Files.isDirectory(tempDir.resolve("config")));
    }

    @Test
    @DisplayName("rejects campaign ids that would escape the output directory")
    void rejectsPathTraversal() {
        assertThrows(IllegalArgumentException.class, () -> fileManager.campaignDir("../etc"));
    }

    // ── save ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("writes the image and a metadata file that points back at it")
        void roundTrip() throws Exception {
            String assetPath = fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.TALL, PNG_BYTES,
                    "a prompt", BRAND_CONTEXT, List.of("brand_logo.png"));

            assertEquals("output/" + CAMPAIGN_ID + "/Widget Pro/9x16/widget_pro_9x16_v1.png", assetPath);
            Path image = tempDir.resolve(assetPath);
            assertTrue(Files.isRegularFile(image));
            assertEquals(PNG_BYTES.length, Files.size(image));

            JsonNode metadata = objectMapper.readTree(image.resolveSibling("metadata.json").toFile());
            assertEquals(assetPath, metadata.get("imagePath").asText());
            assertEquals("Widget Pro", metadata.get("productName").asText());
            assertEquals("9:16", metadata.get("aspectRatio").asText());
            assertEquals("a prompt", metadata.get("generatedPrompt").asText());
            assertEquals("bold", metadata.get("brandContext").get("tone").asText());
            assertEquals(PNG_BYTES.length, metadata.get("fileSize").asLong());
            assertEquals("png", metadata.get("format").asText());
            assertEquals("brand_logo.png", metadata.get("usedAssets").get(0).asText());
            assertEquals("multi-image-composition", metadata.get("generationMethod").asText());
            assertTrue(metadata.hasNonNull("timestamp"));
        }

        @Test
        @DisplayName("text-only generation is tagged text-to-image")
        void textOnlyTag() throws Exception {
            String assetPath = fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES,
                    "a prompt", BRAND_CONTEXT, List.of());

            JsonNode metadata = objectMapper.readTree(tempDir.resolve(assetPath).resolveSibling("metadata.json").toFile());
            assertEquals("text-to-image", metadata.get("generationMethod").asText());
        }

        @Test
        @DisplayName("saving twice for the same unit overwrites in place")
        void idempotentDirectories() {
            String first = fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES, "p", BRAND_CONTEXT, null);
            String second = fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES, "p", BRAND_CONTEXT, null);
            assertEquals(first, second);
        }

        @Test
        @DisplayName("empty image data is a persistence failure")
        void emptyImage() {
            assertThrows(CampaignPersistenceException.class, () -> fileManager.save(
                    CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, new byte[0], "p", BRAND_CONTEXT, List.of()));
        }
    }

    // ── finalizeCampaign ─────────────────────────────────────────────

    @Nested
    @DisplayName("finalizeCampaign")
    class Finalize {

        private List<GenerationResult> results() {
            String saved = fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES, "p", BRAND_CONTEXT, List.of());
            GenerationUnit failedUnit = new GenerationUnit(2, 2, brief.getProducts().get(0), AspectRatio.TALL, List.of());
            return List.of(
                    GenerationResult.builder().productName("Widget Pro").aspectRatio(AspectRatio.SQUARE)
                            .success(true).assetPath(saved).usedAssets(List.of()).build(),
                    GenerationResult.failed(failedUnit, null, "API quota exceeded - please wait and try again"));
        }

        @Test
        @DisplayName("writes brief, summary and a pending review flag")
        void writesAllThreeDocuments() throws Exception {
            List<GenerationResult> results = results();

            fileManager.finalizeCampaign(CAMPAIGN_ID, brief, results);

            Path dir = fileManager.campaignDir(CAMPAIGN_ID);
            JsonNode briefJson = objectMapper.readTree(dir.resolve("campaign_brief.json").toFile());
            JsonNode summary = objectMapper.readTree(dir.resolve("campaign_summary.json").toFile());
            JsonNode review = objectMapper.readTree(dir.resolve("review_status.json").toFile());

            assertEquals("spring-launch", briefJson.get("campaignId").asText());

            assertEquals(1, summary.get("totalProducts").asInt());
            assertEquals(2, summary.get("totalAssets").asInt());
            assertEquals(1, summary.get("successfulAssets").asInt());
            assertEquals(1, summary.get("failedAssets").asInt());
            assertTrue(summary.get("readyForReview").asBoolean());

            assertEquals(CAMPAIGN_ID, review.get("campaignId").asText());
            assertEquals("pending_review", review.get("status").asText());
            assertEquals(2, review.get("totalAssets").asInt());
            assertEquals(1, review.get("successfulAssets").asInt());
            assertEquals(results.get(0).getAssetPath(), review.get("assetsGenerated").get(0).asText());
            assertFalse(review.get("claudeReviewed").asBoolean());
            assertTrue(review.has("complianceScore") && review.get("complianceScore").isNull());
            assertTrue(review.has("reviewStarted") && review.get("reviewStarted").isNull());
            assertTrue(review.has("reviewCompleted") && review.get("reviewCompleted").isNull());

            try (var listing = Files.list(dir)) {
                assertTrue(listing.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
            }
        }

        @Test
        @DisplayName("a failure while staging leaves none of the three documents")
        void failureWhileStaging() throws Exception {
            Path dir = fileManager.campaignDir(CAMPAIGN_ID);
            Files.createDirectories(dir.resolve("review_status.json.tmp").resolve("blocker"));
            List<GenerationResult> results = results();

            assertThrows(CampaignPersistenceException.class,
                    () -> fileManager.finalizeCampaign(CAMPAIGN_ID, brief, results));

            assertFalse(Files.exists(dir.resolve("campaign_brief.json")));
            assertFalse(Files.exists(dir.resolve("campaign_summary.json")));
            assertFalse(Files.exists(dir.resolve("review_status.json")));
            assertFalse(Files.exists(dir.resolve("campaign_brief.json.tmp")));
            assertFalse(Files.exists(dir.resolve("campaign_summary.json.tmp")));
        }

        @Test
        @DisplayName("a failure placing the review flag rolls back the summary")
        void failureWhilePlacingReviewFlag() throws Exception {
            Path dir = fileManager.campaignDir(CAMPAIGN_ID);
            Files.createDirectories(dir.resolve("review_status.json").resolve("blocker"));
            List<GenerationResult> results = results();

            assertThrows(CampaignPersistenceException.class,
                    () -> fileManager.finalizeCampaign(CAMPAIGN_ID, brief, results));

            assertFalse(Files.isRegularFile(dir.resolve("review_status.json")));
            assertFalse(Files.exists(dir.resolve("campaign_summary.json")));
            assertFalse(Files.exists(dir.resolve("campaign_brief.json")));
            assertFalse(Files.exists(dir.resolve("review_status.json.tmp")));
        }
    }

    // ── index & validation ───────────────────────────────────────────

    @Test
    @DisplayName("directory index lists which formats have images and metadata")
    void buildIndex() throws Exception {
        fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES, "p", BRAND_CONTEXT, List.of());
        Files.createDirectories(fileManager.campaignDir(CAMPAIGN_ID).resolve("Widget Pro").resolve("9x16"));

        fileManager.buildIndex(CAMPAIGN_ID);

        JsonNode index = objectMapper.readTree(fileManager.campaignDir(CAMPAIGN_ID).resolve("directory_index.json").toFile());
        assertEquals(1, index.get("totalProducts").asInt());
        JsonNode product = index.get("products").get(0);
        assertEquals("Widget Pro", product.get("name").asText());
        assertEquals(2, product.get("totalFormats").asInt());
        JsonNode square = product.get("formats").get(0);
        assertEquals("1x1", square.get("aspectRatio").asText());
        assertTrue(square.get("hasImage").asBoolean());
        assertTrue(square.get("hasMetadata").asBoolean());
        JsonNode tall = product.get("formats").get(1);
        assertFalse(tall.get("hasImage").asBoolean());
        assertTrue(tall.get("imageFile").isNull());
    }

    @Test
    @DisplayName("index failure is swallowed")
    void buildIndexForMissingCampaign() {
        assertDoesNotThrow(() -> fileManager.buildIndex("campaign_missing"));
    }

    @Test
    @DisplayName("validation reports missing files and images")
    void validateOutput() throws Exception {
        fileManager.save(CAMPAIGN_ID, "Widget Pro", AspectRatio.SQUARE, PNG_BYTES, "p", BRAND_CONTEXT, List.of());
        Files.createDirectories(fileManager.campaignDir(CAMPAIGN_ID).resolve("Widget Pro").resolve("9x16"));

        CampaignValidationReport report = fileManager.validateOutput(CAMPAIGN_ID);

        assertFalse(report.isValid());
        assertTrue(report.getIssues().contains("Missing required file: campaign_brief.json"));
        assertTrue(report.getIssues().contains("Missing required file: review_status.json"));
        assertTrue(report.getIssues().contains("Missing image for Widget Pro/9x16"));
        assertTrue(report.getIssues().contains("Missing metadata for Widget Pro/9x16"));
        assertEquals(1, report.getSummary().getTotalAssets());
        assertEquals(4, report.getSummary().getIssueCount());
    }

    @Test
    @DisplayName("validation fails for an unknown campaign")
    void validateUnknownCampaign() {
        CampaignValidationReport report = fileManager.validateOutput("campaign_unknown");
        assertFalse(report.isValid());
        assertEquals(List.of("Campaign directory not found"), report.getIssues());
    }
}
