package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.config.CampaignProperties;
import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.AssetCategory;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.GenerationMethod;
import com.aivle0102.campaignengine.domain.GenerationResult;
import com.aivle0102.campaignengine.domain.ReviewFlag;
import com.aivle0102.campaignengine.dto.AssetMetadata;
import com.aivle0102.campaignengine.dto.CampaignSummary;
import com.aivle0102.campaignengine.dto.CampaignValidationReport;
import com.aivle0102.campaignengine.dto.DirectoryIndex;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.SecureRandom;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the on-disk layout of campaign output:
 * <pre>
 * output/&lt;campaignId&gt;/&lt;product&gt;/&lt;ratio&gt;/&lt;sanitized&gt;_&lt;ratio&gt;_v1.png
 * output/&lt;campaignId&gt;/&lt;product&gt;/&lt;ratio&gt;/metadata.json
 * output/&lt;campaignId&gt;/campaign_brief.json
 * output/&lt;campaignId&gt;/campaign_summary.json
 * output/&lt;campaignId&gt;/review_status.json
 * output/&lt;campaignId&gt;/directory_index.json
 * </pre>
 * Exactly one writer per campaignId is assumed.
 */
@Service
public class CampaignFileManager {

    private static final Logger log = LoggerFactory.getLogger(CampaignFileManager.class);

    public static final String BRIEF_FILE = "campaign_brief.json";
    public static final String SUMMARY_FILE = "campaign_summary.json";
    public static final String REVIEW_FILE = "review_status.json";
    public static final String INDEX_FILE = "directory_index.json";
    public static final String METADATA_FILE = "metadata.json";

    private static final String IMAGE_VERSION_SUFFIX = "_v1.png";
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Pattern CAMPAIGN_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private final CampaignProperties properties;
    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;
    private final SecureRandom random = new SecureRandom();

    public CampaignFileManager(CampaignProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public void ensureDirectoryStructure() {
        Path base = properties.resolvedBaseDir();
        List<Path> dirs = new ArrayList<>();
        dirs.add(base.resolve("input/briefs"));
        for (AssetCategory category : AssetCategory.SCAN_ORDER) {
            dirs.add(properties.assetRoot().resolve(category.directoryName()));
        }
        dirs.add(properties.outputRoot());
        dirs.add(base.resolve("config"));

        for (Path dir : dirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new CampaignPersistenceException("Failed to create directory " + dir, e);
            }
        }
        log.debug("Directory structure ready under {}", base);
    }

    // campaign_<yyyyMMdd_HHmmss>_<6자리 난수>
    public String newCampaignId() {
        StringBuilder suffix = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "campaign_" + LocalDateTime.now().format(ID_TIMESTAMP) + "_" + suffix;
    }

    public Path createCampaignDirectory(String campaignId) {
        Path dir = campaignDir(campaignId);
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CampaignPersistenceException("Failed to create campaign directory " + dir, e);
        }
    }

    /**
     * Writes the image and its sibling metadata.json.
     *
     * @return the image path relative to the base directory
     */
    public String save(String campaignId, String productName, AspectRatio aspectRatio, byte[] imageBytes,
                       String prompt, String brandContext, List<String> usedAssetNames) {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new CampaignPersistenceException("No image data for " + productName + " " + aspectRatio.label(), null);
        }
        Path formatDir = campaignDir(campaignId)
                .resolve(productDirectoryName(productName))
                .resolve(aspectRatio.pathSegment());
        Path imagePath = formatDir.resolve(imageFileName(productName, aspectRatio));
        List<String> usedAssets = usedAssetNames == null ? List.of() : List.copyOf(usedAssetNames);

        try {
            Files.createDirectories(formatDir);
            Files.write(imagePath, imageBytes);
            log.info("Saved image: {}", imagePath);

            String relativePath = relativize(imagePath);
            AssetMetadata metadata = AssetMetadata.builder()
                    .productName(productName)
                    .aspectRatio(aspectRatio)
                    .generatedPrompt(prompt)
                    .timestamp(Instant.now())
                    .brandContext(parseBrandContext(brandContext))
                    .imagePath(relativePath)
                    .fileSize(imageBytes.length)
                    .format("png")
                    .usedAssets(usedAssets)
                    .generationMethod(GenerationMethod.forAssets(usedAssets))
                    .build();
            Path metadataPath = formatDir.resolve(METADATA_FILE);
            Files.write(metadataPath, prettyWriter.writeValueAsBytes(metadata));
            log.debug("Saved metadata: {}", metadataPath);
            return relativePath;
        } catch (IOException e) {
            throw new CampaignPersistenceException(
                    "Failed to save asset " + productName + " " + aspectRatio.label() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the brief, the campaign summary and the review flag as one unit. All three are staged
     * as temporary files first and then moved into place with the review flag last; on any failure
     * every staged or already-moved document of the set is removed.
     */
    public void finalizeCampaign(String campaignId, CampaignBrief brief, List<GenerationResult> results) {
        Path dir = campaignDir(campaignId);
        Instant now = Instant.now();
        long successful = results.stream().filter(GenerationResult::isSuccess).count();

        CampaignSummary summary = CampaignSummary.builder()
                .campaignId(campaignId)
                .briefCampaignId(brief.getCampaignId())
                .totalProducts(brief.getProducts().size())
                .totalAssets(results.size())
                .successfulAssets((int) successful)
                .failedAssets(results.size() - (int) successful)
                .brandGuidelines(brief.getBrandGuidelines())
                .targetAudience(brief.getTargetAudience())
                .generatedAt(now)
                .readyForReview(true)
                .build();

        ReviewFlag reviewFlag = ReviewFlag.pendingReview(campaignId, results, now);

        // 이동 순서 = 삽입 순서, review flag 는 마지막
        Map<String, Object> documents = new LinkedHashMap<>();
        documents.put(BRIEF_FILE, brief);
        documents.put(SUMMARY_FILE, summary);
        documents.put(REVIEW_FILE, reviewFlag);

        List<Path> staged = new ArrayList<>();
        List<Path> moved = new ArrayList<>();
        try {
            for (Map.Entry<String, Object> doc : documents.entrySet()) {
                byte[] json = prettyWriter.writeValueAsBytes(doc.getValue());
                Path temp = dir.resolve(doc.getKey() + TEMP_SUFFIX);
                Files.write(temp, json);
                staged.add(temp);
            }
            for (Path temp : List.copyOf(staged)) {
                Path target = dir.resolve(temp.getFileName().toString().replace(TEMP_SUFFIX, ""));
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                staged.remove(temp);
                moved.add(target);
            }
        } catch (IOException e) {
            CampaignPersistenceException failure =
                    new CampaignPersistenceException("Failed to finalize campaign " + campaignId + ": " + e.getMessage(), e);
            rollback(staged, failure);
            rollback(moved, failure);
            throw failure;
        }
        log.info("Review flag created for campaign {} ({}/{} successful)", campaignId, successful, results.size());
    }

    /**
     * Best-effort browsing index of which (product, ratio) directories hold an image and metadata.
     * Never throws.
     */
    public void buildIndex(String campaignId) {
        try {
            Path campaignPath = campaignDir(campaignId);
            List<DirectoryIndex.ProductEntry> products = new ArrayList<>();
            for (Path productDir : listDirectories(campaignPath)) {
                List<DirectoryIndex.FormatEntry> formats = new ArrayList<>();
                for (Path formatDir : listDirectories(productDir)) {
                    List<String> files = listFileNames(formatDir);
                    Optional<String> image = files.stream().filter(f -> f.endsWith(".png")).findFirst();
                    Optional<String> metadata = files.stream().filter(f -> f.endsWith(METADATA_FILE)).findFirst();
                    formats.add(new DirectoryIndex.FormatEntry(
                            formatDir.getFileName().toString(),
                            image.orElse(null),
                            metadata.orElse(null),
                            image.isPresent(),
                            metadata.isPresent()));
                }
                products.add(new DirectoryIndex.ProductEntry(productDir.getFileName().toString(), formats.size(), formats));
            }
            DirectoryIndex index = new DirectoryIndex(campaignId, Instant.now(), products.size(), products);
            Path indexPath = campaignPath.resolve(INDEX_FILE);
            Files.write(indexPath, prettyWriter.writeValueAsBytes(index));
            log.info("Directory index created: {}", indexPath);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to create directory index for {}: {}", campaignId, e.getMessage());
        }
    }

    public CampaignValidationReport validateOutput(String campaignId) {
        Path campaignPath = campaignDir(campaignId);
        List<String> issues = new ArrayList<>();
        if (!Files.isDirectory(campaignPath)) {
            issues.add("Campaign directory not found");
            return CampaignValidationReport.invalid(issues);
        }

        for (String required : List.of(BRIEF_FILE, REVIEW_FILE)) {
            if (!Files.isRegularFile(campaignPath.resolve(required))) {
                issues.add("Missing required file: " + required);
            }
        }

        int totalAssets = 0;
        List<Path> productDirs;
        try {
            productDirs = listDirectories(campaignPath);
            for (Path productDir : productDirs) {
                for (Path formatDir : listDirectories(productDir)) {
                    List<String> files = listFileNames(formatDir);
                    boolean hasImage = files.stream().anyMatch(f -> f.endsWith(".png"));
                    boolean hasMetadata = files.stream().anyMatch(f -> f.endsWith(METADATA_FILE));
                    String label = productDir.getFileName() + "/" + formatDir.getFileName();
                    if (hasImage) {
                        totalAssets++;
                    } else {
                        issues.add("Missing image for " + label);
                    }
                    if (!hasMetadata) {
                        issues.add("Missing metadata for " + label);
                    }
                }
            }
        } catch (IOException e) {
            issues.add("Validation error: " + e.getMessage());
            return CampaignValidationReport.invalid(issues);
        }

        CampaignValidationReport.Summary summary = new CampaignValidationReport.Summary(
                campaignId, productDirs.size(), totalAssets, Instant.now(), issues.size());
        return new CampaignValidationReport(issues.isEmpty(), List.copyOf(issues), summary);
    }

    public Path campaignDir(String campaignId) {
        if (campaignId == null || !CAMPAIGN_ID.matcher(campaignId).matches()) {
            throw new IllegalArgumentException("Invalid campaignId: " + campaignId);
        }
        return properties.outputRoot().resolve(campaignId);
    }

    // 소문자화 후 [a-z0-9] 이외 문자는 '_' 로 치환
    public static String sanitize(String productName) {
        return productName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "_");
    }

    public static String imageFileName(String productName, AspectRatio aspectRatio) {
        return sanitize(productName) + "_" + aspectRatio.pathSegment() + IMAGE_VERSION_SUFFIX;
    }

    // 제품 디렉터리는 이름을 유지하되 경로 구분자 등 파일 시스템 예약 문자만 치환
    static String productDirectoryName(String productName) {
        String cleaned = productName.trim().replaceAll("[/\\\\:*?\"<>|]", "_");
        return cleaned.isEmpty() || cleaned.startsWith(".") ? "_" + cleaned : cleaned;
    }

    private String relativize(Path path) {
        return properties.resolvedBaseDir().relativize(path.toAbsolutePath().normalize()).toString();
    }

    private JsonNode parseBrandContext(String brandContext) {
        if (brandContext == null) return objectMapper.nullNode();
        try {
            return objectMapper.readTree(brandContext);
        } catch (IOException e) {
            return TextNode.valueOf(brandContext);
        }
    }

    private void rollback(List<Path> paths, CampaignPersistenceException failure) {
        for (Path path : paths) {
            try {
                if (Files.isRegularFile(path)) {
                    Files.delete(path);
                }
            } catch (IOException e) {
                failure.addSuppressed(e);
                log.error("Failed to roll back {}: {}", path, e.getMessage());
            }
        }
    }

    private static List<Path> listDirectories(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return listing
                    .filter(Files::isDirectory)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .sorted()
                    .toList();
        }
    }

    private static List<String> listFileNames(Path dir) throws IOException {
        try (Stream<Path> listing = Files.list(dir)) {
            return listing
                    .filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        }
    }
}
