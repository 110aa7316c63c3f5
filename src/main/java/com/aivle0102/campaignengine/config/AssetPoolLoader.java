package com.aivle0102.campaignengine.config;

import com.aivle0102.campaignengine.domain.AssetCategory;
import com.aivle0102.campaignengine.domain.AssetRecord;
import com.aivle0102.campaignengine.service.AssetMatcher;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads the reusable brand asset pool ({@code logos/}, {@code backgrounds/}, {@code product-images/})
 * fresh for each campaign run, tagging every asset with the product it matches.
 * <p>
 * Files inside a category directory are read in lexicographic filename order so that
 * matching ties resolve the same way on every run.
 */
@Component
@RequiredArgsConstructor
public class AssetPoolLoader {

    private static final Logger log = LoggerFactory.getLogger(AssetPoolLoader.class);

    private static final Pattern IMAGE_FILE = Pattern.compile(".*\\.(png|jpg|jpeg|svg)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> MIME_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "svg", "image/svg+xml"
    );

    private final CampaignProperties properties;
    private final AssetMatcher assetMatcher;

    public List<AssetRecord> load(List<String> productNames) {
        Path root = properties.assetRoot();
        Path baseDir = properties.resolvedBaseDir();
        List<AssetRecord> loaded = new ArrayList<>();

        for (AssetCategory category : AssetCategory.SCAN_ORDER) {
            Path dir = root.resolve(category.directoryName());
            List<Path> files;
            try (Stream<Path> listing = Files.list(dir)) {
                files = listing
                        .filter(Files::isRegularFile)
                        .filter(p -> isImageFile(p.getFileName().toString()))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                log.warn("Could not read asset directory {}: {}", dir, e.getMessage());
                continue;
            }
            log.info("Scanning {}/: found {} image files", category.directoryName(), files.size());

            for (Path file : files) {
                String filename = file.getFileName().toString();
                try {
                    byte[] payload = Files.readAllBytes(file);
                    String productMatch = assetMatcher.findBestProductMatch(filename, productNames).orElse(null);
                    loaded.add(AssetRecord.builder()
                            .category(category)
                            .filename(filename)
                            .payload(payload)
                            .mimeType(mimeTypeOf(filename))
                            .productMatch(productMatch)
                            .sourcePath(relativize(baseDir, file))
                            .build());
                    log.info("Loaded {}/{} ({}KB){}", category.directoryName(), filename,
                            Math.round(payload.length / 1024.0),
                            productMatch == null ? "" : " -> " + productMatch);
                } catch (IOException e) {
                    log.warn("Failed to load {}/{}: {}", category.directoryName(), filename, e.getMessage());
                }
            }
        }

        log.info("Total assets loaded: {}", loaded.size());
        return loaded;
    }

    public static String mimeTypeOf(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0) return "image/png";
        String ext = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return MIME_TYPES.getOrDefault(ext, "image/png");
    }

    private boolean isImageFile(String filename) {
        return !filename.startsWith(".") && IMAGE_FILE.matcher(filename).matches();
    }

    private String relativize(Path baseDir, Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        return absolute.startsWith(baseDir) ? baseDir.relativize(absolute).toString() : absolute.toString();
    }
}
