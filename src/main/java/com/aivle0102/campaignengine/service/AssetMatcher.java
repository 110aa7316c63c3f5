package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.domain.AssetCategory;
import com.aivle0102.campaignengine.domain.AssetRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Associates pooled brand assets with products by fuzzy filename matching and picks at most
 * one asset per category for a product.
 */
@Component
public class AssetMatcher {

    private static final Logger log = LoggerFactory.getLogger(AssetMatcher.class);

    private static final int MIN_WORD_LENGTH = 3;

    /**
     * Returns the first product (in the given order) whose qualifying words mostly appear in the filename.
     * A word qualifies when it is longer than two characters; at least half of them, rounded up,
     * must be substrings of the normalized filename.
     */
    public Optional<String> findBestProductMatch(String filename, List<String> productNames) {
        if (filename == null || productNames == null) return Optional.empty();
        String cleanFilename = normalize(filename);

        for (String productName : productNames) {
            if (productName == null) continue;
            List<String> words = qualifyingWords(productName);
            if (words.isEmpty()) continue;

            long matching = words.stream().filter(cleanFilename::contains).count();
            int required = (words.size() + 1) / 2;
            if (matching > 0 && matching >= required) {
                return Optional.of(productName);
            }
        }
        return Optional.empty();
    }

    /**
     * Selects at most one asset per category for a product, in logo, background, product-image order.
     * A product-specific asset wins over a generic one; a category with neither is omitted.
     */
    public List<AssetRecord> selectForProduct(String productName, List<AssetRecord> pool) {
        List<AssetRecord> selected = new ArrayList<>();
        if (pool == null || pool.isEmpty()) {
            return selected;
        }
        for (AssetCategory category : AssetCategory.SCAN_ORDER) {
            Optional<AssetRecord> asset = pool.stream()
                    .filter(a -> a.getCategory() == category && a.isMatchedTo(productName))
                    .findFirst()
                    .or(() -> pool.stream()
                            .filter(a -> a.getCategory() == category && a.isGeneric())
                            .findFirst());

            if (asset.isPresent()) {
                selected.add(asset.get());
                log.debug("Selected {} for {}: {}", category.code(), productName, asset.get().getFilename());
            } else {
                log.debug("No {} asset found for {}", category.code(), productName);
            }
        }
        return selected;
    }

    static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", " ");
    }

    private static List<String> qualifyingWords(String productName) {
        return Arrays.stream(normalize(productName).trim().split("\\s+"))
                .filter(w -> w.length() >= MIN_WORD_LENGTH)
                .toList();
    }
}
