package com.aivle0102.campaignengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

// 운영자 열람용 directory_index.json
@Getter
@AllArgsConstructor
public class DirectoryIndex {
    private final String campaignId;
    private final Instant createdAt;
    private final int totalProducts;
    private final List<ProductEntry> products;

    @Getter
    @AllArgsConstructor
    public static class ProductEntry {
        private final String name;
        private final int totalFormats;
        private final List<FormatEntry> formats;
    }

    @Getter
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public static class FormatEntry {
        private final String aspectRatio;
        private final String imageFile;
        private final String metadataFile;
        private final boolean hasImage;
        private final boolean hasMetadata;
    }
}
