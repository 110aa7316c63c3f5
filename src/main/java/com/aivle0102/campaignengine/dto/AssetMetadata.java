package com.aivle0102.campaignengine.dto;

import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.GenerationMethod;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

// 이미지 옆에 저장되는 metadata.json
@Getter
@Builder
public class AssetMetadata {
    private final String productName;
    private final AspectRatio aspectRatio;
    private final String generatedPrompt;
    private final Instant timestamp;
    private final JsonNode brandContext;
    private final String imagePath;
    private final long fileSize;
    private final String format;
    private final List<String> usedAssets;
    private final GenerationMethod generationMethod;
}
