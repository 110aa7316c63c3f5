package com.aivle0102.campaignengine.domain;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class ComposedPrompt {
    private final String productName;
    private final AspectRatio aspectRatio;
    private final String generatedPrompt;
    private final String brandContext;     // BrandGuidelines JSON 스냅샷
    private final String targetAudience;
    private final List<AssetRecord> associatedAssets;
    private final boolean fallback;

    public List<String> usedAssetNames() {
        return associatedAssets == null
                ? List.of()
                : associatedAssets.stream().map(AssetRecord::getFilename).toList();
    }

    public GenerationMethod generationMethod() {
        return GenerationMethod.forAssets(associatedAssets);
    }
}
