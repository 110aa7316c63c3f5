package com.aivle0102.campaignengine.domain;

import java.util.List;

/**
 * One (product, aspect ratio) pair of work, plus the assets matched to the product.
 * {@code index} is 1-based within the run.
 */
public record GenerationUnit(int index, int total, CampaignProduct product, AspectRatio aspectRatio,
                             List<AssetRecord> matchedAssets) {

    public GenerationUnit {
        matchedAssets = matchedAssets == null ? List.of() : List.copyOf(matchedAssets);
    }

    public boolean isLast() {
        return index == total;
    }
}
