package com.aivle0102.campaignengine.dto;

import com.aivle0102.campaignengine.domain.BrandGuidelines;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class CampaignSummary {
    private final String campaignId;
    private final String briefCampaignId;
    private final int totalProducts;
    private final int totalAssets;
    private final int successfulAssets;
    private final int failedAssets;
    private final BrandGuidelines brandGuidelines;
    private final String targetAudience;
    private final Instant generatedAt;
    private final boolean readyForReview;
}
