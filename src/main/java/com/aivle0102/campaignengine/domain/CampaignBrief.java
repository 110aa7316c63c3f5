package com.aivle0102.campaignengine.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class CampaignBrief {
    private String campaignId;
    private List<CampaignProduct> products;
    private String targetRegion;
    private String targetAudience;
    private String campaignMessage;
    private BrandGuidelines brandGuidelines;
}
