package com.aivle0102.campaignengine.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@AllArgsConstructor
public class CampaignValidationReport {
    private final boolean valid;
    private final List<String> issues;
    private final Summary summary;

    public static CampaignValidationReport invalid(List<String> issues) {
        return new CampaignValidationReport(false, List.copyOf(issues), null);
    }

    @Getter
    @AllArgsConstructor
    public static class Summary {
        private final String campaignId;
        private final int totalProducts;
        private final int totalAssets;
        private final Instant validationDate;
        private final int issueCount;
    }
}
