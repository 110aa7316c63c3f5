package com.aivle0102.campaignengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Durable hand-off record for the external review agent ({@code review_status.json}).
 * <p>
 * Written once per campaign with {@code claudeReviewed=false}; the review fields are owned by
 * the agent afterwards and are never read back here.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class ReviewFlag {

    public static final String PENDING_REVIEW = "pending_review";

    private final String campaignId;
    private final String status;
    private final Instant createdAt;
    private final Instant lastModified;
    private final int totalAssets;
    private final int successfulAssets;
    private final List<String> assetsGenerated;
    private final boolean claudeReviewed;
    private final Integer complianceScore;
    private final Instant reviewStarted;
    private final Instant reviewCompleted;

    public static ReviewFlag pendingReview(String campaignId, List<GenerationResult> results, Instant now) {
        return ReviewFlag.builder()
                .campaignId(campaignId)
                .status(PENDING_REVIEW)
                .createdAt(now)
                .lastModified(now)
                .totalAssets(results.size())
                .successfulAssets((int) results.stream().filter(GenerationResult::isSuccess).count())
                .assetsGenerated(results.stream()
                        .filter(GenerationResult::isSuccess)
                        .map(GenerationResult::getAssetPath)
                        .toList())
                .claudeReviewed(false)
                .build();
    }
}
