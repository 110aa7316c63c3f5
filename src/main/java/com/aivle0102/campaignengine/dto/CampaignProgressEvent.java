package com.aivle0102.campaignengine.dto;

import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.CampaignRunState;
import com.aivle0102.campaignengine.domain.GenerationMethod;
import com.aivle0102.campaignengine.domain.GenerationResult;
import com.aivle0102.campaignengine.domain.GenerationUnit;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

// 진행 스트림의 프레임 하나 (type: progress | complete | error)
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CampaignProgressEvent {

    public static final String TYPE_PROGRESS = "progress";
    public static final String TYPE_COMPLETE = "complete";
    public static final String TYPE_ERROR = "error";

    public static final String STATUS_GENERATING = "generating";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_ERROR = "error";

    private final String type;
    private final String campaignId;

    // progress
    private final Integer current;
    private final Integer total;
    private final String product;
    private final AspectRatio aspectRatio;
    private final String status;
    private final Integer assetsUsed;
    private final GenerationMethod generationMethod;
    private final String error;

    // complete
    private final Integer successCount;
    private final Integer errorCount;
    private final Integer totalCount;
    private final List<GenerationResult> results;
    private final CompletionSummary summary;

    public static CampaignProgressEvent generating(String campaignId, GenerationUnit unit) {
        return unitFrame(campaignId, unit, STATUS_GENERATING).build();
    }

    // completed / error 프레임의 assetsUsed 는 실제로 전달된 에셋 수 (fallback 프롬프트면 0)
    public static CampaignProgressEvent completed(String campaignId, GenerationUnit unit, GenerationResult result) {
        return unitFrame(campaignId, unit, STATUS_COMPLETED)
                .assetsUsed(sentAssetCount(result))
                .generationMethod(result.getGenerationMethod())
                .build();
    }

    public static CampaignProgressEvent unitFailed(String campaignId, GenerationUnit unit, GenerationResult result) {
        return unitFrame(campaignId, unit, STATUS_ERROR)
                .assetsUsed(sentAssetCount(result))
                .error(result.getError())
                .build();
    }

    public static CampaignProgressEvent complete(CampaignRunState state, int sampleSize) {
        int total = state.getTotalCount();
        int successful = state.getSuccessCount();
        return CampaignProgressEvent.builder()
                .type(TYPE_COMPLETE)
                .campaignId(state.getCampaignId())
                .successCount(successful)
                .errorCount(state.getFailureCount())
                .totalCount(total)
                .results(state.successfulResults(sampleSize))
                .summary(new CompletionSummary(
                        total,
                        successful,
                        state.getFailureCount(),
                        total == 0 ? 0 : (int) Math.round(successful * 100.0 / total)))
                .build();
    }

    public static CampaignProgressEvent fatal(String campaignId, String error) {
        return CampaignProgressEvent.builder()
                .type(TYPE_ERROR)
                .campaignId(campaignId)
                .error(error == null ? "Campaign generation failed" : error)
                .build();
    }

    public static CampaignProgressEvent queued(String campaignId) {
        return CampaignProgressEvent.builder()
                .type(TYPE_PROGRESS)
                .campaignId(campaignId)
                .status("queued")
                .build();
    }

    private static CampaignProgressEventBuilder unitFrame(String campaignId, GenerationUnit unit, String status) {
        return CampaignProgressEvent.builder()
                .type(TYPE_PROGRESS)
                .campaignId(campaignId)
                .current(unit.index())
                .total(unit.total())
                .product(unit.product().getName())
                .aspectRatio(unit.aspectRatio())
                .status(status)
                .assetsUsed(unit.matchedAssets().size());
    }

    private static int sentAssetCount(GenerationResult result) {
        return result.getUsedAssets() == null ? 0 : result.getUsedAssets().size();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return TYPE_COMPLETE.equals(type) || TYPE_ERROR.equals(type);
    }

    @Getter
    @AllArgsConstructor
    public static class CompletionSummary {
        private final int totalAssets;
        private final int successful;
        private final int failed;
        private final int successRate;
    }
}
