package com.aivle0102.campaignengine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory state of a single campaign run. Owned by the orchestrator; only ever appended to.
 */
public class CampaignRunState {

    private final String campaignId;
    private final List<GenerationResult> results = new ArrayList<>();
    private int successCount;
    private int failureCount;

    public CampaignRunState(String campaignId) {
        this.campaignId = campaignId;
    }

    public void append(GenerationResult result) {
        results.add(result);
        if (result.isSuccess()) {
            successCount++;
        } else {
            failureCount++;
        }
    }

    public String getCampaignId() {
        return campaignId;
    }

    public List<GenerationResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public int getSuccessCount() {
        return successCount;
    }

    public int getFailureCount() {
        return failureCount;
    }

    public int getTotalCount() {
        return results.size();
    }

    public List<GenerationResult> successfulResults(int limit) {
        return results.stream().filter(GenerationResult::isSuccess).limit(limit).toList();
    }
}
