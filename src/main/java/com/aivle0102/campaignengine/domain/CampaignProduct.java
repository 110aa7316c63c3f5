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
public class CampaignProduct {
    private String name;
    private String category;
    private List<String> keyFeatures;
}
