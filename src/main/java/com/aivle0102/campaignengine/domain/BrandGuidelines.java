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
public class BrandGuidelines {
    private List<String> colors;
    private List<String> fonts;
    private String tone;
    private List<String> requiredElements;   // 비어 있으면 검증 단계에서 기본값 채움
    private List<String> prohibitedContent;
}
