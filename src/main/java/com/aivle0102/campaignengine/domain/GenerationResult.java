package com.aivle0102.campaignengine.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

// 유닛 하나의 처리 결과. 실행의 감사 기록(audit trail)을 이룬다.
@Getter
@Builder
public class GenerationResult {
    private final String productName;
    private final AspectRatio aspectRatio;
    private final String prompt;
    private final boolean success;
    private final String assetPath;
    private final String error;
    private final Instant generatedAt;
    private final List<String> usedAssets;
    private final GenerationMethod generationMethod;

    public static GenerationResult saved(ComposedPrompt prompt, String assetPath) {
        return GenerationResult.builder()
                .productName(prompt.getProductName())
                .aspectRatio(prompt.getAspectRatio())
                .prompt(prompt.getGeneratedPrompt())
                .success(true)
                .assetPath(assetPath)
                .generatedAt(Instant.now())
                .usedAssets(prompt.usedAssetNames())
                .generationMethod(prompt.generationMethod())
                .build();
    }

    public static GenerationResult failed(GenerationUnit unit, ComposedPrompt prompt, String error) {
        // 프롬프트 구성 전에 실패했다면 전달된 에셋은 없다
        List<String> usedAssets = prompt != null ? prompt.usedAssetNames() : List.of();
        return GenerationResult.builder()
                .productName(unit.product().getName())
                .aspectRatio(unit.aspectRatio())
                .prompt(prompt == null ? null : prompt.getGeneratedPrompt())
                .success(false)
                .error(error == null ? "Unknown generation error" : error)
                .generatedAt(Instant.now())
                .usedAssets(usedAssets)
                .generationMethod(GenerationMethod.forAssets(usedAssets))
                .build();
    }
}
