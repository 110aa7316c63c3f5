package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.domain.BrandGuidelines;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.CampaignProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CampaignBriefValidator {

    private static final Logger log = LoggerFactory.getLogger(CampaignBriefValidator.class);

    static final List<String> DEFAULT_REQUIRED_ELEMENTS = List.of("brand logo", "legal disclaimer");
    static final List<String> DEFAULT_PROHIBITED_CONTENT = List.of("competitor mentions", "unsubstantiated claims");

    // 브리프를 검증하고 기본값을 채운 새 브리프를 돌려준다 (입력은 변경하지 않음)
    public CampaignBrief validate(CampaignBrief brief) {
        if (brief == null) {
            throw new InvalidCampaignBriefException("Campaign brief is required");
        }
        if (isBlank(brief.getCampaignId())) {
            throw new InvalidCampaignBriefException("Campaign brief is missing campaignId");
        }
        if (brief.getProducts() == null || brief.getProducts().isEmpty()) {
            throw new InvalidCampaignBriefException("Campaign brief must contain at least one product");
        }

        List<CampaignProduct> products = new ArrayList<>();
        Map<String, String> productDirectories = new HashMap<>();
        for (int i = 0; i < brief.getProducts().size(); i++) {
            CampaignProduct product = brief.getProducts().get(i);
            if (product == null || isBlank(product.getName())) {
                throw new InvalidCampaignBriefException("Product #" + (i + 1) + " is missing a name");
            }
            String name = product.getName().trim();
            // 제품별 출력 디렉터리가 겹치면 뒤 제품이 앞 제품의 이미지를 덮어쓴다
            String directoryKey = CampaignFileManager.productDirectoryName(name).toLowerCase(Locale.ROOT);
            String clash = productDirectories.putIfAbsent(directoryKey, name);
            if (clash != null) {
                throw new InvalidCampaignBriefException(
                        "Product #" + (i + 1) + " '" + name + "' collides with product '" + clash + "'");
            }
            products.add(product.toBuilder()
                    .name(name)
                    .category(product.getCategory() == null ? "" : product.getCategory())
                    .keyFeatures(copyOf(product.getKeyFeatures(), "Product #" + (i + 1) + " keyFeatures"))
                    .build());
        }

        BrandGuidelines guidelines = brief.getBrandGuidelines();
        if (guidelines == null) {
            throw new InvalidCampaignBriefException("Campaign brief is missing brandGuidelines");
        }
        if (guidelines.getColors() == null) {
            throw new InvalidCampaignBriefException("brandGuidelines.colors is required");
        }
        if (isBlank(guidelines.getTone())) {
            throw new InvalidCampaignBriefException("brandGuidelines.tone is required");
        }
        if (guidelines.getColors().size() < 2) {
            log.warn("Limited color palette ({} colors) - consider adding more brand colors for better visual consistency",
                    guidelines.getColors().size());
        }

        BrandGuidelines enhanced = guidelines.toBuilder()
                .colors(copyOf(guidelines.getColors(), "brandGuidelines.colors"))
                .fonts(copyOf(guidelines.getFonts(), "brandGuidelines.fonts"))
                .requiredElements(guidelines.getRequiredElements() == null
                        ? DEFAULT_REQUIRED_ELEMENTS
                        : copyOf(guidelines.getRequiredElements(), "brandGuidelines.requiredElements"))
                .prohibitedContent(guidelines.getProhibitedContent() == null
                        ? DEFAULT_PROHIBITED_CONTENT
                        : copyOf(guidelines.getProhibitedContent(), "brandGuidelines.prohibitedContent"))
                .build();

        return brief.toBuilder()
                .products(List.copyOf(products))
                .targetRegion(nullToEmpty(brief.getTargetRegion()))
                .targetAudience(nullToEmpty(brief.getTargetAudience()))
                .campaignMessage(nullToEmpty(brief.getCampaignMessage()))
                .brandGuidelines(enhanced)
                .build();
    }

    // null 리스트는 빈 리스트로, null 원소는 검증 오류로
    private static List<String> copyOf(List<String> values, String field) {
        if (values == null) {
            return List.of();
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new InvalidCampaignBriefException(field + " has an empty entry at position " + (i + 1));
            }
        }
        return List.copyOf(values);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
