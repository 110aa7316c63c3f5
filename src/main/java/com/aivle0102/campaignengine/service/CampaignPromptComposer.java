package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.AssetRecord;
import com.aivle0102.campaignengine.domain.BrandGuidelines;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.CampaignProduct;
import com.aivle0102.campaignengine.domain.ComposedPrompt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a product, a target aspect ratio and the brief's brand rules into an image generation
 * instruction. Uses the asset-aware template when reusable assets were matched and the text-only
 * template otherwise; if rendering fails, a plain-text fallback prompt without assets is produced.
 */
@Service
public class CampaignPromptComposer {

    private static final Logger log = LoggerFactory.getLogger(CampaignPromptComposer.class);

    // 템플릿 인자 순서:
    // 1 productName, 2 category, 3 keyFeatures, 4 targetAudience, 5 campaignMessage,
    // 6 brandColors, 7 brandTone, 8 requiredElements, 9 prohibitedContent, 10 aspectRatio,
    // 11 platformOptimization, 12 compositionGuide, 13 formatSpecificGuidance, 14 compositionDetails,
    // 15 assetInstructions, 16 assetIntegrationGuidance
    static final String MULTI_IMAGE_TEMPLATE = """
            Create a professional product marketing image for %1$s:

            ASSET COMPOSITION INSTRUCTIONS:
            %15$s

            PRODUCT DETAILS:
            - Product: %1$s
            - Category: %2$s
            - Key Features: %3$s
            - Target Audience: %4$s
            - Campaign Message: "%5$s"

            BRAND REQUIREMENTS:
            - Brand Colors: %6$s
            - Visual Tone: %7$s
            - Required Elements: %8$s
            - Prohibited Content: %9$s

            TECHNICAL SPECIFICATIONS:
            - Aspect Ratio: %10$s
            - Platform Optimization: %11$s
            - Composition Style: %12$s

            CREATIVE DIRECTION:
            Seamlessly compose all provided images into a cohesive marketing asset that:

            1. ASSET INTEGRATION: %16$s

            2. PRODUCT FOCUS: Showcase the %1$s prominently with clear visibility of its key features: %3$s

            3. BRAND CONSISTENCY:
               - Use brand color palette: %6$s
               - Maintain %7$s visual aesthetic
               - Include required brand elements: %8$s

            4. AUDIENCE APPEAL: Design to resonate with %4$s, conveying the message "%5$s"

            5. FORMAT OPTIMIZATION: %13$s

            6. COMPOSITION: %14$s

            Style: Professional product photography, clean and modern, high resolution, excellent lighting, premium quality aesthetic, marketing-ready commercial image.
            """;

    static final String TEXT_ONLY_TEMPLATE = """
            Create a professional product marketing image for social media:

            PRODUCT DETAILS:
            - Product: %1$s
            - Category: %2$s
            - Key Features: %3$s
            - Target Audience: %4$s
            - Campaign Message: "%5$s"

            BRAND REQUIREMENTS:
            - Brand Colors: %6$s
            - Visual Tone: %7$s
            - Required Elements: %8$s
            - Prohibited Content: %9$s

            TECHNICAL SPECIFICATIONS:
            - Aspect Ratio: %10$s
            - Platform Optimization: %11$s
            - Composition Style: %12$s

            CREATIVE DIRECTION:
            Generate a high-quality, photorealistic product image that:

            1. PRODUCT FOCUS: Showcase the %1$s prominently with clear visibility of its key features: %3$s

            2. BRAND CONSISTENCY:
               - Use brand color palette: %6$s
               - Maintain %7$s visual aesthetic
               - Include required brand elements: %8$s

            3. AUDIENCE APPEAL: Design to resonate with %4$s, conveying the message "%5$s"

            4. FORMAT OPTIMIZATION: %13$s

            5. COMPOSITION: %14$s

            Style: Professional product photography, clean and modern, high resolution, excellent lighting, premium quality aesthetic, marketing-ready commercial image.
            """;

    private static final String DEFAULT_INTEGRATION_GUIDANCE =
            "Create cohesive design elements that work together harmoniously.";

    private final ObjectMapper objectMapper;
    private final String multiImageTemplate;
    private final String textOnlyTemplate;

    @Autowired
    public CampaignPromptComposer(ObjectMapper objectMapper) {
        this(objectMapper, MULTI_IMAGE_TEMPLATE, TEXT_ONLY_TEMPLATE);
    }

    CampaignPromptComposer(ObjectMapper objectMapper, String multiImageTemplate, String textOnlyTemplate) {
        this.objectMapper = objectMapper;
        this.multiImageTemplate = multiImageTemplate;
        this.textOnlyTemplate = textOnlyTemplate;
    }

    public ComposedPrompt compose(CampaignProduct product, AspectRatio aspectRatio, CampaignBrief brief,
                                  List<AssetRecord> matchedAssets) {
        List<AssetRecord> assets = matchedAssets == null ? List.of() : List.copyOf(matchedAssets);
        String brandContext = brandContext(brief.getBrandGuidelines());

        try {
            String generatedPrompt = render(product, aspectRatio, brief, assets);
            return ComposedPrompt.builder()
                    .productName(product.getName())
                    .aspectRatio(aspectRatio)
                    .generatedPrompt(generatedPrompt)
                    .brandContext(brandContext)
                    .targetAudience(brief.getTargetAudience())
                    .associatedAssets(assets)
                    .fallback(false)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Failed to render {} prompt for {}, using fallback text-only prompt: {}",
                    aspectRatio.label(), product.getName(), e.toString());
            return ComposedPrompt.builder()
                    .productName(product.getName())
                    .aspectRatio(aspectRatio)
                    .generatedPrompt(fallbackPrompt(product, aspectRatio, brief))
                    .brandContext(brandContext)
                    .targetAudience(brief.getTargetAudience())
                    .associatedAssets(List.of())
                    .fallback(true)
                    .build();
        }
    }

    private String render(CampaignProduct product, AspectRatio aspectRatio, CampaignBrief brief,
                          List<AssetRecord> assets) {
        BrandGuidelines guidelines = brief.getBrandGuidelines();
        AssetInstructions instructions = buildAssetInstructions(assets, aspectRatio);
        String template = assets.isEmpty() ? textOnlyTemplate : multiImageTemplate;

        return template.formatted(
                product.getName(),
                product.getCategory(),
                String.join(", ", product.getKeyFeatures()),
                brief.getTargetAudience(),
                brief.getCampaignMessage(),
                String.join(", ", guidelines.getColors()),
                guidelines.getTone(),
                requiredElements(guidelines),
                String.join(", ", guidelines.getProhibitedContent()),
                aspectRatio.label(),
                aspectRatio.platformOptimization(),
                aspectRatio.compositionGuide(),
                aspectRatio.formatSpecificGuidance(),
                aspectRatio.compositionDetails(),
                instructions.instructions(),
                instructions.integrationGuidance()
        );
    }

    // 에셋별 합성 지시문. 이미지 번호는 전달 순서(image 1..N)와 같다.
    AssetInstructions buildAssetInstructions(List<AssetRecord> assets, AspectRatio aspectRatio) {
        List<String> instructions = new ArrayList<>();
        List<String> guidance = new ArrayList<>();

        for (int i = 0; i < assets.size(); i++) {
            AssetRecord asset = assets.get(i);
            String imageRef = "image " + (i + 1);
            switch (asset.getCategory()) {
                case LOGO -> {
                    instructions.add("- Logo: Use the logo from %s (%s) - %s"
                            .formatted(imageRef, asset.getFilename(), aspectRatio.logoPlacement()));
                    guidance.add("Ensure the logo from %s is prominently positioned and maintains brand visibility"
                            .formatted(imageRef));
                }
                case BACKGROUND -> {
                    instructions.add("- Background: Use the background from %s (%s) as the base layer"
                            .formatted(imageRef, asset.getFilename()));
                    guidance.add("Use the background from %s as foundation, ensuring good contrast for text and product"
                            .formatted(imageRef));
                }
                case PRODUCT_IMAGE -> {
                    instructions.add("- Product Image: Incorporate the product visual from %s (%s) as hero element"
                            .formatted(imageRef, asset.getFilename()));
                    guidance.add("Feature the product from %s prominently while maintaining natural composition"
                            .formatted(imageRef));
                }
            }
        }

        return new AssetInstructions(
                String.join("\n", instructions),
                guidance.isEmpty() ? DEFAULT_INTEGRATION_GUIDANCE : String.join(", ", guidance)
        );
    }

    // 템플릿 렌더링 실패 시 사용. 검증된 문자열만 이어 붙이므로 실패하지 않는다.
    String fallbackPrompt(CampaignProduct product, AspectRatio aspectRatio, CampaignBrief brief) {
        BrandGuidelines guidelines = brief.getBrandGuidelines();
        return "Professional " + product.getName() + " product photography for " + aspectRatio.label()
                + " social media format.\n"
                + "Product features: " + String.join(", ", product.getKeyFeatures()) + ".\n"
                + "Brand colors: " + String.join(", ", guidelines.getColors()) + ".\n"
                + "Visual tone: " + guidelines.getTone() + ".\n"
                + "Target audience: " + brief.getTargetAudience() + ".\n"
                + "Campaign message: \"" + brief.getCampaignMessage() + "\".\n"
                + aspectRatio.formatSpecificGuidance() + ".\n"
                + "High-quality, commercial photography style with professional lighting and composition.";
    }

    private String requiredElements(BrandGuidelines guidelines) {
        List<String> required = guidelines.getRequiredElements();
        return required == null || required.isEmpty() ? "brand logo" : String.join(", ", required);
    }

    private String brandContext(BrandGuidelines guidelines) {
        try {
            return objectMapper.writeValueAsString(guidelines);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize brand guidelines: {}", e.getMessage());
            return "{}";
        }
    }

    record AssetInstructions(String instructions, String integrationGuidance) {
    }
}
