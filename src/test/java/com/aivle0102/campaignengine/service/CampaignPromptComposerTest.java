package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.config.JacksonConfig;
import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.AssetCategory;
import com.aivle0102.campaignengine.domain.AssetRecord;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.ComposedPrompt;
import com.aivle0102.campaignengine.domain.GenerationMethod;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.aivle0102.campaignengine.service.CampaignFixtures.asset;
import static org.assertj.core.api.Assertions.assertThat;

class CampaignPromptComposerTest {

    private final ObjectMapper objectMapper = JacksonConfig.campaignObjectMapper();
    private final CampaignPromptComposer composer = new CampaignPromptComposer(objectMapper);
    private final CampaignBriefValidator validator = new CampaignBriefValidator();

    private final CampaignBrief brief = validator.validate(CampaignFixtures.brief("Widget Pro"));

    @Test
    @DisplayName("tall prompt carries the story-format guidance verbatim")
    void tallGuidanceVerbatim() {
        ComposedPrompt prompt = composer.compose(brief.getProducts().get(0), AspectRatio.TALL, brief, List.of());

        assertThat(prompt.getGeneratedPrompt())
                .contains(AspectRatio.TALL.formatSpecificGuidance())
                .contains(AspectRatio.TALL.compositionDetails())
                .contains("Aspect Ratio: 9:16");
    }

    @Test
    @DisplayName("text-only prompt never emits asset instructions")
    void noAssetInstructionsWithoutAssets() {
        for (AspectRatio ratio : AspectRatio.GENERATION_ORDER) {
            ComposedPrompt prompt = composer.compose(brief.getProducts().get(0), ratio, brief, List.of());

            assertThat(prompt.getGeneratedPrompt())
                    .doesNotContain("ASSET COMPOSITION INSTRUCTIONS")
                    .doesNotContain("ASSET INTEGRATION")
                    .doesNotContain("image 1");
            assertThat(prompt.generationMethod()).isEqualTo(GenerationMethod.TEXT_TO_IMAGE);
            assertThat(prompt.isFallback()).isFalse();
        }
    }

    @Test
    @DisplayName("asset-aware prompt numbers images and places the logo per ratio")
    void assetInstructions() {
        List<AssetRecord> assets = List.of(
                asset(AssetCategory.LOGO, "brand_logo.png", null),
                asset(AssetCategory.BACKGROUND, "studio_bg.png", null),
                asset(AssetCategory.PRODUCT_IMAGE, "widget_pro.png", "Widget Pro"));

        ComposedPrompt tall = composer.compose(brief.getProducts().get(0), AspectRatio.TALL, brief, assets);
        ComposedPrompt square = composer.compose(brief.getProducts().get(0), AspectRatio.SQUARE, brief, assets);

        assertThat(tall.getGeneratedPrompt())
                .contains("ASSET COMPOSITION INSTRUCTIONS")
                .contains("- Logo: Use the logo from image 1 (brand_logo.png) - position in top third area for story format visibility")
                .contains("- Background: Use the background from image 2 (studio_bg.png) as the base layer")
                .contains("- Product Image: Incorporate the product visual from image 3 (widget_pro.png) as hero element");
        assertThat(square.getGeneratedPrompt()).contains("position in bottom right corner or top left corner");
        assertThat(tall.usedAssetNames()).containsExactly("brand_logo.png", "studio_bg.png", "widget_pro.png");
        assertThat(tall.generationMethod()).isEqualTo(GenerationMethod.MULTI_IMAGE_COMPOSITION);
    }

    @Test
    @DisplayName("prompt includes brand constraints, audience and message")
    void brandConstraints() {
        ComposedPrompt prompt = composer.compose(brief.getProducts().get(0), AspectRatio.WIDE, brief, List.of());

        assertThat(prompt.getGeneratedPrompt())
                .contains("Brand Colors: #0A2540, #00D4FF")
                .contains("Visual Tone: confident and modern")
                .contains("Required Elements: brand logo, legal disclaimer")
                .contains("Prohibited Content: competitor mentions, unsubstantiated claims")
                .contains("Target Audience: young professionals")
                .contains("\"Power your day\"")
                .contains("Key Features: long battery life, compact design");
        assertThat(prompt.getTargetAudience()).isEqualTo("young professionals");
    }

    @Test
    @DisplayName("brand context is a JSON snapshot of the guidelines")
    void brandContextSnapshot() throws Exception {
        ComposedPrompt prompt = composer.compose(brief.getProducts().get(0), AspectRatio.SQUARE, brief, List.of());

        JsonNode context = objectMapper.readTree(prompt.getBrandContext());
        assertThat(context.get("tone").asText()).isEqualTo("confident and modern");
        assertThat(context.get("colors")).hasSize(2);
    }

    @Test
    @DisplayName("broken template falls back to a plain prompt without assets")
    void fallbackOnRenderFailure() {
        CampaignPromptComposer broken = new CampaignPromptComposer(objectMapper, "%q %1$s", "%q %1$s");
        List<AssetRecord> assets = List.of(asset(AssetCategory.LOGO, "brand_logo.png", null));

        ComposedPrompt prompt = broken.compose(brief.getProducts().get(0), AspectRatio.TALL, brief, assets);

        assertThat(prompt.isFallback()).isTrue();
        assertThat(prompt.getAssociatedAssets()).isEmpty();
        assertThat(prompt.getGeneratedPrompt())
                .startsWith("Professional Widget Pro product photography for 9:16 social media format.")
                .contains(AspectRatio.TALL.formatSpecificGuidance());
    }
}
