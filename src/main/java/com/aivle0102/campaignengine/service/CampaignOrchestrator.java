package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.client.ImageGenerationClient;
import com.aivle0102.campaignengine.client.ImageGenerationException;
import com.aivle0102.campaignengine.client.ReferenceImage;
import com.aivle0102.campaignengine.config.AssetPoolLoader;
import com.aivle0102.campaignengine.config.CampaignProperties;
import com.aivle0102.campaignengine.domain.AspectRatio;
import com.aivle0102.campaignengine.domain.AssetRecord;
import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.domain.CampaignProduct;
import com.aivle0102.campaignengine.domain.CampaignRunState;
import com.aivle0102.campaignengine.domain.ComposedPrompt;
import com.aivle0102.campaignengine.domain.GenerationResult;
import com.aivle0102.campaignengine.domain.GenerationUnit;
import com.aivle0102.campaignengine.dto.CampaignProgressEvent;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Drives one campaign run: expands the brief into (product x aspect ratio) units, processes them
 * strictly one after another, records one result per unit and hands the output off for review.
 * <p>
 * A unit's failure (prompt composition, generation or saving) is recorded and the run moves on.
 * Only directory setup, finalize and progress transport failures abort the run.
 */
@Service
@RequiredArgsConstructor
public class CampaignOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(CampaignOrchestrator.class);

    private final CampaignBriefValidator briefValidator;
    private final AssetPoolLoader assetPoolLoader;
    private final AssetMatcher assetMatcher;
    private final CampaignPromptComposer promptComposer;
    private final ImageGenerationClient imageGenerationClient;
    private final CampaignFileManager fileManager;
    private final CampaignProperties properties;

    public CampaignRunState run(CampaignBrief brief) {
        return run(brief, fileManager.newCampaignId(), CampaignProgressListener.NONE);
    }

    public CampaignRunState run(CampaignBrief brief, String campaignId, CampaignProgressListener listener) {
        CampaignBrief validated = briefValidator.validate(brief);
        CampaignProgressListener progress = listener == null ? CampaignProgressListener.NONE : listener;

        try {
            fileManager.ensureDirectoryStructure();
            fileManager.createCampaignDirectory(campaignId);

            List<String> productNames = validated.getProducts().stream().map(CampaignProduct::getName).toList();
            List<AssetRecord> pool = assetPoolLoader.load(productNames);
            List<GenerationUnit> units = expand(validated, pool);
            log.info("Starting campaign {} (brief {}): {}", campaignId, validated.getCampaignId(), describePlan(units));

            CampaignRunState state = new CampaignRunState(campaignId);
            for (GenerationUnit unit : units) {
                state.append(process(campaignId, unit, validated, progress));
                if (!unit.isLast()) {
                    pause(campaignId);
                }
            }
            log.info("Campaign generation complete: {} success, {} errors", state.getSuccessCount(), state.getFailureCount());

            fileManager.finalizeCampaign(campaignId, validated, state.getResults());
            fileManager.buildIndex(campaignId);

            progress.onEvent(CampaignProgressEvent.complete(state, properties.getCompleteSampleSize()));
            log.info("Campaign {} completed", campaignId);
            return state;
        } catch (CampaignPersistenceException | ProgressTransportException | CampaignRunException e) {
            log.error("Campaign {} aborted: {}", campaignId, e.getMessage(), e);
            emitFatal(progress, campaignId, e.getMessage());
            if (e instanceof CampaignRunException runException) {
                throw runException;
            }
            throw new CampaignRunException(campaignId, e.getMessage(), e);
        }
    }

    // 제품(브리프 순서) x 비율(고정 순서) 작업 행렬
    public List<GenerationUnit> expand(CampaignBrief brief, List<AssetRecord> pool) {
        List<AspectRatio> ratios = AspectRatio.GENERATION_ORDER;
        int total = brief.getProducts().size() * ratios.size();
        List<GenerationUnit> units = new ArrayList<>(total);
        int index = 1;
        for (CampaignProduct product : brief.getProducts()) {
            List<AssetRecord> matched = assetMatcher.selectForProduct(product.getName(), pool);
            for (AspectRatio ratio : ratios) {
                units.add(new GenerationUnit(index++, total, product, ratio, matched));
            }
        }
        return units;
    }

    private GenerationResult process(String campaignId, GenerationUnit unit, CampaignBrief brief,
                                     CampaignProgressListener progress) {
        String label = "[" + unit.index() + "/" + unit.total() + "] " + unit.product().getName()
                + " " + unit.aspectRatio().label();
        progress.onEvent(CampaignProgressEvent.generating(campaignId, unit));

        ComposedPrompt prompt = null;
        GenerationResult result;
        try {
            prompt = promptComposer.compose(unit.product(), unit.aspectRatio(), brief, unit.matchedAssets());
            List<ReferenceImage> references = prompt.getAssociatedAssets().stream()
                    .map(AssetRecord::toReferenceImage)
                    .toList();
            log.info("{} Generating ({}){}", label, prompt.generationMethod().tag(),
                    references.isEmpty() ? "" : " with assets " + prompt.usedAssetNames());

            byte[] image = imageGenerationClient.generate(prompt.getGeneratedPrompt(), references, unit.aspectRatio());
            String assetPath = fileManager.save(campaignId, unit.product().getName(), unit.aspectRatio(), image,
                    prompt.getGeneratedPrompt(), prompt.getBrandContext(), prompt.usedAssetNames());
            result = GenerationResult.saved(prompt, assetPath);
        } catch (ImageGenerationException e) {
            log.error("{} Failed ({}): {}", label, e.getKind(), e.getMessage());
            result = GenerationResult.failed(unit, prompt, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} Failed: {}", label, e.getMessage(), e);
            result = GenerationResult.failed(unit, prompt, e.getMessage());
        }

        if (result.isSuccess()) {
            log.info("{} Success: {}", label, result.getAssetPath());
            progress.onEvent(CampaignProgressEvent.completed(campaignId, unit, result));
        } else {
            progress.onEvent(CampaignProgressEvent.unitFailed(campaignId, unit, result));
        }
        return result;
    }

    private void pause(String campaignId) {
        Duration delay = properties.getInterUnitDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CampaignRunException(campaignId, "Campaign run interrupted", e);
        }
    }

    private void emitFatal(CampaignProgressListener progress, String campaignId, String message) {
        try {
            progress.onEvent(CampaignProgressEvent.fatal(campaignId, message));
        } catch (RuntimeException e) {
            log.warn("Could not deliver error event for campaign {}: {}", campaignId, e.getMessage());
        }
    }

    private String describePlan(List<GenerationUnit> units) {
        List<String> products = units.stream().map(u -> u.product().getName()).distinct().toList();
        Map<String, Long> assetBreakdown = units.stream()
                .filter(u -> u.aspectRatio() == AspectRatio.GENERATION_ORDER.get(0))
                .flatMap(u -> u.matchedAssets().stream())
                .collect(Collectors.groupingBy(a -> a.getCategory().code(), TreeMap::new, Collectors.counting()));
        String assets = assetBreakdown.isEmpty()
                ? "no existing assets"
                : assetBreakdown.entrySet().stream()
                        .map(e -> e.getValue() + " " + e.getKey())
                        .collect(Collectors.joining(", "));
        return units.size() + " units for " + products.size() + " products " + products + " using " + assets;
    }
}
