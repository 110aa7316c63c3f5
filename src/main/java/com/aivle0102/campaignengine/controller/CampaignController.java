package com.aivle0102.campaignengine.controller;

import com.aivle0102.campaignengine.domain.CampaignBrief;
import com.aivle0102.campaignengine.dto.CampaignProgressEvent;
import com.aivle0102.campaignengine.dto.CampaignValidationReport;
import com.aivle0102.campaignengine.service.CampaignBriefValidator;
import com.aivle0102.campaignengine.service.CampaignFileManager;
import com.aivle0102.campaignengine.service.CampaignOrchestrator;
import com.aivle0102.campaignengine.service.CampaignProgressTracker;
import com.aivle0102.campaignengine.service.CampaignRunException;
import com.aivle0102.campaignengine.service.InvalidCampaignBriefException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

@RestController
@RequestMapping("/api/campaigns")
public class CampaignController {

    private static final Logger log = LoggerFactory.getLogger(CampaignController.class);

    private final CampaignOrchestrator campaignOrchestrator;
    private final CampaignBriefValidator briefValidator;
    private final CampaignFileManager fileManager;
    private final CampaignProgressTracker progressTracker;
    private final TaskExecutor campaignExecutor;

    public CampaignController(CampaignOrchestrator campaignOrchestrator,
                              CampaignBriefValidator briefValidator,
                              CampaignFileManager fileManager,
                              CampaignProgressTracker progressTracker,
                              @Qualifier("campaignExecutor") TaskExecutor campaignExecutor) {
        this.campaignOrchestrator = campaignOrchestrator;
        this.briefValidator = briefValidator;
        this.fileManager = fileManager;
        this.progressTracker = progressTracker;
        this.campaignExecutor = campaignExecutor;
    }

    // 브리프 검증 후 캠페인 실행을 백그라운드로 넘기고 진행 스트림을 바로 돌려준다
    @PostMapping("/generate")
    public SseEmitter generate(@RequestBody CampaignBrief brief) {
        CampaignBrief validated = briefValidator.validate(brief);
        String campaignId = fileManager.newCampaignId();
        progressTracker.open(campaignId);
        SseEmitter emitter = progressTracker.subscribe(campaignId);
        log.info("Starting campaign generation: {} (brief {}, {} products)",
                campaignId, validated.getCampaignId(), validated.getProducts().size());

        try {
            campaignExecutor.execute(() -> runCampaign(validated, campaignId));
        } catch (TaskRejectedException e) {
            log.error("Campaign {} rejected: {}", campaignId, e.getMessage());
            progressTracker.publish(campaignId, CampaignProgressEvent.fatal(campaignId, "Campaign queue is full"));
        }
        return emitter;
    }

    @GetMapping("/{campaignId}/progress")
    public SseEmitter subscribe(@PathVariable("campaignId") String campaignId) {
        return progressTracker.subscribe(campaignId);
    }

    @GetMapping("/{campaignId}/validation")
    public CampaignValidationReport validate(@PathVariable("campaignId") String campaignId) {
        return fileManager.validateOutput(campaignId);
    }

    @ExceptionHandler({InvalidCampaignBriefException.class, IllegalArgumentException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleBadRequest(RuntimeException e) {
        return Map.of("error", e.getMessage());
    }

    private void runCampaign(CampaignBrief brief, String campaignId) {
        try {
            campaignOrchestrator.run(brief, campaignId, progressTracker.listenerFor(campaignId));
        } catch (CampaignRunException e) {
            // error 프레임은 오케스트레이터가 이미 보냈다
            log.error("Campaign {} failed: {}", campaignId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Campaign {} failed unexpectedly", campaignId, e);
            progressTracker.publish(campaignId, CampaignProgressEvent.fatal(campaignId, e.getMessage()));
        }
    }
}
