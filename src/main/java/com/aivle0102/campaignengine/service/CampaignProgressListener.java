package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.dto.CampaignProgressEvent;

/**
 * One-directional push channel from the orchestrator to whatever is watching a run.
 * <p>
 * Implementations must not block on consumers.
 * <p>
 * {@link ProgressTransportException} is the hook for transports whose failure should stop the
 * run (a caller that must see every frame, for example). Throwing it aborts the run with a
 * terminal error. The SSE transport ({@link CampaignProgressTracker#listenerFor}) never throws it:
 * a subscriber that went away is dropped and the run continues, and its outcome stays
 * available to later subscribers.
 */
@FunctionalInterface
public interface CampaignProgressListener {

    CampaignProgressListener NONE = event -> { };

    void onEvent(CampaignProgressEvent event);
}
