package com.aivle0102.campaignengine.service;

import com.aivle0102.campaignengine.dto.CampaignProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-campaign SSE subscribers. Keeps the latest frame of every running campaign so late subscribers
 * start from a snapshot, and the terminal frame of recently finished campaigns so a late subscriber
 * still gets the outcome before its stream is closed.
 */
@Service
public class CampaignProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(CampaignProgressTracker.class);

    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;
    private static final int FINISHED_HISTORY_SIZE = 200;

    private final ConcurrentHashMap<String, CampaignProgressEvent> latest = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();

    // 최근 종료된 캠페인의 terminal 프레임 (오래된 것부터 밀려난다)
    private final Map<String, CampaignProgressEvent> finished = Collections.synchronizedMap(
            new LinkedHashMap<String, CampaignProgressEvent>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CampaignProgressEvent> eldest) {
                    return size() > FINISHED_HISTORY_SIZE;
                }
            });

    // 실행 시작 전에 호출. 이 시점부터 구독하면 queued 프레임을 받는다.
    public void open(String campaignId) {
        if (campaignId == null || campaignId.isBlank()) {
            return;
        }
        finished.remove(campaignId);
        latest.putIfAbsent(campaignId, CampaignProgressEvent.queued(campaignId));
    }

    public SseEmitter subscribe(String campaignId) {
        SseEmitter emitter = new SseEmitter(DEFAULT_TIMEOUT_MS);
        if (campaignId == null || campaignId.isBlank()) {
            emitter.complete();
            return emitter;
        }

        CampaignProgressEvent outcome = finished.get(campaignId);
        if (outcome != null) {
            replayAndClose(emitter, outcome);
            return emitter;
        }

        emitters.computeIfAbsent(campaignId, key -> new CopyOnWriteArrayList<>()).add(emitter);
        emitter.onCompletion(() -> removeEmitter(campaignId, emitter));
        emitter.onTimeout(() -> removeEmitter(campaignId, emitter));
        emitter.onError((ex) -> removeEmitter(campaignId, emitter));

        CampaignProgressEvent snapshot = latest.get(campaignId);
        if (snapshot == null) {
            // 종료 프레임이 구독 직전에 발행됐을 수 있다
            CampaignProgressEvent justFinished = finished.get(campaignId);
            removeEmitter(campaignId, emitter);
            replayAndClose(emitter, justFinished != null
                    ? justFinished
                    : CampaignProgressEvent.fatal(campaignId, "Unknown campaign: " + campaignId));
            return emitter;
        }
        if (!send(emitter, snapshot)) {
            removeEmitter(campaignId, emitter);
        }
        return emitter;
    }

    public CampaignProgressListener listenerFor(String campaignId) {
        return event -> publish(campaignId, event);
    }

    // 전송 실패한 구독자는 제거만 하고 실행은 계속된다
    public void publish(String campaignId, CampaignProgressEvent event) {
        if (campaignId == null || event == null) {
            return;
        }
        if (event.isTerminal()) {
            finished.put(campaignId, event);
            latest.remove(campaignId);
        } else {
            latest.put(campaignId, event);
        }
        List<SseEmitter> list = emitters.get(campaignId);
        if (list != null) {
            for (SseEmitter emitter : list) {
                if (!send(emitter, event)) {
                    removeEmitter(campaignId, emitter);
                }
            }
        }
        if (event.isTerminal()) {
            close(campaignId);
        }
    }

    int activeEmitterCount() {
        return emitters.values().stream().mapToInt(List::size).sum();
    }

    private void replayAndClose(SseEmitter emitter, CampaignProgressEvent event) {
        send(emitter, event);
        emitter.complete();
    }

    private boolean send(SseEmitter emitter, CampaignProgressEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.getType()).data(event, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.debug("Dropping progress subscriber: {}", ex.getMessage());
            return false;
        }
    }

    private void close(String campaignId) {
        List<SseEmitter> list = emitters.remove(campaignId);
        if (list == null) {
            return;
        }
        for (SseEmitter emitter : list) {
            emitter.complete();
        }
    }

    private void removeEmitter(String campaignId, SseEmitter emitter) {
        emitters.computeIfPresent(campaignId, (key, list) -> {
            list.remove(emitter);
            return list.isEmpty() ? null : list;
        });
    }
}
