package com.aivle0102.campaignengine.service;

// 캠페인 브리프 검증 실패 (유닛 스케줄 전에 거부)
public class InvalidCampaignBriefException extends RuntimeException {
    public InvalidCampaignBriefException(String message) {
        super(message);
    }
}
