package com.aivle0102.campaignengine.service;

// 실행 전체를 중단시키는 오류 (디렉터리 준비, finalize, 진행 채널 전송 실패)
public class CampaignRunException extends RuntimeException {

    private final String campaignId;

    public CampaignRunException(String campaignId, String message, Throwable cause) {
        super(message, cause);
        this.campaignId = campaignId;
    }

    public String getCampaignId() {
        return campaignId;
    }
}
