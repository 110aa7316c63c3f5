package com.aivle0102.campaignengine.service;

public class CampaignPersistenceException extends RuntimeException {
    public CampaignPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
