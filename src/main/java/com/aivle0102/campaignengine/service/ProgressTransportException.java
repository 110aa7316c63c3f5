package com.aivle0102.campaignengine.service;

public class ProgressTransportException extends RuntimeException {
    public ProgressTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
