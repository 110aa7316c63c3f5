package com.aivle0102.campaignengine.client;

public class ImageGenerationException extends Exception {

    private final GenerationErrorKind kind;

    // message 가 없으면 kind 의 기본 메시지를 쓴다
    public ImageGenerationException(GenerationErrorKind kind, String message) {
        super(message != null ? message : kind.defaultMessage());
        this.kind = kind;
    }

    public ImageGenerationException(GenerationErrorKind kind, String message, Throwable cause) {
        super(message != null ? message : kind.defaultMessage(), cause);
        this.kind = kind;
    }

    public GenerationErrorKind getKind() {
        return kind;
    }
}
