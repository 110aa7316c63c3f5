package com.aivle0102.campaignengine.client;

import java.util.Locale;

public enum GenerationErrorKind {
    QUOTA_EXCEEDED("API quota exceeded - please wait and try again"),
    AUTHENTICATION_FAILED("Authentication failed - check API key"),
    NOT_FOUND("Model not found or unavailable"),
    SERVER_UNAVAILABLE("Image generation service temporarily unavailable"),
    CONTENT_POLICY_BLOCKED("Request blocked by the content policy"),
    MALFORMED_REQUEST("Image generation request was rejected as malformed"),
    TIMEOUT("Image generation timed out"),
    MALFORMED_RESPONSE("Image generation response did not contain image data"),
    UNKNOWN("Image generation failed");

    private final String defaultMessage;

    GenerationErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public static GenerationErrorKind fromStatus(int status, String body) {
        if (status == 429) return QUOTA_EXCEEDED;
        if (status == 401 || status == 403) return AUTHENTICATION_FAILED;
        if (status == 404) return NOT_FOUND;
        if (status >= 500) return SERVER_UNAVAILABLE;
        if (status == 400 && mentionsContentPolicy(body)) return CONTENT_POLICY_BLOCKED;
        if (status >= 400) return MALFORMED_REQUEST;
        return UNKNOWN;
    }

    private static boolean mentionsContentPolicy(String body) {
        if (body == null) return false;
        String lower = body.toLowerCase(Locale.ROOT);
        return lower.contains("content_policy") || lower.contains("content policy")
                || lower.contains("safety system") || lower.contains("moderation_blocked");
    }
}
