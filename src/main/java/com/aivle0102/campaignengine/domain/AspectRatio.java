package com.aivle0102.campaignengine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

// 캠페인에서 지원하는 출력 비율. 순서가 곧 생성 순서다.
public enum AspectRatio {

    SQUARE("1:1",
            "1024x1024",
            "Instagram feed, Facebook post, LinkedIn post",
            "Centered, balanced composition with equal spacing",
            "Perfect for square Instagram posts - center the product with balanced negative space, ensure all key elements are visible within the square frame",
            "Use central focal point, symmetrical balance, avoid elements that would be cut off in square format",
            "position in bottom right corner or top left corner"),

    TALL("9:16",
            "1024x1536",
            "Instagram Stories, TikTok, Snapchat, vertical social formats",
            "Vertical composition, top-to-bottom visual flow",
            "Optimized for mobile viewing in vertical orientation - stack elements vertically, use the full height effectively, ensure text readability on mobile devices",
            "Utilize vertical space with layered composition, place key messaging in top third for better story visibility, bottom third clear for CTA overlays",
            "position in top third area for story format visibility"),

    WIDE("16:9",
            "1536x1024",
            "YouTube thumbnails, LinkedIn cover, Facebook cover, Twitter header",
            "Horizontal landscape composition, left-to-right flow",
            "Landscape format perfect for cover photos and headers - use horizontal space for storytelling, create dynamic left-to-right visual flow",
            "Leverage wide format for environmental context, use rule of thirds, create depth with foreground/background elements",
            "position in bottom right corner or integrate into header area");

    public static final List<AspectRatio> GENERATION_ORDER = List.of(SQUARE, TALL, WIDE);

    private final String label;
    private final String imageSize;
    private final String platformOptimization;
    private final String compositionGuide;
    private final String formatSpecificGuidance;
    private final String compositionDetails;
    private final String logoPlacement;

    AspectRatio(String label, String imageSize, String platformOptimization, String compositionGuide,
                String formatSpecificGuidance, String compositionDetails, String logoPlacement) {
        this.label = label;
        this.imageSize = imageSize;
        this.platformOptimization = platformOptimization;
        this.compositionGuide = compositionGuide;
        this.formatSpecificGuidance = formatSpecificGuidance;
        this.compositionDetails = compositionDetails;
        this.logoPlacement = logoPlacement;
    }

    @JsonValue
    public String label() {
        return label;
    }

    // 파일 시스템 경로용 표기 (예: 9x16)
    public String pathSegment() {
        return label.replace(':', 'x');
    }

    public String imageSize() {
        return imageSize;
    }

    public String platformOptimization() {
        return platformOptimization;
    }

    public String compositionGuide() {
        return compositionGuide;
    }

    public String formatSpecificGuidance() {
        return formatSpecificGuidance;
    }

    public String compositionDetails() {
        return compositionDetails;
    }

    public String logoPlacement() {
        return logoPlacement;
    }

    @JsonCreator
    public static AspectRatio fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("aspect ratio is null");
        }
        for (AspectRatio ratio : values()) {
            if (ratio.label.equals(value) || ratio.pathSegment().equals(value) || ratio.name().equalsIgnoreCase(value)) {
                return ratio;
            }
        }
        throw new IllegalArgumentException("Unsupported aspect ratio: " + value);
    }
}
