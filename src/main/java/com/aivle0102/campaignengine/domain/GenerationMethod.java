package com.aivle0102.campaignengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;

public enum GenerationMethod {
    MULTI_IMAGE_COMPOSITION("multi-image-composition"),
    TEXT_TO_IMAGE("text-to-image");

    private final String tag;

    GenerationMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static GenerationMethod forAssets(Collection<?> usedAssets) {
        return usedAssets == null || usedAssets.isEmpty() ? TEXT_TO_IMAGE : MULTI_IMAGE_COMPOSITION;
    }
}
