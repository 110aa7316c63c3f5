package com.aivle0102.campaignengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

public enum AssetCategory {
    LOGO("logo", "logos"),
    BACKGROUND("background", "backgrounds"),
    PRODUCT_IMAGE("product-image", "product-images");

    // 에셋 풀 스캔 순서 (logos -> backgrounds -> product-images)
    public static final List<AssetCategory> SCAN_ORDER = List.of(LOGO, BACKGROUND, PRODUCT_IMAGE);

    private final String code;
    private final String directoryName;

    AssetCategory(String code, String directoryName) {
        this.code = code;
        this.directoryName = directoryName;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String directoryName() {
        return directoryName;
    }
}
