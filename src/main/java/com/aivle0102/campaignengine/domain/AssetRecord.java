package com.aivle0102.campaignengine.domain;

import com.aivle0102.campaignengine.client.ReferenceImage;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Getter;

// 에셋 풀에서 읽어온 재사용 브랜드 이미지 (실행 중 읽기 전용)
@Getter
@Builder
public class AssetRecord {
    private final AssetCategory category;
    private final String filename;
    @JsonIgnore
    private final byte[] payload;
    private final String mimeType;
    private final String productMatch; // 매칭된 제품명, 없으면 공용(generic) 에셋
    private final String sourcePath;

    public boolean isGeneric() {
        return productMatch == null;
    }

    public boolean isMatchedTo(String productName) {
        return productMatch != null && productMatch.equals(productName);
    }

    public ReferenceImage toReferenceImage() {
        return new ReferenceImage(filename, payload, mimeType);
    }
}
