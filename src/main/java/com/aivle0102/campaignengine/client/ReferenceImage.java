package com.aivle0102.campaignengine.client;

// 생성 요청에 함께 보내는 참조 이미지
public record ReferenceImage(String filename, byte[] data, String mimeType) {
}
