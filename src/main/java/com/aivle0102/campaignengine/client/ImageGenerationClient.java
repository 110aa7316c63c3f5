package com.aivle0102.campaignengine.client;

import com.aivle0102.campaignengine.domain.AspectRatio;

import java.util.List;

/**
 * Boundary to the external image synthesis service.
 * <p>
 * Implementations normalize the provider response once and return raw image bytes; every
 * failure surfaces as an {@link ImageGenerationException} carrying a {@link GenerationErrorKind}.
 * No implementation retries on its own.
 */
public interface ImageGenerationClient {

    /**
     * @param prompt          generation instruction
     * @param referenceImages images to compose into the output, empty for text-only generation
     * @param aspectRatio     requested output shape
     * @return the rendered image bytes
     */
    byte[] generate(String prompt, List<ReferenceImage> referenceImages, AspectRatio aspectRatio)
            throws ImageGenerationException;
}
