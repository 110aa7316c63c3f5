package com.aivle0102.campaignengine.client;

import com.aivle0102.campaignengine.config.CampaignProperties;
import com.aivle0102.campaignengine.domain.AspectRatio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// OpenAI Images API 호출 전용 클래스

@Component
public class OpenAiImageClient implements ImageGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiImageClient.class);

    private final WebClient openAiImageWebClient;
    private final String imageModel;
    private final Duration timeout;

    public OpenAiImageClient(
            @Qualifier("openAiImageWebClient") WebClient openAiImageWebClient,
            @Value("${openai.image-model:gpt-image-1}") String imageModel,
            CampaignProperties properties
    ) {
        this.openAiImageWebClient = openAiImageWebClient;
        this.imageModel = imageModel;
        this.timeout = properties.getGenerationTimeout();
    }

    @Override
    public byte[] generate(String prompt, List<ReferenceImage> referenceImages, AspectRatio aspectRatio)
            throws ImageGenerationException {
        List<ReferenceImage> references = referenceImages == null ? List.of() : referenceImages;
        log.debug("Calling OpenAI images API: model={}, size={}, references={}, promptLength={}",
                imageModel, aspectRatio.imageSize(), references.size(), prompt.length());

        Map<String, Object> res;
        try {
            res = references.isEmpty()
                    ? generateFromPrompt(prompt, aspectRatio)
                    : generateWithEdit(prompt, references, aspectRatio);
        } catch (WebClientResponseException e) {
            String bodyText = e.getResponseBodyAsString();
            GenerationErrorKind kind = GenerationErrorKind.fromStatus(e.getStatusCode().value(), bodyText);
            log.error("OpenAI images API error: status={}, kind={}, body={}", e.getStatusCode(), kind, bodyText);
            throw new ImageGenerationException(kind, kind.defaultMessage() + " (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (WebClientRequestException e) {
            throw new ImageGenerationException(GenerationErrorKind.SERVER_UNAVAILABLE,
                    GenerationErrorKind.SERVER_UNAVAILABLE.defaultMessage() + ": " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout)이 상한을 넘기면 IllegalStateException을 던진다
            throw new ImageGenerationException(GenerationErrorKind.TIMEOUT,
                    GenerationErrorKind.TIMEOUT.defaultMessage() + " after " + timeout.toSeconds() + "s", e);
        } catch (RuntimeException e) {
            throw new ImageGenerationException(GenerationErrorKind.UNKNOWN,
                    GenerationErrorKind.UNKNOWN.defaultMessage() + ": " + e.getMessage(), e);
        }

        return decodeImage(res);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> generateFromPrompt(String prompt, AspectRatio aspectRatio) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", imageModel);
        body.put("prompt", prompt);
        body.put("size", aspectRatio.imageSize());
        applyOutputFormat(body);

        return openAiImageWebClient.post()
                .uri("/images/generations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(Map.class)
                .block(timeout);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> generateWithEdit(String prompt, List<ReferenceImage> references, AspectRatio aspectRatio) {
        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("model", imageModel);
        form.part("prompt", prompt);
        form.part("size", aspectRatio.imageSize());
        for (ReferenceImage reference : references) {
            form.part("image[]", new ByteArrayResource(reference.data()) {
                @Override public String getFilename() { return reference.filename(); }
            }).contentType(MediaType.parseMediaType(reference.mimeType()));
        }
        if (!isGptImageModel()) {
            form.part("response_format", "b64_json");
        }

        return openAiImageWebClient.post()
                .uri("/images/edits")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form.build()))
                .retrieve()
                .bodyToMono(Map.class)
                .block(timeout);
    }

    // GPT 이미지 모델은 항상 b64_json 으로 응답하므로 response_format 을 보내지 않는다
    private void applyOutputFormat(Map<String, Object> body) {
        if (isGptImageModel()) {
            body.put("output_format", "png");
        } else {
            body.put("response_format", "b64_json");
        }
    }

    private boolean isGptImageModel() {
        return imageModel != null && imageModel.startsWith("gpt-image-");
    }

    // OpenAI Images 응답: { data: [ { b64_json: "..." } ], ... }
    private byte[] decodeImage(Map<String, Object> res) throws ImageGenerationException {
        if (res == null) {
            throw malformed("OpenAI response is null");
        }
        Object dataObj = res.get("data");
        if (!(dataObj instanceof List<?> data) || data.isEmpty()) {
            throw malformed("OpenAI response missing data");
        }
        Object first = data.get(0);
        if (!(first instanceof Map<?, ?> firstMap)) {
            throw malformed("OpenAI response data[0] invalid");
        }
        Object b64 = firstMap.get("b64_json");
        if (!(b64 instanceof String s) || s.isBlank()) {
            throw malformed("OpenAI response missing b64_json");
        }
        try {
            return Base64.getDecoder().decode(s);
        } catch (IllegalArgumentException e) {
            throw new ImageGenerationException(GenerationErrorKind.MALFORMED_RESPONSE,
                    "OpenAI response b64_json is not valid base64", e);
        }
    }

    private ImageGenerationException malformed(String detail) {
        return new ImageGenerationException(GenerationErrorKind.MALFORMED_RESPONSE,
                GenerationErrorKind.MALFORMED_RESPONSE.defaultMessage() + ": " + detail);
    }
}
