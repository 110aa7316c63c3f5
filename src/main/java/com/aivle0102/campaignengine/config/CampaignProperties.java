package com.aivle0102.campaignengine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    // 상대 경로 계산의 기준 디렉터리 (기본값: 실행 디렉터리)
    private String baseDir = ".";

    private String outputDir = "output";

    private String assetDir = "input/assets";

    // 외부 API rate limit 을 위한 유닛 간 고정 대기
    private Duration interUnitDelay = Duration.ofSeconds(1);

    private Duration generationTimeout = Duration.ofSeconds(120);

    // complete 이벤트에 실어 보낼 성공 결과 샘플 수
    private int completeSampleSize = 5;

    public Path resolvedBaseDir() {
        return Path.of(baseDir).toAbsolutePath().normalize();
    }

    public Path outputRoot() {
        return resolvedBaseDir().resolve(outputDir);
    }

    public Path assetRoot() {
        return resolvedBaseDir().resolve(assetDir);
    }
}
