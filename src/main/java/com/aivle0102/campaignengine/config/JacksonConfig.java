package com.aivle0102.campaignengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * One mapper for briefs, SSE frames and the documents under {@code output/}.
 * Output documents are pretty-printed by the file manager, not here, so SSE frames stay on one line.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return campaignObjectMapper();
    }

    // 스프링 컨텍스트 밖(테스트 등)에서도 같은 설정을 쓰기 위한 팩토리
    public static ObjectMapper campaignObjectMapper() {
        return new ObjectMapper()
                // createdAt, timestamp 등은 ISO-8601 문자열로
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                // 브리프에 모르는 필드가 있어도 무시
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                // "colors": "#000000" 처럼 단일 값도 리스트로 받는다
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);
    }
}
