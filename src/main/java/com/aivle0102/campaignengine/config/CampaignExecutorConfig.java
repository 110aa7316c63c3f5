package com.aivle0102.campaignengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class CampaignExecutorConfig {

    // 캠페인 실행은 한 번에 하나씩 (생성 API 쿼터 보호)
    @Bean(name = "campaignExecutor")
    public ThreadPoolTaskExecutor campaignExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("campaign-");
        executor.initialize();
        return executor;
    }
}
