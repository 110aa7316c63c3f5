package com.aivle0102.campaignengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CampaignEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CampaignEngineApplication.class, args);
    }
}
