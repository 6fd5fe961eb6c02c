package com.hivemind.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hivemind.core.config.HivemindProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PlatformClientConfig {

    private static final Logger log = LoggerFactory.getLogger(PlatformClientConfig.class);

    @Bean
    public PlatformClient platformClient(HivemindProperties properties, ObjectProvider<ObjectMapper> objectMapper) {
        var client = new TablePlatformClient(properties.getPlatform(), objectMapper.getIfAvailable(ObjectMapper::new));
        if (client.isConfigured()) {
            log.info("Platform client targeting {}", properties.getPlatform().getBaseUrl());
        } else {
            log.info("No platform endpoint configured, generated artifacts will not be deployed");
        }
        return client;
    }
}
