package com.runtimehub.runtime_engine.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate for the HTTP Request and Download File nodes. No call may outlive the
 * per-node execution ceiling.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, RuntimeHubProperties properties) {
        return builder
                .setConnectTimeout(properties.getWorkflow().getMaxNodeExecutionTime())
                .setReadTimeout(properties.getWorkflow().getMaxNodeExecutionTime())
                .build();
    }
}
