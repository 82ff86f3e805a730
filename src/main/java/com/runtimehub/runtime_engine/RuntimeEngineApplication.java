package com.runtimehub.runtime_engine;

import com.runtimehub.runtime_engine.config.RuntimeHubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableScheduling
@EnableConfigurationProperties(RuntimeHubProperties.class)
public class RuntimeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuntimeEngineApplication.class, args);
    }
}
