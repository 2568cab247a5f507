package com.psl.search.opensearch;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties(OpenSearchProperties.class)
public class OpenSearchConfig {

    @Bean
    public RestTemplate openSearchRestTemplate(RestTemplateBuilder builder, OpenSearchProperties properties) {
        RestTemplateBuilder configured = builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()));
        if (properties.getUsername() != null && !properties.getUsername().isBlank()) {
            configured = configured.basicAuthentication(properties.getUsername(), properties.getPassword());
        }
        return configured.build();
    }
}
