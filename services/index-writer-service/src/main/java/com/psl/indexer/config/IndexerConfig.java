package com.psl.indexer.config;

import com.psl.schema.SchemaRegistry;
import com.psl.schema.SchemaRegistryLoader;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@EnableConfigurationProperties({
    IndexerProperties.class,
    MetadataProperties.class,
    OpenSearchProperties.class,
    SchemaProperties.class
})
public class IndexerConfig {

    @Bean
    public SchemaRegistry schemaRegistry(SchemaProperties properties) {
        return new SchemaRegistryLoader().load(properties.getFieldsPath(), properties.getTaxonomyPath());
    }

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

    @Bean
    public RestTemplate metadataRestTemplate(RestTemplateBuilder builder, MetadataProperties properties) {
        return builder
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService indexerExecutor(IndexerProperties properties) {
        int threads = Math.max(1, Math.min(properties.getConcurrency(), Math.max(1, properties.getBatchSize())));
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "indexer-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
