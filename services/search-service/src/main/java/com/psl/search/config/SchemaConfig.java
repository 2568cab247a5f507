package com.psl.search.config;

import com.psl.schema.SchemaRegistry;
import com.psl.schema.SchemaRegistryLoader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SchemaProperties.class)
public class SchemaConfig {

    @Bean
    public SchemaRegistry schemaRegistry(SchemaProperties properties) {
        return new SchemaRegistryLoader().load(properties.getFieldsPath(), properties.getTaxonomyPath());
    }
}
