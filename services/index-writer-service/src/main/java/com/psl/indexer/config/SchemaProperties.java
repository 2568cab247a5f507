package com.psl.indexer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "schema")
public class SchemaProperties {
    private String fieldsPath = "classpath:schema/paper-fields.yml";
    private String taxonomyPath = "classpath:schema/taxonomy.yml";

    public String getFieldsPath() {
        return fieldsPath;
    }

    public void setFieldsPath(String fieldsPath) {
        this.fieldsPath = fieldsPath;
    }

    public String getTaxonomyPath() {
        return taxonomyPath;
    }

    public void setTaxonomyPath(String taxonomyPath) {
        this.taxonomyPath = taxonomyPath;
    }
}
