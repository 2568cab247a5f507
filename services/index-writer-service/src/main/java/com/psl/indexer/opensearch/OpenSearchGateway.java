package com.psl.indexer.opensearch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.config.OpenSearchProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Write-side engine calls: bulk indexing plus the index and alias administration needed to bootstrap a run.
 */
@Component
public class OpenSearchGateway {
    private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final OpenSearchProperties properties;

    public OpenSearchGateway(
        @Qualifier("openSearchRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        OpenSearchProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public JsonNode bulk(String ndjson) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(NDJSON);
        return exchange("/_bulk", HttpMethod.POST, new HttpEntity<>(ndjson, headers), false);
    }

    public boolean indexExists(String index) {
        return exchange("/" + index, HttpMethod.GET, HttpEntity.EMPTY, true) != null;
    }

    public void createIndex(String index, Map<String, Object> body) {
        exchange("/" + index, HttpMethod.PUT, jsonEntity(body), false);
    }

    /**
     * Concrete indices the alias points at; empty when the alias does not exist.
     */
    public List<String> aliasTargets(String alias) {
        JsonNode response = exchange("/_alias/" + alias, HttpMethod.GET, HttpEntity.EMPTY, true);
        List<String> indices = new ArrayList<>();
        if (response == null) {
            return indices;
        }
        response.fieldNames().forEachRemaining(indices::add);
        return indices;
    }

    /**
     * {@code _meta} of each concrete index behind {@code indexOrAlias}, keyed by index name.
     */
    public Map<String, JsonNode> mappingMeta(String indexOrAlias) {
        JsonNode response = exchange("/" + indexOrAlias + "/_mapping", HttpMethod.GET, HttpEntity.EMPTY, true);
        Map<String, JsonNode> meta = new LinkedHashMap<>();
        if (response == null) {
            return meta;
        }
        response.fields().forEachRemaining(entry ->
            meta.put(entry.getKey(), entry.getValue().path("mappings").path("_meta"))
        );
        return meta;
    }

    /**
     * Points {@code alias} at {@code index} only, detaching it from {@code previous} in the same atomic call.
     */
    public void swapAlias(String alias, String index, List<String> previous) {
        List<Map<String, Object>> actions = new ArrayList<>();
        for (String old : previous) {
            if (!old.equals(index)) {
                actions.add(Map.of("remove", Map.of("index", old, "alias", alias)));
            }
        }
        actions.add(Map.of("add", Map.of("index", index, "alias", alias)));
        exchange("/_aliases", HttpMethod.POST, jsonEntity(Map.of("actions", actions)), false);
    }

    private HttpEntity<String> jsonEntity(Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            return new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to serialize OpenSearch request", e);
        }
    }

    private JsonNode exchange(String path, HttpMethod method, HttpEntity<?> entity, boolean notFoundAsNull) {
        String url = buildUrl(path);
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, method, entity, String.class);
            String body = response.getBody();
            return body == null || body.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (ResourceAccessException e) {
            throw new OpenSearchUnavailableException("OpenSearch unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404 && notFoundAsNull) {
                return null;
            }
            if (status == 502 || status == 503 || status == 504) {
                throw new OpenSearchUnavailableException("OpenSearch unavailable: " + status, e);
            }
            throw new OpenSearchRequestException("OpenSearch error: " + status, e, status);
        } catch (JsonProcessingException e) {
            throw new OpenSearchRequestException("Failed to parse OpenSearch response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
