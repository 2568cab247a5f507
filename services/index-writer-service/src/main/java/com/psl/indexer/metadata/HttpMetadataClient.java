package com.psl.indexer.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.config.MetadataProperties;
import com.psl.schema.identifier.PaperIdentifier;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Reads docmeta records over HTTP. {@code GET /docmeta/{paper_id}} returns the newest version and lists the older
 * ones under {@code previous_versions}; each older version is then read from {@code /docmeta/{paper_id}v{n}}.
 */
@Component
public class HttpMetadataClient implements MetadataFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpMetadataClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final MetadataProperties properties;

    public HttpMetadataClient(
        @Qualifier("metadataRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        MetadataProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public PaperVersions fetch(PaperIdentifier identifier) {
        String paperId = identifier.paperId();
        MetadataRecord latest = new MetadataRecord(getDocmeta(paperId));
        List<MetadataRecord> records = new ArrayList<>();
        records.add(latest);

        TreeSet<Integer> previous = new TreeSet<>();
        for (JsonNode entry : latest.get("previous_versions")) {
            int version = entry.isInt() ? entry.asInt() : entry.path("version").asInt(0);
            if (version > 0 && !Integer.valueOf(version).equals(latest.version())) {
                previous.add(version);
            }
        }
        for (Integer version : previous) {
            records.add(new MetadataRecord(getDocmeta(paperId + "v" + version)));
        }
        log.debug("metadata_fetched paper_id={} versions={}", paperId, records.size());
        return new PaperVersions(paperId, records);
    }

    private JsonNode getDocmeta(String id) {
        String url = buildUrl("/docmeta/" + id);
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.GET, HttpEntity.EMPTY, String.class);
            String body = response.getBody();
            if (body == null || body.isBlank()) {
                throw new MetadataFetchException("empty docmeta response for " + id, null, false);
            }
            JsonNode node = objectMapper.readTree(body);
            if (!node.isObject()) {
                throw new MetadataFetchException("docmeta response is not an object for " + id, null, false);
            }
            return node;
        } catch (ResourceAccessException e) {
            throw new MetadataFetchException("metadata source unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 404) {
                throw new PaperNotFoundException(id);
            }
            boolean transientStatus = status >= 500 || status == 429 || status == 408;
            throw new MetadataFetchException("metadata source error: " + status + " for " + id, e, transientStatus);
        } catch (JsonProcessingException e) {
            throw new MetadataFetchException("unparseable docmeta for " + id, e, false);
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
