package com.psl.indexer.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.opensearch.OpenSearchGateway;
import com.psl.indexer.opensearch.OpenSearchRequestException;
import com.psl.indexer.opensearch.OpenSearchUnavailableException;
import com.psl.schema.document.PaperDocument;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sends a batch of documents as one bulk call and reports a verdict per {@code paper_id_v}. Each document is an
 * update whose script replaces the stored source unless its content hash is unchanged, with the document itself
 * as upsert, so re-sending an unchanged document is a no-op. Never retries; retry policy belongs to the caller.
 */
@Component
public class IndexWriter {
    private static final Logger log = LoggerFactory.getLogger(IndexWriter.class);
    private static final TypeReference<Map<String, Object>> SOURCE_TYPE = new TypeReference<>() {};
    static final String REPLACE_UNLESS_UNCHANGED =
        "if (ctx._source." + ContentHasher.FIELD + " == params.doc." + ContentHasher.FIELD + ") { ctx.op = 'noop'; } "
            + "else { ctx._source.clear(); ctx._source.putAll(params.doc); }";

    private final OpenSearchGateway gateway;
    private final ObjectMapper objectMapper;
    private final ContentHasher contentHasher;

    public IndexWriter(OpenSearchGateway gateway, ObjectMapper objectMapper) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.contentHasher = new ContentHasher(objectMapper);
    }

    public BatchResult upsert(String index, List<PaperDocument> documents) {
        BatchResult result = new BatchResult();
        if (documents == null || documents.isEmpty()) {
            return result;
        }

        String body;
        try {
            body = buildBulkBody(index, documents);
        } catch (JsonProcessingException e) {
            for (PaperDocument document : documents) {
                result.add(ItemResult.rejected(document.getPaperIdV(), "unserializable document: " + e.getOriginalMessage()));
            }
            return result;
        }

        JsonNode response;
        try {
            response = gateway.bulk(body);
        } catch (OpenSearchUnavailableException e) {
            log.warn("bulk_request_failed index={} docs={} transient=true error={}", index, documents.size(), e.getMessage());
            return allItems(documents, ItemOutcome.RETRYABLE, e.getMessage());
        } catch (OpenSearchRequestException e) {
            boolean transientFailure = e.getStatusCode() > 0 && BulkFailureClassifier.isTransient(e.getStatusCode(), null);
            log.warn(
                "bulk_request_failed index={} docs={} transient={} error={}",
                index,
                documents.size(),
                transientFailure,
                e.getMessage()
            );
            return allItems(documents, transientFailure ? ItemOutcome.RETRYABLE : ItemOutcome.REJECTED, e.getMessage());
        }

        for (JsonNode item : response.path("items")) {
            JsonNode action = item.path("update");
            String id = action.path("_id").asText(null);
            if (id == null) {
                continue;
            }
            int status = action.path("status").asInt(0);
            if (status >= 200 && status < 300) {
                result.add(ItemResult.written(id, "noop".equals(action.path("result").asText())));
                continue;
            }
            JsonNode error = action.path("error");
            String type = error.path("type").asText(null);
            String reason = type == null ? "status " + status : type + ": " + error.path("reason").asText("");
            if (BulkFailureClassifier.isTransient(status, type)) {
                result.add(ItemResult.retryable(id, reason));
            } else {
                result.add(ItemResult.rejected(id, reason));
            }
        }

        for (PaperDocument document : documents) {
            if (result.get(document.getPaperIdV()) == null) {
                result.add(ItemResult.retryable(document.getPaperIdV(), "missing from bulk response"));
            }
        }
        log.debug("bulk_completed index={} docs={} errors={}", index, documents.size(), response.path("errors").asBoolean());
        return result;
    }

    String buildBulkBody(String index, List<PaperDocument> documents) throws JsonProcessingException {
        StringBuilder body = new StringBuilder();
        for (PaperDocument document : documents) {
            Map<String, Object> source = objectMapper.convertValue(document, SOURCE_TYPE);
            source.put(ContentHasher.FIELD, contentHasher.hash(source));

            Map<String, Object> action = Map.of("update", Map.of("_index", index, "_id", document.getPaperIdV()));
            Map<String, Object> script = new LinkedHashMap<>();
            script.put("lang", "painless");
            script.put("source", REPLACE_UNLESS_UNCHANGED);
            script.put("params", Map.of("doc", source));
            Map<String, Object> update = new LinkedHashMap<>();
            update.put("script", script);
            update.put("upsert", source);

            body.append(objectMapper.writeValueAsString(action)).append('\n');
            body.append(objectMapper.writeValueAsString(update)).append('\n');
        }
        return body.toString();
    }

    private BatchResult allItems(List<PaperDocument> documents, ItemOutcome outcome, String reason) {
        BatchResult result = new BatchResult();
        for (PaperDocument document : documents) {
            result.add(new ItemResult(document.getPaperIdV(), outcome, reason, false));
        }
        return result;
    }
}
