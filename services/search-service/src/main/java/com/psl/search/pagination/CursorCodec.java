package com.psl.search.pagination;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.psl.search.query.QueryException;
import com.psl.search.query.SortOrder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Opaque cursor: URL-safe base64 of the ordering and the sort values of the last hit served.
 */
@Component
public class CursorCodec {
    private static final String ORDER = "o";
    private static final String AFTER = "a";

    private final ObjectMapper objectMapper;

    public CursorCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(SortOrder order, JsonNode sortValues) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ORDER, order.getKey());
        node.set(AFTER, sortValues);
        try {
            byte[] json = objectMapper.writeValueAsBytes(node);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cursor serialization failed", e);
        }
    }

    /**
     * Sort values to continue after. Cursors are only valid for the ordering they were issued for.
     */
    public List<Object> decode(String cursor, SortOrder expectedOrder) {
        JsonNode node;
        try {
            byte[] json = Base64.getUrlDecoder().decode(cursor.trim());
            node = objectMapper.readTree(new String(json, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException | JsonProcessingException e) {
            throw new QueryException("invalid cursor", e);
        }
        if (node == null || !node.path(AFTER).isArray() || node.path(AFTER).isEmpty()) {
            throw new QueryException("invalid cursor");
        }
        for (JsonNode value : node.path(AFTER)) {
            if (!value.isValueNode() || value.isNull()) {
                throw new QueryException("invalid cursor");
            }
        }
        if (!expectedOrder.getKey().equals(node.path(ORDER).asText())) {
            throw new QueryException("cursor was issued for a different order");
        }
        return objectMapper.convertValue(node.path(AFTER), new TypeReference<List<Object>>() { });
    }
}
