package com.psl.search.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.schema.document.PaperDocument;
import com.psl.schema.identifier.PaperIdentifier;
import com.psl.search.api.dto.DocumentSetResponse;
import com.psl.search.api.dto.MatchedAuthor;
import com.psl.search.api.dto.PaperHit;
import com.psl.search.opensearch.OpenSearchGateway;
import com.psl.search.pagination.PageLinks;
import com.psl.search.pagination.PagePlan;
import com.psl.search.pagination.PaginationPlanner;
import com.psl.search.query.PaperQuery;
import com.psl.search.query.QueryBuilder;
import com.psl.search.query.SortOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class PaperSearchService {
    private static final Logger log = LoggerFactory.getLogger(PaperSearchService.class);

    private final OpenSearchGateway gateway;
    private final QueryBuilder queryBuilder;
    private final PaginationPlanner planner;
    private final ObjectMapper objectMapper;

    public PaperSearchService(
        OpenSearchGateway gateway,
        QueryBuilder queryBuilder,
        PaginationPlanner planner,
        ObjectMapper objectMapper
    ) {
        this.gateway = gateway;
        this.queryBuilder = queryBuilder;
        this.planner = planner;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs one page of a paper search. {@code request} is the current request URI, used to build page links.
     */
    public DocumentSetResponse search(
        PaperQuery query,
        Integer start,
        Integer size,
        String cursor,
        UriComponentsBuilder request
    ) {
        SortOrder order = queryBuilder.effectiveOrder(query);
        PagePlan plan = planner.plan(start, size, cursor, order);
        JsonNode response = gateway.search(queryBuilder.buildSearchBody(query, plan));

        JsonNode hitsNode = response.path("hits");
        long total = hitsNode.path("total").path("value").asLong(0);
        List<PaperHit> results = new ArrayList<>();
        JsonNode lastSort = null;
        for (JsonNode hit : hitsNode.path("hits")) {
            results.add(new PaperHit(toDocument(hit), matchedAuthors(hit)));
            lastSort = hit.path("sort");
        }
        PageLinks links = planner.links(plan, total, results.size(), lastSort, order, request);
        log.debug(
            "paper_search searchtype={} order={} total={} returned={} cursor={}",
            query.searchType(),
            order.getKey(),
            total,
            results.size(),
            plan.isCursor()
        );

        DocumentSetResponse.Metadata metadata = new DocumentSetResponse.Metadata();
        metadata.setQuery(echo(query, order));
        metadata.setTotal(total);
        metadata.setPagination(links);
        DocumentSetResponse body = new DocumentSetResponse();
        body.setMetadata(metadata);
        body.setResults(results);
        return body;
    }

    /**
     * A versionless id resolves to the current version; a versioned id to exactly that version.
     */
    public PaperDocument getPaper(String id) {
        PaperIdentifier identifier;
        try {
            identifier = PaperIdentifier.parse(id);
        } catch (IllegalArgumentException e) {
            throw new DocumentNotFoundException(id);
        }
        Map<String, Object> filters = new LinkedHashMap<>();
        if (identifier.isVersioned()) {
            filters.put("paper_id_v", PaperDocument.composeId(identifier.paperId(), identifier.version().orElseThrow()));
        } else {
            filters.put("paper_id", identifier.paperId());
            filters.put("is_current", true);
        }
        JsonNode hits = gateway.search(queryBuilder.buildLookupBody(filters)).path("hits").path("hits");
        if (!hits.isArray() || hits.isEmpty()) {
            throw new DocumentNotFoundException(id);
        }
        return toDocument(hits.get(0));
    }

    private PaperDocument toDocument(JsonNode hit) {
        return objectMapper.convertValue(hit.path("_source"), PaperDocument.class);
    }

    private List<MatchedAuthor> matchedAuthors(JsonNode hit) {
        Map<Integer, String> byPosition = new TreeMap<>();
        hit.path("inner_hits").fields().forEachRemaining(entry -> {
            if (!entry.getKey().startsWith(QueryBuilder.AUTHOR_INNER_HITS)) {
                return;
            }
            for (JsonNode inner : entry.getValue().path("hits").path("hits")) {
                JsonNode offset = inner.path("_nested").path("offset");
                if (offset.isInt()) {
                    byPosition.putIfAbsent(offset.asInt(), inner.path("_source").path("full_name").asText(null));
                }
            }
        });
        List<MatchedAuthor> matched = new ArrayList<>();
        byPosition.forEach((position, fullName) -> matched.add(new MatchedAuthor(position, fullName)));
        return matched;
    }

    private Map<String, Object> echo(PaperQuery query, SortOrder order) {
        Map<String, Object> echo = new LinkedHashMap<>();
        if (query.hasText()) {
            echo.put("query", query.text());
            echo.put("searchtype", query.searchType().name().toLowerCase());
        }
        if (!query.primaryCategories().isEmpty()) {
            echo.put("primary_category", query.primaryCategories());
        }
        echo.put("order", order.getKey());
        echo.put("include_older_versions", query.includeOlderVersions());
        return echo;
    }
}
