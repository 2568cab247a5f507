package com.psl.search.query;

import com.psl.schema.SchemaRegistry;
import com.psl.schema.taxonomy.Taxonomy;
import com.psl.search.pagination.PagePlan;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Translates a {@link PaperQuery} into an engine search body.
 *
 * <p>Free text is scored against a ranked field set: exact title keyword, folded title keyword, stemmed title, the
 * {@code combined} aggregate and finally {@code fulltext}. Author matches run inside the nested {@code authors}
 * documents with inner hits so the matching author can be reported back.
 */
@Component
public class QueryBuilder {
    public static final String AUTHOR_INNER_HITS = "authors";
    static final String PRIMARY_CATEGORY = "primary_classification.category.id";
    static final String SECONDARY = "secondary_classification";
    static final String SECONDARY_CATEGORY = "secondary_classification.category.id";
    static final String TIE_BREAKER = "paper_id_v";

    private static final List<String> EXCLUDED_SOURCE = List.of("combined", "authors_combined", "content_hash");
    private static final int INNER_HITS_SIZE = 10;

    private static final FieldSet ALL_FIELDS = new FieldSet(
        "title.exact",
        "title.folded",
        List.of("title^5", "combined^2", "combined.folded^2", "fulltext"),
        List.of("title.folded", "combined.folded")
    );
    private static final FieldSet TITLE_FIELDS = new FieldSet(
        "title.exact",
        "title.folded",
        List.of("title"),
        List.of("title", "title.folded")
    );
    private static final FieldSet ABSTRACT_FIELDS = new FieldSet(
        null,
        null,
        List.of("abstract^2", "abstract.folded"),
        List.of("abstract.folded")
    );

    private final Taxonomy taxonomy;
    private final String authorsPath;

    public QueryBuilder(SchemaRegistry registry) {
        for (FieldSet fields : List.of(ALL_FIELDS, TITLE_FIELDS, ABSTRACT_FIELDS)) {
            fields.paths().forEach(registry::requireField);
        }
        registry.requireField(PRIMARY_CATEGORY);
        registry.requireField(SECONDARY_CATEGORY);
        registry.requireField(TIE_BREAKER);
        this.taxonomy = registry.taxonomy();
        this.authorsPath = registry.nestedPathOf("authors.full_name");
        if (authorsPath == null) {
            throw new IllegalStateException("authors must be a nested field");
        }
    }

    public Map<String, Object> buildSearchBody(PaperQuery query, PagePlan page) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", buildQuery(query));
        body.put("sort", buildSort(query));
        body.put("size", page.size());
        if (page.isCursor()) {
            body.put("search_after", page.searchAfter());
        } else {
            body.put("from", page.start());
        }
        body.put("track_total_hits", true);
        body.put("_source", Map.of("excludes", EXCLUDED_SOURCE));
        return body;
    }

    /**
     * Body selecting one document by exact keyword filters, for paper lookups.
     */
    public Map<String, Object> buildLookupBody(Map<String, Object> exactFilters) {
        List<Object> filter = new ArrayList<>();
        exactFilters.forEach((field, value) -> filter.add(term(field, value)));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", Map.of("bool", Map.of("filter", filter)));
        body.put("size", 1);
        body.put("_source", Map.of("excludes", EXCLUDED_SOURCE));
        return body;
    }

    public Map<String, Object> buildQuery(PaperQuery query) {
        List<Object> must = new ArrayList<>();
        List<Object> filter = new ArrayList<>();
        if (query.hasText()) {
            must.add(textClause(query.searchType(), query.text()));
        }
        if (!query.includeOlderVersions()) {
            filter.add(term("is_current", true));
        }
        List<String> categories = canonicalCategories(query.primaryCategories());
        if (!categories.isEmpty()) {
            filter.add(categoryClause(categories));
        }
        if (must.isEmpty() && filter.isEmpty()) {
            return Map.of("match_all", Map.of());
        }
        Map<String, Object> bool = new LinkedHashMap<>();
        if (!must.isEmpty()) {
            bool.put("must", must);
        }
        if (!filter.isEmpty()) {
            bool.put("filter", filter);
        }
        return Map.of("bool", bool);
    }

    /**
     * Sort clauses, always tie-broken on {@code paper_id_v} in the primary direction so that sort values identify
     * a position in the result list.
     */
    public List<Map<String, Object>> buildSort(PaperQuery query) {
        SortOrder order = effectiveOrder(query);
        List<Map<String, Object>> sort = new ArrayList<>();
        sort.add(Map.of(order.getField(), Map.of("order", order.getDirection())));
        sort.add(Map.of(TIE_BREAKER, Map.of("order", order.getDirection())));
        return sort;
    }

    public SortOrder effectiveOrder(PaperQuery query) {
        if (query.order() != null) {
            return query.order();
        }
        return query.hasText() ? SortOrder.RELEVANCE : SortOrder.SUBMITTED_DATE_FIRST_DESC;
    }

    private List<String> canonicalCategories(List<String> requested) {
        Set<String> categories = new LinkedHashSet<>();
        for (String raw : requested) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String canonical = taxonomy.canonicalCategoryId(raw);
            if (!taxonomy.isKnownCategory(canonical)) {
                throw new QueryException("unknown primary_category: " + raw.trim());
            }
            categories.add(canonical);
        }
        return new ArrayList<>(categories);
    }

    private Map<String, Object> categoryClause(List<String> categories) {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("path", SECONDARY);
        nested.put("query", Map.of("terms", Map.of(SECONDARY_CATEGORY, categories)));
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", List.of(Map.of("terms", Map.of(PRIMARY_CATEGORY, categories)), Map.of("nested", nested)));
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }

    private Map<String, Object> textClause(SearchType searchType, String text) {
        return switch (searchType) {
            case ALL -> allClause(text);
            case TITLE -> fieldSetClause(parse(text), TITLE_FIELDS);
            case ABSTRACT -> fieldSetClause(parse(text), ABSTRACT_FIELDS);
            case AUTHOR -> authorClause(text);
        };
    }

    private Map<String, Object> allClause(String text) {
        Optional<QueryText.DatePartial> partial = QueryText.datePartial(text);
        String remainder = partial.map(QueryText.DatePartial::remainder).orElse(text);
        List<Object> should = new ArrayList<>();
        if (!remainder.isBlank()) {
            QueryText parsed = parse(remainder);
            should.add(fieldSetClause(parsed, ALL_FIELDS));
            if (!parsed.hasWildcards()) {
                should.add(nestedAuthor(fullNameClause(parsed), AUTHOR_INNER_HITS, 3.0));
            }
        }
        partial.ifPresent(date -> should.add(term("announced_date_first", date.month())));
        return shouldAny(should);
    }

    /**
     * Every {@code ;}-separated author term has to match some author of the paper.
     */
    private Map<String, Object> authorClause(String text) {
        List<String> terms = QueryText.authorTerms(text);
        if (terms.isEmpty()) {
            throw new QueryException("author query is empty");
        }
        List<Map<String, Object>> must = new ArrayList<>();
        for (int i = 0; i < terms.size(); i++) {
            must.add(nestedAuthor(authorTermClause(parse(terms.get(i))), AUTHOR_INNER_HITS + "_" + i, null));
        }
        return must.size() == 1 ? must.get(0) : Map.of("bool", Map.of("must", must));
    }

    private Map<String, Object> authorTermClause(QueryText term) {
        String text = term.stripped();
        int comma = text.indexOf(',');
        if (comma > 0) {
            String last = text.substring(0, comma).trim();
            String first = text.substring(comma + 1).trim();
            List<Object> must = new ArrayList<>();
            if (term.isLiteral()) {
                must.add(term(authorsPath + ".last_name.exact", last));
                if (!first.isEmpty()) {
                    must.add(Map.of("prefix", Map.of(authorsPath + ".first_name.exact", first)));
                }
            } else {
                must.add(match(authorsPath + ".last_name", last, "and"));
                if (!first.isEmpty()) {
                    must.add(Map.of("match_phrase_prefix", Map.of(authorsPath + ".first_name", first)));
                }
            }
            return Map.of("bool", Map.of("must", must));
        }
        if (term.hasWildcards()) {
            List<Object> must = new ArrayList<>();
            for (String wildcard : term.wildcards()) {
                must.add(shouldAny(List.of(
                    wildcard(authorsPath + ".full_name", wildcard),
                    wildcard(authorsPath + ".last_name", wildcard)
                )));
            }
            if (!term.words().isEmpty()) {
                must.add(match(authorsPath + ".full_name", term.plainText(), "and"));
            }
            return Map.of("bool", Map.of("must", must));
        }
        return fullNameClause(term);
    }

    /**
     * Quoted input compares the untouched names; anything else goes through the folded analyzer.
     */
    private Map<String, Object> fullNameClause(QueryText text) {
        if (text.isLiteral()) {
            return shouldAny(List.of(
                term(authorsPath + ".full_name.exact", text.stripped()),
                term(authorsPath + ".full_name_initialized.exact", text.stripped())
            ));
        }
        return shouldAny(List.of(
            match(authorsPath + ".full_name", text.stripped(), "and"),
            match(authorsPath + ".full_name_initialized", text.stripped(), "and")
        ));
    }

    private Map<String, Object> nestedAuthor(Map<String, Object> inner, String innerHitsName, Double boost) {
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("path", authorsPath);
        nested.put("query", inner);
        nested.put("score_mode", "max");
        nested.put("inner_hits", Map.of("name", innerHitsName, "size", INNER_HITS_SIZE));
        if (boost != null) {
            nested.put("boost", boost);
        }
        return Map.of("nested", nested);
    }

    private Map<String, Object> fieldSetClause(QueryText text, FieldSet fields) {
        if (text.isEmpty()) {
            throw new QueryException("query has no searchable terms");
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        if (!text.words().isEmpty()) {
            parts.add(multiMatch(text.plainText(), fields.analyzed(), null));
        }
        for (String phrase : text.phrases()) {
            parts.add(multiMatch(phrase, fields.analyzed(), "phrase"));
        }
        for (String wildcard : text.wildcards()) {
            List<Object> alternatives = new ArrayList<>();
            for (String field : fields.wildcard()) {
                alternatives.add(wildcard(field, wildcard));
            }
            parts.add(shouldAny(alternatives));
        }
        Map<String, Object> core = parts.size() == 1 ? parts.get(0) : Map.of("bool", Map.of("must", parts));
        if (fields.exact() == null || text.hasWildcards()) {
            return core;
        }
        return shouldAny(List.of(
            boostedTerm(fields.exact(), text.stripped(), 10.0),
            boostedTerm(fields.folded(), text.stripped(), 8.0),
            core
        ));
    }

    private static QueryText parse(String text) {
        return QueryText.parse(text);
    }

    private static Map<String, Object> multiMatch(String text, List<String> fields, String type) {
        Map<String, Object> multiMatch = new LinkedHashMap<>();
        multiMatch.put("query", text);
        multiMatch.put("fields", fields);
        if (type != null) {
            multiMatch.put("type", type);
        }
        return Map.of("multi_match", multiMatch);
    }

    private static Map<String, Object> match(String field, String text, String operator) {
        Map<String, Object> match = new LinkedHashMap<>();
        match.put("query", text);
        match.put("operator", operator);
        return Map.of("match", Map.of(field, match));
    }

    private static Map<String, Object> wildcard(String field, String value) {
        return Map.of("wildcard", Map.of(field, Map.of("value", value)));
    }

    private static Map<String, Object> term(String field, Object value) {
        return Map.of("term", Map.of(field, value));
    }

    private static Map<String, Object> boostedTerm(String field, String value, double boost) {
        Map<String, Object> term = new LinkedHashMap<>();
        term.put("value", value);
        term.put("boost", boost);
        return Map.of("term", Map.of(field, term));
    }

    private static Map<String, Object> shouldAny(List<?> clauses) {
        Map<String, Object> bool = new LinkedHashMap<>();
        bool.put("should", clauses);
        bool.put("minimum_should_match", 1);
        return Map.of("bool", bool);
    }

    /**
     * Fields one search type reaches. {@code exact} and {@code folded} are keyword fields compared against the
     * whole query; {@code analyzed} carry multi_match boosts.
     */
    private record FieldSet(String exact, String folded, List<String> analyzed, List<String> wildcard) {
        List<String> paths() {
            List<String> paths = new ArrayList<>();
            if (exact != null) {
                paths.add(exact);
            }
            if (folded != null) {
                paths.add(folded);
            }
            for (String field : analyzed) {
                int caret = field.indexOf('^');
                paths.add(caret < 0 ? field : field.substring(0, caret));
            }
            paths.addAll(wildcard);
            return paths;
        }
    }
}
