package com.psl.search.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.SchemaRegistryLoader;
import com.psl.search.pagination.PagePlan;
import java.util.List;
import org.junit.jupiter.api.Test;

class QueryBuilderTest {

    private static final SchemaRegistry REGISTRY = new SchemaRegistryLoader()
        .load("classpath:schema/paper-fields.yml", "classpath:schema/taxonomy.yml");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QueryBuilder builder = new QueryBuilder(REGISTRY);

    @Test
    void emptyRequestReturnsCurrentVersionsNewestFirst() {
        PaperQuery query = new PaperQuery(null, SearchType.ALL, List.of(), null, false);

        JsonNode body = objectMapper.valueToTree(builder.buildSearchBody(query, PagePlan.offset(0, 50)));

        assertThat(body.path("query").path("bool").path("filter").get(0).path("term").path("is_current").asBoolean())
            .isTrue();
        assertThat(body.path("query").path("bool").has("must")).isFalse();
        assertThat(body.path("sort").get(0).path("submitted_date_first").path("order").asText()).isEqualTo("desc");
        assertThat(body.path("sort").get(1).path("paper_id_v").path("order").asText()).isEqualTo("desc");
        assertThat(body.path("from").asInt()).isZero();
        assertThat(body.path("size").asInt()).isEqualTo(50);
        assertThat(body.path("track_total_hits").asBoolean()).isTrue();
    }

    @Test
    void olderVersionsWithoutFiltersMatchEverything() {
        PaperQuery query = new PaperQuery(null, SearchType.ALL, List.of(), null, true);

        JsonNode clause = objectMapper.valueToTree(builder.buildQuery(query));

        assertThat(clause.has("match_all")).isTrue();
    }

    @Test
    void categoryFilterMatchesPrimaryOrNestedSecondary() {
        PaperQuery query = new PaperQuery(null, SearchType.ALL, List.of("cmp-lg", "cs.LG", "cs.CL"), null, false);

        JsonNode filter = objectMapper.valueToTree(builder.buildQuery(query)).path("bool").path("filter");
        JsonNode categories = filter.get(1).path("bool");

        assertThat(categories.path("minimum_should_match").asInt()).isEqualTo(1);
        assertThat(categories.path("should").get(0).path("terms").path("primary_classification.category.id"))
            .extracting(JsonNode::asText)
            .containsExactly("cs.CL", "cs.LG");
        JsonNode nested = categories.path("should").get(1).path("nested");
        assertThat(nested.path("path").asText()).isEqualTo("secondary_classification");
        assertThat(nested.path("query").path("terms").path("secondary_classification.category.id"))
            .extracting(JsonNode::asText)
            .containsExactly("cs.CL", "cs.LG");
    }

    @Test
    void unknownCategoryIsAQueryError() {
        PaperQuery query = new PaperQuery(null, SearchType.ALL, List.of("cs.XX"), null, false);

        assertThatThrownBy(() -> builder.buildQuery(query))
            .isInstanceOf(QueryException.class)
            .hasMessageContaining("cs.XX");
    }

    @Test
    void freeTextPrefersExactTitleThenFoldedTitleThenAnalyzedFields() {
        PaperQuery query = new PaperQuery("Attention Is All You Need", SearchType.ALL, List.of(), null, false);

        JsonNode must = objectMapper.valueToTree(builder.buildQuery(query)).path("bool").path("must").get(0);
        JsonNode should = must.path("bool").path("should");
        JsonNode ranked = should.get(0).path("bool").path("should");

        assertThat(ranked.get(0).path("term").path("title.exact").path("value").asText())
            .isEqualTo("Attention Is All You Need");
        assertThat(ranked.get(0).path("term").path("title.exact").path("boost").asDouble()).isEqualTo(10.0);
        assertThat(ranked.get(1).path("term").path("title.folded").path("boost").asDouble()).isEqualTo(8.0);
        assertThat(ranked.get(2).path("multi_match").path("fields"))
            .extracting(JsonNode::asText)
            .containsExactly("title^5", "combined^2", "combined.folded^2", "fulltext");

        JsonNode authors = should.get(1).path("nested");
        assertThat(authors.path("path").asText()).isEqualTo("authors");
        assertThat(authors.path("inner_hits").path("name").asText()).isEqualTo(QueryBuilder.AUTHOR_INNER_HITS);
    }

    @Test
    void freeTextDefaultsToRelevanceOrder() {
        PaperQuery query = new PaperQuery("entanglement", SearchType.ALL, List.of(), null, false);

        JsonNode sort = objectMapper.valueToTree(builder.buildSort(query));

        assertThat(sort.get(0).path("_score").path("order").asText()).isEqualTo("desc");
        assertThat(builder.effectiveOrder(query)).isEqualTo(SortOrder.RELEVANCE);
    }

    @Test
    void explicitOrderIsTieBrokenInTheSameDirection() {
        PaperQuery query = new PaperQuery("entanglement", SearchType.ALL, List.of(), SortOrder.ANNOUNCED_DATE_FIRST, false);

        JsonNode sort = objectMapper.valueToTree(builder.buildSort(query));

        assertThat(sort.get(0).path("announced_date_first").path("order").asText()).isEqualTo("asc");
        assertThat(sort.get(1).path("paper_id_v").path("order").asText()).isEqualTo("asc");
    }

    @Test
    void yearMonthTokenAddsAnnouncementClause() {
        PaperQuery query = new PaperQuery("graphene 0704", SearchType.ALL, List.of(), null, false);

        JsonNode should = objectMapper.valueToTree(builder.buildQuery(query))
            .path("bool").path("must").get(0).path("bool").path("should");

        assertThat(should).hasSize(3);
        assertThat(should.get(2).path("term").path("announced_date_first").asText()).isEqualTo("2007-04");
        assertThat(should.get(0).toString()).doesNotContain("0704");
    }

    @Test
    void wildcardsSwitchToFoldedWildcardQueries() {
        PaperQuery query = new PaperQuery("Neur* networks", SearchType.TITLE, List.of(), null, false);

        JsonNode must = objectMapper.valueToTree(builder.buildQuery(query)).path("bool").path("must").get(0);
        JsonNode parts = must.path("bool").path("must");

        assertThat(parts.get(0).path("multi_match").path("query").asText()).isEqualTo("networks");
        JsonNode alternatives = parts.get(1).path("bool").path("should");
        assertThat(alternatives.get(0).path("wildcard").path("title").path("value").asText()).isEqualTo("neur*");
        assertThat(alternatives.get(1).path("wildcard").path("title.folded").path("value").asText()).isEqualTo("neur*");
        assertThat(must.toString()).doesNotContain("title.exact");
    }

    @Test
    void leadingWildcardIsRejected() {
        PaperQuery query = new PaperQuery("?uantum", SearchType.ALL, List.of(), null, false);

        assertThatThrownBy(() -> builder.buildQuery(query)).isInstanceOf(QueryException.class);
    }

    @Test
    void literalAbstractSearchUsesPhraseMatching() {
        PaperQuery query = new PaperQuery("\"dark matter*\"", SearchType.ABSTRACT, List.of(), null, false);

        JsonNode multiMatch = objectMapper.valueToTree(builder.buildQuery(query))
            .path("bool").path("must").get(0).path("multi_match");

        assertThat(multiMatch.path("type").asText()).isEqualTo("phrase");
        assertThat(multiMatch.path("query").asText()).isEqualTo("dark matter*");
        assertThat(multiMatch.path("fields")).extracting(JsonNode::asText).containsExactly("abstract^2", "abstract.folded");
    }

    @Test
    void everyAuthorTermMustMatchItsOwnNestedAuthor() {
        PaperQuery query = new PaperQuery("einstein_a; \"Niels Bohr\"", SearchType.AUTHOR, List.of(), null, false);

        JsonNode terms = objectMapper.valueToTree(builder.buildQuery(query))
            .path("bool").path("must").get(0).path("bool").path("must");

        assertThat(terms).hasSize(2);
        JsonNode first = terms.get(0).path("nested");
        assertThat(first.path("inner_hits").path("name").asText()).isEqualTo("authors_0");
        JsonNode surname = first.path("query").path("bool").path("must");
        assertThat(surname.get(0).path("match").path("authors.last_name").path("query").asText()).isEqualTo("einstein");
        assertThat(surname.get(1).path("match_phrase_prefix").path("authors.first_name").asText()).isEqualTo("a");

        JsonNode second = terms.get(1).path("nested");
        assertThat(second.path("inner_hits").path("name").asText()).isEqualTo("authors_1");
        assertThat(second.path("query").path("bool").path("should").get(0)
            .path("term").path("authors.full_name.exact").asText()).isEqualTo("Niels Bohr");
    }

    @Test
    void cursorPagesUseSearchAfterInsteadOfFrom() {
        PaperQuery query = new PaperQuery(null, SearchType.ALL, List.of(), null, false);

        JsonNode body = objectMapper.valueToTree(
            builder.buildSearchBody(query, PagePlan.cursor(25, List.of("2020-01-01T00:00:00Z", "1234.5678v2")))
        );

        assertThat(body.has("from")).isFalse();
        assertThat(body.path("search_after")).extracting(JsonNode::asText)
            .containsExactly("2020-01-01T00:00:00Z", "1234.5678v2");
        assertThat(body.path("_source").path("excludes")).extracting(JsonNode::asText)
            .contains("combined", "authors_combined");
    }
}
