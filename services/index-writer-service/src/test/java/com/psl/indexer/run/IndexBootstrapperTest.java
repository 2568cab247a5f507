package com.psl.indexer.run;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.config.IndexerProperties;
import com.psl.indexer.config.OpenSearchProperties;
import com.psl.indexer.opensearch.OpenSearchGateway;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.SchemaRegistryLoader;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IndexBootstrapperTest {

    private static final SchemaRegistry REGISTRY = new SchemaRegistryLoader()
        .load("classpath:schema/paper-fields.yml", "classpath:schema/taxonomy.yml");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-06T07:08:09Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OpenSearchGateway gateway;
    private IndexerProperties indexerProperties;

    @BeforeEach
    void setUp() {
        gateway = mock(OpenSearchGateway.class);
        indexerProperties = new IndexerProperties();
    }

    @Test
    void firstRunCreatesVersionedIndexBehindAlias() {
        when(gateway.aliasTargets("papers")).thenReturn(List.of());
        when(gateway.indexExists("papers-v3")).thenReturn(false);

        IndexTarget target = bootstrapper().prepare();

        assertThat(target.writeIndex()).isEqualTo("papers");
        assertThat(target.rebuild()).isFalse();
        verify(gateway).createIndex(eq("papers-v3"), anyMap());
        verify(gateway).swapAlias("papers", "papers-v3", List.of());
    }

    @Test
    void matchingSchemaWritesIncrementallyThroughAlias() {
        when(gateway.aliasTargets("papers")).thenReturn(List.of("papers-v3"));
        when(gateway.mappingMeta("papers")).thenReturn(Map.of("papers-v3", meta(3)));

        IndexTarget target = bootstrapper().prepare();

        assertThat(target.writeIndex()).isEqualTo("papers");
        assertThat(target.rebuild()).isFalse();
        verify(gateway, never()).createIndex(anyString(), anyMap());
        verify(gateway, never()).swapAlias(anyString(), anyString(), anyList());
    }

    @Test
    void schemaChangeTriggersRebuildIntoTimestampedIndex() {
        when(gateway.aliasTargets("papers")).thenReturn(List.of("papers-v2"));
        when(gateway.mappingMeta("papers")).thenReturn(Map.of("papers-v2", meta(2)));

        IndexTarget target = bootstrapper().prepare();

        assertThat(target.rebuild()).isTrue();
        assertThat(target.writeIndex()).isEqualTo("papers-v3-20240506070809");
        assertThat(target.previousIndices()).containsExactly("papers-v2");
        verify(gateway).createIndex(eq("papers-v3-20240506070809"), anyMap());
    }

    @Test
    void completedRebuildMovesAlias() {
        IndexTarget target = new IndexTarget("papers-v3-20240506070809", "papers", true, List.of("papers-v2"));

        bootstrapper().complete(target, new RunSummary());

        verify(gateway).swapAlias("papers", "papers-v3-20240506070809", List.of("papers-v2"));
    }

    @Test
    void cancelledRebuildLeavesAliasAlone() {
        IndexTarget target = new IndexTarget("papers-v3-20240506070809", "papers", true, List.of("papers-v2"));
        RunSummary summary = new RunSummary();
        summary.markCancelled("operator");

        bootstrapper().complete(target, summary);

        verify(gateway, never()).swapAlias(any(), any(), any());
    }

    @Test
    void explicitRebuildIgnoresMatchingSchema() {
        indexerProperties.setMode("rebuild");
        when(gateway.aliasTargets("papers")).thenReturn(List.of("papers-v3"));

        IndexTarget target = bootstrapper().prepare();

        assertThat(target.rebuild()).isTrue();
        verify(gateway, never()).mappingMeta(anyString());
    }

    private IndexBootstrapper bootstrapper() {
        return new IndexBootstrapper(gateway, REGISTRY, new OpenSearchProperties(), indexerProperties, CLOCK);
    }

    private JsonNode meta(int version) {
        return objectMapper.createObjectNode().put("schema_version", version);
    }
}
