package com.psl.indexer.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.indexer.config.IndexerProperties;
import com.psl.indexer.config.OpenSearchProperties;
import com.psl.indexer.opensearch.OpenSearchGateway;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.mapping.IndexMappingBuilder;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prepares the index a run writes into. Incremental runs write through the alias; a rebuild goes to a new
 * versioned index that replaces the alias target only after a run that was not cancelled.
 */
@Component
public class IndexBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(IndexBootstrapper.class);
    private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final OpenSearchGateway gateway;
    private final SchemaRegistry registry;
    private final OpenSearchProperties openSearchProperties;
    private final IndexerProperties indexerProperties;
    private final Clock clock;

    public IndexBootstrapper(
        OpenSearchGateway gateway,
        SchemaRegistry registry,
        OpenSearchProperties openSearchProperties,
        IndexerProperties indexerProperties,
        Clock clock
    ) {
        this.gateway = gateway;
        this.registry = registry;
        this.openSearchProperties = openSearchProperties;
        this.indexerProperties = indexerProperties;
        this.clock = clock;
    }

    public IndexTarget prepare() {
        String alias = openSearchProperties.getIndex();
        BootstrapMode mode = BootstrapMode.from(indexerProperties.getMode());
        List<String> current = gateway.aliasTargets(alias);

        if (mode == BootstrapMode.AUTO) {
            mode = current.isEmpty() || schemaMatches(alias) ? BootstrapMode.INCREMENTAL : BootstrapMode.REBUILD;
            log.info("bootstrap_mode_resolved alias={} mode={} schema_version={}", alias, mode, registry.getVersion());
        }

        if (mode == BootstrapMode.REBUILD) {
            String index = alias + "-v" + registry.getVersion() + "-" + SUFFIX.format(clock.instant());
            gateway.createIndex(index, new IndexMappingBuilder(registry).buildCreateIndexBody());
            log.info("index_created index={} alias={} rebuild=true", index, alias);
            return new IndexTarget(index, alias, true, current);
        }

        if (current.isEmpty()) {
            String index = alias + "-v" + registry.getVersion();
            if (!gateway.indexExists(index)) {
                gateway.createIndex(index, new IndexMappingBuilder(registry).buildCreateIndexBody());
                log.info("index_created index={} alias={} rebuild=false", index, alias);
            }
            gateway.swapAlias(alias, index, List.of());
        }
        return new IndexTarget(alias, alias, false, current);
    }

    /**
     * Moves the alias onto a rebuilt index. Cancelled rebuilds leave the alias where it was.
     */
    public void complete(IndexTarget target, RunSummary summary) {
        if (!target.rebuild()) {
            return;
        }
        if (summary.isCancelled()) {
            log.warn("alias_swap_skipped alias={} index={} reason=cancelled", target.alias(), target.writeIndex());
            return;
        }
        gateway.swapAlias(target.alias(), target.writeIndex(), target.previousIndices());
        log.info(
            "alias_swapped alias={} index={} previous={}",
            target.alias(),
            target.writeIndex(),
            target.previousIndices()
        );
    }

    private boolean schemaMatches(String alias) {
        Map<String, JsonNode> meta = gateway.mappingMeta(alias);
        if (meta.isEmpty()) {
            return false;
        }
        for (JsonNode entry : meta.values()) {
            if (entry.path(IndexMappingBuilder.SCHEMA_VERSION_META).asInt(-1) != registry.getVersion()) {
                return false;
            }
        }
        return true;
    }
}
