package com.psl.indexer.run;

import com.psl.indexer.config.IndexerProperties;
import com.psl.indexer.metadata.MetadataFetchException;
import com.psl.indexer.metadata.MetadataFetcher;
import com.psl.indexer.metadata.PaperNotFoundException;
import com.psl.indexer.metadata.PaperVersions;
import com.psl.indexer.normalize.DocumentNormalizer;
import com.psl.indexer.normalize.NormalizedDocument;
import com.psl.indexer.normalize.TransformException;
import com.psl.indexer.writer.BatchResult;
import com.psl.indexer.writer.IndexWriter;
import com.psl.indexer.writer.ItemResult;
import com.psl.schema.document.PaperDocument;
import com.psl.schema.identifier.PaperIdentifier;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Drives identifiers through fetch, transform and index. Identifiers are processed in fixed-size batches: within a
 * batch each identifier is fetched and normalized by its own worker, then the batch's documents are written with one
 * bulk call, retrying only the transient failures. Identifier-scoped failures end in the run summary's dead-letter
 * list and never abort the run.
 */
@Component
public class IndexingOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(IndexingOrchestrator.class);

    private final MetadataFetcher fetcher;
    private final DocumentNormalizer normalizer;
    private final IndexWriter writer;
    private final ExecutorService executor;
    private final IndexerProperties properties;
    private final RetryPolicy retryPolicy;

    public IndexingOrchestrator(
        MetadataFetcher fetcher,
        DocumentNormalizer normalizer,
        IndexWriter writer,
        @Qualifier("indexerExecutor") ExecutorService executor,
        IndexerProperties properties
    ) {
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.writer = writer;
        this.executor = executor;
        this.properties = properties;
        this.retryPolicy = RetryPolicy.from(properties);
    }

    public RunSummary run(List<String> identifiers, String index, RunCancellation cancellation) {
        RunSummary summary = new RunSummary();
        summary.setIndex(index);
        summary.addTotal(identifiers.size());
        int batchSize = Math.max(1, properties.getBatchSize());
        log.info(
            "indexing_run_started identifiers={} batch_size={} concurrency={} index={}",
            identifiers.size(),
            batchSize,
            properties.getConcurrency(),
            index
        );

        for (int start = 0; start < identifiers.size(); start += batchSize) {
            List<String> batch = identifiers.subList(start, Math.min(identifiers.size(), start + batchSize));
            if (cancellation.isCancelled()) {
                for (String identifier : identifiers.subList(start, identifiers.size())) {
                    finish(summary, new Outcome(identifier, IdentifierState.CANCELLED, null, cancellation.reason(), 0), false);
                }
                break;
            }
            processBatch(batch, index, cancellation, summary);
        }

        if (cancellation.isCancelled()) {
            summary.markCancelled(cancellation.reason());
        }
        log.info(
            "indexing_run_finished total={} indexed={} dead_lettered={} retried={} flagged={} cancelled={}",
            summary.getTotal(),
            summary.getIndexed(),
            summary.getDeadLettered(),
            summary.getRetried(),
            summary.getFlagged(),
            summary.getCancelledCount()
        );
        return summary;
    }

    private void processBatch(List<String> batch, String index, RunCancellation cancellation, RunSummary summary) {
        List<Future<Prepared>> futures = new ArrayList<>();
        for (String identifier : batch) {
            futures.add(executor.submit(() -> prepare(identifier, cancellation)));
        }

        List<Prepared> prepared = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            prepared.add(await(batch.get(i), futures.get(i), cancellation));
        }

        List<Prepared> batched = new ArrayList<>();
        for (Prepared item : prepared) {
            int flagged = 0;
            for (NormalizedDocument document : item.documents()) {
                if (document.isFlagged()) {
                    flagged++;
                }
            }
            summary.recordFlagged(flagged);
            if (item.outcome() == null) {
                batched.add(item);
            } else {
                finish(summary, item.outcome(), item.retried());
            }
        }
        if (!batched.isEmpty()) {
            write(batched, index, cancellation, summary);
        }
        log.info("batch_completed identifiers={} batched={}", batch.size(), batched.size());
    }

    private Prepared prepare(String raw, RunCancellation cancellation) {
        PaperIdentifier identifier;
        try {
            identifier = PaperIdentifier.parse(raw);
        } catch (IllegalArgumentException e) {
            return Prepared.failed(raw, IdentifierState.FETCH_FAILED, e, 0, false);
        }

        PaperVersions versions = null;
        boolean retried = false;
        int attempt = 0;
        while (versions == null) {
            if (cancellation.isCancelled()) {
                return Prepared.cancelled(raw, cancellation.reason(), attempt, retried);
            }
            attempt++;
            log.debug("identifier_transition identifier={} state={} attempt={}", raw, IdentifierState.FETCHING, attempt);
            try {
                versions = fetcher.fetch(identifier);
            } catch (PaperNotFoundException e) {
                return Prepared.failed(raw, IdentifierState.FETCH_FAILED, e, attempt, retried);
            } catch (MetadataFetchException e) {
                if (!e.isRetryable() || !retryPolicy.canRetry(attempt)) {
                    return Prepared.failed(raw, IdentifierState.FETCH_FAILED, e, attempt, retried);
                }
                retried = true;
                long backoffMs = retryPolicy.backoffMs(attempt);
                log.warn(
                    "fetch_retry identifier={} attempt={}/{} backoff_ms={} error={}",
                    raw,
                    attempt,
                    retryPolicy.getMaxAttempts(),
                    backoffMs,
                    e.getMessage()
                );
                if (!cancellation.sleep(backoffMs)) {
                    return Prepared.cancelled(raw, cancellation.reason(), attempt, retried);
                }
            } catch (RuntimeException e) {
                return Prepared.failed(raw, IdentifierState.FETCH_FAILED, e, attempt, retried);
            }
        }

        log.debug("identifier_transition identifier={} state={}", raw, IdentifierState.TRANSFORMING);
        try {
            List<NormalizedDocument> documents = normalizer.normalizeAll(versions, identifier.version().orElse(null));
            log.debug("identifier_transition identifier={} state={} documents={}", raw, IdentifierState.BATCHED, documents.size());
            return new Prepared(raw, documents, null, attempt, retried);
        } catch (TransformException e) {
            return Prepared.failed(raw, IdentifierState.TRANSFORM_FAILED, e, attempt, retried)
                .withReason(e.getField() + " " + e.getReason() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            return Prepared.failed(raw, IdentifierState.TRANSFORM_FAILED, e, attempt, retried);
        }
    }

    private Prepared await(String identifier, Future<Prepared> future, RunCancellation cancellation) {
        long timeoutMs = properties.getOperationTimeoutMs();
        try {
            return timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            return Prepared.failed(identifier, IdentifierState.FETCH_FAILED, e, 1, false)
                .withReason("operation timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return Prepared.failed(identifier, IdentifierState.FETCH_FAILED, cause, 1, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted");
            future.cancel(true);
            return Prepared.cancelled(identifier, cancellation.reason(), 0, false);
        }
    }

    private void write(List<Prepared> batched, String index, RunCancellation cancellation, RunSummary summary) {
        Map<String, Prepared> ownerByDocId = new LinkedHashMap<>();
        List<PaperDocument> pending = new ArrayList<>();
        for (Prepared item : batched) {
            for (NormalizedDocument document : item.documents()) {
                ownerByDocId.put(document.document().getPaperIdV(), item);
                pending.add(document.document());
            }
        }

        Map<String, ItemResult> failures = new LinkedHashMap<>();
        Set<String> abandoned = new HashSet<>();
        Set<String> retriedIdentifiers = new HashSet<>();
        int attempt = 1;
        while (!pending.isEmpty()) {
            BatchResult result = writer.upsert(index, pending);
            List<PaperDocument> retry = new ArrayList<>();
            for (PaperDocument document : pending) {
                ItemResult item = result.get(document.getPaperIdV());
                switch (item.outcome()) {
                    case WRITTEN -> {
                        summary.recordDocument(item.unchanged());
                        Metrics.counter("indexer.documents.total", "outcome", item.unchanged() ? "unchanged" : "written")
                            .increment();
                    }
                    case REJECTED -> {
                        failures.put(document.getPaperIdV(), item);
                        Metrics.counter("indexer.documents.total", "outcome", "rejected").increment();
                    }
                    case RETRYABLE -> retry.add(document);
                }
            }
            if (retry.isEmpty()) {
                break;
            }
            if (!retryPolicy.canRetry(attempt) || cancellation.isCancelled()) {
                boolean cancelled = cancellation.isCancelled();
                for (PaperDocument document : retry) {
                    failures.put(document.getPaperIdV(), result.get(document.getPaperIdV()));
                    if (cancelled) {
                        abandoned.add(document.getPaperIdV());
                    }
                    Metrics.counter("indexer.documents.total", "outcome", "failed").increment();
                }
                break;
            }
            for (PaperDocument document : retry) {
                retriedIdentifiers.add(ownerByDocId.get(document.getPaperIdV()).identifier());
            }
            long backoffMs = retryPolicy.backoffMs(attempt);
            log.warn(
                "index_retry docs={} attempt={}/{} backoff_ms={} first_reason={}",
                retry.size(),
                attempt,
                retryPolicy.getMaxAttempts(),
                backoffMs,
                result.get(retry.get(0).getPaperIdV()).reason()
            );
            if (!cancellation.sleep(backoffMs)) {
                for (PaperDocument document : retry) {
                    failures.put(document.getPaperIdV(), result.get(document.getPaperIdV()));
                    abandoned.add(document.getPaperIdV());
                }
                break;
            }
            attempt++;
            pending = retry;
        }

        for (Prepared item : batched) {
            boolean retried = item.retried() || retriedIdentifiers.contains(item.identifier());
            ItemResult failure = null;
            boolean cancelled = false;
            for (NormalizedDocument document : item.documents()) {
                String id = document.document().getPaperIdV();
                if (failures.containsKey(id)) {
                    if (abandoned.contains(id)) {
                        cancelled = true;
                    } else if (failure == null) {
                        failure = failures.get(id);
                    }
                }
            }
            if (failure != null) {
                finish(summary, new Outcome(
                    item.identifier(),
                    IdentifierState.INDEX_FAILED,
                    failure.outcome().name(),
                    failure.paperIdV() + " " + failure.reason(),
                    attempt
                ), retried);
            } else if (cancelled) {
                finish(summary, new Outcome(item.identifier(), IdentifierState.CANCELLED, null, cancellation.reason(), attempt), retried);
            } else {
                finish(summary, new Outcome(item.identifier(), IdentifierState.INDEXED, null, null, attempt), retried);
            }
        }
    }

    private void finish(RunSummary summary, Outcome outcome, boolean retried) {
        if (retried) {
            summary.recordRetried();
        }
        Metrics.counter("indexer.identifiers.total", "outcome", outcome.state().name().toLowerCase()).increment();
        switch (outcome.state()) {
            case INDEXED -> {
                summary.recordIndexed();
                log.debug("identifier_transition identifier={} state={}", outcome.identifier(), IdentifierState.INDEXED);
            }
            case CANCELLED -> summary.recordCancelled();
            default -> {
                DeadLetterEntry entry = new DeadLetterEntry(
                    outcome.identifier(),
                    outcome.state(),
                    outcome.errorClass(),
                    outcome.reason(),
                    outcome.attempts()
                );
                summary.recordDeadLetter(entry);
                log.warn(
                    "dead_letter identifier={} state={} error_class={} attempts={} reason=\"{}\"",
                    entry.identifier(),
                    entry.state(),
                    entry.errorClass(),
                    entry.attempts(),
                    entry.reason()
                );
            }
        }
    }

    private record Outcome(String identifier, IdentifierState state, String errorClass, String reason, int attempts) {
    }

    /**
     * Result of the fetch and transform stages for one identifier: documents ready to write, or a terminal outcome.
     */
    private record Prepared(
        String identifier,
        List<NormalizedDocument> documents,
        Outcome outcome,
        int attempts,
        boolean retried
    ) {
        static Prepared failed(String identifier, IdentifierState state, Throwable error, int attempts, boolean retried) {
            Outcome outcome = new Outcome(identifier, state, error.getClass().getSimpleName(), error.getMessage(), attempts);
            return new Prepared(identifier, List.of(), outcome, attempts, retried);
        }

        static Prepared cancelled(String identifier, String reason, int attempts, boolean retried) {
            Outcome outcome = new Outcome(identifier, IdentifierState.CANCELLED, null, reason, attempts);
            return new Prepared(identifier, List.of(), outcome, attempts, retried);
        }

        Prepared withReason(String reason) {
            Outcome updated = new Outcome(identifier, outcome.state(), outcome.errorClass(), reason, attempts);
            return new Prepared(identifier, documents, updated, attempts, retried);
        }
    }
}
