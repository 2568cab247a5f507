package com.psl.indexer.run;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of one indexing run. Counters are updated concurrently by workers.
 */
public class RunSummary {
    private final AtomicInteger total = new AtomicInteger();
    private final AtomicInteger indexed = new AtomicInteger();
    private final AtomicInteger retried = new AtomicInteger();
    private final AtomicInteger flagged = new AtomicInteger();
    private final AtomicInteger cancelledCount = new AtomicInteger();
    private final AtomicInteger documentsWritten = new AtomicInteger();
    private final AtomicInteger documentsUnchanged = new AtomicInteger();
    private final List<DeadLetterEntry> deadLetters = Collections.synchronizedList(new ArrayList<>());
    private volatile boolean cancelled;
    private volatile String cancelReason;
    private volatile String index;

    void addTotal(int count) {
        total.addAndGet(count);
    }

    void recordIndexed() {
        indexed.incrementAndGet();
    }

    void recordRetried() {
        retried.incrementAndGet();
    }

    void recordFlagged(int count) {
        flagged.addAndGet(count);
    }

    void recordCancelled() {
        cancelledCount.incrementAndGet();
    }

    void recordDocument(boolean unchanged) {
        documentsWritten.incrementAndGet();
        if (unchanged) {
            documentsUnchanged.incrementAndGet();
        }
    }

    void recordDeadLetter(DeadLetterEntry entry) {
        deadLetters.add(entry);
    }

    void markCancelled(String reason) {
        this.cancelled = true;
        this.cancelReason = reason;
    }

    void setIndex(String index) {
        this.index = index;
    }

    @JsonProperty("total")
    public int getTotal() {
        return total.get();
    }

    @JsonProperty("indexed")
    public int getIndexed() {
        return indexed.get();
    }

    @JsonProperty("dead_lettered")
    public int getDeadLettered() {
        return deadLetters.size();
    }

    @JsonProperty("retried")
    public int getRetried() {
        return retried.get();
    }

    @JsonProperty("flagged")
    public int getFlagged() {
        return flagged.get();
    }

    @JsonProperty("cancelled")
    public int getCancelledCount() {
        return cancelledCount.get();
    }

    @JsonProperty("documents_written")
    public int getDocumentsWritten() {
        return documentsWritten.get();
    }

    @JsonProperty("documents_unchanged")
    public int getDocumentsUnchanged() {
        return documentsUnchanged.get();
    }

    @JsonProperty("run_cancelled")
    public boolean isCancelled() {
        return cancelled;
    }

    @JsonProperty("cancel_reason")
    public String getCancelReason() {
        return cancelReason;
    }

    @JsonProperty("index")
    public String getIndex() {
        return index;
    }

    @JsonProperty("dead_letters")
    public List<DeadLetterEntry> getDeadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }
}
