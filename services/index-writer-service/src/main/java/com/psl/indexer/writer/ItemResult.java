package com.psl.indexer.writer;

/**
 * Engine verdict for one document of a bulk call. {@code unchanged} is set when the engine kept the stored copy
 * because its content hash already matched.
 */
public record ItemResult(String paperIdV, ItemOutcome outcome, String reason, boolean unchanged) {
    public static ItemResult written(String paperIdV, boolean unchanged) {
        return new ItemResult(paperIdV, ItemOutcome.WRITTEN, null, unchanged);
    }

    public static ItemResult rejected(String paperIdV, String reason) {
        return new ItemResult(paperIdV, ItemOutcome.REJECTED, reason, false);
    }

    public static ItemResult retryable(String paperIdV, String reason) {
        return new ItemResult(paperIdV, ItemOutcome.RETRYABLE, reason, false);
    }
}
