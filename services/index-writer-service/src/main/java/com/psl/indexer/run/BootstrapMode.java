package com.psl.indexer.run;

public enum BootstrapMode {
    AUTO,
    INCREMENTAL,
    REBUILD;

    public static BootstrapMode from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        return switch (value.trim().toLowerCase()) {
            case "incremental" -> INCREMENTAL;
            case "rebuild" -> REBUILD;
            case "auto" -> AUTO;
            default -> throw new IllegalArgumentException("unknown indexer mode: " + value);
        };
    }
}
