package com.psl.schema.identifier;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Paper identifier, optionally pinned to one version. Accepts the current scheme ({@code 1234.5678},
 * {@code 1234.56789v2}) and the archive-prefixed scheme ({@code hep-th/9901001}, {@code math.AG/0101001v3}).
 */
public final class PaperIdentifier {
    private static final Pattern NEW_STYLE = Pattern.compile("^(\\d{4}\\.\\d{4,5})(?:v(\\d+))?$");
    private static final Pattern OLD_STYLE = Pattern.compile("^([a-z][a-z-]*(?:\\.[A-Z]{2})?/\\d{7})(?:v(\\d+))?$");

    private final String paperId;
    private final Integer version;

    private PaperIdentifier(String paperId, Integer version) {
        this.paperId = paperId;
        this.version = version;
    }

    public static PaperIdentifier parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("paper identifier is blank");
        }
        String value = raw.trim();
        Matcher matcher = NEW_STYLE.matcher(value);
        if (!matcher.matches()) {
            matcher = OLD_STYLE.matcher(value);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("malformed paper identifier: " + raw);
            }
        }
        Integer version = null;
        if (matcher.group(2) != null) {
            try {
                version = Integer.parseInt(matcher.group(2));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("malformed paper identifier: " + raw, ex);
            }
            if (version < 1) {
                throw new IllegalArgumentException("paper version must be positive: " + raw);
            }
        }
        return new PaperIdentifier(matcher.group(1), version);
    }

    public String paperId() {
        return paperId;
    }

    public Optional<Integer> version() {
        return Optional.ofNullable(version);
    }

    public boolean isVersioned() {
        return version != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PaperIdentifier other)) {
            return false;
        }
        return paperId.equals(other.paperId) && Objects.equals(version, other.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(paperId, version);
    }

    @Override
    public String toString() {
        return version == null ? paperId : paperId + "v" + version;
    }
}
